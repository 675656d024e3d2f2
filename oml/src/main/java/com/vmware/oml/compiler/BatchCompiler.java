/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml.compiler;

import com.google.common.io.Files;
import com.vmware.oml.CompiledModel;
import com.vmware.oml.ModelException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Compiles many models, collecting every failure instead of stopping at the first one unless asked
 * to.
 */
public final class BatchCompiler {
    private static final Logger LOG = LoggerFactory.getLogger(BatchCompiler.class);

    private final ModelCompiler compiler;
    private final boolean stopOnError;

    public BatchCompiler(final ModelCompiler compiler, final boolean stopOnError) {
        this.compiler = compiler;
        this.stopOnError = stopOnError;
    }

    public BatchCompiler(final ModelCompiler compiler) {
        this(compiler, false);
    }

    /**
     * @param sources model sources by name, compiled in iteration order
     * @param data inputs shared by every model
     */
    public BatchReport compileAll(final Map<String, String> sources, final Map<String, ?> data) {
        final Map<String, CompiledModel> compiled = new LinkedHashMap<>();
        final Map<String, ModelException> failed = new LinkedHashMap<>();
        final List<String> skipped = new ArrayList<>();
        for (final Map.Entry<String, String> source: sources.entrySet()) {
            if (stopOnError && !failed.isEmpty()) {
                skipped.add(source.getKey());
                continue;
            }
            try {
                compiled.put(source.getKey(), compiler.compile(source.getKey(), source.getValue(), data));
            } catch (final ModelException e) {
                LOG.warn("Could not compile {}: {}", source.getKey(), e.getMessage());
                failed.put(source.getKey(), e);
            }
        }
        return report(compiled, failed, skipped);
    }

    public BatchReport compileFiles(final List<Path> files, final Map<String, ?> data) {
        final Map<String, CompiledModel> compiled = new LinkedHashMap<>();
        final Map<String, ModelException> failed = new LinkedHashMap<>();
        final List<String> skipped = new ArrayList<>();
        for (final Path file: files) {
            final String name = Files.getNameWithoutExtension(file.toString());
            if (stopOnError && !failed.isEmpty()) {
                skipped.add(name);
                continue;
            }
            try {
                compiled.put(name, compiler.compileFile(file, data));
            } catch (final ModelException e) {
                LOG.warn("Could not compile {}: {}", file, e.getMessage());
                failed.put(name, e);
            }
        }
        return report(compiled, failed, skipped);
    }

    private static BatchReport report(final Map<String, CompiledModel> compiled,
                                      final Map<String, ModelException> failed, final List<String> skipped) {
        final BatchReport report = new BatchReport(compiled, failed, skipped);
        LOG.info("Batch finished: {} compiled, {} failed, {} skipped", compiled.size(), failed.size(),
                 skipped.size());
        return report;
    }
}
