/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml.compiler;

import com.google.common.io.Files;
import com.vmware.oml.CompiledModel;
import com.vmware.oml.ModelException;
import com.vmware.oml.backend.CodeGenerator;
import com.vmware.oml.backend.SolverBackend;
import com.vmware.oml.binding.BindingWarning;
import com.vmware.oml.binding.BoundValues;
import com.vmware.oml.binding.DataBindingService;
import com.vmware.oml.parser.OmlParser;
import com.vmware.oml.parser.OmlParsers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs a model source through parsing, transformation, validation, data binding and code
 * generation. A compiler holds no state between calls, so one instance can be shared.
 */
public final class ModelCompiler {
    private static final Logger LOG = LoggerFactory.getLogger(ModelCompiler.class);
    private static final String DEFAULT_NAME = "model";

    private final boolean configStrictBinding;
    @Nullable private final Path configBaseDirectory;
    @Nullable private final SolverBackend configBackend;

    private ModelCompiler(final boolean configStrictBinding, @Nullable final Path configBaseDirectory,
                          @Nullable final SolverBackend configBackend) {
        this.configStrictBinding = configStrictBinding;
        this.configBaseDirectory = configBaseDirectory;
        this.configBackend = configBackend;
    }

    public CompiledModel compile(final String source) {
        return compile(DEFAULT_NAME, source, Map.of());
    }

    public CompiledModel compile(final String source, final Map<String, ?> data) {
        return compile(DEFAULT_NAME, source, data);
    }

    public CompiledModel compile(final String name, final String source, final Map<String, ?> data) {
        return compile(name, source, data, configBaseDirectory);
    }

    /**
     * Compiles a model file. Imports in the file are resolved relative to its directory.
     */
    public CompiledModel compileFile(final Path file, final Map<String, ?> data) {
        final String source;
        try {
            source = java.nio.file.Files.readString(file, StandardCharsets.UTF_8);
        } catch (final IOException e) {
            throw new ModelException("Could not read model file " + file, e);
        }
        final Path directory = file.toAbsolutePath().getParent();
        return compile(Files.getNameWithoutExtension(file.toString()), source, data, directory);
    }

    private CompiledModel compile(final String name, final String source, final Map<String, ?> data,
                                  @Nullable final Path baseDirectory) {
        final long start = System.nanoTime();
        final OmlParser.ModelContext tree = OmlParsers.parse(source);
        final long parsed = System.nanoTime();
        final TransformResult transformed = AstTransformer.transform(tree);
        final List<String> warnings = new ArrayList<>(transformed.warnings());
        warnings.addAll(ModelValidator.validate(transformed.model()));
        final long validated = System.nanoTime();

        final DataBindingService binding = new DataBindingService(configStrictBinding);
        final Map<String, Object> inputs = binding.assembleInputs(transformed.model(), data, baseDirectory);
        final BoundValues bound = binding.bind(transformed.model(), inputs);
        for (final BindingWarning warning: bound.warnings()) {
            warnings.add(warning.toString());
        }
        final long bindingDone = System.nanoTime();

        final String program = CodeGenerator.generate(transformed.model(), name);
        final long end = System.nanoTime();
        LOG.info("Compiled {}: parse {}us, transform and validate {}us, binding {}us, codegen {}us, "
                 + "{} variable(s), complexity {}", name, (parsed - start) / 1000, (validated - parsed) / 1000,
                 (bindingDone - validated) / 1000, (end - bindingDone) / 1000, transformed.variables().size(),
                 transformed.complexity().level());
        return new CompiledModel(name, source, transformed.model(), program, transformed.variables(),
                                 transformed.datasets(), transformed.complexity(), bound, inputs, warnings,
                                 configBackend);
    }

    public static class Builder {
        private boolean strictBinding = false;
        @Nullable private Path baseDirectory = null;
        @Nullable private SolverBackend backend = null;

        /**
         * Configures whether sets and parameters without data are an error.
         * @param strictBinding fail with a BindingException instead of warning and using 0. Defaults to false.
         * @return the current Builder object with `strictBinding` set
         */
        public Builder setStrictBinding(final boolean strictBinding) {
            this.strictBinding = strictBinding;
            return this;
        }

        /**
         * Directory that relative imports in model sources are resolved against. Model files always
         * use their own directory.
         * @param baseDirectory import directory. Defaults to the working directory.
         * @return the current Builder object with `baseDirectory` set
         */
        public Builder setBaseDirectory(final Path baseDirectory) {
            this.baseDirectory = baseDirectory;
            return this;
        }

        /**
         * Backend used by {@link CompiledModel#solve()}.
         * @param backend solver backend. Defaults to OR-Tools with default settings.
         * @return the current Builder object with `backend` set
         */
        public Builder setBackend(final SolverBackend backend) {
            this.backend = backend;
            return this;
        }

        public ModelCompiler build() {
            return new ModelCompiler(strictBinding, baseDirectory, backend);
        }
    }
}
