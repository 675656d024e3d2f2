/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml.compiler;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.vmware.oml.CompiledModel;
import com.vmware.oml.ModelException;

import java.util.Map;

/**
 * Outcome of a {@link BatchCompiler} run: the models that compiled, the errors of those that did not,
 * and the sources that were skipped after an error.
 */
public final class BatchReport {
    private final ImmutableMap<String, CompiledModel> compiled;
    private final ImmutableMap<String, ModelException> failed;
    private final ImmutableList<String> skipped;

    BatchReport(final Map<String, CompiledModel> compiled, final Map<String, ModelException> failed,
                final Iterable<String> skipped) {
        this.compiled = ImmutableMap.copyOf(compiled);
        this.failed = ImmutableMap.copyOf(failed);
        this.skipped = ImmutableList.copyOf(skipped);
    }

    public ImmutableMap<String, CompiledModel> compiled() {
        return compiled;
    }

    public ImmutableMap<String, ModelException> failed() {
        return failed;
    }

    public ImmutableList<String> skipped() {
        return skipped;
    }

    public int total() {
        return compiled.size() + failed.size() + skipped.size();
    }

    public boolean isSuccessful() {
        return failed.isEmpty() && skipped.isEmpty();
    }

    /**
     * One line per failed source, {@code name: message}.
     */
    public ImmutableList<String> errors() {
        return failed.entrySet().stream()
                .map(e -> e.getKey() + ": " + e.getValue().getMessage())
                .collect(ImmutableList.toImmutableList());
    }

    @Override
    public String toString() {
        return "BatchReport{" +
                "compiled=" + compiled.keySet() +
                ", failed=" + failed.keySet() +
                ", skipped=" + skipped +
                '}';
    }
}
