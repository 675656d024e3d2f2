/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml;

import com.vmware.oml.compiler.ModelCompiler;

import java.nio.file.Path;
import java.util.Map;

/**
 * Entry points for the common cases. Use {@link ModelCompiler.Builder} to configure binding or the
 * solver.
 */
public final class Oml {

    private Oml() {
    }

    public static CompiledModel compile(final String source) {
        return compile(source, Map.of());
    }

    /**
     * @param data tables, collections, maps or scalars by name
     */
    public static CompiledModel compile(final String source, final Map<String, ?> data) {
        return new ModelCompiler.Builder().build().compile(source, data);
    }

    public static CompiledModel compileFile(final Path file) {
        return compileFile(file, Map.of());
    }

    public static CompiledModel compileFile(final Path file, final Map<String, ?> data) {
        return new ModelCompiler.Builder().build().compileFile(file, data);
    }

    public static Result solve(final String source) {
        return compile(source).solve();
    }

    public static Result solve(final String source, final Map<String, ?> data) {
        return compile(source, data).solve();
    }
}
