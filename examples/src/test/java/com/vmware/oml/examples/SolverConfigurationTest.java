/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml.examples;

import com.vmware.oml.Result;
import com.vmware.oml.backend.ortools.OrToolsBackend;
import com.vmware.oml.compiler.ModelCompiler;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SolverConfigurationTest {
    @Test
    public void backendInitializationExample() {
        final OrToolsBackend orToolsBackend = new OrToolsBackend.Builder()
                .setNumThreads(1)
                .setPrintDiagnostics(true)
                .setMaxTimeInSeconds(5).build();
        final ModelCompiler compiler = new ModelCompiler.Builder().setBackend(orToolsBackend).build();
        final Result result = compiler.compile("var c1 : int\nmin: c1\nsubject to:\n  c1 == 10\n").solve();
        assertTrue(result.isOptimal());
        assertEquals(10.0, result.value("c1").orElseThrow(), 1e-6);
    }
}
