/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml.backend.ortools;

import com.vmware.oml.Result;
import com.vmware.oml.ResultStatus;
import com.vmware.oml.SolverException;
import com.vmware.oml.backend.Problem;
import com.vmware.oml.compiler.ModelCompiler;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class OrToolsBackendTest {
    private static final OrToolsBackend BACKEND;

    static {
        // Loads the native libraries
        BACKEND = new OrToolsBackend.Builder().setMaxTimeInSeconds(30).build();
    }

    private final ModelCompiler compiler = new ModelCompiler.Builder().setBackend(BACKEND).build();

    @Test
    public void testLinearProgram() {
        final Result result = compiler.compile("var x>=0\nvar y>=0\nmin: x+y\nsubject to:\n c1: x+y>=10\n").solve();
        assertEquals(ResultStatus.OPTIMAL, result.status());
        assertEquals("Optimal", result.status().toString());
        assertEquals(10.0, result.objective().orElseThrow(), 1e-6);
        assertEquals(10.0, result.value("x").orElseThrow() + result.value("y").orElseThrow(), 1e-6);
        assertEquals("glop", result.solver());
    }

    @Test
    public void testMaximize() {
        final Result result = compiler.compile("var x <= 4\nvar y <= 3\nmax: 2 * x + y\n" +
                                               "subject to:\n  c: x + y <= 5\n").solve();
        assertTrue(result.isOptimal());
        assertEquals(9.0, result.objective().orElseThrow(), 1e-6);
        assertEquals(4.0, result.value("x").orElseThrow(), 1e-6);
    }

    @Test
    public void testInfeasible() {
        final Result result = compiler.compile("var x <= 5\nmin: x\nsubject to:\n  c: x >= 10\n").solve();
        assertTrue(result.isInfeasible());
        assertTrue(result.variables().isEmpty());
        assertTrue(result.objective().isEmpty());
    }

    @Test
    public void testUnbounded() {
        final Result result = compiler.compile("var x free\nvar y\nmin: x + y\nsubject to:\n  c: x - y <= 3\n")
                                      .solve();
        // presolve may only prove the problem to be infeasible or unbounded
        assertTrue(result.isUnbounded() || result.isInfeasible(), result.toString());
    }

    @Test
    public void testMixedInteger() {
        final Result result = compiler.compile("var x : int <= 10\n" +
                                               "var y : int <= 10\n" +
                                               "max: 3 * x + 2 * y\n" +
                                               "subject to:\n" +
                                               "  c: x + y <= 4.5\n" +
                                               "  d: x <= 3\n").solve();
        assertTrue(result.isOptimal(), result.toString());
        assertEquals(11.0, result.objective().orElseThrow(), 1e-6);
        assertEquals(3.0, result.value("x").orElseThrow(), 1e-6);
        assertEquals(1.0, result.value("y").orElseThrow(), 1e-6);
    }

    @Test
    public void testBinaryKnapsack() {
        final String model = "set I\n" +
                             "param value[I]\n" +
                             "param weight[I]\n" +
                             "param capacity\n" +
                             "var take[I] : bin\n" +
                             "max: sum(value[i] * take[i] for i in I)\n" +
                             "subject to:\n" +
                             "  cap: sum(weight[i] * take[i] for i in I) <= capacity\n";
        final Result result = compiler.compile(model, Map.of("I", List.of("a", "b", "c"),
                                                             "value", Map.of("a", 10, "b", 7, "c", 5),
                                                             "weight", Map.of("a", 4, "b", 5, "c", 3),
                                                             "capacity", 7)).solve();
        assertTrue(result.isOptimal(), result.toString());
        assertEquals(15.0, result.objective().orElseThrow(), 1e-6);
        assertEquals(0.0, result.value("take", "b").orElseThrow(), 1e-6);
        assertEquals(List.of("take[a]", "take[c]"), List.copyOf(result.nonZeroVariables().keySet()));
    }

    @Test
    public void testChooseSolver() {
        final Problem lp = compiler.compile("var x\nmin: x\n").buildProblem();
        final Problem mip = compiler.compile("var x : int\nmin: x\n").buildProblem();
        assertEquals("glop", BACKEND.chooseSolver(lp));
        assertTrue(List.of("scip", "cbc", "sat").contains(BACKEND.chooseSolver(mip)));

        final OrToolsBackend forced = new OrToolsBackend.Builder().setSolverName("scip").build();
        assertEquals("scip", forced.chooseSolver(lp));

        final OrToolsBackend missing = new OrToolsBackend.Builder().setSolverName("no-such-solver").build();
        assertThrows(SolverException.class, () -> missing.chooseSolver(lp));
        final Result result = compiler.compile("var x\nmin: x\n").solve(missing);
        assertEquals(ResultStatus.SOLVER_ERROR, result.status());
        assertEquals("OrToolsBackend", result.solver());
    }

    @Test
    public void testLpExport() {
        final Problem problem = compiler.compile("var x>=0\nvar y>=0\nmin: x+y\nsubject to:\n c1: x+y>=10\n")
                                        .buildProblem();
        final String lp = BACKEND.toLpString(problem);
        assertTrue(lp.contains("c1"), lp);
        assertTrue(lp.contains("x"), lp);
    }
}
