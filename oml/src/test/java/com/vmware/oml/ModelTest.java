/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml;

import com.vmware.oml.parser.SyntaxError;
import org.junit.jupiter.api.Test;

import java.net.URISyntaxException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * End to end tests going from model source and data to solver results.
 */
public class ModelTest {

    @Test
    public void testProductionPlanning() {
        final String model = "set P\n" +
                "param profit[P]\n" +
                "param hours[P]\n" +
                "param capacity\n" +
                "var make[P] : int >= 0\n" +
                "max: sum(profit[p] * make[p] for p in P)\n" +
                "subject to:\n" +
                "  time: sum(hours[p] * make[p] for p in P) <= capacity\n" +
                "  limit[p]: make[p] <= 10 for p in P\n";
        final Map<String, Object> data = Map.of("P", List.of("chairs", "tables"),
                                                "profit", Map.of("chairs", 3, "tables", 5),
                                                "hours", Map.of("chairs", 1, "tables", 2),
                                                "capacity", 14);
        final Result result = Oml.solve(model, data);
        assertEquals(ResultStatus.OPTIMAL, result.status());
        assertEquals(40.0, result.objective().orElseThrow(), 1e-6);
        assertEquals(10.0, result.value("make", "chairs").orElseThrow(), 1e-6);
        assertEquals(2.0, result.value("make", "tables").orElseThrow(), 1e-6);
        assertEquals(List.of("make[chairs]", "make[tables]"), List.copyOf(result.variables().keySet()));
    }

    @Test
    public void testTransportFromCsvFiles() throws URISyntaxException {
        final Path file = Paths.get(ModelTest.class.getResource("/models/transport.oml").toURI());
        final CompiledModel compiled = Oml.compileFile(file);
        assertEquals("transport", compiled.name());
        assertTrue(compiled.warnings().isEmpty());

        final Result result = compiled.solve();
        assertTrue(result.isOptimal());
        assertEquals(153.675, result.objective().orElseThrow(), 1e-6);
        double shipped = 0;
        for (final double value: result.valuesOf("ship").values()) {
            shipped += value;
        }
        assertEquals(900.0, shipped, 1e-6);
        assertEquals(275.0, result.value("ship", "san_diego", "topeka").orElseThrow(), 1e-6);
    }

    @Test
    public void testPortugueseModel() {
        final Result result = Oml.solve("var x : inteiro >= 0\n" +
                                        "var y : inteiro >= 0\n" +
                                        "minimizar: 3 * x + 2 * y\n" +
                                        "sujeito a:\n" +
                                        "  cobertura: x + y >= 4\n" +
                                        "  minimo: x >= 1\n");
        assertTrue(result.isOptimal());
        assertEquals(9.0, result.objective().orElseThrow(), 1e-6);
        assertEquals(Map.of("x", 1.0, "y", 3.0), result.nonZeroVariables());
    }

    @Test
    public void testSyntaxErrorSurface() {
        final SyntaxException exception = assertThrows(SyntaxException.class,
                () -> Oml.compile("var x\nmin x\n"));
        assertEquals(1, exception.errors().size());
        final SyntaxError error = exception.errors().get(0);
        assertEquals(2, error.line());
    }

    @Test
    public void testValidationErrorSurface() {
        final ValidationException exception = assertThrows(ValidationException.class,
                () -> Oml.compile("param c\nmin: c\n"));
        assertEquals(List.of("Objective does not refer to any decision variable"), exception.problems());
    }

    @Test
    public void testExecutionErrorSurface() {
        final Result result = Oml.solve("var x\nmin: x\nsubject to:\n  c: x <= limit[1]\n");
        assertEquals(ResultStatus.EXECUTION_ERROR, result.status());
        assertTrue(result.isError());
        assertEquals("none", result.solver());
        assertEquals("TranslationException: Unknown symbol limit", result.message().orElseThrow());
    }

    @Test
    public void testInfeasibleModel() {
        final Result result = Oml.solve("var x <= 1\nmax: x\nsubject to:\n  c: x >= 2\n");
        assertEquals(ResultStatus.INFEASIBLE, result.status());
        assertEquals("Infeasible", result.status().toString());
    }
}
