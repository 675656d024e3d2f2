/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml.compiler;

import com.vmware.oml.BindingException;
import com.vmware.oml.CompiledModel;
import com.vmware.oml.ModelException;
import com.vmware.oml.SyntaxException;
import com.vmware.oml.ValidationException;
import com.vmware.oml.ast.VarDomain;
import com.vmware.oml.binding.DataTables;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ModelCompilerTest {
    private final ModelCompiler compiler = new ModelCompiler.Builder().build();

    @Test
    public void testCompile() {
        final CompiledModel model = compiler.compile("set S\n" +
                                                     "var x : bin\n" +
                                                     "min: x + slack\n" +
                                                     "subject to:\n" +
                                                     "  c[r]: x >= 0 for r in routes.origin\n");
        assertEquals("model", model.name());
        assertEquals(Set.of(new Variable("x", List.of(), VarDomain.BINARY),
                            new Variable("slack", List.of(), VarDomain.CONTINUOUS)), model.variables());
        assertEquals(Set.of(new DatasetReference("routes", "origin")), model.datasets());
        assertEquals(List.of("Undeclared variable 'slack' assumed continuous with slack >= 0",
                             "S: No data found for set S"), model.warnings());
        assertTrue(model.program().contains("public final class GeneratedModel"));
        assertTrue(model.complexity().totalComplexity() > 0);
    }

    @Test
    public void testErrorsPropagate() {
        assertThrows(SyntaxException.class, () -> compiler.compile("var x >=\n"));
        assertThrows(ValidationException.class, () -> compiler.compile("param c\nmin: c\n"));
        final ModelCompiler strict = new ModelCompiler.Builder().setStrictBinding(true).build();
        assertThrows(BindingException.class, () -> strict.compile("set S\nvar x\nmin: x\n"));
    }

    @Test
    public void testCompileFile(@TempDir final Path directory) throws IOException {
        Files.write(directory.resolve("demand.csv"), "product,demand\nA,10\nB,20\n".getBytes(StandardCharsets.UTF_8));
        final Path file = directory.resolve("plan.oml");
        Files.write(file, ("import \"demand.csv\"\n" +
                           "set product\n" +
                           "param demand[product]\n" +
                           "var x[product]\n" +
                           "min: sum(x[p] for p in product)\n" +
                           "subject to:\n" +
                           "  meet[p]: x[p] >= demand[p] for p in product\n").getBytes(StandardCharsets.UTF_8));
        final CompiledModel model = compiler.compileFile(file, Map.of());
        assertEquals("plan", model.name());
        assertEquals(Map.of("A", 10L, "B", 20L), model.boundValues().get("demand").orElseThrow());
        assertEquals(2, model.buildProblem().rows().size());
    }

    @Test
    public void testBaseDirectory(@TempDir final Path directory) throws IOException {
        Files.write(directory.resolve("limits.csv"), "limit\n4\n".getBytes(StandardCharsets.UTF_8));
        final ModelCompiler withBase = new ModelCompiler.Builder().setBaseDirectory(directory).build();
        final CompiledModel model = withBase.compile("import \"limits.csv\"\nparam limit\nvar x\nmin: x\n");
        assertEquals(4L, model.boundValues().get("limit").orElseThrow());
    }

    @Test
    public void testBlankScalarCell() {
        final CompiledModel model = compiler.compile("param budget\nvar x\nmin: x\n",
                Map.of("settings", DataTables.fromCsv("budget,region\n,eu\n")));
        assertFalse(model.boundValues().contains("budget"));
        assertEquals(List.of("budget: No data found for parameter budget, using 0"), model.warnings());
    }

    @Test
    public void testEmptyIndexSet() {
        final CompiledModel model = compiler.compile("set I\nparam d[I]\nvar x\nmin: x + sum(d[i] for i in I)\n",
                                                     Map.of("I", List.of(), "d", Map.of()));
        assertEquals(1, model.buildProblem().variables().size());
    }

    @Test
    public void testMissingFile(@TempDir final Path directory) {
        final ModelException exception = assertThrows(ModelException.class,
                () -> compiler.compileFile(directory.resolve("missing.oml"), Map.of()));
        assertTrue(exception.getMessage().startsWith("Could not read model file"));
    }
}
