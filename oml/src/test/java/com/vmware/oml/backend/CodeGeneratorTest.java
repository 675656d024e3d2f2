/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml.backend;

import com.vmware.oml.ast.Model;
import com.vmware.oml.compiler.AstTransformer;
import com.vmware.oml.parser.OmlParsers;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class CodeGeneratorTest {
    private static final String PRODUCTION = "set P = [A, B]\n" +
                                             "set T = 1..3\n" +
                                             "param cost[P] = 10\n" +
                                             "param rate = 2.5\n" +
                                             "var x[P, T] : int <= 100\n" +
                                             "maximize: sum(cost[p] * x[p, t] for p in P, t in T where t > 1)\n" +
                                             "subject to:\n" +
                                             "  cap[t]: sum(x[p, t] for p in P) <= 40 for t in T\n" +
                                             "  x[\"A\", 1] >= rate\n";

    @Test
    public void testDeterministic() {
        final Model model = model(PRODUCTION);
        assertEquals(CodeGenerator.generate(model, "production"), CodeGenerator.generate(model, "production"));
        assertEquals(CodeGenerator.generate(model(PRODUCTION), "production"),
                     CodeGenerator.generate(model(PRODUCTION), "production"));
    }

    @Test
    public void testProgramShape() {
        final String program = CodeGenerator.generate(model(PRODUCTION), "production");
        assertTrue(program.startsWith("package com.vmware.oml.generated;"));
        assertTrue(program.contains("@Generated(\"com.vmware.oml.backend.CodeGenerator\")"));
        assertTrue(program.contains("public final class GeneratedModel"));
        assertTrue(program.contains("public static Problem build(final Ops o)"));
        assertTrue(program.contains("public static SolverOutcome solve(final Ops o, final SolverBackend backend)"));
        assertTrue(program.contains("final Problem problem = o.newProblem(\"production\", Sense.MAXIMIZE);"));
        assertTrue(program.contains("final List<Object> P = o.set(\"P\", List.of(), () -> o.list(\"A\", \"B\"));"));
        assertTrue(program.contains("final List<Object> T = o.set(\"T\", List.of(), () -> o.range(1L, 3L, null));"));
        assertTrue(program.contains("final VarFamily x = problem.addVariables(\"x\", List.of(P, T), "
                                    + "VarDomain.INTEGER, 0.0, 100.0);"));
        assertTrue(program.contains("// Constraint cap"));
        assertTrue(program.contains("for (final Object _t : o.elements(T))"));
        assertTrue(program.contains("problem.addConstraint(o.label(\"cap\", _t), "));
        assertTrue(program.contains("// Constraint (unnamed)"));
        assertTrue(program.contains("problem.addConstraint(null, o.ge(o.index(x, \"A\", 1L), rate));"));
        assertTrue(program.contains("o.where(o.elements(T), _t -> o.gt(_t, 1L))"));
    }

    @Test
    public void testLiterals() {
        final String program = CodeGenerator.generate(model(PRODUCTION), "production");
        assertTrue(program.contains("final Object cost = o.param(\"cost\", List.of(), List.of(\"P\"), 10L);"));
        assertTrue(program.contains("final Object rate = o.param(\"rate\", List.of(), List.of(), 2.5);"));
        assertFalse(program.contains("10.0L"));
        assertFalse(program.contains("1.0L"));
        assertEquals("5L", CodeGenerator.literal(5L).toString());
        assertEquals("-0.25", CodeGenerator.literal(-0.25).toString());
        assertEquals("\"a\\\"b\"", CodeGenerator.literal("a\"b").toString());
    }

    @Test
    public void testDefaultBounds() {
        final String program = CodeGenerator.generate(model("var y free\nvar z\nmin: y + z\n"), "m");
        assertTrue(program.contains("problem.addVariable(\"y\", VarDomain.CONTINUOUS, Double.NEGATIVE_INFINITY, "
                                    + "Double.POSITIVE_INFINITY);"));
        assertTrue(program.contains("problem.addVariable(\"z\", VarDomain.CONTINUOUS, 0.0, Double.POSITIVE_INFINITY);"));
        assertTrue(program.contains("Sense.MINIMIZE"));
    }

    @Test
    public void testStringsCannotEscape() {
        final String program = CodeGenerator.generate(
                model("set P = [\"a\\\"); System.exit(1); //\", \"'); DROP TABLE x; --\"]\n" +
                      "var x[P]\n" +
                      "min: sum(x[p] for p in P)\n"), "m");
        assertTrue(program.contains("o.list(\"a\\\"); System.exit(1); //\", \"'); DROP TABLE x; --\")"));
        assertEquals(program.indexOf("System.exit"), program.lastIndexOf("System.exit"));
    }

    @Test
    public void testNamesAreSanitized() {
        final String program = CodeGenerator.generate(model("var class\nvar problem\nvar o\n" +
                                                            "min: class + problem + o\n"), "m");
        assertTrue(program.contains("final DecisionVariable class_ = problem.addVariable(\"class\""));
        assertTrue(program.contains("final DecisionVariable problem_ = problem.addVariable(\"problem\""));
        assertTrue(program.contains("final DecisionVariable o_ = problem.addVariable(\"o\""));
        assertTrue(program.contains("problem.setObjective(o.add(o.add(class_, problem_), o_));"));
    }

    @Test
    public void testIdentifiers() {
        assertEquals("x", Identifiers.sanitize("x"));
        assertEquals("_1abc", Identifiers.sanitize("1abc"));
        assertEquals("o_", Identifiers.sanitize("ção"));
        assertEquals("unnamed", Identifiers.sanitize("çã"));
        assertEquals("__", Identifiers.sanitize("_"));
        assertEquals("int_", Identifiers.sanitize("int"));
        assertEquals("backend_", Identifiers.sanitize("backend"));
        assertEquals("custo_a", Identifiers.sanitize("custo_ça"));
    }

    @Test
    public void testProdWarning() {
        final String program = CodeGenerator.generate(
                model("set I = {1, 2}\nvar x\nmin: prod(i for i in I) * x\n"), "m");
        assertTrue(program.contains("/* WARNING: prod is not linear, decision variables are rejected */ "
                                    + "o.prod(o.elements(I), _i -> _i)"));
    }

    @Test
    public void testUnsupportedFunction() {
        final String program = CodeGenerator.generate(model("var x\nmin: foo(x)\n"), "m");
        assertTrue(program.contains("/* unsupported function foo */ o.unsupported(\"foo\")"));
    }

    @Test
    public void testImplicitVariablesAndExtraObjectives() {
        final String program = CodeGenerator.generate(model("min: a\nmax: a\n"), "m");
        assertTrue(program.contains("// a is not declared, assumed continuous and non-negative"));
        assertTrue(program.contains("// Additional objective ignored"));
    }

    @Test
    public void testImportsAndColumns() {
        final String program = CodeGenerator.generate(
                model("import \"data/routes.csv\"\nset R\nvar x\nmin: x\n" +
                      "subject to:\n  c[r]: x >= 1 for r in routes.origin\n"), "m");
        assertTrue(program.contains("// import \"data/routes.csv\""));
        assertTrue(program.contains("final List<Object> R = o.set(\"R\", List.of(\"routes\"), null);"));
        assertTrue(program.contains("for (final Object _r : o.column(\"routes\", \"origin\"))"));
    }

    private static Model model(final String source) {
        return AstTransformer.transform(OmlParsers.parse(source)).model();
    }
}
