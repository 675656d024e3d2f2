/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml.compiler;

import com.vmware.oml.ValidationException;
import com.vmware.oml.ast.Model;
import com.vmware.oml.parser.OmlParsers;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ModelValidatorTest {

    @Test
    public void testValidModel() {
        final List<String> warnings = validate("set P = {1, 2}\n" +
                                               "var x[P] : int <= 4\n" +
                                               "min: sum(x[p] for p in P where p > 1)\n" +
                                               "subject to:\n" +
                                               "  c[p]: x[p] >= if(p == 1, 2, 3) for p in P\n");
        assertTrue(warnings.isEmpty());
    }

    @Test
    public void testObjectiveWithoutVariables() {
        final ValidationException exception = assertThrows(ValidationException.class,
                () -> validate("param c = 3\nvar x\nmin: c\n"));
        assertEquals(List.of("Objective does not refer to any decision variable"), exception.problems());
    }

    @Test
    public void testLoopVariableShadowingIsNotAVariableUse() {
        final ValidationException exception = assertThrows(ValidationException.class,
                () -> validate("set P = {1, 2}\nvar x\nmin: sum(x for x in P)\n"));
        assertEquals(List.of("Objective does not refer to any decision variable"), exception.problems());
    }

    @Test
    public void testComparisonOutsideConstraint() {
        final ValidationException exception = assertThrows(ValidationException.class,
                () -> validate("var x\nmin: x + (x <= 3)\n"));
        assertEquals(List.of("Comparison '<=' is only allowed in a constraint or a condition"),
                     exception.problems());
    }

    @Test
    public void testNestedComparisonInConstraint() {
        final ValidationException exception = assertThrows(ValidationException.class,
                () -> validate("var x\nmin: x\nsubject to:\n  c: x >= (x == 1)\n"));
        assertEquals(List.of("Comparison '==' is only allowed in a constraint or a condition"),
                     exception.problems());
    }

    @Test
    public void testUndeclaredIndexSet() {
        final ValidationException exception = assertThrows(ValidationException.class,
                () -> validate("var x[Q]\nmin: x[1]\n"));
        assertEquals(List.of("Variable 'x' is indexed by 'Q', which is not a declared set"), exception.problems());
    }

    @Test
    public void testIndexArity() {
        final ValidationException exception = assertThrows(ValidationException.class,
                () -> validate("set P = {1}\nvar x[P]\nmin: x\n"));
        assertEquals(List.of("Variable 'x' is indexed by 1 set(s) but used with 0 index(es)"),
                     exception.problems());
    }

    @Test
    public void testEmptyDomain() {
        final ValidationException exception = assertThrows(ValidationException.class,
                () -> validate("var x >= 5 <= 1\nmin: x\n"));
        assertEquals(List.of("Variable 'x' has an empty domain [5.0, 1.0]"), exception.problems());
    }

    @Test
    public void testDuplicateDeclaration() {
        final ValidationException exception = assertThrows(ValidationException.class,
                () -> validate("set A = {1}\nparam A\nvar x\nmin: x\n"));
        assertEquals(List.of("'A' is declared more than once (set, then param)"), exception.problems());
    }

    @Test
    public void testConstraintMustBeComparison() {
        final ValidationException exception = assertThrows(ValidationException.class,
                () -> validate("var x\nmin: x\nsubject to:\n  c: x + 1\n"));
        assertEquals(List.of("Constraint c is not a comparison"), exception.problems());
    }

    @Test
    public void testAllProblemsAreReported() {
        final ValidationException exception = assertThrows(ValidationException.class,
                () -> validate("var x[Q] >= 2 <= 1\nparam c\nmin: c\n"));
        assertEquals(3, exception.problems().size());
    }

    @Test
    public void testWarnings() {
        assertEquals(List.of("Model has no objective, solving for feasibility only"),
                     validate("var x\nsubject to:\n  x >= 1\n"));
        assertEquals(List.of("Model has 2 objectives, only the first one is used"),
                     validate("var x\nmin: x\nmax: x\n"));
    }

    private static List<String> validate(final String source) {
        final Model model = AstTransformer.transform(OmlParsers.parse(source)).model();
        return ModelValidator.validate(model);
    }
}
