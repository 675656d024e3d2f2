/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml.backend;

import com.vmware.oml.TranslationException;
import com.vmware.oml.ast.Sense;
import com.vmware.oml.ast.VarDomain;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ProblemTest {

    @Test
    public void testVariableFamilies() {
        final Problem problem = new Problem("p", Sense.MINIMIZE);
        final VarFamily x = problem.addVariables("x", List.of(List.of("A", "B"), List.of(1, 2)),
                                                 VarDomain.CONTINUOUS, 0, 5);
        final DecisionVariable y = problem.addVariable("y", VarDomain.CONTINUOUS, 0, Double.POSITIVE_INFINITY);

        assertEquals(List.of("x[A,1]", "x[A,2]", "x[B,1]", "x[B,2]", "y"),
                     problem.variables().stream().map(DecisionVariable::label).collect(Collectors.toList()));
        assertEquals(4, y.id());
        assertEquals(List.of("A", 2L), x.get("A", 2).index());
        assertEquals(2, problem.families().size());
        assertFalse(problem.isMixedInteger());

        problem.addVariable("z", VarDomain.BINARY, 0, 1);
        assertTrue(problem.isMixedInteger());
        assertThrows(IllegalArgumentException.class, () -> problem.addVariable("y", VarDomain.INTEGER, 0, 1));
    }

    @Test
    public void testEmptyIndexSet() {
        final Problem problem = new Problem("p", Sense.MINIMIZE);
        final VarFamily x = problem.addVariables("x", List.of(List.of("A"), List.of()), VarDomain.CONTINUOUS, 0, 1);
        assertTrue(x.members().isEmpty());
        assertThrows(TranslationException.class, () -> x.get("A"));
    }

    @Test
    public void testRowBounds() {
        final Problem problem = new Problem("p", Sense.MINIMIZE);
        final DecisionVariable x = problem.addVariable("x", VarDomain.CONTINUOUS, 0, 10);
        problem.addConstraint("le", Relation.of(Affine.from(x).plus(Affine.constant(2)), 5L,
                                                Relation.Kind.LESS_OR_EQUAL));
        problem.addConstraint("ge", Relation.of(x, 1L, Relation.Kind.GREATER_OR_EQUAL));
        problem.addConstraint(null, Relation.of(x, 4L, Relation.Kind.EQUAL));

        final List<LinearRow> rows = problem.rows();
        assertEquals(3, rows.size());
        assertEquals(Double.NEGATIVE_INFINITY, rows.get(0).lower());
        assertEquals(3.0, rows.get(0).upper());
        assertEquals(Map.of(x, 1.0), rows.get(0).expression().terms());
        assertEquals(0.0, rows.get(0).expression().constant());
        assertEquals(1.0, rows.get(1).lower());
        assertEquals(Double.POSITIVE_INFINITY, rows.get(1).upper());
        assertEquals(4.0, rows.get(2).lower());
        assertEquals(4.0, rows.get(2).upper());
        assertFalse(rows.get(2).name().isPresent());
    }

    @Test
    public void testConstantConstraints() {
        final Problem problem = new Problem("p", Sense.MINIMIZE);
        problem.addConstraint("holds", true);
        problem.addConstraint("holdsToo", Relation.of(1L, 2L, Relation.Kind.LESS_OR_EQUAL));
        assertTrue(problem.rows().isEmpty());

        problem.addConstraint("never", false);
        assertEquals(1, problem.rows().size());
        final LinearRow row = problem.rows().get(0);
        assertEquals("never", row.name().orElseThrow());
        assertTrue(row.expression().isConstant());
        assertEquals(1.0, row.lower());

        assertThrows(TranslationException.class, () -> problem.addConstraint("notAComparison", 3L));
    }

    @Test
    public void testRepeatedLabels() {
        final Problem problem = new Problem("p", Sense.MINIMIZE);
        final DecisionVariable x = problem.addVariable("x", VarDomain.CONTINUOUS, 0, 10);
        problem.addConstraint("c", Relation.of(x, 1L, Relation.Kind.GREATER_OR_EQUAL));
        problem.addConstraint("c", Relation.of(x, 5L, Relation.Kind.LESS_OR_EQUAL));
        problem.addConstraint("c", Relation.of(x, 3L, Relation.Kind.LESS_OR_EQUAL));
        assertEquals(List.of("c", "c_2", "c_3"),
                     problem.rows().stream().map(r -> r.name().orElseThrow()).collect(Collectors.toList()));
    }

    @Test
    public void testObjective() {
        final Problem problem = new Problem("p", Sense.MAXIMIZE);
        assertFalse(problem.hasObjective());
        final DecisionVariable x = problem.addVariable("x", VarDomain.CONTINUOUS, 0, 10);
        problem.setObjective(x);
        problem.setObjective(7L);
        assertTrue(problem.hasObjective());
        assertTrue(problem.objective().isConstant());
        assertEquals(7.0, problem.objective().constant());
        assertEquals(Sense.MAXIMIZE, problem.sense());
    }
}
