/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml.backend;

import com.vmware.oml.TranslationException;
import com.vmware.oml.ast.Sense;
import com.vmware.oml.ast.VarDomain;
import com.vmware.oml.binding.BoundValues;
import com.vmware.oml.binding.DataTable;
import com.vmware.oml.binding.DataTables;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class OpsTests {
    private Ops ops;
    private Problem problem;

    @BeforeEach
    public void setUp() {
        ops = new Ops(BoundValues.empty(), Map.of());
        problem = ops.newProblem("test", Sense.MINIMIZE);
    }

    @Test
    public void testIntegerArithmetic() {
        assertEquals(5L, ops.add(2L, 3L));
        assertEquals(-1L, ops.sub(2L, 3L));
        assertEquals(6L, ops.mul(2L, 3L));
        assertEquals(2.5, ops.add(2L, 0.5));
        assertEquals(1.5, ops.div(3L, 2L));
        assertEquals(2L, ops.mod(-1L, 3L));
        assertEquals(1024L, ops.pow(2L, 10L));
        assertEquals(0.5, ops.pow(2L, -1L));
        assertEquals(-4L, ops.neg(4L));
        assertInstanceOf(Long.class, ops.neg(-7L));
        assertEquals(-2.5, ops.neg(2.5));
    }

    @Test
    public void testOverflowFallsBackToDouble() {
        assertInstanceOf(Double.class, ops.add(Long.MAX_VALUE, 1L));
        assertInstanceOf(Double.class, ops.mul(Long.MAX_VALUE, 2L));
        assertInstanceOf(Double.class, ops.pow(10L, 30L));
        assertEquals(-(double) Long.MIN_VALUE, ops.neg(Long.MIN_VALUE));
    }

    @Test
    public void testLinearArithmetic() {
        final DecisionVariable x = problem.addVariable("x", VarDomain.CONTINUOUS, 0, 10);
        final DecisionVariable y = problem.addVariable("y", VarDomain.CONTINUOUS, 0, 10);
        final Affine e = (Affine) ops.add(ops.mul(3L, x), ops.sub(y, 2L));
        assertEquals(Map.of(x, 3.0, y, 1.0), e.terms());
        assertEquals(-2.0, e.constant());

        final Affine halved = (Affine) ops.div(e, 2L);
        assertEquals(1.5, halved.terms().get(x));
        assertEquals(-1.0, halved.constant());

        final Affine cancelled = (Affine) ops.sub(x, x);
        assertTrue(cancelled.isConstant());
        assertEquals(x, ops.pow(x, 1L));
        assertEquals(Map.of(x, -1.0), ((Affine) ops.neg(x)).terms());
    }

    @Test
    public void testNonLinearOperationsFail() {
        final DecisionVariable x = problem.addVariable("x", VarDomain.CONTINUOUS, 0, 10);
        final DecisionVariable y = problem.addVariable("y", VarDomain.CONTINUOUS, 0, 10);
        final TranslationException product = assertThrows(TranslationException.class, () -> ops.mul(x, y));
        assertTrue(product.getMessage().startsWith("Product of decision variables is not linear"));
        assertThrows(TranslationException.class, () -> ops.div(1L, x));
        assertThrows(TranslationException.class, () -> ops.div(x, 0L));
        assertThrows(TranslationException.class, () -> ops.pow(x, 2L));
        assertThrows(TranslationException.class, () -> ops.call("abs", x));
        assertThrows(TranslationException.class, () -> ops.prod(List.of(1L, 2L), i -> x));
    }

    @Test
    public void testComparisons() {
        assertEquals(true, ops.le(1L, 2L));
        assertEquals(false, ops.gt(1L, 2L));
        assertEquals(true, ops.eq(2L, 2.0));
        assertEquals(true, ops.ne("A", "B"));
        assertEquals(true, ops.lt("A", "B"));
        assertThrows(TranslationException.class, () -> ops.le("A", 1L));

        final DecisionVariable x = problem.addVariable("x", VarDomain.CONTINUOUS, 0, 10);
        final Relation relation = (Relation) ops.ge(x, 3L);
        assertEquals(Relation.Kind.GREATER_OR_EQUAL, relation.kind());
        assertEquals(-3.0, relation.expression().constant());
        assertThrows(TranslationException.class, () -> ops.ne(x, 3L));
    }

    @Test
    public void testStrictComparisonIsRelaxedOnce() {
        final DecisionVariable x = problem.addVariable("x", VarDomain.CONTINUOUS, 0, 10);
        assertEquals(Relation.Kind.LESS_OR_EQUAL, ((Relation) ops.lt(x, 3L)).kind());
        assertEquals(Relation.Kind.GREATER_OR_EQUAL, ((Relation) ops.gt(x, 1L)).kind());
        assertEquals(List.of("Strict comparison '<' between linear expressions is treated as '<='"), ops.warnings());
    }

    @Test
    public void testConditions() {
        assertTrue(ops.and(true, 1L));
        assertFalse(ops.or(false, 0L));
        assertTrue(ops.not(false));
        assertEquals("then", ops.ifThenElse(ops.gt(2L, 1L), () -> "then", () -> "else"));
        final DecisionVariable x = problem.addVariable("x", VarDomain.CONTINUOUS, 0, 10);
        final TranslationException e = assertThrows(TranslationException.class, () -> ops.test(ops.le(x, 1L)));
        assertTrue(e.getMessage().startsWith("Conditions cannot depend on decision variables"));
    }

    @Test
    public void testSets() {
        assertEquals(List.of(1L, 2L, 3L), ops.list(1, 2L, 3.0, 2));
        assertEquals(List.of(1L, 3L, 5L), ops.range(1L, 5L, 2L));
        assertEquals(List.of(1L, 2L, 3L), ops.range(1L, 3L, null));
        assertEquals(List.of(1L, 2L, 3L), ops.union(List.of(1L, 2L), List.of(2L, 3L)));
        assertEquals(List.of(2L), ops.intersect(List.of(1L, 2L), List.of(2L, 3L)));
        assertEquals(List.of(1L), ops.difference(List.of(1L, 2L), List.of(2L, 3L)));
        assertEquals(List.of(2L, 4L), ops.where(List.of(1L, 2L, 3L, 4L), i -> ops.eq(ops.mod(i, 2L), 0L)));
        assertEquals(List.of("a"), ops.elements(Map.of("a", 1L)));
        assertThrows(TranslationException.class, () -> ops.elements(3L));
    }

    @Test
    public void testSumAndProd() {
        assertEquals(10L, ops.sum(List.of(1L, 2L, 3L, 4L), i -> i));
        assertEquals(0L, ops.sum(List.of(), i -> i));
        assertEquals(24L, ops.prod(List.of(1L, 2L, 3L, 4L), i -> i));

        final VarFamily x = problem.addVariables("x", List.of(List.of("A", "B")), VarDomain.CONTINUOUS, 0, 1);
        final Affine total = (Affine) ops.sum(List.of("A", "B"), p -> ops.add(ops.index(x, p), 1L));
        assertEquals(2, total.terms().size());
        assertEquals(2.0, total.constant());
    }

    @Test
    public void testIndex() {
        final Map<Object, Object> cost = Map.of("A", Map.of(1L, 5L));
        assertEquals(5L, ops.index(cost, "A", 1));
        final TranslationException missing = assertThrows(TranslationException.class,
                () -> ops.index(cost, "B", 1L));
        assertEquals("No value for index [B, 1]", missing.getMessage());
        assertThrows(TranslationException.class, () -> ops.index(cost, "A", 1L, 2L));
        assertEquals(7L, ops.index(7L, "anything"));

        final VarFamily x = problem.addVariables("x", List.of(List.of(1, 2)), VarDomain.INTEGER, 0, 1);
        assertEquals("x[2]", ((DecisionVariable) ops.index(x, 2.0)).label());
        assertThrows(TranslationException.class, () -> ops.index(x, 3L));
    }

    @Test
    public void testFunctions() {
        assertEquals(3L, ops.call("abs", -3L));
        assertEquals(2.0, ops.call("sqrt", 4L));
        assertEquals(1L, ops.call("floor", 1.7));
        assertEquals(2L, ops.call("ceil", 1.2));
        assertEquals(2L, ops.call("round", 1.5));
        assertEquals(1L, ops.call("min", 3L, 1L, 2L));
        assertEquals(9L, ops.call("MAX", List.of(4L, 9L), 5L));
        assertEquals(8L, ops.call("pow", 2L, 3L));
        assertThrows(TranslationException.class, () -> ops.call("sqrt", 1L, 2L));
        assertThrows(TranslationException.class, () -> ops.call("system", 1L));
        assertTrue(Ops.isFunction("Log"));
        assertFalse(Ops.isFunction("exec"));
    }

    @Test
    public void testResolutionOrder() {
        final DataTable plants = DataTables.builder("plant", "capacity")
                                           .row("p1", 10)
                                           .row("p2", 20)
                                           .build();
        final Ops withData = new Ops(BoundValues.empty(), Map.of("plants", plants));
        assertEquals(List.of("p1", "p2"), withData.set("plant", List.of("plants"), null));
        assertEquals(List.of("q"), withData.set("other", List.of("plants"), () -> List.of("q")));
        assertEquals(List.of(), withData.set("missing", List.of(), null));
        assertEquals(List.of("Set missing has no data, it is empty"), withData.warnings());

        assertEquals(Map.of("p1", 10L, "p2", 20L),
                     withData.param("capacity", List.of("plants"), List.of("plant"), null));
        assertEquals(10L, withData.param("capacity", List.of("plants"), List.of(), null));
        assertEquals(3L, withData.param("rate", List.of("plants"), List.of(), 3));
        assertEquals(0L, withData.param("rate", List.of("plants"), List.of(), null));

        assertEquals(List.of(10L, 20L), withData.column("plants", "capacity"));
        assertThrows(TranslationException.class, () -> withData.column("plants", "cost"));
        assertThrows(TranslationException.class, () -> withData.column("nothing", "cost"));
    }

    @Test
    public void testLabel() {
        assertEquals("c", ops.label("c"));
        assertEquals("c[A,1]", ops.label("c", "A", 1L));
        assertThrows(TranslationException.class, () -> ops.unsupported("lambda"));
    }
}
