/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml.backend;

import com.google.common.collect.ImmutableMap;
import com.vmware.oml.TranslationException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A linear expression {@code sum(coefficient * variable) + constant}. Immutable; {@link Builder} is
 * used to accumulate long sums.
 */
public final class Affine {
    private static final Affine ZERO = new Affine(ImmutableMap.of(), 0);

    private final ImmutableMap<DecisionVariable, Double> terms;
    private final double constant;

    private Affine(final ImmutableMap<DecisionVariable, Double> terms, final double constant) {
        this.terms = terms;
        this.constant = constant;
    }

    public static Affine zero() {
        return ZERO;
    }

    public static Affine constant(final double value) {
        return new Affine(ImmutableMap.of(), value);
    }

    public static Affine of(final DecisionVariable variable) {
        return new Affine(ImmutableMap.of(variable, 1.0), 0);
    }

    /**
     * Converts a number, variable or affine expression into an affine expression.
     */
    public static Affine from(final Object value) {
        if (value instanceof Affine) {
            return (Affine) value;
        }
        if (value instanceof DecisionVariable) {
            return of((DecisionVariable) value);
        }
        if (value instanceof Number) {
            return constant(((Number) value).doubleValue());
        }
        if (value instanceof Boolean) {
            return constant((Boolean) value ? 1 : 0);
        }
        throw new TranslationException("Expected a numeric or linear expression but found " + describe(value));
    }

    public static boolean isLinear(final Object value) {
        return value instanceof Affine || value instanceof DecisionVariable;
    }

    static String describe(final Object value) {
        return value.getClass().getSimpleName() + " " + value;
    }

    public ImmutableMap<DecisionVariable, Double> terms() {
        return terms;
    }

    public double constant() {
        return constant;
    }

    public boolean isConstant() {
        return terms.isEmpty();
    }

    public Affine plus(final Affine other) {
        return new Builder().add(this, 1).add(other, 1).build();
    }

    public Affine minus(final Affine other) {
        return new Builder().add(this, 1).add(other, -1).build();
    }

    public Affine scale(final double factor) {
        return new Builder().add(this, factor).build();
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder();
        terms.forEach((variable, coefficient) -> {
            if (sb.length() > 0) {
                sb.append(" + ");
            }
            sb.append(coefficient).append('*').append(variable.label());
        });
        if (constant != 0 || sb.length() == 0) {
            if (sb.length() > 0) {
                sb.append(" + ");
            }
            sb.append(constant);
        }
        return sb.toString();
    }

    /**
     * Accumulates terms. Coefficients of the same variable are merged and zero coefficients dropped.
     */
    public static final class Builder {
        private final Map<DecisionVariable, Double> terms = new LinkedHashMap<>();
        private double constant = 0;

        public Builder add(final Affine affine, final double factor) {
            affine.terms.forEach((variable, coefficient) -> terms.merge(variable, coefficient * factor, Double::sum));
            constant += affine.constant * factor;
            return this;
        }

        public Builder add(final Object value) {
            return add(from(value), 1);
        }

        public Affine build() {
            terms.values().removeIf(c -> c == 0.0);
            return new Affine(ImmutableMap.copyOf(terms), constant);
        }
    }
}
