/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml.backend;

/**
 * A linear comparison, normalized to {@code expression (<=|>=|==) 0}.
 */
public final class Relation {
    private final Affine expression;
    private final Kind kind;

    public Relation(final Affine expression, final Kind kind) {
        this.expression = expression;
        this.kind = kind;
    }

    public static Relation of(final Object left, final Object right, final Kind kind) {
        return new Relation(Affine.from(left).minus(Affine.from(right)), kind);
    }

    public Affine expression() {
        return expression;
    }

    public Kind kind() {
        return kind;
    }

    /**
     * Whether a relation with no variables holds.
     */
    public boolean holdsTrivially() {
        final double c = expression.constant();
        switch (kind) {
            case LESS_OR_EQUAL:
                return c <= 0;
            case GREATER_OR_EQUAL:
                return c >= 0;
            default:
                return c == 0;
        }
    }

    @Override
    public String toString() {
        return expression + " " + kind.symbol + " 0";
    }

    public enum Kind {
        LESS_OR_EQUAL("<="),
        GREATER_OR_EQUAL(">="),
        EQUAL("==");

        private final String symbol;

        Kind(final String symbol) {
            this.symbol = symbol;
        }
    }
}
