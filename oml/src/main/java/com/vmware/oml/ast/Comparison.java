/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml.ast;

public final class Comparison extends Expr {
    private final Operator operator;
    private final Expr left;
    private final Expr right;

    public Comparison(final Operator operator, final Expr left, final Expr right) {
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    public Operator getOperator() {
        return operator;
    }

    public Expr getLeft() {
        return left;
    }

    public Expr getRight() {
        return right;
    }

    @Override
    public String toString() {
        return "Comparison{" +
                "operator=" + operator +
                ", left=" + left +
                ", right=" + right +
                '}';
    }

    @Override
    <T, C> T acceptVisitor(final AstVisitor<T, C> visitor, final C context) {
        return visitor.visitComparison(this, context);
    }

    public enum Operator {
        LESS_THAN_OR_EQUAL("<="),
        GREATER_THAN_OR_EQUAL(">="),
        EQUAL("=="),
        NOT_EQUAL("!="),
        LESS_THAN("<"),
        GREATER_THAN(">");

        private final String symbol;

        Operator(final String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        public static Operator fromSymbol(final String symbol) {
            if ("=".equals(symbol)) {
                return EQUAL;
            }
            for (final Operator op: values()) {
                if (op.symbol.equals(symbol)) {
                    return op;
                }
            }
            throw new IllegalArgumentException("Unknown comparison operator " + symbol);
        }
    }
}
