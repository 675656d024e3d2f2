/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml.ast;

public final class SetOperation extends SetExpr {
    private final Operator operator;
    private final SetExpr left;
    private final SetExpr right;

    public SetOperation(final Operator operator, final SetExpr left, final SetExpr right) {
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    public Operator getOperator() {
        return operator;
    }

    public SetExpr getLeft() {
        return left;
    }

    public SetExpr getRight() {
        return right;
    }

    @Override
    public String toString() {
        return "SetOperation{" +
                "operator=" + operator +
                ", left=" + left +
                ", right=" + right +
                '}';
    }

    @Override
    <T, C> T acceptVisitor(final AstVisitor<T, C> visitor, final C context) {
        return visitor.visitSetOperation(this, context);
    }

    public enum Operator {
        UNION,
        INTERSECTION,
        DIFFERENCE
    }
}
