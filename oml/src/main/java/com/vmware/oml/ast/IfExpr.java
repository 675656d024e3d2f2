/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml.ast;

public final class IfExpr extends Expr {
    private final Expr condition;
    private final Expr thenExpr;
    private final Expr elseExpr;

    public IfExpr(final Expr condition, final Expr thenExpr, final Expr elseExpr) {
        this.condition = condition;
        this.thenExpr = thenExpr;
        this.elseExpr = elseExpr;
    }

    public Expr getCondition() {
        return condition;
    }

    public Expr getThenExpr() {
        return thenExpr;
    }

    public Expr getElseExpr() {
        return elseExpr;
    }

    @Override
    public String toString() {
        return "IfExpr{" +
                "condition=" + condition +
                ", thenExpr=" + thenExpr +
                ", elseExpr=" + elseExpr +
                '}';
    }

    @Override
    <T, C> T acceptVisitor(final AstVisitor<T, C> visitor, final C context) {
        return visitor.visitIfExpr(this, context);
    }
}
