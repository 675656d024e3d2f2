/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml.ast;

public final class Objective extends Statement {
    private final Sense sense;
    private final Expr expr;

    public Objective(final Sense sense, final Expr expr) {
        this.sense = sense;
        this.expr = expr;
    }

    public Sense getSense() {
        return sense;
    }

    public Expr getExpr() {
        return expr;
    }

    @Override
    public String toString() {
        return "Objective{" +
                "sense=" + sense +
                ", expr=" + expr +
                '}';
    }

    @Override
    <T, C> T acceptVisitor(final AstVisitor<T, C> visitor, final C context) {
        return visitor.visitObjective(this, context);
    }
}
