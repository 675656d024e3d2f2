/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml.ast;

import java.util.List;

/**
 * Multiplies the body over every combination of loop values. Only linear when the body is data.
 */
public final class Prod extends Expr {
    private final Expr body;
    private final List<LoopClause> loops;

    public Prod(final Expr body, final List<LoopClause> loops) {
        this.body = body;
        this.loops = List.copyOf(loops);
    }

    public Expr getBody() {
        return body;
    }

    public List<LoopClause> getLoops() {
        return loops;
    }

    @Override
    public String toString() {
        return "Prod{" +
                "body=" + body +
                ", loops=" + loops +
                '}';
    }

    @Override
    <T, C> T acceptVisitor(final AstVisitor<T, C> visitor, final C context) {
        return visitor.visitProd(this, context);
    }
}
