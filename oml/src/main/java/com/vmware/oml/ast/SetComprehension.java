/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml.ast;

/**
 * {@code {p in P where cond}}: the elements of a source that satisfy a condition.
 */
public final class SetComprehension extends SetExpr {
    private final LoopClause clause;

    public SetComprehension(final LoopClause clause) {
        this.clause = clause;
    }

    public LoopClause getClause() {
        return clause;
    }

    @Override
    public String toString() {
        return "SetComprehension{" +
                "clause=" + clause +
                '}';
    }

    @Override
    <T, C> T acceptVisitor(final AstVisitor<T, C> visitor, final C context) {
        return visitor.visitSetComprehension(this, context);
    }
}
