/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml.ast;

import javax.annotation.Nullable;
import java.util.Optional;

/**
 * Binds {@code variable} to each element of {@code source} in turn, skipping elements for which the
 * condition does not hold.
 */
public final class LoopClause extends Node {
    private final String variable;
    private final Expr source;
    @Nullable private final Expr condition;

    public LoopClause(final String variable, final Expr source, @Nullable final Expr condition) {
        this.variable = variable;
        this.source = source;
        this.condition = condition;
    }

    public String getVariable() {
        return variable;
    }

    public Expr getSource() {
        return source;
    }

    public Optional<Expr> getCondition() {
        return Optional.ofNullable(condition);
    }

    @Override
    public String toString() {
        return "LoopClause{" +
                "variable='" + variable + '\'' +
                ", source=" + source +
                ", condition=" + condition +
                '}';
    }

    @Override
    <T, C> T acceptVisitor(final AstVisitor<T, C> visitor, final C context) {
        return visitor.visitLoopClause(this, context);
    }
}
