/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml.ast;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Optional;

/**
 * A (possibly named) constraint. Loop clauses expand it into one row per combination of loop values;
 * the optional name indices are evaluated per row to build its label.
 */
public final class Constraint extends Node {
    @Nullable private final String name;
    private final List<Expr> nameIndices;
    private final Expr expr;
    private final List<LoopClause> loops;

    public Constraint(@Nullable final String name, final List<Expr> nameIndices, final Expr expr,
                      final List<LoopClause> loops) {
        this.name = name;
        this.nameIndices = List.copyOf(nameIndices);
        this.expr = expr;
        this.loops = List.copyOf(loops);
    }

    public Optional<String> getName() {
        return Optional.ofNullable(name);
    }

    public List<Expr> getNameIndices() {
        return nameIndices;
    }

    public Expr getExpr() {
        return expr;
    }

    public List<LoopClause> getLoops() {
        return loops;
    }

    @Override
    public String toString() {
        return "Constraint{" +
                "name='" + name + '\'' +
                ", nameIndices=" + nameIndices +
                ", expr=" + expr +
                ", loops=" + loops +
                '}';
    }

    @Override
    <T, C> T acceptVisitor(final AstVisitor<T, C> visitor, final C context) {
        return visitor.visitConstraint(this, context);
    }
}
