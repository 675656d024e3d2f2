/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml.ast;

import javax.annotation.Nullable;
import java.util.Optional;

/**
 * {@code start..end [step s]}, inclusive on both ends. Bounds are number literals or references to
 * scalar parameters.
 */
public final class RangeSet extends SetExpr {
    private final Expr start;
    private final Expr end;
    @Nullable private final Expr step;

    public RangeSet(final Expr start, final Expr end, @Nullable final Expr step) {
        this.start = start;
        this.end = end;
        this.step = step;
    }

    public Expr getStart() {
        return start;
    }

    public Expr getEnd() {
        return end;
    }

    public Optional<Expr> getStep() {
        return Optional.ofNullable(step);
    }

    @Override
    public String toString() {
        return "RangeSet{" +
                "start=" + start +
                ", end=" + end +
                ", step=" + step +
                '}';
    }

    @Override
    <T, C> T acceptVisitor(final AstVisitor<T, C> visitor, final C context) {
        return visitor.visitRangeSet(this, context);
    }
}
