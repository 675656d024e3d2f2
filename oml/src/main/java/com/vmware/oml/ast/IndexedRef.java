/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml.ast;

import java.util.List;

/**
 * {@code name[i, j, ...]}: an element of an indexed variable family or parameter.
 */
public final class IndexedRef extends Expr {
    private final String name;
    private final List<Expr> indices;

    public IndexedRef(final String name, final List<Expr> indices) {
        this.name = name;
        this.indices = List.copyOf(indices);
    }

    public String getName() {
        return name;
    }

    public List<Expr> getIndices() {
        return indices;
    }

    @Override
    public String toString() {
        return "IndexedRef{" +
                "name='" + name + '\'' +
                ", indices=" + indices +
                '}';
    }

    @Override
    <T, C> T acceptVisitor(final AstVisitor<T, C> visitor, final C context) {
        return visitor.visitIndexedRef(this, context);
    }
}
