/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml.ast;

import java.util.List;

/**
 * A decision variable family. Bounds are the effective ones: defaults and bound clauses are
 * already resolved.
 */
public final class VarDecl extends Statement {
    private final String name;
    private final List<String> indices;
    private final VarDomain domain;
    private final double lowerBound;
    private final double upperBound;
    private final boolean implicit;

    public VarDecl(final String name, final List<String> indices, final VarDomain domain,
                   final double lowerBound, final double upperBound, final boolean implicit) {
        this.name = name;
        this.indices = List.copyOf(indices);
        this.domain = domain;
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
        this.implicit = implicit;
    }

    public String getName() {
        return name;
    }

    public List<String> getIndices() {
        return indices;
    }

    public boolean isIndexed() {
        return !indices.isEmpty();
    }

    public VarDomain getDomain() {
        return domain;
    }

    public double getLowerBound() {
        return lowerBound;
    }

    public double getUpperBound() {
        return upperBound;
    }

    /**
     * True if this variable was never declared and was inferred from its use in the objective or a
     * constraint.
     */
    public boolean isImplicit() {
        return implicit;
    }

    @Override
    public String toString() {
        return "VarDecl{" +
                "name='" + name + '\'' +
                ", indices=" + indices +
                ", domain=" + domain +
                ", lowerBound=" + lowerBound +
                ", upperBound=" + upperBound +
                ", implicit=" + implicit +
                '}';
    }

    @Override
    <T, C> T acceptVisitor(final AstVisitor<T, C> visitor, final C context) {
        return visitor.visitVarDecl(this, context);
    }
}
