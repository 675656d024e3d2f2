/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml.backend;

import com.google.common.collect.ImmutableList;
import com.vmware.oml.ast.VarDomain;

import java.util.List;
import java.util.stream.Collectors;

/**
 * One solver column: a member of a variable family, identified by its index values. Instances are
 * only created by {@link Problem}, and compared by identity.
 */
public final class DecisionVariable {
    private final int id;
    private final String family;
    private final ImmutableList<Object> index;
    private final VarDomain domain;
    private final double lowerBound;
    private final double upperBound;

    DecisionVariable(final int id, final String family, final List<Object> index, final VarDomain domain,
                     final double lowerBound, final double upperBound) {
        this.id = id;
        this.family = family;
        this.index = ImmutableList.copyOf(index);
        this.domain = domain;
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
    }

    /**
     * Position of this variable in its problem.
     */
    public int id() {
        return id;
    }

    public String family() {
        return family;
    }

    public ImmutableList<Object> index() {
        return index;
    }

    public VarDomain domain() {
        return domain;
    }

    public double lowerBound() {
        return lowerBound;
    }

    public double upperBound() {
        return upperBound;
    }

    /**
     * {@code x} for scalar variables, {@code x[A,1]} for indexed ones.
     */
    public String label() {
        if (index.isEmpty()) {
            return family;
        }
        return family + index.stream().map(String::valueOf).collect(Collectors.joining(",", "[", "]"));
    }

    @Override
    public String toString() {
        return label();
    }
}
