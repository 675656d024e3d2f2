/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml.backend;

import javax.annotation.Nullable;
import java.util.Optional;

/**
 * A solver row {@code lower <= sum(terms) <= upper}. The expression's constant is always zero; it has
 * been moved into the bounds.
 */
public final class LinearRow {
    @Nullable private final String name;
    private final Affine expression;
    private final double lower;
    private final double upper;

    LinearRow(@Nullable final String name, final Affine expression, final double lower, final double upper) {
        this.name = name;
        this.expression = expression;
        this.lower = lower;
        this.upper = upper;
    }

    public Optional<String> name() {
        return Optional.ofNullable(name);
    }

    public Affine expression() {
        return expression;
    }

    public double lower() {
        return lower;
    }

    public double upper() {
        return upper;
    }

    @Override
    public String toString() {
        return (name == null ? "" : name + ": ") + lower + " <= " + expression + " <= " + upper;
    }
}
