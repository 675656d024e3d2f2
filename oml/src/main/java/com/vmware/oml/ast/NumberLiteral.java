/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml.ast;

import com.google.common.base.Preconditions;

/**
 * A numeric literal, held as a Long when integral in the source and as a Double otherwise.
 */
public final class NumberLiteral extends Expr {
    private final Number value;

    public NumberLiteral(final Number value) {
        Preconditions.checkArgument(value instanceof Long || value instanceof Double,
                                    "Unexpected literal type %s", value.getClass());
        this.value = value;
    }

    public Number getValue() {
        return value;
    }

    public boolean isIntegral() {
        return value instanceof Long;
    }

    @Override
    public String toString() {
        return "NumberLiteral{" +
                "value=" + value +
                '}';
    }

    @Override
    <T, C> T acceptVisitor(final AstVisitor<T, C> visitor, final C context) {
        return visitor.visitNumberLiteral(this, context);
    }
}
