/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml.ast;

import java.util.List;

/**
 * An explicit list of elements. Elements are Long, Double or String values, in source order.
 */
public final class SetLiteral extends SetExpr {
    private final List<Object> elements;

    public SetLiteral(final List<Object> elements) {
        this.elements = List.copyOf(elements);
    }

    public List<Object> getElements() {
        return elements;
    }

    @Override
    public String toString() {
        return "SetLiteral{" +
                "elements=" + elements +
                '}';
    }

    @Override
    <T, C> T acceptVisitor(final AstVisitor<T, C> visitor, final C context) {
        return visitor.visitSetLiteral(this, context);
    }
}
