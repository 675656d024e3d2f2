/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml.ast;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Optional;

public final class ParamDecl extends Statement {
    private final String name;
    private final List<String> indices;
    @Nullable private final Object defaultValue;

    /**
     * @param name parameter name
     * @param indices names of the sets indexing this parameter, in declaration order
     * @param defaultValue a Long, Double or String literal, or null
     */
    public ParamDecl(final String name, final List<String> indices, @Nullable final Object defaultValue) {
        this.name = name;
        this.indices = List.copyOf(indices);
        this.defaultValue = defaultValue;
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

    public Optional<Object> getDefaultValue() {
        return Optional.ofNullable(defaultValue);
    }

    @Override
    public String toString() {
        return "ParamDecl{" +
                "name='" + name + '\'' +
                ", indices=" + indices +
                ", defaultValue=" + defaultValue +
                '}';
    }

    @Override
    <T, C> T acceptVisitor(final AstVisitor<T, C> visitor, final C context) {
        return visitor.visitParamDecl(this, context);
    }
}
