/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml.compiler;

import com.vmware.oml.ast.VarDomain;

import java.util.List;
import java.util.Objects;

/**
 * A decision variable referenced by a model. Indices are the placeholders as written at the use
 * site, for example {@code [p, t]} for {@code x[p, t]}. Two references are the same variable when
 * name and indices match; the domain does not take part in identity.
 */
public final class Variable {
    private final String name;
    private final List<String> indices;
    private final VarDomain domain;

    public Variable(final String name, final List<String> indices, final VarDomain domain) {
        this.name = name;
        this.indices = List.copyOf(indices);
        this.domain = domain;
    }

    public String name() {
        return name;
    }

    public List<String> indices() {
        return indices;
    }

    public VarDomain domain() {
        return domain;
    }

    public boolean isIndexed() {
        return !indices.isEmpty();
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Variable)) {
            return false;
        }
        final Variable that = (Variable) o;
        return name.equals(that.name) && indices.equals(that.indices);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, indices);
    }

    @Override
    public String toString() {
        return indices.isEmpty() ? name : name + "[" + String.join(",", indices) + "]";
    }
}
