/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml.binding;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Values resolved for the sets and parameters of a model. A set maps to an ordered immutable list of
 * elements, a scalar parameter to a Number (or String), and an indexed parameter to nested immutable
 * maps, one level per index. Built once by {@link DataBindingService} and never modified.
 */
public final class BoundValues {
    private final ImmutableMap<String, Object> values;
    private final ImmutableList<BindingWarning> warnings;

    BoundValues(final Map<String, Object> values, final List<BindingWarning> warnings) {
        this.values = ImmutableMap.copyOf(values);
        this.warnings = ImmutableList.copyOf(warnings);
    }

    public static BoundValues empty() {
        return new BoundValues(Map.of(), List.of());
    }

    public boolean contains(final String name) {
        return values.containsKey(name);
    }

    public Optional<Object> get(final String name) {
        return Optional.ofNullable(values.get(name));
    }

    public Set<String> names() {
        return values.keySet();
    }

    public ImmutableMap<String, Object> asMap() {
        return values;
    }

    public ImmutableList<BindingWarning> warnings() {
        return warnings;
    }

    @Override
    public String toString() {
        return "BoundValues{" +
                "values=" + values +
                ", warnings=" + warnings +
                '}';
    }
}
