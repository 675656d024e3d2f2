/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml.backend;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.vmware.oml.TranslationException;
import com.vmware.oml.binding.Keys;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * All variables declared by one {@code var} statement, one per element of the product of its index
 * sets.
 */
public final class VarFamily {
    private final String name;
    private final ImmutableMap<List<Object>, DecisionVariable> members;

    VarFamily(final String name, final ImmutableMap<List<Object>, DecisionVariable> members) {
        this.name = name;
        this.members = members;
    }

    public String name() {
        return name;
    }

    public ImmutableList<DecisionVariable> members() {
        return members.values().asList();
    }

    public DecisionVariable get(final Object... keys) {
        final List<Object> key = new ArrayList<>(keys.length);
        for (final Object k: keys) {
            key.add(Keys.normalize(k));
        }
        final DecisionVariable variable = members.get(key);
        if (variable == null) {
            throw new TranslationException(String.format("%s%s is outside the index sets of %s",
                                                         name, Arrays.toString(keys), name));
        }
        return variable;
    }

    @Override
    public String toString() {
        return "VarFamily{" +
                "name='" + name + '\'' +
                ", size=" + members.size() +
                '}';
    }
}
