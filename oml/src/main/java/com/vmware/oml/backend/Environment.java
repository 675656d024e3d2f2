/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml.backend;

import javax.annotation.Nullable;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Names visible while a model is evaluated. Loops and sums open child scopes, so loop variables
 * shadow declarations and disappear when the loop ends.
 */
final class Environment {
    @Nullable private final Environment parent;
    private final Map<String, Object> values = new HashMap<>();

    Environment() {
        this(null);
    }

    private Environment(@Nullable final Environment parent) {
        this.parent = parent;
    }

    Environment child() {
        return new Environment(this);
    }

    void define(final String name, final Object value) {
        values.put(name, value);
    }

    Optional<Object> lookup(final String name) {
        for (Environment scope = this; scope != null; scope = scope.parent) {
            final Object value = scope.values.get(name);
            if (value != null) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }
}
