/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml.binding;

import java.util.Objects;

/**
 * A non-fatal problem found while binding data to a model, such as a parameter nothing could be
 * found for.
 */
public final class BindingWarning {
    private final String name;
    private final String message;

    public BindingWarning(final String name, final String message) {
        this.name = name;
        this.message = message;
    }

    /**
     * The set or parameter the warning is about.
     */
    public String name() {
        return name;
    }

    public String message() {
        return message;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BindingWarning)) {
            return false;
        }
        final BindingWarning that = (BindingWarning) o;
        return name.equals(that.name) && message.equals(that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, message);
    }

    @Override
    public String toString() {
        return name + ": " + message;
    }
}
