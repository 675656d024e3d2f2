/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml.binding;

import javax.annotation.Nullable;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Canonical form of values used as set elements and parameter keys: integral numbers become Longs
 * and other numbers Doubles, so that {@code 1}, {@code 1L} and {@code 1.0} all select the same
 * element.
 */
public final class Keys {

    private Keys() {
    }

    @Nullable
    public static Object normalize(@Nullable final Object value) {
        if (!(value instanceof Number) || value instanceof Long) {
            return value;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof BigDecimal) {
            final BigDecimal decimal = (BigDecimal) value;
            try {
                return decimal.longValueExact();
            } catch (final ArithmeticException e) {
                return decimal.doubleValue();
            }
        }
        final double d = ((Number) value).doubleValue();
        if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < Long.MAX_VALUE) {
            return (long) d;
        }
        return d;
    }

    public static List<Object> normalizeAll(final Iterable<?> values) {
        final List<Object> out = new ArrayList<>();
        for (final Object value: values) {
            out.add(normalize(value));
        }
        return out;
    }
}
