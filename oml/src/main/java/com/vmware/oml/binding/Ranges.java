/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml.binding;

import com.google.common.base.Preconditions;

import java.util.ArrayList;
import java.util.List;

/**
 * Expansion of {@code start..end step s} ranges.
 */
public final class Ranges {
    private static final int MAX_ELEMENTS = 10_000_000;

    private Ranges() {
    }

    /**
     * Elements from {@code start} to {@code end}, both included. Integral bounds and steps produce
     * Longs, anything else produces Doubles. A negative step counts down.
     */
    public static List<Object> inclusive(final Number start, final Number end, final Number step) {
        Preconditions.checkArgument(step.doubleValue() != 0, "Range step must not be zero");
        final List<Object> elements = new ArrayList<>();
        if (start instanceof Long && end instanceof Long && step instanceof Long) {
            final long s = step.longValue();
            for (long i = start.longValue(); s > 0 ? i <= end.longValue() : i >= end.longValue(); i += s) {
                elements.add(i);
                Preconditions.checkArgument(elements.size() <= MAX_ELEMENTS, "Range %s..%s is too large",
                                            start, end);
            }
            return elements;
        }
        final double s = step.doubleValue();
        final double last = end.doubleValue();
        for (int k = 0; ; k++) {
            final double value = start.doubleValue() + k * s;
            // tolerate rounding on the last element
            if (s > 0 ? value > last + 1e-9 : value < last - 1e-9) {
                break;
            }
            elements.add(Keys.normalize(value));
            Preconditions.checkArgument(elements.size() <= MAX_ELEMENTS, "Range %s..%s is too large", start, end);
        }
        return elements;
    }
}
