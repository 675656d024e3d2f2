/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml.backend;

import com.google.common.collect.ImmutableSet;

import javax.lang.model.SourceVersion;
import java.util.Set;

/**
 * Turns model names into Java identifiers for generated programs.
 */
public final class Identifiers {
    private static final Set<String> RESERVED = ImmutableSet.of("o", "problem", "backend");

    private Identifiers() {
    }

    /**
     * Keeps ASCII letters, digits and underscores, prefixes a leading digit with an underscore, and
     * appends an underscore to Java keywords and to names used by the generated code itself.
     */
    public static String sanitize(final String name) {
        final StringBuilder sb = new StringBuilder(name.length() + 1);
        for (final char c: name.toCharArray()) {
            if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '_') {
                sb.append(c);
            }
        }
        if (sb.length() == 0) {
            return "unnamed";
        }
        if (Character.isDigit(sb.charAt(0))) {
            sb.insert(0, '_');
        }
        final String cleaned = sb.toString();
        if (SourceVersion.isKeyword(cleaned) || "_".equals(cleaned) || RESERVED.contains(cleaned)) {
            return cleaned + "_";
        }
        return cleaned;
    }
}
