/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml.examples;

import com.vmware.oml.ModelException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.stream.Collectors;

/**
 * Reads the models and data files bundled with the examples.
 */
final class Resources {

    private Resources() {
    }

    static String read(final String name) {
        final InputStream resourceAsStream = Resources.class.getResourceAsStream(name);
        if (resourceAsStream == null) {
            throw new ModelException("Missing resource " + name);
        }
        try (BufferedReader reader =
                     new BufferedReader(new InputStreamReader(resourceAsStream, StandardCharsets.UTF_8))) {
            return reader.lines().collect(Collectors.joining("\n"));
        } catch (final IOException e) {
            throw new ModelException("Could not read resource " + name, e);
        }
    }
}
