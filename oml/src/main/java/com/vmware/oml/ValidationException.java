/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml;

import java.util.List;

/**
 * Raised when a syntactically valid model is semantically ill-formed. All problems found in
 * one pass are reported together.
 */
public class ValidationException extends ModelException {
    private final List<String> problems;

    public ValidationException(final List<String> problems) {
        super("Invalid model:\n  - " + String.join("\n  - ", problems));
        this.problems = List.copyOf(problems);
    }

    public ValidationException(final String problem) {
        this(List.of(problem));
    }

    public List<String> problems() {
        return problems;
    }
}
