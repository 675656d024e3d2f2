/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml;

import com.vmware.oml.parser.SyntaxError;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Raised when the source does not match the grammar. Carries every error the lexer and parser
 * reported, not just the first one.
 */
public class SyntaxException extends ModelException {
    private final List<SyntaxError> errors;

    public SyntaxException(final List<SyntaxError> errors) {
        super(format(errors));
        this.errors = List.copyOf(errors);
    }

    public List<SyntaxError> errors() {
        return errors;
    }

    private static String format(final List<SyntaxError> errors) {
        return "Syntax error(s):\n" + errors.stream().map(SyntaxError::toString)
                                            .collect(Collectors.joining("\n"));
    }
}
