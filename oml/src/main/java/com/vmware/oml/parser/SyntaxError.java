/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml.parser;

import java.util.Objects;

/**
 * A single lexer or parser error, positioned in the source text.
 */
public final class SyntaxError {
    private final int line;
    private final int column;
    private final String offendingText;
    private final String message;

    public SyntaxError(final int line, final int column, final String offendingText, final String message) {
        this.line = line;
        this.column = column;
        this.offendingText = offendingText;
        this.message = message;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }

    public String offendingText() {
        return offendingText;
    }

    public String message() {
        return message;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SyntaxError)) {
            return false;
        }
        final SyntaxError that = (SyntaxError) o;
        return line == that.line && column == that.column && offendingText.equals(that.offendingText)
                && message.equals(that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(line, column, offendingText, message);
    }

    @Override
    public String toString() {
        return String.format("line %d:%d at '%s': %s", line, column, offendingText, message);
    }
}
