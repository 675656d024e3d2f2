/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml;

/**
 * Raised when a model construct cannot be lowered into a linear program.
 */
public class TranslationException extends ModelException {
    public TranslationException(final String message) {
        super(message);
    }

    public TranslationException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
