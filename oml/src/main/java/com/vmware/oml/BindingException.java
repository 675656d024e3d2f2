/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml;

/**
 * Raised when external data cannot be bound to a declared set or parameter.
 */
public class BindingException extends ModelException {
    public BindingException(final String message) {
        super(message);
    }

    public BindingException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
