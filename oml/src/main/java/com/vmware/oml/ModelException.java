/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml;

/**
 * Root of all exceptions raised while compiling or solving a model.
 */
public class ModelException extends RuntimeException {
    public ModelException(final String message, final Throwable cause) {
        super(message, cause);
    }

    public ModelException(final String message) {
        super(message);
    }
}
