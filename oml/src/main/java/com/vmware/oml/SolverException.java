/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml;

/**
 * An exception thrown when invoking the solver. Typically used to convey a missing solver or an internal
 * solver failure. Statuses like infeasibility are reported through {@link Result} instead.
 */
public class SolverException extends ModelException {
    private final String reason;

    public SolverException(final String reason) {
        super(reason);
        this.reason = reason;
    }

    public String reason() {
        return reason;
    }
}
