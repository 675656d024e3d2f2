/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml.ast;

public enum VarDomain {
    CONTINUOUS,
    INTEGER,
    BINARY;

    public boolean isIntegral() {
        return this != CONTINUOUS;
    }
}
