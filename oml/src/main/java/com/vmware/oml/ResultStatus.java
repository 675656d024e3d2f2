/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml;

/**
 * Outcome of solving a model.
 */
public enum ResultStatus {
    OPTIMAL("Optimal"),
    INFEASIBLE("Infeasible"),
    UNBOUNDED("Unbounded"),
    /** The model could not be turned into a problem, so no solver was called. */
    EXECUTION_ERROR("ExecutionError"),
    /** The solver itself failed. */
    SOLVER_ERROR("SolverError"),
    /** The solver stopped without proving optimality, for example on a time limit. */
    UNKNOWN("Unknown");

    private final String displayName;

    ResultStatus(final String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
