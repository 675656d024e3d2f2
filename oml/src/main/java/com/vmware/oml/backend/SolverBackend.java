/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml.backend;

import com.vmware.oml.SolverException;

/**
 * A solver that can solve a {@link Problem}.
 */
public interface SolverBackend {

    /**
     * @throws SolverException if the solver fails, as opposed to proving the problem infeasible or
     *                         unbounded
     */
    SolverOutcome solve(Problem problem);
}
