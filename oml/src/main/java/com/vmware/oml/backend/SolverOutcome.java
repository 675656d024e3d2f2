/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml.backend;

import com.google.common.collect.ImmutableMap;
import com.vmware.oml.ResultStatus;

import javax.annotation.Nullable;
import java.util.Map;
import java.util.Optional;

/**
 * What a {@link SolverBackend} reports back: a status, and when a solution was found, the objective
 * value and the value of every variable.
 */
public final class SolverOutcome {
    private final ResultStatus status;
    @Nullable private final Double objective;
    private final ImmutableMap<DecisionVariable, Double> values;
    private final String solver;
    @Nullable private final String message;

    public SolverOutcome(final ResultStatus status, @Nullable final Double objective,
                         final Map<DecisionVariable, Double> values, final String solver,
                         @Nullable final String message) {
        this.status = status;
        this.objective = objective;
        this.values = ImmutableMap.copyOf(values);
        this.solver = solver;
        this.message = message;
    }

    public ResultStatus status() {
        return status;
    }

    public Optional<Double> objective() {
        return Optional.ofNullable(objective);
    }

    public ImmutableMap<DecisionVariable, Double> values() {
        return values;
    }

    public String solver() {
        return solver;
    }

    public Optional<String> message() {
        return Optional.ofNullable(message);
    }

    @Override
    public String toString() {
        return "SolverOutcome{" +
                "status=" + status +
                ", objective=" + objective +
                ", values=" + values.size() +
                ", solver='" + solver + '\'' +
                '}';
    }
}
