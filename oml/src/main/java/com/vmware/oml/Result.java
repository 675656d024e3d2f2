/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableTable;
import com.vmware.oml.binding.Keys;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The outcome of solving a model. Variable values are keyed by variable name and index tuple; scalar
 * variables use the empty tuple.
 */
public final class Result {
    private static final double ZERO_TOLERANCE = 1e-8;

    private final ResultStatus status;
    @Nullable private final Double objective;
    private final ImmutableTable<String, ImmutableList<Object>, Double> values;
    private final double elapsedSeconds;
    private final String solver;
    @Nullable private final String message;

    public Result(final ResultStatus status, @Nullable final Double objective,
                  final ImmutableTable<String, ImmutableList<Object>, Double> values, final double elapsedSeconds,
                  final String solver, @Nullable final String message) {
        this.status = status;
        this.objective = objective;
        this.values = values;
        this.elapsedSeconds = elapsedSeconds;
        this.solver = solver;
        this.message = message;
    }

    /**
     * A result without a solution.
     */
    public static Result failure(final ResultStatus status, final String message, final double elapsedSeconds,
                                 final String solver) {
        return new Result(status, null, ImmutableTable.of(), elapsedSeconds, solver, message);
    }

    public ResultStatus status() {
        return status;
    }

    public Optional<Double> objective() {
        return Optional.ofNullable(objective);
    }

    public double elapsedSeconds() {
        return elapsedSeconds;
    }

    public String solver() {
        return solver;
    }

    /**
     * Error or diagnostic message from the solver or the model, if any.
     */
    public Optional<String> message() {
        return Optional.ofNullable(message);
    }

    public ImmutableTable<String, ImmutableList<Object>, Double> table() {
        return values;
    }

    /**
     * Values by variable label, {@code x} or {@code x[A,1]}, in the order the variables were declared.
     */
    public ImmutableMap<String, Double> variables() {
        final ImmutableMap.Builder<String, Double> builder = ImmutableMap.builder();
        values.cellSet().forEach(cell -> builder.put(label(cell.getRowKey(), cell.getColumnKey()), cell.getValue()));
        return builder.build();
    }

    /**
     * Values of every member of one variable family, keyed by index tuple.
     */
    public Map<ImmutableList<Object>, Double> valuesOf(final String family) {
        return values.row(family);
    }

    public Optional<Double> value(final String family, final Object... index) {
        final List<Object> key = new ArrayList<>(index.length);
        for (final Object k: index) {
            key.add(Keys.normalize(k));
        }
        return Optional.ofNullable(values.get(family, ImmutableList.copyOf(key)));
    }

    public ImmutableMap<String, Double> nonZeroVariables() {
        return variables().entrySet().stream()
                .filter(e -> Math.abs(e.getValue()) > ZERO_TOLERANCE)
                .collect(ImmutableMap.toImmutableMap(Map.Entry::getKey, Map.Entry::getValue));
    }

    public boolean isOptimal() {
        return status == ResultStatus.OPTIMAL;
    }

    public boolean isInfeasible() {
        return status == ResultStatus.INFEASIBLE;
    }

    public boolean isUnbounded() {
        return status == ResultStatus.UNBOUNDED;
    }

    public boolean isError() {
        return status == ResultStatus.EXECUTION_ERROR || status == ResultStatus.SOLVER_ERROR;
    }

    private static String label(final String family, final List<Object> index) {
        if (index.isEmpty()) {
            return family;
        }
        return family + index.stream().map(String::valueOf).collect(Collectors.joining(",", "[", "]"));
    }

    @Override
    public String toString() {
        return "Result{" +
                "status=" + status +
                ", objective=" + objective +
                ", variables=" + values.size() +
                ", elapsedSeconds=" + elapsedSeconds +
                ", solver='" + solver + '\'' +
                (message == null ? "" : ", message='" + message + '\'') +
                '}';
    }
}
