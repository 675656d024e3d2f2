/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml.backend;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableTable;
import com.vmware.oml.Result;
import com.vmware.oml.ResultStatus;
import com.vmware.oml.ast.Model;
import com.vmware.oml.binding.BoundValues;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Builds a problem from a model and its bound data, then solves it. Failures never escape: a model
 * that cannot be built yields {@link ResultStatus#EXECUTION_ERROR} and a failing backend
 * {@link ResultStatus#SOLVER_ERROR}.
 */
public final class ExecutionSandbox {
    private static final Logger LOG = LoggerFactory.getLogger(ExecutionSandbox.class);
    private static final String NO_SOLVER = "none";

    private ExecutionSandbox() {
    }

    public static Result execute(final Model model, final BoundValues bound, final Map<String, ?> inputs,
                                 final String name, final SolverBackend backend) {
        return execute(model, bound, inputs, name, () -> backend);
    }

    /**
     * Creates the backend only once the problem is built, so that a backend that cannot be
     * initialized, for example because its native libraries fail to load, also yields
     * {@link ResultStatus#SOLVER_ERROR}.
     */
    public static Result execute(final Model model, final BoundValues bound, final Map<String, ?> inputs,
                                 final String name, final Supplier<? extends SolverBackend> backendFactory) {
        final long start = System.nanoTime();
        final Problem problem;
        try {
            problem = ModelInterpreter.build(model, new Ops(bound, inputs), name);
        } catch (final RuntimeException e) {
            LOG.error("Could not build problem {}", name, e);
            return Result.failure(ResultStatus.EXECUTION_ERROR, describe(e), seconds(start), NO_SOLVER);
        }
        SolverBackend backend = null;
        final SolverOutcome outcome;
        try {
            backend = backendFactory.get();
            outcome = backend.solve(problem);
        } catch (final RuntimeException | LinkageError e) {
            LOG.error("Solver failed on problem {}", name, e);
            return Result.failure(ResultStatus.SOLVER_ERROR, describe(e), seconds(start),
                                  backend == null ? NO_SOLVER : backend.getClass().getSimpleName());
        }
        final ImmutableTable.Builder<String, ImmutableList<Object>, Double> values = ImmutableTable.builder();
        for (final DecisionVariable variable: problem.variables()) {
            final Double value = outcome.values().get(variable);
            if (value != null && !value.isNaN()) {
                values.put(variable.family(), variable.index(), value);
            }
        }
        final Result result = new Result(outcome.status(), outcome.objective().orElse(null), values.build(),
                                         seconds(start), outcome.solver(), outcome.message().orElse(null));
        LOG.info("Solved {}: {}", name, result);
        return result;
    }

    private static double seconds(final long startNanos) {
        return (System.nanoTime() - startNanos) / 1e9;
    }

    private static String describe(final Throwable e) {
        return e.getMessage() == null ? e.getClass().getSimpleName()
                                      : e.getClass().getSimpleName() + ": " + e.getMessage();
    }
}
