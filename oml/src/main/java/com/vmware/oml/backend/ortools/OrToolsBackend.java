/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml.backend.ortools;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.ortools.Loader;
import com.google.ortools.modelbuilder.LinearConstraint;
import com.google.ortools.modelbuilder.LinearExpr;
import com.google.ortools.modelbuilder.LinearExprBuilder;
import com.google.ortools.modelbuilder.ModelBuilder;
import com.google.ortools.modelbuilder.ModelSolver;
import com.google.ortools.modelbuilder.SolveStatus;
import com.google.ortools.modelbuilder.Variable;
import com.vmware.oml.ResultStatus;
import com.vmware.oml.SolverException;
import com.vmware.oml.ast.Sense;
import com.vmware.oml.backend.Affine;
import com.vmware.oml.backend.DecisionVariable;
import com.vmware.oml.backend.LinearRow;
import com.vmware.oml.backend.Problem;
import com.vmware.oml.backend.SolverBackend;
import com.vmware.oml.backend.SolverOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Solves problems with OR-Tools' model builder. Continuous problems go to GLOP; problems with integer
 * or binary variables go to the first available of SCIP, CBC and CP-SAT, unless a solver is named
 * explicitly.
 */
public class OrToolsBackend implements SolverBackend {
    private static final Logger LOG = LoggerFactory.getLogger(OrToolsBackend.class);
    private static final int NUM_THREADS_DEFAULT = 4;
    private static final int MAX_TIME_IN_SECONDS = 60;
    private static final String LP_SOLVER = "glop";
    private static final List<String> MIP_SOLVERS = ImmutableList.of("scip", "cbc", "sat");

    static {
        Loader.loadNativeLibraries();
    }

    @Nullable private final String configSolverName;
    private final int configNumThreads;
    private final int configMaxTimeInSeconds;
    private final boolean configPrintDiagnostics;

    private OrToolsBackend(@Nullable final String configSolverName, final int configNumThreads,
                           final int configMaxTimeInSeconds, final boolean configPrintDiagnostics) {
        this.configSolverName = configSolverName;
        this.configNumThreads = configNumThreads;
        this.configMaxTimeInSeconds = configMaxTimeInSeconds;
        this.configPrintDiagnostics = configPrintDiagnostics;
    }

    @Override
    public SolverOutcome solve(final Problem problem) {
        final List<Variable> columns = new ArrayList<>();
        final ModelBuilder model = toModel(problem, columns);
        final String solverName = chooseSolver(problem);
        final ModelSolver solver = new ModelSolver(solverName);
        solver.setTimeLimit(Duration.ofSeconds(configMaxTimeInSeconds));
        solver.enableOutput(configPrintDiagnostics);
        if ("sat".equals(solverName)) {
            solver.setSolverSpecificParameters("num_workers:" + configNumThreads);
        }
        final long start = System.nanoTime();
        final SolveStatus status = solver.solve(model);
        LOG.info("{} returned {} for {} in {}ms", solverName, status, problem.name(),
                 (System.nanoTime() - start) / 1_000_000);
        if (configPrintDiagnostics) {
            LOG.info("Solver wall time: {}s, {} variable(s), {} constraint(s)", solver.getWallTime(),
                     model.numVariables(), model.numConstraints());
        }
        final ResultStatus resultStatus;
        switch (status) {
            case OPTIMAL:
                resultStatus = ResultStatus.OPTIMAL;
                break;
            case FEASIBLE:
                resultStatus = ResultStatus.UNKNOWN;
                break;
            case INFEASIBLE:
                return new SolverOutcome(ResultStatus.INFEASIBLE, null, Map.of(), solverName, null);
            case UNBOUNDED:
                return new SolverOutcome(ResultStatus.UNBOUNDED, null, Map.of(), solverName, null);
            case ABNORMAL:
            case MODEL_INVALID:
                throw new SolverException(solverName + " could not solve " + problem.name() + ": " + status);
            default:
                return new SolverOutcome(ResultStatus.UNKNOWN, null, Map.of(), solverName, status.toString());
        }
        final Map<DecisionVariable, Double> values = new LinkedHashMap<>();
        for (final DecisionVariable variable: problem.variables()) {
            values.put(variable, solver.getValue(columns.get(variable.id())));
        }
        final String message = resultStatus == ResultStatus.UNKNOWN
                ? "Feasible solution found, optimality not proven" : null;
        return new SolverOutcome(resultStatus, solver.getObjectiveValue(), values, solverName, message);
    }

    /**
     * The problem in LP file format.
     */
    public String toLpString(final Problem problem) {
        return toModel(problem, new ArrayList<>()).exportToLpString(false);
    }

    private static ModelBuilder toModel(final Problem problem, final List<Variable> columns) {
        final ModelBuilder model = new ModelBuilder();
        model.setName(problem.name());
        for (final DecisionVariable variable: problem.variables()) {
            columns.add(model.newVar(variable.lowerBound(), variable.upperBound(), variable.domain().isIntegral(),
                                     variable.label()));
        }
        for (final LinearRow row: problem.rows()) {
            final LinearConstraint constraint = model.addLinearConstraint(linear(row.expression(), columns),
                                                                          row.lower(), row.upper());
            row.name().ifPresent(constraint::withName);
        }
        if (problem.hasObjective()) {
            final LinearExpr objective = linear(problem.objective(), columns);
            if (problem.sense() == Sense.MAXIMIZE) {
                model.maximize(objective);
            } else {
                model.minimize(objective);
            }
        }
        return model;
    }

    private static LinearExpr linear(final Affine affine, final List<Variable> columns) {
        final LinearExprBuilder builder = LinearExpr.newBuilder();
        affine.terms().forEach((variable, coefficient) -> builder.addTerm(columns.get(variable.id()), coefficient));
        builder.add(affine.constant());
        return builder.build();
    }

    @VisibleForTesting
    String chooseSolver(final Problem problem) {
        if (configSolverName != null) {
            if (!new ModelSolver(configSolverName).solverIsSupported()) {
                throw new SolverException("Solver " + configSolverName + " is not available");
            }
            return configSolverName;
        }
        if (!problem.isMixedInteger()) {
            return LP_SOLVER;
        }
        for (final String candidate: MIP_SOLVERS) {
            if (new ModelSolver(candidate).solverIsSupported()) {
                return candidate;
            }
            LOG.debug("Solver {} is not available", candidate);
        }
        throw new SolverException("No mixed-integer solver available, tried " + MIP_SOLVERS);
    }

    public static class Builder {
        @Nullable private String solverName = null;
        private int numThreads = NUM_THREADS_DEFAULT;
        private int maxTimeInSeconds = MAX_TIME_IN_SECONDS;
        private boolean printDiagnostics = false;

        /**
         * Forces a specific OR-Tools solver, such as "glop", "scip", "cbc" or "sat".
         * @param solverName solver name. Defaults to choosing GLOP or a mixed-integer solver per problem.
         * @return the current Builder object with `solverName` set
         */
        public Builder setSolverName(final String solverName) {
            this.solverName = solverName;
            return this;
        }

        /**
         * Number of solver threads. Only CP-SAT uses it, as its num_workers parameter.
         * @param numThreads number of solver threads to use. Defaults to {@value NUM_THREADS_DEFAULT}.
         * @return the current Builder object with `numThreads` set
         */
        public Builder setNumThreads(final int numThreads) {
            this.numThreads = numThreads;
            return this;
        }

        /**
         * Solver timeout. A solver that runs out of time without proving optimality yields an
         * Unknown result.
         * @param maxTimeInSeconds timeout value in seconds. Defaults to {@value MAX_TIME_IN_SECONDS}.
         * @return the current Builder object with `maxTimeInSeconds` set
         */
        public Builder setMaxTimeInSeconds(final int maxTimeInSeconds) {
            this.maxTimeInSeconds = maxTimeInSeconds;
            return this;
        }

        /**
         * Configures whether or not to print solver output and diagnostics for each invocation of solve()
         *
         * @param printDiagnostics print solver logs and timing. Defaults to false.
         * @return the current Builder object with `printDiagnostics` set
         */
        public Builder setPrintDiagnostics(final boolean printDiagnostics) {
            this.printDiagnostics = printDiagnostics;
            return this;
        }

        public OrToolsBackend build() {
            return new OrToolsBackend(solverName, numThreads, maxTimeInSeconds, printDiagnostics);
        }
    }
}
