/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.vmware.oml.ast.Model;
import com.vmware.oml.backend.ExecutionSandbox;
import com.vmware.oml.backend.ModelInterpreter;
import com.vmware.oml.backend.Ops;
import com.vmware.oml.backend.Problem;
import com.vmware.oml.backend.SolverBackend;
import com.vmware.oml.backend.ortools.OrToolsBackend;
import com.vmware.oml.binding.BoundValues;
import com.vmware.oml.compiler.ComplexityMetrics;
import com.vmware.oml.compiler.DatasetReference;
import com.vmware.oml.compiler.Variable;

import javax.annotation.Nullable;
import java.util.Map;
import java.util.Set;

/**
 * A model that went through the whole compiler: its source, syntax tree, generated program,
 * inventories and bound data. Instances are immutable, and {@link #solve()} can be called any number
 * of times, also concurrently, since every call builds its own problem.
 */
public final class CompiledModel {
    private final String name;
    private final String source;
    private final Model model;
    private final String program;
    private final ImmutableSet<Variable> variables;
    private final ImmutableSet<DatasetReference> datasets;
    private final ComplexityMetrics complexity;
    private final BoundValues boundValues;
    private final ImmutableMap<String, Object> inputs;
    private final ImmutableList<String> warnings;
    @Nullable private final SolverBackend backend;

    /**
     * Created by {@link com.vmware.oml.compiler.ModelCompiler}.
     */
    public CompiledModel(final String name, final String source, final Model model, final String program,
                         final Set<Variable> variables, final Set<DatasetReference> datasets,
                         final ComplexityMetrics complexity, final BoundValues boundValues,
                         final Map<String, ?> inputs, final Iterable<String> warnings,
                         @Nullable final SolverBackend backend) {
        this.name = name;
        this.source = source;
        this.model = model;
        this.program = program;
        this.variables = ImmutableSet.copyOf(variables);
        this.datasets = ImmutableSet.copyOf(datasets);
        this.complexity = complexity;
        this.boundValues = boundValues;
        this.inputs = ImmutableMap.copyOf(inputs);
        this.warnings = ImmutableList.copyOf(warnings);
        this.backend = backend;
    }

    public String name() {
        return name;
    }

    public String source() {
        return source;
    }

    public Model model() {
        return model;
    }

    /**
     * Java source of a class that builds this model's problem, for inspection and export.
     */
    public String program() {
        return program;
    }

    public ImmutableSet<Variable> variables() {
        return variables;
    }

    public ImmutableSet<DatasetReference> datasets() {
        return datasets;
    }

    public ComplexityMetrics complexity() {
        return complexity;
    }

    public BoundValues boundValues() {
        return boundValues;
    }

    public ImmutableList<String> warnings() {
        return warnings;
    }

    /**
     * Solves with the backend configured at compile time, or OR-Tools with default settings.
     */
    public Result solve() {
        if (backend != null) {
            return solve(backend);
        }
        return ExecutionSandbox.execute(model, boundValues, inputs, name,
                                        () -> new OrToolsBackend.Builder().build());
    }

    public Result solve(final SolverBackend solverBackend) {
        return ExecutionSandbox.execute(model, boundValues, inputs, name, solverBackend);
    }

    /**
     * Builds the problem without solving it.
     */
    public Problem buildProblem() {
        return ModelInterpreter.build(model, new Ops(boundValues, inputs), name);
    }

    @Override
    public String toString() {
        return "CompiledModel{" +
                "name='" + name + '\'' +
                ", variables=" + variables +
                ", datasets=" + datasets +
                ", complexity=" + complexity +
                ", warnings=" + warnings.size() +
                '}';
    }
}
