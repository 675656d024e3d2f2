/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml.compiler;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.vmware.oml.ast.Model;

import java.util.List;
import java.util.Set;

/**
 * The syntax tree of a model along with what was learned while building it.
 */
public final class TransformResult {
    private final Model model;
    private final ImmutableSet<Variable> variables;
    private final ImmutableSet<DatasetReference> datasets;
    private final ComplexityMetrics complexity;
    private final ImmutableList<String> warnings;

    TransformResult(final Model model, final Set<Variable> variables, final Set<DatasetReference> datasets,
                    final ComplexityMetrics complexity, final List<String> warnings) {
        this.model = model;
        this.variables = ImmutableSet.copyOf(variables);
        this.datasets = ImmutableSet.copyOf(datasets);
        this.complexity = complexity;
        this.warnings = ImmutableList.copyOf(warnings);
    }

    public Model model() {
        return model;
    }

    /**
     * Decision variables referenced by the objective and constraints, in order of first use.
     */
    public Set<Variable> variables() {
        return variables;
    }

    public Set<DatasetReference> datasets() {
        return datasets;
    }

    public ComplexityMetrics complexity() {
        return complexity;
    }

    public List<String> warnings() {
        return warnings;
    }
}
