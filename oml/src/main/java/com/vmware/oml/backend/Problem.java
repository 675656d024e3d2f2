/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml.backend;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.vmware.oml.TranslationException;
import com.vmware.oml.ast.Sense;
import com.vmware.oml.ast.VarDomain;
import com.vmware.oml.binding.Keys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A linear or mixed-integer program, independent of any particular solver: variables with bounds
 * and domains, rows, and an objective. The optimization sense is fixed when the problem is created.
 */
public final class Problem {
    private static final Logger LOG = LoggerFactory.getLogger(Problem.class);

    private final String name;
    private final Sense sense;
    private final List<DecisionVariable> variables = new ArrayList<>();
    private final Map<String, VarFamily> families = new LinkedHashMap<>();
    private final List<LinearRow> rows = new ArrayList<>();
    private final Map<String, Integer> labelCounts = new HashMap<>();
    private Affine objective = Affine.zero();
    private boolean hasObjective = false;

    Problem(final String name, final Sense sense) {
        this.name = name;
        this.sense = sense;
    }

    public String name() {
        return name;
    }

    public Sense sense() {
        return sense;
    }

    /**
     * Declares one variable per element of the product of {@code indexSets}, in order.
     */
    public VarFamily addVariables(final String family, final List<List<Object>> indexSets, final VarDomain domain,
                                  final double lowerBound, final double upperBound) {
        Preconditions.checkArgument(!families.containsKey(family), "Variable %s declared twice", family);
        final List<List<Object>> normalized = new ArrayList<>();
        for (final List<Object> set: indexSets) {
            normalized.add(Keys.normalizeAll(set));
        }
        final ImmutableMap.Builder<List<Object>, DecisionVariable> members = ImmutableMap.builder();
        for (final List<Object> index: Lists.cartesianProduct(normalized)) {
            final DecisionVariable variable = new DecisionVariable(variables.size(), family, index, domain,
                                                                   lowerBound, upperBound);
            variables.add(variable);
            members.put(variable.index(), variable);
        }
        final VarFamily varFamily = new VarFamily(family, members.buildKeepingLast());
        families.put(family, varFamily);
        LOG.debug("Declared {} {} variable(s) for {}", varFamily.members().size(), domain, family);
        return varFamily;
    }

    public DecisionVariable addVariable(final String family, final VarDomain domain, final double lowerBound,
                                        final double upperBound) {
        return addVariables(family, List.of(), domain, lowerBound, upperBound).get();
    }

    /**
     * @param expression a number, a variable or an affine expression
     */
    public void setObjective(final Object expression) {
        if (hasObjective) {
            LOG.warn("Objective of {} set more than once, keeping the last one", name);
        }
        this.objective = Affine.from(expression);
        this.hasObjective = true;
    }

    /**
     * Adds a row for {@code constraint}, which is either a {@link Relation} or, when the comparison
     * involved no variables, a Boolean. A relation without variables, or a Boolean, that holds is
     * dropped; one that does not hold becomes an empty, infeasible row.
     *
     * @param label row name, or null for an unnamed row. Repeated labels get a numeric suffix.
     */
    public void addConstraint(@Nullable final String label, final Object constraint) {
        final String name = label == null ? null : uniqueLabel(label);
        if (constraint instanceof Boolean || (constraint instanceof Relation
                                              && ((Relation) constraint).expression().isConstant())) {
            final boolean holds = constraint instanceof Boolean ? (Boolean) constraint
                                                                : ((Relation) constraint).holdsTrivially();
            if (holds) {
                LOG.debug("Constraint {} holds trivially, skipping it", name);
            } else {
                LOG.warn("Constraint {} can never hold, the problem is infeasible", name);
                rows.add(new LinearRow(name, Affine.zero(), 1, 1));
            }
            return;
        }
        if (!(constraint instanceof Relation)) {
            throw new TranslationException("Constraint " + (name == null ? "" : name + " ")
                                           + "is not a comparison: " + Affine.describe(constraint));
        }
        final Relation relation = (Relation) constraint;
        final Affine expression = relation.expression();
        final Affine terms = expression.minus(Affine.constant(expression.constant()));
        final double bound = -expression.constant();
        switch (relation.kind()) {
            case LESS_OR_EQUAL:
                rows.add(new LinearRow(name, terms, Double.NEGATIVE_INFINITY, bound));
                break;
            case GREATER_OR_EQUAL:
                rows.add(new LinearRow(name, terms, bound, Double.POSITIVE_INFINITY));
                break;
            default:
                rows.add(new LinearRow(name, terms, bound, bound));
                break;
        }
    }

    private String uniqueLabel(final String label) {
        final int seen = labelCounts.merge(label, 1, Integer::sum);
        if (seen == 1) {
            return label;
        }
        final String renamed = label + "_" + seen;
        LOG.warn("Constraint label {} is used more than once, renaming to {}", label, renamed);
        return renamed;
    }

    public ImmutableList<DecisionVariable> variables() {
        return ImmutableList.copyOf(variables);
    }

    public ImmutableMap<String, VarFamily> families() {
        return ImmutableMap.copyOf(families);
    }

    public ImmutableList<LinearRow> rows() {
        return ImmutableList.copyOf(rows);
    }

    public Affine objective() {
        return objective;
    }

    public boolean hasObjective() {
        return hasObjective;
    }

    public boolean isMixedInteger() {
        return variables.stream().anyMatch(v -> v.domain().isIntegral());
    }

    @Override
    public String toString() {
        return "Problem{" +
                "name='" + name + '\'' +
                ", sense=" + sense +
                ", variables=" + variables.size() +
                ", rows=" + rows.size() +
                '}';
    }
}
