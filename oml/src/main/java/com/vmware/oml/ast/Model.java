/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml.ast;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * A parsed model: an ordered list of statements.
 */
public final class Model extends Node {
    private final List<Statement> statements;

    public Model(final List<Statement> statements) {
        this.statements = List.copyOf(statements);
    }

    public List<Statement> getStatements() {
        return statements;
    }

    public <S extends Statement> List<S> statementsOf(final Class<S> kind) {
        return statements.stream().filter(kind::isInstance).map(kind::cast).collect(Collectors.toList());
    }

    /**
     * Only the first objective of a model is used.
     */
    public Optional<Objective> getObjective() {
        return statements.stream().filter(Objective.class::isInstance).map(Objective.class::cast).findFirst();
    }

    public Sense getSense() {
        return getObjective().map(Objective::getSense).orElse(Sense.MINIMIZE);
    }

    @Override
    public String toString() {
        return "Model{" +
                "statements=" + statements +
                '}';
    }

    @Override
    <T, C> T acceptVisitor(final AstVisitor<T, C> visitor, final C context) {
        return visitor.visitModel(this, context);
    }
}
