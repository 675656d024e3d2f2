/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml.ast;

import java.util.List;

public final class ConstraintBlock extends Statement {
    private final List<Constraint> constraints;

    public ConstraintBlock(final List<Constraint> constraints) {
        this.constraints = List.copyOf(constraints);
    }

    public List<Constraint> getConstraints() {
        return constraints;
    }

    @Override
    public String toString() {
        return "ConstraintBlock{" +
                "constraints=" + constraints +
                '}';
    }

    @Override
    <T, C> T acceptVisitor(final AstVisitor<T, C> visitor, final C context) {
        return visitor.visitConstraintBlock(this, context);
    }
}
