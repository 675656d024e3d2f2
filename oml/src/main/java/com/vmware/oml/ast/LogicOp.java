/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml.ast;

import java.util.List;

/**
 * AND and OR have two operands, NOT has one.
 */
public final class LogicOp extends Expr {
    private final Operator operator;
    private final List<Expr> operands;

    public LogicOp(final Operator operator, final List<Expr> operands) {
        this.operator = operator;
        this.operands = List.copyOf(operands);
    }

    public Operator getOperator() {
        return operator;
    }

    public List<Expr> getOperands() {
        return operands;
    }

    @Override
    public String toString() {
        return "LogicOp{" +
                "operator=" + operator +
                ", operands=" + operands +
                '}';
    }

    @Override
    <T, C> T acceptVisitor(final AstVisitor<T, C> visitor, final C context) {
        return visitor.visitLogicOp(this, context);
    }

    public enum Operator {
        AND,
        OR,
        NOT
    }
}
