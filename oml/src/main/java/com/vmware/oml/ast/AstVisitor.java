/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml.ast;

/**
 * Visits the syntax tree. Every node kind has its own abstract method, so adding a kind is caught at
 * compile time by every visitor.
 *
 * @param <T> result type
 * @param <C> context passed down the tree
 */
public abstract class AstVisitor<T, C> {

    public T visit(final Node node, final C context) {
        return node.acceptVisitor(this, context);
    }

    protected abstract T visitModel(Model node, C context);

    protected abstract T visitImport(Import node, C context);

    protected abstract T visitSetDecl(SetDecl node, C context);

    protected abstract T visitParamDecl(ParamDecl node, C context);

    protected abstract T visitVarDecl(VarDecl node, C context);

    protected abstract T visitObjective(Objective node, C context);

    protected abstract T visitConstraintBlock(ConstraintBlock node, C context);

    protected abstract T visitConstraint(Constraint node, C context);

    protected abstract T visitLoopClause(LoopClause node, C context);

    protected abstract T visitBinaryOp(BinaryOp node, C context);

    protected abstract T visitComparison(Comparison node, C context);

    protected abstract T visitLogicOp(LogicOp node, C context);

    protected abstract T visitNegate(Negate node, C context);

    protected abstract T visitVarRef(VarRef node, C context);

    protected abstract T visitIndexedRef(IndexedRef node, C context);

    protected abstract T visitDatasetColumn(DatasetColumn node, C context);

    protected abstract T visitSum(Sum node, C context);

    protected abstract T visitProd(Prod node, C context);

    protected abstract T visitFunctionCall(FunctionCall node, C context);

    protected abstract T visitIfExpr(IfExpr node, C context);

    protected abstract T visitNumberLiteral(NumberLiteral node, C context);

    protected abstract T visitStringLiteral(StringLiteral node, C context);

    protected abstract T visitSetLiteral(SetLiteral node, C context);

    protected abstract T visitRangeSet(RangeSet node, C context);

    protected abstract T visitSetRef(SetRef node, C context);

    protected abstract T visitSetOperation(SetOperation node, C context);

    protected abstract T visitSetComprehension(SetComprehension node, C context);
}
