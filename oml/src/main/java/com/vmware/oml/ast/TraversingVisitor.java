/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml.ast;

import javax.annotation.Nullable;

/**
 * Walks the whole tree in source order and does nothing else. Subclasses override the kinds they
 * are interested in and call {@code super} to keep descending. Loop clauses are visited before the
 * expressions they scope.
 *
 * @param <C> context passed down the tree
 */
public class TraversingVisitor<C> extends AstVisitor<Void, C> {

    @Nullable
    @Override
    protected Void visitModel(final Model node, final C context) {
        for (final Statement statement: node.getStatements()) {
            visit(statement, context);
        }
        return null;
    }

    @Nullable
    @Override
    protected Void visitImport(final Import node, final C context) {
        return null;
    }

    @Nullable
    @Override
    protected Void visitSetDecl(final SetDecl node, final C context) {
        node.getValue().ifPresent(value -> visit(value, context));
        return null;
    }

    @Nullable
    @Override
    protected Void visitParamDecl(final ParamDecl node, final C context) {
        return null;
    }

    @Nullable
    @Override
    protected Void visitVarDecl(final VarDecl node, final C context) {
        return null;
    }

    @Nullable
    @Override
    protected Void visitObjective(final Objective node, final C context) {
        visit(node.getExpr(), context);
        return null;
    }

    @Nullable
    @Override
    protected Void visitConstraintBlock(final ConstraintBlock node, final C context) {
        for (final Constraint constraint: node.getConstraints()) {
            visit(constraint, context);
        }
        return null;
    }

    @Nullable
    @Override
    protected Void visitConstraint(final Constraint node, final C context) {
        for (final LoopClause loop: node.getLoops()) {
            visit(loop, context);
        }
        for (final Expr index: node.getNameIndices()) {
            visit(index, context);
        }
        visit(node.getExpr(), context);
        return null;
    }

    @Nullable
    @Override
    protected Void visitLoopClause(final LoopClause node, final C context) {
        visit(node.getSource(), context);
        node.getCondition().ifPresent(condition -> visit(condition, context));
        return null;
    }

    @Nullable
    @Override
    protected Void visitBinaryOp(final BinaryOp node, final C context) {
        visit(node.getLeft(), context);
        visit(node.getRight(), context);
        return null;
    }

    @Nullable
    @Override
    protected Void visitComparison(final Comparison node, final C context) {
        visit(node.getLeft(), context);
        visit(node.getRight(), context);
        return null;
    }

    @Nullable
    @Override
    protected Void visitLogicOp(final LogicOp node, final C context) {
        for (final Expr operand: node.getOperands()) {
            visit(operand, context);
        }
        return null;
    }

    @Nullable
    @Override
    protected Void visitNegate(final Negate node, final C context) {
        visit(node.getArgument(), context);
        return null;
    }

    @Nullable
    @Override
    protected Void visitVarRef(final VarRef node, final C context) {
        return null;
    }

    @Nullable
    @Override
    protected Void visitIndexedRef(final IndexedRef node, final C context) {
        for (final Expr index: node.getIndices()) {
            visit(index, context);
        }
        return null;
    }

    @Nullable
    @Override
    protected Void visitDatasetColumn(final DatasetColumn node, final C context) {
        return null;
    }

    @Nullable
    @Override
    protected Void visitSum(final Sum node, final C context) {
        for (final LoopClause loop: node.getLoops()) {
            visit(loop, context);
        }
        visit(node.getBody(), context);
        return null;
    }

    @Nullable
    @Override
    protected Void visitProd(final Prod node, final C context) {
        for (final LoopClause loop: node.getLoops()) {
            visit(loop, context);
        }
        visit(node.getBody(), context);
        return null;
    }

    @Nullable
    @Override
    protected Void visitFunctionCall(final FunctionCall node, final C context) {
        for (final Expr argument: node.getArguments()) {
            visit(argument, context);
        }
        return null;
    }

    @Nullable
    @Override
    protected Void visitIfExpr(final IfExpr node, final C context) {
        visit(node.getCondition(), context);
        visit(node.getThenExpr(), context);
        visit(node.getElseExpr(), context);
        return null;
    }

    @Nullable
    @Override
    protected Void visitNumberLiteral(final NumberLiteral node, final C context) {
        return null;
    }

    @Nullable
    @Override
    protected Void visitStringLiteral(final StringLiteral node, final C context) {
        return null;
    }

    @Nullable
    @Override
    protected Void visitSetLiteral(final SetLiteral node, final C context) {
        return null;
    }

    @Nullable
    @Override
    protected Void visitRangeSet(final RangeSet node, final C context) {
        visit(node.getStart(), context);
        visit(node.getEnd(), context);
        node.getStep().ifPresent(step -> visit(step, context));
        return null;
    }

    @Nullable
    @Override
    protected Void visitSetRef(final SetRef node, final C context) {
        return null;
    }

    @Nullable
    @Override
    protected Void visitSetOperation(final SetOperation node, final C context) {
        visit(node.getLeft(), context);
        visit(node.getRight(), context);
        return null;
    }

    @Nullable
    @Override
    protected Void visitSetComprehension(final SetComprehension node, final C context) {
        visit(node.getClause(), context);
        return null;
    }
}
