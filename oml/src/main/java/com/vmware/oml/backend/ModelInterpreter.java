/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml.backend;

import com.google.common.io.Files;
import com.vmware.oml.TranslationException;
import com.vmware.oml.ast.AstVisitor;
import com.vmware.oml.ast.BinaryOp;
import com.vmware.oml.ast.Comparison;
import com.vmware.oml.ast.Constraint;
import com.vmware.oml.ast.ConstraintBlock;
import com.vmware.oml.ast.DatasetColumn;
import com.vmware.oml.ast.Expr;
import com.vmware.oml.ast.FunctionCall;
import com.vmware.oml.ast.IfExpr;
import com.vmware.oml.ast.Import;
import com.vmware.oml.ast.IndexedRef;
import com.vmware.oml.ast.LogicOp;
import com.vmware.oml.ast.LoopClause;
import com.vmware.oml.ast.Model;
import com.vmware.oml.ast.Negate;
import com.vmware.oml.ast.NumberLiteral;
import com.vmware.oml.ast.Objective;
import com.vmware.oml.ast.ParamDecl;
import com.vmware.oml.ast.Prod;
import com.vmware.oml.ast.RangeSet;
import com.vmware.oml.ast.SetComprehension;
import com.vmware.oml.ast.SetDecl;
import com.vmware.oml.ast.SetLiteral;
import com.vmware.oml.ast.SetOperation;
import com.vmware.oml.ast.SetRef;
import com.vmware.oml.ast.Statement;
import com.vmware.oml.ast.StringLiteral;
import com.vmware.oml.ast.Sum;
import com.vmware.oml.ast.VarDecl;
import com.vmware.oml.ast.VarRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Evaluates a model directly into a {@link Problem}, with the same semantics as the program produced
 * by {@link CodeGenerator}: declarations bind names in order, constraints are expanded over their
 * loops, and every operation goes through {@link Ops}. A new interpreter is used for every call.
 */
public final class ModelInterpreter extends AstVisitor<Object, Environment> {
    private static final Logger LOG = LoggerFactory.getLogger(ModelInterpreter.class);

    private final Ops ops;
    private final Problem problem;
    private final List<String> importedTables = new ArrayList<>();
    private boolean objectiveSet = false;

    private ModelInterpreter(final Ops ops, final Problem problem) {
        this.ops = ops;
        this.problem = problem;
    }

    public static Problem build(final Model model, final Ops ops, final String name) {
        final long start = System.nanoTime();
        final ModelInterpreter interpreter = new ModelInterpreter(ops, ops.newProblem(name, model.getSense()));
        interpreter.visit(model, new Environment());
        LOG.info("Built {} with {} variable(s) and {} row(s) in {}us", name, interpreter.problem.variables().size(),
                 interpreter.problem.rows().size(), (System.nanoTime() - start) / 1000);
        return interpreter.problem;
    }

    @Override
    protected Object visitModel(final Model node, final Environment env) {
        for (final Statement statement: node.getStatements()) {
            visit(statement, env);
        }
        return problem;
    }

    @Nullable
    @Override
    protected Object visitImport(final Import node, final Environment env) {
        importedTables.add(Files.getNameWithoutExtension(node.getPath()));
        return null;
    }

    @Nullable
    @Override
    protected Object visitSetDecl(final SetDecl node, final Environment env) {
        final Supplier<List<Object>> literal = node.getValue()
                .<Supplier<List<Object>>>map(value -> () -> ops.elements(visit(value, env)))
                .orElse(null);
        env.define(node.getName(), ops.set(node.getName(), importedTables, literal));
        return null;
    }

    @Nullable
    @Override
    protected Object visitParamDecl(final ParamDecl node, final Environment env) {
        env.define(node.getName(), ops.param(node.getName(), importedTables, node.getIndices(),
                                             node.getDefaultValue().orElse(null)));
        return null;
    }

    @Nullable
    @Override
    protected Object visitVarDecl(final VarDecl node, final Environment env) {
        if (!node.isIndexed()) {
            env.define(node.getName(), problem.addVariable(node.getName(), node.getDomain(),
                                                           node.getLowerBound(), node.getUpperBound()));
            return null;
        }
        final List<List<Object>> indexSets = new ArrayList<>();
        for (final String index: node.getIndices()) {
            indexSets.add(ops.elements(lookup(index, env)));
        }
        env.define(node.getName(), problem.addVariables(node.getName(), indexSets, node.getDomain(),
                                                        node.getLowerBound(), node.getUpperBound()));
        return null;
    }

    @Nullable
    @Override
    protected Object visitObjective(final Objective node, final Environment env) {
        if (objectiveSet) {
            LOG.debug("Ignoring additional objective {}", node);
            return null;
        }
        problem.setObjective(visit(node.getExpr(), env));
        objectiveSet = true;
        return null;
    }

    @Nullable
    @Override
    protected Object visitConstraintBlock(final ConstraintBlock node, final Environment env) {
        for (final Constraint constraint: node.getConstraints()) {
            visit(constraint, env);
        }
        return null;
    }

    @Nullable
    @Override
    protected Object visitConstraint(final Constraint node, final Environment env) {
        expand(node, 0, env, new ArrayList<>());
        return null;
    }

    /*
     * One row per combination of loop values that passes every condition.
     */
    private void expand(final Constraint node, final int depth, final Environment env,
                        final List<Object> loopValues) {
        if (depth == node.getLoops().size()) {
            problem.addConstraint(label(node, env, loopValues), visit(node.getExpr(), env));
            return;
        }
        final LoopClause loop = node.getLoops().get(depth);
        for (final Object element: ops.elements(visit(loop.getSource(), env))) {
            final Environment scope = env.child();
            scope.define(loop.getVariable(), element);
            if (loop.getCondition().isPresent() && !ops.test(visit(loop.getCondition().get(), scope))) {
                continue;
            }
            loopValues.add(element);
            expand(node, depth + 1, scope, loopValues);
            loopValues.remove(loopValues.size() - 1);
        }
    }

    @Nullable
    private String label(final Constraint node, final Environment env, final List<Object> loopValues) {
        if (node.getName().isEmpty()) {
            return null;
        }
        if (node.getNameIndices().isEmpty()) {
            return ops.label(node.getName().get(), loopValues.toArray());
        }
        final List<Object> keys = new ArrayList<>();
        for (final Expr index: node.getNameIndices()) {
            keys.add(visit(index, env));
        }
        return ops.label(node.getName().get(), keys.toArray());
    }

    @Override
    protected Object visitLoopClause(final LoopClause node, final Environment env) {
        throw new TranslationException("Loop clause outside of a sum, product or constraint: " + node);
    }

    @Override
    protected Object visitBinaryOp(final BinaryOp node, final Environment env) {
        final Object left = visit(node.getLeft(), env);
        final Object right = visit(node.getRight(), env);
        switch (node.getOperator()) {
            case ADD:
                return ops.add(left, right);
            case SUBTRACT:
                return ops.sub(left, right);
            case MULTIPLY:
                return ops.mul(left, right);
            case DIVIDE:
                return ops.div(left, right);
            case MODULO:
                return ops.mod(left, right);
            case POWER:
                return ops.pow(left, right);
            default:
                throw new TranslationException("Unknown operator " + node.getOperator());
        }
    }

    @Override
    protected Object visitComparison(final Comparison node, final Environment env) {
        final Object left = visit(node.getLeft(), env);
        final Object right = visit(node.getRight(), env);
        switch (node.getOperator()) {
            case LESS_THAN_OR_EQUAL:
                return ops.le(left, right);
            case GREATER_THAN_OR_EQUAL:
                return ops.ge(left, right);
            case EQUAL:
                return ops.eq(left, right);
            case NOT_EQUAL:
                return ops.ne(left, right);
            case LESS_THAN:
                return ops.lt(left, right);
            case GREATER_THAN:
                return ops.gt(left, right);
            default:
                throw new TranslationException("Unknown comparison " + node.getOperator());
        }
    }

    @Override
    protected Object visitLogicOp(final LogicOp node, final Environment env) {
        switch (node.getOperator()) {
            case AND:
                for (final Expr operand: node.getOperands()) {
                    if (!ops.test(visit(operand, env))) {
                        return false;
                    }
                }
                return true;
            case OR:
                for (final Expr operand: node.getOperands()) {
                    if (ops.test(visit(operand, env))) {
                        return true;
                    }
                }
                return false;
            default:
                return ops.not(visit(node.getOperands().get(0), env));
        }
    }

    @Override
    protected Object visitNegate(final Negate node, final Environment env) {
        return ops.neg(visit(node.getArgument(), env));
    }

    @Override
    protected Object visitVarRef(final VarRef node, final Environment env) {
        return lookup(node.getName(), env);
    }

    @Override
    protected Object visitIndexedRef(final IndexedRef node, final Environment env) {
        final Object container = lookup(node.getName(), env);
        final Object[] keys = new Object[node.getIndices().size()];
        for (int i = 0; i < keys.length; i++) {
            keys[i] = visit(node.getIndices().get(i), env);
        }
        return ops.index(container, keys);
    }

    @Override
    protected Object visitDatasetColumn(final DatasetColumn node, final Environment env) {
        return ops.column(node.getTable(), node.getColumn());
    }

    @Override
    protected Object visitSum(final Sum node, final Environment env) {
        return sum(node.getBody(), node.getLoops(), 0, env);
    }

    private Object sum(final Expr body, final List<LoopClause> loops, final int depth, final Environment env) {
        final LoopClause loop = loops.get(depth);
        return ops.sum(source(loop, env), element -> {
            final Environment scope = env.child();
            scope.define(loop.getVariable(), element);
            return depth + 1 == loops.size() ? visit(body, scope) : sum(body, loops, depth + 1, scope);
        });
    }

    @Override
    protected Object visitProd(final Prod node, final Environment env) {
        return prod(node.getBody(), node.getLoops(), 0, env);
    }

    private Object prod(final Expr body, final List<LoopClause> loops, final int depth, final Environment env) {
        final LoopClause loop = loops.get(depth);
        return ops.prod(source(loop, env), element -> {
            final Environment scope = env.child();
            scope.define(loop.getVariable(), element);
            return depth + 1 == loops.size() ? visit(body, scope) : prod(body, loops, depth + 1, scope);
        });
    }

    /*
     * Elements a loop ranges over, after its condition.
     */
    private List<Object> source(final LoopClause loop, final Environment env) {
        final Object source = visit(loop.getSource(), env);
        if (loop.getCondition().isEmpty()) {
            return ops.elements(source);
        }
        final Expr condition = loop.getCondition().get();
        return ops.where(source, element -> {
            final Environment scope = env.child();
            scope.define(loop.getVariable(), element);
            return visit(condition, scope);
        });
    }

    @Override
    protected Object visitFunctionCall(final FunctionCall node, final Environment env) {
        final Object[] args = new Object[node.getArguments().size()];
        for (int i = 0; i < args.length; i++) {
            args[i] = visit(node.getArguments().get(i), env);
        }
        return ops.call(node.getName(), args);
    }

    @Override
    protected Object visitIfExpr(final IfExpr node, final Environment env) {
        return ops.ifThenElse(visit(node.getCondition(), env), () -> visit(node.getThenExpr(), env),
                              () -> visit(node.getElseExpr(), env));
    }

    @Override
    protected Object visitNumberLiteral(final NumberLiteral node, final Environment env) {
        return node.getValue();
    }

    @Override
    protected Object visitStringLiteral(final StringLiteral node, final Environment env) {
        return node.getValue();
    }

    @Override
    protected Object visitSetLiteral(final SetLiteral node, final Environment env) {
        return ops.list(node.getElements().toArray());
    }

    @Override
    protected Object visitRangeSet(final RangeSet node, final Environment env) {
        return ops.range(visit(node.getStart(), env), visit(node.getEnd(), env),
                         node.getStep().map(step -> visit(step, env)).orElse(null));
    }

    @Override
    protected Object visitSetRef(final SetRef node, final Environment env) {
        return ops.elements(lookup(node.getName(), env));
    }

    @Override
    protected Object visitSetOperation(final SetOperation node, final Environment env) {
        final Object left = visit(node.getLeft(), env);
        final Object right = visit(node.getRight(), env);
        switch (node.getOperator()) {
            case UNION:
                return ops.union(left, right);
            case INTERSECTION:
                return ops.intersect(left, right);
            default:
                return ops.difference(left, right);
        }
    }

    @Override
    protected Object visitSetComprehension(final SetComprehension node, final Environment env) {
        return source(node.getClause(), env);
    }

    private static Object lookup(final String name, final Environment env) {
        return env.lookup(name).orElseThrow(() -> new TranslationException("Unknown symbol " + name));
    }
}
