/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml.compiler;

import com.vmware.oml.ValidationException;
import com.vmware.oml.ast.BinaryOp;
import com.vmware.oml.ast.Comparison;
import com.vmware.oml.ast.Constraint;
import com.vmware.oml.ast.ConstraintBlock;
import com.vmware.oml.ast.Expr;
import com.vmware.oml.ast.FunctionCall;
import com.vmware.oml.ast.IfExpr;
import com.vmware.oml.ast.IndexedRef;
import com.vmware.oml.ast.LoopClause;
import com.vmware.oml.ast.Model;
import com.vmware.oml.ast.Negate;
import com.vmware.oml.ast.Objective;
import com.vmware.oml.ast.ParamDecl;
import com.vmware.oml.ast.Prod;
import com.vmware.oml.ast.RangeSet;
import com.vmware.oml.ast.SetDecl;
import com.vmware.oml.ast.Statement;
import com.vmware.oml.ast.Sum;
import com.vmware.oml.ast.TraversingVisitor;
import com.vmware.oml.ast.VarDecl;
import com.vmware.oml.ast.VarRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Semantic checks that the grammar cannot express. Every problem in a model is collected before a
 * single {@link ValidationException} is thrown. Problems that do not prevent solving are returned as
 * warnings instead.
 */
public final class ModelValidator {
    private static final Logger LOG = LoggerFactory.getLogger(ModelValidator.class);

    private ModelValidator() {
    }

    public static List<String> validate(final Model model) {
        final List<String> problems = new ArrayList<>();
        final List<String> warnings = new ArrayList<>();
        final Map<String, VarDecl> vars = new HashMap<>();
        final Set<String> sets = new HashSet<>();

        final Map<String, String> declared = new HashMap<>();
        for (final Statement statement: model.getStatements()) {
            final Optional<String> kindAndName = declaration(statement);
            if (kindAndName.isEmpty()) {
                continue;
            }
            final String name = declaredName(statement);
            final String previous = declared.putIfAbsent(name, kindAndName.get());
            if (previous != null) {
                problems.add(String.format("'%s' is declared more than once (%s, then %s)",
                                           name, previous, kindAndName.get()));
            }
            if (statement instanceof SetDecl) {
                sets.add(name);
            } else if (statement instanceof VarDecl) {
                vars.putIfAbsent(name, (VarDecl) statement);
            }
        }

        for (final VarDecl var: vars.values()) {
            for (final String index: var.getIndices()) {
                if (!sets.contains(index)) {
                    problems.add(String.format("Variable '%s' is indexed by '%s', which is not a declared set",
                                               var.getName(), index));
                }
            }
            if (var.getLowerBound() > var.getUpperBound()) {
                problems.add(String.format("Variable '%s' has an empty domain [%s, %s]",
                                           var.getName(), var.getLowerBound(), var.getUpperBound()));
            }
        }

        final List<Objective> objectives = model.statementsOf(Objective.class);
        if (objectives.isEmpty()) {
            warnings.add("Model has no objective, solving for feasibility only");
        } else {
            if (objectives.size() > 1) {
                warnings.add(String.format("Model has %d objectives, only the first one is used",
                                           objectives.size()));
            }
            final VariableUses uses = new VariableUses(vars);
            uses.visit(objectives.get(0).getExpr(), uses.scope);
            if (uses.found.isEmpty()) {
                problems.add("Objective does not refer to any decision variable");
            }
        }

        for (final ConstraintBlock block: model.statementsOf(ConstraintBlock.class)) {
            for (final Constraint constraint: block.getConstraints()) {
                if (!(constraint.getExpr() instanceof Comparison)) {
                    problems.add(String.format("Constraint %s is not a comparison",
                                               constraint.getName().orElse("<unnamed>")));
                }
            }
        }

        new ComparisonPlacement(problems).visit(model, false);
        new IndexArity(vars, problems).visit(model, new HashSet<>());

        warnings.forEach(LOG::warn);
        if (!problems.isEmpty()) {
            LOG.error("Model failed validation with {} problem(s)", problems.size());
            throw new ValidationException(problems);
        }
        return warnings;
    }

    private static Optional<String> declaration(final Statement statement) {
        if (statement instanceof SetDecl) {
            return Optional.of("set");
        } else if (statement instanceof ParamDecl) {
            return Optional.of("param");
        } else if (statement instanceof VarDecl) {
            return Optional.of("var");
        }
        return Optional.empty();
    }

    private static String declaredName(final Statement statement) {
        if (statement instanceof SetDecl) {
            return ((SetDecl) statement).getName();
        } else if (statement instanceof ParamDecl) {
            return ((ParamDecl) statement).getName();
        }
        return ((VarDecl) statement).getName();
    }

    /**
     * Finds references to decision variables, ignoring loop variables that shadow them.
     */
    private static final class VariableUses extends TraversingVisitor<Set<String>> {
        private final Map<String, VarDecl> vars;
        private final Set<String> found = new HashSet<>();
        private final Set<String> scope = new HashSet<>();

        private VariableUses(final Map<String, VarDecl> vars) {
            this.vars = vars;
        }

        @Nullable
        @Override
        protected Void visitLoopClause(final LoopClause node, final Set<String> context) {
            context.add(node.getVariable());
            return super.visitLoopClause(node, context);
        }

        @Nullable
        @Override
        protected Void visitVarRef(final VarRef node, final Set<String> context) {
            if (vars.containsKey(node.getName()) && !context.contains(node.getName())) {
                found.add(node.getName());
            }
            return null;
        }

        @Nullable
        @Override
        protected Void visitIndexedRef(final IndexedRef node, final Set<String> context) {
            if (vars.containsKey(node.getName())) {
                found.add(node.getName());
            }
            return super.visitIndexedRef(node, context);
        }
    }

    /**
     * Comparisons may only appear at the top of a constraint or as (part of) a condition. The context
     * says whether a comparison is allowed at the current position.
     */
    private static final class ComparisonPlacement extends TraversingVisitor<Boolean> {
        private final List<String> problems;

        private ComparisonPlacement(final List<String> problems) {
            this.problems = problems;
        }

        @Nullable
        @Override
        protected Void visitObjective(final Objective node, final Boolean context) {
            return super.visitObjective(node, false);
        }

        @Nullable
        @Override
        protected Void visitConstraint(final Constraint node, final Boolean context) {
            node.getLoops().forEach(loop -> visit(loop, false));
            node.getNameIndices().forEach(index -> visit(index, false));
            visit(node.getExpr(), true);
            return null;
        }

        @Nullable
        @Override
        protected Void visitLoopClause(final LoopClause node, final Boolean context) {
            visit(node.getSource(), false);
            node.getCondition().ifPresent(condition -> visit(condition, true));
            return null;
        }

        @Nullable
        @Override
        protected Void visitComparison(final Comparison node, final Boolean context) {
            if (!context) {
                problems.add(String.format("Comparison '%s' is only allowed in a constraint or a condition",
                                           node.getOperator().symbol()));
            }
            return super.visitComparison(node, false);
        }

        @Nullable
        @Override
        protected Void visitBinaryOp(final BinaryOp node, final Boolean context) {
            return super.visitBinaryOp(node, false);
        }

        @Nullable
        @Override
        protected Void visitNegate(final Negate node, final Boolean context) {
            return super.visitNegate(node, false);
        }

        @Nullable
        @Override
        protected Void visitIfExpr(final IfExpr node, final Boolean context) {
            visit(node.getCondition(), true);
            visit(node.getThenExpr(), false);
            visit(node.getElseExpr(), false);
            return null;
        }

        @Nullable
        @Override
        protected Void visitSum(final Sum node, final Boolean context) {
            return super.visitSum(node, false);
        }

        @Nullable
        @Override
        protected Void visitProd(final Prod node, final Boolean context) {
            return super.visitProd(node, false);
        }

        @Nullable
        @Override
        protected Void visitFunctionCall(final FunctionCall node, final Boolean context) {
            return super.visitFunctionCall(node, false);
        }

        @Nullable
        @Override
        protected Void visitIndexedRef(final IndexedRef node, final Boolean context) {
            return super.visitIndexedRef(node, false);
        }

        @Nullable
        @Override
        protected Void visitRangeSet(final RangeSet node, final Boolean context) {
            return super.visitRangeSet(node, false);
        }
    }

    /**
     * A decision variable must be used with as many indices as it has index sets.
     */
    private static final class IndexArity extends TraversingVisitor<Set<String>> {
        private final Map<String, VarDecl> vars;
        private final List<String> problems;

        private IndexArity(final Map<String, VarDecl> vars, final List<String> problems) {
            this.vars = vars;
            this.problems = problems;
        }

        @Nullable
        @Override
        protected Void visitLoopClause(final LoopClause node, final Set<String> context) {
            context.add(node.getVariable());
            return super.visitLoopClause(node, context);
        }

        @Nullable
        @Override
        protected Void visitConstraint(final Constraint node, final Set<String> context) {
            return super.visitConstraint(node, new HashSet<>(context));
        }

        @Nullable
        @Override
        protected Void visitSum(final Sum node, final Set<String> context) {
            return super.visitSum(node, new HashSet<>(context));
        }

        @Nullable
        @Override
        protected Void visitProd(final Prod node, final Set<String> context) {
            return super.visitProd(node, new HashSet<>(context));
        }

        @Nullable
        @Override
        protected Void visitVarRef(final VarRef node, final Set<String> context) {
            check(node.getName(), List.of(), context);
            return null;
        }

        @Nullable
        @Override
        protected Void visitIndexedRef(final IndexedRef node, final Set<String> context) {
            check(node.getName(), node.getIndices(), context);
            return super.visitIndexedRef(node, context);
        }

        private void check(final String name, final List<Expr> indices, final Set<String> loopVariables) {
            final VarDecl var = vars.get(name);
            if (var == null || loopVariables.contains(name)) {
                return;
            }
            if (var.getIndices().size() != indices.size()) {
                problems.add(String.format("Variable '%s' is indexed by %d set(s) but used with %d index(es)",
                                           name, var.getIndices().size(), indices.size()));
            }
        }
    }
}
