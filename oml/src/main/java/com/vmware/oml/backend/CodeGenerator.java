/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml.backend;

import com.google.common.collect.ImmutableSet;
import com.google.common.io.Files;
import com.squareup.javapoet.AnnotationSpec;
import com.squareup.javapoet.CodeBlock;
import com.squareup.javapoet.JavaFile;
import com.squareup.javapoet.MethodSpec;
import com.squareup.javapoet.ParameterizedTypeName;
import com.squareup.javapoet.TypeSpec;
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
import com.vmware.oml.ast.Sense;
import com.vmware.oml.ast.SetComprehension;
import com.vmware.oml.ast.SetDecl;
import com.vmware.oml.ast.SetLiteral;
import com.vmware.oml.ast.SetOperation;
import com.vmware.oml.ast.SetRef;
import com.vmware.oml.ast.Statement;
import com.vmware.oml.ast.StringLiteral;
import com.vmware.oml.ast.Sum;
import com.vmware.oml.ast.VarDecl;
import com.vmware.oml.ast.VarDomain;
import com.vmware.oml.ast.VarRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.processing.Generated;
import javax.lang.model.element.Modifier;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Renders a model as the source of a Java class whose {@code build(Ops)} method constructs the same
 * {@link Problem} that {@link ModelInterpreter} builds. The output only depends on the model, so the
 * same model always produces the same text.
 *
 * Every user name goes through {@link Identifiers#sanitize} and every string through JavaPoet's
 * {@code $S} escaping. Loop variables are prefixed with an underscore so that they cannot clash
 * with declarations.
 */
public final class CodeGenerator {
    private static final Logger LOG = LoggerFactory.getLogger(CodeGenerator.class);
    public static final String GENERATED_PACKAGE = "com.vmware.oml.generated";
    public static final String GENERATED_CLASS = "GeneratedModel";

    private final List<String> importedTables = new ArrayList<>();
    private final MethodSpec.Builder output = MethodSpec.methodBuilder("build");
    private final ExpressionGen expressions = new ExpressionGen();

    private CodeGenerator() {
    }

    public static String generate(final Model model, final String name) {
        final long start = System.nanoTime();
        final String program = new CodeGenerator().render(model, name);
        LOG.info("Generated program for {} in {}us", name, (System.nanoTime() - start) / 1000);
        LOG.debug("Generated program:\n{}", program);
        return program;
    }

    private String render(final Model model, final String name) {
        output.addModifiers(Modifier.PUBLIC, Modifier.STATIC)
              .returns(Problem.class)
              .addParameter(Ops.class, "o", Modifier.FINAL)
              .addStatement("final $T problem = o.newProblem($S, $T.$L)", Problem.class, name, Sense.class,
                            model.getSense().name());
        boolean objectiveSeen = false;
        for (final Statement statement: model.getStatements()) {
            if (statement instanceof Import) {
                addImport((Import) statement);
            } else if (statement instanceof SetDecl) {
                addSet((SetDecl) statement);
            } else if (statement instanceof ParamDecl) {
                addParam((ParamDecl) statement);
            } else if (statement instanceof VarDecl) {
                addVar((VarDecl) statement);
            } else if (statement instanceof Objective) {
                if (objectiveSeen) {
                    output.addComment("Additional objective ignored");
                } else {
                    output.addCode("\n");
                    output.addStatement("problem.setObjective($L)",
                                        expressions.visit(((Objective) statement).getExpr(), ImmutableSet.of()));
                    objectiveSeen = true;
                }
            } else if (statement instanceof ConstraintBlock) {
                for (final Constraint constraint: ((ConstraintBlock) statement).getConstraints()) {
                    addConstraint(constraint);
                }
            } else {
                output.addCode("/* unsupported statement $L */\n", statement.getClass().getSimpleName());
            }
        }
        output.addStatement("return problem");

        final MethodSpec solve = MethodSpec.methodBuilder("solve")
                .addModifiers(Modifier.PUBLIC, Modifier.STATIC)
                .returns(SolverOutcome.class)
                .addParameter(Ops.class, "o", Modifier.FINAL)
                .addParameter(SolverBackend.class, "backend", Modifier.FINAL)
                .addStatement("return backend.solve(build(o))")
                .build();
        final TypeSpec spec = TypeSpec.classBuilder(GENERATED_CLASS)
                .addAnnotation(AnnotationSpec.builder(Generated.class)
                                 .addMember("value", "$S", CodeGenerator.class.getName())
                                 .build())
                .addModifiers(Modifier.PUBLIC, Modifier.FINAL)
                .addMethod(output.build())
                .addMethod(solve)
                .build();
        return JavaFile.builder(GENERATED_PACKAGE, spec).build().toString();
    }

    private void addImport(final Import node) {
        importedTables.add(Files.getNameWithoutExtension(node.getPath()));
        output.addComment("import $S", node.getPath());
    }

    private CodeBlock importedTablesList() {
        return CodeBlock.of("$T.of($L)", List.class, importedTables.stream()
                .map(table -> CodeBlock.of("$S", table))
                .collect(CodeBlock.joining(", ")));
    }

    private void addSet(final SetDecl node) {
        final CodeBlock literal = node.getValue()
                .map(value -> CodeBlock.of("() -> $L", expressions.visit(value, ImmutableSet.of())))
                .orElse(CodeBlock.of("null"));
        output.addStatement("final $T $L = o.set($S, $L, $L)",
                            ParameterizedTypeName.get(List.class, Object.class), Identifiers.sanitize(node.getName()),
                            node.getName(), importedTablesList(), literal);
    }

    private void addParam(final ParamDecl node) {
        final CodeBlock indices = CodeBlock.of("$T.of($L)", List.class, node.getIndices().stream()
                .map(index -> CodeBlock.of("$S", index))
                .collect(CodeBlock.joining(", ")));
        output.addStatement("final $T $L = o.param($S, $L, $L, $L)", Object.class,
                            Identifiers.sanitize(node.getName()), node.getName(), importedTablesList(), indices,
                            node.getDefaultValue().map(CodeGenerator::literal).orElse(CodeBlock.of("null")));
    }

    private void addVar(final VarDecl node) {
        final String local = Identifiers.sanitize(node.getName());
        if (node.isImplicit()) {
            output.addComment("$L is not declared, assumed continuous and non-negative", local);
        }
        if (!node.isIndexed()) {
            output.addStatement("final $T $L = problem.addVariable($S, $T.$L, $L, $L)", DecisionVariable.class,
                                local, node.getName(), VarDomain.class, node.getDomain().name(),
                                bound(node.getLowerBound()), bound(node.getUpperBound()));
            return;
        }
        final String sets = node.getIndices().stream().map(Identifiers::sanitize).collect(Collectors.joining(", "));
        output.addStatement("final $T $L = problem.addVariables($S, $T.of($L), $T.$L, $L, $L)", VarFamily.class,
                            local, node.getName(), List.class, sets, VarDomain.class, node.getDomain().name(),
                            bound(node.getLowerBound()), bound(node.getUpperBound()));
    }

    private void addConstraint(final Constraint node) {
        output.addCode("\n");
        output.addComment("Constraint $L", node.getName().orElse("(unnamed)"));
        Set<String> scope = ImmutableSet.of();
        final List<CodeBlock> loopVariables = new ArrayList<>();
        for (final LoopClause loop: node.getLoops()) {
            final CodeBlock source = expressions.loopSource(loop, scope);
            scope = expressions.bind(scope, loop.getVariable());
            output.beginControlFlow("for (final $T $L : $L)", Object.class, loopVariable(loop.getVariable()), source);
            loopVariables.add(CodeBlock.of("$L", loopVariable(loop.getVariable())));
        }
        final CodeBlock label;
        if (node.getName().isEmpty()) {
            label = CodeBlock.of("null");
        } else {
            final List<CodeBlock> keys = new ArrayList<>();
            if (node.getNameIndices().isEmpty()) {
                keys.addAll(loopVariables);
            } else {
                for (final Expr index: node.getNameIndices()) {
                    keys.add(expressions.visit(index, scope));
                }
            }
            label = keys.isEmpty() ? CodeBlock.of("$S", node.getName().get())
                    : CodeBlock.of("o.label($S, $L)", node.getName().get(), CodeBlock.join(keys, ", "));
        }
        output.addStatement("problem.addConstraint($L, $L)", label, expressions.visit(node.getExpr(), scope));
        for (int i = 0; i < node.getLoops().size(); i++) {
            output.endControlFlow();
        }
    }

    private static String loopVariable(final String name) {
        return "_" + Identifiers.sanitize(name);
    }

    private static CodeBlock bound(final double value) {
        if (value == Double.POSITIVE_INFINITY) {
            return CodeBlock.of("$T.POSITIVE_INFINITY", Double.class);
        }
        if (value == Double.NEGATIVE_INFINITY) {
            return CodeBlock.of("$T.NEGATIVE_INFINITY", Double.class);
        }
        return CodeBlock.of("$L", value);
    }

    /**
     * Longs are rendered with an {@code L} suffix and no fractional part, Doubles as Java double
     * literals, Strings through {@code $S}.
     */
    static CodeBlock literal(final Object value) {
        if (value instanceof Long) {
            return CodeBlock.of("$LL", value);
        }
        if (value instanceof Double) {
            final double d = (Double) value;
            return Double.isInfinite(d) ? bound(d) : CodeBlock.of("$L", d);
        }
        return CodeBlock.of("$S", String.valueOf(value));
    }

    /**
     * Renders expressions. The context is the set of loop variables in scope.
     */
    private static final class ExpressionGen extends AstVisitor<CodeBlock, Set<String>> {

        private Set<String> bind(final Set<String> scope, final String variable) {
            return ImmutableSet.<String>builder().addAll(scope).add(variable).build();
        }

        private CodeBlock loopSource(final LoopClause loop, final Set<String> scope) {
            final CodeBlock source = visit(loop.getSource(), scope);
            if (loop.getCondition().isEmpty()) {
                return source;
            }
            final Set<String> inner = bind(scope, loop.getVariable());
            return CodeBlock.of("o.where($L, $L -> $L)", source, loopVariable(loop.getVariable()),
                                visit(loop.getCondition().get(), inner));
        }

        private CodeBlock aggregate(final String function, final Expr body, final List<LoopClause> loops,
                                    final int depth, final Set<String> scope) {
            final LoopClause loop = loops.get(depth);
            final CodeBlock source = loopSource(loop, scope);
            final Set<String> inner = bind(scope, loop.getVariable());
            final CodeBlock rest = depth + 1 == loops.size() ? visit(body, inner)
                                                             : aggregate(function, body, loops, depth + 1, inner);
            return CodeBlock.of("o.$L($L, $L -> $L)", function, source, loopVariable(loop.getVariable()), rest);
        }

        private CodeBlock name(final String name, final Set<String> scope) {
            return CodeBlock.of("$L", scope.contains(name) ? loopVariable(name) : Identifiers.sanitize(name));
        }

        private CodeBlock call(final String method, final List<? extends Expr> args, final Set<String> scope) {
            return CodeBlock.of("o.$L($L)", method, args.stream().map(arg -> visit(arg, scope))
                    .collect(CodeBlock.joining(", ")));
        }

        @Override
        protected CodeBlock visitModel(final Model node, final Set<String> scope) {
            return unsupported("model");
        }

        @Override
        protected CodeBlock visitImport(final Import node, final Set<String> scope) {
            return unsupported("import");
        }

        @Override
        protected CodeBlock visitSetDecl(final SetDecl node, final Set<String> scope) {
            return unsupported("set declaration");
        }

        @Override
        protected CodeBlock visitParamDecl(final ParamDecl node, final Set<String> scope) {
            return unsupported("param declaration");
        }

        @Override
        protected CodeBlock visitVarDecl(final VarDecl node, final Set<String> scope) {
            return unsupported("var declaration");
        }

        @Override
        protected CodeBlock visitObjective(final Objective node, final Set<String> scope) {
            return unsupported("objective");
        }

        @Override
        protected CodeBlock visitConstraintBlock(final ConstraintBlock node, final Set<String> scope) {
            return unsupported("constraint block");
        }

        @Override
        protected CodeBlock visitConstraint(final Constraint node, final Set<String> scope) {
            return unsupported("nested constraint");
        }

        @Override
        protected CodeBlock visitLoopClause(final LoopClause node, final Set<String> scope) {
            return unsupported("loop clause");
        }

        @Override
        protected CodeBlock visitBinaryOp(final BinaryOp node, final Set<String> scope) {
            final String method;
            switch (node.getOperator()) {
                case ADD:
                    method = "add";
                    break;
                case SUBTRACT:
                    method = "sub";
                    break;
                case MULTIPLY:
                    method = "mul";
                    break;
                case DIVIDE:
                    method = "div";
                    break;
                case MODULO:
                    method = "mod";
                    break;
                default:
                    method = "pow";
                    break;
            }
            return call(method, List.of(node.getLeft(), node.getRight()), scope);
        }

        @Override
        protected CodeBlock visitComparison(final Comparison node, final Set<String> scope) {
            final String method;
            switch (node.getOperator()) {
                case LESS_THAN_OR_EQUAL:
                    method = "le";
                    break;
                case GREATER_THAN_OR_EQUAL:
                    method = "ge";
                    break;
                case EQUAL:
                    method = "eq";
                    break;
                case NOT_EQUAL:
                    method = "ne";
                    break;
                case LESS_THAN:
                    method = "lt";
                    break;
                default:
                    method = "gt";
                    break;
            }
            return call(method, List.of(node.getLeft(), node.getRight()), scope);
        }

        @Override
        protected CodeBlock visitLogicOp(final LogicOp node, final Set<String> scope) {
            if (node.getOperator() == LogicOp.Operator.NOT) {
                return call("not", node.getOperands(), scope);
            }
            final String method = node.getOperator() == LogicOp.Operator.AND ? "and" : "or";
            final List<Expr> operands = node.getOperands();
            CodeBlock result = visit(operands.get(operands.size() - 1), scope);
            for (int i = operands.size() - 2; i >= 0; i--) {
                result = CodeBlock.of("o.$L($L, $L)", method, visit(operands.get(i), scope), result);
            }
            return result;
        }

        @Override
        protected CodeBlock visitNegate(final Negate node, final Set<String> scope) {
            return call("neg", List.of(node.getArgument()), scope);
        }

        @Override
        protected CodeBlock visitVarRef(final VarRef node, final Set<String> scope) {
            return name(node.getName(), scope);
        }

        @Override
        protected CodeBlock visitIndexedRef(final IndexedRef node, final Set<String> scope) {
            return CodeBlock.of("o.index($L, $L)", name(node.getName(), scope), node.getIndices().stream()
                    .map(index -> visit(index, scope))
                    .collect(CodeBlock.joining(", ")));
        }

        @Override
        protected CodeBlock visitDatasetColumn(final DatasetColumn node, final Set<String> scope) {
            return CodeBlock.of("o.column($S, $S)", node.getTable(), node.getColumn());
        }

        @Override
        protected CodeBlock visitSum(final Sum node, final Set<String> scope) {
            return aggregate("sum", node.getBody(), node.getLoops(), 0, scope);
        }

        @Override
        protected CodeBlock visitProd(final Prod node, final Set<String> scope) {
            LOG.warn("prod is not linear and is only evaluated over data: {}", node);
            return CodeBlock.of("/* WARNING: prod is not linear, decision variables are rejected */ $L",
                                aggregate("prod", node.getBody(), node.getLoops(), 0, scope));
        }

        @Override
        protected CodeBlock visitFunctionCall(final FunctionCall node, final Set<String> scope) {
            if (!Ops.isFunction(node.getName())) {
                return CodeBlock.of("/* unsupported function $L */ o.unsupported($S)",
                                    Identifiers.sanitize(node.getName()), node.getName());
            }
            final List<CodeBlock> args = new ArrayList<>();
            args.add(CodeBlock.of("$S", node.getName()));
            node.getArguments().forEach(arg -> args.add(visit(arg, scope)));
            return CodeBlock.of("o.call($L)", CodeBlock.join(args, ", "));
        }

        @Override
        protected CodeBlock visitIfExpr(final IfExpr node, final Set<String> scope) {
            return CodeBlock.of("o.ifThenElse($L, () -> $L, () -> $L)", visit(node.getCondition(), scope),
                                visit(node.getThenExpr(), scope), visit(node.getElseExpr(), scope));
        }

        @Override
        protected CodeBlock visitNumberLiteral(final NumberLiteral node, final Set<String> scope) {
            return literal(node.getValue());
        }

        @Override
        protected CodeBlock visitStringLiteral(final StringLiteral node, final Set<String> scope) {
            return CodeBlock.of("$S", node.getValue());
        }

        @Override
        protected CodeBlock visitSetLiteral(final SetLiteral node, final Set<String> scope) {
            return CodeBlock.of("o.list($L)", node.getElements().stream()
                    .map(CodeGenerator::literal)
                    .collect(CodeBlock.joining(", ")));
        }

        @Override
        protected CodeBlock visitRangeSet(final RangeSet node, final Set<String> scope) {
            return CodeBlock.of("o.range($L, $L, $L)", visit(node.getStart(), scope), visit(node.getEnd(), scope),
                                node.getStep().map(step -> visit(step, scope)).orElse(CodeBlock.of("null")));
        }

        @Override
        protected CodeBlock visitSetRef(final SetRef node, final Set<String> scope) {
            return CodeBlock.of("o.elements($L)", name(node.getName(), scope));
        }

        @Override
        protected CodeBlock visitSetOperation(final SetOperation node, final Set<String> scope) {
            final String method;
            switch (node.getOperator()) {
                case UNION:
                    method = "union";
                    break;
                case INTERSECTION:
                    method = "intersect";
                    break;
                default:
                    method = "difference";
                    break;
            }
            return call(method, List.of(node.getLeft(), node.getRight()), scope);
        }

        @Override
        protected CodeBlock visitSetComprehension(final SetComprehension node, final Set<String> scope) {
            final LoopClause clause = node.getClause();
            if (clause.getCondition().isEmpty()) {
                return CodeBlock.of("o.elements($L)", visit(clause.getSource(), scope));
            }
            return loopSource(clause, scope);
        }

        private static CodeBlock unsupported(final String what) {
            return CodeBlock.of("/* unsupported $L */ o.unsupported($S)", what, what);
        }
    }
}
