/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml.compiler;

import com.google.common.io.Files;
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
import com.vmware.oml.ast.Node;
import com.vmware.oml.ast.NumberLiteral;
import com.vmware.oml.ast.Objective;
import com.vmware.oml.ast.ParamDecl;
import com.vmware.oml.ast.Prod;
import com.vmware.oml.ast.RangeSet;
import com.vmware.oml.ast.Sense;
import com.vmware.oml.ast.SetComprehension;
import com.vmware.oml.ast.SetDecl;
import com.vmware.oml.ast.SetExpr;
import com.vmware.oml.ast.SetLiteral;
import com.vmware.oml.ast.SetOperation;
import com.vmware.oml.ast.SetRef;
import com.vmware.oml.ast.Statement;
import com.vmware.oml.ast.StringLiteral;
import com.vmware.oml.ast.Sum;
import com.vmware.oml.ast.VarDecl;
import com.vmware.oml.ast.VarDomain;
import com.vmware.oml.ast.VarRef;
import com.vmware.oml.parser.OmlBaseVisitor;
import com.vmware.oml.parser.OmlParser;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Converts the parse tree produced by the generated parser into the {@link Model} syntax tree.
 *
 * Along the way it records which decision variables and dataset columns the model refers to and
 * gathers complexity counters. All of that state lives in the instance, and a new instance is
 * created for every call to {@link #transform}, so nothing leaks from one model into the next.
 */
public final class AstTransformer extends OmlBaseVisitor<Node> {
    private static final Logger LOG = LoggerFactory.getLogger(AstTransformer.class);

    // Declarations found by a first pass over the statements, so that use sites may precede them
    private final Set<String> declaredSets = new HashSet<>();
    private final Set<String> declaredParams = new HashSet<>();
    private final Map<String, VarDomain> declaredVars = new HashMap<>();
    private final Set<String> importedTables = new HashSet<>();

    private final Deque<Set<String>> loopScopes = new ArrayDeque<>();
    private final Set<Variable> variables = new LinkedHashSet<>();
    private final Set<DatasetReference> datasets = new LinkedHashSet<>();
    private final Map<String, VarDecl> implicitVars = new LinkedHashMap<>();
    private final List<String> warnings = new ArrayList<>();

    // > 0 while inside an objective or constraint body
    private int bodyDepth = 0;
    // > 0 while inside index brackets or a loop header
    private int headerDepth = 0;

    private int nestingLevel = 1;
    private int operationCount = 0;
    private int functionCount = 0;
    private int conditionalCount = 0;

    private AstTransformer() {
    }

    public static TransformResult transform(final OmlParser.ModelContext ctx) {
        final AstTransformer transformer = new AstTransformer();
        final Model model = (Model) transformer.visitModel(ctx);
        final ComplexityMetrics complexity = new ComplexityMetrics(transformer.nestingLevel,
                transformer.variables.size(), transformer.operationCount, transformer.functionCount,
                transformer.conditionalCount);
        LOG.debug("Transformed model with {} statement(s), {} variable reference(s), {}",
                  model.getStatements().size(), transformer.variables.size(), complexity);
        return new TransformResult(model, transformer.variables, transformer.datasets, complexity,
                                   transformer.warnings);
    }

    @Override
    public Node visitModel(final OmlParser.ModelContext ctx) {
        collectDeclarations(ctx);
        final List<Statement> statements = new ArrayList<>();
        for (final OmlParser.StatementContext statement: ctx.statement()) {
            statements.add((Statement) visit(statement));
        }
        if (!implicitVars.isEmpty()) {
            final List<Statement> withImplicit = new ArrayList<>(implicitVars.values());
            withImplicit.addAll(statements);
            return new Model(withImplicit);
        }
        return new Model(statements);
    }

    private void collectDeclarations(final OmlParser.ModelContext ctx) {
        for (final OmlParser.StatementContext statement: ctx.statement()) {
            if (statement.setDecl() != null) {
                declaredSets.add(statement.setDecl().ID().getText());
            } else if (statement.paramDecl() != null) {
                declaredParams.add(statement.paramDecl().ID().getText());
            } else if (statement.varDecl() != null) {
                declaredVars.put(statement.varDecl().ID().getText(), domainOf(statement.varDecl().domain()));
            } else if (statement.importStmt() != null) {
                final String path = unquote(statement.importStmt().STRING().getText());
                importedTables.add(Files.getNameWithoutExtension(path));
            }
        }
    }

    @Override
    public Node visitStatement(final OmlParser.StatementContext ctx) {
        return visit(ctx.getChild(0));
    }

    @Override
    public Node visitImportStmt(final OmlParser.ImportStmtContext ctx) {
        return new Import(unquote(ctx.STRING().getText()));
    }

    @Override
    public Node visitSetDecl(final OmlParser.SetDeclContext ctx) {
        final SetExpr value = ctx.setExpr() == null ? null : setExpr(ctx.setExpr());
        return new SetDecl(ctx.ID().getText(), value);
    }

    @Override
    public Node visitParamDecl(final OmlParser.ParamDeclContext ctx) {
        Object defaultValue = null;
        if (ctx.literal() != null) {
            defaultValue = ctx.literal().STRING() != null ? unquote(ctx.literal().STRING().getText())
                                                          : signedNumber(ctx.literal().signedNumber());
        }
        return new ParamDecl(ctx.ID().getText(), idList(ctx.idList()), defaultValue);
    }

    @Override
    public Node visitVarDecl(final OmlParser.VarDeclContext ctx) {
        final VarDomain domain = domainOf(ctx.domain());
        double lower = 0;
        double upper = domain == VarDomain.BINARY ? 1 : Double.POSITIVE_INFINITY;
        for (final OmlParser.BoundClauseContext clause: ctx.boundClause()) {
            if (clause instanceof OmlParser.LowerBoundContext) {
                lower = signedNumber(((OmlParser.LowerBoundContext) clause).signedNumber()).doubleValue();
            } else if (clause instanceof OmlParser.UpperBoundContext) {
                upper = signedNumber(((OmlParser.UpperBoundContext) clause).signedNumber()).doubleValue();
            } else if (clause instanceof OmlParser.FixedBoundContext) {
                lower = signedNumber(((OmlParser.FixedBoundContext) clause).signedNumber()).doubleValue();
                upper = lower;
            } else {
                lower = Double.NEGATIVE_INFINITY;
                upper = Double.POSITIVE_INFINITY;
            }
        }
        return new VarDecl(ctx.ID().getText(), idList(ctx.idList()), domain, lower, upper, false);
    }

    @Override
    public Node visitObjective(final OmlParser.ObjectiveContext ctx) {
        final Sense sense = ctx.MIN() != null || ctx.MINIMIZE() != null ? Sense.MINIMIZE : Sense.MAXIMIZE;
        bodyDepth++;
        final Expr expr = expr(ctx.expr());
        bodyDepth--;
        return new Objective(sense, expr);
    }

    @Override
    public Node visitConstraintBlock(final OmlParser.ConstraintBlockContext ctx) {
        final List<Constraint> constraints = new ArrayList<>();
        for (final OmlParser.ConstraintContext constraint: ctx.constraint()) {
            constraints.add((Constraint) visit(constraint));
        }
        return new ConstraintBlock(constraints);
    }

    @Override
    public Node visitConstraint(final OmlParser.ConstraintContext ctx) {
        loopScopes.push(new HashSet<>());
        try {
            final List<LoopClause> loops = loopClauses(ctx.loopClause());
            final List<OmlParser.ExprContext> exprs = ctx.expr();
            final List<Expr> nameIndices = new ArrayList<>();
            headerDepth++;
            for (final OmlParser.ExprContext index: exprs.subList(0, exprs.size() - 1)) {
                nameIndices.add(expr(index));
            }
            headerDepth--;
            bodyDepth++;
            final Expr body = expr(exprs.get(exprs.size() - 1));
            bodyDepth--;
            final String name = ctx.ID() == null ? null : ctx.ID().getText();
            return new Constraint(name, nameIndices, body, loops);
        } finally {
            loopScopes.pop();
        }
    }

    /*
     * Each binding of a clause becomes its own LoopClause. A where-condition belongs to the last
     * binding of its clause, by which point every variable it may refer to is in scope.
     */
    private List<LoopClause> loopClauses(final List<OmlParser.LoopClauseContext> clauses) {
        final List<LoopClause> loops = new ArrayList<>();
        headerDepth++;
        for (final OmlParser.LoopClauseContext clause: clauses) {
            final List<OmlParser.LoopBindingContext> bindings = clause.loopBinding();
            for (int i = 0; i < bindings.size(); i++) {
                final OmlParser.LoopBindingContext binding = bindings.get(i);
                final Expr source = loopSource(binding.loopSource());
                final String variable = binding.ID().getText();
                loopScopes.element().add(variable);
                final boolean last = i == bindings.size() - 1;
                final Expr condition = last && clause.expr() != null ? expr(clause.expr()) : null;
                loops.add(new LoopClause(variable, source, condition));
            }
        }
        headerDepth--;
        return loops;
    }

    private Expr loopSource(final OmlParser.LoopSourceContext ctx) {
        if (ctx instanceof OmlParser.ColumnSourceContext) {
            final OmlParser.ColumnSourceContext column = (OmlParser.ColumnSourceContext) ctx;
            return datasetColumn(column.ID(0).getText(), column.ID(1).getText());
        }
        return setExpr(((OmlParser.SetSourceContext) ctx).setExpr());
    }

    @Override
    public Node visitParenSet(final OmlParser.ParenSetContext ctx) {
        return visit(ctx.setExpr());
    }

    @Override
    public Node visitComprehensionSet(final OmlParser.ComprehensionSetContext ctx) {
        loopScopes.push(new HashSet<>());
        headerDepth++;
        try {
            final Expr source = loopSource(ctx.loopSource());
            final String variable = ctx.ID().getText();
            loopScopes.element().add(variable);
            final Expr condition = ctx.expr() == null ? null : expr(ctx.expr());
            return new SetComprehension(new LoopClause(variable, source, condition));
        } finally {
            headerDepth--;
            loopScopes.pop();
        }
    }

    @Override
    public Node visitBraceSet(final OmlParser.BraceSetContext ctx) {
        return new SetLiteral(setElements(ctx.setElement()));
    }

    @Override
    public Node visitBracketSet(final OmlParser.BracketSetContext ctx) {
        return new SetLiteral(setElements(ctx.setElement()));
    }

    @Override
    public Node visitRangeSet(final OmlParser.RangeSetContext ctx) {
        final List<OmlParser.RangeBoundContext> bounds = ctx.rangeBound();
        final Expr step = bounds.size() > 2 ? rangeBound(bounds.get(2)) : null;
        return new RangeSet(rangeBound(bounds.get(0)), rangeBound(bounds.get(1)), step);
    }

    @Override
    public Node visitRefSet(final OmlParser.RefSetContext ctx) {
        return new SetRef(ctx.ID().getText());
    }

    @Override
    public Node visitOperationSet(final OmlParser.OperationSetContext ctx) {
        final SetOperation.Operator operator;
        switch (ctx.op.getType()) {
            case OmlParser.UNION:
                operator = SetOperation.Operator.UNION;
                break;
            case OmlParser.INTER:
                operator = SetOperation.Operator.INTERSECTION;
                break;
            default:
                operator = SetOperation.Operator.DIFFERENCE;
                break;
        }
        return new SetOperation(operator, setExpr(ctx.setExpr(0)), setExpr(ctx.setExpr(1)));
    }

    private List<Object> setElements(final List<OmlParser.SetElementContext> elements) {
        final List<Object> values = new ArrayList<>(elements.size());
        for (final OmlParser.SetElementContext element: elements) {
            if (element.signedNumber() != null) {
                values.add(signedNumber(element.signedNumber()));
            } else if (element.STRING() != null) {
                values.add(unquote(element.STRING().getText()));
            } else {
                values.add(element.ID().getText());
            }
        }
        return values;
    }

    private Expr rangeBound(final OmlParser.RangeBoundContext ctx) {
        if (ctx.signedNumber() != null) {
            return new NumberLiteral(signedNumber(ctx.signedNumber()));
        }
        return new VarRef(ctx.ID().getText());
    }

    @Override
    public Node visitParenExpr(final OmlParser.ParenExprContext ctx) {
        return visit(ctx.expr());
    }

    @Override
    public Node visitSumExpr(final OmlParser.SumExprContext ctx) {
        functionCount++;
        operationCount += 2;
        loopScopes.push(new HashSet<>());
        try {
            final List<LoopClause> loops = loopClauses(ctx.loopClause());
            return new Sum(expr(ctx.expr()), loops);
        } finally {
            loopScopes.pop();
        }
    }

    @Override
    public Node visitProdExpr(final OmlParser.ProdExprContext ctx) {
        functionCount++;
        operationCount += 2;
        loopScopes.push(new HashSet<>());
        try {
            final List<LoopClause> loops = loopClauses(ctx.loopClause());
            return new Prod(expr(ctx.expr()), loops);
        } finally {
            loopScopes.pop();
        }
    }

    @Override
    public Node visitIfExpr(final OmlParser.IfExprContext ctx) {
        conditionalCount++;
        nestingLevel++;
        headerDepth++;
        final Expr condition = expr(ctx.expr(0));
        headerDepth--;
        return new IfExpr(condition, expr(ctx.expr(1)), expr(ctx.expr(2)));
    }

    @Override
    public Node visitFunctionCallExpr(final OmlParser.FunctionCallExprContext ctx) {
        functionCount++;
        final List<Expr> arguments = ctx.expr().stream().map(this::expr).collect(Collectors.toList());
        return new FunctionCall(ctx.functionName().getText().toLowerCase(Locale.ROOT), arguments);
    }

    @Override
    public Node visitDatasetColumnExpr(final OmlParser.DatasetColumnExprContext ctx) {
        return datasetColumn(ctx.ID(0).getText(), ctx.ID(1).getText());
    }

    private DatasetColumn datasetColumn(final String table, final String column) {
        datasets.add(new DatasetReference(table, column));
        return new DatasetColumn(table, column);
    }

    @Override
    public Node visitIndexedExpr(final OmlParser.IndexedExprContext ctx) {
        final String name = ctx.ID().getText();
        headerDepth++;
        final List<Expr> indices = ctx.expr().stream().map(this::expr).collect(Collectors.toList());
        headerDepth--;
        final VarDomain domain = declaredVars.get(name);
        if (domain != null && !isLoopVariable(name)) {
            final List<String> placeholders = ctx.expr().stream().map(OmlParser.ExprContext::getText)
                                                 .collect(Collectors.toList());
            variables.add(new Variable(name, placeholders, domain));
        }
        return new IndexedRef(name, indices);
    }

    @Override
    public Node visitIdentifierExpr(final OmlParser.IdentifierExprContext ctx) {
        final String name = ctx.ID().getText();
        if (isLoopVariable(name)) {
            return new VarRef(name);
        }
        final VarDomain domain = declaredVars.get(name);
        if (domain != null) {
            variables.add(new Variable(name, List.of(), domain));
        } else if (bodyDepth > 0 && headerDepth == 0 && !declaredSets.contains(name)
                   && !declaredParams.contains(name) && !importedTables.contains(name)) {
            declareImplicitly(name);
        }
        return new VarRef(name);
    }

    private void declareImplicitly(final String name) {
        if (!implicitVars.containsKey(name)) {
            implicitVars.put(name, new VarDecl(name, List.of(), VarDomain.CONTINUOUS, 0,
                                               Double.POSITIVE_INFINITY, true));
            final String warning = String.format("Undeclared variable '%s' assumed continuous with %s >= 0",
                                                 name, name);
            LOG.info(warning);
            warnings.add(warning);
        }
        variables.add(new Variable(name, List.of(), VarDomain.CONTINUOUS));
    }

    private boolean isLoopVariable(final String name) {
        for (final Set<String> scope: loopScopes) {
            if (scope.contains(name)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public Node visitNumberExpr(final OmlParser.NumberExprContext ctx) {
        return new NumberLiteral(number(ctx.NUMBER().getText()));
    }

    @Override
    public Node visitStringExpr(final OmlParser.StringExprContext ctx) {
        return new StringLiteral(unquote(ctx.STRING().getText()));
    }

    @Override
    public Node visitPowerExpr(final OmlParser.PowerExprContext ctx) {
        operationCount++;
        return new BinaryOp(BinaryOp.Operator.POWER, expr(ctx.expr(0)), expr(ctx.expr(1)));
    }

    @Override
    public Node visitNegateExpr(final OmlParser.NegateExprContext ctx) {
        operationCount++;
        final Expr argument = expr(ctx.expr());
        // fold "-3" into a literal so that it prints and evaluates as one
        if (argument instanceof NumberLiteral) {
            final Number value = ((NumberLiteral) argument).getValue();
            return new NumberLiteral(value instanceof Long ? (Number) (-value.longValue())
                                                           : (Number) (-value.doubleValue()));
        }
        return new Negate(argument);
    }

    @Override
    public Node visitMultiplicativeExpr(final OmlParser.MultiplicativeExprContext ctx) {
        operationCount++;
        return new BinaryOp(BinaryOp.Operator.fromSymbol(ctx.op.getText()), expr(ctx.expr(0)), expr(ctx.expr(1)));
    }

    @Override
    public Node visitAdditiveExpr(final OmlParser.AdditiveExprContext ctx) {
        operationCount++;
        return new BinaryOp(BinaryOp.Operator.fromSymbol(ctx.op.getText()), expr(ctx.expr(0)), expr(ctx.expr(1)));
    }

    @Override
    public Node visitComparisonExpr(final OmlParser.ComparisonExprContext ctx) {
        operationCount++;
        return new Comparison(Comparison.Operator.fromSymbol(ctx.op.getText()), expr(ctx.expr(0)),
                              expr(ctx.expr(1)));
    }

    @Override
    public Node visitNotExpr(final OmlParser.NotExprContext ctx) {
        operationCount++;
        return new LogicOp(LogicOp.Operator.NOT, List.of(expr(ctx.expr())));
    }

    @Override
    public Node visitAndExpr(final OmlParser.AndExprContext ctx) {
        operationCount++;
        return new LogicOp(LogicOp.Operator.AND, List.of(expr(ctx.expr(0)), expr(ctx.expr(1))));
    }

    @Override
    public Node visitOrExpr(final OmlParser.OrExprContext ctx) {
        operationCount++;
        return new LogicOp(LogicOp.Operator.OR, List.of(expr(ctx.expr(0)), expr(ctx.expr(1))));
    }

    private Expr expr(final OmlParser.ExprContext ctx) {
        return (Expr) visit(ctx);
    }

    private SetExpr setExpr(final OmlParser.SetExprContext ctx) {
        return (SetExpr) visit(ctx);
    }

    private static List<String> idList(@Nullable final OmlParser.IdListContext ctx) {
        if (ctx == null) {
            return List.of();
        }
        return ctx.ID().stream().map(TerminalNode::getText).collect(Collectors.toList());
    }

    private static VarDomain domainOf(@Nullable final OmlParser.DomainContext ctx) {
        if (ctx == null || ctx.CONTINUOUS() != null) {
            return VarDomain.CONTINUOUS;
        }
        return ctx.INTEGER() != null ? VarDomain.INTEGER : VarDomain.BINARY;
    }

    private static Number signedNumber(final OmlParser.SignedNumberContext ctx) {
        final Number value = number(ctx.NUMBER().getText());
        if (ctx.getChildCount() == 1) {
            return value;
        }
        return value instanceof Long ? (Number) (-value.longValue()) : (Number) (-value.doubleValue());
    }

    /**
     * Integral literals become Longs, everything else (or anything too large for a long) a Double.
     */
    static Number number(final String text) {
        if (text.indexOf('.') < 0 && text.indexOf('e') < 0 && text.indexOf('E') < 0) {
            try {
                return Long.valueOf(text);
            } catch (final NumberFormatException e) {
                LOG.debug("Literal {} does not fit a long, using a double", text);
            }
        }
        return Double.valueOf(text);
    }

    /**
     * Strips the surrounding quotes of a string token and resolves backslash escapes.
     */
    static String unquote(final String token) {
        final String body = token.substring(1, token.length() - 1);
        final StringBuilder sb = new StringBuilder(body.length());
        for (int i = 0; i < body.length(); i++) {
            final char c = body.charAt(i);
            if (c != '\\' || i == body.length() - 1) {
                sb.append(c);
                continue;
            }
            final char next = body.charAt(++i);
            switch (next) {
                case 'n':
                    sb.append('\n');
                    break;
                case 't':
                    sb.append('\t');
                    break;
                case 'r':
                    sb.append('\r');
                    break;
                default:
                    sb.append(next);
                    break;
            }
        }
        return sb.toString();
    }
}
