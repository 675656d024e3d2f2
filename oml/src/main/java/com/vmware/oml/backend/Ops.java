/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml.backend;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.math.LongMath;
import com.vmware.oml.TranslationException;
import com.vmware.oml.ast.Sense;
import com.vmware.oml.binding.BoundValues;
import com.vmware.oml.binding.DataTable;
import com.vmware.oml.binding.Keys;
import com.vmware.oml.binding.Ranges;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * The only runtime surface available to a model program. Everything a model can do, reading its
 * data, iterating over sets, doing arithmetic and building a {@link Problem}, goes through an instance
 * of this class, which only sees the values bound for one compile call.
 *
 * Runtime values are Longs, Doubles, Strings and Booleans for data, Lists for sets, nested Maps for
 * indexed parameters, and {@link DecisionVariable}, {@link VarFamily}, {@link Affine} and
 * {@link Relation} for anything that involves decision variables.
 */
public final class Ops {
    private static final Logger LOG = LoggerFactory.getLogger(Ops.class);
    private static final Set<String> FUNCTIONS = ImmutableSet.of("abs", "min", "max", "sqrt", "floor", "ceil",
                                                                 "round", "exp", "log", "pow");

    private final BoundValues bound;
    private final Map<String, ?> inputs;
    private final List<String> warnings = new ArrayList<>();
    private boolean strictComparisonWarned = false;

    public Ops(final BoundValues bound, final Map<String, ?> inputs) {
        this.bound = bound;
        this.inputs = inputs;
    }

    /**
     * Whether {@code name} is one of the functions {@link #call} accepts.
     */
    public static boolean isFunction(final String name) {
        return FUNCTIONS.contains(name.toLowerCase(Locale.ROOT));
    }

    public Problem newProblem(final String name, final Sense sense) {
        return new Problem(name, sense);
    }

    public List<String> warnings() {
        return ImmutableList.copyOf(warnings);
    }

    private void warn(final String message) {
        LOG.warn(message);
        warnings.add(message);
    }

    /**
     * Resolves a set from the bound values, then from a same-named column of an imported table,
     * then from the literal in the model.
     */
    public List<Object> set(final String name, final List<String> importedTables,
                            @Nullable final Supplier<List<Object>> literal) {
        final Object value = bound.get(name).orElse(null);
        if (value != null) {
            return elements(value);
        }
        for (final String tableName: importedTables) {
            final Object table = inputs.get(tableName);
            if (table instanceof DataTable && ((DataTable) table).hasColumn(name)) {
                return ((DataTable) table).distinct(name);
            }
        }
        if (literal != null) {
            return literal.get();
        }
        warn("Set " + name + " has no data, it is empty");
        return List.of();
    }

    /**
     * Resolves a parameter from the bound values, then from a same-named column of an imported
     * table, then from its declared default, and finally falls back to 0.
     *
     * @param indices names of the sets indexing the parameter, empty for a scalar
     */
    public Object param(final String name, final List<String> importedTables, final List<String> indices,
                        @Nullable final Object defaultValue) {
        final Object value = bound.get(name).orElse(null);
        if (value != null) {
            return value;
        }
        for (final String tableName: importedTables) {
            final Object input = inputs.get(tableName);
            if (!(input instanceof DataTable) || !((DataTable) input).hasColumn(name)) {
                continue;
            }
            final DataTable table = (DataTable) input;
            if (indices.isEmpty() && table.rowCount() > 0) {
                return table.value(0, name);
            }
            if (!indices.isEmpty() && indices.stream().allMatch(table::hasColumn)) {
                return fromTable(table, name, indices);
            }
        }
        if (defaultValue != null) {
            return Keys.normalize(defaultValue);
        }
        return 0L;
    }

    private static Map<Object, Object> fromTable(final DataTable table, final String name,
                                                 final List<String> indices) {
        final Map<Object, Object> root = new LinkedHashMap<>();
        for (int row = 0; row < table.rowCount(); row++) {
            Map<Object, Object> level = root;
            for (int i = 0; i < indices.size() - 1; i++) {
                @SuppressWarnings("unchecked")
                final Map<Object, Object> next = (Map<Object, Object>) level.computeIfAbsent(
                        table.value(row, indices.get(i)), k -> new LinkedHashMap<>());
                level = next;
            }
            level.put(table.value(row, indices.get(indices.size() - 1)), table.value(row, name));
        }
        return root;
    }

    /**
     * Distinct values of a column of an input table.
     */
    public List<Object> column(final String tableName, final String column) {
        final Object input = inputs.get(tableName);
        if (!(input instanceof DataTable)) {
            throw new TranslationException("No table named " + tableName);
        }
        final DataTable table = (DataTable) input;
        if (!table.hasColumn(column)) {
            throw new TranslationException("Table " + tableName + " has no column " + column);
        }
        return table.distinct(column);
    }

    public List<Object> list(final Object... elements) {
        return ImmutableList.copyOf(new LinkedHashSet<>(Keys.normalizeAll(Arrays.asList(elements))));
    }

    public List<Object> range(final Object start, final Object end, @Nullable final Object step) {
        return Ranges.inclusive(number(start), number(end), step == null ? 1L : number(step));
    }

    public List<Object> union(final Object left, final Object right) {
        final Set<Object> result = new LinkedHashSet<>(elements(left));
        result.addAll(elements(right));
        return new ArrayList<>(result);
    }

    public List<Object> intersect(final Object left, final Object right) {
        final Set<Object> other = new LinkedHashSet<>(elements(right));
        return elements(left).stream().filter(other::contains).collect(Collectors.toList());
    }

    public List<Object> difference(final Object left, final Object right) {
        final Set<Object> other = new LinkedHashSet<>(elements(right));
        return elements(left).stream().filter(e -> !other.contains(e)).collect(Collectors.toList());
    }

    /**
     * The elements of {@code source} for which {@code condition} holds.
     */
    public List<Object> where(final Object source, final Function<Object, Object> condition) {
        final List<Object> kept = new ArrayList<>();
        for (final Object element: elements(source)) {
            if (test(condition.apply(element))) {
                kept.add(element);
            }
        }
        return kept;
    }

    /**
     * Sums {@code body} over {@code source}. The result is a number when every term is a number and an
     * {@link Affine} expression otherwise.
     */
    public Object sum(final Object source, final Function<Object, Object> body) {
        final Affine.Builder linear = new Affine.Builder();
        boolean isLinear = false;
        Object numeric = 0L;
        for (final Object element: elements(source)) {
            final Object term = body.apply(element);
            if (Affine.isLinear(term)) {
                linear.add(term);
                isLinear = true;
            } else {
                numeric = add(numeric, term);
            }
        }
        if (!isLinear) {
            return numeric;
        }
        return linear.add(numeric).build();
    }

    /**
     * Multiplies {@code body} over {@code source}. Only defined for data, since a product of
     * decision variables is not linear.
     */
    public Object prod(final Object source, final Function<Object, Object> body) {
        Object product = 1L;
        for (final Object element: elements(source)) {
            final Object factor = body.apply(element);
            if (Affine.isLinear(factor)) {
                throw new TranslationException("prod over decision variables is not linear: " + factor);
            }
            product = mul(product, factor);
        }
        return product;
    }

    /**
     * Looks up {@code keys} in an indexed parameter or a variable family. Scalars ignore the keys, so
     * that a parameter left at its scalar default can still be indexed.
     */
    public Object index(final Object container, final Object... keys) {
        if (container instanceof VarFamily) {
            return ((VarFamily) container).get(keys);
        }
        if (container instanceof Map) {
            Object current = container;
            for (final Object key: keys) {
                if (!(current instanceof Map)) {
                    throw new TranslationException("Too many indices " + Arrays.toString(keys));
                }
                final Object next = ((Map<?, ?>) current).get(Keys.normalize(key));
                if (next == null) {
                    throw new TranslationException("No value for index " + Arrays.toString(keys));
                }
                current = next;
            }
            return current;
        }
        if (container instanceof Number || container instanceof String) {
            return container;
        }
        throw new TranslationException("Cannot index " + Affine.describe(container));
    }

    public Object add(final Object left, final Object right) {
        if (left instanceof Long && right instanceof Long) {
            try {
                return Math.addExact((Long) left, (Long) right);
            } catch (final ArithmeticException e) {
                return ((Long) left).doubleValue() + (Long) right;
            }
        }
        if (left instanceof Number && right instanceof Number) {
            return ((Number) left).doubleValue() + ((Number) right).doubleValue();
        }
        return Affine.from(left).plus(Affine.from(right));
    }

    public Object sub(final Object left, final Object right) {
        if (left instanceof Long && right instanceof Long) {
            try {
                return Math.subtractExact((Long) left, (Long) right);
            } catch (final ArithmeticException e) {
                return ((Long) left).doubleValue() - (Long) right;
            }
        }
        if (left instanceof Number && right instanceof Number) {
            return ((Number) left).doubleValue() - ((Number) right).doubleValue();
        }
        return Affine.from(left).minus(Affine.from(right));
    }

    public Object mul(final Object left, final Object right) {
        if (left instanceof Long && right instanceof Long) {
            try {
                return Math.multiplyExact((Long) left, (Long) right);
            } catch (final ArithmeticException e) {
                return ((Long) left).doubleValue() * (Long) right;
            }
        }
        if (left instanceof Number && right instanceof Number) {
            return ((Number) left).doubleValue() * ((Number) right).doubleValue();
        }
        final Affine l = Affine.from(left);
        final Affine r = Affine.from(right);
        if (l.isConstant()) {
            return r.scale(l.constant());
        }
        if (r.isConstant()) {
            return l.scale(r.constant());
        }
        throw new TranslationException("Product of decision variables is not linear: (" + l + ") * (" + r + ")");
    }

    public Object div(final Object left, final Object right) {
        final Affine divisor = Affine.from(right);
        if (!divisor.isConstant()) {
            throw new TranslationException("Division by a decision variable is not linear: " + divisor);
        }
        if (divisor.constant() == 0) {
            throw new TranslationException("Division by zero");
        }
        if (left instanceof Number) {
            return ((Number) left).doubleValue() / divisor.constant();
        }
        return Affine.from(left).scale(1 / divisor.constant());
    }

    public Object mod(final Object left, final Object right) {
        final Number l = number(left);
        final Number r = number(right);
        if (r.doubleValue() == 0) {
            throw new TranslationException("Modulo by zero");
        }
        if (l instanceof Long && r instanceof Long) {
            return Math.floorMod((Long) l, (Long) r);
        }
        final double d = r.doubleValue();
        return l.doubleValue() - Math.floor(l.doubleValue() / d) * d;
    }

    public Object pow(final Object base, final Object exponent) {
        final Number e = number(exponent);
        if (Affine.isLinear(base)) {
            if (e.doubleValue() == 1) {
                return base;
            }
            throw new TranslationException("Power of a decision variable is not linear: " + base + " ^ " + e);
        }
        final Number b = number(base);
        if (b instanceof Long && e instanceof Long && (Long) e >= 0 && (Long) e <= Integer.MAX_VALUE) {
            try {
                return LongMath.checkedPow((Long) b, ((Long) e).intValue());
            } catch (final ArithmeticException overflow) {
                return Math.pow(b.doubleValue(), e.doubleValue());
            }
        }
        return Math.pow(b.doubleValue(), e.doubleValue());
    }

    public Object neg(final Object value) {
        if (value instanceof Long) {
            return value.equals(Long.MIN_VALUE) ? (Object) (-((Long) value).doubleValue()) : (Object) (-(Long) value);
        }
        if (value instanceof Number) {
            return -((Number) value).doubleValue();
        }
        return Affine.from(value).scale(-1);
    }

    public Object le(final Object left, final Object right) {
        if (isLinear(left, right)) {
            return Relation.of(left, right, Relation.Kind.LESS_OR_EQUAL);
        }
        return compare(left, right) <= 0;
    }

    public Object ge(final Object left, final Object right) {
        if (isLinear(left, right)) {
            return Relation.of(left, right, Relation.Kind.GREATER_OR_EQUAL);
        }
        return compare(left, right) >= 0;
    }

    public Object eq(final Object left, final Object right) {
        if (isLinear(left, right)) {
            return Relation.of(left, right, Relation.Kind.EQUAL);
        }
        return equal(left, right);
    }

    public Object ne(final Object left, final Object right) {
        if (isLinear(left, right)) {
            throw new TranslationException("'!=' cannot be used between linear expressions: " + left + " != " + right);
        }
        return !equal(left, right);
    }

    /**
     * Strict comparisons of linear expressions are relaxed to their non-strict form.
     */
    public Object lt(final Object left, final Object right) {
        if (isLinear(left, right)) {
            relaxed("<");
            return Relation.of(left, right, Relation.Kind.LESS_OR_EQUAL);
        }
        return compare(left, right) < 0;
    }

    public Object gt(final Object left, final Object right) {
        if (isLinear(left, right)) {
            relaxed(">");
            return Relation.of(left, right, Relation.Kind.GREATER_OR_EQUAL);
        }
        return compare(left, right) > 0;
    }

    private void relaxed(final String operator) {
        if (!strictComparisonWarned) {
            strictComparisonWarned = true;
            warn("Strict comparison '" + operator + "' between linear expressions is treated as '"
                 + operator + "='");
        }
    }

    public boolean and(final Object left, final Object right) {
        return test(left) && test(right);
    }

    public boolean or(final Object left, final Object right) {
        return test(left) || test(right);
    }

    public boolean not(final Object value) {
        return !test(value);
    }

    /**
     * The truth value of a condition. Conditions are evaluated while the problem is built, so they
     * cannot depend on decision variables.
     */
    public boolean test(final Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue() != 0;
        }
        if (value instanceof Relation || Affine.isLinear(value)) {
            throw new TranslationException("Conditions cannot depend on decision variables: " + value);
        }
        throw new TranslationException("Not a condition: " + Affine.describe(value));
    }

    public Object ifThenElse(final Object condition, final Supplier<Object> then, final Supplier<Object> otherwise) {
        return test(condition) ? then.get() : otherwise.get();
    }

    /**
     * Calls one of the allowed numeric functions. Only {@code min} and {@code max} accept any number
     * of arguments.
     */
    public Object call(final String function, final Object... args) {
        final String name = function.toLowerCase(Locale.ROOT);
        if (!isFunction(name)) {
            throw new TranslationException("Unknown function " + function);
        }
        for (final Object arg: args) {
            if (Affine.isLinear(arg)) {
                throw new TranslationException("Function " + name + " cannot be applied to decision variables");
            }
        }
        switch (name) {
            case "min":
            case "max":
                return minMax(name, args);
            case "pow":
                checkArity(name, args, 2);
                return pow(args[0], args[1]);
            default:
                break;
        }
        checkArity(name, args, 1);
        final Number x = number(args[0]);
        switch (name) {
            case "abs":
                return x instanceof Long ? (Object) Math.abs((Long) x) : (Object) Math.abs(x.doubleValue());
            case "sqrt":
                return Math.sqrt(x.doubleValue());
            case "floor":
                return Keys.normalize(Math.floor(x.doubleValue()));
            case "ceil":
                return Keys.normalize(Math.ceil(x.doubleValue()));
            case "round":
                return Math.round(x.doubleValue());
            case "exp":
                return Math.exp(x.doubleValue());
            default:
                return Math.log(x.doubleValue());
        }
    }

    private Object minMax(final String name, final Object... args) {
        final List<Object> values = new ArrayList<>();
        for (final Object arg: args) {
            if (arg instanceof Collection || arg instanceof Map) {
                values.addAll(elements(arg));
            } else {
                values.add(arg);
            }
        }
        if (values.isEmpty()) {
            throw new TranslationException(name + " of nothing");
        }
        Object best = values.get(0);
        for (final Object value: values.subList(1, values.size())) {
            final int c = compare(value, best);
            if ("min".equals(name) ? c < 0 : c > 0) {
                best = value;
            }
        }
        return best;
    }

    private static void checkArity(final String name, final Object[] args, final int expected) {
        if (args.length != expected) {
            throw new TranslationException(String.format("%s expects %d argument(s) but got %d",
                                                         name, expected, args.length));
        }
    }

    /**
     * Label of one instance of a constraint, {@code name[a,b]}.
     */
    public String label(final String name, final Object... keys) {
        if (keys.length == 0) {
            return name;
        }
        return name + Arrays.stream(keys).map(String::valueOf).collect(Collectors.joining(",", "[", "]"));
    }

    public Object unsupported(final String construct) {
        throw new TranslationException("Unsupported construct: " + construct);
    }

    /**
     * The elements of a set-like value, normalized.
     */
    public List<Object> elements(final Object value) {
        if (value instanceof Map) {
            return Keys.normalizeAll(((Map<?, ?>) value).keySet());
        }
        if (value instanceof Collection) {
            return Keys.normalizeAll((Collection<?>) value);
        }
        throw new TranslationException("Not a set: " + Affine.describe(value));
    }

    private static boolean isLinear(final Object left, final Object right) {
        return Affine.isLinear(left) || Affine.isLinear(right);
    }

    private static Number number(final Object value) {
        if (value instanceof Number) {
            return (Number) Keys.normalize(value);
        }
        if (value instanceof Affine && ((Affine) value).isConstant()) {
            return (Number) Keys.normalize(((Affine) value).constant());
        }
        throw new TranslationException("Expected a number but found " + Affine.describe(value));
    }

    private static boolean equal(final Object left, final Object right) {
        if (left instanceof Number && right instanceof Number) {
            return ((Number) left).doubleValue() == ((Number) right).doubleValue();
        }
        return left.equals(right);
    }

    private static int compare(final Object left, final Object right) {
        if (left instanceof Number && right instanceof Number) {
            return Double.compare(((Number) left).doubleValue(), ((Number) right).doubleValue());
        }
        if (left instanceof String && right instanceof String) {
            return ((String) left).compareTo((String) right);
        }
        throw new TranslationException("Cannot compare " + Affine.describe(left) + " with "
                                       + Affine.describe(right));
    }
}
