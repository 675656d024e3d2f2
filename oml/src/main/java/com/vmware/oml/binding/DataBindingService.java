/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml.binding;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.io.Files;
import com.vmware.oml.BindingException;
import com.vmware.oml.ModelException;
import com.vmware.oml.ValidationException;
import com.vmware.oml.ast.Import;
import com.vmware.oml.ast.Model;
import com.vmware.oml.ast.NumberLiteral;
import com.vmware.oml.ast.ParamDecl;
import com.vmware.oml.ast.RangeSet;
import com.vmware.oml.ast.SetDecl;
import com.vmware.oml.ast.SetExpr;
import com.vmware.oml.ast.SetLiteral;
import org.jooq.Record;
import org.jooq.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves the sets and parameters a model declares against external data.
 *
 * Inputs come from two places: CSV files named by {@code import} statements, and tables supplied by
 * the caller. Caller tables win over imported ones with the same name. Sets are resolved before
 * parameters, so that indexed parameters can be densified over the full product of their index
 * sets. Inputs are only ever read: every resolved value is copied into fresh immutable collections.
 */
public class DataBindingService {
    private static final Logger LOG = LoggerFactory.getLogger(DataBindingService.class);
    private static final List<String> VALUE_COLUMNS = List.of("value", "valor", "val");

    private final boolean strict;

    /**
     * @param strict if true, a set or parameter that no input provides and that has no value in the
     *               model fails binding instead of producing a warning
     */
    public DataBindingService(final boolean strict) {
        this.strict = strict;
    }

    public DataBindingService() {
        this(false);
    }

    /**
     * Collects the inputs visible to a model: tables for its {@code import} statements, resolved
     * relative to {@code baseDirectory}, overridden by the caller's data. Tables and result sets are
     * wrapped as {@link DataTable}s; collections, maps and scalars are kept as they are.
     *
     * @return a read-only map from input name to input
     */
    public Map<String, Object> assembleInputs(final Model model, final Map<String, ?> data,
                                              @Nullable final Path baseDirectory) {
        final Map<String, Object> inputs = new LinkedHashMap<>();
        for (final Import importStmt: model.statementsOf(Import.class)) {
            final Path path = resolve(importStmt.getPath(), baseDirectory);
            final String extension = Files.getFileExtension(path.toString()).toLowerCase(Locale.ROOT);
            if (!"csv".equals(extension)) {
                LOG.warn("Ignoring import of {}: only .csv files can be imported", path);
                continue;
            }
            inputs.put(Files.getNameWithoutExtension(path.toString()), DataTables.fromCsv(path));
        }
        for (final Map.Entry<String, ?> entry: data.entrySet()) {
            inputs.put(entry.getKey(), asInput(entry.getKey(), entry.getValue()));
        }
        LOG.debug("Binding inputs: {}", inputs.keySet());
        return Collections.unmodifiableMap(inputs);
    }

    private static Path resolve(final String path, @Nullable final Path baseDirectory) {
        final Path p = Paths.get(path);
        if (p.isAbsolute() || baseDirectory == null) {
            return p;
        }
        return baseDirectory.resolve(p);
    }

    @SuppressWarnings("unchecked")
    private static Object asInput(final String name, @Nullable final Object value) {
        if (value instanceof DataTable || value instanceof Collection || value instanceof Map
                || value instanceof Number || value instanceof String) {
            return value;
        }
        if (value instanceof Result) {
            return DataTable.of((Result<? extends Record>) value);
        }
        throw new BindingException(String.format("Unsupported input for '%s': %s", name,
                                                 value == null ? "null" : value.getClass().getName()));
    }

    /**
     * Resolves every declared set and parameter of {@code model} against {@code inputs}.
     */
    public BoundValues bind(final Model model, final Map<String, ?> inputs) {
        final long start = System.nanoTime();
        final Binding binding = new Binding(inputs);
        for (final SetDecl set: model.statementsOf(SetDecl.class)) {
            binding.bindSet(set);
        }
        for (final ParamDecl param: model.statementsOf(ParamDecl.class)) {
            binding.bindParam(param);
        }
        final BoundValues bound = new BoundValues(binding.values, binding.warnings);
        LOG.info("Bound {} of {} declaration(s) in {}us, {} warning(s)", bound.names().size(),
                 model.statementsOf(SetDecl.class).size() + model.statementsOf(ParamDecl.class).size(),
                 (System.nanoTime() - start) / 1000, bound.warnings().size());
        return bound;
    }

    /**
     * State of a single call to {@link #bind}.
     */
    private final class Binding {
        private final Map<String, ?> inputs;
        private final Map<String, Object> values = new LinkedHashMap<>();
        private final Map<String, List<Object>> resolvedSets = new LinkedHashMap<>();
        private final List<BindingWarning> warnings = new ArrayList<>();

        private Binding(final Map<String, ?> inputs) {
            this.inputs = inputs;
        }

        private void warn(final String name, final String message) {
            final BindingWarning warning = new BindingWarning(name, message);
            LOG.warn("{}", warning);
            warnings.add(warning);
        }

        private void bindSet(final SetDecl decl) {
            final String name = decl.getName();
            Optional<List<Object>> elements = Optional.empty();
            final Object own = inputs.get(name);
            if (own != null) {
                elements = Optional.of(setFromInput(name, own));
            } else {
                for (final Map.Entry<String, ?> entry: inputs.entrySet()) {
                    if (entry.getValue() instanceof DataTable && ((DataTable) entry.getValue()).hasColumn(name)) {
                        LOG.debug("Set {} taken from column of table {}", name, entry.getKey());
                        elements = Optional.of(((DataTable) entry.getValue()).distinct(name));
                        break;
                    }
                }
            }
            if (elements.isEmpty()) {
                elements = literalSet(decl);
                if (elements.isEmpty()) {
                    // Sets built from other sets are left for evaluation at solve time
                    if (decl.getValue().isEmpty()) {
                        unresolved(name, "No data found for set " + name);
                    }
                    return;
                }
                resolvedSets.put(name, elements.get());
                return;
            }
            final ImmutableList<Object> list = ImmutableList.copyOf(elements.get());
            resolvedSets.put(name, list);
            values.put(name, list);
        }

        private List<Object> setFromInput(final String name, final Object input) {
            if (input instanceof DataTable) {
                final DataTable table = (DataTable) input;
                if (table.hasColumn(name)) {
                    return table.distinct(name);
                }
                if (table.indexColumns().size() == 1) {
                    return table.distinct(table.indexColumns().get(0));
                }
                if (table.columns().size() > 1) {
                    warn(name, String.format("Table %s has columns %s, using the first one for set %s",
                                             name, table.columns(), name));
                }
                return table.distinct(table.columns().get(0));
            }
            if (input instanceof Map) {
                return distinct(((Map<?, ?>) input).keySet());
            }
            if (input instanceof Collection) {
                return distinct((Collection<?>) input);
            }
            throw new ValidationException(String.format("Set '%s' cannot be bound to the scalar %s", name, input));
        }

        /*
         * Literal sets and numeric ranges in the model are resolved here too, so that parameters
         * indexed by them can be densified.
         */
        private Optional<List<Object>> literalSet(final SetDecl decl) {
            if (decl.getValue().isEmpty()) {
                return Optional.empty();
            }
            final SetExpr value = decl.getValue().get();
            if (value instanceof SetLiteral) {
                return Optional.of(distinct(((SetLiteral) value).getElements()));
            }
            if (value instanceof RangeSet) {
                final RangeSet range = (RangeSet) value;
                if (range.getStart() instanceof NumberLiteral && range.getEnd() instanceof NumberLiteral
                        && range.getStep().map(s -> s instanceof NumberLiteral).orElse(true)) {
                    final Number step = range.getStep().map(s -> ((NumberLiteral) s).getValue()).orElse(1L);
                    return Optional.of(Ranges.inclusive(((NumberLiteral) range.getStart()).getValue(),
                                                        ((NumberLiteral) range.getEnd()).getValue(), step));
                }
            }
            return Optional.empty();
        }

        private void bindParam(final ParamDecl decl) {
            final String name = decl.getName();
            final Object own = inputs.get(name);
            if (own != null) {
                final Object value = paramFromInput(decl, own);
                if (value != null) {
                    values.put(name, value);
                    return;
                }
                LOG.debug("Parameter {} has an empty value under its own name", name);
            }
            for (final Map.Entry<String, ?> entry: inputs.entrySet()) {
                if (!(entry.getValue() instanceof DataTable) || !((DataTable) entry.getValue()).hasColumn(name)
                        || entry.getValue() == own) {
                    continue;
                }
                try {
                    final Object value = paramFromTable(decl, (DataTable) entry.getValue());
                    if (value == null) {
                        LOG.debug("Parameter {} is empty in table {}, trying other tables", name, entry.getKey());
                        continue;
                    }
                    values.put(name, value);
                    LOG.debug("Parameter {} taken from table {}", name, entry.getKey());
                    return;
                } catch (final ModelException e) {
                    LOG.warn("Could not extract parameter {} from table {}, trying other tables: {}",
                             name, entry.getKey(), e.getMessage());
                }
            }
            if (decl.getDefaultValue().isPresent()) {
                LOG.debug("Parameter {} uses its declared default {}", name, decl.getDefaultValue().get());
                return;
            }
            unresolved(name, "No data found for parameter " + name + ", using 0");
        }

        private void unresolved(final String name, final String message) {
            if (strict) {
                throw new BindingException(message);
            }
            warn(name, message);
        }

        /*
         * Returns null when a scalar is found but its cell is empty.
         */
        @Nullable
        private Object paramFromInput(final ParamDecl decl, final Object input) {
            final String name = decl.getName();
            if (!decl.isIndexed()) {
                if (input instanceof Number) {
                    return Keys.normalize(input);
                }
                if (input instanceof String) {
                    return input;
                }
                throw new ValidationException(String.format("Parameter '%s' is a scalar but was given %s",
                                                            name, describe(input)));
            }
            if (input instanceof DataTable) {
                return paramFromTable(decl, (DataTable) input);
            }
            if (input instanceof Map) {
                final Map<List<Object>, Object> entries = new LinkedHashMap<>();
                flatten((Map<?, ?>) input, decl.getIndices().size(), new ArrayList<>(), entries, name);
                return shape(decl, entries);
            }
            throw new ValidationException(String.format("Parameter '%s' is indexed by %s but was given %s",
                                                        name, decl.getIndices(), describe(input)));
        }

        @Nullable
        private Object paramFromTable(final ParamDecl decl, final DataTable table) {
            final String name = decl.getName();
            if (!decl.isIndexed()) {
                final String column = table.resolveColumn(name).orElseThrow(
                        () -> new BindingException("No column " + name + " in " + table));
                if (table.rowCount() == 0) {
                    throw new BindingException("Table for parameter " + name + " is empty");
                }
                if (table.rowCount() > 1) {
                    warn(name, "Scalar parameter " + name + " found in a table with " + table.rowCount()
                               + " rows, using the first");
                }
                return table.value(0, column);
            }
            final TableLayout layout = layout(decl, table);
            final Map<List<Object>, Object> entries = new LinkedHashMap<>();
            for (int row = 0; row < table.rowCount(); row++) {
                final Object value = table.value(row, layout.valueColumn);
                if (value == null) {
                    continue;
                }
                final List<Object> key = new ArrayList<>(layout.keyColumns.size());
                for (final String keyColumn: layout.keyColumns) {
                    key.add(table.value(row, keyColumn));
                }
                if (entries.put(key, value) != null) {
                    LOG.debug("Duplicate key {} for parameter {}, keeping the last value", key, name);
                }
            }
            return shape(decl, entries);
        }

        /*
         * Key columns are the declared index names that exist as columns (or the table's own index),
         * topped up in column order. The value column is the one named like the parameter, then one
         * of the conventional value names, then whatever single column is left.
         */
        private TableLayout layout(final ParamDecl decl, final DataTable table) {
            final String name = decl.getName();
            final int arity = decl.getIndices().size();
            final List<String> keys = new ArrayList<>();
            if (table.indexColumns().size() == arity) {
                keys.addAll(table.indexColumns());
            } else {
                for (final String index: decl.getIndices()) {
                    table.resolveColumn(index).ifPresent(keys::add);
                }
            }
            final List<String> candidates = new ArrayList<>(table.columns());
            candidates.removeAll(keys);
            String valueColumn = table.resolveColumn(name).filter(candidates::contains).orElse(null);
            if (valueColumn == null) {
                for (final String conventional: VALUE_COLUMNS) {
                    final Optional<String> found = table.resolveColumn(conventional).filter(candidates::contains);
                    if (found.isPresent()) {
                        valueColumn = found.get();
                        break;
                    }
                }
            }
            if (valueColumn != null) {
                candidates.remove(valueColumn);
            }
            while (keys.size() < arity && !candidates.isEmpty()) {
                keys.add(candidates.remove(0));
            }
            if (keys.size() < arity) {
                throw new BindingException(String.format("Table with columns %s has too few columns for %s%s",
                                                         table.columns(), name, decl.getIndices()));
            }
            if (valueColumn == null) {
                if (candidates.isEmpty()) {
                    throw new BindingException(String.format("Table with columns %s has no value column for %s",
                                                             table.columns(), name));
                }
                valueColumn = candidates.get(0);
                if (candidates.size() > 1) {
                    warn(name, String.format("Several candidate value columns %s for %s, using %s",
                                             candidates, name, valueColumn));
                }
            }
            LOG.debug("Parameter {}: keys {} value {}", name, keys, valueColumn);
            return new TableLayout(keys, valueColumn);
        }

        private void flatten(final Map<?, ?> map, final int arity, final List<Object> prefix,
                             final Map<List<Object>, Object> out, final String name) {
            for (final Map.Entry<?, ?> entry: map.entrySet()) {
                final List<Object> key = new ArrayList<>(prefix);
                if (entry.getKey() instanceof List) {
                    key.addAll(Keys.normalizeAll((List<?>) entry.getKey()));
                } else {
                    key.add(Keys.normalize(entry.getKey()));
                }
                if (key.size() < arity && entry.getValue() instanceof Map) {
                    flatten((Map<?, ?>) entry.getValue(), arity, key, out, name);
                } else if (key.size() == arity) {
                    if (entry.getValue() != null) {
                        out.put(key, Keys.normalize(entry.getValue()));
                    }
                } else {
                    throw new ValidationException(String.format("Key %s of parameter '%s' does not match %d index(es)",
                                                                key, name, arity));
                }
            }
        }

        /*
         * Densifies onto the product of the index sets when all of them are known, then nests one
         * map level per index.
         */
        private Object shape(final ParamDecl decl, final Map<List<Object>, Object> entries) {
            final String name = decl.getName();
            final List<List<Object>> axes = new ArrayList<>();
            for (final String index: decl.getIndices()) {
                final List<Object> set = resolvedSets.get(index);
                if (set == null) {
                    LOG.debug("Parameter {} is not densified: index {} is not a resolved set", name, index);
                    return nest(entries);
                }
                axes.add(set);
            }
            final List<List<Object>> product = Lists.cartesianProduct(axes);
            boolean overlaps = false;
            for (final List<Object> key: product) {
                if (entries.containsKey(key)) {
                    overlaps = true;
                    break;
                }
            }
            if (!overlaps && !product.isEmpty()) {
                throw new BindingException(String.format("Data for %s%s does not match any element of %s",
                                                         name, decl.getIndices(), decl.getIndices()));
            }
            final Object fill = decl.getDefaultValue().filter(Number.class::isInstance).map(Keys::normalize)
                                    .orElse(0L);
            final Map<List<Object>, Object> dense = new LinkedHashMap<>();
            int filled = 0;
            for (final List<Object> key: product) {
                final Object value = entries.get(key);
                if (value == null) {
                    filled++;
                }
                dense.put(key, value == null ? fill : value);
            }
            final int dropped = entries.size() - (product.size() - filled);
            if (dropped > 0) {
                LOG.debug("Parameter {}: {} entries outside of {} dropped", name, dropped, decl.getIndices());
            }
            if (filled > 0) {
                LOG.debug("Parameter {}: {} missing entries filled with {}", name, filled, fill);
            }
            return nest(dense);
        }
    }

    /**
     * Turns {@code (a, b) -> v} entries into {@code a -> (b -> v)}, preserving key order at every level.
     */
    @VisibleForTesting
    static ImmutableMap<Object, Object> nest(final Map<List<Object>, Object> entries) {
        final Map<Object, Object> root = new LinkedHashMap<>();
        for (final Map.Entry<List<Object>, Object> entry: entries.entrySet()) {
            final List<Object> key = entry.getKey();
            Map<Object, Object> level = root;
            for (int i = 0; i < key.size() - 1; i++) {
                @SuppressWarnings("unchecked")
                final Map<Object, Object> next = (Map<Object, Object>) level.computeIfAbsent(key.get(i),
                        k -> new LinkedHashMap<>());
                level = next;
            }
            level.put(key.get(key.size() - 1), entry.getValue());
        }
        return freeze(root);
    }

    private static ImmutableMap<Object, Object> freeze(final Map<Object, Object> map) {
        final ImmutableMap.Builder<Object, Object> builder = ImmutableMap.builder();
        for (final Map.Entry<Object, Object> entry: map.entrySet()) {
            if (entry.getValue() instanceof LinkedHashMap) {
                @SuppressWarnings("unchecked")
                final Map<Object, Object> inner = (Map<Object, Object>) entry.getValue();
                builder.put(entry.getKey(), freeze(inner));
            } else {
                builder.put(entry.getKey(), entry.getValue());
            }
        }
        return builder.build();
    }

    private static List<Object> distinct(final Collection<?> values) {
        final Set<Object> set = new LinkedHashSet<>(Keys.normalizeAll(values));
        set.remove(null);
        return new ArrayList<>(set);
    }

    private static String describe(final Object input) {
        if (input instanceof DataTable) {
            return "a table";
        }
        if (input instanceof Map) {
            return "a mapping";
        }
        if (input instanceof Collection) {
            return "a list";
        }
        return "the value " + input;
    }

    private static final class TableLayout {
        private final List<String> keyColumns;
        private final String valueColumn;

        private TableLayout(final List<String> keyColumns, final String valueColumn) {
            this.keyColumns = keyColumns;
            this.valueColumn = valueColumn;
        }
    }
}
