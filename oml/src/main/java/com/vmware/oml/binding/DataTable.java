/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml.binding;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import org.jooq.Field;
import org.jooq.Record;
import org.jooq.Result;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * A read-only, column-addressed view over a jOOQ {@link Result}. Values read through the view are
 * normalized with {@link Keys#normalize}. The view never writes to the underlying result, and
 * {@link #withIndex} returns a new view rather than changing this one.
 *
 * Column lookups are exact first and case-insensitive second, since databases like H2 report
 * unquoted identifiers in upper case.
 */
public final class DataTable {
    private final Result<? extends Record> result;
    private final ImmutableList<String> columns;
    private final ImmutableList<String> indexColumns;

    DataTable(final Result<? extends Record> result, final List<String> indexColumns) {
        this.result = result;
        final List<String> names = new ArrayList<>();
        for (final Field<?> field: result.fields()) {
            names.add(field.getName());
        }
        this.columns = ImmutableList.copyOf(names);
        for (final String index: indexColumns) {
            Preconditions.checkArgument(resolveColumn(index).isPresent(),
                                        "Index column %s is not one of %s", index, columns);
        }
        this.indexColumns = ImmutableList.copyOf(indexColumns);
    }

    /**
     * Wraps a copy of {@code result}, so later changes to the caller's records are not seen.
     */
    public static DataTable of(final Result<? extends Record> result) {
        return new DataTable(result.into(result.fields()), List.of());
    }

    /**
     * Returns a view of the same rows that declares the given columns as its index, in order.
     */
    public DataTable withIndex(final String... indexColumns) {
        return new DataTable(result, Arrays.asList(indexColumns));
    }

    public ImmutableList<String> columns() {
        return columns;
    }

    public ImmutableList<String> indexColumns() {
        return indexColumns;
    }

    public int rowCount() {
        return result.size();
    }

    public boolean hasColumn(final String name) {
        return resolveColumn(name).isPresent();
    }

    /**
     * Finds the actual name of a column, matching exactly if possible and ignoring case otherwise.
     */
    public Optional<String> resolveColumn(final String name) {
        if (columns.contains(name)) {
            return Optional.of(name);
        }
        final String lower = name.toLowerCase(Locale.ROOT);
        return columns.stream().filter(c -> c.toLowerCase(Locale.ROOT).equals(lower)).findFirst();
    }

    /**
     * All values of a column, in row order.
     */
    public List<Object> column(final String name) {
        final int position = position(name);
        final List<Object> values = new ArrayList<>(result.size());
        for (final Record record: result) {
            values.add(Keys.normalize(record.get(position)));
        }
        return values;
    }

    /**
     * Distinct non-null values of a column, in order of first appearance.
     */
    public List<Object> distinct(final String name) {
        final Set<Object> values = new LinkedHashSet<>();
        for (final Object value: column(name)) {
            if (value != null) {
                values.add(value);
            }
        }
        return new ArrayList<>(values);
    }

    @Nullable
    public Object value(final int row, final String column) {
        return Keys.normalize(result.get(row).get(position(column)));
    }

    private int position(final String name) {
        final String actual = resolveColumn(name).orElseThrow(
                () -> new IllegalArgumentException("No column " + name + " in " + columns));
        return columns.indexOf(actual);
    }

    @Override
    public String toString() {
        return "DataTable{" +
                "columns=" + columns +
                ", indexColumns=" + indexColumns +
                ", rows=" + result.size() +
                '}';
    }
}
