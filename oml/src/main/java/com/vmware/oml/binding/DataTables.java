/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml.binding;

import com.google.common.base.Preconditions;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.vmware.oml.BindingException;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.Record;
import org.jooq.Result;
import org.jooq.SQLDialect;
import org.jooq.exception.DataAccessException;
import org.jooq.impl.DSL;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Factory methods for {@link DataTable}s: from CSV text or files, from database tables through jOOQ,
 * and from rows supplied in code.
 */
public final class DataTables {
    private static final Logger LOG = LoggerFactory.getLogger(DataTables.class);
    private static final Pattern INTEGRAL = Pattern.compile("[+-]?[0-9]+");
    private static final Pattern DECIMAL = Pattern.compile("[+-]?([0-9]+\\.?[0-9]*|\\.[0-9]+)([eE][+-]?[0-9]+)?");

    private DataTables() {
    }

    public static DataTable fromResult(final Result<? extends Record> result) {
        return DataTable.of(result);
    }

    /**
     * Reads CSV text whose first line holds the column names. Cells that look like numbers become
     * Longs or Doubles, empty cells become nulls, everything else stays a trimmed String.
     */
    public static DataTable fromCsv(final String csv) {
        final Result<Record> raw;
        try {
            raw = DSL.using(SQLDialect.DEFAULT).fetchFromCSV(csv);
        } catch (final DataAccessException e) {
            throw new BindingException("Could not parse CSV data", e);
        }
        final List<String> columns = new ArrayList<>();
        for (final Field<?> field: raw.fields()) {
            columns.add(field.getName().trim());
        }
        final Builder builder = new Builder(columns);
        for (final Record record: raw) {
            final Object[] values = new Object[columns.size()];
            for (int i = 0; i < values.length; i++) {
                values[i] = coerce(record.get(i));
            }
            builder.row(values);
        }
        return builder.build();
    }

    public static DataTable fromCsv(final Path file) {
        try {
            final String content = Files.readString(file, StandardCharsets.UTF_8);
            final DataTable table = fromCsv(content);
            LOG.debug("Read {} row(s) with columns {} from {}", table.rowCount(), table.columns(), file);
            return table;
        } catch (final IOException e) {
            throw new BindingException("Could not read " + file, e);
        }
    }

    /**
     * Fetches every row of a database table.
     */
    public static DataTable fromDatabase(final DSLContext conn, final String tableName) {
        final Result<Record> result = conn.selectFrom(DSL.table(DSL.unquotedName(tableName))).fetch();
        return DataTable.of(result);
    }

    /**
     * A two column table holding the entries of a map.
     */
    public static DataTable fromMap(final String keyColumn, final String valueColumn, final Map<?, ?> entries) {
        final Builder builder = builder(keyColumn, valueColumn);
        entries.forEach((k, v) -> builder.row(k, v));
        return builder.build().withIndex(keyColumn);
    }

    /**
     * A single column table.
     */
    public static DataTable fromValues(final String column, final Collection<?> values) {
        final Builder builder = builder(column);
        values.forEach(value -> builder.row(value));
        return builder.build();
    }

    public static Builder builder(final String... columns) {
        return new Builder(List.of(columns));
    }

    @Nullable
    private static Object coerce(@Nullable final Object cell) {
        if (!(cell instanceof String)) {
            return cell;
        }
        final String text = ((String) cell).trim();
        if (text.isEmpty()) {
            return null;
        }
        if (INTEGRAL.matcher(text).matches()) {
            try {
                return Long.valueOf(text);
            } catch (final NumberFormatException e) {
                return Double.valueOf(text);
            }
        }
        if (DECIMAL.matcher(text).matches()) {
            return Double.valueOf(text);
        }
        return text;
    }

    /**
     * Builds a table row by row.
     */
    public static final class Builder {
        private final DSLContext ctx = DSL.using(SQLDialect.DEFAULT);
        private final Field<?>[] fields;
        private final Result<Record> result;
        private final List<String> index = new ArrayList<>();

        private Builder(final List<String> columns) {
            Preconditions.checkArgument(!columns.isEmpty(), "A table needs at least one column");
            this.fields = columns.stream().map(c -> DSL.field(DSL.name(c))).toArray(Field<?>[]::new);
            this.result = ctx.newResult(fields);
        }

        @CanIgnoreReturnValue
        public Builder row(final Object... values) {
            Preconditions.checkArgument(values.length == fields.length,
                                        "Expected %s values but got %s", fields.length, values.length);
            final Record record = ctx.newRecord(fields);
            record.fromArray(values);
            result.add(record);
            return this;
        }

        @CanIgnoreReturnValue
        public Builder index(final String... columns) {
            index.addAll(List.of(columns));
            return this;
        }

        public DataTable build() {
            return new DataTable(result.into(fields), index);
        }
    }
}
