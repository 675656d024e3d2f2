/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml.binding;

import com.vmware.oml.BindingException;
import org.jooq.DSLContext;
import org.jooq.Record;
import org.jooq.Result;
import org.jooq.impl.DSL;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class DataTablesTest {

    static {
        System.getProperties().setProperty("org.jooq.no-logo", "true");
    }

    @Test
    public void testCsvCoercion() {
        final DataTable table = DataTables.fromCsv("name, qty,price\nA, 3, 1.5\nB,,2\n");
        assertEquals(List.of("name", "qty", "price"), table.columns());
        assertEquals(2, table.rowCount());
        assertEquals("A", table.value(0, "name"));
        assertEquals(3L, table.value(0, "qty"));
        assertEquals(1.5, table.value(0, "price"));
        assertNull(table.value(1, "qty"));
        assertEquals(2L, table.value(1, "price"));
        assertEquals(Arrays.asList(3L, null), table.column("qty"));
        assertEquals(List.of(3L), table.distinct("qty"));
    }

    @Test
    public void testCaseInsensitiveColumns() {
        final DataTable table = DataTables.fromCsv("Node,Capacity\nn1,4\n");
        assertTrue(table.hasColumn("node"));
        assertEquals("Capacity", table.resolveColumn("CAPACITY").orElseThrow());
        assertFalse(table.resolveColumn("cap").isPresent());
        assertThrows(IllegalArgumentException.class, () -> table.column("cap"));
    }

    @Test
    public void testCsvFile(@TempDir final Path directory) {
        assertThrows(BindingException.class, () -> DataTables.fromCsv(directory.resolve("missing.csv")));
    }

    @Test
    public void testDatabaseTable() {
        final DSLContext conn = DSL.using("jdbc:h2:mem:");
        conn.execute("create table capacity (node varchar(30) primary key, cap integer not null)");
        conn.execute("insert into capacity values ('n1', 4)");
        conn.execute("insert into capacity values ('n2', 8)");

        final DataTable table = DataTables.fromDatabase(conn, "capacity");
        assertEquals(List.of("NODE", "CAP"), table.columns());
        assertEquals(List.of("n1", "n2"), table.distinct("node"));
        assertEquals(List.of(4L, 8L), table.column("cap"));
    }

    @Test
    public void testResultInput() {
        final DSLContext conn = DSL.using("jdbc:h2:mem:");
        conn.execute("create table demand (product varchar(30), amount decimal(10, 2))");
        conn.execute("insert into demand values ('A', 10), ('B', 2.5)");

        final DataTable table = DataTables.fromResult(conn.selectFrom(DSL.table("demand")).fetch());
        assertEquals(10L, table.value(0, "amount"));
        assertEquals(2.5, table.value(1, "amount"));
    }

    @Test
    public void testResultIsCopied() {
        final DSLContext conn = DSL.using("jdbc:h2:mem:");
        conn.execute("create table demand (product varchar(30), amount integer)");
        conn.execute("insert into demand values ('A', 10), ('B', 20)");
        final Result<Record> result = conn.selectFrom(DSL.table("demand")).fetch();

        final DataTable table = DataTables.fromResult(result);
        result.get(0).fromArray("Z", 99);
        result.remove(1);

        assertEquals(2, table.rowCount());
        assertEquals(List.of("A", "B"), table.column("product"));
        assertEquals(List.of(10L, 20L), table.column("amount"));
    }

    @Test
    public void testBuiltTableIsNotAffectedByLaterRows() {
        final DataTables.Builder builder = DataTables.builder("k", "v").row("a", 1);
        final DataTable table = builder.build();
        builder.row("b", 2);
        assertEquals(1, table.rowCount());
    }

    @Test
    public void testWithIndexReturnsNewView() {
        final DataTable table = DataTables.builder("k", "v").row("a", 1).build();
        final DataTable indexed = table.withIndex("k");
        assertTrue(table.indexColumns().isEmpty());
        assertEquals(List.of("k"), indexed.indexColumns());
        assertThrows(IllegalArgumentException.class, () -> table.withIndex("missing"));
    }

    @Test
    public void testFromMapAndValues() {
        final DataTable map = DataTables.fromMap("product", "price", Map.of("A", 2));
        assertEquals(List.of("product"), map.indexColumns());
        assertEquals(2L, map.value(0, "price"));

        final DataTable values = DataTables.fromValues("node", List.of("n1", "n2", "n1"));
        assertEquals(3, values.rowCount());
        assertEquals(List.of("n1", "n2"), values.distinct("node"));
    }

    @Test
    public void testBuilderRowArity() {
        assertThrows(IllegalArgumentException.class, () -> DataTables.builder("a", "b").row(1));
    }

    @Test
    public void testRanges() {
        assertEquals(List.of(1L, 3L, 5L, 7L, 9L), Ranges.inclusive(1L, 10L, 2L));
        assertEquals(List.of(3L, 2L, 1L), Ranges.inclusive(3L, 1L, -1L));
        assertEquals(List.of(0L, 0.5, 1L), Ranges.inclusive(0L, 1L, 0.5));
        assertTrue(Ranges.inclusive(5L, 1L, 1L).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> Ranges.inclusive(1L, 2L, 0L));
    }

    @Test
    public void testKeyNormalization() {
        assertEquals(3L, Keys.normalize(3));
        assertEquals(3L, Keys.normalize(3.0));
        assertEquals(2.5, Keys.normalize(2.5f));
        assertEquals(7L, Keys.normalize(new java.math.BigDecimal("7.00")));
        assertEquals("x", Keys.normalize("x"));
        assertNull(Keys.normalize(null));
    }
}
