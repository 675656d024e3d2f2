/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml.ast;

/**
 * {@code table.column}: the values of a column of an input table.
 */
public final class DatasetColumn extends Expr {
    private final String table;
    private final String column;

    public DatasetColumn(final String table, final String column) {
        this.table = table;
        this.column = column;
    }

    public String getTable() {
        return table;
    }

    public String getColumn() {
        return column;
    }

    @Override
    public String toString() {
        return "DatasetColumn{" +
                "table='" + table + '\'' +
                ", column='" + column + '\'' +
                '}';
    }

    @Override
    <T, C> T acceptVisitor(final AstVisitor<T, C> visitor, final C context) {
        return visitor.visitDatasetColumn(this, context);
    }
}
