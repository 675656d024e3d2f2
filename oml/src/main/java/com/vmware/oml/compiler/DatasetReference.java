/*
 * Copyright 2018-2021 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2
 */

package com.vmware.oml.compiler;

import java.util.Objects;

/**
 * A {@code table.column} reference found in a model.
 */
public final class DatasetReference {
    private final String table;
    private final String column;

    public DatasetReference(final String table, final String column) {
        this.table = table;
        this.column = column;
    }

    public String table() {
        return table;
    }

    public String column() {
        return column;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DatasetReference)) {
            return false;
        }
        final DatasetReference that = (DatasetReference) o;
        return table.equals(that.table) && column.equals(that.column);
    }

    @Override
    public int hashCode() {
        return Objects.hash(table, column);
    }

    @Override
    public String toString() {
        return table + "." + column;
    }
}
