package io.cfgdb.common;

import java.util.Objects;

public record TableKey(String table, RowKey row) {

    public TableKey {
        Objects.requireNonNull(table, "table must not be null");
        Objects.requireNonNull(row, "row must not be null");
    }
}
