package io.cfgdb.client.watch;

import io.cfgdb.common.Row;
import io.cfgdb.common.RowKey;

@FunctionalInterface
public interface TableChangeHandler {

    /**
     * @param row the row as read after the change; empty when the row was deleted
     */
    void onChange(String table, RowKey key, Row row, ChangeKind kind);
}
