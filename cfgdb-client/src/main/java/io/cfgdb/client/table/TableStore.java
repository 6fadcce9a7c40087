package io.cfgdb.client.table;

import io.cfgdb.common.Row;
import io.cfgdb.common.RowKey;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Typed tables over the hashes of one database. A row lives in the hash
 * {@code TABLE<sep>serialized-key}.
 *
 * <p>Snapshots map table name to rows; a {@code null} table in a snapshot passed to
 * {@link #modConfig(Map)} deletes that table, a {@code null} row deletes that row.
 */
public interface TableStore {

    /**
     * Current row, or an empty row when the entry does not exist.
     */
    Row getEntry(String table, RowKey key);

    /**
     * Replaces the row: columns of the stored row that {@code row} does not mention are removed.
     * The read, write and removal are separate commands; a concurrent writer can interleave.
     * A {@code null} row deletes the entry.
     */
    void setEntry(String table, RowKey key, Row row);

    /**
     * Writes the columns of {@code row} and keeps every other stored column. A {@code null} row
     * deletes the entry.
     */
    void modEntry(String table, RowKey key, Row row);

    List<RowKey> getKeys(String table);

    Map<RowKey, Row> getTable(String table);

    void deleteTable(String table);

    Map<String, Map<RowKey, Row>> getConfig();

    void modConfig(Map<String, Map<RowKey, Row>> config);

    void setBulk(Map<String, Map<String, String>> hashes);

    void deleteBulk(Collection<String> keys);

    void hdelBulk(Map<String, ? extends Collection<String>> fieldsByKey);

    List<Map<String, String>> getAllBulk(List<String> keys);
}
