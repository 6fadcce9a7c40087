package io.cfgdb.client.table;

import io.cfgdb.client.ConnectionRegistry;
import io.cfgdb.client.DatabaseSpec;
import io.cfgdb.client.StoreConnection;
import io.cfgdb.client.StorePipeline;
import io.cfgdb.common.KeyCodec;
import io.cfgdb.common.Row;
import io.cfgdb.common.RowKey;
import io.cfgdb.common.TableKey;
import io.cfgdb.common.TypeCodec;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Issues one command per key. Whole-table and whole-store reads enumerate keys with a single
 * pattern listing.
 */
public class DirectTableStore implements TableStore {

    protected final ConnectionRegistry registry;
    protected final DatabaseSpec database;
    protected final KeyCodec keys;

    public DirectTableStore(ConnectionRegistry registry, DatabaseSpec database) {
        this.registry = registry;
        this.database = database;
        this.keys = database.keyCodec();
    }

    public DatabaseSpec database() {
        return database;
    }

    public KeyCodec keyCodec() {
        return keys;
    }

    protected StoreConnection connection() {
        return registry.connection(database.name());
    }

    @Override
    public Row getEntry(String table, RowKey key) {
        return TypeCodec.decode(connection().hgetall(keys.hashKey(table, key)));
    }

    @Override
    public void setEntry(String table, RowKey key, Row row) {
        StoreConnection connection = connection();
        String hash = keys.hashKey(table, key);
        if (row == null) {
            connection.del(hash);
            return;
        }
        Row original = getEntry(table, key);
        connection.hset(hash, TypeCodec.encode(row));
        List<String> stale = new ArrayList<>();
        original.fields().forEach((name, value) -> {
            if (!row.contains(name)) {
                stale.add(TypeCodec.storedFieldName(name, value));
            }
        });
        if (!stale.isEmpty()) {
            connection.hdel(hash, stale.toArray(new String[0]));
        }
    }

    @Override
    public void modEntry(String table, RowKey key, Row row) {
        StoreConnection connection = connection();
        String hash = keys.hashKey(table, key);
        if (row == null) {
            connection.del(hash);
        } else {
            connection.hset(hash, TypeCodec.encode(row));
        }
    }

    @Override
    public List<RowKey> getKeys(String table) {
        List<RowKey> rows = new ArrayList<>();
        for (String key : connection().keys(keys.tablePattern(table))) {
            keys.parse(key).ifPresent(parsed -> rows.add(parsed.row()));
        }
        return rows;
    }

    @Override
    public Map<RowKey, Row> getTable(String table) {
        StoreConnection connection = connection();
        Map<RowKey, Row> rows = new LinkedHashMap<>();
        for (String key : connection.keys(keys.tablePattern(table))) {
            Optional<TableKey> parsed = keys.parse(key);
            if (parsed.isEmpty()) {
                continue;
            }
            Map<String, String> raw = connection.hgetall(key);
            if (!raw.isEmpty()) {
                rows.put(parsed.get().row(), TypeCodec.decode(raw));
            }
        }
        return rows;
    }

    @Override
    public void deleteTable(String table) {
        StoreConnection connection = connection();
        for (String key : connection.keys(keys.tablePattern(table))) {
            connection.del(key);
        }
    }

    @Override
    public Map<String, Map<RowKey, Row>> getConfig() {
        StoreConnection connection = connection();
        Map<String, Map<RowKey, Row>> config = new LinkedHashMap<>();
        for (String key : connection.keys("*")) {
            Optional<TableKey> parsed = keys.parse(key);
            if (parsed.isEmpty()) {
                continue;
            }
            Map<String, String> raw = connection.hgetall(key);
            if (!raw.isEmpty()) {
                put(config, parsed.get(), TypeCodec.decode(raw));
            }
        }
        return config;
    }

    @Override
    public void modConfig(Map<String, Map<RowKey, Row>> config) {
        config.forEach((table, rows) -> {
            if (rows == null) {
                deleteTable(table);
                return;
            }
            rows.forEach((key, row) -> modEntry(table, key, row));
        });
    }

    @Override
    public void setBulk(Map<String, Map<String, String>> hashes) {
        StorePipeline pipeline = connection().pipeline();
        hashes.forEach(pipeline::hset);
        pipeline.execute();
    }

    @Override
    public void deleteBulk(Collection<String> hashKeys) {
        StorePipeline pipeline = connection().pipeline();
        hashKeys.forEach(pipeline::del);
        pipeline.execute();
    }

    @Override
    public void hdelBulk(Map<String, ? extends Collection<String>> fieldsByKey) {
        StorePipeline pipeline = connection().pipeline();
        fieldsByKey.forEach((key, fields) -> pipeline.hdel(key, fields.toArray(new String[0])));
        pipeline.execute();
    }

    @Override
    public List<Map<String, String>> getAllBulk(List<String> hashKeys) {
        StorePipeline pipeline = connection().pipeline();
        List<Supplier<Map<String, String>>> replies = new ArrayList<>(hashKeys.size());
        for (String key : hashKeys) {
            replies.add(pipeline.hgetall(key));
        }
        pipeline.execute();
        List<Map<String, String>> results = new ArrayList<>(replies.size());
        for (Supplier<Map<String, String>> reply : replies) {
            results.add(reply.get());
        }
        return results;
    }

    protected static void put(Map<String, Map<RowKey, Row>> config, TableKey key, Row row) {
        config.computeIfAbsent(key.table(), table -> new LinkedHashMap<>()).put(key.row(), row);
    }
}
