package io.cfgdb.client.table;

import io.cfgdb.client.ConnectionRegistry;
import io.cfgdb.client.DatabaseSpec;
import io.cfgdb.client.ScanPage;
import io.cfgdb.client.StoreConnection;
import io.cfgdb.client.StorePipeline;
import io.cfgdb.common.Row;
import io.cfgdb.common.RowKey;
import io.cfgdb.common.TableKey;
import io.cfgdb.common.TypeCodec;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.function.Supplier;

/**
 * Same contract as {@link DirectTableStore}, but whole-table and whole-store operations walk the
 * keyspace with cursor scans of {@code scanBatchSize} keys and send each batch's reads or writes
 * as one pipeline. Single-entry operations are inherited unchanged.
 */
public final class PipelinedTableStore extends DirectTableStore {

    public static final int DEFAULT_SCAN_BATCH_SIZE = 30;

    private final int scanBatchSize;

    public PipelinedTableStore(ConnectionRegistry registry, DatabaseSpec database) {
        this(registry, database, DEFAULT_SCAN_BATCH_SIZE);
    }

    public PipelinedTableStore(ConnectionRegistry registry, DatabaseSpec database, int scanBatchSize) {
        super(registry, database);
        if (scanBatchSize <= 0) {
            throw new IllegalArgumentException("scanBatchSize must be positive");
        }
        this.scanBatchSize = scanBatchSize;
    }

    public int scanBatchSize() {
        return scanBatchSize;
    }

    @Override
    public Map<RowKey, Row> getTable(String table) {
        Map<RowKey, Row> rows = new LinkedHashMap<>();
        readAll(keys.tablePattern(table), (key, row) -> rows.put(key.row(), row));
        return rows;
    }

    @Override
    public Map<String, Map<RowKey, Row>> getConfig() {
        Map<String, Map<RowKey, Row>> config = new LinkedHashMap<>();
        readAll("*", (key, row) -> put(config, key, row));
        return config;
    }

    @Override
    public void deleteTable(String table) {
        StoreConnection connection = connection();
        StorePipeline pipeline = connection.pipeline();
        deleteTable(connection, pipeline, table);
        pipeline.execute();
    }

    @Override
    public void modConfig(Map<String, Map<RowKey, Row>> config) {
        StoreConnection connection = connection();
        StorePipeline pipeline = connection.pipeline();
        config.forEach((table, rows) -> {
            if (rows == null) {
                // the scan must see rows queued earlier in this snapshot
                pipeline.execute();
                deleteTable(connection, pipeline, table);
                return;
            }
            rows.forEach((key, row) -> {
                String hash = keys.hashKey(table, key);
                if (row == null) {
                    pipeline.del(hash);
                } else {
                    pipeline.hset(hash, TypeCodec.encode(row));
                }
            });
        });
        pipeline.execute();
    }

    private void deleteTable(StoreConnection connection, StorePipeline pipeline, String table) {
        ScanPage page = null;
        do {
            page = connection.scan(nextCursor(page), keys.tablePattern(table), scanBatchSize);
            page.keys().forEach(pipeline::del);
        } while (!page.isFinished());
    }

    private static String nextCursor(ScanPage previous) {
        return previous == null ? ScanPage.INITIAL_CURSOR : previous.cursor();
    }

    private void readAll(String pattern, BiConsumer<TableKey, Row> sink) {
        StoreConnection connection = connection();
        StorePipeline pipeline = connection.pipeline();
        ScanPage page = null;
        do {
            page = connection.scan(nextCursor(page), pattern, scanBatchSize);
            List<TableKey> batch = new ArrayList<>(page.keys().size());
            List<Supplier<Map<String, String>>> replies = new ArrayList<>(page.keys().size());
            for (String key : page.keys()) {
                Optional<TableKey> parsed = keys.parse(key);
                if (parsed.isPresent()) {
                    batch.add(parsed.get());
                    replies.add(pipeline.hgetall(key));
                }
            }
            pipeline.execute();
            for (int i = 0; i < batch.size(); i++) {
                Map<String, String> raw = replies.get(i).get();
                if (!raw.isEmpty()) {
                    sink.accept(batch.get(i), TypeCodec.decode(raw));
                }
            }
        } while (!page.isFinished());
    }
}
