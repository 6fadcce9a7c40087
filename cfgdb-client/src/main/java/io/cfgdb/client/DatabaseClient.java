package io.cfgdb.client;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Primitive per-database accessors over a {@link ConnectionRegistry}. Reads take an
 * {@link AccessPolicy}; writes are retried on connection failure like non-blocking reads.
 */
public final class DatabaseClient implements AutoCloseable {

    /**
     * Keyspace event published when a hash field is written; awaited when a database is empty.
     */
    static final String HSET_EVENT = "hset";

    private final DatabaseCatalog catalog;
    private final ConnectionRegistry registry;
    private final BlockingAccessor accessor;
    private final Runnable onClose;

    public DatabaseClient(
        StoreConnector connector,
        StoreClientConfig config,
        BlockingConfig blockingConfig,
        DatabaseCatalog catalog
    ) {
        this(connector, config, blockingConfig, catalog, () -> {});
    }

    private DatabaseClient(
        StoreConnector connector,
        StoreClientConfig config,
        BlockingConfig blockingConfig,
        DatabaseCatalog catalog,
        Runnable onClose
    ) {
        this.catalog = catalog;
        this.registry = new ConnectionRegistry(connector, config);
        this.accessor = new BlockingAccessor(registry, blockingConfig);
        this.onClose = onClose;
    }

    /**
     * Client backed by Lettuce connections. The event loops are released by {@link #close()}.
     */
    public static DatabaseClient create(StoreClientConfig config, BlockingConfig blockingConfig, DatabaseCatalog catalog) {
        LettuceStoreConnector connector = new LettuceStoreConnector(config);
        return new DatabaseClient(connector, config, blockingConfig, catalog, connector::close);
    }

    public static DatabaseClient create(StoreClientConfig config) {
        return create(config, BlockingConfig.defaults(), DatabaseCatalog.defaults());
    }

    public void connect(String name) {
        connect(name, true);
    }

    public void connect(String name, boolean retryForever) {
        connect(name, retryForever, CancellationToken.none());
    }

    public void connect(String name, boolean retryForever, CancellationToken cancellation) {
        registry.connect(catalog.get(name), retryForever, cancellation);
    }

    public void close(String name) {
        registry.close(name);
    }

    public DatabaseCatalog catalog() {
        return catalog;
    }

    public ConnectionRegistry registry() {
        return registry;
    }

    public BlockingAccessor accessor() {
        return accessor;
    }

    public DatabaseSpec database(String name) {
        return catalog.get(name);
    }

    public int dbId(String name) {
        return catalog.get(name).id();
    }

    public String separator(String name) {
        return catalog.get(name).separator();
    }

    public StoreConnection connection(String name) {
        return registry.connection(name);
    }

    public ReadResult<List<String>> keys(String db) {
        return keys(db, "*", AccessPolicy.nonBlocking());
    }

    public ReadResult<List<String>> keys(String db, String pattern, AccessPolicy policy) {
        return accessor.execute(db, "keys", policy, connection -> {
            List<String> keys = connection.keys(pattern);
            if (keys.isEmpty()) {
                return ReadResult.unavailable(HSET_EVENT, "Database '" + db + "' is empty");
            }
            return ReadResult.present(keys);
        });
    }

    /**
     * Reads one field. A field holding the empty string counts as not yet written.
     */
    public ReadResult<String> get(String db, String hash, String field, AccessPolicy policy) {
        return accessor.execute(db, "get", policy, connection -> connection.hget(hash, field)
            .filter(value -> !value.isEmpty())
            .<ReadResult<String>>map(ReadResult::present)
            .orElseGet(() -> ReadResult.unavailable(hash,
                "Key '" + hash + "' field '" + field + "' unavailable in database '" + db + "'")));
    }

    public ReadResult<Map<String, String>> getAll(String db, String hash, AccessPolicy policy) {
        return accessor.execute(db, "getAll", policy, connection -> {
            Map<String, String> fields = connection.hgetall(hash);
            if (fields.isEmpty()) {
                return ReadResult.unavailable(hash, "Key '" + hash + "' unavailable in database '" + db + "'");
            }
            return ReadResult.present(fields);
        });
    }

    public long set(String db, String hash, String field, String value) {
        return accessor.execute(db, "set", AccessPolicy.nonBlocking(),
            connection -> ReadResult.present(connection.hset(hash, Map.of(field, value)))).orElseThrow();
    }

    public long delete(String db, String key) {
        return accessor.execute(db, "delete", AccessPolicy.nonBlocking(),
            connection -> ReadResult.present(connection.del(key))).orElseThrow();
    }

    public long deleteAllByPattern(String db, String pattern) {
        return accessor.execute(db, "deleteAllByPattern", AccessPolicy.nonBlocking(), connection -> {
            long deleted = 0;
            for (String key : connection.keys(pattern)) {
                deleted += connection.del(key);
            }
            return ReadResult.present(deleted);
        }).orElseThrow();
    }

    public long publish(String db, String channel, String message) {
        return registry.connection(db).publish(channel, message);
    }

    public boolean expire(String db, String key, Duration ttl) {
        return registry.connection(db).expire(key, ttl);
    }

    public boolean exists(String db, String key) {
        return registry.connection(db).exists(key);
    }

    @Override
    public void close() {
        try {
            registry.close();
        } finally {
            onClose.run();
        }
    }
}
