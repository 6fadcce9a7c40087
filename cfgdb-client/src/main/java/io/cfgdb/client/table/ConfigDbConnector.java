package io.cfgdb.client.table;

import io.cfgdb.client.CancellationToken;
import io.cfgdb.client.DatabaseClient;
import io.cfgdb.client.DatabaseSpec;
import io.cfgdb.client.NotificationChannel;
import io.cfgdb.client.StoreConnection;
import io.cfgdb.client.watch.ChangeNotifier;
import io.cfgdb.client.watch.TableChangeHandler;
import io.cfgdb.common.Row;
import io.cfgdb.common.RowKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;

/**
 * Table access to one configuration database: connects it through a {@link DatabaseClient},
 * optionally waits until the configuration has been loaded, and then serves table reads, writes
 * and change subscriptions.
 */
public final class ConfigDbConnector implements TableStore {

    private static final Logger log = LoggerFactory.getLogger(ConfigDbConnector.class);

    public static final String CONFIG_DB = "CONFIG_DB";

    /**
     * String key set once the configuration database has been populated.
     */
    public static final String INIT_INDICATOR = "CONFIG_DB_INITIALIZED";

    public enum Strategy {
        DIRECT,
        PIPELINED
    }

    private final DatabaseClient client;
    private final String databaseName;
    private final Strategy strategy;
    private final Duration pollTimeout;

    private volatile TableStore tables;
    private volatile ChangeNotifier notifier;

    public ConfigDbConnector(DatabaseClient client) {
        this(client, CONFIG_DB, Strategy.DIRECT);
    }

    public ConfigDbConnector(DatabaseClient client, String databaseName, Strategy strategy) {
        this(client, databaseName, strategy, ChangeNotifier.DEFAULT_POLL_TIMEOUT);
    }

    public ConfigDbConnector(DatabaseClient client, String databaseName, Strategy strategy, Duration pollTimeout) {
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.databaseName = Objects.requireNonNull(databaseName, "databaseName must not be null");
        this.strategy = Objects.requireNonNull(strategy, "strategy must not be null");
        this.pollTimeout = Objects.requireNonNull(pollTimeout, "pollTimeout must not be null");
    }

    public String databaseName() {
        return databaseName;
    }

    public void connect() {
        connect(true, true);
    }

    public void connect(boolean waitForInit, boolean retryForever) {
        connect(waitForInit, retryForever, CancellationToken.none());
    }

    public void connect(boolean waitForInit, boolean retryForever, CancellationToken cancellation) {
        client.connect(databaseName, retryForever, cancellation);
        DatabaseSpec database = client.database(databaseName);
        if (waitForInit) {
            waitForInit(cancellation);
        }
        tables = switch (strategy) {
            case DIRECT -> new DirectTableStore(client.registry(), database);
            case PIPELINED -> new PipelinedTableStore(client.registry(), database);
        };
        notifier = new ChangeNotifier(client.registry(), database, pollTimeout);
        log.atInfo()
            .addKeyValue("db", databaseName)
            .addKeyValue("strategy", strategy)
            .log("Connected to configuration database");
    }

    public boolean isConnected() {
        return tables != null && client.registry().isConnected(databaseName);
    }

    /**
     * Blocks until {@link #INIT_INDICATOR} is set, woken by keyspace events on that key.
     */
    public void waitForInit(CancellationToken cancellation) {
        StoreConnection connection = client.connection(databaseName);
        String channelName = client.database(databaseName).keyspaceChannelPrefix() + INIT_INDICATOR;
        try (NotificationChannel channel = connection.psubscribe(channelName)) {
            while (connection.get(INIT_INDICATOR).isEmpty()) {
                cancellation.throwIfCancelled();
                log.atDebug().addKeyValue("db", databaseName).log("Waiting for configuration to be initialized");
                channel.poll(pollTimeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted");
        }
    }

    public TableStore tables() {
        TableStore current = tables;
        if (current == null) {
            throw new IllegalStateException("Not connected to " + databaseName);
        }
        return current;
    }

    public ChangeNotifier notifier() {
        ChangeNotifier current = notifier;
        if (current == null) {
            throw new IllegalStateException("Not connected to " + databaseName);
        }
        return current;
    }

    public ChangeNotifier.Registration subscribe(String table, TableChangeHandler handler) {
        return notifier().subscribe(table, handler);
    }

    public void unsubscribe(String table) {
        notifier().unsubscribe(table);
    }

    public void listen(CancellationToken cancellation) {
        notifier().listen(cancellation);
    }

    @Override
    public Row getEntry(String table, RowKey key) {
        return tables().getEntry(table, key);
    }

    @Override
    public void setEntry(String table, RowKey key, Row row) {
        tables().setEntry(table, key, row);
    }

    @Override
    public void modEntry(String table, RowKey key, Row row) {
        tables().modEntry(table, key, row);
    }

    @Override
    public List<RowKey> getKeys(String table) {
        return tables().getKeys(table);
    }

    @Override
    public Map<RowKey, Row> getTable(String table) {
        return tables().getTable(table);
    }

    @Override
    public void deleteTable(String table) {
        tables().deleteTable(table);
    }

    @Override
    public Map<String, Map<RowKey, Row>> getConfig() {
        return tables().getConfig();
    }

    @Override
    public void modConfig(Map<String, Map<RowKey, Row>> config) {
        tables().modConfig(config);
    }

    @Override
    public void setBulk(Map<String, Map<String, String>> hashes) {
        tables().setBulk(hashes);
    }

    @Override
    public void deleteBulk(Collection<String> keys) {
        tables().deleteBulk(keys);
    }

    @Override
    public void hdelBulk(Map<String, ? extends Collection<String>> fieldsByKey) {
        tables().hdelBulk(fieldsByKey);
    }

    @Override
    public List<Map<String, String>> getAllBulk(List<String> keys) {
        return tables().getAllBulk(keys);
    }
}
