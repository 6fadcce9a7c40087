package io.cfgdb.client.watch;

import io.cfgdb.client.CancellationToken;
import io.cfgdb.client.ConnectionRegistry;
import io.cfgdb.client.DatabaseSpec;
import io.cfgdb.client.KeyspaceEvent;
import io.cfgdb.client.NotificationChannel;
import io.cfgdb.client.StoreConnection;
import io.cfgdb.common.KeyCodec;
import io.cfgdb.common.Row;
import io.cfgdb.common.TableKey;
import io.cfgdb.common.TypeCodec;
import io.cfgdb.common.exception.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * Dispatches keyspace events of one database to handlers registered per table. Handlers may be
 * added and removed while {@link #listen(CancellationToken)} is running.
 */
public final class ChangeNotifier {

    private static final Logger log = LoggerFactory.getLogger(ChangeNotifier.class);

    public static final Duration DEFAULT_POLL_TIMEOUT = Duration.ofSeconds(1);

    private final ConnectionRegistry registry;
    private final DatabaseSpec database;
    private final KeyCodec keys;
    private final Duration pollTimeout;
    private final ConcurrentHashMap<String, Set<TableChangeHandler>> handlers = new ConcurrentHashMap<>();

    public ChangeNotifier(ConnectionRegistry registry, DatabaseSpec database) {
        this(registry, database, DEFAULT_POLL_TIMEOUT);
    }

    public ChangeNotifier(ConnectionRegistry registry, DatabaseSpec database, Duration pollTimeout) {
        this.registry = registry;
        this.database = database;
        this.keys = database.keyCodec();
        this.pollTimeout = Objects.requireNonNull(pollTimeout, "pollTimeout must not be null");
    }

    /**
     * Handle of one subscription; closing it removes the handler.
     */
    public final class Registration implements AutoCloseable {
        private final String table;
        private final TableChangeHandler handler;

        private Registration(String table, TableChangeHandler handler) {
            this.table = table;
            this.handler = handler;
        }

        public String table() {
            return table;
        }

        @Override
        public void close() {
            unsubscribe(table, handler);
        }
    }

    public Registration subscribe(String table, TableChangeHandler handler) {
        Objects.requireNonNull(handler, "handler must not be null");
        String name = keys.tableName(table);
        handlers.computeIfAbsent(name, t -> new CopyOnWriteArraySet<>()).add(handler);
        return new Registration(name, handler);
    }

    public void unsubscribe(String table) {
        handlers.remove(keys.tableName(table));
    }

    public void unsubscribe(String table, TableChangeHandler handler) {
        handlers.computeIfPresent(keys.tableName(table), (t, set) -> {
            set.remove(handler);
            return set.isEmpty() ? null : set;
        });
    }

    public boolean hasHandlers(String table) {
        return handlers.containsKey(keys.tableName(table));
    }

    /**
     * Blocks dispatching change events until {@code cancellation} fires or the thread is
     * interrupted, then returns normally. A lost connection is reopened, waiting
     * {@link io.cfgdb.client.StoreClientConfig#connectRetryWait()} between attempts, and the
     * subscription renewed; changes made while disconnected are not replayed.
     */
    public void listen(CancellationToken cancellation) {
        String pattern = database.keyspaceChannelPrefix() + "*";
        log.atInfo().addKeyValue("db", database.name()).addKeyValue("pattern", pattern).log("Listening for changes");
        try {
            while (!cancellation.isCancelled()) {
                try {
                    dispatchUntilCancelled(pattern, cancellation);
                } catch (StoreException.ConnectionFailed e) {
                    log.atWarn()
                        .addKeyValue("db", database.name())
                        .log("Lost change notifications, reconnecting: {}", e.getMessage());
                    registry.reconnect(database.name(), cancellation);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (CancellationException e) {
            log.atDebug().addKeyValue("db", database.name()).log("Reconnect cancelled");
        }
        log.atInfo().addKeyValue("db", database.name()).log("Stopped listening for changes");
    }

    private void dispatchUntilCancelled(String pattern, CancellationToken cancellation) throws InterruptedException {
        StoreConnection connection = registry.connection(database.name());
        try (NotificationChannel channel = connection.psubscribe(pattern)) {
            while (!cancellation.isCancelled()) {
                Optional<KeyspaceEvent> event = channel.poll(pollTimeout);
                if (event.isPresent()) {
                    dispatch(connection, event.get());
                }
            }
        }
    }

    /**
     * Runs {@link #listen(CancellationToken)} on a daemon thread.
     */
    public Thread startListening(CancellationToken cancellation) {
        Thread t = new Thread(() -> listen(cancellation), "cfgdb-notifier-" + database.name());
        t.setDaemon(true);
        t.start();
        return t;
    }

    void dispatch(StoreConnection connection, KeyspaceEvent event) {
        if (!event.isKeyspace()) {
            return;
        }
        Optional<TableKey> parsed = keys.parse(event.key());
        if (parsed.isEmpty()) {
            log.atDebug().addKeyValue("channel", event.channel()).log("Ignoring change to key without table");
            return;
        }
        TableKey key = parsed.get();
        Set<TableChangeHandler> tableHandlers = handlers.get(key.table());
        if (tableHandlers == null || tableHandlers.isEmpty()) {
            return;
        }
        String hash = event.key();
        Row row;
        ChangeKind kind;
        try {
            row = TypeCodec.decode(connection.hgetall(hash));
            kind = connection.exists(hash) ? ChangeKind.SET : ChangeKind.DELETE;
        } catch (StoreException.BadRequest e) {
            log.atWarn().addKeyValue("key", hash).log("Cannot read changed row: {}", e.getMessage());
            return;
        }
        for (TableChangeHandler handler : tableHandlers) {
            try {
                handler.onChange(key.table(), key.row(), row, kind);
            } catch (RuntimeException e) {
                log.atWarn()
                    .setCause(e)
                    .addKeyValue("table", key.table())
                    .addKeyValue("key", key.row())
                    .log("Change handler failed");
            }
        }
    }
}
