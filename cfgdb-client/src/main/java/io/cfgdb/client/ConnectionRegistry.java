package io.cfgdb.client;

import io.cfgdb.common.exception.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns at most one live connection, and at most one keyspace subscription, per logical database
 * name.
 */
public final class ConnectionRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

    static final String NOTIFY_KEYSPACE_EVENTS = "notify-keyspace-events";

    private final StoreConnector connector;
    private final StoreClientConfig config;
    private final ConcurrentHashMap<String, DatabaseHandle> handles = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, DatabaseSpec> known = new ConcurrentHashMap<>();

    private static final class DatabaseHandle {
        final DatabaseSpec database;
        final StoreConnection connection;
        volatile NotificationChannel notifications;

        DatabaseHandle(DatabaseSpec database, StoreConnection connection) {
            this.database = database;
            this.connection = connection;
        }
    }

    public ConnectionRegistry(StoreConnector connector, StoreClientConfig config) {
        this.connector = connector;
        this.config = config;
    }

    public StoreClientConfig config() {
        return config;
    }

    public void connect(DatabaseSpec database, boolean retryForever) {
        connect(database, retryForever, CancellationToken.none());
    }

    /**
     * Connects {@code database} unless it is connected already. With {@code retryForever} a failed
     * attempt is retried after {@link StoreClientConfig#connectRetryWait()} until it succeeds or
     * {@code cancellation} fires; otherwise the first failure is thrown.
     */
    public void connect(DatabaseSpec database, boolean retryForever, CancellationToken cancellation) {
        if (!retryForever) {
            connectOnce(database);
            return;
        }
        while (true) {
            cancellation.throwIfCancelled();
            try {
                connectOnce(database);
                return;
            } catch (StoreException.ConnectionFailed e) {
                log.atWarn()
                    .addKeyValue("db", database.name())
                    .addKeyValue("id", database.id())
                    .addKeyValue("retryIn", config.connectRetryWait())
                    .log("Connecting to database failed, will retry: {}", e.getMessage());
                close(database.name());
                cancellation.pause(config.connectRetryWait());
            }
        }
    }

    private synchronized void connectOnce(DatabaseSpec database) {
        known.put(database.name(), database);
        if (handles.containsKey(database.name())) {
            return;
        }
        StoreConnection connection = connector.connect(database);
        try {
            connection.configSet(NOTIFY_KEYSPACE_EVENTS, config.keyspaceEvents());
        } catch (RuntimeException e) {
            connection.close();
            throw e;
        }
        handles.put(database.name(), new DatabaseHandle(database, connection));
    }

    /**
     * Drops the connection of {@code name}, waits the retry interval and connects again, retrying
     * until the database is reachable.
     */
    public void reconnect(String name, CancellationToken cancellation) {
        DatabaseSpec database = database(name);
        log.atWarn()
            .addKeyValue("db", name)
            .log("Could not reach the store, waiting before trying again");
        close(name);
        cancellation.pause(config.connectRetryWait());
        connect(database, true, cancellation);
    }

    /**
     * Releases the connection and keyspace subscription of {@code name}. Closing an unknown or
     * already closed database does nothing.
     */
    public synchronized void close(String name) {
        DatabaseHandle handle = handles.remove(name);
        if (handle == null) {
            return;
        }
        try {
            NotificationChannel notifications = handle.notifications;
            if (notifications != null) {
                handle.notifications = null;
                notifications.close();
            }
        } finally {
            handle.connection.close();
        }
    }

    public StoreConnection connection(String name) {
        return handle(name).connection;
    }

    public boolean isConnected(String name) {
        return handles.containsKey(name);
    }

    /**
     * Spec of a database that was connected at least once, connected or not right now.
     */
    public DatabaseSpec database(String name) {
        DatabaseSpec database = known.get(name);
        if (database == null) {
            throw new StoreException.MissingClient(name);
        }
        return database;
    }

    public NotificationChannel subscribeKeyspace(String name) {
        DatabaseHandle handle = handle(name);
        synchronized (handle) {
            if (handle.notifications == null) {
                log.atDebug().addKeyValue("db", name).log("Subscribing to keyspace notifications");
                handle.notifications = handle.connection.psubscribe(config.keyspacePattern());
            }
            return handle.notifications;
        }
    }

    public Optional<NotificationChannel> notifications(String name) {
        return Optional.ofNullable(handle(name).notifications);
    }

    public void unsubscribeKeyspace(String name) {
        DatabaseHandle handle = handles.get(name);
        if (handle == null) {
            return;
        }
        synchronized (handle) {
            if (handle.notifications != null) {
                log.atDebug().addKeyValue("db", name).log("Unsubscribing from keyspace notifications");
                handle.notifications.close();
                handle.notifications = null;
            }
        }
    }

    private DatabaseHandle handle(String name) {
        DatabaseHandle handle = handles.get(name);
        if (handle == null) {
            throw new StoreException.MissingClient(name);
        }
        return handle;
    }

    @Override
    public void close() {
        for (String name : handles.keySet()) {
            close(name);
        }
    }
}
