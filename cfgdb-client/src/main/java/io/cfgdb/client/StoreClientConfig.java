package io.cfgdb.client;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Connection parameters shared by every database of one store.
 *
 * @param keyspaceEvents value written to {@code notify-keyspace-events} on every new connection
 * @param keyspacePattern pattern subscribed to while a blocking read waits for data
 */
public record StoreClientConfig(
    String host,
    int port,
    Optional<String> unixSocketPath,
    Duration commandTimeout,
    Duration connectTimeout,
    Duration connectRetryWait,
    String keyspaceEvents,
    String keyspacePattern
) {
    public static final String DEFAULT_HOST = "127.0.0.1";
    public static final int DEFAULT_PORT = 6379;
    public static final String DEFAULT_UNIX_SOCKET_PATH = "/var/run/redis/redis.sock";
    public static final String DEFAULT_KEYSPACE_EVENTS = "KEA";
    public static final String DEFAULT_KEYSPACE_PATTERN = "__key*__:*";

    public StoreClientConfig {
        Objects.requireNonNull(host, "host must not be null");
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("port must be between 1 and 65535");
        }
        Objects.requireNonNull(unixSocketPath, "unixSocketPath must not be null");
        Objects.requireNonNull(commandTimeout, "commandTimeout must not be null");
        Objects.requireNonNull(connectTimeout, "connectTimeout must not be null");
        Objects.requireNonNull(connectRetryWait, "connectRetryWait must not be null");
        Objects.requireNonNull(keyspaceEvents, "keyspaceEvents must not be null");
        Objects.requireNonNull(keyspacePattern, "keyspacePattern must not be null");
        if (commandTimeout.isNegative() || commandTimeout.isZero()) {
            throw new IllegalArgumentException("commandTimeout must be positive");
        }
        if (connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("connectTimeout must be positive");
        }
        if (connectRetryWait.isNegative()) {
            throw new IllegalArgumentException("connectRetryWait must not be negative");
        }
    }

    public static StoreClientConfig defaults() {
        return tcp(DEFAULT_HOST, DEFAULT_PORT);
    }

    public static StoreClientConfig tcp(String host, int port) {
        return new StoreClientConfig(
            host,
            port,
            Optional.empty(),
            Duration.ofSeconds(5),
            Duration.ofSeconds(5),
            Duration.ofSeconds(10),
            DEFAULT_KEYSPACE_EVENTS,
            DEFAULT_KEYSPACE_PATTERN
        );
    }

    public static StoreClientConfig unixSocket(String path) {
        StoreClientConfig base = defaults();
        return new StoreClientConfig(
            base.host(),
            base.port(),
            Optional.of(path),
            base.commandTimeout(),
            base.connectTimeout(),
            base.connectRetryWait(),
            base.keyspaceEvents(),
            base.keyspacePattern()
        );
    }

    public StoreClientConfig withConnectRetryWait(Duration wait) {
        return new StoreClientConfig(
            host, port, unixSocketPath, commandTimeout, connectTimeout, wait, keyspaceEvents, keyspacePattern
        );
    }
}
