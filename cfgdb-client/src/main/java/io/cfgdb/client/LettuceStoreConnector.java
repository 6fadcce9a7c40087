package io.cfgdb.client;

import io.cfgdb.common.exception.StoreException;
import io.lettuce.core.ClientOptions;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisException;
import io.lettuce.core.RedisURI;
import io.lettuce.core.SocketOptions;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.resource.ClientResources;
import io.lettuce.core.resource.DefaultClientResources;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * Opens Lettuce connections, one client per database, sharing event loops between them.
 *
 * <p>Automatic reconnection is disabled: a dropped connection must surface as a failed command so
 * that the caller's retry protocol can close and reopen it.
 */
public final class LettuceStoreConnector implements StoreConnector, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LettuceStoreConnector.class);

    private final StoreClientConfig config;
    private final ClientResources resources;

    public LettuceStoreConnector(StoreClientConfig config) {
        this.config = config;
        this.resources = DefaultClientResources.create();
    }

    @Override
    public StoreConnection connect(DatabaseSpec database) {
        RedisClient client = RedisClient.create(resources, uri(database));
        client.setOptions(ClientOptions.builder()
            .autoReconnect(false)
            .disconnectedBehavior(ClientOptions.DisconnectedBehavior.REJECT_COMMANDS)
            .socketOptions(SocketOptions.builder()
                .connectTimeout(config.connectTimeout())
                .build())
            .build());
        try {
            StatefulRedisConnection<String, String> connection = client.connect();
            log.atDebug()
                .addKeyValue("db", database.name())
                .addKeyValue("id", database.id())
                .log("Connected to store");
            return new LettuceStoreConnection(database, client, connection, config.commandTimeout());
        } catch (RedisException e) {
            client.shutdown();
            throw new StoreException.ConnectionFailed(
                database.name(), "Failed to connect to database '" + database.name() + "'", e);
        }
    }

    private RedisURI uri(DatabaseSpec database) {
        RedisURI.Builder builder = config.unixSocketPath()
            .map(RedisURI.Builder::socket)
            .orElseGet(() -> RedisURI.Builder.redis(config.host(), config.port()));
        return builder
            .withDatabase(database.id())
            .withTimeout(config.commandTimeout())
            .build();
    }

    @Override
    public void close() {
        resources.shutdown(0, 5, TimeUnit.SECONDS);
    }
}
