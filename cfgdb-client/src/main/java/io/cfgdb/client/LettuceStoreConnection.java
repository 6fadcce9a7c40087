package io.cfgdb.client;

import io.cfgdb.common.exception.StoreException;
import io.lettuce.core.KeyScanCursor;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisCommandExecutionException;
import io.lettuce.core.RedisException;
import io.lettuce.core.ScanArgs;
import io.lettuce.core.ScanCursor;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.sync.RedisCommands;
import io.lettuce.core.pubsub.StatefulRedisPubSubConnection;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

final class LettuceStoreConnection implements StoreConnection {

    private final DatabaseSpec database;
    private final RedisClient client;
    private final StatefulRedisConnection<String, String> connection;
    private final RedisCommands<String, String> commands;
    private final Duration timeout;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    LettuceStoreConnection(
        DatabaseSpec database,
        RedisClient client,
        StatefulRedisConnection<String, String> connection,
        Duration timeout
    ) {
        this.database = database;
        this.client = client;
        this.connection = connection;
        this.commands = connection.sync();
        this.timeout = timeout;
    }

    @Override
    public DatabaseSpec database() {
        return database;
    }

    @Override
    public Optional<String> get(String key) {
        return call("GET", () -> Optional.ofNullable(commands.get(key)));
    }

    @Override
    public Optional<String> hget(String key, String field) {
        return call("HGET", () -> Optional.ofNullable(commands.hget(key, field)));
    }

    @Override
    public Map<String, String> hgetall(String key) {
        return call("HGETALL", () -> commands.hgetall(key));
    }

    @Override
    public long hset(String key, Map<String, String> fields) {
        return call("HSET", () -> commands.hset(key, fields));
    }

    @Override
    public long hdel(String key, String... fields) {
        return call("HDEL", () -> commands.hdel(key, fields));
    }

    @Override
    public long del(String... keys) {
        return call("DEL", () -> commands.del(keys));
    }

    @Override
    public List<String> keys(String pattern) {
        return call("KEYS", () -> commands.keys(pattern));
    }

    @Override
    public ScanPage scan(String cursor, String pattern, int count) {
        return call("SCAN", () -> {
            KeyScanCursor<String> page = commands.scan(
                ScanCursor.of(cursor), ScanArgs.Builder.matches(pattern).limit(count));
            return new ScanPage(page.getCursor(), page.getKeys());
        });
    }

    @Override
    public boolean expire(String key, Duration ttl) {
        return call("EXPIRE", () -> commands.expire(key, ttl.toSeconds()));
    }

    @Override
    public boolean exists(String key) {
        return call("EXISTS", () -> commands.exists(key) > 0);
    }

    @Override
    public long publish(String channel, String message) {
        return call("PUBLISH", () -> commands.publish(channel, message));
    }

    @Override
    public void configSet(String parameter, String value) {
        call("CONFIG SET", () -> commands.configSet(parameter, value));
    }

    @Override
    public StorePipeline pipeline() {
        return new LettuceStorePipeline(this, connection, timeout);
    }

    @Override
    public NotificationChannel psubscribe(String pattern) {
        return call("PSUBSCRIBE", () -> {
            StatefulRedisPubSubConnection<String, String> pubSub = client.connectPubSub();
            return LettuceNotificationChannel.open(pubSub, database.name(), pattern);
        });
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            try {
                connection.close();
            } finally {
                client.shutdown();
            }
        }
    }

    <T> T call(String command, Supplier<T> operation) {
        try {
            return operation.get();
        } catch (RedisException e) {
            throw translate(command, e);
        }
    }

    StoreException translate(String command, RedisException e) {
        if (e instanceof RedisCommandExecutionException && !isTransient(e.getMessage())) {
            return new StoreException.BadRequest(
                "Bad request " + command + " on database '" + database.name() + "': " + e.getMessage(), e);
        }
        return new StoreException.ConnectionFailed(
            database.name(), command + " failed on database '" + database.name() + "'", e);
    }

    private static boolean isTransient(String message) {
        return message != null && (message.startsWith("LOADING") || message.startsWith("BUSY"));
    }
}
