package io.cfgdb.client;

import io.lettuce.core.LettuceFutures;
import io.lettuce.core.RedisCommandTimeoutException;
import io.lettuce.core.RedisFuture;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.async.RedisAsyncCommands;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Queues commands locally and writes them with auto-flush disabled, so that synchronous commands
 * issued on the same connection between two {@link #execute()} calls are not held back.
 */
final class LettuceStorePipeline implements StorePipeline {

    private final LettuceStoreConnection owner;
    private final StatefulRedisConnection<String, String> connection;
    private final Duration timeout;
    private final List<Function<RedisAsyncCommands<String, String>, RedisFuture<?>>> queued = new ArrayList<>();

    LettuceStorePipeline(
        LettuceStoreConnection owner,
        StatefulRedisConnection<String, String> connection,
        Duration timeout
    ) {
        this.owner = owner;
        this.connection = connection;
        this.timeout = timeout;
    }

    @Override
    public Supplier<Map<String, String>> hgetall(String key) {
        AtomicReference<RedisFuture<Map<String, String>>> reply = new AtomicReference<>();
        queued.add(async -> {
            RedisFuture<Map<String, String>> future = async.hgetall(key);
            reply.set(future);
            return future;
        });
        return () -> {
            RedisFuture<Map<String, String>> future = reply.get();
            if (future == null || !future.isDone()) {
                throw new IllegalStateException("Pipeline has not been executed");
            }
            return owner.call("HGETALL", () ->
                LettuceFutures.awaitOrCancel(future, timeout.toNanos(), TimeUnit.NANOSECONDS));
        };
    }

    @Override
    public void hset(String key, Map<String, String> fields) {
        queued.add(async -> async.hset(key, fields));
    }

    @Override
    public void hdel(String key, String... fields) {
        queued.add(async -> async.hdel(key, fields));
    }

    @Override
    public void del(String key) {
        queued.add(async -> async.del(key));
    }

    @Override
    public int size() {
        return queued.size();
    }

    @Override
    public void execute() {
        if (queued.isEmpty()) {
            return;
        }
        owner.call("PIPELINE", () -> {
            RedisAsyncCommands<String, String> async = connection.async();
            List<RedisFuture<?>> futures = new ArrayList<>(queued.size());
            connection.setAutoFlushCommands(false);
            try {
                for (var command : queued) {
                    futures.add(command.apply(async));
                }
                connection.flushCommands();
            } finally {
                connection.setAutoFlushCommands(true);
                queued.clear();
            }
            if (!LettuceFutures.awaitAll(timeout, futures.toArray(new RedisFuture<?>[0]))) {
                throw new RedisCommandTimeoutException("Pipeline of " + futures.size() + " commands timed out");
            }
            return null;
        });
    }
}
