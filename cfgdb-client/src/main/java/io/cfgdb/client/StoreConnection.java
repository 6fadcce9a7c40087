package io.cfgdb.client;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Primitive commands of the store, bound to one numeric database. Transport failures surface as
 * {@link io.cfgdb.common.exception.StoreException.ConnectionFailed}, rejected commands as
 * {@link io.cfgdb.common.exception.StoreException.BadRequest}.
 */
public interface StoreConnection extends AutoCloseable {

    DatabaseSpec database();

    Optional<String> get(String key);

    Optional<String> hget(String key, String field);

    Map<String, String> hgetall(String key);

    long hset(String key, Map<String, String> fields);

    long hdel(String key, String... fields);

    long del(String... keys);

    List<String> keys(String pattern);

    ScanPage scan(String cursor, String pattern, int count);

    boolean expire(String key, Duration ttl);

    boolean exists(String key);

    long publish(String channel, String message);

    void configSet(String parameter, String value);

    StorePipeline pipeline();

    NotificationChannel psubscribe(String pattern);

    @Override
    void close();
}
