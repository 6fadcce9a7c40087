package io.cfgdb.client;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Commands queued client side and sent in one round trip by {@link #execute()}. Replies of queued
 * reads become available through the returned suppliers once {@code execute} has returned.
 */
public interface StorePipeline {

    Supplier<Map<String, String>> hgetall(String key);

    void hset(String key, Map<String, String> fields);

    void hdel(String key, String... fields);

    void del(String key);

    int size();

    void execute();
}
