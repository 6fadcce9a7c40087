package io.cfgdb.client;

import java.time.Duration;
import java.util.Optional;

/**
 * Pattern subscription to the change-event stream of a store.
 */
public interface NotificationChannel extends AutoCloseable {

    String pattern();

    /**
     * Waits up to {@code timeout} for the next event.
     */
    Optional<KeyspaceEvent> poll(Duration timeout) throws InterruptedException;

    @Override
    void close();
}
