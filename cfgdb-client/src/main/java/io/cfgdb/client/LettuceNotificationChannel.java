package io.cfgdb.client;

import io.cfgdb.common.exception.StoreException;
import io.lettuce.core.pubsub.RedisPubSubAdapter;
import io.lettuce.core.pubsub.StatefulRedisPubSubConnection;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Buffers pattern messages delivered on the driver's event loop until a reader polls them. The
 * connection does not reconnect on its own; once it drops, {@link #poll(Duration)} fails with
 * {@link StoreException.ConnectionFailed} after the buffered messages have been drained.
 */
final class LettuceNotificationChannel implements NotificationChannel {

    private final StatefulRedisPubSubConnection<String, String> connection;
    private final String database;
    private final String pattern;
    private final BlockingQueue<KeyspaceEvent> queue = new LinkedBlockingQueue<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private LettuceNotificationChannel(
        StatefulRedisPubSubConnection<String, String> connection,
        String database,
        String pattern
    ) {
        this.connection = connection;
        this.database = database;
        this.pattern = pattern;
    }

    static LettuceNotificationChannel open(
        StatefulRedisPubSubConnection<String, String> connection,
        String database,
        String pattern
    ) {
        var channel = new LettuceNotificationChannel(connection, database, pattern);
        connection.addListener(new RedisPubSubAdapter<>() {
            @Override
            public void message(String subscribed, String channelName, String message) {
                if (!channel.closed.get()) {
                    channel.queue.offer(new KeyspaceEvent(subscribed, channelName, message));
                }
            }
        });
        try {
            connection.sync().psubscribe(pattern);
        } catch (RuntimeException e) {
            connection.close();
            throw e;
        }
        return channel;
    }

    @Override
    public String pattern() {
        return pattern;
    }

    @Override
    public Optional<KeyspaceEvent> poll(Duration timeout) throws InterruptedException {
        if (closed.get()) {
            throw new IllegalStateException("Notification channel '" + pattern + "' is closed");
        }
        KeyspaceEvent event = queue.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
        if (event == null && !connection.isOpen()) {
            throw new StoreException.ConnectionFailed(
                database, "Notification connection for '" + pattern + "' on database '" + database + "' was lost", null);
        }
        return Optional.ofNullable(event);
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            queue.clear();
            connection.close();
        }
    }
}
