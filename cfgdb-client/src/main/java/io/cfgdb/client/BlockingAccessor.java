package io.cfgdb.client;

import io.cfgdb.common.exception.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * Runs store reads under an {@link AccessPolicy}.
 *
 * <ul>
 *   <li>Connection failures close and reopen the connection, then retry. They never give up; only
 *       the policy's cancellation token ends the loop.
 *   <li>Rejected commands are thrown at once.
 *   <li>Missing data is returned as {@link ReadResult.Unavailable} for non-blocking reads. Blocking
 *       reads first subscribe to keyspace notifications and retry, then wait for a notification
 *       whose payload matches the awaited token, for at most {@link BlockingConfig#maxDataWait()}.
 * </ul>
 */
public final class BlockingAccessor {

    private static final Logger log = LoggerFactory.getLogger(BlockingAccessor.class);

    private final ConnectionRegistry registry;
    private final BlockingConfig config;

    @FunctionalInterface
    public interface Operation<T> {
        ReadResult<T> apply(StoreConnection connection);
    }

    public BlockingAccessor(ConnectionRegistry registry, BlockingConfig config) {
        this.registry = registry;
        this.config = config;
    }

    public <T> ReadResult<T> execute(String database, String operation, AccessPolicy policy, Operation<T> op) {
        CancellationToken cancellation = policy.cancellation();
        int attempts = 0;
        while (true) {
            cancellation.throwIfCancelled();
            try {
                ReadResult<T> result = op.apply(registry.connection(database));
                if (result instanceof ReadResult.Unavailable<T> unavailable) {
                    if (!policy.waitForData()) {
                        return result;
                    }
                    log.atWarn().addKeyValue("db", database).log(unavailable.reason());
                    if (registry.notifications(database).isEmpty()) {
                        // subscribe first, then read again: a write between the read and the
                        // subscription would otherwise go unnoticed
                        registry.subscribeKeyspace(database);
                        continue;
                    }
                    if (awaitNotification(database, unavailable.awaited(), cancellation)) {
                        continue;
                    }
                    registry.unsubscribeKeyspace(database);
                    return result;
                }
                registry.unsubscribeKeyspace(database);
                return result;
            } catch (StoreException.BadRequest e) {
                log.atError()
                    .setCause(e)
                    .addKeyValue("db", database)
                    .addKeyValue("operation", operation)
                    .log("Bad database request");
                throw e;
            } catch (StoreException.ConnectionFailed e) {
                attempts++;
                logAccessFailure(database, operation, attempts, e);
                registry.reconnect(database, cancellation);
            }
        }
    }

    private void logAccessFailure(String database, String operation, int attempts, StoreException e) {
        if (config.errorThreshold() < attempts && attempts < config.suppressionThreshold()) {
            log.atError()
                .setCause(e)
                .addKeyValue("db", database)
                .addKeyValue("operation", operation)
                .addKeyValue("attempts", attempts)
                .log("Database access failure");
        } else {
            log.atWarn()
                .addKeyValue("db", database)
                .addKeyValue("operation", operation)
                .addKeyValue("attempts", attempts)
                .log("Database access failure: {}", e.getMessage());
        }
    }

    private boolean awaitNotification(String database, String awaited, CancellationToken cancellation) {
        NotificationChannel channel = registry.notifications(database)
            .orElseThrow(() -> new IllegalStateException("No keyspace subscription for " + database));
        long deadline = System.nanoTime() + config.maxDataWait().toNanos();
        log.atDebug().addKeyValue("db", database).addKeyValue("awaited", awaited).log("Waiting for notification");
        while (true) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                break;
            }
            Duration timeout = Duration.ofNanos(Math.min(remaining, config.notificationTimeout().toNanos()));
            Optional<KeyspaceEvent> event;
            try {
                event = channel.poll(timeout);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw CancellationToken.interrupted();
            }
            cancellation.throwIfCancelled();
            if (event.isPresent() && awaited.equals(event.get().message())) {
                log.atInfo()
                    .addKeyValue("db", database)
                    .addKeyValue("awaited", awaited)
                    .log("Awaited data announced, unblocking");
                cancellation.pause(config.dataSettleWait());
                return true;
            }
        }
        log.atWarn()
            .addKeyValue("db", database)
            .addKeyValue("awaited", awaited)
            .log("No notification received before timeout");
        return false;
    }
}
