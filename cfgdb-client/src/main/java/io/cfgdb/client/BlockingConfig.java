package io.cfgdb.client;

import java.time.Duration;
import java.util.Objects;

/**
 * Timing of blocking reads.
 *
 * @param notificationTimeout how long a single wait for a change notification may take
 * @param maxDataWait total time spent waiting for notifications before a read gives up
 * @param dataSettleWait pause after a matching notification before the read is retried
 * @param errorThreshold consecutive connection failures after which failures are logged as errors
 * @param suppressionThreshold consecutive connection failures after which logging drops back to warnings
 */
public record BlockingConfig(
    Duration notificationTimeout,
    Duration maxDataWait,
    Duration dataSettleWait,
    int errorThreshold,
    int suppressionThreshold
) {
    public BlockingConfig {
        Objects.requireNonNull(notificationTimeout, "notificationTimeout must not be null");
        Objects.requireNonNull(maxDataWait, "maxDataWait must not be null");
        Objects.requireNonNull(dataSettleWait, "dataSettleWait must not be null");
        if (notificationTimeout.isNegative() || notificationTimeout.isZero()) {
            throw new IllegalArgumentException("notificationTimeout must be positive");
        }
        if (maxDataWait.isNegative()) {
            throw new IllegalArgumentException("maxDataWait must not be negative");
        }
        if (dataSettleWait.isNegative()) {
            throw new IllegalArgumentException("dataSettleWait must not be negative");
        }
        if (errorThreshold < 0) {
            throw new IllegalArgumentException("errorThreshold must be non-negative");
        }
        if (suppressionThreshold <= errorThreshold) {
            throw new IllegalArgumentException("suppressionThreshold must be greater than errorThreshold");
        }
    }

    public static BlockingConfig defaults() {
        return new BlockingConfig(
            Duration.ofSeconds(10),
            Duration.ofSeconds(60),
            Duration.ofSeconds(3),
            10,
            15
        );
    }
}
