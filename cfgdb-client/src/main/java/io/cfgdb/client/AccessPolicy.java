package io.cfgdb.client;

import java.util.Objects;

/**
 * How a read reacts to missing data. Connection failures are retried under every policy; the
 * cancellation token bounds those retries as well as the wait for data.
 *
 * @param waitForData whether a read that finds nothing waits for the data to be written
 */
public record AccessPolicy(boolean waitForData, CancellationToken cancellation) {

    private static final AccessPolicy NON_BLOCKING = new AccessPolicy(false, CancellationToken.none());
    private static final AccessPolicy BLOCKING = new AccessPolicy(true, CancellationToken.none());

    public AccessPolicy {
        Objects.requireNonNull(cancellation, "cancellation must not be null");
    }

    public static AccessPolicy nonBlocking() {
        return NON_BLOCKING;
    }

    public static AccessPolicy blocking() {
        return BLOCKING;
    }

    public static AccessPolicy blocking(CancellationToken cancellation) {
        return new AccessPolicy(true, cancellation);
    }

    public static AccessPolicy nonBlocking(CancellationToken cancellation) {
        return new AccessPolicy(false, cancellation);
    }
}
