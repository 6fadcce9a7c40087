package io.cfgdb.client;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Cooperative cancellation for loops that would otherwise never give up: persistent connects,
 * reconnect backoff and notification waits.
 */
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken(false);

    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final boolean cancellable;

    private CancellationToken(boolean cancellable) {
        this.cancellable = cancellable;
    }

    public static CancellationToken create() {
        return new CancellationToken(true);
    }

    public static CancellationToken none() {
        return NONE;
    }

    public void cancel() {
        if (!cancellable) {
            throw new UnsupportedOperationException("This token cannot be cancelled");
        }
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new CancellationException("Operation cancelled");
        }
    }

    /**
     * Sleeps for {@code duration}, waking early with {@link CancellationException} when the token is
     * cancelled or the thread is interrupted. The interrupt flag is restored in the latter case.
     */
    public void pause(Duration duration) {
        try {
            if (cancelled.await(duration.toNanos(), TimeUnit.NANOSECONDS)) {
                throw new CancellationException("Operation cancelled");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw interrupted();
        }
    }

    static CancellationException interrupted() {
        return new CancellationException("Interrupted");
    }
}
