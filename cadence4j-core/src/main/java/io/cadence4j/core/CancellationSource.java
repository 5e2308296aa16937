package io.cadence4j.core;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Owner side of a {@link CancellationToken}. Cancelling is idempotent and wakes every waiter.
 */
public final class CancellationSource {

    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final CancellationToken token = new Token();

    public CancellationToken token() {
        return token;
    }

    public void cancel() {
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    private final class Token implements CancellationToken {
        @Override
        public boolean isCancelled() {
            return CancellationSource.this.isCancelled();
        }

        @Override
        public boolean awaitCancellation(Duration timeout) throws InterruptedException {
            Objects.requireNonNull(timeout, "timeout must not be null");
            if (timeout.isZero() || timeout.isNegative()) {
                return isCancelled();
            }
            return cancelled.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }
    }
}
