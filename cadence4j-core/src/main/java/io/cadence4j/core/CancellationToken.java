package io.cadence4j.core;

import java.time.Duration;
import java.util.concurrent.CancellationException;

/**
 * Cooperative cancellation signal handed to work units and retry loops.
 *
 * @see CancellationSource
 */
public interface CancellationToken {

    boolean isCancelled();

    /**
     * Blocks the calling thread for up to {@code timeout}, returning early once cancelled.
     *
     * @return true if the token was cancelled, false if the timeout elapsed first
     */
    boolean awaitCancellation(Duration timeout) throws InterruptedException;

    default void throwIfCancelled() {
        if (isCancelled()) {
            throw new CancellationException("operation cancelled");
        }
    }

    /**
     * A token that is never cancelled.
     */
    static CancellationToken none() {
        return NoneToken.INSTANCE;
    }

    final class NoneToken implements CancellationToken {
        private static final NoneToken INSTANCE = new NoneToken();

        private NoneToken() {
        }

        @Override
        public boolean isCancelled() {
            return false;
        }

        @Override
        public boolean awaitCancellation(Duration timeout) throws InterruptedException {
            long millis = timeout.toMillis();
            if (millis > 0) {
                Thread.sleep(millis);
            }
            return false;
        }
    }
}
