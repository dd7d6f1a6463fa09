package dev.nuclr.photo.viewer.prefetch;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Owns one cancellable run. Cancelling is one-way and wakes every
 * {@link CancellationToken#sleep} in progress.
 */
public final class CancellationSource {

    private final CountDownLatch cancelled = new CountDownLatch(1);

    private final CancellationToken token = new CancellationToken() {
        @Override
        public boolean isCancelled() {
            return cancelled.getCount() == 0;
        }

        @Override
        public void sleep(long millis) {
            throwIfCancelled();
            try {
                if (cancelled.await(millis, TimeUnit.MILLISECONDS)) {
                    throw new CancellationException();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CancellationException("Interrupted");
            }
        }
    };

    public CancellationToken token() {
        return token;
    }

    public void cancel() {
        cancelled.countDown();
    }

    public boolean isCancelled() {
        return token.isCancelled();
    }
}
