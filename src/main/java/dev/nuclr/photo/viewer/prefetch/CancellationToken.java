package dev.nuclr.photo.viewer.prefetch;

import java.util.concurrent.CancellationException;

/**
 * Read side of a {@link CancellationSource}. Checked cooperatively at loop
 * boundaries; {@link #sleep} wakes up as soon as the source is cancelled.
 */
public interface CancellationToken {

    boolean isCancelled();

    /** @throws CancellationException if cancelled */
    default void throwIfCancelled() {
        if (isCancelled()) throw new CancellationException();
    }

    /**
     * Wait for {@code millis}, or less if cancelled meanwhile.
     *
     * @throws CancellationException if cancelled before or during the wait
     */
    void sleep(long millis);

    /** A token that is never cancelled. */
    CancellationToken NONE = new CancellationToken() {
        @Override
        public boolean isCancelled() {
            return false;
        }

        @Override
        public void sleep(long millis) {
            try {
                Thread.sleep(millis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CancellationException("Interrupted");
            }
        }
    };
}
