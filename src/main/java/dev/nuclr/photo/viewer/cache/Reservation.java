package dev.nuclr.photo.viewer.cache;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Claim on the memory budget for a prefetch decode that has not landed yet.
 * Closing it returns the bytes; closing twice is a no-op.
 */
public final class Reservation implements AutoCloseable {

    private final AtomicLong reservedBytes;
    private final long bytes;
    private final AtomicBoolean released = new AtomicBoolean();

    Reservation(AtomicLong reservedBytes, long bytes) {
        this.reservedBytes = reservedBytes;
        this.bytes = bytes;
    }

    public long bytes() {
        return bytes;
    }

    public boolean isReleased() {
        return released.get();
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            reservedBytes.addAndGet(-bytes);
        }
    }
}
