package dev.nuclr.photo.viewer;

import javax.swing.SwingUtilities;

/**
 * Schedules work on the thread that owns the display resources.
 *
 * <p>The cache uses it to release evicted bitmaps and to deliver cache status
 * notifications, so neither ever runs on the thread performing an eviction scan.
 */
@FunctionalInterface
public interface UiDispatcher {

    void post(Runnable action);

    /** Dispatcher backed by the Swing event dispatch thread. */
    static UiDispatcher swing() {
        return SwingUtilities::invokeLater;
    }
}
