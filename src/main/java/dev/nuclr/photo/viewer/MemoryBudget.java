package dev.nuclr.photo.viewer;

/**
 * Memory the application may use, as reported by the platform.
 */
@FunctionalInterface
public interface MemoryBudget {

    /** Upper bound for the whole application in MB; non-positive when unknown. */
    int appMemoryLimitMb();
}
