package dev.nuclr.photo.viewer.prefetch;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Picks which indices to prefetch, nearest first.
 * Ties on distance go to the smaller index.
 */
public final class PrefetchPlanner {

    private PrefetchPlanner() {}

    /**
     * Up to {@code forward} indices after {@code current} and {@code backward}
     * before it, within {@code [0, size)}.
     */
    public static List<Integer> aroundCurrent(int current, int size, int forward, int backward) {
        if (size <= 0 || current < 0 || current >= size) return List.of();

        List<Integer> indices = new ArrayList<>();
        for (int i = 1; i <= Math.max(0, forward) && current + i < size; i++) {
            indices.add(current + i);
        }
        for (int i = 1; i <= Math.max(0, backward) && current - i >= 0; i++) {
            indices.add(current - i);
        }
        return byDistance(indices, current);
    }

    /**
     * The {@code max(1, need)} indices of the visible range closest to its midpoint.
     * The range is clamped to {@code [0, size)}.
     */
    public static List<Integer> visibleCenter(int first, int last, int size, int need) {
        if (size <= 0) return List.of();
        int lo = Math.max(0, Math.min(first, size - 1));
        int hi = Math.max(0, Math.min(last, size - 1));
        if (hi < lo) return List.of();

        int center = (lo + hi) / 2;
        List<Integer> indices = new ArrayList<>(hi - lo + 1);
        for (int i = lo; i <= hi; i++) indices.add(i);

        List<Integer> ordered = byDistance(indices, center);
        return ordered.subList(0, Math.min(ordered.size(), Math.max(1, need)));
    }

    private static List<Integer> byDistance(List<Integer> indices, int origin) {
        indices.sort(Comparator.<Integer>comparingInt(i -> Math.abs(i - origin))
                .thenComparingInt(i -> i));
        return indices;
    }
}
