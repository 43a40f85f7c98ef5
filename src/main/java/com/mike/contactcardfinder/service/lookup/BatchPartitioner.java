package com.mike.contactcardfinder.service.lookup;

import java.util.ArrayList;
import java.util.List;

public final class BatchPartitioner {

    private BatchPartitioner() {
    }

    /**
     * Consecutive slices of {@code size} items in source order; the last one may be shorter.
     */
    public static <T> List<List<T>> partition(List<T> items, int size) {
        if (size <= 0) throw new IllegalArgumentException("batch size must be > 0, got " + size);
        if (items == null || items.isEmpty()) return List.of();

        List<List<T>> batches = new ArrayList<>((items.size() + size - 1) / size);
        for (int from = 0; from < items.size(); from += size) {
            batches.add(List.copyOf(items.subList(from, Math.min(items.size(), from + size))));
        }
        return batches;
    }
}
