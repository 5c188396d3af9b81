package org.tfviewer.datapipeline.utils;

import java.util.Collections;
import java.util.List;
import java.util.function.ToLongFunction;

/**
 * Binary-search insertion helpers for lists kept in ascending order.
 * <p>
 * The index structures of the ingestion engine are plain {@link java.util.ArrayList}s that are
 * only ever inserted into, so a sorted list with binary insertion is all they need.
 */
public final class SortedLists {

    private SortedLists() {
        // Utility class - prevent instantiation
    }

    /**
     * Keys may repeat; the result is the boundary after all equal keys.
     *
     * @return The first index whose key is {@code > key}.
     */
    public static <T> int upperBound(List<T> list, long key, ToLongFunction<? super T> keyOf) {
        int low = 0;
        int high = list.size();
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (keyOf.applyAsLong(list.get(mid)) <= key) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }

    /**
     * Inserts {@code value} after all elements with an equal key.
     *
     * @return The insert position.
     */
    public static <T> int insertRight(List<T> list, T value, ToLongFunction<? super T> keyOf) {
        int index = upperBound(list, keyOf.applyAsLong(value), keyOf);
        list.add(index, value);
        return index;
    }

    /**
     * Inserts {@code value} unless it is already present.
     *
     * @return The insert position, or -1 if the value was already present.
     */
    public static int insertUnique(List<Long> list, long value) {
        int found = Collections.binarySearch(list, value);
        if (found >= 0) {
            return -1;
        }
        int index = -found - 1;
        list.add(index, value);
        return index;
    }
}
