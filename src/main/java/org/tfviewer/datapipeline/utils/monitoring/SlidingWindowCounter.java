package org.tfviewer.datapipeline.utils.monitoring;

import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A thread-safe counter of events over a sliding window of whole seconds.
 * <p>
 * Recording is O(1); {@link #getRate()} is O(windowSeconds). Buckets older than the window are
 * dropped once more than {@code windowSeconds + 5} of them exist.
 * <pre>
 * SlidingWindowCounter records = new SlidingWindowCounter(5);
 * records.recordCount();
 * double recordsPerSecond = records.getRate();
 * </pre>
 */
public class SlidingWindowCounter {

    private final ConcurrentHashMap<Long, AtomicLong> buckets = new ConcurrentHashMap<>();
    private final int windowSeconds;
    private final int maxBuckets;

    /**
     * @param windowSeconds The size of the sliding window in seconds.
     * @throws IllegalArgumentException if windowSeconds <= 0
     */
    public SlidingWindowCounter(int windowSeconds) {
        if (windowSeconds <= 0) {
            throw new IllegalArgumentException("Window size must be positive, got: " + windowSeconds);
        }
        this.windowSeconds = windowSeconds;
        this.maxBuckets = windowSeconds + 5;
    }

    public void recordCount() {
        recordSum(1);
    }

    /**
     * Adds {@code value} to the current second's bucket.
     */
    public void recordSum(long value) {
        long currentSecond = Instant.now().getEpochSecond();
        buckets.computeIfAbsent(currentSecond, k -> new AtomicLong()).addAndGet(value);
        cleanupIfNeeded(currentSecond);
    }

    /**
     * @return The average sum per second over the window ending now.
     */
    public double getRate() {
        return getRate(Instant.now().getEpochSecond());
    }

    public double getRate(long nowSeconds) {
        long total = 0;
        for (int i = 0; i < windowSeconds; i++) {
            AtomicLong bucket = buckets.get(nowSeconds - i);
            if (bucket != null) {
                total += bucket.get();
            }
        }
        return (double) total / windowSeconds;
    }

    int getBucketCount() {
        return buckets.size();
    }

    private void cleanupIfNeeded(long currentSecond) {
        if (buckets.size() > maxBuckets) {
            long cutoffSecond = currentSecond - windowSeconds - 1;
            buckets.keySet().removeIf(second -> second < cutoffSecond);
        }
    }
}
