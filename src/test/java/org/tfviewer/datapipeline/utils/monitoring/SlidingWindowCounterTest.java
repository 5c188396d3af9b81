package org.tfviewer.datapipeline.utils.monitoring;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

@Tag("unit")
class SlidingWindowCounterTest {

    @Test
    void testConstructor_RejectsNonPositiveWindow() {
        assertThatThrownBy(() -> new SlidingWindowCounter(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testGetRate_AveragesOverWindow() {
        SlidingWindowCounter counter = new SlidingWindowCounter(5);
        counter.recordSum(7);
        counter.recordCount();
        counter.recordCount();
        counter.recordCount();
        long now = Instant.now().getEpochSecond();

        assertThat(counter.getRate(now)).isEqualTo(2.0);
        assertThat(counter.getBucketCount()).isBetween(1, 2);
    }

    @Test
    void testGetRate_OldBucketsFallOutOfWindow() {
        SlidingWindowCounter counter = new SlidingWindowCounter(2);
        counter.recordSum(10);
        long now = Instant.now().getEpochSecond();

        assertThat(counter.getRate(now + 10)).isZero();
    }

    @Test
    void testGetRate_EmptyCounter() {
        assertThat(new SlidingWindowCounter(3).getRate()).isZero();
    }
}
