package org.tfviewer.datapipeline.utils;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class SortedListsTest {

    private record Point(long step, String name) {
    }

    @Test
    void testUpperBound_SkipsAllEqualKeys() {
        List<Long> steps = List.of(1L, 3L, 3L, 3L, 7L);

        assertThat(SortedLists.upperBound(steps, 0L, Long::longValue)).isZero();
        assertThat(SortedLists.upperBound(steps, 3L, Long::longValue)).isEqualTo(4);
        assertThat(SortedLists.upperBound(steps, 9L, Long::longValue)).isEqualTo(5);
    }

    @Test
    void testInsertRight_KeepsInsertionOrderForEqualKeys() {
        List<Point> points = new ArrayList<>();
        SortedLists.insertRight(points, new Point(2, "a"), Point::step);
        SortedLists.insertRight(points, new Point(1, "b"), Point::step);
        int position = SortedLists.insertRight(points, new Point(2, "c"), Point::step);

        assertThat(position).isEqualTo(2);
        assertThat(points).extracting(Point::name).containsExactly("b", "a", "c");
    }

    @Test
    void testInsertUnique_ReportsPositionOrMinusOne() {
        List<Long> steps = new ArrayList<>();

        assertThat(SortedLists.insertUnique(steps, 5L)).isZero();
        assertThat(SortedLists.insertUnique(steps, 2L)).isZero();
        assertThat(SortedLists.insertUnique(steps, 9L)).isEqualTo(2);
        assertThat(SortedLists.insertUnique(steps, 5L)).isEqualTo(-1);
        assertThat(steps).containsExactly(2L, 5L, 9L);
    }
}
