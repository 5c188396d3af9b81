package org.tfviewer.datapipeline.entries;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.tfviewer.datapipeline.api.entries.EntryType;
import org.tfviewer.datapipeline.api.entries.GlobalEntryListener;
import org.tfviewer.datapipeline.api.entries.LoaderId;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@Tag("unit")
class ScalarEntryTest {

    private final ScalarEntry entry = new ScalarEntry(org.tfviewer.datapipeline.api.entries.Tag.of("loss"));

    @Test
    void testAddData_PartitionsByTopLevelLoader() {
        entry.addData(5, 1.0, LoaderId.of(0, 1));
        entry.addData(3, 2.0, LoaderId.of(0, 2));
        entry.addData(4, 9.0, LoaderId.of(1));

        assertThat(entry.getType()).isEqualTo(EntryType.SCALAR);
        assertThat(entry.isPerStep()).isFalse();
        assertThat(entry.loaderIds()).containsExactly(LoaderId.of(0), LoaderId.of(1));
        assertThat(entry.steps(LoaderId.of(0))).containsExactly(3L, 5L);
        assertThat(entry.getData(LoaderId.of(0))).containsExactly(2.0, 1.0);
        assertThat(entry.steps()).containsExactly(3L, 4L, 5L);
        assertThat(entry.size()).isEqualTo(3);
    }

    @Test
    void testAddData_RepeatedStepGoesAfterExisting() {
        assertThat(entry.addData(5, 1.0, LoaderId.of(0))).isZero();
        assertThat(entry.addData(7, 2.0, LoaderId.of(0))).isEqualTo(1);
        assertThat(entry.addData(5, 3.0, LoaderId.of(0))).isEqualTo(1);

        assertThat(entry.steps(LoaderId.of(0))).containsExactly(5L, 5L, 7L);
        assertThat(entry.getData(LoaderId.of(0))).containsExactly(1.0, 3.0, 2.0);
        assertThat(entry.steps()).containsExactly(5L, 7L);
    }

    @Test
    void testAddData_NotifiesWithPositionAndRoot() {
        GlobalEntryListener listener = mock(GlobalEntryListener.class);
        entry.addListener(listener);

        entry.addData(2, 1.0, LoaderId.of(3, 0));
        entry.addData(1, 1.0, LoaderId.of(3, 1));

        var order = inOrder(listener);
        order.verify(listener).onStepAdded(0, LoaderId.of(3));
        order.verify(listener).onStepAdded(0, LoaderId.of(3));
        verifyNoMoreInteractions(listener);
    }

    @Test
    void testUnknownLoader_IsEmpty() {
        assertThat(entry.steps(LoaderId.of(9))).isEmpty();
        assertThat(entry.getData(LoaderId.of(9))).isEmpty();
    }

    @Test
    void testClose_DropsDataAndListeners() {
        GlobalEntryListener listener = mock(GlobalEntryListener.class);
        entry.addListener(listener);
        entry.addData(1, 1.0, LoaderId.of(0));

        entry.close();
        entry.addData(2, 1.0, LoaderId.of(0));

        assertThat(entry.size()).isEqualTo(1);
        verify(listener, times(1)).onStepAdded(anyInt(), any());
    }
}
