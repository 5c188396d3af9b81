package org.tfviewer.datapipeline.services.ingestion;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.tfviewer.datapipeline.api.entries.EntryType;
import org.tfviewer.datapipeline.api.entries.LoaderId;
import org.tfviewer.datapipeline.api.entries.PerStepEntry;
import org.tfviewer.datapipeline.api.entries.Tag;
import org.tfviewer.datapipeline.entries.ScalarEntry;
import org.tfviewer.datapipeline.resources.files.TrackedFile;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

@org.junit.jupiter.api.Tag("unit")
class EntryIndexTest {

    private static final TrackedFile FILE = new TrackedFile(Path.of("events.out.tfevents.1"));

    private EntryIndex index;

    private static final class StepEntry extends PerStepEntry {
        StepEntry(Tag tag, long step, long offset) {
            super(FILE, offset, tag, step, LoaderId.of(0));
        }

        @Override
        public EntryType getType() {
            return EntryType.IMAGE;
        }
    }

    @BeforeEach
    void setUp() {
        index = new EntryIndex();
    }

    @Test
    void testAdd_ReportsNewTagsAndStepPositions() {
        EntryIndex.Insertion first = index.add(new StepEntry(Tag.of("img"), 5, 0));
        EntryIndex.Insertion second = index.add(new StepEntry(Tag.of("img"), 2, 10));
        EntryIndex.Insertion repeat = index.add(new StepEntry(Tag.of("mask", 0), 5, 20));

        assertThat(first).isEqualTo(new EntryIndex.Insertion(true, 0));
        assertThat(second).isEqualTo(new EntryIndex.Insertion(false, 0));
        assertThat(repeat).isEqualTo(new EntryIndex.Insertion(true, -1));
        assertThat(index.stepsCopy()).containsExactly(2L, 5L);
        assertThat(index.perStepCount()).isEqualTo(3);
    }

    @Test
    void testAddStep_SharesStepListWithPerStepEntries() {
        index.add(new StepEntry(Tag.of("img"), 0, 0));
        index.add(new StepEntry(Tag.of("img"), 1, 10));

        assertThat(index.addStep(0)).isEqualTo(-1);
        assertThat(index.addStep(2)).isEqualTo(2);
        assertThat(index.addStep(2)).isEqualTo(-1);
        assertThat(index.stepsCopy()).containsExactly(0L, 1L, 2L);
        assertThat(index.entriesAtStepCopy(2)).isEmpty();
        assertThat(index.perStepCount()).isEqualTo(2);
    }

    @Test
    void testAdd_EqualStepsKeepInsertionOrderAndNewestWinsAtStep() {
        StepEntry older = new StepEntry(Tag.of("img"), 3, 0);
        StepEntry newer = new StepEntry(Tag.of("img"), 3, 40);
        StepEntry earlier = new StepEntry(Tag.of("img"), 1, 80);

        index.add(older);
        index.add(newer);
        index.add(earlier);

        assertThat(index.entriesCopy(Tag.of("img"))).containsExactly(earlier, older, newer);
        assertThat(index.entriesAtStepCopy(3)).containsEntry(Tag.of("img"), newer);
        assertThat(index.entriesAtStepCopy(4)).isEmpty();
    }

    @Test
    void testTags_IncludeGlobalsInFirstSeenOrder() {
        index.add(new ScalarEntry(Tag.of("loss")));
        index.add(new StepEntry(Tag.of("img"), 0, 0));

        assertThat(index.tags()).containsExactly(Tag.of("loss"), Tag.of("img"));
        assertThat(index.tagTypesCopy()).containsExactly(
            entry(Tag.of("loss"), EntryType.SCALAR),
            entry(Tag.of("img"), EntryType.IMAGE));
        assertThat(index.tagIndexCopy()).containsOnlyKeys(Tag.of("img"));
        assertThat(index.isGlobal(Tag.of("loss"))).isTrue();
        assertThat(index.globalEntry(Tag.of("loss"))).isNotNull();
        assertThat(index.tagCount()).isEqualTo(2);
    }

    @Test
    void testAdd_RejectsSecondGlobalForTag() {
        index.add(new ScalarEntry(Tag.of("loss")));

        assertThatThrownBy(() -> index.add(new ScalarEntry(Tag.of("loss"))))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("already registered");
    }

    @Test
    void testAdd_RejectsTypeConflicts() {
        index.add(new ScalarEntry(Tag.of("x")));
        index.add(new StepEntry(Tag.of("y"), 0, 0));

        assertThatThrownBy(() -> index.add(new StepEntry(Tag.of("x"), 0, 0)))
            .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> index.add(new ScalarEntry(Tag.of("y"))))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testClear_ClosesEntries() {
        StepEntry entry = new StepEntry(Tag.of("img"), 0, 0);
        index.add(entry);
        index.add(new ScalarEntry(Tag.of("loss")));

        index.clear();

        assertThat(entry.isClosed()).isTrue();
        assertThat(index.tags()).isEmpty();
        assertThat(index.stepsCopy()).isEmpty();
        assertThat(index.globals()).isEmpty();
        assertThat(index.perStepCount()).isZero();
    }
}
