package org.tfviewer.datapipeline.resources.files;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.tfviewer.datapipeline.api.contracts.Event;
import org.tfviewer.junit.extensions.logging.ExpectLog;
import org.tfviewer.junit.extensions.logging.LogLevel;
import org.tfviewer.junit.extensions.logging.LogWatchExtension;
import org.tfviewer.test.utils.TfRecordFiles;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class TrackedFileTest {

    @TempDir
    Path tempDir;

    @Test
    void testHasChanged_TracksCommittedOffset() throws IOException {
        Path path = tempDir.resolve("run.tfevents.1");
        long size = TfRecordFiles.append(path, TfRecordFiles.scalarEvent(0, "loss", 1f));
        TrackedFile file = new TrackedFile(path);

        assertThat(file.isValid()).isTrue();
        assertThat(file.hasChanged()).isTrue();
        assertThat(file.size()).isEqualTo(size);

        file.setCommittedOffset(size);
        assertThat(file.hasChanged()).isFalse();

        TfRecordFiles.append(path, TfRecordFiles.scalarEvent(1, "loss", 2f));
        assertThat(file.hasChanged()).isTrue();
    }

    @Test
    void testIsValid_FalseWhenDeleted() throws IOException {
        Path path = tempDir.resolve("run.tfevents.1");
        TfRecordFiles.append(path, TfRecordFiles.scalarEvent(0, "loss", 1f));
        TrackedFile file = new TrackedFile(path);

        Files.delete(path);

        assertThat(file.isValid()).isFalse();
        assertThat(file.size()).isZero();
        assertThat(file.lastModifiedTime()).isZero();
    }

    @Test
    void testIsValid_FalseWhenTruncatedBelowCommittedOffset() throws IOException {
        Path path = tempDir.resolve("run.tfevents.1");
        long size = TfRecordFiles.append(path, TfRecordFiles.scalarEvent(0, "loss", 1f));
        TrackedFile file = new TrackedFile(path);
        file.setCommittedOffset(size);

        Files.write(path, new byte[3]);

        assertThat(file.isValid()).isFalse();
    }

    @Test
    void testNewReader_StartsAtCommittedOffset() throws IOException {
        Path path = tempDir.resolve("run.tfevents.1");
        long first = TfRecordFiles.append(path, TfRecordFiles.scalarEvent(0, "loss", 1f));
        TfRecordFiles.append(path, TfRecordFiles.scalarEvent(7, "loss", 2f));
        TrackedFile file = new TrackedFile(path);
        file.setCommittedOffset(first);

        try (var reader = file.newReader()) {
            Event event = Event.parseFrom(reader.next().orElseThrow().payload());
            assertThat(event.getStep()).isEqualTo(7);
        }
    }

    @Test
    void testReadCachedAndDecodeAt_ReturnsCachedMessage() throws IOException {
        Path path = tempDir.resolve("run.tfevents.1");
        long first = TfRecordFiles.append(path, TfRecordFiles.scalarEvent(0, "loss", 1f));
        TfRecordFiles.append(path, TfRecordFiles.scalarEvent(5, "acc", 0.5f));
        TrackedFile file = new TrackedFile(path, 2);

        Event event = file.readCachedAndDecodeAt(first, Event.parser());
        assertThat(event.getStep()).isEqualTo(5);
        assertThat(file.readCachedAndDecodeAt(first, Event.parser())).isSameAs(event);
        assertThat(file.readCachedRecordAt(first)).isEqualTo(event.toByteArray());
    }

    @Test
    void testReadCachedRecordAt_FailsWithoutCompleteRecord() throws IOException {
        Path path = tempDir.resolve("run.tfevents.1");
        long size = TfRecordFiles.append(path, TfRecordFiles.scalarEvent(0, "loss", 1f));
        TrackedFile file = new TrackedFile(path);

        assertThatThrownBy(() -> file.readCachedRecordAt(size))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("No complete record");
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "Committed offset of .* regressed from .*")
    void testSetCommittedOffset_RegressionIsLoggedAndDropsCache() throws IOException {
        Path path = tempDir.resolve("run.tfevents.1");
        long size = TfRecordFiles.append(path, TfRecordFiles.scalarEvent(0, "loss", 1f));
        TrackedFile file = new TrackedFile(path);
        byte[] cached = file.readCachedRecordAt(0);
        file.setCommittedOffset(size);

        file.setCommittedOffset(0);

        assertThat(file.committedOffset()).isZero();
        assertThat(file.readCachedRecordAt(0)).isNotSameAs(cached).isEqualTo(cached);
    }

    @Test
    void testConstructor_RejectsEmptyCache() {
        assertThatThrownBy(() -> new TrackedFile(tempDir.resolve("x"), 0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
