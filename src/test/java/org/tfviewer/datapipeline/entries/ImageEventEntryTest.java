package org.tfviewer.datapipeline.entries;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.tfviewer.datapipeline.api.decode.ImageData;
import org.tfviewer.datapipeline.api.entries.LoaderId;
import org.tfviewer.datapipeline.resources.files.TrackedFile;
import org.tfviewer.datapipeline.services.decode.DecodeWorkerPool;
import org.tfviewer.datapipeline.services.decode.ImageDataFuture;
import org.tfviewer.junit.extensions.logging.LogWatchExtension;
import org.tfviewer.test.utils.TfRecordFiles;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.await;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class ImageEventEntryTest {

    private static final org.tfviewer.datapipeline.api.entries.Tag IMG =
        org.tfviewer.datapipeline.api.entries.Tag.of("img");

    @TempDir
    Path tempDir;

    private DecodeWorkerPool pool;
    private Path file;

    @BeforeEach
    void setUp() {
        pool = new DecodeWorkerPool("test", 1, Duration.ofSeconds(5));
        file = tempDir.resolve("events.out.tfevents.1");
    }

    @AfterEach
    void tearDown() {
        pool.stop();
    }

    private ImageEventEntry entry(byte[] encoded) throws IOException {
        TfRecordFiles.append(file, TfRecordFiles.imageEvent(3, "img", encoded));
        return new ImageEventEntry(new TrackedFile(file), 0, 0, IMG, 3, LoaderId.of(0), pool);
    }

    @Test
    void testReadImageData_DecodesPng() throws IOException {
        ImageData data = entry(TfRecordFiles.png(2, 2, true)).readImageData();

        assertThat(data).isInstanceOf(ImageData.RawBlob.class);
        assertThat(((ImageData.RawBlob) data).description()).isEqualTo("img\nSize: 2x2x3");
    }

    @Test
    void testReadImageData_UnsupportedLayoutStaysEncoded() throws IOException {
        ByteArrayOutputStream argb = new ByteArrayOutputStream();
        ImageIO.write(new BufferedImage(2, 2, BufferedImage.TYPE_INT_ARGB), "png", argb);

        ImageData data = entry(argb.toByteArray()).readImageData();

        assertThat(data).isInstanceOf(ImageData.CompressedBlob.class);
        assertThat(((ImageData.CompressedBlob) data).bytes()).isEqualTo(argb.toByteArray());
    }

    @Test
    void testReadImageData_WrongValueIndex() throws IOException {
        TfRecordFiles.append(file, TfRecordFiles.imageEvent(3, "img", TfRecordFiles.png(2, 2, false)));
        ImageEventEntry entry = new ImageEventEntry(new TrackedFile(file), 0, 4, IMG, 3, LoaderId.of(0), pool);

        assertThat(entry.readImageData()).isInstanceOf(ImageData.Unavailable.class);
    }

    @Test
    void testReadImageDataAsync_SharesFutureUntilDone() throws IOException {
        ImageEventEntry entry = entry(TfRecordFiles.png(2, 2, false));

        ImageDataFuture first = entry.readImageDataAsync();
        assertThat(entry.readImageDataAsync()).isSameAs(first);
        first.start();
        await().atMost(5, TimeUnit.SECONDS).until(first::isDone);

        assertThat(first.getResult()).get().isInstanceOf(ImageData.RawBlob.class);
        assertThat(entry.readImageDataAsync()).isNotSameAs(first);
    }

    @Test
    void testClose_CancelsPendingFutureAndRejectsNewOnes() throws IOException {
        ImageEventEntry entry = entry(TfRecordFiles.png(2, 2, false));
        ImageDataFuture pending = entry.readImageDataAsync();

        entry.close();

        assertThat(pending.getState()).isEqualTo(ImageDataFuture.State.CANCELLED);
        assertThat(entry.isClosed()).isTrue();
        assertThatThrownBy(entry::readImageDataAsync).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(entry::readImageData).isInstanceOf(IllegalStateException.class);
    }
}
