package org.tfviewer.datapipeline.resources.records;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;
import java.util.Optional;

/**
 * Lazily reads TFRecord frames from a file that may still be growing.
 * <p>
 * Frame layout (all integers little endian):
 * <pre>
 * uint64 length
 * uint32 masked_crc32c(length)
 * byte   payload[length]
 * uint32 masked_crc32c(payload)
 * </pre>
 * <p>
 * {@link #next()} distinguishes three outcomes:
 * <ul>
 *   <li>a validated frame,</li>
 *   <li>{@link Optional#empty()} at the end of the available data, which includes a trailing
 *       frame the writer has not finished yet,</li>
 *   <li>{@link CorruptRecordException} for a complete frame with a checksum mismatch. Any other
 *       {@link IOException} means the read has to be aborted.</li>
 * </ul>
 * {@link #offset()} never advances past a frame that was not fully validated, so a caller can
 * always resume from it without losing or repeating records.
 * <p>
 * The file handle is released when the data is exhausted, when an error is thrown and on
 * {@link #close()}. Use try-with-resources:
 * <pre>
 * try (TfRecordReader reader = TfRecordReader.open(path, committedOffset)) {
 *     Optional&lt;RecordFrame&gt; frame;
 *     while ((frame = reader.next()).isPresent()) {
 *         process(frame.get());
 *     }
 * }
 * </pre>
 * <strong>Thread Safety:</strong> NOT thread-safe. Each reader must be used by a single thread.
 */
public class TfRecordReader implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TfRecordReader.class);

    static final int HEADER_LENGTH = 12;
    static final int FOOTER_LENGTH = 4;
    private static final long MAX_PAYLOAD_LENGTH = Integer.MAX_VALUE - 64;

    private final Path path;
    private FileChannel channel;
    private long offset;

    private TfRecordReader(Path path, FileChannel channel, long startOffset) {
        this.path = path;
        this.channel = channel;
        this.offset = startOffset;
    }

    /**
     * Opens a reader positioned at {@code startOffset}, which must be the start of a frame.
     *
     * @throws IOException if the file cannot be opened.
     */
    public static TfRecordReader open(Path path, long startOffset) throws IOException {
        if (startOffset < 0) {
            throw new IllegalArgumentException("startOffset must be >= 0, got " + startOffset);
        }
        FileChannel channel = FileChannel.open(path, StandardOpenOption.READ);
        return new TfRecordReader(path, channel, startOffset);
    }

    /**
     * Reads the next frame.
     *
     * @return The frame, or empty if no further complete frame is available yet.
     * @throws CorruptRecordException if the next frame is complete but fails its checksum.
     * @throws IOException            if reading fails.
     */
    public Optional<RecordFrame> next() throws IOException {
        if (channel == null) {
            return Optional.empty();
        }
        try {
            long size = channel.size();
            if (size - offset < HEADER_LENGTH) {
                return finish();
            }

            ByteBuffer header = ByteBuffer.allocate(HEADER_LENGTH).order(ByteOrder.LITTLE_ENDIAN);
            if (!readFully(header, offset)) {
                return finish();
            }
            long length = header.getLong(0);
            int lengthCrc = header.getInt(8);
            if (MaskedCrc32c.maskedCrc32c(header.array(), 0, 8) != lengthCrc) {
                throw new CorruptRecordException(
                    "Length checksum mismatch in " + path + " at offset " + offset, offset, -1);
            }
            if (length < 0 || length > MAX_PAYLOAD_LENGTH) {
                throw new CorruptRecordException(
                    "Implausible record length " + length + " in " + path + " at offset " + offset, offset, -1);
            }

            long frameEnd = offset + HEADER_LENGTH + length + FOOTER_LENGTH;
            if (frameEnd > size) {
                log.debug("Partial record in {} at offset {} ({} of {} bytes written)",
                    path, offset, size - offset, frameEnd - offset);
                return finish();
            }

            int payloadLength = (int) length;
            ByteBuffer body = ByteBuffer.allocate(payloadLength + FOOTER_LENGTH).order(ByteOrder.LITTLE_ENDIAN);
            if (!readFully(body, offset + HEADER_LENGTH)) {
                return finish();
            }
            int payloadCrc = body.getInt(payloadLength);
            if (MaskedCrc32c.maskedCrc32c(body.array(), 0, payloadLength) != payloadCrc) {
                throw new CorruptRecordException(
                    "Payload checksum mismatch in " + path + " at offset " + offset, offset, frameEnd);
            }

            long startOffset = offset;
            offset = frameEnd;
            return Optional.of(new RecordFrame(Arrays.copyOf(body.array(), payloadLength), startOffset, frameEnd));
        } catch (IOException e) {
            try {
                close();
            } catch (IOException closeFailure) {
                e.addSuppressed(closeFailure);
            }
            throw e;
        }
    }

    /**
     * @return Offset immediately after the last validated frame.
     */
    public long offset() {
        return offset;
    }

    public Path getPath() {
        return path;
    }

    public boolean isClosed() {
        return channel == null;
    }

    /**
     * Releases the file handle. Idempotent.
     */
    @Override
    public void close() throws IOException {
        FileChannel current = channel;
        channel = null;
        if (current != null) {
            current.close();
        }
    }

    private Optional<RecordFrame> finish() throws IOException {
        close();
        return Optional.empty();
    }

    /**
     * Fills the buffer from the given position. Returns false if the file ended first, which
     * happens when it is truncated while we read.
     */
    private boolean readFully(ByteBuffer buffer, long position) throws IOException {
        long pos = position;
        while (buffer.hasRemaining()) {
            int read = channel.read(buffer, pos);
            if (read < 0) {
                return false;
            }
            pos += read;
        }
        return true;
    }
}
