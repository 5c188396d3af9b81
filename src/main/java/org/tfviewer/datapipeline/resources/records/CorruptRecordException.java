package org.tfviewer.datapipeline.resources.records;

import java.io.IOException;

/**
 * A complete frame whose checksum does not match. Unlike other {@link IOException}s this does
 * not mean the file is unreadable, only that one frame is.
 * <p>
 * When the header checksum was valid and only the payload checksum failed, the frame's extent
 * is known and reading may continue at {@link #getNextOffset()}. A bad header checksum leaves
 * the length untrusted, so the frame cannot be skipped.
 */
public class CorruptRecordException extends IOException {

    private final long offset;
    private final long nextOffset;

    public CorruptRecordException(String message, long offset, long nextOffset) {
        super(message);
        this.offset = offset;
        this.nextOffset = nextOffset;
    }

    /**
     * @return Offset of the corrupt frame.
     */
    public long getOffset() {
        return offset;
    }

    /**
     * @return Offset after the corrupt frame, or -1 if it cannot be skipped.
     */
    public long getNextOffset() {
        return nextOffset;
    }

    public boolean isSkippable() {
        return nextOffset >= 0;
    }
}
