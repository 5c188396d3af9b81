package org.tfviewer.datapipeline.api.entries;

import org.tfviewer.datapipeline.resources.files.TrackedFile;

import java.util.Comparator;
import java.util.Objects;

/**
 * An entry tied to one step. It keeps the offset of the record it was decoded from, so its
 * heavy payload can be re-read lazily long after the poll that created it.
 * <p>
 * The reference to the {@link TrackedFile} is non-owning: the source loader owns the file,
 * and {@link #close()} drops the reference so a closed entry can no longer read.
 */
public abstract class PerStepEntry extends Entry {

    /**
     * Orders entries by ascending step.
     */
    public static final Comparator<PerStepEntry> BY_STEP = Comparator.comparingLong(PerStepEntry::getStep);

    private volatile TrackedFile file;
    private final long offset;
    private final long step;
    private final LoaderId loaderId;

    protected PerStepEntry(TrackedFile file, long offset, Tag tag, long step, LoaderId loaderId) {
        super(tag);
        this.file = Objects.requireNonNull(file, "file");
        this.offset = offset;
        this.step = step;
        this.loaderId = Objects.requireNonNull(loaderId, "loaderId");
    }

    @Override
    public final boolean isPerStep() {
        return true;
    }

    public long getStep() {
        return step;
    }

    public long getOffset() {
        return offset;
    }

    public LoaderId getLoaderId() {
        return loaderId;
    }

    public boolean isClosed() {
        return file == null;
    }

    /**
     * Returns the file this entry was read from.
     *
     * @return The tracked file.
     * @throws IllegalStateException if the entry was closed.
     */
    protected TrackedFile requireFile() {
        TrackedFile current = file;
        if (current == null) {
            throw new IllegalStateException("Entry " + this + " is closed");
        }
        return current;
    }

    @Override
    public void close() {
        file = null;
    }

    @Override
    public String toString() {
        TrackedFile current = file;
        return "Entry(tag='" + tagString() + "', step=" + step + ", file="
            + (current == null ? "<closed>" : current.getPath()) + ")";
    }
}
