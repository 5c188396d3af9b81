package org.tfviewer.datapipeline.api.entries;

import java.util.Objects;

/**
 * A unit of decoded data identified by its {@link Tag}.
 * <p>
 * Entries are created by source loaders on the poll thread and live in the ingestion
 * engine's index until the engine is closed or reloaded, at which point {@link #close()}
 * releases whatever the entry still references.
 */
public abstract class Entry {

    private final Tag tag;

    protected Entry(Tag tag) {
        this.tag = Objects.requireNonNull(tag, "tag");
    }

    public Tag getTag() {
        return tag;
    }

    /**
     * @return true if this entry belongs to a single step, false if it spans the whole source.
     */
    public abstract boolean isPerStep();

    public abstract EntryType getType();

    public String tagString() {
        return tag.toPathString();
    }

    /**
     * Releases resources held by this entry. The default implementation does nothing.
     */
    public void close() {
    }

    @Override
    public String toString() {
        return "Entry(tag='" + tagString() + "')";
    }
}
