package org.tfviewer.datapipeline.api.ingestion;

import org.tfviewer.datapipeline.api.entries.Entry;
import org.tfviewer.datapipeline.api.entries.GlobalEntry;
import org.tfviewer.datapipeline.api.entries.LoaderId;
import org.tfviewer.datapipeline.api.entries.Tag;
import org.tfviewer.datapipeline.services.decode.DecodeWorkerPool;

import java.util.concurrent.locks.Lock;

/**
 * The mutation interface a source loader uses to publish what it decoded.
 * <p>
 * All entries of one record are added while holding {@link #lock()}, so readers never see a
 * partially applied record:
 * <pre>
 * Lock lock = sink.lock();
 * lock.lock();
 * try {
 *     sink.addEntry(entry);
 * } finally {
 *     lock.unlock();
 * }
 * sink.recordCommitted();
 * </pre>
 */
public interface EntrySink {

    /**
     * @return true if the current poll should unwind at the next checkpoint.
     */
    boolean isInterruptionRequested();

    /**
     * @return The lock guarding the index. Re-entrant.
     */
    Lock lock();

    /**
     * Converts a raw tag string into its hierarchical form.
     */
    Tag tagToPath(String tag);

    /**
     * Adds an entry to the index. Must be called while holding {@link #lock()}.
     *
     * @throws IllegalStateException if a global entry is registered twice for one tag, or a tag
     *                               is re-declared with a different type.
     */
    void addEntry(Entry entry);

    /**
     * Registers a step reported by a global entry, e.g. a scalar observation, in the engine's
     * step list. Must be called while holding {@link #lock()}. Known steps are ignored.
     */
    void addStep(long step);

    /**
     * Returns the global entry registered for a tag. Must be called while holding {@link #lock()}.
     *
     * @return The entry, or null if none is registered.
     */
    GlobalEntry globalEntry(Tag tag);

    /**
     * @return The pool entries use for heavy decode work.
     */
    DecodeWorkerPool workerPool();

    /**
     * Reports that the loader with the given id disappeared.
     */
    void deleteLoader(LoaderId loaderId);

    /**
     * Marks the end of one record: progress and step notifications are emitted here.
     */
    void recordCommitted();

    /**
     * Records a transient error that did not stop ingestion.
     */
    void reportError(String code, String source, String message);
}
