package org.tfviewer.datapipeline.api.ingestion;

import org.tfviewer.datapipeline.api.entries.EntryType;
import org.tfviewer.datapipeline.api.entries.LoaderId;
import org.tfviewer.datapipeline.api.entries.Tag;

/**
 * Notifications emitted by the ingestion engine. All callbacks run on the engine's poll
 * thread; implementations hand work over to their own thread if it is not trivial.
 * <p>
 * Within one cycle, tag and global entry discoveries are delivered as records are decoded,
 * progress and step notifications follow once the record is committed.
 */
public interface IngestionListener {

    /**
     * The index was cleared by a reload; everything received so far is stale.
     */
    default void onSourceDiscoveryCleared() {
    }

    /**
     * @param iteration Number of committed records so far.
     * @param ratio     Bytes loaded divided by bytes available, {@code 1.0} once the initial load is complete.
     */
    default void onProgress(long iteration, double ratio) {
    }

    /**
     * A step not seen before was inserted into the global step list.
     *
     * @param position  Insert position in the ascending step list at the time of insertion.
     * @param iteration The iteration in which the step was inserted.
     */
    default void onStepInserted(int position, long iteration) {
    }

    default void onTagDiscovered(Tag tag, EntryType type) {
    }

    default void onGlobalEntryDiscovered(Tag tag, EntryType type) {
    }

    /**
     * Every source was read completely once.
     */
    default void onInitialLoadComplete() {
    }

    /**
     * A source disappeared and its loader was dropped. Entries it produced stay in the index.
     */
    default void onLoaderRemoved(LoaderId loaderId) {
    }

    /**
     * The poll loop terminated, normally or because of an error.
     */
    default void onLoopStopped() {
    }
}
