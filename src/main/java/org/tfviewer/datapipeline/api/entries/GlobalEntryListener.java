package org.tfviewer.datapipeline.api.entries;

/**
 * Receives observations as they are added to a {@link GlobalEntry}. Called on the poll thread
 * while the ingestion engine's lock is held; implementations must return quickly.
 */
@FunctionalInterface
public interface GlobalEntryListener {

    /**
     * @param index    Position at which the observation was inserted in the loader's series.
     * @param loaderId The loader series that received the observation.
     */
    void onStepAdded(int index, LoaderId loaderId);
}
