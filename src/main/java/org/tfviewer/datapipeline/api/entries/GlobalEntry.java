package org.tfviewer.datapipeline.api.entries;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * An entry that is not tied to one step but accumulates observations over the lifetime of
 * its sources, partitioned by loader id. Observations are only ever added.
 */
public abstract class GlobalEntry extends Entry {

    private final List<GlobalEntryListener> listeners = new CopyOnWriteArrayList<>();

    protected GlobalEntry(Tag tag) {
        super(tag);
    }

    @Override
    public final boolean isPerStep() {
        return false;
    }

    /**
     * @return All distinct steps observed across all loaders, ascending.
     */
    public abstract List<Long> steps();

    /**
     * @param loaderId A loader id as returned by {@link #loaderIds()}.
     * @return The steps observed for that loader, ascending, duplicates retained.
     */
    public abstract List<Long> steps(LoaderId loaderId);

    /**
     * @return All loader ids that contributed, in order of first appearance.
     */
    public abstract List<LoaderId> loaderIds();

    public void addListener(GlobalEntryListener listener) {
        listeners.add(listener);
    }

    public void removeListener(GlobalEntryListener listener) {
        listeners.remove(listener);
    }

    protected void fireStepAdded(int index, LoaderId loaderId) {
        for (GlobalEntryListener listener : listeners) {
            listener.onStepAdded(index, loaderId);
        }
    }

    @Override
    public void close() {
        listeners.clear();
    }
}
