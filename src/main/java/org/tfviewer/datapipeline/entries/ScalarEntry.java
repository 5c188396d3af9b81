package org.tfviewer.datapipeline.entries;

import org.tfviewer.datapipeline.api.entries.EntryType;
import org.tfviewer.datapipeline.api.entries.GlobalEntry;
import org.tfviewer.datapipeline.api.entries.LoaderId;
import org.tfviewer.datapipeline.api.entries.Tag;
import org.tfviewer.datapipeline.utils.SortedLists;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A scalar time series, e.g. a loss curve, collected from all sources that report the tag.
 * <p>
 * Observations are partitioned by the <em>top-level</em> loader id, so all files of one run
 * directory form one series. Within a series observations are ordered by step; repeated steps
 * are kept and inserted after existing ones.
 * <p>
 * <strong>Thread Safety:</strong> written by the poll thread, readable from any thread.
 * Listeners are notified on the poll thread after the observation is visible.
 */
public class ScalarEntry extends GlobalEntry {

    private final List<Long> allSteps = new ArrayList<>();
    private final List<LoaderId> loaderIds = new ArrayList<>();
    private final Map<LoaderId, Series> series = new HashMap<>();

    private static final class Series {
        private final List<Long> steps = new ArrayList<>();
        private final List<Double> values = new ArrayList<>();
    }

    public ScalarEntry(Tag tag) {
        super(tag);
    }

    @Override
    public EntryType getType() {
        return EntryType.SCALAR;
    }

    /**
     * Adds one observation.
     *
     * @param loaderId The loader that read the observation; only its root is used.
     * @return The position of the observation in its series.
     */
    public int addData(long step, double value, LoaderId loaderId) {
        LoaderId key = loaderId.root();
        int index;
        synchronized (this) {
            SortedLists.insertUnique(allSteps, step);
            Series target = series.get(key);
            if (target == null) {
                target = new Series();
                series.put(key, target);
                loaderIds.add(key);
            }
            index = SortedLists.upperBound(target.steps, step, Long::longValue);
            target.steps.add(index, step);
            target.values.add(index, value);
        }
        fireStepAdded(index, key);
        return index;
    }

    @Override
    public synchronized List<Long> steps() {
        return List.copyOf(allSteps);
    }

    /**
     * @return The steps of one series, empty for an unknown loader id.
     */
    @Override
    public synchronized List<Long> steps(LoaderId loaderId) {
        Series target = series.get(loaderId);
        return target == null ? List.of() : List.copyOf(target.steps);
    }

    /**
     * @return The values of one series in step order, empty for an unknown loader id.
     */
    public synchronized List<Double> getData(LoaderId loaderId) {
        Series target = series.get(loaderId);
        return target == null ? List.of() : List.copyOf(target.values);
    }

    @Override
    public synchronized List<LoaderId> loaderIds() {
        return List.copyOf(loaderIds);
    }

    /**
     * @return The number of observations across all series.
     */
    public synchronized int size() {
        int size = 0;
        for (Series s : series.values()) {
            size += s.steps.size();
        }
        return size;
    }

    @Override
    public void close() {
        super.close();
        synchronized (this) {
            allSteps.clear();
            loaderIds.clear();
            series.clear();
        }
    }

    @Override
    public String toString() {
        return "ScalarEntry(tag='" + tagString() + "', observations=" + size() + ")";
    }
}
