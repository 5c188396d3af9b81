package org.tfviewer.datapipeline.services.ingestion;

import org.tfviewer.datapipeline.api.entries.Entry;
import org.tfviewer.datapipeline.api.entries.EntryType;
import org.tfviewer.datapipeline.api.entries.GlobalEntry;
import org.tfviewer.datapipeline.api.entries.PerStepEntry;
import org.tfviewer.datapipeline.api.entries.Tag;
import org.tfviewer.datapipeline.utils.SortedLists;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The merged tag/step index of an ingestion engine.
 * <ul>
 *   <li>tag → per-step entries, ascending by step, equal steps in insertion order</li>
 *   <li>step → (tag → entry), the newest entry of a tag at that step wins</li>
 *   <li>all distinct steps, ascending</li>
 *   <li>tag → global entry, at most one per tag</li>
 *   <li>all tags, per-step and global, with their type in first-seen order</li>
 * </ul>
 * <strong>Thread Safety:</strong> NOT thread-safe. The engine guards it with its lock.
 */
class EntryIndex {

    /**
     * What an insertion changed.
     *
     * @param newTag       The entry's tag was not known before.
     * @param stepPosition Insert position of a step not known before, or -1.
     */
    record Insertion(boolean newTag, int stepPosition) {
    }

    private final Map<Tag, List<PerStepEntry>> tagIndex = new HashMap<>();
    private final Map<Long, Map<Tag, PerStepEntry>> stepIndex = new HashMap<>();
    private final List<Long> steps = new ArrayList<>();
    private final Map<Tag, GlobalEntry> globalIndex = new LinkedHashMap<>();
    private final Map<Tag, EntryType> tagTypes = new LinkedHashMap<>();
    private final List<Tag> tags = new ArrayList<>();
    private final List<GlobalEntry> globals = new ArrayList<>();
    private int perStepCount = 0;

    /**
     * @throws IllegalStateException if a global entry is added twice for one tag, or a tag is
     *                               re-declared with another type or kind.
     */
    Insertion add(Entry entry) {
        Tag tag = entry.getTag();
        EntryType declared = tagTypes.get(tag);
        if (declared != null && declared != entry.getType()) {
            throw new IllegalStateException(
                "Tag " + tag + " was declared as " + declared.getName() + ", got " + entry.getType().getName());
        }
        if (entry instanceof PerStepEntry perStep) {
            return addPerStep(perStep, declared == null);
        }
        if (entry instanceof GlobalEntry global) {
            addGlobal(global);
            return new Insertion(true, -1);
        }
        throw new IllegalArgumentException("Unsupported entry " + entry);
    }

    private Insertion addPerStep(PerStepEntry entry, boolean newTag) {
        Tag tag = entry.getTag();
        if (globalIndex.containsKey(tag)) {
            throw new IllegalStateException("Tag " + tag + " is registered as a global entry");
        }
        List<PerStepEntry> entries = tagIndex.get(tag);
        if (entries == null) {
            entries = new ArrayList<>();
            tagIndex.put(tag, entries);
            tags.add(tag);
            tagTypes.put(tag, entry.getType());
        }
        SortedLists.insertRight(entries, entry, PerStepEntry::getStep);
        stepIndex.computeIfAbsent(entry.getStep(), s -> new LinkedHashMap<>()).put(tag, entry);
        perStepCount++;
        return new Insertion(newTag, SortedLists.insertUnique(steps, entry.getStep()));
    }

    private void addGlobal(GlobalEntry entry) {
        Tag tag = entry.getTag();
        if (globalIndex.containsKey(tag)) {
            throw new IllegalStateException("A global entry for tag " + tag + " is already registered");
        }
        if (tagIndex.containsKey(tag)) {
            throw new IllegalStateException("Tag " + tag + " is registered with per-step entries");
        }
        globalIndex.put(tag, entry);
        globals.add(entry);
        tags.add(tag);
        tagTypes.put(tag, entry.getType());
    }

    /**
     * Adds a step without an entry, for steps only global entries report.
     *
     * @return The insert position, or -1 if the step was known.
     */
    int addStep(long step) {
        return SortedLists.insertUnique(steps, step);
    }

    GlobalEntry globalEntry(Tag tag) {
        return globalIndex.get(tag);
    }

    /**
     * @return All tags in first-seen order. Live view.
     */
    List<Tag> tags() {
        return tags;
    }

    /**
     * @return Global entries in first-seen order. Live view.
     */
    List<GlobalEntry> globals() {
        return globals;
    }

    EntryType typeOf(Tag tag) {
        return tagTypes.get(tag);
    }

    Map<Tag, EntryType> tagTypesCopy() {
        Map<Tag, EntryType> copy = new LinkedHashMap<>();
        for (Tag tag : tags) {
            copy.put(tag, tagTypes.get(tag));
        }
        return copy;
    }

    List<Long> stepsCopy() {
        return List.copyOf(steps);
    }

    List<PerStepEntry> entriesCopy(Tag tag) {
        List<PerStepEntry> entries = tagIndex.get(tag);
        return entries == null ? List.of() : List.copyOf(entries);
    }

    Map<Tag, List<PerStepEntry>> tagIndexCopy() {
        Map<Tag, List<PerStepEntry>> copy = new LinkedHashMap<>();
        for (Tag tag : tags) {
            List<PerStepEntry> entries = tagIndex.get(tag);
            if (entries != null) {
                copy.put(tag, List.copyOf(entries));
            }
        }
        return copy;
    }

    Map<Tag, PerStepEntry> entriesAtStepCopy(long step) {
        Map<Tag, PerStepEntry> entries = stepIndex.get(step);
        return entries == null ? Map.of() : new LinkedHashMap<>(entries);
    }

    int stepCount() {
        return steps.size();
    }

    int tagCount() {
        return tags.size();
    }

    boolean isGlobal(Tag tag) {
        return globalIndex.containsKey(tag);
    }

    int perStepCount() {
        return perStepCount;
    }

    /**
     * Closes all entries and empties the index.
     */
    void clear() {
        for (List<PerStepEntry> entries : tagIndex.values()) {
            for (PerStepEntry entry : entries) {
                entry.close();
            }
        }
        for (GlobalEntry entry : globals) {
            entry.close();
        }
        tagIndex.clear();
        stepIndex.clear();
        steps.clear();
        globalIndex.clear();
        tagTypes.clear();
        tags.clear();
        globals.clear();
        perStepCount = 0;
    }
}
