package org.tfviewer.datapipeline.api.entries;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Provenance of a source loader: the index of the top-level source followed by the indices
 * of nested sub-sources. Ids order lexicographically, shorter prefixes first.
 *
 * @param path The index chain, never empty.
 */
public record LoaderId(List<Integer> path) implements Comparable<LoaderId> {

    public LoaderId {
        Objects.requireNonNull(path, "path");
        if (path.isEmpty()) {
            throw new IllegalArgumentException("A loader id needs at least one index");
        }
        path = List.copyOf(path);
    }

    public static LoaderId of(int... indices) {
        List<Integer> path = new ArrayList<>(indices.length);
        for (int index : indices) {
            path.add(index);
        }
        return new LoaderId(path);
    }

    /**
     * Creates the id of a nested sub-source.
     *
     * @param index Index of the sub-source within this source.
     * @return The child id.
     */
    public LoaderId child(int index) {
        List<Integer> childPath = new ArrayList<>(path);
        childPath.add(index);
        return new LoaderId(childPath);
    }

    /**
     * Returns the id of the top-level source this id descends from.
     *
     * @return The id consisting only of the first index.
     */
    public LoaderId root() {
        return path.size() == 1 ? this : new LoaderId(List.of(path.get(0)));
    }

    @Override
    public int compareTo(LoaderId other) {
        int common = Math.min(path.size(), other.path.size());
        for (int i = 0; i < common; i++) {
            int cmp = Integer.compare(path.get(i), other.path.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(path.size(), other.path.size());
    }

    @Override
    public String toString() {
        return path.stream().map(String::valueOf).collect(Collectors.joining("."));
    }
}
