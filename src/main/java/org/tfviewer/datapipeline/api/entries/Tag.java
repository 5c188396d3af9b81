package org.tfviewer.datapipeline.api.entries;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Hierarchical identity of a data stream, e.g. {@code ("loss/train")} or {@code ("mask", 2)}.
 * <p>
 * Segments are either {@link String}s or {@link Integer}s. Two tags are equal when their
 * segment lists are equal.
 *
 * @param segments The ordered path segments, never empty.
 */
public record Tag(List<Object> segments) {

    public Tag {
        Objects.requireNonNull(segments, "segments");
        if (segments.isEmpty()) {
            throw new IllegalArgumentException("A tag needs at least one segment");
        }
        for (Object segment : segments) {
            if (!(segment instanceof String) && !(segment instanceof Integer)) {
                throw new IllegalArgumentException("Tag segments must be String or Integer, got: " + segment);
            }
        }
        segments = List.copyOf(segments);
    }

    /**
     * Creates a tag from the given segments.
     *
     * @param segments String or Integer segments.
     * @return The tag.
     */
    public static Tag of(Object... segments) {
        return new Tag(Arrays.asList(segments));
    }

    /**
     * Joins all segments with {@code '/'}.
     *
     * @return The tag rendered as a path string.
     */
    public String toPathString() {
        return segments.stream().map(String::valueOf).collect(Collectors.joining("/"));
    }

    @Override
    public String toString() {
        return segments.stream()
            .map(s -> s instanceof String ? "'" + s + "'" : String.valueOf(s))
            .collect(Collectors.joining(", ", "(", segments.size() == 1 ? ",)" : ")"));
    }
}
