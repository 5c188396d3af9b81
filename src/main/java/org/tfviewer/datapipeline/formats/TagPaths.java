package org.tfviewer.datapipeline.formats;

import org.tfviewer.datapipeline.api.entries.Tag;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Converts producer tag strings into hierarchical {@link Tag}s.
 * <p>
 * A trailing {@code /image} is dropped, then trailing purely numeric segments become integer
 * segments; the remaining prefix is kept as one string segment:
 * <pre>
 * "loss"               -> ("loss",)
 * "input/image/0"      -> ("input/image", 0)
 * "sample/3/image"     -> ("sample", 3)
 * "layer/2/act/1"      -> ("layer/2/act", 1)
 * </pre>
 * Results are memoized per instance.
 */
public class TagPaths {

    private static final String IMAGE_SUFFIX = "/image";

    private final ConcurrentMap<String, Tag> cache = new ConcurrentHashMap<>();

    public Tag toPath(String tag) {
        return cache.computeIfAbsent(tag, TagPaths::parse);
    }

    public int size() {
        return cache.size();
    }

    static Tag parse(String tag) {
        String rest = tag.endsWith(IMAGE_SUFFIX) ? tag.substring(0, tag.length() - IMAGE_SUFFIX.length()) : tag;
        Deque<Integer> indices = new ArrayDeque<>();
        int slash = rest.lastIndexOf('/');
        while (slash >= 0) {
            String segment = rest.substring(slash + 1);
            if (!isDigits(segment)) {
                break;
            }
            indices.addFirst(Integer.parseInt(segment));
            rest = rest.substring(0, slash);
            slash = rest.lastIndexOf('/');
        }
        List<Object> segments = new ArrayList<>(indices.size() + 1);
        segments.add(rest);
        segments.addAll(indices);
        return new Tag(segments);
    }

    private static boolean isDigits(String segment) {
        if (segment.isEmpty() || segment.length() > 9) {
            return false;
        }
        for (int i = 0; i < segment.length(); i++) {
            char c = segment.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }
}
