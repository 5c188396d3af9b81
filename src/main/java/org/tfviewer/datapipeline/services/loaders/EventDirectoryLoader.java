package org.tfviewer.datapipeline.services.loaders;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tfviewer.datapipeline.api.entries.LoaderId;
import org.tfviewer.datapipeline.api.ingestion.EntrySink;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Tails all event files of a run directory.
 * <p>
 * Each poll picks up event files that appeared since the last poll, then polls the children
 * in ascending {@link SourceLoader#sortKey()} order, so the most recently written file goes
 * last. Children that report themselves unusable are dropped and their ids reported to the
 * sink. Child ids are minted from this loader's own counter and never reused.
 * <p>
 * The directory's own id is never reported here; the owner of this loader reports it once
 * {@link #poll(EntrySink)} returns false.
 */
public final class EventDirectoryLoader implements SourceLoader {

    private static final Logger log = LoggerFactory.getLogger(EventDirectoryLoader.class);

    private final Path path;
    private final LoaderId id;
    private final LoaderOptions options;
    private final List<EventFileLoader> children = new ArrayList<>();
    private final Set<Path> knownFiles = new HashSet<>();
    private int nextChildIndex = 0;

    public EventDirectoryLoader(Path path, LoaderId id, LoaderOptions options) {
        this.path = Objects.requireNonNull(path, "path");
        this.id = Objects.requireNonNull(id, "id");
        this.options = Objects.requireNonNull(options, "options");
        try {
            discoverNewFiles();
        } catch (IOException e) {
            log.warn("Cannot list {}: {}", path, e.getMessage());
        }
    }

    /**
     * @return true for a directory that contains at least one event file.
     */
    public static boolean appliesTo(Path path) {
        if (!Files.isDirectory(path)) {
            return false;
        }
        try {
            return !listEventFiles(path).isEmpty();
        } catch (IOException e) {
            log.debug("Cannot list {}: {}", path, e.getMessage());
            return false;
        }
    }

    @Override
    public LoaderId id() {
        return id;
    }

    @Override
    public Path path() {
        return path;
    }

    @Override
    public SourceKind kind() {
        return SourceKind.EVENT_DIRECTORY;
    }

    /**
     * @return The ids of the event files currently tracked, in the order they were last polled.
     */
    public List<LoaderId> childIds() {
        return children.stream().map(SourceLoader::id).collect(Collectors.toList());
    }

    @Override
    public long bytesLoaded() {
        return children.stream().mapToLong(SourceLoader::bytesLoaded).sum();
    }

    @Override
    public long bytesTotal() {
        return children.stream().mapToLong(SourceLoader::bytesTotal).sum();
    }

    @Override
    public long sortKey() {
        return children.stream().mapToLong(SourceLoader::sortKey).max().orElse(0L);
    }

    @Override
    public boolean poll(EntrySink sink) {
        if (!Files.isDirectory(path)) {
            log.info("Directory {} was deleted, dropping {} event file(s)", path, children.size());
            for (EventFileLoader child : children) {
                sink.deleteLoader(child.id());
            }
            children.clear();
            return false;
        }
        try {
            discoverNewFiles();
        } catch (IOException e) {
            log.warn("Cannot list {}: {}", path, e.getMessage());
            sink.reportError("READ_FAILED", path.toString(), e.getMessage());
        }

        children.sort(Comparator.comparingLong(SourceLoader::sortKey));
        List<EventFileLoader> removed = new ArrayList<>();
        for (EventFileLoader child : children) {
            if (!child.poll(sink)) {
                removed.add(child);
            }
            if (sink.isInterruptionRequested()) {
                break;
            }
        }
        for (EventFileLoader child : removed) {
            children.remove(child);
            knownFiles.remove(child.path());
            sink.deleteLoader(child.id());
        }
        return !children.isEmpty();
    }

    private void discoverNewFiles() throws IOException {
        for (Path file : listEventFiles(path)) {
            if (knownFiles.add(file)) {
                EventFileLoader child = new EventFileLoader(file, id.child(nextChildIndex++), options);
                log.debug("Tracking new event file {} as {}", file, child.id());
                children.add(child);
            }
        }
    }

    /**
     * @return The event files directly inside {@code directory}, sorted by name.
     */
    static List<Path> listEventFiles(Path directory) throws IOException {
        try (Stream<Path> entries = Files.list(directory)) {
            return entries
                .filter(EventFileLoader::isEventFileName)
                .filter(Files::isRegularFile)
                .sorted()
                .collect(Collectors.toList());
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    @Override
    public String toString() {
        return "EventDirectoryLoader(" + path + ", id=" + id + ", files=" + children.size() + ")";
    }
}
