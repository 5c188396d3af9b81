package org.tfviewer.datapipeline.services.loaders;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tfviewer.datapipeline.api.entries.LoaderId;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Picks the loader variant for a path.
 * <p>
 * Kinds are tried in registration order and the first one that applies wins. A registry is
 * created once at startup and handed to the ingestion engine:
 * <pre>
 * SourceLoaderRegistry registry = SourceLoaderRegistry.defaults(LoaderOptions.DEFAULTS);
 * Optional&lt;SourceLoader&gt; loader = registry.resolve(path, LoaderId.of(0));
 * </pre>
 */
public class SourceLoaderRegistry {

    private static final Logger log = LoggerFactory.getLogger(SourceLoaderRegistry.class);

    private final List<SourceKind> kinds = new ArrayList<>();
    private final LoaderOptions options;

    /**
     * Creates an empty registry.
     */
    public SourceLoaderRegistry(LoaderOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    /**
     * @return A registry with all kinds in their default order: event file, event directory,
     *         record file.
     */
    public static SourceLoaderRegistry defaults(LoaderOptions options) {
        SourceLoaderRegistry registry = new SourceLoaderRegistry(options);
        for (SourceKind kind : SourceKind.values()) {
            registry.register(kind);
        }
        return registry;
    }

    /**
     * Appends a kind to the resolution order. Registering a kind twice has no effect.
     *
     * @return This registry.
     */
    public SourceLoaderRegistry register(SourceKind kind) {
        Objects.requireNonNull(kind, "kind");
        if (!kinds.contains(kind)) {
            kinds.add(kind);
        }
        return this;
    }

    public List<SourceKind> kinds() {
        return List.copyOf(kinds);
    }

    public LoaderOptions options() {
        return options;
    }

    /**
     * @return The first registered kind that applies to the path.
     */
    public Optional<SourceKind> kindOf(Path path) {
        for (SourceKind kind : kinds) {
            if (appliesTo(kind, path)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    /**
     * Creates a loader for the path.
     *
     * @param id The id the new loader gets.
     * @return The loader, or empty if no registered kind applies.
     */
    public Optional<SourceLoader> resolve(Path path, LoaderId id) {
        Optional<SourceLoader> loader = kindOf(path).map(kind -> create(kind, path, id));
        loader.ifPresent(l -> log.debug("Resolved {} as {}", path, l));
        return loader;
    }

    static boolean appliesTo(SourceKind kind, Path path) {
        switch (kind) {
            case EVENT_FILE:
                return EventFileLoader.appliesTo(path);
            case EVENT_DIRECTORY:
                return EventDirectoryLoader.appliesTo(path);
            case RECORD_FILE:
                return RecordFileLoader.appliesTo(path);
            default:
                throw new IllegalArgumentException("Unknown source kind " + kind);
        }
    }

    private SourceLoader create(SourceKind kind, Path path, LoaderId id) {
        switch (kind) {
            case EVENT_FILE:
                return new EventFileLoader(path, id, options);
            case EVENT_DIRECTORY:
                return new EventDirectoryLoader(path, id, options);
            case RECORD_FILE:
                return new RecordFileLoader(path, id, options);
            default:
                throw new IllegalArgumentException("Unknown source kind " + kind);
        }
    }
}
