package org.tfviewer.datapipeline.services.loaders;

import org.tfviewer.datapipeline.api.entries.LoaderId;
import org.tfviewer.datapipeline.api.ingestion.EntrySink;

import java.nio.file.Path;

/**
 * A source of entries: one event file, a directory of event files, or one record file.
 * <p>
 * Loaders are owned by the ingestion engine and only ever used from its poll thread.
 */
public sealed interface SourceLoader permits AbstractFileLoader, EventDirectoryLoader {

    LoaderId id();

    Path path();

    SourceKind kind();

    /**
     * @return Bytes consumed so far, summed over all files of the source.
     */
    long bytesLoaded();

    /**
     * @return Current size of the source in bytes, summed over all files.
     */
    long bytesTotal();

    /**
     * @return Key ordering sibling sources, the last modification time in epoch milliseconds.
     */
    long sortKey();

    /**
     * Reads everything that was appended since the last poll and publishes it to the sink.
     * Returns early, with {@code true}, when the sink requests an interruption.
     *
     * @return false exactly when the source became permanently unusable and must be dropped.
     */
    boolean poll(EntrySink sink);
}
