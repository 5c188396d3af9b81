package org.tfviewer.datapipeline.services.loaders;

/**
 * Settings shared by all source loaders of one engine.
 *
 * @param recordCacheSize      Number of records (and decoded messages) cached per file.
 * @param corruptRecordRetries Consecutive cycles a record with a bad payload checksum is retried
 *                             before it is skipped.
 */
public record LoaderOptions(int recordCacheSize, int corruptRecordRetries) {

    public static final LoaderOptions DEFAULTS = new LoaderOptions(32, 3);

    public LoaderOptions {
        if (recordCacheSize < 1) {
            throw new IllegalArgumentException("recordCacheSize must be >= 1, got " + recordCacheSize);
        }
        if (corruptRecordRetries < 1) {
            throw new IllegalArgumentException("corruptRecordRetries must be >= 1, got " + corruptRecordRetries);
        }
    }
}
