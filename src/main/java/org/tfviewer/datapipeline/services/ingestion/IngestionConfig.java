package org.tfviewer.datapipeline.services.ingestion;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.tfviewer.datapipeline.services.loaders.LoaderOptions;

import java.time.Duration;

/**
 * Settings of one {@link IngestionEngine}, read from the {@code tfviewer.ingestion} block.
 * <pre>
 * tfviewer.ingestion {
 *   pollIntervalMs = 2500
 *   interactivePreload = false
 *   workerThreads = 4
 *   recordCacheSize = 32
 *   corruptRecordRetries = 3
 *   progressInterval = 10
 *   stopTimeoutMs = 5000
 * }
 * </pre>
 *
 * @param pollInterval         Wait between two poll cycles.
 * @param interactivePreload   Stream tags and steps while the initial load is still running.
 * @param workerThreads        Size of the decode worker pool.
 * @param recordCacheSize      Records cached per file.
 * @param corruptRecordRetries Cycles a record with a bad checksum is retried before it is skipped.
 * @param progressInterval     Emit progress every n-th record during the initial load.
 * @param stopTimeout          How long stopping waits for the poll thread and the decode workers.
 */
public record IngestionConfig(
    Duration pollInterval,
    boolean interactivePreload,
    int workerThreads,
    int recordCacheSize,
    int corruptRecordRetries,
    int progressInterval,
    Duration stopTimeout
) {

    public static final String CONFIG_PATH = "tfviewer.ingestion";

    public IngestionConfig {
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive, got " + pollInterval);
        }
        if (workerThreads < 1) {
            throw new IllegalArgumentException("workerThreads must be >= 1, got " + workerThreads);
        }
        if (progressInterval < 1) {
            throw new IllegalArgumentException("progressInterval must be >= 1, got " + progressInterval);
        }
        if (stopTimeout.isNegative()) {
            throw new IllegalArgumentException("stopTimeout must not be negative, got " + stopTimeout);
        }
        if (recordCacheSize < 1) {
            throw new IllegalArgumentException("recordCacheSize must be >= 1, got " + recordCacheSize);
        }
        if (corruptRecordRetries < 1) {
            throw new IllegalArgumentException("corruptRecordRetries must be >= 1, got " + corruptRecordRetries);
        }
    }

    /**
     * @return The built-in defaults.
     */
    public static IngestionConfig defaults() {
        return from(ConfigFactory.empty());
    }

    /**
     * Reads the settings from an ingestion block; missing keys fall back to the defaults.
     *
     * @param options The contents of {@value #CONFIG_PATH}.
     */
    public static IngestionConfig from(Config options) {
        return new IngestionConfig(
            Duration.ofMillis(options.hasPath("pollIntervalMs") ? options.getLong("pollIntervalMs") : 2500L),
            options.hasPath("interactivePreload") && options.getBoolean("interactivePreload"),
            options.hasPath("workerThreads") ? options.getInt("workerThreads") : 4,
            options.hasPath("recordCacheSize") ? options.getInt("recordCacheSize") : LoaderOptions.DEFAULTS.recordCacheSize(),
            options.hasPath("corruptRecordRetries") ? options.getInt("corruptRecordRetries") : LoaderOptions.DEFAULTS.corruptRecordRetries(),
            options.hasPath("progressInterval") ? options.getInt("progressInterval") : 10,
            Duration.ofMillis(options.hasPath("stopTimeoutMs") ? options.getLong("stopTimeoutMs") : 5000L)
        );
    }

    /**
     * Reads the {@value #CONFIG_PATH} block of a full application config.
     */
    public static IngestionConfig fromRoot(Config root) {
        return root.hasPath(CONFIG_PATH) ? from(root.getConfig(CONFIG_PATH)) : defaults();
    }

    public LoaderOptions loaderOptions() {
        return new LoaderOptions(recordCacheSize, corruptRecordRetries);
    }

    public IngestionConfig withPollInterval(Duration interval) {
        return new IngestionConfig(interval, interactivePreload, workerThreads, recordCacheSize,
            corruptRecordRetries, progressInterval, stopTimeout);
    }

    public IngestionConfig withInteractivePreload(boolean preload) {
        return new IngestionConfig(pollInterval, preload, workerThreads, recordCacheSize,
            corruptRecordRetries, progressInterval, stopTimeout);
    }
}
