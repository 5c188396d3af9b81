package org.tfviewer.datapipeline.api.resources;

import java.time.Instant;

/**
 * A transient error that affected ingestion without stopping it, for example a corrupt
 * record that was skipped or a read that failed and will be retried.
 *
 * @param timestamp When the error was recorded.
 * @param code      Category of the error (e.g. "CORRUPT_RECORD", "READ_FAILED").
 * @param source    The file or directory the error relates to.
 * @param message   Human-readable description.
 */
public record OperationalError(
    Instant timestamp,
    String code,
    String source,
    String message
) {
}
