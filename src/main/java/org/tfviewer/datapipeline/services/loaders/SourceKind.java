package org.tfviewer.datapipeline.services.loaders;

/**
 * The fixed set of source variants, in default registration order.
 */
public enum SourceKind {
    /**
     * A single TensorFlow event file, recognized by {@code .tfevents} in its name.
     */
    EVENT_FILE,
    /**
     * A directory containing at least one event file.
     */
    EVENT_DIRECTORY,
    /**
     * A record file of examples, recognized by {@code .tfrecords} in its name.
     */
    RECORD_FILE
}
