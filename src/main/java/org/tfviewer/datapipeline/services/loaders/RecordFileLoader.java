package org.tfviewer.datapipeline.services.loaders;

import org.tfviewer.datapipeline.api.decode.DecodedRecord;
import org.tfviewer.datapipeline.api.decode.DecodedValue;
import org.tfviewer.datapipeline.api.decode.RecordDecoder;
import org.tfviewer.datapipeline.api.entries.LoaderId;
import org.tfviewer.datapipeline.api.entries.Tag;
import org.tfviewer.datapipeline.api.ingestion.EntrySink;
import org.tfviewer.datapipeline.entries.RecordImageEntry;
import org.tfviewer.datapipeline.entries.RecordMaskEntry;
import org.tfviewer.datapipeline.formats.ExampleRecordDecoder;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Tails a record file of examples. Examples have no step, so the n-th record of the file
 * becomes step n. Each record yields an {@code image} entry and one {@code mask/<i>} entry per
 * packed mask, depending on which features it has.
 */
public final class RecordFileLoader extends AbstractFileLoader {

    static final String MARKER = ".tfrecords";

    private long recordCount = 0;

    public RecordFileLoader(Path path, LoaderId id, LoaderOptions options) {
        this(path, id, new ExampleRecordDecoder(), options);
    }

    public RecordFileLoader(Path path, LoaderId id, RecordDecoder decoder, LoaderOptions options) {
        super(path, id, decoder, options);
    }

    /**
     * @return true for a path whose file name contains {@value #MARKER} and that is not a directory.
     */
    public static boolean appliesTo(Path path) {
        Path name = path.getFileName();
        return name != null && name.toString().contains(MARKER) && !Files.isDirectory(path);
    }

    @Override
    public SourceKind kind() {
        return SourceKind.RECORD_FILE;
    }

    /**
     * @return The number of records decoded so far, which is also the next step.
     */
    public long recordCount() {
        return recordCount;
    }

    @Override
    protected void publish(long offset, DecodedRecord record, EntrySink sink) {
        long step = record.step().orElse(recordCount);
        for (DecodedValue value : record.values()) {
            Tag tag = sink.tagToPath(value.tag());
            if (ExampleRecordDecoder.IMAGE_TAG.equals(value.tag())) {
                sink.addEntry(new RecordImageEntry(file(), offset, tag, step, id(), sink.workerPool(),
                    value.description()));
            } else {
                sink.addEntry(new RecordMaskEntry(file(), offset, tag, step, id(), sink.workerPool(),
                    value.payloadIndex(), value.description()));
            }
        }
        recordCount++;
    }
}
