package org.tfviewer.datapipeline.services.loaders;

import org.tfviewer.datapipeline.api.decode.DecodedRecord;
import org.tfviewer.datapipeline.api.decode.DecodedValue;
import org.tfviewer.datapipeline.api.decode.RecordDecoder;
import org.tfviewer.datapipeline.api.entries.GlobalEntry;
import org.tfviewer.datapipeline.api.entries.LoaderId;
import org.tfviewer.datapipeline.api.entries.Tag;
import org.tfviewer.datapipeline.api.ingestion.EntrySink;
import org.tfviewer.datapipeline.entries.ImageEventEntry;
import org.tfviewer.datapipeline.entries.ScalarEntry;
import org.tfviewer.datapipeline.formats.EventRecordDecoder;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Tails one TensorFlow event file. Image values become per-step {@link ImageEventEntry}s,
 * scalar values are appended to the {@link ScalarEntry} of their tag.
 */
public final class EventFileLoader extends AbstractFileLoader {

    static final String MARKER = ".tfevents";

    public EventFileLoader(Path path, LoaderId id, LoaderOptions options) {
        this(path, id, new EventRecordDecoder(), options);
    }

    public EventFileLoader(Path path, LoaderId id, RecordDecoder decoder, LoaderOptions options) {
        super(path, id, decoder, options);
    }

    /**
     * @return true for a path whose file name contains {@value #MARKER} and that is not a directory.
     */
    public static boolean appliesTo(Path path) {
        return isEventFileName(path) && !Files.isDirectory(path);
    }

    static boolean isEventFileName(Path path) {
        Path name = path.getFileName();
        return name != null && name.toString().contains(MARKER);
    }

    @Override
    public SourceKind kind() {
        return SourceKind.EVENT_FILE;
    }

    @Override
    protected void publish(long offset, DecodedRecord record, EntrySink sink) {
        long step = record.step().orElse(0L);
        for (DecodedValue value : record.values()) {
            Tag tag = sink.tagToPath(value.tag());
            switch (value.type()) {
                case IMAGE:
                    sink.addEntry(new ImageEventEntry(file(), offset, value.payloadIndex(), tag, step, id(),
                        sink.workerPool()));
                    break;
                case SCALAR:
                    addScalar(sink, tag, step, value.scalarValue());
                    break;
                default:
                    throw new IllegalStateException("Unhandled entry type " + value.type() + " for tag " + tag);
            }
        }
    }

    private void addScalar(EntrySink sink, Tag tag, long step, double value) {
        GlobalEntry existing = sink.globalEntry(tag);
        if (existing == null) {
            ScalarEntry entry = new ScalarEntry(tag);
            entry.addData(step, value, id());
            sink.addEntry(entry);
        } else if (existing instanceof ScalarEntry scalar) {
            scalar.addData(step, value, id());
        } else {
            throw new IllegalStateException("Tag " + tag + " is registered as " + existing.getType() + ", not as scalar");
        }
        sink.addStep(step);
    }
}
