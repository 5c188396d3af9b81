package org.tfviewer.datapipeline.services.loaders;

import com.google.protobuf.InvalidProtocolBufferException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tfviewer.datapipeline.api.decode.DecodedRecord;
import org.tfviewer.datapipeline.api.decode.RecordDecoder;
import org.tfviewer.datapipeline.api.entries.LoaderId;
import org.tfviewer.datapipeline.api.ingestion.EntrySink;
import org.tfviewer.datapipeline.resources.files.TrackedFile;
import org.tfviewer.datapipeline.resources.records.CorruptRecordException;
import org.tfviewer.datapipeline.resources.records.RecordFrame;
import org.tfviewer.datapipeline.resources.records.TfRecordReader;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.Lock;

/**
 * Base class for loaders that tail a single framed record file.
 * <p>
 * Each poll resumes at the committed offset and handles every complete record in file order:
 * decode, publish all entries of the record under the sink's lock, commit the record's end
 * offset, then report the record as committed. The stop request is checked before every
 * record, so a poll unwinds between records and never halfway through one.
 * <p>
 * <strong>Error policy:</strong>
 * <ul>
 *   <li>A partially written trailing record ends the poll; it is read again next cycle.</li>
 *   <li>An {@link IOException} ends the poll with a warning; the read is retried next cycle.</li>
 *   <li>A complete record with a bad payload checksum ends the poll. After
 *       {@link LoaderOptions#corruptRecordRetries()} consecutive failures at the same offset the
 *       record is skipped.</li>
 *   <li>A record with a bad length checksum cannot be skipped; the file stalls at that offset.</li>
 *   <li>A record that passes its checksum but does not parse is skipped immediately.</li>
 * </ul>
 * Programming errors such as an {@link IllegalStateException} from the sink propagate.
 */
public abstract sealed class AbstractFileLoader implements SourceLoader permits EventFileLoader, RecordFileLoader {

    protected final Logger log = LoggerFactory.getLogger(this.getClass());

    private final LoaderId id;
    private final TrackedFile file;
    private final RecordDecoder decoder;
    private final LoaderOptions options;

    private long failingOffset = -1;
    private int failures = 0;
    private long stalledOffset = -1;

    protected AbstractFileLoader(Path path, LoaderId id, RecordDecoder decoder, LoaderOptions options) {
        this.id = Objects.requireNonNull(id, "id");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.options = Objects.requireNonNull(options, "options");
        this.file = new TrackedFile(path, options.recordCacheSize());
    }

    @Override
    public LoaderId id() {
        return id;
    }

    @Override
    public Path path() {
        return file.getPath();
    }

    protected TrackedFile file() {
        return file;
    }

    @Override
    public long bytesLoaded() {
        return file.committedOffset();
    }

    @Override
    public long bytesTotal() {
        return file.size();
    }

    @Override
    public long sortKey() {
        return file.lastModifiedTime();
    }

    @Override
    public final boolean poll(EntrySink sink) {
        if (!file.isValid()) {
            log.info("{} was deleted or truncated below offset {}, dropping it", path(), file.committedOffset());
            return false;
        }
        if (!file.hasChanged()) {
            return true;
        }
        try (TfRecordReader reader = file.newReader()) {
            while (!sink.isInterruptionRequested()) {
                Optional<RecordFrame> frame = reader.next();
                if (frame.isEmpty()) {
                    break;
                }
                handleFrame(frame.get(), sink);
            }
        } catch (CorruptRecordException e) {
            handleCorruptRecord(e, sink);
        } catch (IOException e) {
            log.warn("Failed to read {} at offset {}: {}", path(), file.committedOffset(), e.getMessage());
            sink.reportError("READ_FAILED", path().toString(), e.getMessage());
        }
        return true;
    }

    private void handleFrame(RecordFrame frame, EntrySink sink) {
        if (frame.startOffset() == failingOffset) {
            log.debug("Record at offset {} of {} is readable again", failingOffset, path());
            failingOffset = -1;
            failures = 0;
        }
        DecodedRecord record;
        try {
            record = decoder.decodeRecord(frame.payload());
        } catch (InvalidProtocolBufferException e) {
            log.warn("Skipping malformed record in {} at offset {}: {}", path(), frame.startOffset(), e.getMessage());
            sink.reportError("MALFORMED_RECORD", path().toString(),
                "Record at offset " + frame.startOffset() + " does not parse: " + e.getMessage());
            file.setCommittedOffset(frame.endOffset());
            return;
        }

        Lock lock = sink.lock();
        lock.lock();
        try {
            publish(frame.startOffset(), record, sink);
        } finally {
            lock.unlock();
        }
        file.setCommittedOffset(frame.endOffset());
        sink.recordCommitted();
    }

    private void handleCorruptRecord(CorruptRecordException e, EntrySink sink) {
        if (!e.isSkippable()) {
            if (stalledOffset != e.getOffset()) {
                stalledOffset = e.getOffset();
                log.error("{} cannot be read past offset {}: {}", path(), e.getOffset(), e.getMessage());
                sink.reportError("CORRUPT_HEADER", path().toString(), e.getMessage());
            }
            return;
        }
        if (failingOffset != e.getOffset()) {
            failingOffset = e.getOffset();
            failures = 0;
        }
        failures++;
        if (failures < options.corruptRecordRetries()) {
            log.debug("Checksum mismatch in {} at offset {}, attempt {}/{}",
                path(), e.getOffset(), failures, options.corruptRecordRetries());
            return;
        }
        log.error("Skipping corrupt record in {} at offset {} after {} attempts", path(), e.getOffset(), failures);
        sink.reportError("CORRUPT_RECORD", path().toString(), e.getMessage());
        file.setCommittedOffset(e.getNextOffset());
        failingOffset = -1;
        failures = 0;
    }

    /**
     * Turns one decoded record into entries. Called with the sink's lock held.
     *
     * @param offset Start offset of the record, used by entries to re-read it.
     */
    protected abstract void publish(long offset, DecodedRecord record, EntrySink sink);

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + path() + ", id=" + id + ")";
    }
}
