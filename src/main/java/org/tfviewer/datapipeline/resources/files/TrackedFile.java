package org.tfviewer.datapipeline.resources.files;

import com.google.protobuf.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tfviewer.datapipeline.resources.records.RecordFrame;
import org.tfviewer.datapipeline.resources.records.TfRecordReader;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Tracks how far a growing record file has been read.
 * <p>
 * The committed offset is the end of the last record that was fully processed. It only moves
 * forward while the file is valid; a file that was deleted or truncated below it is
 * {@linkplain #isValid() invalid} and the owning loader gives up on it.
 * <p>
 * Records and their decoded messages are cached per offset in small LRU caches, because
 * several entries can point at the same record and decode workers re-read records lazily.
 * <p>
 * <strong>Thread Safety:</strong> the committed offset is written by the poll thread only.
 * The cache methods are safe to call from any thread.
 */
public class TrackedFile {

    private static final Logger log = LoggerFactory.getLogger(TrackedFile.class);

    public static final int DEFAULT_CACHE_SIZE = 32;

    private final Path path;
    private volatile long committedOffset;

    private final Object cacheLock = new Object();
    private final Map<Long, byte[]> recordCache;
    private final Map<DecodedKey, Object> decodedCache;

    private record DecodedKey(long offset, Parser<?> parser) {
    }

    public TrackedFile(Path path) {
        this(path, DEFAULT_CACHE_SIZE);
    }

    public TrackedFile(Path path, int cacheSize) {
        this.path = Objects.requireNonNull(path, "path");
        if (cacheSize < 1) {
            throw new IllegalArgumentException("cacheSize must be >= 1, got " + cacheSize);
        }
        this.recordCache = new LruCache<>(cacheSize);
        this.decodedCache = new LruCache<>(cacheSize);
    }

    public Path getPath() {
        return path;
    }

    /**
     * @return true if the file exists and was not truncated below the committed offset.
     */
    public boolean isValid() {
        return Files.isRegularFile(path) && committedOffset <= size();
    }

    /**
     * @return true if the file size differs from the committed offset, i.e. there may be new records.
     */
    public boolean hasChanged() {
        return committedOffset != size();
    }

    /**
     * @return The current file size, 0 if the file does not exist.
     */
    public long size() {
        try {
            return Files.size(path);
        } catch (NoSuchFileException e) {
            return 0;
        } catch (IOException e) {
            log.debug("Cannot stat {}: {}", path, e.getMessage());
            return 0;
        }
    }

    /**
     * @return The last modification time in epoch milliseconds, 0 if the file does not exist.
     */
    public long lastModifiedTime() {
        try {
            return Files.getLastModifiedTime(path).toMillis();
        } catch (IOException e) {
            return 0;
        }
    }

    public long committedOffset() {
        return committedOffset;
    }

    /**
     * Commits the end of the last processed record.
     * <p>
     * A regressing offset means the file was replaced under us. That is a logic error on the
     * caller's side; it is logged and the caches are dropped, since they may describe the old file.
     */
    public void setCommittedOffset(long offset) {
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be >= 0, got " + offset);
        }
        if (offset < committedOffset) {
            log.error("Committed offset of {} regressed from {} to {}, dropping record cache",
                path, committedOffset, offset);
            clearCache();
        }
        committedOffset = offset;
    }

    /**
     * Opens a reader at the committed offset.
     */
    public TfRecordReader newReader() throws IOException {
        return newReaderFrom(committedOffset);
    }

    public TfRecordReader newReaderFrom(long offset) throws IOException {
        return TfRecordReader.open(path, offset);
    }

    /**
     * Returns the payload of the record starting at {@code offset}, reading it if not cached.
     *
     * @throws IOException if no complete, valid record starts at that offset.
     */
    public byte[] readCachedRecordAt(long offset) throws IOException {
        synchronized (cacheLock) {
            byte[] cached = recordCache.get(offset);
            if (cached != null) {
                return cached;
            }
        }
        byte[] payload;
        try (TfRecordReader reader = newReaderFrom(offset)) {
            Optional<RecordFrame> frame = reader.next();
            if (frame.isEmpty()) {
                throw new IOException("No complete record at offset " + offset + " in " + path);
            }
            payload = frame.get().payload();
        }
        synchronized (cacheLock) {
            recordCache.put(offset, payload);
        }
        return payload;
    }

    /**
     * Returns the record starting at {@code offset} parsed with {@code parser}, cached per offset.
     *
     * @throws IOException if the record cannot be read or parsed.
     */
    public <T> T readCachedAndDecodeAt(long offset, Parser<T> parser) throws IOException {
        DecodedKey key = new DecodedKey(offset, parser);
        synchronized (cacheLock) {
            Object cached = decodedCache.get(key);
            if (cached != null) {
                @SuppressWarnings("unchecked")
                T message = (T) cached;
                return message;
            }
        }
        T message = parser.parseFrom(readCachedRecordAt(offset));
        synchronized (cacheLock) {
            decodedCache.put(key, message);
        }
        return message;
    }

    public void clearCache() {
        synchronized (cacheLock) {
            recordCache.clear();
            decodedCache.clear();
        }
    }

    @Override
    public String toString() {
        return "TrackedFile(" + path + ")";
    }

    private static final class LruCache<K, V> extends LinkedHashMap<K, V> {
        private final int maxEntries;

        LruCache(int maxEntries) {
            super(16, 0.75f, true);
            this.maxEntries = maxEntries;
        }

        @Override
        protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
            return size() > maxEntries;
        }
    }
}
