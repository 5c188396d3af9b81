package org.tfviewer.datapipeline.entries;

import org.tfviewer.datapipeline.api.decode.ImageDataListener;
import org.tfviewer.datapipeline.api.decode.ImageSource;
import org.tfviewer.datapipeline.api.entries.EntryType;
import org.tfviewer.datapipeline.api.entries.LoaderId;
import org.tfviewer.datapipeline.api.entries.PerStepEntry;
import org.tfviewer.datapipeline.api.entries.Tag;
import org.tfviewer.datapipeline.resources.files.TrackedFile;
import org.tfviewer.datapipeline.services.decode.DecodeWorkerPool;
import org.tfviewer.datapipeline.services.decode.ImageDataFuture;

import java.util.Objects;

/**
 * A per-step entry whose payload is an image that is only decoded on request.
 * <p>
 * {@link #readImageDataAsync()} hands out one shared {@link ImageDataFuture} while a decode is
 * in flight; once it is done the next call creates a fresh one. Closing the entry cancels the
 * in-flight future.
 */
public abstract class ImageEntry extends PerStepEntry implements ImageSource {

    private final DecodeWorkerPool pool;
    private ImageDataFuture pending;

    protected ImageEntry(TrackedFile file, long offset, Tag tag, long step, LoaderId loaderId,
                         DecodeWorkerPool pool) {
        super(file, offset, tag, step, loaderId);
        this.pool = Objects.requireNonNull(pool, "pool");
    }

    @Override
    public EntryType getType() {
        return EntryType.IMAGE;
    }

    /**
     * Returns the future decoding this entry's image. The caller registers its listeners and
     * calls {@link ImageDataFuture#start()}.
     *
     * @throws IllegalStateException if the entry was closed.
     */
    public synchronized ImageDataFuture readImageDataAsync() {
        if (isClosed()) {
            throw new IllegalStateException("Entry " + this + " is closed");
        }
        if (pending == null) {
            ImageDataFuture future = new ImageDataFuture(this, toString(), pool);
            future.addListener(ImageDataListener.onDone(() -> clearPending(future)));
            pending = future;
        }
        return pending;
    }

    private synchronized void clearPending(ImageDataFuture future) {
        if (pending == future) {
            pending = null;
        }
    }

    /**
     * @return The tag line followed by {@code details}, if any.
     */
    protected String describe(String details) {
        return details.isEmpty() ? tagString() : tagString() + "\n" + details;
    }

    @Override
    public void close() {
        ImageDataFuture future;
        synchronized (this) {
            super.close();
            future = pending;
            pending = null;
        }
        if (future != null) {
            future.cancel();
        }
    }
}
