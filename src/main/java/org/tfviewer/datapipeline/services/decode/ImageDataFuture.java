package org.tfviewer.datapipeline.services.decode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tfviewer.datapipeline.api.decode.ImageData;
import org.tfviewer.datapipeline.api.decode.ImageDataListener;
import org.tfviewer.datapipeline.api.decode.ImageSource;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One asynchronous image decode on a {@link DecodeWorkerPool}.
 * <p>
 * State transitions are {@code CREATED -> STARTED -> (CANCELLED | COMPLETED)}, with
 * {@code CREATED -> CANCELLED} for a future cancelled before it was started. Listeners get
 * exactly one {@link ImageDataListener#onDone()} in every case, and at most one
 * {@link ImageDataListener#onDataReady(ImageData)}, only if the decode succeeded and was not
 * cancelled.
 * <p>
 * All transitions happen under one {@link ReentrantLock}. The worker releases it for the
 * duration of the actual decode, so {@link #cancel()} called from the consumer thread takes
 * effect immediately; a result computed after cancellation is discarded.
 */
public class ImageDataFuture implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(ImageDataFuture.class);

    public enum State {
        CREATED,
        STARTED,
        CANCELLED,
        COMPLETED
    }

    private final ReentrantLock lock = new ReentrantLock();
    private final ImageSource source;
    private final String description;
    private final DecodeWorkerPool pool;
    private final List<ImageDataListener> listeners = new CopyOnWriteArrayList<>();

    private State state = State.CREATED;
    private ImageData result;

    public ImageDataFuture(ImageSource source, String description, DecodeWorkerPool pool) {
        this.source = Objects.requireNonNull(source, "source");
        this.description = description;
        this.pool = Objects.requireNonNull(pool, "pool");
    }

    public void addListener(ImageDataListener listener) {
        listeners.add(listener);
    }

    public void removeListener(ImageDataListener listener) {
        listeners.remove(listener);
    }

    /**
     * Submits the decode to the pool. Calling it again, or after {@link #cancel()}, has no effect.
     */
    public void start() {
        lock.lock();
        try {
            if (state == State.CREATED) {
                state = State.STARTED;
                pool.submit(this);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Cancels the decode. Safe to call in any state; only the first call on an unfinished
     * future has an effect.
     */
    public void cancel() {
        lock.lock();
        try {
            if (state == State.CREATED || state == State.STARTED) {
                boolean submitted = state == State.STARTED;
                state = State.CANCELLED;
                if (submitted) {
                    pool.cancel(this);
                }
                fireDone();
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void run() {
        lock.lock();
        try {
            if (state != State.STARTED) {
                return;
            }
            ImageData data = null;
            boolean failed = false;
            lock.unlock();
            try {
                data = source.readImageData();
            } catch (IOException | RuntimeException e) {
                failed = true;
                log.warn("Failed to decode image for {}: {}", description, e.getMessage());
                log.debug("Exception details:", e);
            } finally {
                lock.lock();
            }
            if (state != State.STARTED) {
                log.debug("Discarding decoded image for {}, future was cancelled", description);
                return;
            }
            state = State.COMPLETED;
            if (!failed) {
                result = data;
                fireDataReady(data);
            }
            fireDone();
        } finally {
            lock.unlock();
        }
    }

    public State getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public boolean isDone() {
        State current = getState();
        return current == State.CANCELLED || current == State.COMPLETED;
    }

    /**
     * @return The decoded image once the future completed successfully.
     */
    public Optional<ImageData> getResult() {
        lock.lock();
        try {
            return Optional.ofNullable(result);
        } finally {
            lock.unlock();
        }
    }

    private void fireDataReady(ImageData data) {
        for (ImageDataListener listener : listeners) {
            try {
                listener.onDataReady(data);
            } catch (RuntimeException e) {
                log.warn("Image listener failed for {}: {}", description, e.getMessage());
                log.debug("Exception details:", e);
            }
        }
    }

    private void fireDone() {
        pool.taskFinished(this);
        for (ImageDataListener listener : listeners) {
            try {
                listener.onDone();
            } catch (RuntimeException e) {
                log.warn("Image listener failed for {}: {}", description, e.getMessage());
                log.debug("Exception details:", e);
            }
        }
    }

    @Override
    public String toString() {
        return "ImageDataFuture(" + description + ")";
    }
}
