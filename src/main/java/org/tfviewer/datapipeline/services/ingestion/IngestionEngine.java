package org.tfviewer.datapipeline.services.ingestion;

import org.tfviewer.datapipeline.api.entries.Entry;
import org.tfviewer.datapipeline.api.entries.EntryType;
import org.tfviewer.datapipeline.api.entries.GlobalEntry;
import org.tfviewer.datapipeline.api.entries.LoaderId;
import org.tfviewer.datapipeline.api.entries.PerStepEntry;
import org.tfviewer.datapipeline.api.entries.Tag;
import org.tfviewer.datapipeline.api.ingestion.EntrySink;
import org.tfviewer.datapipeline.api.ingestion.IngestionListener;
import org.tfviewer.datapipeline.formats.TagPaths;
import org.tfviewer.datapipeline.services.AbstractService;
import org.tfviewer.datapipeline.services.decode.DecodeWorkerPool;
import org.tfviewer.datapipeline.services.loaders.SourceLoader;
import org.tfviewer.datapipeline.services.loaders.SourceLoaderRegistry;
import org.tfviewer.datapipeline.utils.monitoring.SlidingWindowCounter;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Tails a set of event and record sources and maintains a merged index of their entries.
 * <p>
 * A dedicated poll thread polls every source loader once per cycle, in ascending
 * {@link SourceLoader#sortKey()} order, then waits for the poll interval or a wake-up from
 * {@link #stop()}, {@link #reload()} or {@link #addSource(Path)}. Loaders publish entries through
 * an {@link EntrySink} under the engine lock, one record at a time; consumer threads read
 * snapshots under the same lock.
 * <p>
 * <strong>Notifications:</strong> until the first complete cycle the engine is in initial-load
 * mode. Tags discovered in that mode are announced in one batch when the cycle completes,
 * followed by {@code onProgress(iteration, 1.0)} and {@code onInitialLoadComplete()}. Afterwards
 * (or throughout, with interactive preload) tags and new step positions are announced as they
 * are read. {@link #addSource(Path)} re-enters initial-load mode.
 * <p>
 * <strong>Failure semantics:</strong> I/O problems are handled inside the loaders and retried.
 * Any exception escaping a loader, such as an index invariant violation, ends the poll loop
 * and moves the engine to {@link State#ERROR}. Listeners always receive
 * {@code onLoopStopped()} and the decode pool is drained before the poll thread exits.
 * <pre>
 * IngestionEngine engine = new IngestionEngine(IngestionConfig.defaults(),
 *     SourceLoaderRegistry.defaults(LoaderOptions.DEFAULTS));
 * engine.subscribe(listener);
 * engine.start(List.of(Path.of("runs/experiment-1")));
 * ...
 * engine.close();
 * </pre>
 */
public class IngestionEngine extends AbstractService implements AutoCloseable {

    private final IngestionConfig config;
    private final SourceLoaderRegistry registry;
    private final DecodeWorkerPool workerPool;
    private final TagPaths tagPaths = new TagPaths();
    private final Sink sink = new Sink();

    private final ReentrantLock lock = new ReentrantLock();
    private final EntryIndex index = new EntryIndex();
    private int announcedTags = 0;
    private final List<PendingStep> pendingSteps = new ArrayList<>();

    private final ReentrantLock waitLock = new ReentrantLock();
    private final Condition wakeCondition = waitLock.newCondition();
    private boolean wakeRequested = false;

    private final List<IngestionListener> listeners = new CopyOnWriteArrayList<>();
    private final List<SourceLoader> loaders = new ArrayList<>();
    private final List<Path> sourcePaths = new CopyOnWriteArrayList<>();
    private final Queue<Path> pendingSources = new ConcurrentLinkedQueue<>();
    private int nextLoaderIndex = 0;

    private volatile boolean initialLoad = true;
    private volatile boolean reloadRequested = false;
    private volatile int activeLoaders = 0;
    private long iteration = 0;
    private final AtomicLong recordsCommitted = new AtomicLong();
    private final SlidingWindowCounter recordRate = new SlidingWindowCounter(5);

    private record PendingStep(int position, long iteration) {
    }

    public IngestionEngine(IngestionConfig config, SourceLoaderRegistry registry) {
        super("ingestion-engine", config.stopTimeout());
        this.config = Objects.requireNonNull(config, "config");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.workerPool = new DecodeWorkerPool(serviceName, config.workerThreads(), config.stopTimeout());
    }

    /**
     * Resolves the given paths to loaders and starts the poll thread. Paths no loader applies
     * to are logged and skipped.
     *
     * @throws IllegalStateException if the engine was already started.
     */
    public void start(Collection<Path> paths) {
        if (getCurrentState() != State.IDLE) {
            throw new IllegalStateException("Cannot start " + serviceName + " as it is in state " + getCurrentState());
        }
        for (Path path : paths) {
            addLoader(path);
        }
        loaders.sort(Comparator.comparingLong(SourceLoader::sortKey));
        activeLoaders = loaders.size();
        start();
    }

    @Override
    protected void logStarted() {
        log.info("{} started with {} source(s), polling every {} ms", serviceName, loaders.size(),
            config.pollInterval().toMillis());
    }

    /**
     * Adds a top-level source while the engine runs. The poll thread picks it up at the start
     * of the next cycle, which starts immediately, and re-enters initial-load mode until that
     * cycle completes.
     *
     * @throws IllegalStateException if the engine is not {@link State#RUNNING}.
     */
    public void addSource(Path path) {
        Objects.requireNonNull(path, "path");
        State state = getCurrentState();
        if (state != State.RUNNING) {
            throw new IllegalStateException("Cannot add " + path + " to " + serviceName + " in state " + state);
        }
        pendingSources.add(path);
        wake();
    }

    /**
     * Requests a full reload: the poll thread closes all entries, clears the index, recreates
     * all loaders with fresh ids and reads every source from the beginning.
     */
    public void reload() {
        reloadRequested = true;
        wake();
    }

    public void subscribe(IngestionListener listener) {
        Objects.requireNonNull(listener, "listener");
        lock.lock();
        try {
            listeners.add(listener);
            List<Tag> tags = index.tags();
            for (int i = 0; i < announcedTags; i++) {
                announceTag(listener, tags.get(i));
            }
        } finally {
            lock.unlock();
        }
    }

    public void unsubscribe(IngestionListener listener) {
        listeners.remove(listener);
    }

    @Override
    protected void onStopRequested() {
        wake();
    }

    /**
     * Stops the engine if it runs and closes all entries. Idempotent.
     */
    @Override
    public void close() {
        stop();
        lock.lock();
        try {
            index.clear();
            announcedTags = 0;
            pendingSteps.clear();
        } finally {
            lock.unlock();
        }
        workerPool.stop();
    }

    @Override
    protected void run() throws InterruptedException {
        try {
            while (!isStopRequested()) {
                if (!pollCycle()) {
                    log.info("No sources left, stopping {}", serviceName);
                    break;
                }
                awaitNextCycle();
            }
        } finally {
            Path dropped;
            while ((dropped = pendingSources.poll()) != null) {
                log.warn("Dropping source {} added while {} was stopping", dropped, serviceName);
            }
            lock.lock();
            try {
                fire(IngestionListener::onLoopStopped);
            } finally {
                lock.unlock();
            }
            if (workerPool.pendingCount() > 0) {
                log.debug("Waiting for {} decode task(s)", workerPool.pendingCount());
            }
            workerPool.stop();
        }
    }

    /**
     * Runs one poll cycle.
     *
     * @return false if there are no sources left.
     */
    private boolean pollCycle() {
        if (reloadRequested) {
            reloadRequested = false;
            performReload();
        }
        drainPendingSources();

        List<SourceLoader> unusable = new ArrayList<>();
        for (SourceLoader loader : loaders) {
            if (!loader.poll(sink)) {
                unusable.add(loader);
            }
            if (sink.isInterruptionRequested()) {
                break;
            }
        }
        for (SourceLoader loader : unusable) {
            loaders.remove(loader);
            log.info("Source {} is gone, dropping loader {}", loader.path(), loader.id());
            sink.deleteLoader(loader.id());
        }
        activeLoaders = loaders.size();

        if (sink.isInterruptionRequested()) {
            return true;
        }
        if (loaders.isEmpty() && pendingSources.isEmpty()) {
            return false;
        }
        if (initialLoad && pendingSources.isEmpty()) {
            completeInitialLoad();
        }
        return true;
    }

    private void completeInitialLoad() {
        lock.lock();
        try {
            announcePendingTags();
            long current = iteration;
            fire(l -> l.onProgress(current, 1.0));
            log.info("Initial load complete: {} tag(s), {} step(s) after {} record(s)",
                index.tagCount(), index.stepCount(), current);
            fire(IngestionListener::onInitialLoadComplete);
            initialLoad = false;
        } finally {
            lock.unlock();
        }
    }

    private void performReload() {
        log.info("Reloading {} source(s)", sourcePaths.size());
        lock.lock();
        try {
            index.clear();
            announcedTags = 0;
            pendingSteps.clear();
            initialLoad = true;
            fire(IngestionListener::onSourceDiscoveryCleared);
        } finally {
            lock.unlock();
        }
        loaders.clear();
        List<Path> paths = new ArrayList<>(sourcePaths);
        sourcePaths.clear();
        for (Path path : paths) {
            addLoader(path);
        }
        loaders.sort(Comparator.comparingLong(SourceLoader::sortKey));
        activeLoaders = loaders.size();
    }

    private void drainPendingSources() {
        Path path;
        boolean added = false;
        while ((path = pendingSources.poll()) != null) {
            addLoader(path);
            added = true;
        }
        if (added) {
            initialLoad = true;
            activeLoaders = loaders.size();
        }
    }

    private void addLoader(Path path) {
        sourcePaths.add(path);
        LoaderId id = LoaderId.of(nextLoaderIndex++);
        Optional<SourceLoader> loader = registry.resolve(path, id);
        if (loader.isPresent()) {
            loaders.add(loader.get());
        } else {
            log.warn("Cannot load {}: not an event file, event directory or record file", path);
            recordError("UNSUPPORTED_SOURCE", path.toString(), "No source kind applies to this path");
        }
    }

    private void awaitNextCycle() throws InterruptedException {
        waitLock.lock();
        try {
            if (!wakeRequested && !isStopRequested()) {
                wakeCondition.await(config.pollInterval().toMillis(), TimeUnit.MILLISECONDS);
            }
            wakeRequested = false;
        } finally {
            waitLock.unlock();
        }
    }

    private void wake() {
        waitLock.lock();
        try {
            wakeRequested = true;
            wakeCondition.signalAll();
        } finally {
            waitLock.unlock();
        }
    }

    private boolean isStreaming() {
        return config.interactivePreload() || !initialLoad;
    }

    /**
     * Announces all tags not announced yet, in first-seen order. Caller holds the lock.
     */
    private void announcePendingTags() {
        List<Tag> tags = index.tags();
        while (announcedTags < tags.size()) {
            Tag tag = tags.get(announcedTags++);
            for (IngestionListener listener : listeners) {
                announceTag(listener, tag);
            }
        }
    }

    private void announceTag(IngestionListener listener, Tag tag) {
        EntryType type = index.typeOf(tag);
        try {
            if (index.isGlobal(tag)) {
                listener.onGlobalEntryDiscovered(tag, type);
            } else {
                listener.onTagDiscovered(tag, type);
            }
        } catch (RuntimeException e) {
            log.warn("Listener {} failed on tag {}: {}", listener, tag, e.getMessage());
            log.debug("Exception details:", e);
        }
    }

    private void fire(Consumer<IngestionListener> notification) {
        for (IngestionListener listener : listeners) {
            try {
                notification.accept(listener);
            } catch (RuntimeException e) {
                log.warn("Listener {} failed: {}", listener, e.getMessage());
                log.debug("Exception details:", e);
            }
        }
    }

    private double progressRatio() {
        long loaded = 0;
        long total = 0;
        for (SourceLoader loader : loaders) {
            loaded += loader.bytesLoaded();
            total += loader.bytesTotal();
        }
        return total == 0 ? 1.0 : (double) loaded / total;
    }

    /**
     * @return All tags, per-step and global, in first-seen order.
     */
    public List<Tag> tags() {
        lock.lock();
        try {
            return List.copyOf(index.tags());
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return The type of every tag, in first-seen order.
     */
    public Map<Tag, EntryType> tagTypes() {
        lock.lock();
        try {
            return index.tagTypesCopy();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return All distinct steps, ascending.
     */
    public List<Long> steps() {
        lock.lock();
        try {
            return index.stepsCopy();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return Per-step entries by tag, each list ascending by step.
     */
    public Map<Tag, List<PerStepEntry>> tagIndex() {
        lock.lock();
        try {
            return index.tagIndexCopy();
        } finally {
            lock.unlock();
        }
    }

    public List<PerStepEntry> entries(Tag tag) {
        lock.lock();
        try {
            return index.entriesCopy(tag);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return The newest entry of every tag that has one at exactly this step.
     */
    public Map<Tag, PerStepEntry> entriesAtStep(long step) {
        lock.lock();
        try {
            return index.entriesAtStepCopy(step);
        } finally {
            lock.unlock();
        }
    }

    public Optional<GlobalEntry> globalEntry(Tag tag) {
        lock.lock();
        try {
            return Optional.ofNullable(index.globalEntry(tag));
        } finally {
            lock.unlock();
        }
    }

    public List<GlobalEntry> globalEntries() {
        lock.lock();
        try {
            return List.copyOf(index.globals());
        } finally {
            lock.unlock();
        }
    }

    public boolean isInitialLoad() {
        return initialLoad;
    }

    public DecodeWorkerPool workerPool() {
        return workerPool;
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("loaders_active", activeLoaders);
        metrics.put("records_committed", recordsCommitted.get());
        metrics.put("records_per_second", recordRate.getRate());
        metrics.put("decode_tasks_pending", workerPool.pendingCount());
        lock.lock();
        try {
            metrics.put("tags_known", index.tagCount());
            metrics.put("steps_known", index.stepCount());
            metrics.put("entries_known", index.perStepCount());
        } finally {
            lock.unlock();
        }
    }

    /**
     * The mutation interface handed to loaders. Only used on the poll thread.
     */
    private final class Sink implements EntrySink {

        @Override
        public boolean isInterruptionRequested() {
            return isStopRequested() || reloadRequested;
        }

        @Override
        public Lock lock() {
            return lock;
        }

        @Override
        public Tag tagToPath(String tag) {
            return tagPaths.toPath(tag);
        }

        @Override
        public void addEntry(Entry entry) {
            if (!lock.isHeldByCurrentThread()) {
                throw new IllegalStateException("addEntry requires the engine lock");
            }
            EntryIndex.Insertion insertion = index.add(entry);
            if (insertion.stepPosition() >= 0) {
                pendingSteps.add(new PendingStep(insertion.stepPosition(), iteration));
            }
            if (insertion.newTag() && isStreaming()) {
                announcePendingTags();
            }
        }

        @Override
        public void addStep(long step) {
            if (!lock.isHeldByCurrentThread()) {
                throw new IllegalStateException("addStep requires the engine lock");
            }
            int position = index.addStep(step);
            if (position >= 0) {
                pendingSteps.add(new PendingStep(position, iteration));
            }
        }

        @Override
        public GlobalEntry globalEntry(Tag tag) {
            return index.globalEntry(tag);
        }

        @Override
        public DecodeWorkerPool workerPool() {
            return workerPool;
        }

        @Override
        public void deleteLoader(LoaderId loaderId) {
            log.debug("Loader {} removed", loaderId);
            fire(l -> l.onLoaderRemoved(loaderId));
        }

        @Override
        public void recordCommitted() {
            recordsCommitted.incrementAndGet();
            recordRate.recordCount();
            long current = iteration;
            if (initialLoad) {
                if (current % config.progressInterval() == 0) {
                    double ratio = progressRatio();
                    fire(l -> l.onProgress(current, ratio));
                }
            } else {
                fire(l -> l.onProgress(current, 1.0));
            }
            iteration++;
            lock.lock();
            try {
                if (isStreaming()) {
                    for (PendingStep step : pendingSteps) {
                        fire(l -> l.onStepInserted(step.position(), step.iteration()));
                    }
                }
                pendingSteps.clear();
            } finally {
                lock.unlock();
            }
        }

        @Override
        public void reportError(String code, String source, String message) {
            recordError(code, source, message);
        }
    }
}
