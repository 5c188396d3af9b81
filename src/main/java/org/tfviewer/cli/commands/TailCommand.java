package org.tfviewer.cli.commands;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tfviewer.cli.CommandLineInterface;
import org.tfviewer.datapipeline.api.entries.EntryType;
import org.tfviewer.datapipeline.api.entries.LoaderId;
import org.tfviewer.datapipeline.api.entries.Tag;
import org.tfviewer.datapipeline.api.ingestion.IngestionListener;
import org.tfviewer.datapipeline.api.services.IService;
import org.tfviewer.datapipeline.services.ingestion.IngestionConfig;
import org.tfviewer.datapipeline.services.ingestion.IngestionEngine;
import org.tfviewer.datapipeline.services.loaders.SourceLoaderRegistry;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

@Command(
    name = "tail",
    description = "Follow event files, event directories and record files and log what appears until interrupted"
)
public class TailCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(TailCommand.class);

    @Parameters(arity = "1..*", paramLabel = "PATH", description = "Event file, event directory or record file")
    private List<Path> paths;

    @Option(names = "--interactive", description = "Report tags and steps while the initial load is still running")
    private boolean interactive;

    @Option(names = "--poll-interval-ms", description = "Override the configured poll interval")
    private Long pollIntervalMs;

    @ParentCommand
    private CommandLineInterface parent;

    @Override
    public Integer call() throws InterruptedException {
        IngestionConfig config = IngestionConfig.fromRoot(parent.getConfig());
        if (interactive) {
            config = config.withInteractivePreload(true);
        }
        if (pollIntervalMs != null) {
            config = config.withPollInterval(Duration.ofMillis(pollIntervalMs));
        }

        IngestionEngine engine = new IngestionEngine(config, SourceLoaderRegistry.defaults(config.loaderOptions()));
        CountDownLatch stopped = new CountDownLatch(1);
        engine.subscribe(new TailListener(stopped));
        Thread shutdownHook = new Thread(engine::close, "tfviewer-shutdown");
        Runtime.getRuntime().addShutdownHook(shutdownHook);

        engine.start(paths);
        stopped.await();
        engine.close();
        try {
            Runtime.getRuntime().removeShutdownHook(shutdownHook);
        } catch (IllegalStateException e) {
            LOG.debug("JVM already shutting down");
        }
        return engine.getCurrentState() == IService.State.ERROR ? 1 : 0;
    }

    private static final class TailListener implements IngestionListener {
        private final CountDownLatch stopped;

        TailListener(CountDownLatch stopped) {
            this.stopped = stopped;
        }

        @Override
        public void onSourceDiscoveryCleared() {
            LOG.info("Index cleared, reloading");
        }

        @Override
        public void onProgress(long iteration, double ratio) {
            LOG.debug("Progress: {} record(s), {}%", iteration, Math.round(ratio * 100));
        }

        @Override
        public void onStepInserted(int position, long iteration) {
            LOG.debug("New step at position {} (record {})", position, iteration);
        }

        @Override
        public void onTagDiscovered(Tag tag, EntryType type) {
            LOG.info("Tag {} ({})", tag, type.getName());
        }

        @Override
        public void onGlobalEntryDiscovered(Tag tag, EntryType type) {
            LOG.info("Series {} ({})", tag, type.getName());
        }

        @Override
        public void onInitialLoadComplete() {
            LOG.info("Initial load complete, following new data");
        }

        @Override
        public void onLoaderRemoved(LoaderId loaderId) {
            LOG.info("Source {} removed", loaderId);
        }

        @Override
        public void onLoopStopped() {
            stopped.countDown();
        }
    }
}
