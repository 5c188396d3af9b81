package org.tfviewer.cli.commands;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.tfviewer.cli.CommandLineInterface;
import org.tfviewer.datapipeline.api.entries.EntryType;
import org.tfviewer.datapipeline.api.entries.GlobalEntry;
import org.tfviewer.datapipeline.api.entries.PerStepEntry;
import org.tfviewer.datapipeline.api.entries.Tag;
import org.tfviewer.datapipeline.api.ingestion.IngestionListener;
import org.tfviewer.datapipeline.api.resources.OperationalError;
import org.tfviewer.datapipeline.entries.ScalarEntry;
import org.tfviewer.datapipeline.services.ingestion.IngestionConfig;
import org.tfviewer.datapipeline.services.ingestion.IngestionEngine;
import org.tfviewer.datapipeline.services.loaders.SourceLoaderRegistry;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

@Command(
    name = "inspect",
    description = "Read the given sources once and print their tags, steps and read errors"
)
public class InspectCommand implements Callable<Integer> {

    @Parameters(arity = "1..*", paramLabel = "PATH", description = "Event file, event directory or record file")
    private List<Path> paths;

    @Option(names = "--json", description = "Print the summary as JSON")
    private boolean json;

    @Option(names = "--timeout-seconds", defaultValue = "300", description = "Give up if the initial load takes longer (default: ${DEFAULT-VALUE})")
    private long timeoutSeconds;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    /**
     * @param count Number of entries for per-step tags, number of observations for series.
     */
    public record TagSummary(String tag, String type, boolean global, int count) {
    }

    public record Summary(List<TagSummary> tags, int stepCount, Long firstStep, Long lastStep, List<String> errors) {
    }

    @Override
    public Integer call() throws InterruptedException, JsonProcessingException {
        IngestionConfig config = IngestionConfig.fromRoot(parent.getConfig());
        Summary summary;
        try (IngestionEngine engine = new IngestionEngine(config, SourceLoaderRegistry.defaults(config.loaderOptions()))) {
            CountDownLatch loaded = new CountDownLatch(1);
            engine.subscribe(new IngestionListener() {
                @Override
                public void onInitialLoadComplete() {
                    loaded.countDown();
                }

                @Override
                public void onLoopStopped() {
                    loaded.countDown();
                }
            });
            engine.start(paths);
            if (!loaded.await(timeoutSeconds, TimeUnit.SECONDS)) {
                spec.commandLine().getErr().println("Initial load did not complete within " + timeoutSeconds + " s");
                return 1;
            }
            summary = summarize(engine);
        }

        PrintWriter out = spec.commandLine().getOut();
        if (json) {
            ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
            out.println(mapper.writeValueAsString(summary));
        } else {
            printText(summary, out);
        }
        out.flush();
        return summary.errors().isEmpty() ? 0 : 2;
    }

    static Summary summarize(IngestionEngine engine) {
        List<TagSummary> tags = new ArrayList<>();
        Map<Tag, EntryType> types = engine.tagTypes();
        Map<Tag, List<PerStepEntry>> index = engine.tagIndex();
        for (Map.Entry<Tag, EntryType> entry : types.entrySet()) {
            Tag tag = entry.getKey();
            String type = entry.getValue().getName();
            List<PerStepEntry> perStep = index.get(tag);
            if (perStep != null) {
                tags.add(new TagSummary(tag.toPathString(), type, false, perStep.size()));
            } else {
                GlobalEntry global = engine.globalEntry(tag).orElseThrow();
                int observations = global instanceof ScalarEntry scalar ? scalar.size() : global.steps().size();
                tags.add(new TagSummary(tag.toPathString(), type, true, observations));
            }
        }
        List<Long> steps = engine.steps();
        List<String> errors = new ArrayList<>();
        for (OperationalError error : engine.getErrors()) {
            errors.add(error.code() + " " + error.source() + ": " + error.message());
        }
        return new Summary(tags, steps.size(),
            steps.isEmpty() ? null : steps.get(0),
            steps.isEmpty() ? null : steps.get(steps.size() - 1),
            errors);
    }

    private static void printText(Summary summary, PrintWriter out) {
        out.printf("%d tag(s)%n", summary.tags().size());
        for (TagSummary tag : summary.tags()) {
            out.printf("  %-40s %-7s %s%d%n", tag.tag(), tag.type(), tag.global() ? "observations=" : "entries=", tag.count());
        }
        if (summary.stepCount() == 0) {
            out.println("no steps");
        } else {
            out.printf("%d step(s) from %d to %d%n", summary.stepCount(), summary.firstStep(), summary.lastStep());
        }
        for (String error : summary.errors()) {
            out.println("error: " + error);
        }
    }
}
