package org.contagio.cli.commands;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

import org.contagio.cli.CommandLineInterface;
import org.contagio.config.ConfiguredModelFactory;
import org.contagio.experiment.ExperimentRecord;
import org.contagio.experiment.ExperimentRunner;
import org.contagio.experiment.ExperimentSummarizer;
import org.contagio.experiment.ParameterGrid;
import org.contagio.experiment.SummaryRow;
import org.contagio.experiment.checkpoint.CheckpointException;
import org.contagio.experiment.checkpoint.CorruptCheckpointPolicy;
import org.contagio.experiment.checkpoint.ICheckpointStore;
import org.contagio.experiment.checkpoint.InMemoryCheckpointStore;
import org.contagio.experiment.checkpoint.JsonLinesCheckpointStore;
import org.contagio.runtime.StoppingPredicate;
import org.contagio.runtime.api.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * CLI command that runs a parameter sweep and prints (or writes) the JSON summary.
 * <p>
 * Reads the base model from {@code contagio.model} and the sweep from
 * {@code contagio.experiment}; grid parameter names are paths inside the model block.
 * With a checkpoint file, an interrupted sweep resumes where it stopped when rerun with the
 * same configuration.
 */
@Command(
    name = "sweep",
    description = "Run a parameter sweep with checkpointing and print the summary as JSON"
)
public class SweepCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(SweepCommand.class);

    @Option(names = {"--seed"}, description = "Global seed (default: contagio.experiment.seed)")
    private Long seed;

    @Option(names = {"--replicates"}, description = "Replicates per combination (default: contagio.experiment.replicates)")
    private Integer replicates;

    @Option(names = {"--parallelism"}, description = "Worker threads, 0 = auto (default: contagio.experiment.parallelism)")
    private Integer parallelism;

    @Option(names = {"--checkpoint"}, description = "JSON Lines checkpoint file (default: contagio.experiment.checkpoint-file)")
    private Path checkpoint;

    @Option(names = {"--on-corrupt"}, description = "Corrupt checkpoint policy: ${COMPLETION-CANDIDATES} "
            + "(default: contagio.experiment.on-corrupt-checkpoint)")
    private CorruptCheckpointPolicy onCorrupt;

    @Option(names = {"--group-by"}, split = ",", description = "Parameters to group the summary by "
            + "(default: contagio.experiment.group-by, or every grid parameter)")
    private List<String> groupBy;

    @Option(names = {"-o", "--output"}, description = "Write the summary to this file instead of standard output")
    private Path output;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        try {
            Config config = parent.getConfig();
            Config experiment = config.getConfig("contagio.experiment");
            ParameterGrid grid = ParameterGrid.fromConfig(experiment.getConfig("grid"));
            List<String> effectiveGroupBy = groupBy != null ? groupBy
                    : experiment.hasPath("group-by") && !experiment.getStringList("group-by").isEmpty()
                    ? experiment.getStringList("group-by") : grid.names();

            ExperimentRunner.Builder runner = ExperimentRunner.builder()
                    .modelFactory(new ConfiguredModelFactory(config.getConfig("contagio.model")))
                    .grid(grid)
                    .seed(seed != null ? seed : experiment.getLong("seed"))
                    .replicates(replicates != null ? replicates : experiment.getInt("replicates"))
                    .maxSteps(experiment.getLong("max-steps"))
                    .parallelism(parallelism != null ? parallelism : experiment.getInt("parallelism"))
                    .checkpointInterval(experiment.getInt("checkpoint-interval"));
            if (experiment.hasPath("stop-at-adaptive-fraction")) {
                runner.stoppingPredicate(StoppingPredicate.adaptiveFractionAtLeast(
                        experiment.getDouble("stop-at-adaptive-fraction")));
            }

            List<ExperimentRecord> records;
            try (ICheckpointStore store = openCheckpoint(experiment)) {
                records = runner.checkpointStore(store).build().run();
            }

            String json = toJson(ExperimentSummarizer.summarize(records, effectiveGroupBy));
            if (output != null) {
                Files.writeString(output, json + System.lineSeparator(), StandardCharsets.UTF_8);
                LOG.info("Summary written to {}", output.toAbsolutePath());
            } else {
                out.println(json);
                out.flush();
            }
            return 0;
        } catch (ConfigurationException | ConfigException | IllegalArgumentException e) {
            LOG.error("Invalid sweep configuration: {}", e.getMessage());
            return 1;
        } catch (CheckpointException e) {
            LOG.error("Checkpoint error: {}", e.getMessage());
            return 1;
        } catch (IOException e) {
            LOG.error("Failed to write summary: {}", e.getMessage());
            return 1;
        }
    }

    private ICheckpointStore openCheckpoint(Config experiment) {
        Path file = checkpoint != null ? checkpoint
                : experiment.hasPath("checkpoint-file") ? Path.of(experiment.getString("checkpoint-file")) : null;
        if (file == null) {
            LOG.info("No checkpoint file configured; the sweep cannot be resumed");
            return new InMemoryCheckpointStore();
        }
        CorruptCheckpointPolicy policy = onCorrupt != null ? onCorrupt
                : CorruptCheckpointPolicy.parse(experiment.getString("on-corrupt-checkpoint"));
        LOG.info("Using checkpoint {} (on corrupt data: {})", file.toAbsolutePath(), policy);
        return new JsonLinesCheckpointStore(file, policy);
    }

    /**
     * Renders summary rows as a JSON array; undefined statistics become {@code null}.
     */
    static String toJson(List<SummaryRow> rows) {
        JsonArray array = new JsonArray();
        for (SummaryRow row : rows) {
            JsonObject json = new JsonObject();
            for (Map.Entry<String, Object> entry : row.group().entrySet()) {
                Object value = entry.getValue();
                if (value instanceof Number number) {
                    json.add(entry.getKey(), new JsonPrimitive(number));
                } else if (value instanceof Boolean bool) {
                    json.add(entry.getKey(), new JsonPrimitive(bool));
                } else {
                    json.add(entry.getKey(), new JsonPrimitive(String.valueOf(value)));
                }
            }
            json.addProperty("replicates", row.replicates());
            addNumber(json, "success_rate", row.successRate());
            addNumber(json, "mean_time_to_fixation", row.meanTimeToFixation());
            addNumber(json, "std_time_to_fixation", row.stdTimeToFixation());
            json.addProperty("timed_out", row.timedOut());
            json.addProperty("failed", row.failed());
            addNumber(json, "mean_final_adaptive_fraction", row.meanFinalAdaptiveFraction());
            array.add(json);
        }
        return new GsonBuilder().serializeNulls().setPrettyPrinting().create().toJson(array);
    }

    private static void addNumber(JsonObject json, String name, double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            json.add(name, JsonNull.INSTANCE);
        } else {
            json.addProperty(name, value);
        }
    }
}
