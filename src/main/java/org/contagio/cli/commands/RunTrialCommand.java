package org.contagio.cli.commands;

import java.io.PrintWriter;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;

import org.contagio.cli.CommandLineInterface;
import org.contagio.config.ModelConfiguration;
import org.contagio.runtime.AgentBasedModel;
import org.contagio.runtime.Measures;
import org.contagio.runtime.StepSummary;
import org.contagio.runtime.StoppingPredicate;
import org.contagio.runtime.Trial;
import org.contagio.runtime.TrialResult;
import org.contagio.runtime.api.ConfigurationException;
import org.contagio.runtime.internal.services.SeededRandomProvider;
import org.contagio.runtime.model.Behavior;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * CLI command that runs one trial of the configured model and prints its time series.
 * <p>
 * Reads {@code contagio.model} and {@code contagio.trial}; the options override the trial
 * settings.
 */
@Command(
    name = "run",
    description = "Run a single trial of the configured model and print its time series"
)
public class RunTrialCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(RunTrialCommand.class);

    /**
     * Output formats of the time series.
     */
    enum Format {
        TABLE,
        JSON
    }

    @Option(names = {"--seed"}, description = "Random seed (default: contagio.trial.seed)")
    private Long seed;

    @Option(names = {"--max-steps"}, description = "Step bound (default: contagio.trial.max-steps)")
    private Long maxSteps;

    @Option(names = {"--format"}, description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})",
            defaultValue = "TABLE")
    private Format format;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        try {
            Config config = parent.getConfig();
            Config trialConfig = config.getConfig("contagio.trial");
            long effectiveSeed = seed != null ? seed : trialConfig.getLong("seed");
            long effectiveMaxSteps = maxSteps != null ? maxSteps : trialConfig.getLong("max-steps");
            StoppingPredicate predicate = trialConfig.hasPath("stop-at-adaptive-fraction")
                    ? StoppingPredicate.adaptiveFractionAtLeast(trialConfig.getDouble("stop-at-adaptive-fraction"))
                    : StoppingPredicate.never();

            ModelConfiguration modelConfiguration = ModelConfiguration.fromConfig(config.getConfig("contagio.model"));
            AgentBasedModel model = modelConfiguration.build(new SeededRandomProvider(effectiveSeed));
            model.addMeasure(Measures.ADAPTIVE_FRACTION_NAME, Measures.ADAPTIVE_FRACTION);
            model.addMeasure(Measures.MEAN_FITNESS_NAME, Measures.MEAN_FITNESS);

            LOG.info("Running trial on {} agents (seed {}, max {} steps)", model.size(), effectiveSeed, effectiveMaxSteps);
            TrialResult result = new Trial(model, effectiveMaxSteps, predicate).run();

            if (format == Format.JSON) {
                out.println(toJson(result));
            } else {
                printTable(result, out);
            }
            out.flush();
            LOG.info("Trial finished: {} at step {}", result.outcome(), result.terminalStep());
            return 0;
        } catch (ConfigurationException | ConfigException | IllegalArgumentException e) {
            LOG.error("Cannot run trial: {}", e.getMessage());
            return 1;
        }
    }

    private static void printTable(TrialResult result, PrintWriter out) {
        StepSummary first = result.timeSeries().isEmpty() ? null : result.timeSeries().get(0);
        StringBuilder header = new StringBuilder("step\tlegacy\tadaptive");
        if (first != null) {
            for (String name : first.measures().keySet()) {
                header.append('\t').append(name);
            }
        }
        out.println(header);
        for (StepSummary summary : result.timeSeries()) {
            StringBuilder line = new StringBuilder()
                    .append(summary.step()).append('\t')
                    .append(summary.count(Behavior.LEGACY)).append('\t')
                    .append(summary.count(Behavior.ADAPTIVE));
            for (double value : summary.measures().values()) {
                line.append('\t').append(String.format(Locale.ROOT, "%.4f", value));
            }
            out.println(line);
        }
        out.println("outcome: " + result.outcome() + " at step " + result.terminalStep()
                + (result.failureMessage() != null ? " (" + result.failureMessage() + ")" : ""));
    }

    static String toJson(TrialResult result) {
        JsonObject json = new JsonObject();
        json.addProperty("outcome", result.outcome().name());
        json.addProperty("terminalStep", result.terminalStep());
        if (result.failureMessage() != null) {
            json.addProperty("failureMessage", result.failureMessage());
        }
        JsonArray series = new JsonArray();
        for (StepSummary summary : result.timeSeries()) {
            JsonObject step = new JsonObject();
            step.addProperty("step", summary.step());
            JsonObject counts = new JsonObject();
            for (Map.Entry<Behavior, Integer> entry : summary.counts().entrySet()) {
                counts.addProperty(entry.getKey().name(), entry.getValue());
            }
            step.add("counts", counts);
            JsonObject measures = new JsonObject();
            for (Map.Entry<String, Double> entry : summary.measures().entrySet()) {
                measures.addProperty(entry.getKey(), entry.getValue());
            }
            step.add("measures", measures);
            series.add(step);
        }
        json.add("timeSeries", series);
        return new GsonBuilder().serializeSpecialFloatingPointValues().setPrettyPrinting().create().toJson(json);
    }
}
