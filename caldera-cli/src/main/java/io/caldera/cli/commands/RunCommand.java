package io.caldera.cli.commands;

import io.caldera.cli.execution.VerboseRecipeListener;
import io.caldera.cli.ui.AnsiStyles;
import io.caldera.core.CalderaConfig;
import io.caldera.core.CalderaEnvironment;
import io.caldera.core.calibration.CalibrationOverrides;
import io.caldera.core.exception.PipelineAbortException;
import io.caldera.core.exception.UserAbortException;
import io.caldera.core.execution.RecipeListener;
import io.caldera.core.execution.RecipeStatus;
import io.caldera.core.execution.RunLog;
import io.caldera.core.frame.GroupMode;
import io.caldera.core.loop.LoopSelector.LoopRequest;
import io.caldera.core.loop.LoopType;
import io.caldera.core.loop.ObservationList;
import io.caldera.core.pipeline.PipelineOrchestrator;
import io.caldera.core.pipeline.RunParameters;
import io.caldera.core.pipeline.RunStatistics;
import io.caldera.core.recipe.RecipeParameters;
import io.caldera.serialization.RecipeJson;
import io.caldera.serialization.RunSummary;
import jakarta.inject.Inject;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/// CLI command that reduces a night of observations.
///
/// ### Usage
/// ```bash
/// caldera run [--ut YYYYMMDD] [--from N] [--to N | --list 1,3,5:8 | --files a,b]
///             [--loop list|inf|wait|flag|file] [--skip] [--batch]
///             [--calib dark=d_12,readnoise=8] [--recipe NAME] [--recpars FILE]
///             [--grptrans] [--resume] [-v] [--summary-json FILE]
/// ```
///
/// ### Exit status
/// - `0` every recipe completed or terminated cleanly
/// - `1` a recipe failed, the data loop timed out, or the run aborted
/// - `2` invalid arguments
///
/// @see io.caldera.core.pipeline.PipelineOrchestrator
@Command(name = "run", description = "Reduce observations with their recipes")
class RunCommand extends CalderaCommand {

    private static final Logger logger = Logger.getLogger(RunCommand.class.getName());

    @Option(names = "--ut", description = "UT date to reduce, YYYYMMDD (default: today)")
    private String utdate;

    @Option(names = "--from", description = "First observation number")
    private Integer from;

    @Option(names = "--to", description = "Last observation number")
    private Integer to;

    @Option(names = "--list", description = "Observation list, e.g. 1,3,5:8")
    private String list;

    @Option(names = "--files", split = ",", description = "Explicit input files, relative to the input directory")
    private List<String> files;

    @Option(names = "--loop", description = "Loop type: list, inf, wait, flag or file")
    private String loop;

    @Option(names = "--skip", description = "Skip missing observations")
    private boolean skip = false;

    @Option(names = "--batch", description = "Group every frame before running any recipe")
    private boolean batch = false;

    @Option(names = "--calib", description = "Calibration overrides, e.g. dark=d_12,readnoise=8")
    private String calib;

    @Option(names = "--recipe", description = "Recipe to run instead of the one in each header")
    private String recipe;

    @Option(names = "--recpars", description = "Recipe parameter file")
    private String recpars;

    @Option(names = "--grptrans", description = "Drop existing groups whenever a new group starts")
    private boolean groupTransient = false;

    @Option(names = "--resume", description = "Keep existing group files")
    private boolean resume = false;

    @Option(
            names = {"-v", "--verbose"},
            description = "Show primitives and engine calls as they run")
    private boolean verbose = false;

    @Option(names = "--summary-json", description = "Write a JSON run summary to this file")
    private Path summaryJson;

    @Inject CalderaEnvironment environment;

    Clock clock = Clock.systemUTC();

    @Override
    protected int execute() {
        AnsiStyles styles = styles();

        RunParameters parameters;
        try {
            parameters = parameters();
        } catch (IllegalArgumentException | IOException e) {
            printError("Invalid arguments:", e.getMessage());
            return USAGE;
        }

        CalderaConfig config = environment.getConfig();
        if (groupTransient) {
            config.setGroupMode(GroupMode.TRANSIENT);
        }
        config.setResume(config.isResume() || resume);

        System.out.printf(
                "%s %s%n",
                styles.checkmark(),
                styles.bold("Reducing UT " + parameters.utdate() + " for " + environment.getInstrument().name()));
        System.out.printf(
                "%s%n%n",
                styles.gray("  Input: " + config.getInputDir() + " " + styles.bullet()
                        + " Output: " + config.getOutputDir()
                        + (batch ? " " + styles.bullet() + " batch mode" : "")));

        RecipeListener listener = verbose ? new VerboseRecipeListener(System.out, color) : RecipeListener.NOOP;
        PipelineOrchestrator orchestrator = environment.createOrchestrator(RunLog.create(), listener);

        Instant started = clock.instant();
        RunStatistics stats;
        try {
            stats = orchestrator.run(parameters);
        } catch (UserAbortException e) {
            printError("Run aborted:", e.getMessage());
            return 1;
        } catch (PipelineAbortException e) {
            printError("Run failed:", e.getMessage());
            return 1;
        }

        printStatistics(stats, styles);
        if (summaryJson != null) {
            writeSummary(RunSummary.of(stats, parameters.utdate(), batch, started, clock.instant()));
        }
        return stats.exitCode();
    }

    RunParameters parameters() throws IOException {
        List<Integer> observations = list == null ? null : ObservationList.parse(list);
        LoopRequest request = new LoopRequest(
                loop == null ? null : LoopType.fromName(loop), from, to, observations, files, skip);
        return RunParameters.builder()
                .utdate(utdate != null ? utdate : LocalDate.now(clock.withZone(ZoneOffset.UTC))
                        .format(DateTimeFormatter.BASIC_ISO_DATE))
                .loop(request)
                .batch(batch)
                .recipeOverride(recipe)
                .recipeParameters(recipeParameters())
                .calibrationOverrides(CalibrationOverrides.parse(calib))
                .build();
    }

    private RecipeParameters recipeParameters() throws IOException {
        if (recpars == null) {
            return RecipeParameters.empty();
        }
        CalderaConfig config = environment.getConfig();
        Path file = RecipeParameters.locate(recpars, List.of(Path.of("."), config.getOutputDir()))
                .orElseThrow(() -> new IllegalArgumentException("Recipe parameter file not found: " + recpars));
        logger.info("Reading recipe parameters from " + file);
        return RecipeParameters.load(file);
    }

    private void printStatistics(RunStatistics stats, AnsiStyles styles) {
        String summary = stats.summary();
        if (summary.isEmpty()) {
            System.out.printf("%n%s %s%n", styles.crossmark(), styles.bold("No observations were processed"));
            return;
        }
        boolean success = stats.exitCode() == 0;
        System.out.printf(
                "%n%s %s%n", success ? styles.checkmark() : styles.crossmark(), styles.bold(summary));
        String counts = Arrays.stream(RecipeStatus.values())
                .filter(status -> stats.count(status) > 0)
                .map(status -> status.name() + ": " + stats.count(status))
                .collect(Collectors.joining(" " + styles.bullet() + " "));
        System.out.printf("  %s%n", styles.successOrError(counts, success));
    }

    private void writeSummary(RunSummary summary) {
        try {
            RecipeJson.writeSummary(summary, summaryJson);
            System.out.println(styles().gray("  Summary written to " + summaryJson));
        } catch (IOException e) {
            printError("Could not write run summary:", e.getMessage());
        }
    }
}
