package io.caldera.core.pipeline;

import io.caldera.core.calibration.CalibrationSelector;
import io.caldera.core.engine.EngineSet;
import io.caldera.core.exception.FatalPipelineException;
import io.caldera.core.exception.LoopException;
import io.caldera.core.exception.LoopTimeoutException;
import io.caldera.core.exception.PipelineAbortException;
import io.caldera.core.exception.RecipeCompileException;
import io.caldera.core.exception.RecipeNotFoundException;
import io.caldera.core.exception.UserAbortException;
import io.caldera.core.execution.DisplaySink;
import io.caldera.core.execution.ExecutionOutcome;
import io.caldera.core.execution.RecipeContext;
import io.caldera.core.execution.RecipeExecutor;
import io.caldera.core.execution.RecipeListener;
import io.caldera.core.execution.RecipeStatus;
import io.caldera.core.execution.RunLog;
import io.caldera.core.frame.DerivedHeaders;
import io.caldera.core.frame.Frame;
import io.caldera.core.frame.FrameFactory;
import io.caldera.core.frame.Group;
import io.caldera.core.frame.GroupRegistry;
import io.caldera.core.loop.DataLoop;
import io.caldera.core.loop.LoopCursor;
import io.caldera.core.loop.LoopSelector;
import io.caldera.core.recipe.CompiledRecipe;
import io.caldera.core.recipe.CompiledRecipeCache;
import io.caldera.core.recipe.RecipeParameters;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/// Drives a reduction run: acquires frames, groups them and runs their recipes.
///
/// ### Run modes
/// - **Streaming**: each frame is grouped and reduced as soon as the loop delivers it
/// - **Batch**: the loop is drained first, grouping every frame; groups are then
///   reduced in creation order, members in membership order, so recipes can
///   tell when they reach the last member of a group
///
/// ### Contracts
/// - **Postcondition**: returns statistics for every recipe that ran
/// - Compilation failures, unreadable data and environment errors throw
///   {@link FatalPipelineException}; operator interrupts throw {@link UserAbortException}
/// - A loop timeout ends acquisition; frames already delivered are still reduced
///
/// @implNote **Not thread-safe**. One orchestrator drives one run.
public class PipelineOrchestrator {

    /// Header key naming the observed target, used for target-specific recipe parameters.
    public static final String OBJECT_KEY = "OBJECT";

    private final FrameFactory frames;
    private final LoopSelector loops;
    private final GroupRegistry groups;
    private final CompiledRecipeCache recipes;
    private final RecipeExecutor executor;
    private final CalibrationSelector calibration;
    private final EngineSet engines;
    private final DisplaySink display;
    private final RunLog log;
    private final RecipeListener listener;
    private final Path inputDir;
    private final Path outputDir;
    private final Set<String> parameterWarnings = new HashSet<>();

    private PipelineOrchestrator(Builder builder) {
        this.frames = Objects.requireNonNull(builder.frames, "frames");
        this.loops = Objects.requireNonNull(builder.loops, "loops");
        this.groups = Objects.requireNonNull(builder.groups, "groups");
        this.recipes = Objects.requireNonNull(builder.recipes, "recipes");
        this.executor = Objects.requireNonNull(builder.executor, "executor");
        this.calibration = Objects.requireNonNull(builder.calibration, "calibration");
        this.engines = Objects.requireNonNull(builder.engines, "engines");
        this.display = builder.display == null ? DisplaySink.NONE : builder.display;
        this.log = Objects.requireNonNull(builder.log, "log");
        this.listener = builder.listener == null ? RecipeListener.NOOP : builder.listener;
        this.inputDir = builder.inputDir;
        this.outputDir = builder.outputDir;
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Runs the pipeline.
    ///
    /// @param parameters run arguments, not null
    /// @return outcome tally, never null
    /// @throws PipelineAbortException on a fatal error or operator abort
    public RunStatistics run(RunParameters parameters) throws PipelineAbortException {
        RunStatistics stats = new RunStatistics();
        calibration.applyOverrides(parameters.calibrationOverrides());

        LoopSelector.Selection selection;
        try {
            selection = loops.select(parameters.loop(), parameters.utdate());
        } catch (LoopException e) {
            throw new FatalPipelineException(e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new FatalPipelineException("Invalid loop arguments: " + e.getMessage(), e);
        }

        if (parameters.batch()) {
            runBatch(selection, parameters, stats);
        } else {
            runStreaming(selection, parameters, stats);
        }

        String summary = stats.summary();
        if (!summary.isEmpty()) {
            log.info(summary);
        }
        return stats;
    }

    private void runStreaming(LoopSelector.Selection selection, RunParameters parameters, RunStatistics stats)
            throws PipelineAbortException {
        Optional<Frame> next;
        while ((next = acquire(selection, parameters.utdate(), parameters.loop().skip(), stats)).isPresent()) {
            Frame frame = next.get();
            Group group = place(frame);
            process(frame, group, parameters, stats);
        }
    }

    private void runBatch(LoopSelector.Selection selection, RunParameters parameters, RunStatistics stats)
            throws PipelineAbortException {
        Set<Group> batch = new LinkedHashSet<>();
        Optional<Frame> next;
        while ((next = acquire(selection, parameters.utdate(), parameters.loop().skip(), stats)).isPresent()) {
            batch.add(place(next.get()));
        }
        log.info("Batch mode: processing " + batch.size() + " group(s)");
        for (Group group : batch) {
            for (Frame frame : new ArrayList<>(group.members())) {
                process(frame, group, parameters, stats);
            }
        }
    }

    private Optional<Frame> acquire(
            LoopSelector.Selection selection, String utdate, boolean skip, RunStatistics stats)
            throws PipelineAbortException {
        DataLoop loop = selection.loop();
        LoopCursor cursor = selection.cursor();
        try {
            return loop.next(frames, utdate, cursor, skip);
        } catch (LoopTimeoutException e) {
            log.error(e.getMessage());
            stats.markLoopTimedOut();
            cursor.end();
            return Optional.empty();
        } catch (LoopException e) {
            if (e.getCause() instanceof InterruptedException) {
                throw new UserAbortException("Interrupted while waiting for data");
            }
            throw new FatalPipelineException("Data loop " + loop.name() + " failed: " + e.getMessage(), e);
        }
    }

    private Group place(Frame frame) throws FatalPipelineException {
        try {
            return groups.place(frame);
        } catch (IOException e) {
            throw new FatalPipelineException("Unable to prepare group of " + frame.raw() + ": " + e.getMessage(), e);
        }
    }

    /// Compiles and executes the recipe of one frame.
    private void process(Frame frame, Group group, RunParameters parameters, RunStatistics stats)
            throws PipelineAbortException {
        if (Thread.currentThread().isInterrupted()) {
            throw new UserAbortException("Interrupted before processing " + frame.raw());
        }
        log.setObservation(frame.number());
        try {
            listener.onFrameStart(frame, group);
            if (parameters.recipeOverride() != null) {
                frame.setRecipe(parameters.recipeOverride());
            }
            CompiledRecipe recipe = compile(frame);
            RecipeContext context = RecipeContext.builder()
                    .frame(frame)
                    .group(group)
                    .calibration(calibration)
                    .engines(engines)
                    .display(display)
                    .parameters(recipeParameters(recipe, frame, parameters.recipeParameters()))
                    .inputDir(inputDir)
                    .outputDir(outputDir)
                    .build();

            ExecutionOutcome outcome = executor.execute(recipe, context);
            RecipeStatus status = outcome.statusOrThrow();
            stats.record(status);
            group.checkMembership();
            removeNokeep(frame);
        } finally {
            log.setObservation(-1);
        }
    }

    private CompiledRecipe compile(Frame frame) throws FatalPipelineException {
        Object mode = frame.headerValue(DerivedHeaders.OBSERVATION_MODE);
        try {
            return recipes.get(frame.recipe(), mode == null ? "" : mode.toString());
        } catch (RecipeNotFoundException e) {
            throw new FatalPipelineException(e.getMessage(), e);
        } catch (RecipeCompileException e) {
            throw new FatalPipelineException("Unable to compile recipe " + frame.recipe() + ": " + e.getMessage(), e);
        }
    }

    private Map<String, String> recipeParameters(CompiledRecipe recipe, Frame frame, RecipeParameters all) {
        if (all.isEmpty()) {
            return Map.of();
        }
        if (!recipe.parameters().isEmpty() && parameterWarnings.add(recipe.name())) {
            Set<String> unsupported = all.unsupported(recipe.name(), recipe.parameters());
            if (!unsupported.isEmpty()) {
                log.warn("Recipe " + recipe.name() + " does not support parameter(s) " + unsupported);
            }
        }
        Object object = frame.headerValue(OBJECT_KEY);
        return all.forRecipe(recipe.name(), object == null ? null : object.toString());
    }

    private void removeNokeep(Frame frame) {
        if (outputDir == null) {
            return;
        }
        List<String> current = frame.files();
        for (String name : frame.nokeepFiles()) {
            if (current.contains(name)) {
                continue;
            }
            Path file = outputDir.resolve(name);
            try {
                if (Files.deleteIfExists(file)) {
                    log.fine("Removed temporary file " + name);
                }
            } catch (IOException e) {
                log.warn("Could not remove temporary file " + file + ": " + e.getMessage());
            }
        }
    }

    /// Fluent builder for {@link PipelineOrchestrator}.
    public static final class Builder {
        private FrameFactory frames;
        private LoopSelector loops;
        private GroupRegistry groups;
        private CompiledRecipeCache recipes;
        private RecipeExecutor executor;
        private CalibrationSelector calibration;
        private EngineSet engines;
        private DisplaySink display;
        private RunLog log;
        private RecipeListener listener;
        private Path inputDir;
        private Path outputDir;

        private Builder() {}

        public Builder frames(FrameFactory frames) {
            this.frames = frames;
            return this;
        }

        public Builder loops(LoopSelector loops) {
            this.loops = loops;
            return this;
        }

        public Builder groups(GroupRegistry groups) {
            this.groups = groups;
            return this;
        }

        public Builder recipes(CompiledRecipeCache recipes) {
            this.recipes = recipes;
            return this;
        }

        public Builder executor(RecipeExecutor executor) {
            this.executor = executor;
            return this;
        }

        public Builder calibration(CalibrationSelector calibration) {
            this.calibration = calibration;
            return this;
        }

        public Builder engines(EngineSet engines) {
            this.engines = engines;
            return this;
        }

        public Builder display(DisplaySink display) {
            this.display = display;
            return this;
        }

        public Builder log(RunLog log) {
            this.log = log;
            return this;
        }

        public Builder listener(RecipeListener listener) {
            this.listener = listener;
            return this;
        }

        public Builder inputDir(Path inputDir) {
            this.inputDir = inputDir;
            return this;
        }

        public Builder outputDir(Path outputDir) {
            this.outputDir = outputDir;
            return this;
        }

        public PipelineOrchestrator build() {
            return new PipelineOrchestrator(this);
        }
    }
}
