package io.caldera.core;

import io.caldera.core.calibration.CalibrationSelector;
import io.caldera.core.engine.EngineSet;
import io.caldera.core.execution.DisplaySink;
import io.caldera.core.execution.RecipeExecutor;
import io.caldera.core.execution.RecipeListener;
import io.caldera.core.execution.RunLog;
import io.caldera.core.execution.StatementRegistry;
import io.caldera.core.frame.BadObservationRules;
import io.caldera.core.frame.FrameFactory;
import io.caldera.core.frame.GroupRegistry;
import io.caldera.core.frame.HeaderReader;
import io.caldera.core.instrument.Instrument;
import io.caldera.core.loop.DataDirectory;
import io.caldera.core.loop.LoopSelector;
import io.caldera.core.pipeline.PipelineOrchestrator;
import io.caldera.core.recipe.CompiledRecipeCache;
import io.caldera.core.recipe.RecipeCompiler;
import io.caldera.core.recipe.RecipeLocator;

/// Container holding the long-lived components of a reduction environment.
///
/// Per-run components (compiler, executor, group registry, loops) are built
/// fresh by {@link #createOrchestrator(RunLog, RecipeListener)} so each run
/// gets its own {@link RunLog}. Engines and calibration bindings live as long
/// as the environment.
///
/// @implNote **Not thread-safe**. One run at a time.
///
/// @apiNote Create instances via {@link CalderaFactory} rather than direct construction.
public final class CalderaEnvironment implements AutoCloseable {

    private final CalderaConfig config;
    private final Instrument instrument;
    private final HeaderReader headerReader;
    private final RecipeLocator recipeLocator;
    private final StatementRegistry statements;
    private final CalibrationSelector calibration;
    private final EngineSet engines;
    private final BadObservationRules badObservations;
    private final DisplaySink display;

    CalderaEnvironment(
            CalderaConfig config,
            Instrument instrument,
            HeaderReader headerReader,
            RecipeLocator recipeLocator,
            StatementRegistry statements,
            CalibrationSelector calibration,
            EngineSet engines,
            BadObservationRules badObservations,
            DisplaySink display) {
        this.config = config;
        this.instrument = instrument;
        this.headerReader = headerReader;
        this.recipeLocator = recipeLocator;
        this.statements = statements;
        this.calibration = calibration;
        this.engines = engines;
        this.badObservations = badObservations;
        this.display = display;
    }

    /// Creates a recipe compiler logging to the given run log.
    ///
    /// @param log run log, not null
    /// @return a new compiler, never null
    public RecipeCompiler createCompiler(RunLog log) {
        return new RecipeCompiler(recipeLocator, log, config.getMaxPrimitiveDepth());
    }

    /// Creates an orchestrator for one run.
    ///
    /// @param log run log shared by the compiler, executor and orchestrator, not null
    /// @param listener execution observer, may be null
    /// @return a new orchestrator, never null
    public PipelineOrchestrator createOrchestrator(RunLog log, RecipeListener listener) {
        DataDirectory data =
                new DataDirectory(config.getInputDir(), config.getOutputDir(), instrument.naming());
        return PipelineOrchestrator.builder()
                .frames(new FrameFactory(instrument, headerReader))
                .loops(new LoopSelector(
                        data, config.getPollInterval(), config.getLoopTimeout(), config.getFlagLookahead()))
                .groups(new GroupRegistry(
                        instrument.naming(),
                        config.getOutputDir(),
                        badObservations,
                        config.getGroupMode(),
                        config.isResume()))
                .recipes(new CompiledRecipeCache(createCompiler(log)))
                .executor(new RecipeExecutor(statements, log, listener))
                .calibration(calibration)
                .engines(engines)
                .display(display)
                .log(log)
                .listener(listener)
                .inputDir(config.getInputDir())
                .outputDir(config.getOutputDir())
                .build();
    }

    public CalderaConfig getConfig() {
        return config;
    }

    public Instrument getInstrument() {
        return instrument;
    }

    public HeaderReader getHeaderReader() {
        return headerReader;
    }

    public RecipeLocator getRecipeLocator() {
        return recipeLocator;
    }

    public StatementRegistry getStatements() {
        return statements;
    }

    public CalibrationSelector getCalibration() {
        return calibration;
    }

    public EngineSet getEngines() {
        return engines;
    }

    public BadObservationRules getBadObservations() {
        return badObservations;
    }

    /// Shuts down every running engine.
    @Override
    public void close() {
        engines.close();
    }
}
