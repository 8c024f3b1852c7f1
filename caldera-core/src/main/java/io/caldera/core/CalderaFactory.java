package io.caldera.core;

import io.caldera.core.calibration.CalibrationIndexes;
import io.caldera.core.calibration.CalibrationSearchPath;
import io.caldera.core.calibration.CalibrationSelector;
import io.caldera.core.engine.EngineLauncher;
import io.caldera.core.engine.EngineSet;
import io.caldera.core.engine.ProcessEngineLauncher;
import io.caldera.core.engine.stub.StubEngineLauncher;
import io.caldera.core.execution.DefaultStatementRegistry;
import io.caldera.core.execution.DisplaySink;
import io.caldera.core.execution.StatementRegistry;
import io.caldera.core.frame.BadObservationRules;
import io.caldera.core.frame.FitsHeaderReader;
import io.caldera.core.frame.HeaderReader;
import io.caldera.core.instrument.GenericInstrument;
import io.caldera.core.instrument.Instrument;
import io.caldera.core.recipe.RecipeLocator;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/// Factory for creating and wiring Caldera reduction environments.
///
/// ### Usage Patterns
///
/// **Defaults from configuration**:
/// {@snippet :
/// var env = CalderaFactory.createEnvironment(CalderaConfig.builder()
///     .inputDir(raw)
///     .outputDir(reduced)
///     .recipeRoot(recipes)
///     .build());
/// }
///
/// **Builder with explicit collaborators** (tests, custom instruments):
/// {@snippet :
/// var env = CalderaFactory.builder()
///     .config(config)
///     .instrument(myInstrument)
///     .engineLaunchers(List.of(new StubEngineLauncher(true)))
///     .build();
/// }
///
/// @apiNote **Side effects**: creates the output directory if missing and reads
/// the bad-observation rules from it.
///
/// @see CalderaEnvironment
/// @see CalderaConfig
public final class CalderaFactory {

    private static final Logger logger = Logger.getLogger(CalderaFactory.class.getName());

    private CalderaFactory() {}

    /// Creates an environment with the generic instrument, FITS headers and the
    /// process and stub engine launchers.
    ///
    /// @param config configuration, not null
    /// @return a fully-configured environment, never null
    /// @throws UncheckedIOException if the output directory or bad-observation file cannot be used
    public static CalderaEnvironment createEnvironment(CalderaConfig config) {
        return builder().config(config).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    static RecipeLocator createLocator(CalderaConfig config, String instrument) {
        List<Path> primitiveOverrides = new ArrayList<>(config.getPrimitiveOverrides());
        primitiveOverrides.addAll(RecipeLocator.splitPath(System.getenv(RecipeLocator.PRIMITIVE_DIR_ENV)));
        Path root = config.getRecipeRoot();
        return new RecipeLocator(
                config.getRecipeOverrides(),
                primitiveOverrides,
                root == null ? List.of() : subdirectories(root.resolve("recipes"), instrument),
                root == null ? List.of() : subdirectories(root.resolve("primitives"), instrument),
                instrument);
    }

    /// Lists the variant directories under a tree, the instrument's own first.
    private static List<Path> subdirectories(Path tree, String instrument) {
        List<Path> dirs = new ArrayList<>();
        if (!Files.isDirectory(tree)) {
            logger.warning("Recipe directory " + tree + " does not exist");
            return dirs;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(tree, Files::isDirectory)) {
            for (Path dir : stream) {
                dirs.add(dir);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to list " + tree, e);
        }
        dirs.sort((a, b) -> {
            boolean aOwn = a.getFileName().toString().equalsIgnoreCase(instrument);
            boolean bOwn = b.getFileName().toString().equalsIgnoreCase(instrument);
            if (aOwn != bOwn) {
                return aOwn ? -1 : 1;
            }
            return a.getFileName().toString().compareTo(b.getFileName().toString());
        });
        return dirs;
    }

    /// Fluent builder for {@link CalderaEnvironment}.
    public static final class Builder {
        private CalderaConfig config = new CalderaConfig();
        private Instrument instrument;
        private HeaderReader headerReader;
        private List<EngineLauncher> engineLaunchers;
        private StatementRegistry statements;
        private DisplaySink display = DisplaySink.NONE;

        private Builder() {}

        public Builder config(CalderaConfig config) {
            this.config = config;
            return this;
        }

        /// @param instrument instrument capabilities; defaults to a generic instrument
        ///        built from the configured name and file prefix
        public Builder instrument(Instrument instrument) {
            this.instrument = instrument;
            return this;
        }

        /// @param headerReader header reader; defaults to {@link FitsHeaderReader}
        public Builder headerReader(HeaderReader headerReader) {
            this.headerReader = headerReader;
            return this;
        }

        /// @param engineLaunchers launchers; defaults to process and stub launchers
        public Builder engineLaunchers(List<EngineLauncher> engineLaunchers) {
            this.engineLaunchers = List.copyOf(engineLaunchers);
            return this;
        }

        /// @param statements statement handlers; defaults to the built-in statements
        public Builder statements(StatementRegistry statements) {
            this.statements = statements;
            return this;
        }

        public Builder display(DisplaySink display) {
            this.display = display;
            return this;
        }

        /// Builds the environment.
        ///
        /// @return the environment, never null
        /// @throws UncheckedIOException if the output directory or bad-observation file cannot be used
        public CalderaEnvironment build() {
            Instrument inst = instrument != null
                    ? instrument
                    : GenericInstrument.create(config.getInstrument(), config.getFilePrefix());

            Path outputDir = config.getOutputDir();
            try {
                Files.createDirectories(outputDir);
            } catch (IOException e) {
                throw new UncheckedIOException("Unable to create output directory " + outputDir, e);
            }

            BadObservationRules badObservations;
            Path badObsFile = outputDir.resolve(CalderaConfig.BAD_OBSERVATION_FILE);
            try {
                badObservations = Files.exists(badObsFile)
                        ? BadObservationRules.load(badObsFile)
                        : new BadObservationRules();
            } catch (IOException e) {
                throw new UncheckedIOException("Unable to read " + badObsFile, e);
            }

            List<EngineLauncher> launchers = engineLaunchers != null
                    ? engineLaunchers
                    : List.of(
                            new ProcessEngineLauncher(
                                    config.getEngineCommands(), outputDir, config.getEngineTimeout()),
                            new StubEngineLauncher());

            CalibrationSearchPath searchPath =
                    new CalibrationSearchPath(outputDir, config.getCalibrationDirs());
            CalibrationSelector calibration = new CalibrationSelector(
                    new CalibrationIndexes(inst.calibrationRules(), searchPath));

            logger.info("Caldera environment for " + inst.name() + ": input " + config.getInputDir()
                    + ", output " + outputDir);

            return new CalderaEnvironment(
                    config,
                    inst,
                    headerReader != null ? headerReader : new FitsHeaderReader(),
                    createLocator(config, inst.name()),
                    statements != null ? statements : new DefaultStatementRegistry(),
                    calibration,
                    new EngineSet(launchers),
                    badObservations,
                    display);
        }
    }
}
