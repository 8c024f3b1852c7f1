package io.caldera.core;

import io.caldera.core.frame.GroupMode;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Configuration of a Caldera reduction environment.
///
/// ### Default Values
/// - `inputDir`, `outputDir`: the working directory
/// - `instrument`: `"generic"` with an empty file prefix
/// - `pollInterval`: 2 seconds, `loopTimeout`: 12 hours
/// - `flagLookahead`: 10 observations
/// - `maxPrimitiveDepth`: 10
/// - `groupMode`: {@link GroupMode#PERSISTENT}, `resume`: `false`
/// - `engineTimeout`: 10 minutes
///
/// ### Recipe tree
/// `recipeRoot` holds `recipes/` and `primitives/`, each with one
/// subdirectory per instrument or observing mode plus `general/`.
///
/// @implNote **Not thread-safe**. A mutable configuration object intended to
/// be filled in before it is passed to {@link CalderaFactory}. Do not modify
/// after environment creation.
///
/// @see CalderaFactory#createEnvironment(CalderaConfig)
/// @see Builder
public class CalderaConfig {

    /// Name of the bad-observation rules file in the output directory.
    public static final String BAD_OBSERVATION_FILE = "index.badobs";

    private Path inputDir = Path.of(".");
    private Path outputDir = Path.of(".");
    private List<Path> calibrationDirs = new ArrayList<>();
    private Path recipeRoot;
    private List<Path> recipeOverrides = new ArrayList<>();
    private List<Path> primitiveOverrides = new ArrayList<>();
    private String instrument = "generic";
    private String filePrefix = "";
    private Duration pollInterval = Duration.ofSeconds(2);
    private Duration loopTimeout = Duration.ofHours(12);
    private int flagLookahead = 10;
    private int maxPrimitiveDepth = 10;
    private GroupMode groupMode = GroupMode.PERSISTENT;
    private boolean resume;
    private Map<String, String> engineCommands = new LinkedHashMap<>();
    private Duration engineTimeout = Duration.ofMinutes(10);

    public CalderaConfig() {}

    public Path getInputDir() {
        return inputDir;
    }

    /// @param inputDir directory raw observations arrive in
    public void setInputDir(Path inputDir) {
        this.inputDir = inputDir;
    }

    public Path getOutputDir() {
        return outputDir;
    }

    /// @param outputDir directory products, indexes and links are written to
    public void setOutputDir(Path outputDir) {
        this.outputDir = outputDir;
    }

    public List<Path> getCalibrationDirs() {
        return calibrationDirs;
    }

    /// @param calibrationDirs static calibration directories, searched after the output directory
    public void setCalibrationDirs(List<Path> calibrationDirs) {
        this.calibrationDirs = new ArrayList<>(calibrationDirs);
    }

    public Path getRecipeRoot() {
        return recipeRoot;
    }

    public void setRecipeRoot(Path recipeRoot) {
        this.recipeRoot = recipeRoot;
    }

    public List<Path> getRecipeOverrides() {
        return recipeOverrides;
    }

    public void setRecipeOverrides(List<Path> recipeOverrides) {
        this.recipeOverrides = new ArrayList<>(recipeOverrides);
    }

    public List<Path> getPrimitiveOverrides() {
        return primitiveOverrides;
    }

    public void setPrimitiveOverrides(List<Path> primitiveOverrides) {
        this.primitiveOverrides = new ArrayList<>(primitiveOverrides);
    }

    public String getInstrument() {
        return instrument;
    }

    public void setInstrument(String instrument) {
        this.instrument = instrument;
    }

    public String getFilePrefix() {
        return filePrefix;
    }

    public void setFilePrefix(String filePrefix) {
        this.filePrefix = filePrefix;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    public Duration getLoopTimeout() {
        return loopTimeout;
    }

    public void setLoopTimeout(Duration loopTimeout) {
        this.loopTimeout = loopTimeout;
    }

    public int getFlagLookahead() {
        return flagLookahead;
    }

    public void setFlagLookahead(int flagLookahead) {
        this.flagLookahead = flagLookahead;
    }

    public int getMaxPrimitiveDepth() {
        return maxPrimitiveDepth;
    }

    /// ### Contracts
    /// - **Precondition**: `maxPrimitiveDepth` should be positive
    public void setMaxPrimitiveDepth(int maxPrimitiveDepth) {
        this.maxPrimitiveDepth = maxPrimitiveDepth;
    }

    public GroupMode getGroupMode() {
        return groupMode;
    }

    public void setGroupMode(GroupMode groupMode) {
        this.groupMode = groupMode;
    }

    public boolean isResume() {
        return resume;
    }

    /// @param resume keep existing group products instead of deleting them
    public void setResume(boolean resume) {
        this.resume = resume;
    }

    public Map<String, String> getEngineCommands() {
        return engineCommands;
    }

    /// @param engineCommands engine name to the shell command that runs one operation
    public void setEngineCommands(Map<String, String> engineCommands) {
        this.engineCommands = new LinkedHashMap<>(engineCommands);
    }

    public Duration getEngineTimeout() {
        return engineTimeout;
    }

    public void setEngineTimeout(Duration engineTimeout) {
        this.engineTimeout = engineTimeout;
    }

    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link CalderaConfig}.
    public static final class Builder {
        private final CalderaConfig config = new CalderaConfig();

        private Builder() {}

        public Builder inputDir(Path inputDir) {
            config.setInputDir(inputDir);
            return this;
        }

        public Builder outputDir(Path outputDir) {
            config.setOutputDir(outputDir);
            return this;
        }

        public Builder calibrationDirs(List<Path> calibrationDirs) {
            config.setCalibrationDirs(calibrationDirs);
            return this;
        }

        public Builder recipeRoot(Path recipeRoot) {
            config.setRecipeRoot(recipeRoot);
            return this;
        }

        public Builder recipeOverrides(List<Path> recipeOverrides) {
            config.setRecipeOverrides(recipeOverrides);
            return this;
        }

        public Builder primitiveOverrides(List<Path> primitiveOverrides) {
            config.setPrimitiveOverrides(primitiveOverrides);
            return this;
        }

        public Builder instrument(String instrument) {
            config.setInstrument(instrument);
            return this;
        }

        public Builder filePrefix(String filePrefix) {
            config.setFilePrefix(filePrefix);
            return this;
        }

        public Builder pollInterval(Duration pollInterval) {
            config.setPollInterval(pollInterval);
            return this;
        }

        public Builder loopTimeout(Duration loopTimeout) {
            config.setLoopTimeout(loopTimeout);
            return this;
        }

        public Builder flagLookahead(int flagLookahead) {
            config.setFlagLookahead(flagLookahead);
            return this;
        }

        public Builder maxPrimitiveDepth(int maxPrimitiveDepth) {
            config.setMaxPrimitiveDepth(maxPrimitiveDepth);
            return this;
        }

        public Builder groupMode(GroupMode groupMode) {
            config.setGroupMode(groupMode);
            return this;
        }

        public Builder resume(boolean resume) {
            config.setResume(resume);
            return this;
        }

        public Builder engineCommands(Map<String, String> engineCommands) {
            config.setEngineCommands(engineCommands);
            return this;
        }

        public Builder engineTimeout(Duration engineTimeout) {
            config.setEngineTimeout(engineTimeout);
            return this;
        }

        public CalderaConfig build() {
            return config;
        }
    }
}
