package io.caldera.core.execution;

import io.caldera.core.calibration.CalibrationSelector;
import io.caldera.core.engine.EngineSet;
import io.caldera.core.frame.Frame;
import io.caldera.core.frame.Group;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/// Everything a recipe execution can reach.
///
/// @param frame the frame being reduced
/// @param group the frame's group
/// @param calibration calibration selector bound to this run
/// @param engines running algorithm engines
/// @param display sink for display requests
/// @param parameters recipe parameters for this recipe and target
/// @param inputDir directory raw data is read from
/// @param outputDir directory products are written to
public record RecipeContext(
        Frame frame,
        Group group,
        CalibrationSelector calibration,
        EngineSet engines,
        DisplaySink display,
        Map<String, String> parameters,
        Path inputDir,
        Path outputDir) {

    public RecipeContext {
        Objects.requireNonNull(frame, "frame");
        Objects.requireNonNull(group, "group");
        Objects.requireNonNull(calibration, "calibration");
        Objects.requireNonNull(engines, "engines");
        display = display == null ? DisplaySink.NONE : display;
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link RecipeContext}.
    public static final class Builder {
        private Frame frame;
        private Group group;
        private CalibrationSelector calibration;
        private EngineSet engines;
        private DisplaySink display = DisplaySink.NONE;
        private Map<String, String> parameters = Map.of();
        private Path inputDir;
        private Path outputDir;

        private Builder() {}

        public Builder frame(Frame frame) {
            this.frame = frame;
            return this;
        }

        public Builder group(Group group) {
            this.group = group;
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

        public Builder parameters(Map<String, String> parameters) {
            this.parameters = parameters;
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

        public RecipeContext build() {
            return new RecipeContext(
                    frame, group, calibration, engines, display, parameters, inputDir, outputDir);
        }
    }
}
