package io.caldera.core.pipeline;

import io.caldera.core.loop.LoopSelector.LoopRequest;
import io.caldera.core.recipe.RecipeParameters;
import java.util.Map;
import java.util.Objects;

/// Per-run arguments of the orchestrator.
///
/// @param utdate UT date of the night, `YYYYMMDD`
/// @param loop data-arrival arguments
/// @param batch drain the loop before running any recipe
/// @param recipeOverride recipe run for every frame instead of the header's, or null
/// @param recipeParameters recipe parameters, never null
/// @param calibrationOverrides roles pinned for the whole run, never null
public record RunParameters(
        String utdate,
        LoopRequest loop,
        boolean batch,
        String recipeOverride,
        RecipeParameters recipeParameters,
        Map<String, String> calibrationOverrides) {

    public RunParameters {
        Objects.requireNonNull(utdate, "utdate");
        if (!utdate.matches("\\d{8}")) {
            throw new IllegalArgumentException("UT date must be YYYYMMDD: " + utdate);
        }
        Objects.requireNonNull(loop, "loop");
        recipeParameters = recipeParameters == null ? RecipeParameters.empty() : recipeParameters;
        calibrationOverrides = calibrationOverrides == null ? Map.of() : Map.copyOf(calibrationOverrides);
        if (recipeOverride != null && recipeOverride.isBlank()) {
            recipeOverride = null;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link RunParameters}.
    public static final class Builder {
        private String utdate;
        private LoopRequest loop = new LoopRequest(null, null, null, null, null, false);
        private boolean batch;
        private String recipeOverride;
        private RecipeParameters recipeParameters = RecipeParameters.empty();
        private Map<String, String> calibrationOverrides = Map.of();

        private Builder() {}

        public Builder utdate(String utdate) {
            this.utdate = utdate;
            return this;
        }

        public Builder loop(LoopRequest loop) {
            this.loop = loop;
            return this;
        }

        public Builder batch(boolean batch) {
            this.batch = batch;
            return this;
        }

        public Builder recipeOverride(String recipeOverride) {
            this.recipeOverride = recipeOverride;
            return this;
        }

        public Builder recipeParameters(RecipeParameters recipeParameters) {
            this.recipeParameters = recipeParameters;
            return this;
        }

        public Builder calibrationOverrides(Map<String, String> calibrationOverrides) {
            this.calibrationOverrides = calibrationOverrides;
            return this;
        }

        public RunParameters build() {
            return new RunParameters(
                    utdate, loop, batch, recipeOverride, recipeParameters, calibrationOverrides);
        }
    }
}
