package io.caldera.core.instrument;

/// Header keys an instrument uses for the values the pipeline derives on
/// frame configuration.
///
/// @param recipeKey header holding the recipe name requested at the telescope
/// @param defaultRecipe recipe used when the header carries none
/// @param timeKey numeric header used as the frame's time-ordering value
/// @param observationModeKey header naming the observing mode, used to pick
///        between mode-specific recipe variants
public record HeaderConventions(
        String recipeKey, String defaultRecipe, String timeKey, String observationModeKey) {

    /// Conventions used when an instrument declares nothing special.
    public static HeaderConventions defaults() {
        return new HeaderConventions("RECIPE", "QUICK_LOOK", "MJD-OBS", "OBSMODE");
    }
}
