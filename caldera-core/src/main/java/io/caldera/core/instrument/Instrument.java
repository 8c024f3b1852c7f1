package io.caldera.core.instrument;

import java.util.Objects;

/// The capabilities an instrument plugs into the pipeline.
///
/// Instruments differ in a handful of conventions only, so they are composed
/// from small capability objects instead of subclassed.
///
/// ### Contracts
/// - **Invariant**: every component is non-null
///
/// @param name instrument identifier, also the name of its recipe subdirectory
/// @param naming raw and flag filename conventions
/// @param grouping frame to group key mapping
/// @param calibrationRules calibration roles and index locations
/// @param headers header keys for derived values
public record Instrument(
        String name,
        RawNamingScheme naming,
        GroupingRule grouping,
        CalibrationRuleProvider calibrationRules,
        HeaderConventions headers) {

    public Instrument {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(naming, "naming");
        Objects.requireNonNull(grouping, "grouping");
        Objects.requireNonNull(calibrationRules, "calibrationRules");
        Objects.requireNonNull(headers, "headers");
    }
}
