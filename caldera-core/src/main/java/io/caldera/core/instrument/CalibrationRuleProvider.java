package io.caldera.core.instrument;

import io.caldera.core.calibration.IndexMode;
import io.caldera.core.frame.DerivedHeaders;
import java.util.Set;

/// Tells the calibration layer which roles an instrument has and where each
/// role's rules and index live.
public interface CalibrationRuleProvider {

    /// Returns the calibration roles known to the instrument (dark, flat, ...).
    ///
    /// @return the role names, never null
    Set<String> roles();

    /// @param role the calibration role, not null
    /// @return the bare rules filename searched for on the calibration path
    default String rulesFileName(String role) {
        return "rules." + role;
    }

    /// @param role the calibration role, not null
    /// @return the bare index filename
    default String indexFileName(String role) {
        return "index." + role;
    }

    /// @param role the calibration role, not null
    /// @return where the role's index is stored and whether it may be written
    IndexMode indexMode(String role);

    /// Returns the header key used as the time-ordering field of every index.
    ///
    /// @return the time key, never null
    default String timeKey() {
        return DerivedHeaders.TIME;
    }
}
