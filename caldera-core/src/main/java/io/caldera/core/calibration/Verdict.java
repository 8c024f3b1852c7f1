package io.caldera.core.calibration;

/// Result of checking a named index entry against a header context.
public enum Verdict {
    SUITABLE,
    UNSUITABLE,
    /// The name is not in the index.
    UNKNOWN
}
