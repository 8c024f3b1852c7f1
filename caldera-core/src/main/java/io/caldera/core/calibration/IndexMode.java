package io.caldera.core.calibration;

/// Where a calibration role's index is kept.
public enum IndexMode {
    /// Index lives in the output directory and grows as the run files calibrations.
    DYNAMIC,
    /// Index is read from the calibration directories and never written.
    STATIC,
    /// A static index is copied into the output directory on first use, then grows there.
    COPY
}
