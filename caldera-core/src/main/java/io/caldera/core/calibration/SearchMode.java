package io.caldera.core.calibration;

/// How the selector picks among compatible index entries.
public enum SearchMode {
    /// Smallest absolute time difference to the query.
    NEAREST,
    /// Closest entry taken at or before the query time.
    EARLIER
}
