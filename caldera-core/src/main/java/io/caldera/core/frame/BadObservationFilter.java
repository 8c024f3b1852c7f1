package io.caldera.core.frame;

/// Predicate excluding specific frames from a group's valid members.
///
/// Implementations that can change after construction bump {@link #revision()}
/// on every change so groups know to recompute their members.
@FunctionalInterface
public interface BadObservationFilter {

    /// Filter that excludes nothing.
    BadObservationFilter NONE = frame -> false;

    /// @param frame the frame to test, not null
    /// @return `true` if the frame must be excluded from group members
    boolean matches(Frame frame);

    /// Returns a counter that changes whenever the rule set changes.
    ///
    /// @return the current revision
    default long revision() {
        return 0;
    }
}
