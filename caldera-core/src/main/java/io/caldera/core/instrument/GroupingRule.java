package io.caldera.core.instrument;

import io.caldera.core.frame.Frame;

/// Derives the group key that decides which {@link io.caldera.core.frame.Group}
/// a frame joins.
@FunctionalInterface
public interface GroupingRule {

    /// @param frame a configured frame, not null
    /// @return the group key, never null or blank
    String groupKey(Frame frame);
}
