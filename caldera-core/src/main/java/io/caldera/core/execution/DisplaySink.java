package io.caldera.core.execution;

import io.caldera.core.frame.Frame;
import io.caldera.core.frame.Group;

/// Receives products recipes ask to show. Rendering is up to the implementation.
@FunctionalInterface
public interface DisplaySink {

    /// Sink that ignores every request.
    DisplaySink NONE = (file, frame, group) -> {};

    /// @param file the product to show, not null
    /// @param frame the current frame, not null
    /// @param group the current group, not null
    void show(String file, Frame frame, Group group);
}
