package io.caldera.core.loop;

import java.util.Locale;

/// Data-arrival strategies selectable on the command line.
public enum LoopType {
    LIST,
    INF,
    WAIT,
    FLAG,
    FILE;

    /// @param name case-insensitive strategy name, e.g. `wait`
    /// @return the strategy
    /// @throws IllegalArgumentException if the name is unknown
    public static LoopType fromName(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Unknown loop type '" + name + "'. Expected one of list, inf, wait, flag, file", e);
        }
    }

    /// @return whether the strategy waits for data to arrive
    public boolean waitsForData() {
        return this == WAIT || this == FLAG;
    }
}
