package io.caldera.core.frame;

/// How long groups live during a run.
public enum GroupMode {
    /// Groups persist and grow for the whole run.
    PERSISTENT(0),
    /// All groups are dropped whenever a frame opens a new group.
    TRANSIENT(1),
    /// Every frame joins one group named `ALL`.
    SINGLE(-1);

    private final int code;

    GroupMode(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /// @param code numeric mode as given on the command line
    /// @return the matching mode
    /// @throws IllegalArgumentException for an unknown code
    public static GroupMode fromCode(int code) {
        for (GroupMode mode : values()) {
            if (mode.code == code) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown group mode: " + code);
    }
}
