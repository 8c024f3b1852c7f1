package io.caldera.core.execution;

/// Outcome classes of a recipe run.
///
/// `OK` and `TERMINATED` count as good; every other status makes the run exit
/// with failure. `FATAL` and `USER_ABORT` never reach run statistics because
/// they unwind the run.
public enum RecipeStatus {
    OK(0),
    /// Recoverable per-frame failure; the run continues with the next frame.
    ERROR(-1),
    /// An engine could not be contacted or crashed mid-call.
    BAD_ENGINE(2),
    /// The recipe ended early on purpose.
    TERMINATED(-5),
    FATAL(-3),
    USER_ABORT(-2);

    private final int code;

    RecipeStatus(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /// @return `true` for {@link #OK} and {@link #TERMINATED}
    public boolean isGood() {
        return this == OK || this == TERMINATED;
    }
}
