package io.caldera.serialization;

import io.caldera.core.execution.RecipeStatus;
import io.caldera.core.pipeline.RunStatistics;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/// Machine-readable outcome of one pipeline run.
///
/// @param utdate UT date reduced
/// @param batch whether the run drained the loop before reducing
/// @param startedAt wall-clock start of the run
/// @param duration wall-clock length of the run
/// @param ok recipes that completed
/// @param terminated recipes ended early by the recipe itself
/// @param badEngine recipes failed by an unusable engine
/// @param error recipes that failed
/// @param loopTimedOut whether waiting for data timed out
/// @param exitCode process exit status
/// @param message the one-line summary printed at the end of the run
public record RunSummary(
        String utdate,
        boolean batch,
        Instant startedAt,
        Duration duration,
        int ok,
        int terminated,
        int badEngine,
        int error,
        boolean loopTimedOut,
        int exitCode,
        String message) {

    public RunSummary {
        Objects.requireNonNull(utdate, "utdate");
        message = message == null ? "" : message;
    }

    /// @param stats statistics of the finished run, not null
    /// @param utdate UT date reduced, not null
    /// @param batch whether the run was a batch run
    /// @param startedAt run start, not null
    /// @param finishedAt run end, not null
    /// @return the summary, never null
    public static RunSummary of(
            RunStatistics stats, String utdate, boolean batch, Instant startedAt, Instant finishedAt) {
        return new RunSummary(
                utdate,
                batch,
                startedAt,
                Duration.between(startedAt, finishedAt),
                stats.count(RecipeStatus.OK),
                stats.count(RecipeStatus.TERMINATED),
                stats.count(RecipeStatus.BAD_ENGINE),
                stats.count(RecipeStatus.ERROR),
                stats.isLoopTimedOut(),
                stats.exitCode(),
                stats.summary());
    }

    public int total() {
        return ok + terminated + badEngine + error;
    }
}
