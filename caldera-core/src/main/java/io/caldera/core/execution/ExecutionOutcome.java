package io.caldera.core.execution;

import io.caldera.core.exception.PipelineAbortException;

/// Result of executing one compiled recipe against one frame.
///
/// ### Permitted Subtypes
/// - {@link Completed} - the recipe ran to the end or stopped on an error status
/// - {@link Terminated} - the recipe ended early on purpose
/// - {@link Aborted} - a fatal error or user abort that must unwind the run
///
/// Reading the status through {@link #statusOrThrow()} forces callers to deal
/// with the aborted case as a checked exception.
public sealed interface ExecutionOutcome {

    /// Returns the recipe status, rethrowing the cause of an abort.
    ///
    /// @return the status, never {@link RecipeStatus#FATAL} or {@link RecipeStatus#USER_ABORT}
    /// @throws PipelineAbortException if the recipe aborted the run
    RecipeStatus statusOrThrow() throws PipelineAbortException;

    /// @param status final status, `OK`, `ERROR` or `BAD_ENGINE`
    record Completed(RecipeStatus status) implements ExecutionOutcome {
        @Override
        public RecipeStatus statusOrThrow() {
            return status;
        }
    }

    /// @param reason message given when terminating, may be empty
    record Terminated(String reason) implements ExecutionOutcome {
        @Override
        public RecipeStatus statusOrThrow() {
            return RecipeStatus.TERMINATED;
        }
    }

    /// @param cause the fatal error or user abort, not null
    record Aborted(PipelineAbortException cause) implements ExecutionOutcome {
        @Override
        public RecipeStatus statusOrThrow() throws PipelineAbortException {
            throw cause;
        }
    }
}
