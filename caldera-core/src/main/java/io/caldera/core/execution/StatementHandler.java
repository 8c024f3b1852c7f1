package io.caldera.core.execution;

import io.caldera.core.exception.PipelineAbortException;

/// Runs one kind of recipe statement.
///
/// Handlers signal per-frame failure with
/// {@link io.caldera.core.exception.RecipeFaultException}, early termination with
/// {@link io.caldera.core.exception.TerminateRecipeException}, and run-wide
/// failure with a {@link PipelineAbortException}.
@FunctionalInterface
public interface StatementHandler {

    /// @param statement the parsed statement, not null
    /// @param state the running execution, not null
    /// @return the statement status, {@link io.caldera.core.engine.EngineResponse#OK} on success
    /// @throws PipelineAbortException to unwind the whole run
    int execute(Statement statement, ExecutionState state) throws PipelineAbortException;
}
