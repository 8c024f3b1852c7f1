package io.caldera.core.exception;

import java.io.Serial;

/// An error that unwinds the whole run instead of failing a single frame.
///
/// Checked so that every layer between the executor and the process entry
/// point has to declare or handle it; swallowing one is a compile-time
/// decision, never an accident.
///
/// @see FatalPipelineException
/// @see UserAbortException
public abstract class PipelineAbortException extends Exception {
    @Serial private static final long serialVersionUID = -2398107642285110925L;

    protected PipelineAbortException(String message) {
        super(message);
    }

    protected PipelineAbortException(String message, Throwable cause) {
        super(message, cause);
    }

    /// @return the status code reported for the abort
    public abstract int statusCode();
}
