package io.caldera.core.exception;

import java.io.Serial;

/// The data-arrival loop failed for a reason other than running out of work.
public class LoopException extends Exception {
    @Serial private static final long serialVersionUID = 2286430417309152206L;

    public LoopException(String message) {
        super(message);
    }

    public LoopException(String message, Throwable cause) {
        super(message, cause);
    }
}
