package io.caldera.core.exception;

import java.io.Serial;

/// Environment or setup failure: a missing recipe, a primitive cycle, a
/// directory that cannot be created.
public class FatalPipelineException extends PipelineAbortException {
    @Serial private static final long serialVersionUID = 6641029385516207714L;

    public FatalPipelineException(String message) {
        super(message);
    }

    public FatalPipelineException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public int statusCode() {
        return -3;
    }
}
