package io.caldera.core.exception;

import java.io.Serial;

/// Operator-requested stop. Not reported as a crash.
public class UserAbortException extends PipelineAbortException {
    @Serial private static final long serialVersionUID = 1903385541297366012L;

    public UserAbortException(String message) {
        super(message);
    }

    @Override
    public int statusCode() {
        return -2;
    }
}
