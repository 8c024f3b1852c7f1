package io.caldera.core.exception;

import java.io.Serial;
import java.time.Duration;

public class LoopTimeoutException extends LoopException {
    @Serial private static final long serialVersionUID = -6200392150118764491L;

    private final Duration waited;

    public LoopTimeoutException(String message, Duration waited) {
        super(message);
        this.waited = waited;
    }

    public Duration getWaited() {
        return waited;
    }
}
