package io.caldera.core.exception;

import java.io.Serial;

/// An algorithm engine could not be started or contacted, or crashed mid-call.
public class EngineException extends Exception {
    @Serial private static final long serialVersionUID = 5512887903251129631L;

    private final String engine;

    public EngineException(String engine, String message) {
        super(message);
        this.engine = engine;
    }

    public EngineException(String engine, String message, Throwable cause) {
        super(message, cause);
        this.engine = engine;
    }

    public String getEngine() {
        return engine;
    }
}
