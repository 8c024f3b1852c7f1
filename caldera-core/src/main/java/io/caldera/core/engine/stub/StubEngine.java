package io.caldera.core.engine.stub;

import io.caldera.core.engine.AlgorithmEngine;
import io.caldera.core.engine.EngineResponse;
import io.caldera.core.exception.EngineException;
import java.util.logging.Logger;

/// Engine that answers from {@link StubEngineResponses} instead of computing.
public class StubEngine implements AlgorithmEngine {

    private static final Logger logger = Logger.getLogger(StubEngine.class.getName());

    private final String name;
    private final StubEngineResponses responses;
    private boolean closed;

    public StubEngine(String name) {
        this.name = name;
        this.responses = StubEngineResponses.getInstance();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public EngineResponse invoke(String operation, String arguments) throws EngineException {
        if (closed) {
            throw new EngineException(name, "Stub engine " + name + " has been closed");
        }
        logger.info("[STUB] " + name + " " + operation + " " + arguments);
        return responses.respond(name, operation, arguments);
    }

    @Override
    public void close() {
        closed = true;
    }
}
