package io.caldera.core.engine;

import io.caldera.core.exception.EngineException;

/// A started external engine performing numerical operations on request.
///
/// Calls are synchronous: {@link #invoke} blocks until the engine replies or its
/// transport times out. The core never issues two calls to one engine at once.
public interface AlgorithmEngine extends AutoCloseable {

    /// @return the engine name recipes address it by
    String name();

    /// Sends one request.
    ///
    /// @param operation operation name, not null
    /// @param arguments argument string, not null (may be empty)
    /// @return the engine's reply, never null
    /// @throws EngineException if the engine cannot be contacted or dies mid-call
    EngineResponse invoke(String operation, String arguments) throws EngineException;

    /// Stops the engine. Further invocations fail.
    @Override
    default void close() {}
}
