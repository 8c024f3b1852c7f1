package io.caldera.core.engine;

import io.caldera.core.exception.EngineException;

/// Service provider that starts engines of the kinds it supports.
///
/// When several launchers support an engine name, the one with the highest
/// {@link #getPriority()} starts it.
public interface EngineLauncher {

    /// @return launcher name for diagnostics
    String getName();

    /// @param engineName engine name used in recipes, not null
    /// @return `true` if this launcher can start the engine
    boolean supports(String engineName);

    /// Starts an engine.
    ///
    /// @param engineName engine name used in recipes, not null
    /// @return the running engine, never null
    /// @throws EngineException if the engine cannot be started
    AlgorithmEngine start(String engineName) throws EngineException;

    default int getPriority() {
        return 0;
    }
}
