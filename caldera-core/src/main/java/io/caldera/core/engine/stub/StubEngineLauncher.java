package io.caldera.core.engine.stub;

import io.caldera.core.engine.AlgorithmEngine;
import io.caldera.core.engine.EngineLauncher;
import io.caldera.core.exception.EngineException;
import java.util.logging.Logger;

/// Launches {@link StubEngine}s for any engine name when stub mode is on.
///
/// Stub mode is on when constructed with `true`, or when the system property
/// `caldera.stub.enabled` or the environment variable `CALDERA_STUB_ENABLED`
/// is `true`. An enabled stub launcher outranks every real launcher.
public class StubEngineLauncher implements EngineLauncher {

    private static final Logger logger = Logger.getLogger(StubEngineLauncher.class.getName());

    private static final String ENABLED_KEY = "CALDERA_STUB_ENABLED";
    private static final String ENABLED_PROPERTY = "caldera.stub.enabled";

    private final boolean forced;

    public StubEngineLauncher() {
        this(false);
    }

    /// @param enabled `true` to enable regardless of the global setting
    public StubEngineLauncher(boolean enabled) {
        this.forced = enabled;
    }

    @Override
    public String getName() {
        return "stub";
    }

    @Override
    public boolean supports(String engineName) {
        return isEnabled();
    }

    @Override
    public AlgorithmEngine start(String engineName) throws EngineException {
        if (!StubEngineResponses.getInstance().isStartable(engineName)) {
            throw new EngineException(engineName, "Stub engine " + engineName + " refused to start");
        }
        logger.info("[STUB] Starting stub engine: " + engineName);
        return new StubEngine(engineName);
    }

    @Override
    public int getPriority() {
        return isEnabled() ? 1000 : -1;
    }

    private boolean isEnabled() {
        if (forced) {
            return true;
        }
        if ("true".equalsIgnoreCase(System.getProperty(ENABLED_PROPERTY))) {
            return true;
        }
        return "true".equalsIgnoreCase(System.getenv(ENABLED_KEY));
    }
}
