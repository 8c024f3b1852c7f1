package io.caldera.core.engine;

import io.caldera.core.exception.EngineException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/// The engines of a run, started on first use.
///
/// An engine that reports {@link EngineResponse#BAD_ENGINE} or fails to answer
/// is removed with {@link #remove(String)}; the next request for it starts a
/// fresh instance.
///
/// @implNote **Not thread-safe**. Engines are addressed one call at a time.
public class EngineSet implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(EngineSet.class.getName());

    private final List<EngineLauncher> launchers;
    private final Map<String, AlgorithmEngine> running = new LinkedHashMap<>();

    public EngineSet(List<EngineLauncher> launchers) {
        this.launchers = List.copyOf(launchers);
    }

    /// Returns a running engine, starting it if needed.
    ///
    /// @param name engine name, not null
    /// @return the engine, never null
    /// @throws EngineException if no launcher supports the name or start-up fails
    public AlgorithmEngine get(String name) throws EngineException {
        AlgorithmEngine engine = running.get(name);
        if (engine != null) {
            return engine;
        }
        EngineLauncher launcher = launcherFor(name)
                .orElseThrow(() -> new EngineException(
                        name,
                        "No launcher supports engine " + name + ". Available launchers: "
                                + launchers.stream().map(EngineLauncher::getName).toList()));
        logger.info("Starting engine " + name + " with launcher " + launcher.getName());
        engine = launcher.start(name);
        running.put(name, engine);
        return engine;
    }

    /// Starts engines ahead of processing.
    ///
    /// @param names engine names, not null
    /// @throws EngineException if any engine fails to start
    public void prestart(Collection<String> names) throws EngineException {
        for (String name : names) {
            get(name);
        }
    }

    /// Closes and forgets an engine so the next use relaunches it.
    ///
    /// @param name engine name, not null
    public void remove(String name) {
        AlgorithmEngine engine = running.remove(name);
        if (engine != null) {
            logger.warning("Removing engine " + name + "; it will be relaunched on next use");
            engine.close();
        }
    }

    public boolean isRunning(String name) {
        return running.containsKey(name);
    }

    public Set<String> runningEngines() {
        return Set.copyOf(running.keySet());
    }

    private Optional<EngineLauncher> launcherFor(String name) {
        return launchers.stream()
                .filter(l -> l.supports(name))
                .max(Comparator.comparingInt(EngineLauncher::getPriority));
    }

    /// Closes every running engine.
    @Override
    public void close() {
        for (String name : new ArrayList<>(running.keySet())) {
            AlgorithmEngine engine = running.remove(name);
            logger.fine("Closing engine " + name);
            engine.close();
        }
    }
}
