package io.caldera.core.engine.stub;

import io.caldera.core.engine.EngineResponse;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/// Singleton registry of scripted replies for {@link StubEngine}.
///
/// ### Reply resolution order
/// 1. Next queued reply for `engine` + `operation`
/// 2. Next queued reply for `engine` + `*`
/// 3. Default reply registered for `engine`
/// 4. {@link EngineResponse#ok()}
///
/// Every invocation is recorded and can be inspected with {@link #invocations()}.
///
/// @implNote Thread-safe singleton. Tests call {@link #clear()} between cases.
public class StubEngineResponses {

    private static final Logger logger = Logger.getLogger(StubEngineResponses.class.getName());
    private static final String ANY = "*";

    private static final StubEngineResponses INSTANCE = new StubEngineResponses();

    private final Map<String, Deque<EngineResponse>> queued = new ConcurrentHashMap<>();
    private final Map<String, EngineResponse> defaults = new ConcurrentHashMap<>();
    private final Set<String> unstartable = ConcurrentHashMap.newKeySet();
    private final List<Invocation> invocations = Collections.synchronizedList(new ArrayList<>());

    private StubEngineResponses() {
        // Private constructor for singleton
    }

    public static StubEngineResponses getInstance() {
        return INSTANCE;
    }

    /// Queues replies for one operation; each call consumes one.
    ///
    /// @param engine engine name, not null
    /// @param operation operation name, or `*` for any, not null
    /// @param responses replies in the order they are returned, not null
    public void script(String engine, String operation, EngineResponse... responses) {
        Deque<EngineResponse> queue =
                queued.computeIfAbsent(key(engine, operation), k -> new ArrayDeque<>());
        synchronized (queue) {
            Collections.addAll(queue, responses);
        }
        logger.fine("Scripted " + responses.length + " replies for " + engine + "." + operation);
    }

    /// Sets the reply used once an engine's queues are empty.
    public void setDefault(String engine, EngineResponse response) {
        defaults.put(engine, response);
    }

    /// Makes the launcher refuse to start the engine.
    public void failOnStart(String engine) {
        unstartable.add(engine);
    }

    public boolean isStartable(String engine) {
        return !unstartable.contains(engine);
    }

    /// Records a call and resolves its reply.
    ///
    /// @return the reply, never null
    EngineResponse respond(String engine, String operation, String arguments) {
        invocations.add(new Invocation(engine, operation, arguments));
        EngineResponse reply = poll(key(engine, operation));
        if (reply == null) {
            reply = poll(key(engine, ANY));
        }
        if (reply == null) {
            reply = defaults.getOrDefault(engine, EngineResponse.ok());
        }
        return reply;
    }

    private EngineResponse poll(String key) {
        Deque<EngineResponse> queue = queued.get(key);
        if (queue == null) {
            return null;
        }
        synchronized (queue) {
            return queue.pollFirst();
        }
    }

    /// @return every recorded invocation in call order, never null
    public List<Invocation> invocations() {
        synchronized (invocations) {
            return List.copyOf(invocations);
        }
    }

    /// Clears scripted replies, defaults, start failures and recorded invocations.
    public void clear() {
        queued.clear();
        defaults.clear();
        unstartable.clear();
        invocations.clear();
    }

    private static String key(String engine, String operation) {
        return engine + "#" + operation;
    }

    /// One recorded engine request.
    ///
    /// @param engine engine name
    /// @param operation operation name
    /// @param arguments interpolated argument string
    public record Invocation(String engine, String operation, String arguments) {}
}
