package io.caldera.core.execution;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/// Statement registry preloaded with the {@link BuiltinStatements}.
public class DefaultStatementRegistry implements StatementRegistry {

    private final Map<String, StatementHandler> handlers = new ConcurrentHashMap<>();

    public DefaultStatementRegistry() {
        BuiltinStatements.registerAll(this);
    }

    @Override
    public Optional<StatementHandler> getHandler(String keyword) {
        return Optional.ofNullable(handlers.get(keyword));
    }

    @Override
    public void register(String keyword, StatementHandler handler) {
        if (keyword == null || keyword.isBlank()) {
            throw new IllegalArgumentException("keyword cannot be null or blank");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        handlers.put(keyword, handler);
    }

    @Override
    public boolean hasHandler(String keyword) {
        return handlers.containsKey(keyword);
    }

    @Override
    public Set<String> keywords() {
        return Collections.unmodifiableSet(new TreeSet<>(handlers.keySet()));
    }
}
