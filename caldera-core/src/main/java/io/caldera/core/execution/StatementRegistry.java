package io.caldera.core.execution;

import java.util.Optional;
import java.util.Set;

/// Registry of statement handlers keyed by statement keyword.
///
/// @see DefaultStatementRegistry
public interface StatementRegistry {

    Optional<StatementHandler> getHandler(String keyword);

    /// Registers or replaces a handler.
    ///
    /// @param keyword statement keyword, not null or blank
    /// @param handler the handler, not null
    /// @throws IllegalArgumentException if either argument is null or blank
    void register(String keyword, StatementHandler handler);

    boolean hasHandler(String keyword);

    Set<String> keywords();
}
