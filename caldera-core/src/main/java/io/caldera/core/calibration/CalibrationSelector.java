package io.caldera.core.calibration;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.logging.Logger;

/// Chooses the calibration to use for each role, given the current frame's
/// header context.
///
/// ### Selection order for a role
/// 1. A pinned value (operator override) is returned as is
/// 2. A previously bound value is re-validated against the context and
///    returned if still suitable
/// 3. The role's index is searched for the compatible entry closest in time;
///    the result is bound and returned
/// 4. Otherwise {@link NoSuitableCalibrationException}
///
/// Validation is cheap, so a binding behaves like a cache entry whose
/// invalidation predicate is the role's rules.
///
/// ### Contracts
/// - **Invariant**: a pinned binding is never replaced by dynamic selection
/// - **Invariant**: a pinned role never consults its index
///
/// @implNote **Not thread-safe**. One selector serves one pipeline run.
public class CalibrationSelector {

    private static final Logger logger = Logger.getLogger(CalibrationSelector.class.getName());

    private final CalibrationIndexes indexes;
    private final Map<String, Binding> bindings = new LinkedHashMap<>();

    public CalibrationSelector(CalibrationIndexes indexes) {
        this.indexes = indexes;
    }

    /// Pins a role to a value for the rest of the run.
    ///
    /// @param role calibration role, not null
    /// @param value the calibration name or scalar, not null
    public void pin(String role, String value) {
        bindings.put(role, new Binding(value, true));
        logger.info("Calibration " + role + " pinned to " + value);
    }

    /// Pins every role in an override map.
    ///
    /// @apiNote **Side effects**: logs a warning for roles the instrument does
    /// not know; such roles are pinned anyway so recipes asking for them work.
    ///
    /// @param overrides role to value, not null
    public void applyOverrides(Map<String, String> overrides) {
        for (Map.Entry<String, String> override : overrides.entrySet()) {
            if (!indexes.roles().contains(override.getKey())) {
                logger.warning(
                        "Calibration override '" + override.getKey()
                                + "' is not a known calibration role " + indexes.roles());
            }
            pin(override.getKey(), override.getValue());
        }
    }

    public boolean isPinned(String role) {
        Binding binding = bindings.get(role);
        return binding != null && binding.pinned();
    }

    /// Binds a dynamically produced value, e.g. a new dark filed by a recipe.
    ///
    /// Ignored for pinned roles.
    ///
    /// @param role calibration role, not null
    /// @param value calibration name, not null
    public void bind(String role, String value) {
        if (isPinned(role)) {
            logger.fine("Not rebinding pinned calibration " + role);
            return;
        }
        bindings.put(role, new Binding(value, false));
    }

    /// @return the currently bound value of a role, without validation
    public Optional<String> current(String role) {
        Binding binding = bindings.get(role);
        return binding == null ? Optional.empty() : Optional.of(binding.value());
    }

    /// Selects the calibration nearest in time.
    ///
    /// @param role calibration role, not null
    /// @param context the frame's merged header, not null
    /// @return the calibration name or scalar, never null
    /// @throws NoSuitableCalibrationException if nothing compatible exists
    public String select(String role, Map<String, ?> context)
            throws NoSuitableCalibrationException {
        return select(role, context, SearchMode.NEAREST);
    }

    /// Selects a calibration with an explicit search mode.
    ///
    /// @param role calibration role, not null
    /// @param context the frame's merged header, not null
    /// @param mode nearest in time, or nearest earlier
    /// @return the calibration name or scalar, never null
    /// @throws NoSuitableCalibrationException if nothing compatible exists
    public String select(String role, Map<String, ?> context, SearchMode mode)
            throws NoSuitableCalibrationException {
        Binding binding = bindings.get(role);
        if (binding != null && binding.pinned()) {
            return binding.value();
        }
        CalibrationIndex index = index(role);
        if (binding != null) {
            Verdict verdict = index.verify(binding.value(), context);
            if (verdict == Verdict.SUITABLE) {
                return binding.value();
            }
            logger.fine("Bound " + role + " " + binding.value() + " is " + verdict + ", searching index");
        }
        IndexEntry chosen = choose(index, role, context, mode);
        bindings.put(role, new Binding(chosen.name(), false));
        logger.info("Using " + role + ": " + chosen.name());
        return chosen.name();
    }

    /// Selects a calibration, returning empty instead of failing.
    ///
    /// @param role calibration role, not null
    /// @param context the frame's merged header, not null
    /// @return the calibration, or empty if none is compatible
    public Optional<String> find(String role, Map<String, ?> context) {
        try {
            return Optional.of(select(role, context));
        } catch (NoSuitableCalibrationException e) {
            logger.fine(e.getMessage());
            return Optional.empty();
        }
    }

    /// Selects a calibration, falling back to a default value.
    ///
    /// @param role calibration role, not null
    /// @param context the frame's merged header, not null
    /// @param fallback supplies the value when nothing is compatible, not null
    /// @return the calibration or the fallback value
    public String selectOrDefault(String role, Map<String, ?> context, Supplier<String> fallback) {
        return find(role, context).orElseGet(fallback);
    }

    /// Reads a scalar column of the selected entry, e.g. a readnoise value.
    ///
    /// A pinned role returns its pinned value directly.
    ///
    /// @param role calibration role, not null
    /// @param context the frame's merged header, not null
    /// @param column index column to read, not null
    /// @return the column value, never null
    /// @throws NoSuitableCalibrationException if nothing compatible exists or the
    ///         entry has no such column
    public String column(String role, Map<String, ?> context, String column)
            throws NoSuitableCalibrationException {
        String name = select(role, context);
        if (isPinned(role)) {
            return name;
        }
        IndexEntry entry =
                index(role)
                        .entry(name)
                        .orElseThrow(
                                () -> new NoSuitableCalibrationException(role, "Lost " + role + " entry " + name));
        String value = entry.value(column);
        if (value == null) {
            throw new NoSuitableCalibrationException(
                    role, "The " + role + " index has no column " + column);
        }
        return value;
    }

    /// Finds a calibration file on the search path.
    ///
    /// @param fileName bare filename, not null
    /// @return the file, or empty if it exists on no search directory
    public Optional<Path> locate(String fileName) {
        return indexes.getSearchPath().find(fileName);
    }

    /// @return current bindings in binding order, never null
    public Map<String, Binding> bindings() {
        return Collections.unmodifiableMap(bindings);
    }

    public CalibrationIndexes getIndexes() {
        return indexes;
    }

    private CalibrationIndex index(String role) throws NoSuitableCalibrationException {
        try {
            return indexes.index(role);
        } catch (IOException e) {
            throw new NoSuitableCalibrationException(
                    role, "Unable to open the " + role + " index: " + e.getMessage(), e);
        }
    }

    private static IndexEntry choose(
            CalibrationIndex index, String role, Map<String, ?> context, SearchMode mode)
            throws NoSuitableCalibrationException {
        try {
            return index.choose(context, mode)
                    .orElseThrow(
                            () ->
                                    new NoSuitableCalibrationException(
                                            role, "No suitable " + role + " calibration was found in index file"));
        } catch (IllegalArgumentException e) {
            throw new NoSuitableCalibrationException(role, e.getMessage(), e);
        }
    }

    /// A role's current value.
    ///
    /// @param value calibration name or scalar
    /// @param pinned `true` if set by operator override
    public record Binding(String value, boolean pinned) {}
}
