package io.caldera.core.calibration;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/// One row of a calibration index.
///
/// @param name the payload: a calibration file name or a scalar value
/// @param values header values recorded for the rule keys
/// @param sequence insertion position within the index, starting at 0
public record IndexEntry(String name, Map<String, String> values, long sequence) {

    public IndexEntry {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /// @param key header key
    /// @return the recorded value, or null
    public String value(String key) {
        return values.get(key);
    }

    /// Returns the time-ordering value of the entry.
    ///
    /// @param timeKey header key of the time field, not null
    /// @return the time, or `NaN` if absent or not numeric
    public double time(String timeKey) {
        Double value = FieldRule.number(values.getOrDefault(timeKey, ""));
        return value == null ? Double.NaN : value;
    }
}
