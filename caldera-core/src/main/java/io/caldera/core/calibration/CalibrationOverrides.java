package io.caldera.core.calibration;

import java.util.LinkedHashMap;
import java.util.Map;

/// Parses operator calibration overrides of the form `dark=d_12,readnoise=8.5`.
public final class CalibrationOverrides {

    private CalibrationOverrides() {}

    /// @param text comma separated `role=value` pairs, may be null or blank
    /// @return role to value in the given order, never null
    /// @throws IllegalArgumentException if a pair has no `=` or an empty side
    public static Map<String, String> parse(String text) {
        Map<String, String> overrides = new LinkedHashMap<>();
        if (text == null || text.isBlank()) {
            return overrides;
        }
        for (String pair : text.split(",")) {
            String trimmed = pair.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            int eq = trimmed.indexOf('=');
            if (eq <= 0 || eq == trimmed.length() - 1) {
                throw new IllegalArgumentException("Calibration override must be role=value: " + trimmed);
            }
            overrides.put(trimmed.substring(0, eq).trim().toLowerCase(), trimmed.substring(eq + 1).trim());
        }
        return overrides;
    }
}
