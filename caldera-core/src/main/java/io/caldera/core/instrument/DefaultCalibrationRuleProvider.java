package io.caldera.core.instrument;

import io.caldera.core.calibration.IndexMode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/// Calibration roles declared as a fixed role to index-mode table.
public class DefaultCalibrationRuleProvider implements CalibrationRuleProvider {

    private final Map<String, IndexMode> modes;

    public DefaultCalibrationRuleProvider(Map<String, IndexMode> modes) {
        this.modes = Collections.unmodifiableMap(new LinkedHashMap<>(modes));
    }

    @Override
    public Set<String> roles() {
        return modes.keySet();
    }

    @Override
    public IndexMode indexMode(String role) {
        return modes.getOrDefault(role, IndexMode.DYNAMIC);
    }
}
