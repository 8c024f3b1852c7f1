package io.caldera.core.instrument;

import io.caldera.core.calibration.IndexMode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Builds an {@link Instrument} from plain settings.
///
/// Covers imagers and spectrometers whose files follow the prefixed naming
/// layout; anything unusual supplies its own capability objects instead.
public final class GenericInstrument {

    /// Roles every generic instrument carries.
    public static final List<String> DEFAULT_ROLES =
            List.of("bias", "dark", "flat", "sky", "standard", "readnoise");

    private GenericInstrument() {}

    /// Creates an instrument with default roles, `GRPNUM` grouping and `.fits` files.
    ///
    /// @param name instrument identifier, not null
    /// @param prefix raw filename prefix, not null
    /// @return the instrument, never null
    public static Instrument create(String name, String prefix) {
        Map<String, IndexMode> roles = new LinkedHashMap<>();
        for (String role : DEFAULT_ROLES) {
            roles.put(role, IndexMode.DYNAMIC);
        }
        return create(name, prefix, List.of("GRPNUM"), roles);
    }

    /// Creates an instrument with explicit grouping keys and calibration roles.
    ///
    /// @param name instrument identifier, not null
    /// @param prefix raw filename prefix, not null
    /// @param groupKeys header keys forming the group key, not null
    /// @param roles calibration role to index mode, not null
    /// @return the instrument, never null
    public static Instrument create(
            String name, String prefix, List<String> groupKeys, Map<String, IndexMode> roles) {
        return new Instrument(
                name,
                new PrefixedNamingScheme(prefix, ".fits", 4),
                new HeaderGroupingRule(groupKeys),
                new DefaultCalibrationRuleProvider(roles),
                HeaderConventions.defaults());
    }
}
