package io.caldera.core.instrument;

import java.util.Objects;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Naming scheme of the form `<prefix><utdate>_<nnnn><extension>`.
///
/// Flag files are hidden siblings named `.<prefix><utdate>_<nnnn>.ok` and group
/// files take a leading `g`, e.g. `gf20260101_12`.
///
/// @param prefix instrument file prefix, not null (may be empty)
/// @param extension raw file extension including the dot, not null
/// @param width zero-padded width of the observation number
public record PrefixedNamingScheme(String prefix, String extension, int width)
        implements RawNamingScheme {

    public PrefixedNamingScheme {
        Objects.requireNonNull(prefix, "prefix");
        Objects.requireNonNull(extension, "extension");
        if (width < 1) {
            throw new IllegalArgumentException("width must be positive: " + width);
        }
    }

    @Override
    public String rawFileName(String utdate, int observationNumber) {
        return stem(utdate, observationNumber) + extension;
    }

    @Override
    public String flagFileName(String utdate, int observationNumber) {
        return "." + stem(utdate, observationNumber) + ".ok";
    }

    @Override
    public OptionalInt observationNumber(String utdate, String fileName) {
        Pattern pattern =
                Pattern.compile(
                        Pattern.quote(prefix + utdate + "_")
                                + "(\\d+)"
                                + Pattern.quote(extension));
        Matcher m = pattern.matcher(fileName);
        if (!m.matches()) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(Integer.parseInt(m.group(1)));
    }

    @Override
    public String groupFileName(String utdate, String groupKey) {
        return "g" + prefix + utdate + "_" + groupKey;
    }

    private String stem(String utdate, int observationNumber) {
        return prefix + utdate + "_" + String.format("%0" + width + "d", observationNumber);
    }
}
