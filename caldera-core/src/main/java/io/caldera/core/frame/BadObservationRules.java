package io.caldera.core.frame;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Bad-observation rule set read from a plain text file.
///
/// Each non-comment line is one rule; a frame is bad if any rule matches it.
/// A rule is a conjunction of `field=value` terms compared against the frame's
/// merged header. The shorthand `utdate:obsnum` stands for the derived UT date
/// and observation number. Numeric values compare numerically, so `12` matches
/// a header value of `0012`.
///
/// ```
/// # bad observations for the night
/// 20260101:12
/// DR_UTDATE=20260101 DR_OBSNUM=15
/// OBJECT=focus
/// ```
public class BadObservationRules implements BadObservationFilter {

    private static final Pattern SHORTHAND = Pattern.compile("^(\\d{8}):(\\d+)$");
    private static final Pattern TERM = Pattern.compile("^([^=\\s]+)=(\\S*)$");

    private final List<Map<String, String>> rules = new ArrayList<>();
    private long revision;

    /// Loads rules from a file.
    ///
    /// @param file the rule file, not null
    /// @return the parsed rule set, never null
    /// @throws IOException if the file cannot be read
    /// @throws IllegalArgumentException if a line is malformed
    public static BadObservationRules load(Path file) throws IOException {
        return parse(Files.readAllLines(file));
    }

    /// Parses rule lines.
    ///
    /// @param lines rule file content, not null
    /// @return the parsed rule set, never null
    /// @throws IllegalArgumentException if a line is malformed
    public static BadObservationRules parse(List<String> lines) {
        BadObservationRules parsed = new BadObservationRules();
        int lineNumber = 0;
        for (String line : lines) {
            lineNumber++;
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            parsed.rules.add(parseRule(trimmed, lineNumber));
        }
        return parsed;
    }

    private static Map<String, String> parseRule(String text, int lineNumber) {
        Map<String, String> rule = new LinkedHashMap<>();
        Matcher shorthand = SHORTHAND.matcher(text);
        if (shorthand.matches()) {
            rule.put(DerivedHeaders.UTDATE, shorthand.group(1));
            rule.put(DerivedHeaders.OBSERVATION_NUMBER, shorthand.group(2));
            return rule;
        }
        for (String term : text.split("\\s+")) {
            Matcher m = TERM.matcher(term);
            if (!m.matches()) {
                throw new IllegalArgumentException(
                        "Malformed bad-observation rule at line " + lineNumber + ": " + term);
            }
            rule.put(m.group(1), m.group(2));
        }
        return rule;
    }

    /// Adds a rule; frames matching every field are excluded.
    ///
    /// @param rule field to expected value, not null or empty
    public void add(Map<String, String> rule) {
        if (rule.isEmpty()) {
            throw new IllegalArgumentException("A rule needs at least one field");
        }
        rules.add(new LinkedHashMap<>(rule));
        revision++;
    }

    /// Adds the rule for one observation of one night.
    public void addObservation(String utdate, int observationNumber) {
        add(Map.of(
                DerivedHeaders.UTDATE, utdate,
                DerivedHeaders.OBSERVATION_NUMBER, Integer.toString(observationNumber)));
    }

    /// Removes a previously added rule.
    ///
    /// @return `true` if the rule was present
    public boolean remove(Map<String, String> rule) {
        boolean removed = rules.remove(new LinkedHashMap<>(rule));
        if (removed) {
            revision++;
        }
        return removed;
    }

    public void clear() {
        rules.clear();
        revision++;
    }

    public List<Map<String, String>> rules() {
        return Collections.unmodifiableList(rules);
    }

    @Override
    public boolean matches(Frame frame) {
        for (Map<String, String> rule : rules) {
            if (matchesRule(frame, rule)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public long revision() {
        return revision;
    }

    private static boolean matchesRule(Frame frame, Map<String, String> rule) {
        for (Map.Entry<String, String> term : rule.entrySet()) {
            Object actual = frame.headerValue(term.getKey());
            if (actual == null || !sameValue(actual.toString().trim(), term.getValue())) {
                return false;
            }
        }
        return true;
    }

    static boolean sameValue(String actual, String expected) {
        if (actual.equals(expected)) {
            return true;
        }
        try {
            return new BigDecimal(actual).compareTo(new BigDecimal(expected)) == 0;
        } catch (NumberFormatException notNumeric) {
            return false;
        }
    }
}
