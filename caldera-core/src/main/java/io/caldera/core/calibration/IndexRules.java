package io.caldera.core.calibration;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// The compatibility rules of one calibration role, keyed by header key.
///
/// Keys are held sorted; that order is also the column order of the index file.
///
/// ```
/// # rules.dark
/// EXPTIME   ==
/// READMODE  eq
/// DR_TIME
/// TEMP      ~0.5
/// ```
public class IndexRules {

    private static final Pattern LINE = Pattern.compile("^(\\S+)\\s*(.*)$");

    private final SortedMap<String, FieldRule> rules;

    public IndexRules(Collection<FieldRule> rules) {
        TreeMap<String, FieldRule> sorted = new TreeMap<>();
        for (FieldRule rule : rules) {
            sorted.put(rule.key(), rule);
        }
        this.rules = Collections.unmodifiableSortedMap(sorted);
    }

    /// Loads a rules file.
    ///
    /// @param file the rules file, not null
    /// @return the rules, never null
    /// @throws IOException if the file cannot be read
    /// @throws IllegalArgumentException if a rule cannot be parsed
    public static IndexRules load(Path file) throws IOException {
        return parse(Files.readAllLines(file));
    }

    /// Parses rules file lines; blank lines and `#` comments are skipped.
    ///
    /// @param lines the rules file content, not null
    /// @return the rules, never null
    public static IndexRules parse(List<String> lines) {
        List<FieldRule> parsed = new ArrayList<>();
        for (String line : lines) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                continue;
            }
            Matcher m = LINE.matcher(trimmed);
            if (m.matches()) {
                parsed.add(FieldRule.parse(m.group(1), m.group(2)));
            }
        }
        return new IndexRules(parsed);
    }

    /// Returns a copy with the key added as a record-only rule if absent.
    ///
    /// @param key header key, not null
    /// @return rules containing the key, never null
    public IndexRules withRecorded(String key) {
        if (rules.containsKey(key)) {
            return this;
        }
        List<FieldRule> all = new ArrayList<>(rules.values());
        all.add(new FieldRule(key, FieldRule.Kind.RECORD, 0));
        return new IndexRules(all);
    }

    /// @return the rule keys in sorted order, never null
    public List<String> keys() {
        return List.copyOf(rules.keySet());
    }

    public Collection<FieldRule> rules() {
        return rules.values();
    }

    /// Checks an entry against a query context.
    ///
    /// @param entry the index entry, not null
    /// @param context the frame's merged header, not null
    /// @return `true` if every rule passes
    public boolean accepts(IndexEntry entry, Map<String, ?> context) {
        for (FieldRule rule : rules.values()) {
            if (!rule.accepts(entry.value(rule.key()), context.get(rule.key()))) {
                return false;
            }
        }
        return true;
    }
}
