package io.caldera.core.calibration;

import java.util.Objects;

/// One line of a calibration rules file: a header key and how an index entry's
/// value for it must relate to the query context.
///
/// ### Rule syntax
/// | Text     | Kind               | Passes when                                 |
/// |----------|--------------------|---------------------------------------------|
/// | (blank)  | {@link Kind#RECORD} | always; the key is only stored in the index |
/// | `eq`     | {@link Kind#EQUALS} | entry and context strings are equal          |
/// | `==`     | {@link Kind#NUMERIC_EQUALS} | both numeric and equal              |
/// | `~0.5`   | {@link Kind#TOLERANCE} | numeric difference within the tolerance  |
/// | `<`      | {@link Kind#LESS}   | entry value below the context value          |
/// | `>`      | {@link Kind#GREATER} | entry value above the context value         |
///
/// @param key header key, not null
/// @param kind comparison kind, not null
/// @param tolerance allowed difference for {@link Kind#TOLERANCE}, zero otherwise
public record FieldRule(String key, Kind kind, double tolerance) {

    public enum Kind {
        RECORD,
        EQUALS,
        NUMERIC_EQUALS,
        TOLERANCE,
        LESS,
        GREATER
    }

    public FieldRule {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(kind, "kind");
    }

    /// Parses the rule text following the key on a rules file line.
    ///
    /// @param key header key, not null
    /// @param text rule text, not null (may be blank)
    /// @return the rule, never null
    /// @throws IllegalArgumentException if the rule text is not recognised
    public static FieldRule parse(String key, String text) {
        String rule = text.trim();
        if (rule.isEmpty()) {
            return new FieldRule(key, Kind.RECORD, 0);
        }
        switch (rule) {
            case "eq":
                return new FieldRule(key, Kind.EQUALS, 0);
            case "==":
                return new FieldRule(key, Kind.NUMERIC_EQUALS, 0);
            case "<":
                return new FieldRule(key, Kind.LESS, 0);
            case ">":
                return new FieldRule(key, Kind.GREATER, 0);
            default:
                break;
        }
        if (rule.startsWith("~")) {
            try {
                return new FieldRule(key, Kind.TOLERANCE, Math.abs(Double.parseDouble(rule.substring(1))));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Bad tolerance for " + key + ": " + rule, e);
            }
        }
        throw new IllegalArgumentException("Unrecognised rule for " + key + ": " + rule);
    }

    /// Tests an index entry value against the query context value.
    ///
    /// @param entryValue value stored in the index, may be null
    /// @param contextValue value from the frame context, may be null
    /// @return `true` if the pair satisfies the rule
    public boolean accepts(String entryValue, Object contextValue) {
        if (kind == Kind.RECORD) {
            return true;
        }
        if (entryValue == null || contextValue == null) {
            return false;
        }
        String context = contextValue.toString().trim();
        if (kind == Kind.EQUALS) {
            return entryValue.trim().equals(context);
        }
        Double entry = number(entryValue);
        Double query = number(context);
        if (entry == null || query == null) {
            return false;
        }
        return switch (kind) {
            case NUMERIC_EQUALS -> entry.doubleValue() == query.doubleValue();
            case TOLERANCE -> Math.abs(entry - query) <= tolerance;
            case LESS -> entry < query;
            case GREATER -> entry > query;
            default -> true;
        };
    }

    /// Renders the rule back to rules-file text.
    public String ruleText() {
        return switch (kind) {
            case RECORD -> "";
            case EQUALS -> "eq";
            case NUMERIC_EQUALS -> "==";
            case TOLERANCE -> "~" + tolerance;
            case LESS -> "<";
            case GREATER -> ">";
        };
    }

    static Double number(String text) {
        try {
            return Double.valueOf(text.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
