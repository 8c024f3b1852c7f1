package io.caldera.core.calibration;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/// Append-only store of calibration candidates for one role.
///
/// Every entry records the values of the role's rule keys taken from the
/// header of the frame that produced it. Entries are never rewritten: adding a
/// name that is already present appends a new row that supersedes the old one.
///
/// ### File format
/// ```
/// #name DR_TIME EXPTIME READMODE
/// dark_12 61041.25 30 "FAST READ"
/// dark_19 61041.31 30 SLOW
/// ```
/// The first line lists the columns. Values containing whitespace are quoted.
///
/// ### Contracts
/// - **Invariant**: {@link #entries()} reflects insertion order
/// - **Invariant**: a row is appended under an exclusive file lock, so
///   concurrent pipelines sharing an index never interleave partial rows
///
/// @implNote Readers always see a prefix of the appended rows.
public class CalibrationIndex {

    private static final Logger logger = Logger.getLogger(CalibrationIndex.class.getName());
    private static final String NAME_COLUMN = "#name";

    private final String role;
    private final IndexRules rules;
    private final String timeKey;
    private final Path file;
    private final boolean readOnly;
    private final List<IndexEntry> rows = new ArrayList<>();

    private CalibrationIndex(
            String role, IndexRules rules, String timeKey, Path file, boolean readOnly) {
        this.role = role;
        this.rules = rules.withRecorded(timeKey);
        this.timeKey = timeKey;
        this.file = file;
        this.readOnly = readOnly;
    }

    /// Creates an index that is never persisted.
    ///
    /// @param role calibration role, not null
    /// @param rules compatibility rules, not null
    /// @param timeKey header key of the time-ordering field, not null
    /// @return an empty index, never null
    public static CalibrationIndex inMemory(String role, IndexRules rules, String timeKey) {
        return new CalibrationIndex(role, rules, timeKey, null, false);
    }

    /// Opens an index file, reading any rows already present.
    ///
    /// @param role calibration role, not null
    /// @param rules compatibility rules, not null
    /// @param timeKey header key of the time-ordering field, not null
    /// @param file index file location, not null (need not exist)
    /// @param readOnly `true` to refuse {@link #add}
    /// @return the index, never null
    /// @throws IOException if an existing file cannot be read
    public static CalibrationIndex open(
            String role, IndexRules rules, String timeKey, Path file, boolean readOnly)
            throws IOException {
        CalibrationIndex index = new CalibrationIndex(role, rules, timeKey, file, readOnly);
        if (Files.exists(file)) {
            index.read();
        }
        return index;
    }

    private void read() throws IOException {
        List<String> columns = rules.keys();
        int lineNumber = 0;
        for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            List<String> tokens = tokenize(line);
            if (tokens.get(0).equals(NAME_COLUMN)) {
                columns = tokens.subList(1, tokens.size());
                continue;
            }
            if (tokens.get(0).startsWith("#")) {
                continue;
            }
            if (tokens.size() != columns.size() + 1) {
                logger.warning(
                        "Skipping malformed row " + lineNumber + " of " + file
                                + ": expected " + (columns.size() + 1) + " columns");
                continue;
            }
            Map<String, String> values = new LinkedHashMap<>();
            for (int i = 0; i < columns.size(); i++) {
                values.put(columns.get(i), tokens.get(i + 1));
            }
            rows.add(new IndexEntry(tokens.get(0), values, rows.size()));
        }
        logger.fine("Read " + rows.size() + " " + role + " index rows from " + file);
    }

    /// Appends an entry built from a header.
    ///
    /// @apiNote **Side effects**: appends a row to the index file when the index
    /// is file-backed, writing the column line first if the file is new.
    ///
    /// @param name calibration name or scalar payload, not null or blank
    /// @param header header of the frame the calibration came from, not null
    /// @return the new entry, never null
    /// @throws IllegalArgumentException if the header lacks one of the rule keys
    /// @throws IllegalStateException if the index is read-only
    /// @throws IOException if the row cannot be written
    public synchronized IndexEntry add(String name, Map<String, ?> header) throws IOException {
        if (readOnly) {
            throw new IllegalStateException("The " + role + " index is read-only: " + file);
        }
        if (name == null || name.isBlank() || name.chars().anyMatch(Character::isWhitespace)) {
            throw new IllegalArgumentException("Invalid calibration name: '" + name + "'");
        }
        Map<String, String> values = new LinkedHashMap<>();
        for (String key : rules.keys()) {
            Object value = header.get(key);
            if (value == null) {
                throw new IllegalArgumentException(
                        "Unable to add " + name + " to the " + role + " index: header has no "
                                + key);
            }
            values.put(key, value.toString().trim());
        }
        IndexEntry entry = new IndexEntry(name, values, rows.size());
        if (file != null) {
            append(entry);
        }
        rows.add(entry);
        logger.info("Added " + name + " to the " + role + " index");
        return entry;
    }

    private void append(IndexEntry entry) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (FileChannel channel =
                        FileChannel.open(
                                file,
                                StandardOpenOption.CREATE,
                                StandardOpenOption.WRITE,
                                StandardOpenOption.APPEND);
                FileLock lock = channel.lock()) {
            StringBuilder text = new StringBuilder();
            if (channel.size() == 0) {
                text.append(NAME_COLUMN);
                for (String key : rules.keys()) {
                    text.append(' ').append(key);
                }
                text.append('\n');
            }
            text.append(entry.name());
            for (String key : rules.keys()) {
                text.append(' ').append(quote(entry.value(key)));
            }
            text.append('\n');
            ByteBuffer buffer = ByteBuffer.wrap(text.toString().getBytes(StandardCharsets.UTF_8));
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
        }
    }

    /// Returns the live entries: the latest row for each name, in insertion order.
    ///
    /// @return an unmodifiable list, never null
    public synchronized List<IndexEntry> entries() {
        Map<String, IndexEntry> latest = new LinkedHashMap<>();
        for (IndexEntry row : rows) {
            latest.remove(row.name());
            latest.put(row.name(), row);
        }
        List<IndexEntry> live = new ArrayList<>(latest.values());
        live.sort(Comparator.comparingLong(IndexEntry::sequence));
        return Collections.unmodifiableList(live);
    }

    /// @param name calibration name, not null
    /// @return the latest entry for the name, or empty
    public synchronized Optional<IndexEntry> entry(String name) {
        for (int i = rows.size() - 1; i >= 0; i--) {
            if (rows.get(i).name().equals(name)) {
                return Optional.of(rows.get(i));
            }
        }
        return Optional.empty();
    }

    /// Checks whether a named entry is compatible with a context.
    ///
    /// @param name calibration name, not null
    /// @param context the frame's merged header, not null
    /// @return the verdict, never null
    public Verdict verify(String name, Map<String, ?> context) {
        Optional<IndexEntry> entry = entry(name);
        if (entry.isEmpty()) {
            return Verdict.UNKNOWN;
        }
        return rules.accepts(entry.get(), context) ? Verdict.SUITABLE : Verdict.UNSUITABLE;
    }

    /// Chooses the compatible entry closest in time to the context.
    ///
    /// Ties in time difference go to the entry inserted first.
    ///
    /// @param context the frame's merged header, must contain the time key
    /// @param mode nearest in either direction, or nearest earlier
    /// @return the chosen entry, or empty if none is compatible
    /// @throws IllegalArgumentException if the context has no numeric time value
    public Optional<IndexEntry> choose(Map<String, ?> context, SearchMode mode) {
        Object timeValue = context.get(timeKey);
        Double queryTime = timeValue == null ? null : FieldRule.number(timeValue.toString());
        if (queryTime == null) {
            throw new IllegalArgumentException(
                    "Context has no numeric " + timeKey + " to search the " + role + " index");
        }
        double query = queryTime;
        IndexEntry best = null;
        double bestDistance = Double.POSITIVE_INFINITY;
        for (IndexEntry candidate : entries()) {
            double time = candidate.time(timeKey);
            if (Double.isNaN(time)) {
                continue;
            }
            if (mode == SearchMode.EARLIER && time > query) {
                continue;
            }
            double distance = Math.abs(time - query);
            if (distance >= bestDistance) {
                continue;
            }
            if (rules.accepts(candidate, context)) {
                best = candidate;
                bestDistance = distance;
            }
        }
        return Optional.ofNullable(best);
    }

    public String role() {
        return role;
    }

    public IndexRules rules() {
        return rules;
    }

    public String timeKey() {
        return timeKey;
    }

    /// @return the backing file, or null for an in-memory index
    public Path file() {
        return file;
    }

    public boolean isReadOnly() {
        return readOnly;
    }

    static String quote(String value) {
        if (value.isEmpty() || value.chars().anyMatch(Character::isWhitespace) || value.contains("\"")) {
            return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
        }
        return value;
    }

    static List<String> tokenize(String line) {
        List<String> tokens = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        boolean inToken = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quoted) {
                if (c == '\\' && i + 1 < line.length()) {
                    current.append(line.charAt(++i));
                } else if (c == '"') {
                    quoted = false;
                } else {
                    current.append(c);
                }
            } else if (c == '"') {
                quoted = true;
                inToken = true;
            } else if (Character.isWhitespace(c)) {
                if (inToken) {
                    tokens.add(current.toString());
                    current.setLength(0);
                    inToken = false;
                }
            } else {
                current.append(c);
                inToken = true;
            }
        }
        if (inToken) {
            tokens.add(current.toString());
        }
        return tokens;
    }
}
