package io.caldera.core.frame;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// One observation: its raw file, its headers and the files derived from it.
///
/// A frame is created by {@link FrameFactory} when the data-arrival loop sees a
/// new raw file. The raw header is read once; values computed by the pipeline go
/// into the derived header, which shadows the raw one on lookup. The working
/// filename list starts as the raw file and moves forward as recipe steps
/// write new products (see {@link #inout(String)}).
///
/// ### Contracts
/// - **Invariant**: {@link #files()} is never empty
/// - **Invariant**: a frame belongs to at most one {@link Group}
///
/// @implNote **Not thread-safe**. Frames are only touched by the orchestrator
/// thread.
public class Frame {

    private static final Logger logger = Logger.getLogger(Frame.class.getName());
    private static final Pattern TRAILING_NUMBER = Pattern.compile("(\\d+)(\\.\\w+)?$");

    private final String raw;
    private final Map<String, Object> header;
    private final Map<String, Object> derived = new LinkedHashMap<>();
    private final List<String> files = new ArrayList<>();
    private final Set<String> intermediates = new LinkedHashSet<>();
    private final Set<String> nokeep = new LinkedHashSet<>();
    private boolean good = true;
    private String recipe;
    private String groupKey;
    private Path rawLink;

    /// Creates a frame for a raw file.
    ///
    /// @param raw the raw filename as seen from the working directory, not null
    /// @param header the raw header in file order, not null
    public Frame(String raw, Map<String, ?> header) {
        this.raw = raw;
        this.header = new LinkedHashMap<>(header);
        this.files.add(raw);
    }

    public String raw() {
        return raw;
    }

    /// Returns the observation number parsed from the trailing digits of the raw
    /// name, or from the derived header when the loop already knows it.
    ///
    /// @return the observation number, or `-1` if none can be determined
    public int number() {
        Object known = derived.get(DerivedHeaders.OBSERVATION_NUMBER);
        if (known instanceof Number n) {
            return n.intValue();
        }
        Matcher m = TRAILING_NUMBER.matcher(raw);
        if (m.find()) {
            return Integer.parseInt(m.group(1));
        }
        return -1;
    }

    /// @return the UT date the frame belongs to, empty string if unknown
    public String utdate() {
        Object value = derived.get(DerivedHeaders.UTDATE);
        return value == null ? "" : value.toString();
    }

    /// Returns the current working file (the first of {@link #files()}).
    public String file() {
        return files.get(0);
    }

    /// Returns the working file at a 1-based position.
    ///
    /// @param index 1-based position, must be within `1..files().size()`
    /// @return the filename, never null
    public String file(int index) {
        return files.get(index - 1);
    }

    /// Replaces the working file list with a single file.
    ///
    /// @apiNote **Side effects**: the previous working file is recorded as an
    /// intermediate unless it is the raw file.
    ///
    /// @param file the new working file, not null
    public void setFile(String file) {
        setFiles(List.of(file));
    }

    public void setFiles(List<String> newFiles) {
        if (newFiles.isEmpty()) {
            throw new IllegalArgumentException("A frame needs at least one working file");
        }
        for (String previous : files) {
            if (!previous.equals(raw) && !newFiles.contains(previous)) {
                intermediates.add(previous);
            }
        }
        files.clear();
        files.addAll(newFiles);
    }

    public List<String> files() {
        return Collections.unmodifiableList(files);
    }

    /// Derives input and output names for a step that writes a new product.
    ///
    /// The last `_suffix` component of the current file is replaced by the new
    /// suffix, or the suffix is appended when the name ends in a number (the
    /// observation number) or has only one underscore. Any extension is dropped.
    ///
    /// @param suffix the product suffix, with or without leading underscore, not null
    /// @return the input file and derived output file, never null
    public InOut inout(String suffix) {
        String input = file();
        Path path = Path.of(input);
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot > 0) {
            name = name.substring(0, dot);
        }
        List<String> parts = new ArrayList<>(Arrays.asList(name.split("_")));
        if (parts.size() > 2 && !parts.get(parts.size() - 1).matches("\\d+")) {
            parts.remove(parts.size() - 1);
        }
        parts.add(suffix.startsWith("_") ? suffix.substring(1) : suffix);
        String outName = String.join("_", parts);
        Path parent = path.getParent();
        String output = parent == null ? outName : parent.resolve(outName).toString();
        if (output.equals(input)) {
            logger.warning("inout - output filename equals input filename (" + output + ")");
        }
        return new InOut(input, output);
    }

    /// Returns a header value, preferring the derived header over the raw one.
    ///
    /// @param key header key, not null
    /// @return the value, or null if neither header has it
    public Object headerValue(String key) {
        Object value = derived.get(key);
        return value != null ? value : header.get(key);
    }

    /// Returns the raw header merged with the derived header on top.
    ///
    /// This is the context calibration rules and bad-observation rules are
    /// evaluated against.
    ///
    /// @return an unmodifiable snapshot, never null
    public Map<String, Object> headerContext() {
        Map<String, Object> merged = new LinkedHashMap<>(header);
        merged.putAll(derived);
        return Collections.unmodifiableMap(merged);
    }

    public Map<String, Object> header() {
        return Collections.unmodifiableMap(header);
    }

    public Map<String, Object> derived() {
        return Collections.unmodifiableMap(derived);
    }

    public void setDerived(String key, Object value) {
        derived.put(key, value);
    }

    public boolean isGood() {
        return good;
    }

    /// Clears the good flag. The frame's data is kept; only group membership
    /// filtering changes.
    public void markBad() {
        good = false;
    }

    public String recipe() {
        return recipe;
    }

    public void setRecipe(String recipe) {
        this.recipe = recipe;
        derived.put(DerivedHeaders.RECIPE, recipe);
    }

    public String groupKey() {
        return groupKey;
    }

    public void setGroupKey(String groupKey) {
        this.groupKey = groupKey;
        derived.put(DerivedHeaders.GROUP, groupKey);
    }

    /// Records a product that is not a working file but should be tracked.
    public void addIntermediate(String file) {
        intermediates.add(file);
    }

    public Set<String> intermediates() {
        return Collections.unmodifiableSet(intermediates);
    }

    /// Marks a file for deletion once the frame has been processed.
    public void nokeep(String file) {
        nokeep.add(file);
    }

    public Set<String> nokeepFiles() {
        return Collections.unmodifiableSet(nokeep);
    }

    /// Returns the symbolic link created to expose the raw file in the output
    /// directory, if the loop created one.
    public Optional<Path> rawLink() {
        return Optional.ofNullable(rawLink);
    }

    public void setRawLink(Path rawLink) {
        this.rawLink = rawLink;
    }

    @Override
    public String toString() {
        return "Frame[" + raw + ", #" + number() + (good ? "" : ", bad") + "]";
    }

    /// Input and output filenames of a product-writing step.
    ///
    /// @param in the current working file
    /// @param out the file the step should write
    public record InOut(String in, String out) {}
}
