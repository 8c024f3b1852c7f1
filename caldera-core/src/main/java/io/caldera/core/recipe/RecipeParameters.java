package io.caldera.core.recipe;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Per-recipe parameters from an ini-style file.
///
/// A `[RECIPE]` section applies to every frame reduced with that recipe; a
/// `[RECIPE:OBJECT]` section applies only to frames of that target and
/// overrides the general section. Keys are upper-cased.
///
/// ```
/// [REDUCE_DARK]
/// METHOD = median
///
/// [REDUCE_SCIENCE:M31]
/// SKY_SUBTRACT = 0
/// ```
public class RecipeParameters {

    private static final Pattern SECTION = Pattern.compile("^\\[([^\\]]+)]$");
    private static final Pattern ENTRY = Pattern.compile("^([^=]+?)\\s*=\\s*(.*)$");

    private final Map<String, Map<String, String>> sections;

    private RecipeParameters(Map<String, Map<String, String>> sections) {
        this.sections = sections;
    }

    public static RecipeParameters empty() {
        return new RecipeParameters(Map.of());
    }

    /// Finds a parameter file on a list of directories.
    ///
    /// @param fileName bare or absolute filename, not null
    /// @param dirs directories searched in order, not null
    /// @return the file, or empty if absent everywhere
    public static Optional<Path> locate(String fileName, List<Path> dirs) {
        Path given = Path.of(fileName);
        if (given.isAbsolute()) {
            return Files.isRegularFile(given) ? Optional.of(given) : Optional.empty();
        }
        for (Path dir : dirs) {
            Path candidate = dir.resolve(fileName);
            if (Files.isRegularFile(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /// @param file the parameter file, not null
    /// @return the parsed parameters, never null
    /// @throws IOException if the file cannot be read
    /// @throws IllegalArgumentException on an entry outside any section
    public static RecipeParameters load(Path file) throws IOException {
        return parse(Files.readAllLines(file));
    }

    /// @param lines file content, not null
    /// @return the parsed parameters, never null
    /// @throws IllegalArgumentException on an entry outside any section or a malformed line
    public static RecipeParameters parse(List<String> lines) {
        Map<String, Map<String, String>> sections = new LinkedHashMap<>();
        Map<String, String> current = null;
        int lineNumber = 0;
        for (String line : lines) {
            lineNumber++;
            String text = line.trim();
            if (text.isEmpty() || text.startsWith("#") || text.startsWith(";")) {
                continue;
            }
            Matcher section = SECTION.matcher(text);
            if (section.matches()) {
                current = sections.computeIfAbsent(normalise(section.group(1)), k -> new LinkedHashMap<>());
                continue;
            }
            Matcher entry = ENTRY.matcher(text);
            if (!entry.matches()) {
                throw new IllegalArgumentException("Malformed recipe parameter at line " + lineNumber + ": " + text);
            }
            if (current == null) {
                throw new IllegalArgumentException(
                        "Recipe parameter outside a [RECIPE] section at line " + lineNumber);
            }
            current.put(entry.group(1).trim().toUpperCase(), entry.group(2).trim());
        }
        return new RecipeParameters(sections);
    }

    /// Returns the parameters for a recipe and target.
    ///
    /// @param recipe recipe name, not null
    /// @param object target name from the frame header, may be null
    /// @return merged parameters, the target section winning, never null
    public Map<String, String> forRecipe(String recipe, String object) {
        Map<String, String> merged = new LinkedHashMap<>(sections.getOrDefault(normalise(recipe), Map.of()));
        if (object != null && !object.isBlank()) {
            merged.putAll(sections.getOrDefault(normalise(recipe + ":" + object), Map.of()));
        }
        return Collections.unmodifiableMap(merged);
    }

    /// Returns the keys configured for a recipe that it does not declare.
    ///
    /// @param recipe recipe name, not null
    /// @param declared parameter names the recipe understands, not null
    /// @return unsupported keys across all of the recipe's sections, never null
    public Set<String> unsupported(String recipe, Set<String> declared) {
        Set<String> unsupported = new LinkedHashSet<>();
        String prefix = normalise(recipe);
        for (Map.Entry<String, Map<String, String>> section : sections.entrySet()) {
            String name = section.getKey();
            if (name.equals(prefix) || name.startsWith(prefix + ":")) {
                for (String key : section.getValue().keySet()) {
                    if (!declared.contains(key)) {
                        unsupported.add(key);
                    }
                }
            }
        }
        return unsupported;
    }

    public boolean isEmpty() {
        return sections.isEmpty();
    }

    private static String normalise(String section) {
        return section.trim().toUpperCase().replaceAll("\\s+", "");
    }
}
