package io.caldera.core.recipe;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/// The significant lines of a recipe or primitive file.
///
/// Blank lines, `#` comments and documentation blocks (from a line starting with
/// `=` up to `=cut`) are dropped. A `%parameters A B` line declares the recipe
/// parameters the recipe understands and is not itself a step.
///
/// @param name recipe or primitive name
/// @param path file the source came from
/// @param lines significant lines in order
/// @param parameters declared parameter names
/// @param modified file modification time when read
public record RecipeSource(
        String name, Path path, List<SourceLine> lines, Set<String> parameters, FileTime modified) {

    private static final String PARAMETERS = "%parameters";

    public RecipeSource {
        lines = List.copyOf(lines);
        parameters = Collections.unmodifiableSet(new LinkedHashSet<>(parameters));
    }

    /// Reads and filters a source file.
    ///
    /// @param name recipe or primitive name, not null
    /// @param path the file, not null
    /// @return the source, never null
    /// @throws IOException if the file cannot be read
    public static RecipeSource read(String name, Path path) throws IOException {
        FileTime modified = Files.getLastModifiedTime(path);
        return parse(name, path, Files.readAllLines(path), modified);
    }

    /// Filters raw lines.
    ///
    /// @param name recipe or primitive name, not null
    /// @param path the originating file, may be null
    /// @param raw file content by line, not null
    /// @param modified modification time, may be null
    /// @return the source, never null
    public static RecipeSource parse(String name, Path path, List<String> raw, FileTime modified) {
        List<SourceLine> lines = new ArrayList<>();
        Set<String> parameters = new LinkedHashSet<>();
        boolean inDocumentation = false;
        for (int i = 0; i < raw.size(); i++) {
            String text = raw.get(i).trim();
            if (inDocumentation) {
                if (text.startsWith("=cut")) {
                    inDocumentation = false;
                }
                continue;
            }
            if (raw.get(i).startsWith("=")) {
                inDocumentation = !text.startsWith("=cut");
                continue;
            }
            if (text.isEmpty() || text.startsWith("#")) {
                continue;
            }
            if (text.startsWith(PARAMETERS)) {
                for (String p : text.substring(PARAMETERS.length()).trim().split("\\s+")) {
                    if (!p.isEmpty()) {
                        parameters.add(p.toUpperCase());
                    }
                }
                continue;
            }
            lines.add(new SourceLine(i + 1, text));
        }
        return new RecipeSource(name, path, lines, parameters, modified);
    }
}
