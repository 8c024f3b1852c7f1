package io.caldera.core.recipe;

import io.caldera.core.exception.RecipeNotFoundException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/// Finds recipe and primitive files on their search paths.
///
/// ### Search order
/// 1. Override directories, first match wins
/// 2. For primitives, directories from `CALDERA_PRIMITIVE_DIR`
/// 3. The instrument directories
///
/// When several instrument directories hold the same name, a match in a
/// `general` directory is discarded in favour of any other, a directory named
/// after the instrument wins, and otherwise the directory named after the
/// frame's observation mode is used. If none of those decide, the first match
/// in search order is taken.
public class RecipeLocator {

    /// Environment variable with extra primitive directories, colon separated.
    public static final String PRIMITIVE_DIR_ENV = "CALDERA_PRIMITIVE_DIR";

    static final String GENERAL = "general";

    private static final Logger logger = Logger.getLogger(RecipeLocator.class.getName());

    private final List<Path> recipeOverrides;
    private final List<Path> primitiveOverrides;
    private final List<Path> recipeDirs;
    private final List<Path> primitiveDirs;
    private final String instrument;

    /// @param recipeOverrides directories searched first for recipes, not null
    /// @param primitiveOverrides directories searched first for primitives, not null
    /// @param recipeDirs instrument recipe directories, not null
    /// @param primitiveDirs instrument primitive directories, not null
    /// @param instrument instrument name, not null
    public RecipeLocator(
            List<Path> recipeOverrides,
            List<Path> primitiveOverrides,
            List<Path> recipeDirs,
            List<Path> primitiveDirs,
            String instrument) {
        this.recipeOverrides = List.copyOf(recipeOverrides);
        this.primitiveOverrides = List.copyOf(primitiveOverrides);
        this.recipeDirs = List.copyOf(recipeDirs);
        this.primitiveDirs = List.copyOf(primitiveDirs);
        this.instrument = instrument;
    }

    /// Splits a colon separated directory list, ignoring empty elements.
    ///
    /// @param value the list, may be null
    /// @return the directories, never null
    public static List<Path> splitPath(String value) {
        List<Path> dirs = new ArrayList<>();
        if (value == null) {
            return dirs;
        }
        for (String element : value.split(":")) {
            if (!element.isBlank()) {
                dirs.add(Path.of(element.trim()));
            }
        }
        return dirs;
    }

    /// @param name recipe name, not null
    /// @param observationMode frame observation mode for variant selection, may be empty
    /// @return the recipe file, never null
    /// @throws RecipeNotFoundException if no directory holds the recipe
    public Path locateRecipe(String name, String observationMode) throws RecipeNotFoundException {
        return locate(name, recipeOverrides, recipeDirs, observationMode);
    }

    /// @param name primitive name, not null
    /// @param observationMode frame observation mode for variant selection, may be empty
    /// @return the primitive file, never null
    /// @throws RecipeNotFoundException if no directory holds the primitive
    public Path locatePrimitive(String name, String observationMode)
            throws RecipeNotFoundException {
        return locate(name, primitiveOverrides, primitiveDirs, observationMode);
    }

    private Path locate(String name, List<Path> overrides, List<Path> dirs, String mode)
            throws RecipeNotFoundException {
        for (Path dir : overrides) {
            Path candidate = dir.resolve(name);
            if (Files.isRegularFile(candidate)) {
                logger.fine("Using override " + candidate);
                return candidate;
            }
        }
        List<Path> matches = new ArrayList<>();
        for (Path dir : dirs) {
            Path candidate = dir.resolve(name);
            if (Files.isRegularFile(candidate)) {
                matches.add(candidate);
            }
        }
        if (matches.isEmpty()) {
            List<Path> searched = new ArrayList<>(overrides);
            searched.addAll(dirs);
            throw new RecipeNotFoundException(name, searched);
        }
        return choose(matches, mode);
    }

    private Path choose(List<Path> matches, String mode) {
        if (matches.size() == 1) {
            return matches.get(0);
        }
        List<Path> specific = new ArrayList<>();
        for (Path match : matches) {
            if (!GENERAL.equalsIgnoreCase(dirName(match))) {
                specific.add(match);
            }
        }
        if (specific.isEmpty()) {
            return matches.get(0);
        }
        for (Path match : specific) {
            if (dirName(match).equalsIgnoreCase(instrument)) {
                return match;
            }
        }
        if (mode != null && !mode.isBlank()) {
            for (Path match : specific) {
                if (dirName(match).equalsIgnoreCase(mode)) {
                    return match;
                }
            }
        }
        logger.fine("Ambiguous match " + specific + ", using the first");
        return specific.get(0);
    }

    private static String dirName(Path file) {
        Path parent = file.getParent();
        return parent == null || parent.getFileName() == null ? "" : parent.getFileName().toString();
    }

    public List<Path> getRecipeOverrides() {
        return recipeOverrides;
    }

    public List<Path> getPrimitiveOverrides() {
        return primitiveOverrides;
    }
}
