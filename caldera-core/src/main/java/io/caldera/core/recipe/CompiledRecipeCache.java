package io.caldera.core.recipe;

import io.caldera.core.exception.RecipeCompileException;
import io.caldera.core.exception.RecipeNotFoundException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/// Compiled recipes keyed by recipe name and observation mode.
///
/// An entry is reused while none of the files it was compiled from has changed
/// on disk, so editing a primitive during a run takes effect on the next frame.
public class CompiledRecipeCache {

    private static final Logger logger = Logger.getLogger(CompiledRecipeCache.class.getName());

    private final RecipeCompiler compiler;
    private final Map<String, CompiledRecipe> cache = new ConcurrentHashMap<>();

    public CompiledRecipeCache(RecipeCompiler compiler) {
        this.compiler = compiler;
    }

    /// Returns the compiled recipe, compiling it if absent or stale.
    ///
    /// @param recipeName recipe name, not null
    /// @param observationMode observation mode for variant selection, may be empty
    /// @return the compiled recipe, never null
    /// @throws RecipeNotFoundException if a source file cannot be found
    /// @throws RecipeCompileException if compilation fails
    public CompiledRecipe get(String recipeName, String observationMode)
            throws RecipeNotFoundException, RecipeCompileException {
        String key = recipeName + "|" + (observationMode == null ? "" : observationMode);
        CompiledRecipe cached = cache.get(key);
        if (cached != null && !isStale(cached)) {
            return cached;
        }
        if (cached != null) {
            logger.info("Sources of " + recipeName + " changed, recompiling");
        }
        CompiledRecipe compiled = compiler.compile(recipeName, observationMode);
        cache.put(key, compiled);
        return compiled;
    }

    public void invalidate() {
        cache.clear();
    }

    public int size() {
        return cache.size();
    }

    private static boolean isStale(CompiledRecipe recipe) {
        for (Map.Entry<Path, FileTime> source : recipe.sources().entrySet()) {
            try {
                if (!Files.getLastModifiedTime(source.getKey()).equals(source.getValue())) {
                    return true;
                }
            } catch (IOException e) {
                logger.fine("Cannot stat " + source.getKey() + ": " + e.getMessage());
                return true;
            }
        }
        return false;
    }
}
