package io.caldera.core.recipe;

import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// A recipe with every primitive expanded and status checks injected.
///
/// @param name recipe name
/// @param steps flattened steps in execution order
/// @param parameters recipe parameter names declared by the recipe
/// @param sources every file read during compilation with its modification time
public record CompiledRecipe(
        String name, List<Step> steps, Set<String> parameters, Map<Path, FileTime> sources) {

    public CompiledRecipe {
        steps = List.copyOf(steps);
        parameters = Collections.unmodifiableSet(new LinkedHashSet<>(parameters));
        sources = Collections.unmodifiableMap(new LinkedHashMap<>(sources));
    }

    /// Numbered listing of the steps, one line each.
    ///
    /// @return the listing, never null
    public List<String> listing() {
        List<String> lines = new ArrayList<>();
        for (int i = 0; i < steps.size(); i++) {
            lines.add(listingLine(i));
        }
        return lines;
    }

    /// Listing of the steps around a faulting index, the fault marked with `>`.
    ///
    /// @param index faulting step index
    /// @param radius steps shown on each side
    /// @return the window, never null
    public List<String> window(int index, int radius) {
        List<String> lines = new ArrayList<>();
        int from = Math.max(0, index - radius);
        int to = Math.min(steps.size() - 1, index + radius);
        for (int i = from; i <= to; i++) {
            lines.add((i == index ? "> " : "  ") + listingLine(i));
        }
        return lines;
    }

    private String listingLine(int i) {
        Step step = steps.get(i);
        return String.format("%4d %s:%d  %s", i, step.scope(), step.line(), step.render());
    }
}
