package io.caldera.core.recipe;

import io.caldera.core.exception.RecipeCompileException;
import io.caldera.core.exception.RecipeNotFoundException;
import io.caldera.core.execution.RunLog;
import io.caldera.core.recipe.Step.ArgBind;
import io.caldera.core.recipe.Step.EngineCall;
import io.caldera.core.recipe.Step.EngineStatusCheck;
import io.caldera.core.recipe.Step.RawStatement;
import io.caldera.core.recipe.Step.ScopeEnter;
import io.caldera.core.recipe.Step.ScopeExit;
import io.caldera.core.recipe.Step.StatusCheck;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Expands a recipe into a flat, checked step sequence.
///
/// ### Line classification
/// | Line                                   | Becomes                                  |
/// |----------------------------------------|------------------------------------------|
/// | `_NAME key=value ...`                  | {@link ArgBind}, {@link ScopeEnter}, the expanded body, {@link ScopeExit} |
/// | `engine.invoke("op", "args")`          | {@link EngineCall} followed by {@link EngineStatusCheck} |
/// | `var = engine.invoke("op", "args")`    | {@link EngineCall} assigning `var`, no check |
/// | `STATUS = statement`                   | {@link RawStatement} setting the status, then {@link StatusCheck} |
/// | anything else                          | {@link RawStatement}                     |
///
/// Expansion is depth first. A primitive that appears in its own call path is a
/// cycle and is reported with the path; nesting deeper than the depth limit is
/// reported the same way. Compiling the same sources twice yields equal step
/// sequences.
///
/// Primitive sources are cached by path and re-read when the file's
/// modification time changes.
public class RecipeCompiler {

    public static final int DEFAULT_MAX_DEPTH = 10;

    private static final Pattern PRIMITIVE = Pattern.compile("^(_\\w+)(?:\\s+(.*))?$");
    private static final Pattern ENGINE_CALL =
            Pattern.compile("^(?:(\\w+)\\s*=\\s*)?(\\w+)\\.invoke\\((.*)\\)\\s*;?$");
    private static final Pattern QUOTED = Pattern.compile("\"((?:[^\"\\\\]|\\\\.)*)\"");
    private static final Pattern STATUS_LINE = Pattern.compile("^STATUS\\s*=\\s*(.+)$");
    private static final Pattern ARGUMENT = Pattern.compile("(\\w+)=(\"[^\"]*\"|\\S*)");

    private final RecipeLocator locator;
    private final RunLog log;
    private final int maxDepth;
    private final Map<Path, RecipeSource> sourceCache = new ConcurrentHashMap<>();

    public RecipeCompiler(RecipeLocator locator, RunLog log) {
        this(locator, log, DEFAULT_MAX_DEPTH);
    }

    /// @param locator finds recipe and primitive files, not null
    /// @param log run log, not null
    /// @param maxDepth deepest allowed primitive nesting, positive
    public RecipeCompiler(RecipeLocator locator, RunLog log, int maxDepth) {
        this.locator = locator;
        this.log = log;
        this.maxDepth = maxDepth;
    }

    /// Compiles a recipe.
    ///
    /// @param recipeName recipe name, not null
    /// @param observationMode frame observation mode for variant selection, may be empty
    /// @return the compiled recipe, never null
    /// @throws RecipeNotFoundException if the recipe or one of its primitives cannot be found
    /// @throws RecipeCompileException on a cycle, the depth limit, a malformed
    ///         invocation or an unreadable file
    public CompiledRecipe compile(String recipeName, String observationMode)
            throws RecipeNotFoundException, RecipeCompileException {
        List<String> path = new ArrayList<>();
        path.add(recipeName);
        Path file = locator.locateRecipe(recipeName, observationMode);
        RecipeSource source = source(recipeName, file, path);

        Map<Path, FileTime> sources = new LinkedHashMap<>();
        sources.put(file, source.modified());
        List<Step> steps = new ArrayList<>();
        expand(source, steps, path, observationMode, sources);

        log.fine("Compiled " + recipeName + " into " + steps.size() + " steps from " + sources.size() + " files");
        return new CompiledRecipe(recipeName, steps, source.parameters(), sources);
    }

    private void expand(
            RecipeSource source,
            List<Step> out,
            List<String> path,
            String mode,
            Map<Path, FileTime> sources)
            throws RecipeNotFoundException, RecipeCompileException {
        String scope = source.name();
        for (SourceLine line : source.lines()) {
            Matcher primitive = PRIMITIVE.matcher(line.text());
            if (primitive.matches()) {
                expandPrimitive(primitive.group(1), primitive.group(2), scope, line, out, path, mode, sources);
                continue;
            }
            Matcher engine = ENGINE_CALL.matcher(line.text());
            if (engine.matches()) {
                emitEngineCall(engine, scope, line, out);
                continue;
            }
            Matcher status = STATUS_LINE.matcher(line.text());
            if (status.matches()) {
                out.add(new RawStatement(status.group(1).trim(), true, scope, line.number()));
                out.add(new StatusCheck(scope, line.number()));
                continue;
            }
            out.add(new RawStatement(line.text(), false, scope, line.number()));
        }
    }

    private void expandPrimitive(
            String name,
            String argumentText,
            String caller,
            SourceLine line,
            List<Step> out,
            List<String> path,
            String mode,
            Map<Path, FileTime> sources)
            throws RecipeNotFoundException, RecipeCompileException {
        if (path.contains(name)) {
            List<String> cycle = new ArrayList<>(path);
            cycle.add(name);
            throw new RecipeCompileException(
                    "Primitive " + name + " invokes itself: " + String.join(" -> ", cycle), cycle);
        }
        if (path.size() > maxDepth) {
            List<String> deep = new ArrayList<>(path);
            deep.add(name);
            throw new RecipeCompileException(
                    "Primitives nested deeper than " + maxDepth + ": " + String.join(" -> ", deep), deep);
        }
        Map<String, String> arguments = parseArguments(argumentText, caller, line, path);

        Path file = locator.locatePrimitive(name, mode);
        path.add(name);
        RecipeSource body = source(name, file, path);
        sources.put(file, body.modified());

        out.add(new ArgBind(name, arguments, line.number()));
        out.add(new ScopeEnter(name, caller, line.number()));
        expand(body, out, path, mode, sources);
        out.add(new ScopeExit(name, line.number()));
        path.remove(path.size() - 1);
    }

    private static void emitEngineCall(Matcher engine, String scope, SourceLine line, List<Step> out) {
        String assignTo = engine.group(1);
        String engineName = engine.group(2);
        List<String> quoted = new ArrayList<>();
        Matcher q = QUOTED.matcher(engine.group(3));
        while (q.find()) {
            quoted.add(q.group(1).replace("\\\"", "\""));
        }
        String operation = quoted.size() > 0 ? quoted.get(0) : "(Unknown)";
        String arguments = quoted.size() > 1 ? quoted.get(1) : "";
        out.add(new EngineCall(engineName, operation, arguments, assignTo, scope, line.number()));
        if (assignTo == null) {
            out.add(new EngineStatusCheck(
                    engineName,
                    operation,
                    arguments.isEmpty() ? "(No arguments)" : arguments,
                    scope,
                    line.number()));
        }
    }

    /// Parses `key=value` pairs; a value may be double quoted to contain blanks.
    static Map<String, String> parseArguments(
            String text, String caller, SourceLine line, List<String> path)
            throws RecipeCompileException {
        Map<String, String> arguments = new LinkedHashMap<>();
        if (text == null || text.isBlank()) {
            return arguments;
        }
        Matcher m = ARGUMENT.matcher(text);
        int consumed = 0;
        while (m.find()) {
            if (!text.substring(consumed, m.start()).isBlank()) {
                break;
            }
            String value = m.group(2);
            if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
                value = value.substring(1, value.length() - 1);
            }
            arguments.put(m.group(1), value);
            consumed = m.end();
        }
        if (!text.substring(consumed).isBlank()) {
            throw new RecipeCompileException(
                    "Malformed primitive arguments at " + caller + " line " + line.number() + ": "
                            + text.substring(consumed).trim(),
                    path);
        }
        return arguments;
    }

    private RecipeSource source(String name, Path file, List<String> path)
            throws RecipeCompileException {
        try {
            FileTime modified = Files.getLastModifiedTime(file);
            RecipeSource cached = sourceCache.get(file);
            if (cached != null && modified.equals(cached.modified())) {
                return cached;
            }
            RecipeSource source = RecipeSource.read(name, file);
            sourceCache.put(file, source);
            return source;
        } catch (IOException e) {
            throw new RecipeCompileException("Unable to read " + file + ": " + e.getMessage(), path, e);
        }
    }

    public RecipeLocator getLocator() {
        return locator;
    }
}
