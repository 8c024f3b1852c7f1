package io.caldera.core.execution;

import io.caldera.core.exception.FatalPipelineException;
import io.caldera.core.exception.PipelineAbortException;
import io.caldera.core.exception.RecipeFaultException;
import io.caldera.core.frame.Frame;
import io.caldera.core.frame.Group;
import io.caldera.core.recipe.CompiledRecipe;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Mutable state of one recipe execution: the scope stack, variables, the
/// last status and the parameters of primitives that have finished.
///
/// ### Variable lookup
/// `$name` and `${name}` resolve, in order, against:
/// 1. the open scopes, innermost first
/// 2. the recipe parameters
/// 3. built-in names: `file`, `raw`, `obsnum`, `utdate`, `recipe`, `group`, `nmembers`
///
/// `${hdr.KEY}` reads the frame header, `${_PRIMITIVE.key}` reads an argument a
/// finished primitive was called with, and `$$` is a literal dollar. An
/// unresolvable name is a syntax fault.
public class ExecutionState {

    private static final Pattern VARIABLE = Pattern.compile("\\$\\$|\\$\\{([^}]+)}|\\$(\\w+)");

    private final CompiledRecipe recipe;
    private final RecipeContext context;
    private final RunLog log;
    private final StatementRunner runner;
    private final Deque<Scope> scopes = new ArrayDeque<>();
    private final Map<String, Map<String, String>> primitiveParameters = new LinkedHashMap<>();
    private int lastStatus;
    private int programCounter;

    ExecutionState(CompiledRecipe recipe, RecipeContext context, RunLog log, StatementRunner runner) {
        this.recipe = recipe;
        this.context = context;
        this.log = log;
        this.runner = runner;
        scopes.push(new Scope(recipe.name(), Map.of()));
    }

    public CompiledRecipe recipe() {
        return recipe;
    }

    public RecipeContext context() {
        return context;
    }

    public Frame frame() {
        return context.frame();
    }

    public Group group() {
        return context.group();
    }

    public RunLog log() {
        return log;
    }

    /// @return the innermost scope name
    public String scope() {
        return scopes.peek().name();
    }

    void enterScope(String name, Map<String, String> arguments) {
        scopes.push(new Scope(name, arguments));
    }

    /// Closes the innermost scope and stores the arguments it was called with.
    void exitScope() {
        if (scopes.size() > 1) {
            Scope closed = scopes.pop();
            primitiveParameters.put(closed.name(), Collections.unmodifiableMap(closed.arguments()));
        }
    }

    int depth() {
        return scopes.size();
    }

    /// Sets a variable in the innermost scope.
    public void setVariable(String name, String value) {
        scopes.peek().variables().put(name, value);
    }

    /// @return the variable's value, or null if no scope, parameter or built-in defines it
    public String lookup(String name) {
        for (Scope scope : scopes) {
            String value = scope.variables().get(name);
            if (value != null) {
                return value;
            }
        }
        String parameter = context.parameters().get(name);
        if (parameter == null) {
            parameter = context.parameters().get(name.toUpperCase());
        }
        if (parameter != null) {
            return parameter;
        }
        return builtin(name);
    }

    private String builtin(String name) {
        Frame frame = context.frame();
        return switch (name) {
            case "file" -> frame.file();
            case "raw" -> frame.raw();
            case "obsnum" -> Integer.toString(frame.number());
            case "utdate" -> frame.utdate();
            case "recipe" -> recipe.name();
            case "group" -> context.group().file();
            case "nmembers" -> Integer.toString(context.group().numberOfMembers());
            default -> null;
        };
    }

    /// Replaces variable references in a text.
    ///
    /// @param text text containing `$name`, `${name}` references, not null
    /// @return the interpolated text, never null
    /// @throws RecipeFaultException if a name cannot be resolved
    /// @throws FatalPipelineException if a primitive's parameters are read before it ran
    public String interpolate(String text) throws FatalPipelineException {
        if (text.indexOf('$') < 0) {
            return text;
        }
        Matcher m = VARIABLE.matcher(text);
        StringBuilder out = new StringBuilder();
        while (m.find()) {
            String value;
            if (m.group().equals("$$")) {
                value = "$";
            } else {
                value = resolve(m.group(1) != null ? m.group(1).trim() : m.group(2));
            }
            m.appendReplacement(out, Matcher.quoteReplacement(value));
        }
        m.appendTail(out);
        return out.toString();
    }

    private String resolve(String name) throws FatalPipelineException {
        int dot = name.indexOf('.');
        if (dot > 0) {
            String qualifier = name.substring(0, dot);
            String key = name.substring(dot + 1);
            if (qualifier.equals("hdr")) {
                Object value = context.frame().headerValue(key);
                if (value == null) {
                    throw new RecipeFaultException("Header has no " + key, true);
                }
                return value.toString();
            }
            if (qualifier.startsWith("_")) {
                Map<String, String> stored = primitiveParameters.get(qualifier);
                if (stored == null) {
                    throw new FatalPipelineException(
                            "Parameters of primitive " + qualifier + " requested by " + scope()
                                    + " but " + qualifier + " has not run");
                }
                String value = stored.get(key);
                if (value == null) {
                    throw new RecipeFaultException(qualifier + " was not called with " + key, true);
                }
                return value;
            }
        }
        String value = lookup(name);
        if (value == null) {
            throw new RecipeFaultException("Undefined variable $" + name + " in " + scope(), true);
        }
        return value;
    }

    /// Runs another statement, e.g. the body of a guard.
    ///
    /// @param text statement text, already interpolated; `$` in it is taken literally
    /// @return the statement status
    /// @throws PipelineAbortException to unwind the run
    public int runStatement(String text) throws PipelineAbortException {
        return runner.run(text, this);
    }

    public int getLastStatus() {
        return lastStatus;
    }

    public void setLastStatus(int lastStatus) {
        this.lastStatus = lastStatus;
    }

    int getProgramCounter() {
        return programCounter;
    }

    void setProgramCounter(int programCounter) {
        this.programCounter = programCounter;
    }

    /// @return arguments of every finished primitive, by primitive name
    public Map<String, Map<String, String>> primitiveParameters() {
        return Collections.unmodifiableMap(primitiveParameters);
    }

    /// Dispatches interpolated statement text to handlers.
    @FunctionalInterface
    interface StatementRunner {
        int run(String text, ExecutionState state) throws PipelineAbortException;
    }

    private record Scope(String name, Map<String, String> arguments, Map<String, String> variables) {
        Scope(String name, Map<String, String> arguments) {
            this(name, new LinkedHashMap<>(arguments), new LinkedHashMap<>(arguments));
        }
    }
}
