package io.caldera.core.recipe;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.StringJoiner;

/// One instruction of a compiled recipe.
///
/// ### Permitted Subtypes
/// - {@link RawStatement} - a statement run by a registered handler
/// - {@link EngineCall} - a request to an algorithm engine
/// - {@link EngineStatusCheck} - fails the recipe if the preceding engine call was not OK
/// - {@link StatusCheck} - fails the recipe if the last status is not OK
/// - {@link ArgBind} - binds a primitive's arguments before its scope opens
/// - {@link ScopeEnter} / {@link ScopeExit} - bracket an expanded primitive body
///
/// Every step carries the scope it runs in (recipe or primitive name) and the
/// source line it came from, for error attribution.
public sealed interface Step {

    /// @return the recipe or primitive the step belongs to
    String scope();

    /// @return 1-based source line in the scope's file
    int line();

    /// @return a one-line rendering used in listings and fault windows
    String render();

    /// A statement interpreted by a registered statement handler.
    ///
    /// @param text the statement text, variables not yet interpolated
    /// @param setsStatus `true` when the statement result becomes the last status
    /// @param scope owning recipe or primitive
    /// @param line source line
    record RawStatement(String text, boolean setsStatus, String scope, int line) implements Step {
        @Override
        public String render() {
            return setsStatus ? "STATUS = " + text : text;
        }
    }

    /// A request dispatched to an algorithm engine.
    ///
    /// @param engine engine name
    /// @param operation operation requested from the engine
    /// @param arguments argument string, variables not yet interpolated
    /// @param assignTo variable receiving the status, or null when the call is checked automatically
    /// @param scope owning recipe or primitive
    /// @param line source line
    record EngineCall(
            String engine,
            String operation,
            String arguments,
            String assignTo,
            String scope,
            int line)
            implements Step {
        @Override
        public String render() {
            String call = engine + ".invoke(\"" + operation + "\", \"" + arguments + "\")";
            return assignTo == null ? call : assignTo + " = " + call;
        }
    }

    /// Generated after an unassigned engine call.
    ///
    /// @param engine engine name, for diagnostics
    /// @param operation operation name, for diagnostics
    /// @param arguments argument string, for diagnostics
    /// @param scope owning recipe or primitive
    /// @param line source line of the checked call
    record EngineStatusCheck(
            String engine, String operation, String arguments, String scope, int line)
            implements Step {
        @Override
        public String render() {
            return "check status of " + engine + " " + operation;
        }
    }

    /// Generated after a statement that sets the last status.
    ///
    /// @param scope owning recipe or primitive
    /// @param line source line of the checked statement
    record StatusCheck(String scope, int line) implements Step {
        @Override
        public String render() {
            return "check status";
        }
    }

    /// Binds a primitive's arguments; values are interpolated at run time.
    ///
    /// @param scope the primitive receiving the arguments
    /// @param arguments argument name to raw value, in call order
    /// @param line source line of the invocation in the caller
    record ArgBind(String scope, Map<String, String> arguments, int line) implements Step {
        public ArgBind {
            arguments = Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
        }

        @Override
        public String render() {
            StringJoiner joined = new StringJoiner(" ", "args " + scope + " ", "");
            arguments.forEach((k, v) -> joined.add(k + "=" + v));
            return joined.toString();
        }
    }

    /// Opens the lexical scope of an expanded primitive body.
    ///
    /// @param scope the primitive name
    /// @param caller the recipe or primitive that invoked it
    /// @param line source line of the invocation in the caller
    record ScopeEnter(String scope, String caller, int line) implements Step {
        @Override
        public String render() {
            return "enter " + scope;
        }
    }

    /// Closes the scope opened by the matching {@link ScopeEnter}.
    ///
    /// @param scope the primitive name
    /// @param line source line of the invocation in the caller
    record ScopeExit(String scope, int line) implements Step {
        @Override
        public String render() {
            return "exit " + scope;
        }
    }
}
