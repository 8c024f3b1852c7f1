package io.caldera.core.execution;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Logging context of one pipeline run.
///
/// Prefixes every message with the observation being processed and the
/// innermost primitive scope, so interleaved output from nested primitives
/// can be attributed:
///
/// ```
/// #12 [_DARK_SUBTRACT] Dark subtracted using dark_7
/// ```
///
/// One instance is created per run and handed to the compiler, executor and
/// orchestrator.
///
/// @implNote **Not thread-safe**. A run has a single thread of control.
public class RunLog {

    private final Logger logger;
    private final Deque<String> scopes = new ArrayDeque<>();
    private String framePrefix = "";
    private int warnings;
    private int errors;

    public RunLog(Logger logger) {
        this.logger = logger;
    }

    /// Creates a run log writing to the `io.caldera.core.execution.RunLog` logger.
    public static RunLog create() {
        return new RunLog(Logger.getLogger(RunLog.class.getName()));
    }

    /// Sets the observation number shown in front of each message.
    ///
    /// @param observationNumber observation number, or a negative value to clear it
    public void setObservation(int observationNumber) {
        framePrefix = observationNumber < 0 ? "" : "#" + observationNumber + " ";
    }

    public void enterScope(String scope) {
        scopes.push(scope);
    }

    public void exitScope() {
        if (!scopes.isEmpty()) {
            scopes.pop();
        }
    }

    /// Drops all open scopes; used when a recipe unwinds.
    public void resetScopes() {
        scopes.clear();
    }

    /// @return the innermost open scope, or empty string if none
    public String currentScope() {
        return scopes.isEmpty() ? "" : scopes.peek();
    }

    public void info(String message) {
        logger.info(format(message));
    }

    public void fine(String message) {
        logger.fine(format(message));
    }

    public void warn(String message) {
        warnings++;
        logger.warning(format(message));
    }

    public void error(String message) {
        errors++;
        logger.severe(format(message));
    }

    public void error(String message, Throwable cause) {
        errors++;
        logger.log(Level.SEVERE, format(message), cause);
    }

    public int getWarningCount() {
        return warnings;
    }

    public int getErrorCount() {
        return errors;
    }

    public Logger getLogger() {
        return logger;
    }

    String format(String message) {
        String scope = currentScope();
        return framePrefix + (scope.isEmpty() ? "" : "[" + scope + "] ") + message;
    }
}
