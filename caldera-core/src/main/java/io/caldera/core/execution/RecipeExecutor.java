package io.caldera.core.execution;

import io.caldera.core.engine.AlgorithmEngine;
import io.caldera.core.engine.EngineResponse;
import io.caldera.core.exception.EngineException;
import io.caldera.core.exception.PipelineAbortException;
import io.caldera.core.exception.RecipeFaultException;
import io.caldera.core.exception.TerminateRecipeException;
import io.caldera.core.exception.UserAbortException;
import io.caldera.core.frame.Frame;
import io.caldera.core.recipe.CompiledRecipe;
import io.caldera.core.recipe.Step;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Runs a compiled recipe against one frame.
///
/// Steps are interpreted in order with a program counter. Statements are
/// interpolated, split into a keyword and arguments and dispatched through the
/// {@link StatementRegistry}; engine calls go to the context's {@link
/// io.caldera.core.engine.EngineSet}.
///
/// ### Contracts
/// - **Postcondition**: returns `Completed`, `Terminated` or `Aborted`, never null
/// - **Postcondition**: a frame whose recipe ends in `ERROR` or `BAD_ENGINE` is marked bad
/// - **Invariant**: an engine that reports `BAD_ENGINE` or cannot be reached is
///   removed from the engine set before the recipe returns
///
/// ### Fault handling
/// | Raised                             | Outcome                         |
/// |------------------------------------|---------------------------------|
/// | {@link TerminateRecipeException}   | `Terminated`                    |
/// | {@link RecipeFaultException}       | `Completed(ERROR)`              |
/// | {@link PipelineAbortException}     | `Aborted`, rethrown by caller   |
/// | any other runtime exception        | `Completed(ERROR)`, logged      |
///
/// @implNote **Not thread-safe**. Use one executor per run.
public class RecipeExecutor {

    private static final int FAULT_WINDOW = 3;

    private final StatementRegistry statements;
    private final RunLog log;
    private final RecipeListener listener;

    public RecipeExecutor(StatementRegistry statements, RunLog log, RecipeListener listener) {
        this.statements = Objects.requireNonNull(statements, "statements");
        this.log = Objects.requireNonNull(log, "log");
        this.listener = listener == null ? RecipeListener.NOOP : listener;
    }

    public RecipeExecutor(RunLog log) {
        this(new DefaultStatementRegistry(), log, RecipeListener.NOOP);
    }

    /// Executes a recipe.
    ///
    /// @param recipe compiled recipe, not null
    /// @param context frame, group and services for this execution, not null
    /// @return the outcome, never null
    /// @apiNote **Side effects**: marks the frame bad on failure, removes failed
    ///          engines and deletes the frame's raw link from the output directory
    public ExecutionOutcome execute(CompiledRecipe recipe, RecipeContext context) {
        Frame frame = context.frame();
        Instant start = Instant.now();
        listener.onRecipeStart(recipe.name(), frame);
        log.info("Recipe: " + recipe.name());

        ExecutionState state = new ExecutionState(recipe, context, log, this::dispatch);
        ExecutionOutcome outcome = run(state);

        RecipeStatus status = statusOf(outcome);
        if (status == RecipeStatus.ERROR || status == RecipeStatus.BAD_ENGINE) {
            frame.markBad();
        }
        Duration elapsed = Duration.between(start, Instant.now());
        log.info(String.format(
                "Recipe %s finished with status %s in %.2f s",
                recipe.name(), status, elapsed.toMillis() / 1000.0));
        listener.onRecipeComplete(recipe.name(), frame, status);
        return outcome;
    }

    private ExecutionOutcome run(ExecutionState state) {
        List<Step> steps = state.recipe().steps();
        Map<String, String> pending = Map.of();
        try {
            for (int pc = 0; pc < steps.size(); pc++) {
                state.setProgramCounter(pc);
                if (Thread.currentThread().isInterrupted()) {
                    throw new UserAbortException("Interrupted while running " + state.recipe().name());
                }
                Step step = steps.get(pc);
                RecipeStatus failed = null;
                if (step instanceof Step.RawStatement raw) {
                    int result = runStatement(raw.text(), state);
                    if (raw.setsStatus()) {
                        state.setLastStatus(result);
                    }
                } else if (step instanceof Step.EngineCall call) {
                    failed = callEngine(call, state);
                } else if (step instanceof Step.EngineStatusCheck check) {
                    failed = checkEngine(check, state);
                } else if (step instanceof Step.StatusCheck) {
                    if (state.getLastStatus() != EngineResponse.OK) {
                        log.error("Error in pipeline, status " + state.getLastStatus());
                        failed = RecipeStatus.ERROR;
                    }
                } else if (step instanceof Step.ArgBind bind) {
                    Map<String, String> values = new LinkedHashMap<>();
                    for (Map.Entry<String, String> arg : bind.arguments().entrySet()) {
                        values.put(arg.getKey(), unquote(state.interpolate(arg.getValue())));
                    }
                    pending = values;
                } else if (step instanceof Step.ScopeEnter enter) {
                    state.enterScope(enter.scope(), pending);
                    pending = Map.of();
                    log.enterScope(enter.scope());
                    listener.onPrimitiveEnter(enter.scope(), enter.caller());
                } else if (step instanceof Step.ScopeExit exit) {
                    state.exitScope();
                    log.exitScope();
                    listener.onPrimitiveExit(exit.scope());
                }
                if (failed != null) {
                    return new ExecutionOutcome.Completed(failed);
                }
            }
            return new ExecutionOutcome.Completed(RecipeStatus.OK);
        } catch (TerminateRecipeException e) {
            log.info("Recipe terminated: " + e.getMessage());
            return new ExecutionOutcome.Terminated(e.getMessage());
        } catch (PipelineAbortException e) {
            log.error(e.getMessage());
            return new ExecutionOutcome.Aborted(e);
        } catch (RecipeFaultException e) {
            log.error(e.getMessage());
            if (e.isSyntax()) {
                for (String line : state.recipe().window(state.getProgramCounter(), FAULT_WINDOW)) {
                    log.error(line);
                }
            }
            return new ExecutionOutcome.Completed(RecipeStatus.ERROR);
        } catch (RuntimeException e) {
            log.error("RECIPE ERROR: " + e, e);
            return new ExecutionOutcome.Completed(RecipeStatus.ERROR);
        } finally {
            log.resetScopes();
            removeRawLink(state.context());
        }
    }

    private RecipeStatus callEngine(Step.EngineCall call, ExecutionState state)
            throws PipelineAbortException {
        String arguments = state.interpolate(call.arguments());
        EngineResponse response;
        try {
            AlgorithmEngine engine = state.context().engines().get(call.engine());
            response = engine.invoke(call.operation(), arguments);
        } catch (EngineException e) {
            log.error("Engine " + call.engine() + " failed on " + call.operation() + ": " + e.getMessage());
            state.context().engines().remove(call.engine());
            listener.onEngineCall(call.engine(), call.operation(), arguments, null);
            state.setLastStatus(EngineResponse.BAD_ENGINE);
            return RecipeStatus.BAD_ENGINE;
        }
        if (response.status() == EngineResponse.BAD_ENGINE) {
            state.context().engines().remove(call.engine());
        }
        state.setLastStatus(response.status());
        if (call.assignTo() != null) {
            state.setVariable(call.assignTo(), Integer.toString(response.status()));
        }
        listener.onEngineCall(call.engine(), call.operation(), arguments, response);
        return null;
    }

    private RecipeStatus checkEngine(Step.EngineStatusCheck check, ExecutionState state) {
        int status = state.getLastStatus();
        if (status == EngineResponse.OK) {
            return null;
        }
        log.error(String.format(
                "%s: %s %s - status %d", check.engine(), check.operation(), check.arguments(), status));
        return status == EngineResponse.BAD_ENGINE ? RecipeStatus.BAD_ENGINE : RecipeStatus.ERROR;
    }

    /// Interpolates a statement and dispatches it to its handler.
    int runStatement(String text, ExecutionState state) throws PipelineAbortException {
        return dispatch(state.interpolate(text), state);
    }

    /// Dispatches statement text that has already been interpolated.
    int dispatch(String text, ExecutionState state) throws PipelineAbortException {
        String line = text.trim();
        if (line.isEmpty()) {
            return EngineResponse.OK;
        }
        String[] words = line.split("\\s+");
        String keyword = words[0];
        String rest = line.substring(keyword.length()).trim();
        StatementHandler handler = statements.getHandler(keyword)
                .orElseThrow(() -> new RecipeFaultException("Unknown statement: " + keyword, true));
        List<String> arguments = Arrays.asList(words).subList(1, words.length);
        return handler.execute(new Statement(keyword, rest, arguments), state);
    }

    private void removeRawLink(RecipeContext context) {
        Path inputDir = context.inputDir();
        Path outputDir = context.outputDir();
        if (inputDir == null || outputDir == null || inputDir.equals(outputDir)) {
            return;
        }
        context.frame().rawLink().ifPresent(link -> {
            try {
                Files.deleteIfExists(link);
            } catch (IOException e) {
                log.warn("Could not remove link " + link + ": " + e.getMessage());
            }
        });
    }

    private static String unquote(String value) {
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }

    private static RecipeStatus statusOf(ExecutionOutcome outcome) {
        if (outcome instanceof ExecutionOutcome.Completed completed) {
            return completed.status();
        }
        if (outcome instanceof ExecutionOutcome.Aborted aborted) {
            return aborted.cause().statusCode() == RecipeStatus.USER_ABORT.code()
                    ? RecipeStatus.USER_ABORT
                    : RecipeStatus.FATAL;
        }
        return RecipeStatus.TERMINATED;
    }
}
