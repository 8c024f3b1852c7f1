package io.caldera.core.execution;

import io.caldera.core.calibration.CalibrationIndex;
import io.caldera.core.calibration.NoSuitableCalibrationException;
import io.caldera.core.calibration.SearchMode;
import io.caldera.core.engine.EngineResponse;
import io.caldera.core.exception.FatalPipelineException;
import io.caldera.core.exception.PipelineAbortException;
import io.caldera.core.exception.RecipeFaultException;
import io.caldera.core.exception.TerminateRecipeException;
import io.caldera.core.frame.Frame;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Statements available to every recipe.
///
/// | Statement                       | Effect                                                  |
/// |---------------------------------|---------------------------------------------------------|
/// | `print text`                    | logs the text                                           |
/// | `warn text`                     | logs the text as a warning                              |
/// | `set var value`                 | sets a variable in the current scope                    |
/// | `uhdr KEY value`                | sets a derived header value on the frame                |
/// | `inout suffix`                  | sets `$in` and `$out` for a product-writing step         |
/// | `file name`                     | makes `name` the frame's working file                   |
/// | `nokeep name`                   | marks a file for removal after the frame                |
/// | `calib role [earlier]`          | selects a calibration and sets `$role`                  |
/// | `calib_column role column`      | reads a scalar calibration column into `$role_column`   |
/// | `index role [name]`             | files the working file (or `name`) as a calibration      |
/// | `exists var file`               | sets `$var` to 1 if the file is in the output directory  |
/// | `lastmember`                    | sets `$lastmember` to 1 if the frame ends its group      |
/// | `display [file]`                | sends the working file (or `file`) to the display        |
/// | `if a == b then statement`      | runs the statement when the comparison holds (`!=` too)  |
/// | `terminate [reason]`            | ends the recipe early                                   |
/// | `fail message`                  | fails the recipe for this frame                         |
/// | `fatal message`                 | aborts the whole run                                    |
final class BuiltinStatements {

    private static final Pattern GUARD = Pattern.compile("^(\\S+)\\s*(==|!=)\\s*(\\S+)\\s+then\\s+(.+)$");

    private BuiltinStatements() {}

    static void registerAll(StatementRegistry registry) {
        registry.register("print", BuiltinStatements::print);
        registry.register("warn", BuiltinStatements::warn);
        registry.register("set", BuiltinStatements::set);
        registry.register("uhdr", BuiltinStatements::uhdr);
        registry.register("inout", BuiltinStatements::inout);
        registry.register("file", BuiltinStatements::file);
        registry.register("nokeep", BuiltinStatements::nokeep);
        registry.register("calib", BuiltinStatements::calib);
        registry.register("calib_column", BuiltinStatements::calibColumn);
        registry.register("index", BuiltinStatements::index);
        registry.register("exists", BuiltinStatements::exists);
        registry.register("lastmember", BuiltinStatements::lastMember);
        registry.register("display", BuiltinStatements::display);
        registry.register("if", BuiltinStatements::guard);
        registry.register("terminate", BuiltinStatements::terminate);
        registry.register("fail", BuiltinStatements::fail);
        registry.register("fatal", BuiltinStatements::fatal);
    }

    private static int print(Statement statement, ExecutionState state) {
        state.log().info(statement.text());
        return EngineResponse.OK;
    }

    private static int warn(Statement statement, ExecutionState state) {
        state.log().warn(statement.text());
        return EngineResponse.OK;
    }

    private static int set(Statement statement, ExecutionState state) {
        String name = statement.argument(0);
        String value = statement.text().substring(name.length()).trim();
        state.setVariable(name, value);
        return EngineResponse.OK;
    }

    private static int uhdr(Statement statement, ExecutionState state) {
        String key = statement.argument(0);
        String value = statement.text().substring(key.length()).trim();
        state.frame().setDerived(key, value);
        return EngineResponse.OK;
    }

    private static int inout(Statement statement, ExecutionState state) {
        Frame.InOut names = state.frame().inout(statement.argument(0));
        state.setVariable("in", names.in());
        state.setVariable("out", names.out());
        return EngineResponse.OK;
    }

    private static int file(Statement statement, ExecutionState state) {
        state.frame().setFile(statement.argument(0));
        return EngineResponse.OK;
    }

    private static int nokeep(Statement statement, ExecutionState state) {
        state.frame().nokeep(statement.argument(0));
        return EngineResponse.OK;
    }

    private static int calib(Statement statement, ExecutionState state) {
        String role = statement.argument(0);
        SearchMode mode =
                statement.arguments().size() > 1 && "earlier".equalsIgnoreCase(statement.argument(1))
                        ? SearchMode.EARLIER
                        : SearchMode.NEAREST;
        try {
            String value =
                    state.context()
                            .calibration()
                            .select(role, state.frame().headerContext(), mode);
            state.setVariable(role, value);
            return EngineResponse.OK;
        } catch (NoSuitableCalibrationException e) {
            throw new RecipeFaultException(e.getMessage(), e);
        }
    }

    private static int calibColumn(Statement statement, ExecutionState state) {
        String role = statement.argument(0);
        String column = statement.argument(1);
        try {
            String value =
                    state.context()
                            .calibration()
                            .column(role, state.frame().headerContext(), column);
            state.setVariable(role + "_" + column.toLowerCase(), value);
            return EngineResponse.OK;
        } catch (NoSuitableCalibrationException e) {
            throw new RecipeFaultException(e.getMessage(), e);
        }
    }

    private static int index(Statement statement, ExecutionState state) {
        String role = statement.argument(0);
        String name =
                statement.arguments().size() > 1 ? statement.argument(1) : state.frame().file();
        try {
            CalibrationIndex index = state.context().calibration().getIndexes().index(role);
            index.add(name, state.frame().headerContext());
            state.context().calibration().bind(role, name);
            state.log().info("Filed " + name + " as the current " + role);
            return EngineResponse.OK;
        } catch (IOException | IllegalArgumentException | IllegalStateException e) {
            throw new RecipeFaultException("Unable to file " + name + " as " + role + ": " + e.getMessage(), e);
        }
    }

    private static int exists(Statement statement, ExecutionState state) {
        if (statement.arguments().size() < 2) {
            throw new RecipeFaultException("Usage: exists var file", true);
        }
        Path dir = state.context().outputDir();
        Path file = dir == null ? Path.of(statement.argument(1)) : dir.resolve(statement.argument(1));
        state.setVariable(statement.argument(0), Files.exists(file) ? "1" : "0");
        return EngineResponse.OK;
    }

    private static int lastMember(Statement statement, ExecutionState state) {
        state.setVariable("lastmember", state.group().isLastMember(state.frame()) ? "1" : "0");
        return EngineResponse.OK;
    }

    private static int display(Statement statement, ExecutionState state) {
        String file = statement.arguments().isEmpty() ? state.frame().file() : statement.argument(0);
        state.context().display().show(file, state.frame(), state.group());
        return EngineResponse.OK;
    }

    private static int guard(Statement statement, ExecutionState state) throws PipelineAbortException {
        Matcher m = GUARD.matcher(statement.text());
        if (!m.matches()) {
            throw new RecipeFaultException("Malformed guard: if " + statement.text(), true);
        }
        boolean equal = m.group(1).equals(m.group(3));
        boolean holds = m.group(2).equals("==") == equal;
        if (!holds) {
            return EngineResponse.OK;
        }
        return state.runStatement(m.group(4));
    }

    private static int terminate(Statement statement, ExecutionState state) {
        throw new TerminateRecipeException(statement.text().isEmpty() ? "Recipe terminated" : statement.text());
    }

    private static int fail(Statement statement, ExecutionState state) {
        throw new RecipeFaultException(statement.text().isEmpty() ? "Recipe failed" : statement.text());
    }

    private static int fatal(Statement statement, ExecutionState state) throws FatalPipelineException {
        throw new FatalPipelineException(statement.text().isEmpty() ? "Fatal error in recipe" : statement.text());
    }
}
