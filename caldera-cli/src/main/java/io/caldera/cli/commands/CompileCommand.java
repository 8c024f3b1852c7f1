package io.caldera.cli.commands;

import io.caldera.core.CalderaEnvironment;
import io.caldera.core.exception.RecipeCompileException;
import io.caldera.core.exception.RecipeNotFoundException;
import io.caldera.core.execution.RunLog;
import io.caldera.core.recipe.CompiledRecipe;
import io.caldera.serialization.RecipeJson;
import jakarta.inject.Inject;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/// CLI command that expands a recipe without running it.
///
/// Prints the compiled step list as JSON, or as a numbered listing with
/// `--listing`. Useful for checking primitive search paths and the status
/// checks the compiler injects.
///
/// ### Usage
/// ```bash
/// caldera compile [--mode OBSMODE] [--listing] <recipe>
/// ```
@Command(name = "compile", description = "Expand a recipe and print its steps")
class CompileCommand extends CalderaCommand {

    @Parameters(index = "0", description = "Recipe name")
    private String recipeName;

    @Option(names = "--mode", description = "Observation mode used to choose between recipe variants")
    private String mode = "";

    @Option(names = "--listing", description = "Print a numbered listing instead of JSON")
    private boolean listing = false;

    @Inject CalderaEnvironment environment;

    @Override
    protected int execute() {
        CompiledRecipe recipe;
        try {
            recipe = environment.createCompiler(RunLog.create()).compile(recipeName, mode);
        } catch (RecipeNotFoundException e) {
            printError("Recipe not found:", e.getMessage());
            return 1;
        } catch (RecipeCompileException e) {
            printError("Compilation failed:", e.getMessage());
            return 1;
        }

        if (listing) {
            recipe.listing().forEach(System.out::println);
        } else {
            System.out.println(RecipeJson.toJson(recipe));
        }
        return 0;
    }
}
