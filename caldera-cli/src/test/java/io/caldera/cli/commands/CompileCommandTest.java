package io.caldera.cli.commands;

import static org.assertj.core.api.Assertions.assertThat;

import io.caldera.core.CalderaConfig;
import io.caldera.core.CalderaEnvironment;
import io.caldera.core.CalderaFactory;
import io.caldera.core.engine.stub.StubEngineLauncher;
import io.caldera.core.recipe.Step;
import io.caldera.serialization.RecipeJson;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CompileCommandTest extends BaseCommandTest {

    @TempDir Path tempDir;

    private CalderaEnvironment environment;
    private CompileCommand command;

    @BeforeEach
    void setUp() throws Exception {
        Path recipes = Files.createDirectories(tempDir.resolve("tree/recipes/generic"));
        Path primitives = Files.createDirectories(tempDir.resolve("tree/primitives/generic"));
        Files.write(recipes.resolve("REDUCE_DARK"), List.of("_DARK_SUBTRACT method=median", "print done"));
        Files.write(
                primitives.resolve("_DARK_SUBTRACT"),
                List.of("kappa.invoke(\"darksub\", \"in=$file method=$method\")"));
        Files.write(recipes.resolve("LOOPING"), List.of("_SELF_"));
        Files.write(primitives.resolve("_SELF_"), List.of("_SELF_"));

        environment = CalderaFactory.builder()
                .config(CalderaConfig.builder()
                        .outputDir(tempDir.resolve("reduced"))
                        .recipeRoot(tempDir.resolve("tree"))
                        .build())
                .headerReader(file -> Map.of())
                .engineLaunchers(List.of(new StubEngineLauncher(true)))
                .build();

        command = new CompileCommand();
        injectField(command, "environment", environment);
        plainOutput(command);
    }

    @AfterEach
    void tearDown() {
        environment.close();
    }

    @Test
    void shouldPrintCompiledStepsAsJson() throws Exception {
        // GIVEN
        injectField(command, "recipeName", "REDUCE_DARK");

        // WHEN
        int exitCode = command.call();

        // THEN
        assertThat(exitCode).isZero();
        List<Step> steps = RecipeJson.stepsFromJson(out());
        assertThat(steps).hasSize(6);
        assertThat(steps.get(2)).isInstanceOf(Step.EngineCall.class);
        assertThat(steps.get(3)).isInstanceOf(Step.EngineStatusCheck.class);
    }

    @Test
    void shouldPrintNumberedListing() throws Exception {
        injectField(command, "recipeName", "REDUCE_DARK");
        injectField(command, "listing", true);

        int exitCode = command.call();

        assertThat(exitCode).isZero();
        assertThat(out().lines().toList()).hasSize(6);
        assertThat(out()).contains("_DARK_SUBTRACT:1").contains("REDUCE_DARK:2");
    }

    @Test
    void shouldFailForUnknownRecipe() throws Exception {
        injectField(command, "recipeName", "NO_SUCH_RECIPE");

        int exitCode = command.call();

        assertThat(exitCode).isEqualTo(1);
        assertThat(err()).contains("Recipe not found:");
        assertThat(out()).isEmpty();
    }

    @Test
    void shouldFailForRecursivePrimitive() throws Exception {
        injectField(command, "recipeName", "LOOPING");

        int exitCode = command.call();

        assertThat(exitCode).isEqualTo(1);
        assertThat(err()).contains("Compilation failed:");
    }
}
