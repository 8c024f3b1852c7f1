package io.caldera.core.recipe;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

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
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RecipeCompilerTest {

    @TempDir Path tempDir;

    private Path recipes;
    private Path primitives;
    private RecipeCompiler compiler;

    @BeforeEach
    void setUp() throws Exception {
        recipes = Files.createDirectories(tempDir.resolve("recipes/generic"));
        primitives = Files.createDirectories(tempDir.resolve("primitives/generic"));
        RecipeLocator locator =
                new RecipeLocator(List.of(), List.of(), List.of(recipes), List.of(primitives), "generic");
        compiler = new RecipeCompiler(locator, RunLog.create(), 3);
    }

    @Test
    void shouldExpandPrimitiveBetweenArgumentBindAndScopeMarkers() throws Exception {
        // GIVEN
        write(recipes, "REDUCE_DARK", "# reduce a dark", "_DARK_SUBTRACT method=median", "print done");
        write(primitives, "_DARK_SUBTRACT", "kappa.invoke(\"darksub\", \"in=$file method=$method\")");

        // WHEN
        CompiledRecipe compiled = compiler.compile("REDUCE_DARK", "");

        // THEN
        List<Step> steps = compiled.steps();
        assertThat(steps).hasSize(6);
        assertThat(steps.get(0)).isEqualTo(new ArgBind("_DARK_SUBTRACT", Map.of("method", "median"), 2));
        assertThat(steps.get(1)).isEqualTo(new ScopeEnter("_DARK_SUBTRACT", "REDUCE_DARK", 2));
        assertThat(steps.get(2))
                .isEqualTo(new EngineCall("kappa", "darksub", "in=$file method=$method", null, "_DARK_SUBTRACT", 1));
        assertThat(steps.get(3)).isInstanceOf(EngineStatusCheck.class);
        assertThat(steps.get(4)).isEqualTo(new ScopeExit("_DARK_SUBTRACT", 2));
        assertThat(steps.get(5)).isEqualTo(new RawStatement("print done", false, "REDUCE_DARK", 3));
    }

    @Test
    void shouldNotCheckAssignedEngineCall() throws Exception {
        write(recipes, "R", "status = kappa.invoke(\"stats\", \"ndf=$file\")");

        List<Step> steps = compiler.compile("R", "").steps();

        assertThat(steps).hasSize(1);
        assertThat(((EngineCall) steps.get(0)).assignTo()).isEqualTo("status");
    }

    @Test
    void shouldCheckStatusAfterStatusAssignment() throws Exception {
        write(recipes, "R", "STATUS = exists $file");

        List<Step> steps = compiler.compile("R", "").steps();

        assertThat(steps)
                .containsExactly(
                        new RawStatement("exists $file", true, "R", 1), new StatusCheck("R", 1));
    }

    @Test
    void shouldUnquoteArgumentValuesWithBlanks() throws Exception {
        write(recipes, "R", "_TITLE text=\"dark frame\" n=3");
        write(primitives, "_TITLE", "print $text");

        ArgBind bind = (ArgBind) compiler.compile("R", "").steps().get(0);

        assertThat(bind.arguments()).containsExactly(Map.entry("text", "dark frame"), Map.entry("n", "3"));
    }

    @Test
    void shouldReportCycleWithFullPath() throws Exception {
        write(recipes, "R", "_A");
        write(primitives, "_A", "_B");
        write(primitives, "_B", "_A");

        assertThatThrownBy(() -> compiler.compile("R", ""))
                .isInstanceOf(RecipeCompileException.class)
                .hasMessage("Primitive _A invokes itself: R -> _A -> _B -> _A")
                .extracting(e -> ((RecipeCompileException) e).getPath())
                .isEqualTo(List.of("R", "_A", "_B", "_A"));
    }

    @Test
    void shouldEnforceNestingDepthLimit() throws Exception {
        write(recipes, "R", "_L1");
        write(primitives, "_L1", "_L2");
        write(primitives, "_L2", "_L3");
        write(primitives, "_L3", "_L4");
        write(primitives, "_L4", "print deep");

        assertThatThrownBy(() -> compiler.compile("R", ""))
                .isInstanceOf(RecipeCompileException.class)
                .hasMessageContaining("nested deeper than 3");
    }

    @Test
    void shouldRejectMalformedArguments() throws Exception {
        write(recipes, "R", "_A key=value stray");
        write(primitives, "_A", "print $key");

        assertThatThrownBy(() -> compiler.compile("R", ""))
                .isInstanceOf(RecipeCompileException.class)
                .hasMessageContaining("stray");
    }

    @Test
    void shouldFailForMissingPrimitive() throws Exception {
        write(recipes, "R", "_NOWHERE");

        assertThatThrownBy(() -> compiler.compile("R", ""))
                .isInstanceOf(RecipeNotFoundException.class)
                .hasMessageContaining("_NOWHERE");
    }

    @Test
    void shouldProduceEqualStepsOnRecompilation() throws Exception {
        write(recipes, "R", "%parameters METHOD", "_A x=1", "_A x=2", "STATUS = exists $file");
        write(primitives, "_A", "kappa.invoke(\"add\", \"x=$x\")", "print $x");

        CompiledRecipe first = compiler.compile("R", "");
        CompiledRecipe second = compiler.compile("R", "");

        assertThat(second.steps()).isEqualTo(first.steps());
        assertThat(first.parameters()).containsExactly("METHOD");
        assertThat(first.sources()).hasSize(2);
    }

    @Test
    void shouldMarkFaultingStepInWindow() throws Exception {
        write(recipes, "R", "print a", "print b", "print c");

        List<String> window = compiler.compile("R", "").window(1, 1);

        assertThat(window).hasSize(3);
        assertThat(window.get(1)).startsWith("> ").contains("print b");
        assertThat(window.get(0)).startsWith("  ");
    }

    private static void write(Path dir, String name, String... lines) throws Exception {
        Files.write(dir.resolve(name), List.of(lines));
    }
}
