package io.caldera.core.execution;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.caldera.core.exception.RecipeFaultException;
import io.caldera.core.recipe.CompiledRecipe;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ExecutionStateTest {

    @TempDir Path tempDir;

    private ExecutionState state;

    @BeforeEach
    void setUp() throws Exception {
        RecipeHarness harness = new RecipeHarness(tempDir, Map.of("FILTER", "J"));
        harness.parameters = Map.of("METHOD", "median");
        CompiledRecipe recipe = new CompiledRecipe("R", List.of(), Set.of(), Map.of());
        state = new ExecutionState(recipe, harness.context(), harness.log, (text, s) -> 0);
    }

    @Test
    void shouldResolveInnermostScopeFirst() throws Exception {
        state.setVariable("x", "outer");
        state.enterScope("_P", Map.of("x", "inner"));

        assertThat(state.interpolate("$x ${x}")).isEqualTo("inner inner");

        state.exitScope();

        assertThat(state.interpolate("$x")).isEqualTo("outer");
        assertThat(state.primitiveParameters()).containsEntry("_P", Map.of("x", "inner"));
    }

    @Test
    void shouldFallBackToParametersAndBuiltins() throws Exception {
        assertThat(state.interpolate("$method $METHOD $obsnum $utdate $recipe $nmembers"))
                .isEqualTo("median median 1 20260101 R 1");
    }

    @Test
    void shouldReadHeaderAndKeepLiteralDollar() throws Exception {
        assertThat(state.interpolate("${hdr.FILTER} costs $$5")).isEqualTo("J costs $5");
    }

    @Test
    void shouldRejectUndefinedName() {
        assertThatThrownBy(() -> state.interpolate("$missing"))
                .isInstanceOf(RecipeFaultException.class)
                .hasMessageContaining("$missing");
    }

    @Test
    void shouldNotCloseRecipeScope() {
        state.exitScope();

        assertThat(state.scope()).isEqualTo("R");
        assertThat(state.depth()).isEqualTo(1);
    }
}
