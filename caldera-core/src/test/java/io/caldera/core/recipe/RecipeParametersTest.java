package io.caldera.core.recipe;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RecipeParametersTest {

    private static final List<String> FILE =
            List.of(
                    "# reduction settings",
                    "[REDUCE_SCIENCE]",
                    "method = median",
                    "SKY_SUBTRACT = 1",
                    "",
                    "[reduce_science:M31]",
                    "SKY_SUBTRACT = 0");

    @Test
    void shouldLetTargetSectionOverrideRecipeSection() {
        RecipeParameters parameters = RecipeParameters.parse(FILE);

        assertThat(parameters.forRecipe("REDUCE_SCIENCE", "M31"))
                .containsEntry("METHOD", "median")
                .containsEntry("SKY_SUBTRACT", "0");
        assertThat(parameters.forRecipe("REDUCE_SCIENCE", "M32")).containsEntry("SKY_SUBTRACT", "1");
        assertThat(parameters.forRecipe("REDUCE_DARK", "M31")).isEmpty();
    }

    @Test
    void shouldReportKeysRecipeDoesNotDeclare() {
        RecipeParameters parameters = RecipeParameters.parse(FILE);

        assertThat(parameters.unsupported("REDUCE_SCIENCE", Set.of("METHOD"))).containsExactly("SKY_SUBTRACT");
    }

    @Test
    void shouldRejectEntryOutsideSection() {
        assertThatThrownBy(() -> RecipeParameters.parse(List.of("METHOD = median")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("line 1");
    }

    @Test
    void shouldLocateFileOnSearchDirectories(@TempDir Path tempDir) throws Exception {
        Path dir = Files.createDirectories(tempDir.resolve("b"));
        Path file = Files.write(dir.resolve("params.ini"), FILE);

        assertThat(RecipeParameters.locate("params.ini", List.of(tempDir.resolve("a"), dir))).hasValue(file);
        assertThat(RecipeParameters.load(file).isEmpty()).isFalse();
        assertThat(RecipeParameters.empty().isEmpty()).isTrue();
    }
}
