package io.caldera.core.recipe;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class RecipeSourceTest {

    @Test
    void shouldDropCommentsBlanksAndDocumentation() {
        RecipeSource source =
                RecipeSource.parse(
                        "REDUCE_FLAT",
                        null,
                        List.of(
                                "=head1 NAME",
                                "REDUCE_FLAT - makes a flat",
                                "=cut",
                                "",
                                "# subtract the dark first",
                                "   _DARK_SUBTRACT   ",
                                "_MAKE_FLAT"),
                        null);

        assertThat(source.lines())
                .containsExactly(new SourceLine(6, "_DARK_SUBTRACT"), new SourceLine(7, "_MAKE_FLAT"));
    }

    @Test
    void shouldCollectDeclaredParametersUpperCased() {
        RecipeSource source =
                RecipeSource.parse("R", null, List.of("%parameters method sky_subtract", "print x"), null);

        assertThat(source.parameters()).containsExactly("METHOD", "SKY_SUBTRACT");
        assertThat(source.lines()).containsExactly(new SourceLine(2, "print x"));
    }
}
