package io.caldera.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import io.caldera.core.recipe.CompiledRecipe;
import io.caldera.core.recipe.Step;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class RecipeJsonTest {

    @Test
    void toJson_writesDiscriminatorPerStep() throws Exception {
        String json = RecipeJson.toJson(darkRecipe());

        JsonNode steps = RecipeJson.createMapper().readTree(json).get("steps");
        assertThat(steps).extracting(step -> step.get("type").asText())
                .containsExactly("args", "enter", "engine_call", "engine_check", "statement", "status_check",
                        "exit", "engine_call");
    }

    @Test
    void toJson_omitsSourceTimesAndCheckedCallTarget() throws Exception {
        JsonNode root = RecipeJson.createMapper().readTree(RecipeJson.toJson(darkRecipe()));

        assertThat(root.has("sources")).isFalse();
        assertThat(root.get("name").asText()).isEqualTo("REDUCE_DARK");
        assertThat(root.get("parameters")).extracting(JsonNode::asText).containsExactly("METHOD");
        assertThat(root.get("steps").get(2).has("assignTo")).isFalse();
        assertThat(root.get("steps").get(7).get("assignTo").asText()).isEqualTo("st");
    }

    @Test
    void stepsFromJson_restoresEveryStepKind() {
        CompiledRecipe recipe = darkRecipe();

        List<Step> restored = RecipeJson.stepsFromJson(RecipeJson.toJson(recipe));

        assertThat(restored).isEqualTo(recipe.steps());
    }

    @Test
    void stepsFromJson_keepsArgumentOrder() {
        String json = "[{\"type\":\"args\",\"scope\":\"_P\",\"line\":4,"
                + "\"arguments\":{\"z\":\"1\",\"a\":\"2\",\"m\":\"3\"}}]";

        Step.ArgBind bind = (Step.ArgBind) RecipeJson.stepsFromJson(json).get(0);

        assertThat(bind.arguments().keySet()).containsExactly("z", "a", "m");
    }

    @Test
    void stepsFromJson_rejectsUnknownType() {
        String json = "[{\"type\":\"teleport\",\"scope\":\"R\",\"line\":1}]";

        assertThatThrownBy(() -> RecipeJson.stepsFromJson(json))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown Step type: teleport");
    }

    @Test
    void stepsFromJson_rejectsMissingField() {
        String json = "[{\"type\":\"statement\",\"scope\":\"R\",\"line\":1}]";

        assertThatThrownBy(() -> RecipeJson.stepsFromJson(json))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("'text'");
    }

    @Test
    void stepsFromJson_rejectsDocumentWithoutSteps() {
        assertThatThrownBy(() -> RecipeJson.stepsFromJson("{\"name\":\"R\"}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("No step list");
    }

    private static CompiledRecipe darkRecipe() {
        Map<String, String> arguments = new LinkedHashMap<>();
        arguments.put("method", "median");
        arguments.put("clip", "\"3 sigma\"");
        List<Step> steps = List.of(
                new Step.ArgBind("_DARK_SUBTRACT", arguments, 1),
                new Step.ScopeEnter("_DARK_SUBTRACT", "REDUCE_DARK", 1),
                new Step.EngineCall("kappa", "sub", "in=$file", null, "_DARK_SUBTRACT", 2),
                new Step.EngineStatusCheck("kappa", "sub", "in=$file", "_DARK_SUBTRACT", 2),
                new Step.RawStatement("exists $file", true, "_DARK_SUBTRACT", 3),
                new Step.StatusCheck("_DARK_SUBTRACT", 3),
                new Step.ScopeExit("_DARK_SUBTRACT", 1),
                new Step.EngineCall("kappa", "stats", "in=$file", "st", "REDUCE_DARK", 2));
        return new CompiledRecipe(
                "REDUCE_DARK",
                steps,
                Set.of("METHOD"),
                Map.of(Path.of("/recipes/REDUCE_DARK"), FileTime.fromMillis(1_000L)));
    }
}
