package io.caldera.cli.execution;

import static org.assertj.core.api.Assertions.assertThat;

import io.caldera.core.engine.EngineResponse;
import io.caldera.core.execution.RecipeStatus;
import io.caldera.core.frame.BadObservationRules;
import io.caldera.core.frame.Frame;
import io.caldera.core.frame.Group;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class VerboseRecipeListenerTest {

    private ByteArrayOutputStream outputStream;
    private VerboseRecipeListener listener;
    private Frame frame;

    @BeforeEach
    void setUp() {
        outputStream = new ByteArrayOutputStream();
        listener = new VerboseRecipeListener(new PrintStream(outputStream, true, StandardCharsets.UTF_8), false);
        frame = new Frame("f20260101_0001", Map.of("OBJECT", "M31"));
        frame.setRecipe("REDUCE_OBJECT");
    }

    private String output() {
        return outputStream.toString(StandardCharsets.UTF_8);
    }

    @Test
    void shouldPrintFrameHeaderWithRecipeAndGroup() {
        Group group = new Group("1", "gf20260101_1", new BadObservationRules());

        listener.onFrameStart(frame, group);

        assertThat(output())
                .contains("FRAME f20260101_0001")
                .contains("[REDUCE_OBJECT]")
                .contains("gf20260101_1");
    }

    @Test
    void shouldIndentPrimitivesAndEngineCalls() {
        // WHEN
        listener.onRecipeStart("REDUCE_OBJECT", frame);
        listener.onPrimitiveEnter("_FLAT_FIELD_", "REDUCE_OBJECT");
        listener.onEngineCall("kappa", "div", "in=f20260101_0001", EngineResponse.ok());
        listener.onPrimitiveExit("_FLAT_FIELD_");
        listener.onEngineCall("kappa", "stats", "", EngineResponse.ok());

        // THEN
        assertThat(output().lines().toList())
                .containsExactly(
                        "  REDUCE_OBJECT",
                        "    _FLAT_FIELD_  (from REDUCE_OBJECT)",
                        "      kappa.div in=f20260101_0001 ✓",
                        "    kappa.stats ✓");
    }

    @Test
    void shouldReportFailedAndUnreachableEngines() {
        listener.onEngineCall("kappa", "div", "in=x", EngineResponse.failed(233, "bad input"));
        listener.onEngineCall("ccdpack", "makeflat", "in=x", null);

        assertThat(output())
                .contains("kappa.div in=x ✗ status 233")
                .contains("ccdpack.makeflat in=x ✗ engine unavailable");
    }

    @Test
    void shouldPrintRecipeOutcome() {
        listener.onRecipeComplete("REDUCE_OBJECT", frame, RecipeStatus.ERROR);

        assertThat(output()).contains("* REDUCE_OBJECT (ERROR)").contains("└");
    }
}
