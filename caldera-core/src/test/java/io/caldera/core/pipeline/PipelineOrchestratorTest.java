package io.caldera.core.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import io.caldera.core.CalderaConfig;
import io.caldera.core.CalderaEnvironment;
import io.caldera.core.CalderaFactory;
import io.caldera.core.engine.EngineResponse;
import io.caldera.core.engine.stub.StubEngineLauncher;
import io.caldera.core.engine.stub.StubEngineResponses;
import io.caldera.core.engine.stub.StubEngineResponses.Invocation;
import io.caldera.core.exception.FatalPipelineException;
import io.caldera.core.execution.RecipeListener;
import io.caldera.core.execution.RecipeStatus;
import io.caldera.core.execution.RunLog;
import io.caldera.core.frame.Frame;
import io.caldera.core.loop.LoopSelector.LoopRequest;
import io.caldera.core.loop.LoopType;
import io.caldera.core.recipe.RecipeParameters;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PipelineOrchestratorTest {

    private static final String UTDATE = "20260101";

    @TempDir Path tempDir;

    private final StubEngineResponses stub = StubEngineResponses.getInstance();
    private final Map<String, Map<String, Object>> headers = new HashMap<>();
    private Path rawDir;
    private Path outputDir;
    private Path recipeDir;
    private CalderaEnvironment env;

    @BeforeEach
    void setUp() throws Exception {
        stub.clear();
        rawDir = Files.createDirectories(tempDir.resolve("raw"));
        outputDir = Files.createDirectories(tempDir.resolve("reduced"));
        recipeDir = Files.createDirectories(tempDir.resolve("tree/recipes/generic"));
        Files.createDirectories(tempDir.resolve("tree/primitives/generic"));

        recipe("MARK", "lastmember", "kappa.invoke(\"mark\", \"$file $lastmember\")");
        env = buildEnvironment();
    }

    private CalderaEnvironment buildEnvironment() {
        return CalderaFactory.builder()
                .config(CalderaConfig.builder()
                        .inputDir(rawDir)
                        .outputDir(outputDir)
                        .recipeRoot(tempDir.resolve("tree"))
                        .filePrefix("f")
                        .pollInterval(Duration.ofMillis(20))
                        .loopTimeout(Duration.ofMillis(300))
                        .build())
                .headerReader(file -> headers.getOrDefault(file.getFileName().toString(), Map.of()))
                .engineLaunchers(List.of(new StubEngineLauncher(true)))
                .build();
    }

    @AfterEach
    void tearDown() {
        env.close();
        stub.clear();
    }

    private void recipe(String name, String... lines) throws Exception {
        Files.write(recipeDir.resolve(name), List.of(lines));
    }

    private void observation(int number, String recipe, long groupNumber) throws Exception {
        String name = String.format("f%s_%04d.fits", UTDATE, number);
        Files.writeString(rawDir.resolve(name), "data");
        headers.put(name, Map.of("RECIPE", recipe, "GRPNUM", groupNumber, "OBJECT", "M31"));
    }

    private RunStatistics run(RunParameters.Builder parameters) throws Exception {
        return env.createOrchestrator(RunLog.create(), RecipeListener.NOOP)
                .run(parameters.utdate(UTDATE).build());
    }

    private static LoopRequest list(Integer... observations) {
        return new LoopRequest(null, null, null, List.of(observations), null, false);
    }

    private List<String> markArguments() {
        return stub.invocations().stream().map(Invocation::arguments).toList();
    }

    // ----
    // Run modes
    // ----

    @Nested
    class RunModes {

        @Test
        void shouldReduceEachFrameAsItArrivesInStreamingMode() throws Exception {
            // GIVEN
            observation(1, "MARK", 1);
            observation(2, "MARK", 1);

            // WHEN
            RunStatistics stats = run(RunParameters.builder().loop(list(1, 2)));

            // THEN
            assertThat(markArguments()).containsExactly("f20260101_0001.fits 1", "f20260101_0002.fits 1");
            assertThat(stats.count(RecipeStatus.OK)).isEqualTo(2);
            assertThat(stats.exitCode()).isZero();
        }

        @Test
        void shouldGroupEveryFrameBeforeReducingInBatchMode() throws Exception {
            // GIVEN
            observation(1, "MARK", 1);
            observation(2, "MARK", 2);
            observation(3, "MARK", 1);

            // WHEN
            RunStatistics stats = run(RunParameters.builder().loop(list(1, 2, 3)).batch(true));

            // THEN
            assertThat(markArguments())
                    .containsExactly("f20260101_0001.fits 0", "f20260101_0003.fits 1", "f20260101_0002.fits 1");
            assertThat(stats.total()).isEqualTo(3);
        }

        @Test
        void shouldSkipBadObservationsInBatchMode() throws Exception {
            // GIVEN
            Files.writeString(outputDir.resolve(CalderaConfig.BAD_OBSERVATION_FILE), UTDATE + ":2\n");
            env.close();
            env = buildEnvironment();
            observation(1, "MARK", 1);
            observation(2, "MARK", 1);
            observation(3, "MARK", 1);

            // WHEN
            RunStatistics stats = run(RunParameters.builder().loop(list(1, 2, 3)).batch(true));

            // THEN
            assertThat(markArguments()).containsExactly("f20260101_0001.fits 0", "f20260101_0003.fits 1");
            assertThat(stats.total()).isEqualTo(2);
        }

        @Test
        void shouldRemoveRawLinksAfterEachRecipe() throws Exception {
            observation(1, "MARK", 1);

            run(RunParameters.builder().loop(list(1)));

            assertThat(outputDir.resolve("f20260101_0001.fits")).doesNotExist();
        }
    }

    // ----
    // Outcomes
    // ----

    @Test
    void shouldExitWithFailureWhenRecipeFails() throws Exception {
        observation(1, "MARK", 1);
        stub.script("kappa", "mark", EngineResponse.failed(-1, "bad pixels"));

        RunStatistics stats = run(RunParameters.builder().loop(list(1)));

        assertThat(stats.count(RecipeStatus.ERROR)).isEqualTo(1);
        assertThat(stats.exitCode()).isEqualTo(1);
    }

    @Test
    void shouldStopWaitingAndFailRunWhenLoopTimesOut() throws Exception {
        observation(1, "MARK", 1);

        RunStatistics stats = run(RunParameters.builder()
                .loop(new LoopRequest(LoopType.WAIT, 1, null, null, null, false)));

        assertThat(markArguments()).containsExactly("f20260101_0001.fits 1");
        assertThat(stats.isLoopTimedOut()).isTrue();
        assertThat(stats.exitCode()).isEqualTo(1);
    }

    @Test
    void shouldAbortRunWhenRecipeCannotBeFound() throws Exception {
        observation(1, "NO_SUCH_RECIPE", 1);

        assertThatThrownBy(() -> run(RunParameters.builder().loop(list(1))))
                .isInstanceOf(FatalPipelineException.class)
                .hasMessageContaining("NO_SUCH_RECIPE");
    }

    @Test
    void shouldAbortRunOnContradictoryLoopArguments() {
        assertThatThrownBy(() -> run(RunParameters.builder()
                        .loop(new LoopRequest(LoopType.FILE, 1, null, null, null, false))))
                .isInstanceOf(FatalPipelineException.class)
                .hasMessageStartingWith("Invalid loop arguments");
    }

    // ----
    // Recipe selection and parameters
    // ----

    @Test
    void shouldRunOverrideRecipeForEveryFrame() throws Exception {
        observation(1, "MARK", 1);
        recipe("OTHER", "kappa.invoke(\"other\", \"$file\")");

        run(RunParameters.builder().loop(list(1)).recipeOverride("OTHER"));

        assertThat(stub.invocations()).containsExactly(new Invocation("kappa", "other", "f20260101_0001.fits"));
    }

    @Test
    void shouldPassTargetSpecificParametersToRecipe() throws Exception {
        observation(1, "LEVELS", 1);
        recipe("LEVELS", "kappa.invoke(\"level\", \"$LEVEL\")");
        RecipeParameters parameters =
                RecipeParameters.parse(List.of("[LEVELS]", "LEVEL = 1", "[LEVELS:M31]", "LEVEL = 9"));

        run(RunParameters.builder().loop(list(1)).recipeParameters(parameters));

        assertThat(markArgumentsOf("level")).containsExactly("9");
    }

    @Test
    void shouldNotifyListenerOfEachFrame() throws Exception {
        observation(1, "MARK", 1);
        observation(2, "MARK", 1);
        RecipeListener listener = mock(RecipeListener.class);

        env.createOrchestrator(RunLog.create(), listener)
                .run(RunParameters.builder().utdate(UTDATE).loop(list(1, 2)).build());

        verify(listener, times(2)).onFrameStart(any(Frame.class), any());
        verify(listener, times(2)).onRecipeComplete(any(), any(Frame.class), any(RecipeStatus.class));
    }

    private List<String> markArgumentsOf(String operation) {
        return stub.invocations().stream()
                .filter(invocation -> invocation.operation().equals(operation))
                .map(Invocation::arguments)
                .toList();
    }
}
