package io.caldera.core.engine.stub;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.caldera.core.engine.AlgorithmEngine;
import io.caldera.core.engine.EngineResponse;
import io.caldera.core.exception.EngineException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class StubEngineLauncherTest {

    private final StubEngineResponses responses = StubEngineResponses.getInstance();

    @BeforeEach
    void setUp() {
        responses.clear();
    }

    @AfterEach
    void tearDown() {
        responses.clear();
        System.clearProperty("caldera.stub.enabled");
    }

    @Test
    void shouldOutrankRealLaunchersWhenEnabled() {
        StubEngineLauncher launcher = new StubEngineLauncher(true);

        assertThat(launcher.supports("kappa")).isTrue();
        assertThat(launcher.getPriority()).isEqualTo(1000);
    }

    @Test
    void shouldFollowSystemPropertyWhenNotForced() {
        StubEngineLauncher launcher = new StubEngineLauncher();
        System.setProperty("caldera.stub.enabled", "true");

        assertThat(launcher.supports("kappa")).isTrue();
    }

    @Test
    void shouldReplyFromScriptThenWildcardThenDefault() throws Exception {
        // GIVEN
        responses.script("kappa", "add", EngineResponse.failed(-1, "first"));
        responses.script("kappa", "*", EngineResponse.ok("any"));
        responses.setDefault("kappa", EngineResponse.failed(5, "default"));
        AlgorithmEngine engine = new StubEngineLauncher(true).start("kappa");

        // WHEN / THEN
        assertThat(engine.invoke("add", "a").message()).isEqualTo("first");
        assertThat(engine.invoke("add", "b").message()).isEqualTo("any");
        assertThat(engine.invoke("add", "c").status()).isEqualTo(5);
        assertThat(responses.invocations()).hasSize(3);
    }

    @Test
    void shouldRefuseToStartWhenScripted() {
        responses.failOnStart("kappa");

        assertThatThrownBy(() -> new StubEngineLauncher(true).start("kappa"))
                .isInstanceOf(EngineException.class);
    }

    @Test
    void shouldRejectCallsAfterClose() throws Exception {
        AlgorithmEngine engine = new StubEngineLauncher(true).start("kappa");
        engine.close();

        assertThatThrownBy(() -> engine.invoke("add", ""))
                .isInstanceOf(EngineException.class)
                .hasMessageContaining("closed");
    }
}
