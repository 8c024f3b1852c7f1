package io.caldera.cli.producers;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.caldera.core.CalderaConfig;
import io.caldera.core.CalderaEnvironment;
import io.caldera.core.frame.GroupMode;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.eclipse.microprofile.config.Config;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CalderaEnvironmentProducerTest {

    @TempDir Path tempDir;

    private final Map<String, String> properties = new LinkedHashMap<>();
    private CalderaEnvironmentProducer producer;

    @BeforeEach
    void setUp() {
        Config config = mock(Config.class);
        when(config.getPropertyNames()).thenAnswer(invocation -> properties.keySet());
        when(config.getOptionalValue(anyString(), any())).thenAnswer(invocation -> {
            String value = properties.get(invocation.getArgument(0, String.class));
            Class<?> type = invocation.getArgument(1);
            if (value == null) {
                return Optional.empty();
            }
            if (type == Integer.class) {
                return Optional.of(Integer.valueOf(value));
            }
            if (type == Boolean.class) {
                return Optional.of(Boolean.valueOf(value));
            }
            return Optional.of(value);
        });
        producer = new CalderaEnvironmentProducer();
        producer.config = config;
    }

    @Test
    void shouldMapPropertiesOntoConfig() {
        // GIVEN
        properties.put("caldera.input-dir", "/data/raw");
        properties.put("caldera.output-dir", tempDir.toString());
        properties.put("caldera.calibration-dirs", "/cal/a, /cal/b");
        properties.put("caldera.instrument", "ufti");
        properties.put("caldera.file-prefix", "f");
        properties.put("caldera.poll-interval", "500ms");
        properties.put("caldera.loop-timeout", "PT1H");
        properties.put("caldera.flag-lookahead", "4");
        properties.put("caldera.group-mode", "transient");
        properties.put("caldera.resume", "true");
        properties.put("caldera.engine.kappa", "/star/bin/kappa");
        properties.put("caldera.engine.ccdpack", "/star/bin/ccdpack");

        // WHEN
        CalderaConfig config = producer.createConfig();

        // THEN
        assertThat(config.getInputDir()).isEqualTo(Path.of("/data/raw"));
        assertThat(config.getOutputDir()).isEqualTo(tempDir);
        assertThat(config.getCalibrationDirs()).containsExactly(Path.of("/cal/a"), Path.of("/cal/b"));
        assertThat(config.getInstrument()).isEqualTo("ufti");
        assertThat(config.getFilePrefix()).isEqualTo("f");
        assertThat(config.getPollInterval()).isEqualTo(Duration.ofMillis(500));
        assertThat(config.getLoopTimeout()).isEqualTo(Duration.ofHours(1));
        assertThat(config.getFlagLookahead()).isEqualTo(4);
        assertThat(config.getGroupMode()).isEqualTo(GroupMode.TRANSIENT);
        assertThat(config.isResume()).isTrue();
        assertThat(config.getEngineCommands())
                .containsEntry("kappa", "/star/bin/kappa")
                .containsEntry("ccdpack", "/star/bin/ccdpack")
                .hasSize(2);
    }

    @Test
    void shouldKeepDefaultsForBlankProperties() {
        properties.put("caldera.file-prefix", "  ");

        CalderaConfig config = producer.createConfig();

        CalderaConfig defaults = new CalderaConfig();
        assertThat(config.getFilePrefix()).isEqualTo(defaults.getFilePrefix());
        assertThat(config.getCalibrationDirs()).isEmpty();
        assertThat(config.getRecipeOverrides()).isEmpty();
    }

    @Test
    void shouldParseShortAndIsoDurations() {
        assertThat(CalderaEnvironmentProducer.parseDuration("k", "2s")).isEqualTo(Duration.ofSeconds(2));
        assertThat(CalderaEnvironmentProducer.parseDuration("k", "5m")).isEqualTo(Duration.ofMinutes(5));
        assertThat(CalderaEnvironmentProducer.parseDuration("k", "12h")).isEqualTo(Duration.ofHours(12));
        assertThat(CalderaEnvironmentProducer.parseDuration("k", "1d")).isEqualTo(Duration.ofDays(1));
        assertThat(CalderaEnvironmentProducer.parseDuration("k", "250ms")).isEqualTo(Duration.ofMillis(250));
        assertThat(CalderaEnvironmentProducer.parseDuration("k", "PT30S")).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    void shouldRejectMalformedDuration() {
        assertThatThrownBy(() -> CalderaEnvironmentProducer.parseDuration("poll-interval", "soon"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("caldera.poll-interval");
    }

    @Test
    void shouldProduceEnvironmentWithStubEngines() throws Exception {
        // GIVEN
        properties.put("caldera.output-dir", tempDir.resolve("reduced").toString());
        properties.put("caldera.stub.enabled", "true");

        // WHEN
        CalderaEnvironment environment = producer.calderaEnvironment();

        // THEN
        assertThat(environment.getConfig().getOutputDir()).isEqualTo(tempDir.resolve("reduced"));
        assertThat(tempDir.resolve("reduced")).isDirectory();
        assertThat(environment.getEngines().get("anything")).isNotNull();
        assertThat(environment.getEngines().isRunning("anything")).isTrue();
        producer.cleanup();
    }
}
