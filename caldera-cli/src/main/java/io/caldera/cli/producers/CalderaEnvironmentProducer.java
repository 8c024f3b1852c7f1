package io.caldera.cli.producers;

import io.caldera.core.CalderaConfig;
import io.caldera.core.CalderaEnvironment;
import io.caldera.core.CalderaFactory;
import io.caldera.core.engine.ProcessEngineLauncher;
import io.caldera.core.engine.stub.StubEngineLauncher;
import io.caldera.core.frame.GroupMode;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;
import org.eclipse.microprofile.config.Config;

/// CDI producer for the Caldera reduction environment.
///
/// ### Configuration Properties
/// | Property | Type | Default | Description |
/// |----------|------|---------|-------------|
/// | `caldera.input-dir` | Path | `.` | Raw data directory |
/// | `caldera.output-dir` | Path | `.` | Reduction directory |
/// | `caldera.calibration-dirs` | Paths | - | Comma-separated static calibration directories |
/// | `caldera.recipe-root` | Path | - | Tree holding `recipes/` and `primitives/` |
/// | `caldera.recipe-dirs` | Paths | - | Recipe override directories |
/// | `caldera.primitive-dirs` | Paths | - | Primitive override directories |
/// | `caldera.instrument` | String | `generic` | Instrument name |
/// | `caldera.file-prefix` | String | empty | Raw filename prefix |
/// | `caldera.poll-interval` | Duration | `2s` | Data loop poll interval |
/// | `caldera.loop-timeout` | Duration | `12h` | Data loop timeout |
/// | `caldera.flag-lookahead` | int | `10` | Flag loop skip lookahead |
/// | `caldera.max-primitive-depth` | int | `10` | Primitive nesting limit |
/// | `caldera.group-mode` | String | `persistent` | `persistent`, `transient` or `single` |
/// | `caldera.resume` | Boolean | `false` | Keep existing group files |
/// | `caldera.engine-timeout` | Duration | `10m` | Engine reply timeout |
/// | `caldera.engine.<name>` | String | - | Command line starting engine `<name>` |
/// | `caldera.stub.enabled` | Boolean | `false` | Answer every engine call with the stub engine |
///
/// Durations accept ISO-8601 (`PT2S`) or the short form (`2s`, `5m`, `12h`).
/// Every key may also be given as an environment variable (`CALDERA_OUTPUT_DIR`).
///
/// @implNote Application-scoped singleton. Thread-safe after initialization.
/// @see io.caldera.core.CalderaEnvironment
@ApplicationScoped
public class CalderaEnvironmentProducer {

    private static final Logger logger = Logger.getLogger(CalderaEnvironmentProducer.class.getName());

    static final String PREFIX = "caldera.";
    static final String ENGINE_PREFIX = "caldera.engine.";

    private CalderaEnvironment environment;

    @Inject Config config;

    /// Produces the reduction environment for CDI injection.
    ///
    /// @return configured environment singleton, never null
    /// @throws IllegalArgumentException if a property has an invalid value
    @Produces
    @ApplicationScoped
    public CalderaEnvironment calderaEnvironment() {
        CalderaConfig calderaConfig = createConfig();
        CalderaFactory.Builder builder = CalderaFactory.builder().config(calderaConfig);
        if (config.getOptionalValue(PREFIX + "stub.enabled", Boolean.class).orElse(false)) {
            builder.engineLaunchers(List.of(
                    new ProcessEngineLauncher(
                            calderaConfig.getEngineCommands(),
                            calderaConfig.getOutputDir(),
                            calderaConfig.getEngineTimeout()),
                    new StubEngineLauncher(true)));
            logger.info("Stub engines enabled");
        }
        environment = builder.build();
        return environment;
    }

    CalderaConfig createConfig() {
        CalderaConfig.Builder builder = CalderaConfig.builder();
        path("input-dir").ifPresent(builder::inputDir);
        path("output-dir").ifPresent(builder::outputDir);
        builder.calibrationDirs(paths("calibration-dirs"));
        path("recipe-root").ifPresent(builder::recipeRoot);
        builder.recipeOverrides(paths("recipe-dirs"));
        builder.primitiveOverrides(paths("primitive-dirs"));
        string("instrument").ifPresent(builder::instrument);
        string("file-prefix").ifPresent(builder::filePrefix);
        duration("poll-interval").ifPresent(builder::pollInterval);
        duration("loop-timeout").ifPresent(builder::loopTimeout);
        config.getOptionalValue(PREFIX + "flag-lookahead", Integer.class).ifPresent(builder::flagLookahead);
        config.getOptionalValue(PREFIX + "max-primitive-depth", Integer.class)
                .ifPresent(builder::maxPrimitiveDepth);
        string("group-mode").map(value -> GroupMode.valueOf(value.toUpperCase(Locale.ROOT)))
                .ifPresent(builder::groupMode);
        config.getOptionalValue(PREFIX + "resume", Boolean.class).ifPresent(builder::resume);
        duration("engine-timeout").ifPresent(builder::engineTimeout);
        builder.engineCommands(engineCommands());
        return builder.build();
    }

    private Map<String, String> engineCommands() {
        Map<String, String> commands = new LinkedHashMap<>();
        for (String name : config.getPropertyNames()) {
            if (name.startsWith(ENGINE_PREFIX) && name.length() > ENGINE_PREFIX.length()) {
                config.getOptionalValue(name, String.class)
                        .ifPresent(command -> commands.put(name.substring(ENGINE_PREFIX.length()), command));
            }
        }
        return commands;
    }

    private Optional<String> string(String key) {
        return config.getOptionalValue(PREFIX + key, String.class).map(String::trim).filter(v -> !v.isEmpty());
    }

    private Optional<Path> path(String key) {
        return string(key).map(Path::of);
    }

    private List<Path> paths(String key) {
        List<Path> paths = new ArrayList<>();
        string(key).ifPresent(value -> {
            for (String part : value.split(",")) {
                if (!part.isBlank()) {
                    paths.add(Path.of(part.trim()));
                }
            }
        });
        return paths;
    }

    private Optional<Duration> duration(String key) {
        return string(key).map(value -> parseDuration(key, value));
    }

    static Duration parseDuration(String key, String value) {
        String text = value.trim().toUpperCase(Locale.ROOT);
        try {
            if (text.startsWith("P")) {
                return Duration.parse(text);
            }
            if (text.endsWith("MS")) {
                return Duration.ofMillis(Long.parseLong(text.substring(0, text.length() - 2)));
            }
            if (text.endsWith("D")) {
                return Duration.parse("P" + text);
            }
            return Duration.parse("PT" + text);
        } catch (DateTimeParseException | NumberFormatException e) {
            throw new IllegalArgumentException("Invalid duration for " + PREFIX + key + ": " + value, e);
        }
    }

    /// Shuts down running engines when the application stops.
    @PreDestroy
    public void cleanup() {
        if (environment != null) {
            environment.close();
        }
    }
}
