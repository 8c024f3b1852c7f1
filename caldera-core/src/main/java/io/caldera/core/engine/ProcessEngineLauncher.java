package io.caldera.core.engine;

import io.caldera.core.exception.EngineException;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/// Launches engines backed by an external command.
///
/// Each request runs `<command> <operation> <arguments>` through `/bin/sh -c`
/// in the working directory. The exit code is the engine status; output is
/// logged and returned as the reply message. A request that outlives the
/// timeout is killed and reported as an engine failure.
///
/// ```
/// caldera.engine.kappa=/star/bin/kappa/kappa_mon
/// ```
public class ProcessEngineLauncher implements EngineLauncher {

    private static final Logger logger = Logger.getLogger(ProcessEngineLauncher.class.getName());

    private final Map<String, String> commands;
    private final Path workingDir;
    private final Duration timeout;

    /// @param commands engine name to command, not null
    /// @param workingDir directory the commands run in, not null
    /// @param timeout longest a single request may take, not null
    public ProcessEngineLauncher(Map<String, String> commands, Path workingDir, Duration timeout) {
        this.commands = Map.copyOf(commands);
        this.workingDir = workingDir;
        this.timeout = timeout;
    }

    @Override
    public String getName() {
        return "process";
    }

    @Override
    public boolean supports(String engineName) {
        return commands.containsKey(engineName);
    }

    @Override
    public AlgorithmEngine start(String engineName) throws EngineException {
        String command = commands.get(engineName);
        if (command == null) {
            throw new EngineException(engineName, "No command configured for engine " + engineName);
        }
        Path executable = Path.of(command.trim().split("\\s+")[0]);
        if (executable.isAbsolute() && !Files.isExecutable(executable)) {
            throw new EngineException(engineName, "Engine command is not executable: " + executable);
        }
        return new ProcessEngine(engineName, command);
    }

    private final class ProcessEngine implements AlgorithmEngine {

        private final String name;
        private final String command;

        ProcessEngine(String name, String command) {
            this.name = name;
            this.command = command;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public EngineResponse invoke(String operation, String arguments) throws EngineException {
            String line = command + " " + operation + (arguments.isEmpty() ? "" : " " + arguments);
            logger.fine("Executing engine request [" + name + "]: " + line);
            try {
                ProcessBuilder pb = new ProcessBuilder();
                pb.command(List.of("/bin/sh", "-c", line));
                pb.directory(workingDir.toFile());
                pb.redirectErrorStream(true);

                Process process = pb.start();

                StringBuilder output = new StringBuilder();
                try (BufferedReader reader =
                        new BufferedReader(
                                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                    String out;
                    while ((out = reader.readLine()) != null) {
                        output.append(out).append("\n");
                        logger.info("[" + name + "] " + out);
                    }
                }

                boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
                if (!finished) {
                    process.destroyForcibly();
                    throw new EngineException(
                            name, "Engine " + name + " timed out after " + timeout.toMillis() + "ms");
                }
                return new EngineResponse(process.exitValue(), output.toString().trim());
            } catch (IOException e) {
                throw new EngineException(name, "Engine " + name + " failed: " + e.getMessage(), e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new EngineException(name, "Interrupted waiting for engine " + name, e);
            }
        }
    }
}
