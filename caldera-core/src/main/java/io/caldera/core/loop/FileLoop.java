package io.caldera.core.loop;

import io.caldera.core.exception.LoopException;
import io.caldera.core.frame.Frame;
import io.caldera.core.frame.FrameFactory;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.logging.Logger;

/// Processes explicitly named files, resolved against the input directory.
public class FileLoop implements DataLoop {

    private static final Logger logger = Logger.getLogger(FileLoop.class.getName());

    private final DataDirectory data;

    public FileLoop(DataDirectory data) {
        this.data = data;
    }

    @Override
    public Optional<Frame> next(FrameFactory frames, String utdate, LoopCursor cursor, boolean skip)
            throws LoopException {
        String name;
        while ((name = cursor.pollFile()) != null) {
            Path file = data.getInputDir().resolve(name);
            if (Files.exists(file)) {
                return Optional.of(data.linkAndRead(frames, file, utdate));
            }
            if (!skip) {
                throw new LoopException("Input file " + file + " does not exist");
            }
            logger.warning("Input file " + file + " not found -- skipping");
        }
        return Optional.empty();
    }

    @Override
    public String name() {
        return "file";
    }
}
