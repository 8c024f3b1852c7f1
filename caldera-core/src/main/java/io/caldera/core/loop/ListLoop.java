package io.caldera.core.loop;

import io.caldera.core.exception.LoopException;
import io.caldera.core.frame.Frame;
import io.caldera.core.frame.FrameFactory;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.logging.Logger;

/// Processes an explicit list of observation numbers.
///
/// Without `skip` the first missing file ends the loop; with it, missing
/// observations are reported and passed over.
public class ListLoop implements DataLoop {

    private static final Logger logger = Logger.getLogger(ListLoop.class.getName());

    private final DataDirectory data;

    public ListLoop(DataDirectory data) {
        this.data = data;
    }

    @Override
    public Optional<Frame> next(FrameFactory frames, String utdate, LoopCursor cursor, boolean skip)
            throws LoopException {
        OptionalInt n;
        while ((n = cursor.pollNumber()).isPresent()) {
            Path raw = data.rawPath(utdate, n.getAsInt());
            if (Files.exists(raw)) {
                return Optional.of(data.linkAndRead(frames, raw, utdate));
            }
            if (!skip) {
                logger.warning("Input file " + raw.getFileName() + " not found");
                cursor.end();
                return Optional.empty();
            }
            logger.warning("Input file " + raw.getFileName() + " not found -- skipping");
        }
        return Optional.empty();
    }

    @Override
    public String name() {
        return "list";
    }
}
