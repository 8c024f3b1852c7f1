package io.caldera.core.loop;

import io.caldera.core.exception.LoopException;
import io.caldera.core.frame.Frame;
import io.caldera.core.frame.FrameFactory;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.logging.Logger;

/// Processes consecutive observations from a starting number.
///
/// A missing observation yields no frame and leaves the cursor where it is,
/// so the caller decides whether that ends the run. `skip` is ignored; combine
/// a list loop with a directory scan to skip gaps.
public class InfiniteLoop implements DataLoop {

    private static final Logger logger = Logger.getLogger(InfiniteLoop.class.getName());

    private final DataDirectory data;

    public InfiniteLoop(DataDirectory data) {
        this.data = data;
    }

    @Override
    public Optional<Frame> next(FrameFactory frames, String utdate, LoopCursor cursor, boolean skip)
            throws LoopException {
        OptionalInt n = cursor.current();
        if (n.isEmpty()) {
            return Optional.empty();
        }
        Path raw = data.rawPath(utdate, n.getAsInt());
        if (!Files.exists(raw)) {
            logger.info("No data file " + raw.getFileName() + " yet");
            return Optional.empty();
        }
        Frame frame = data.linkAndRead(frames, raw, utdate);
        cursor.advance();
        return Optional.of(frame);
    }

    @Override
    public String name() {
        return "inf";
    }
}
