package io.caldera.core.loop;

import io.caldera.core.exception.LoopException;
import io.caldera.core.frame.Frame;
import io.caldera.core.frame.FrameFactory;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.logging.Logger;

/// Waits for each consecutive observation to arrive in the input directory.
///
/// A file counts as arrived once its size is nonzero and unchanged across two
/// consecutive polls, which keeps the loop from reading a file still being
/// copied. With `skip`, each poll also scans for a higher observation and
/// jumps to it when the expected one is missing.
public class WaitLoop extends PollingLoop {

    private static final Logger logger = Logger.getLogger(WaitLoop.class.getName());

    public WaitLoop(DataDirectory data, Duration pollInterval, Duration timeout) {
        super(data, pollInterval, timeout);
    }

    @Override
    public Optional<Frame> next(FrameFactory frames, String utdate, LoopCursor cursor, boolean skip)
            throws LoopException {
        OptionalInt current = cursor.current();
        if (current.isEmpty()) {
            return Optional.empty();
        }
        int obsno = current.getAsInt();
        Path raw = data.rawPath(utdate, obsno);
        Wait wait = startWait(raw.getFileName().toString());
        long previousSize = 0;
        while (true) {
            if (Files.exists(raw)) {
                long size = size(raw);
                if (size > 0 && size == previousSize) {
                    break;
                }
                previousSize = size;
            } else if (skip) {
                OptionalInt later = data.nextPresent(utdate, obsno - 1, false);
                if (later.isPresent() && later.getAsInt() != obsno) {
                    logger.warning("File " + raw.getFileName() + " appears to be missing");
                    obsno = later.getAsInt();
                    cursor.moveTo(obsno);
                    raw = data.rawPath(utdate, obsno);
                    previousSize = 0;
                    logger.info("Next available observation is number " + obsno);
                    continue;
                }
            }
            wait.pause();
        }
        logger.info("Found " + raw.getFileName());
        Frame frame = data.linkAndRead(frames, raw, utdate);
        cursor.advance();
        return Optional.of(frame);
    }

    private static long size(Path file) throws LoopException {
        try {
            return Files.size(file);
        } catch (IOException e) {
            throw new LoopException("Unable to stat " + file, e);
        }
    }

    @Override
    public String name() {
        return "wait";
    }
}
