package io.caldera.core.loop;

import io.caldera.core.exception.LoopException;
import io.caldera.core.frame.Frame;
import io.caldera.core.frame.FrameFactory;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/// Waits for the flag file of each consecutive observation.
///
/// An empty flag file means the observation's raw file is complete. A
/// non-empty flag file lists the data files, one per line, relative to the
/// input directory; each listed file becomes a frame. With `skip`, the loop
/// looks up to a fixed number of observations ahead for a flag when the
/// expected one has not appeared.
public class FlagLoop extends PollingLoop {

    private static final Logger logger = Logger.getLogger(FlagLoop.class.getName());

    private final int lookahead;

    public FlagLoop(DataDirectory data, Duration pollInterval, Duration timeout, int lookahead) {
        super(data, pollInterval, timeout);
        this.lookahead = lookahead;
    }

    @Override
    public Optional<Frame> next(FrameFactory frames, String utdate, LoopCursor cursor, boolean skip)
            throws LoopException {
        String queued = cursor.pollPending();
        if (queued != null) {
            return Optional.of(data.linkAndRead(frames, Path.of(queued), utdate));
        }
        OptionalInt current = cursor.current();
        if (current.isEmpty()) {
            return Optional.empty();
        }
        int obsno = current.getAsInt();
        Path flag = data.flagPath(utdate, obsno);
        Wait wait = startWait(flag.getFileName().toString());
        while (!Files.exists(flag)) {
            if (skip) {
                OptionalInt later = lookAhead(utdate, obsno);
                if (later.isPresent()) {
                    logger.warning("Flag " + flag.getFileName() + " appears to be missing");
                    obsno = later.getAsInt();
                    cursor.moveTo(obsno);
                    flag = data.flagPath(utdate, obsno);
                    logger.info("Next available observation is number " + obsno);
                    continue;
                }
            }
            wait.pause();
        }
        cursor.advance();

        List<String> listed = readFlag(flag);
        if (listed.isEmpty()) {
            return Optional.of(data.linkAndRead(frames, data.rawPath(utdate, obsno), utdate));
        }
        logger.fine("Flag " + flag.getFileName() + " lists " + listed.size() + " file(s)");
        cursor.addPending(listed.subList(1, listed.size()));
        return Optional.of(data.linkAndRead(frames, Path.of(listed.get(0)), utdate));
    }

    private OptionalInt lookAhead(String utdate, int obsno) {
        for (int n = obsno + 1; n <= obsno + lookahead; n++) {
            if (Files.exists(data.flagPath(utdate, n))) {
                return OptionalInt.of(n);
            }
        }
        return OptionalInt.empty();
    }

    static List<String> readFlag(Path flag) throws LoopException {
        try {
            if (Files.size(flag) == 0) {
                return List.of();
            }
            return Files.readAllLines(flag).stream()
                    .map(String::trim)
                    .filter(line -> !line.isEmpty())
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new LoopException("Unable to read flag file " + flag, e);
        }
    }

    @Override
    public String name() {
        return "flag";
    }
}
