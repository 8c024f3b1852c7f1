package io.caldera.core.loop;

import io.caldera.core.exception.LoopException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.logging.Logger;

/// Chooses the data-arrival strategy and its starting cursor from run arguments.
///
/// ### Selection rules
/// | Arguments                      | Strategy | Cursor                               |
/// |--------------------------------|----------|--------------------------------------|
/// | files                          | file     | the files                            |
/// | list                           | list     | the list                             |
/// | from and to                    | list     | `from..to`                           |
/// | from and skip                  | list     | `from..` highest observation present |
/// | from                           | inf      | from                                 |
/// | to                             | list     | `1..to`                              |
/// | nothing                        | wait     | 1                                    |
///
/// An explicit loop type replaces the strategy; the cursor still follows the
/// numbers given, with waiting loops starting at `from` (or 1).
public class LoopSelector {

    private static final Logger logger = Logger.getLogger(LoopSelector.class.getName());

    private final DataDirectory data;
    private final Duration pollInterval;
    private final Duration timeout;
    private final int flagLookahead;

    public LoopSelector(DataDirectory data, Duration pollInterval, Duration timeout, int flagLookahead) {
        this.data = Objects.requireNonNull(data, "data");
        this.pollInterval = pollInterval;
        this.timeout = timeout;
        this.flagLookahead = flagLookahead;
    }

    /// Selects a strategy.
    ///
    /// @param request the loop arguments, not null
    /// @param utdate UT date, used to scan for the highest observation
    /// @return the chosen loop and cursor, never null
    /// @throws LoopException if the data directory cannot be scanned
    /// @throws IllegalArgumentException if the arguments contradict each other
    public Selection select(LoopRequest request, String utdate) throws LoopException {
        LoopType type;
        LoopCursor cursor;
        if (!request.files().isEmpty()) {
            type = LoopType.FILE;
            cursor = LoopCursor.ofFiles(request.files());
        } else if (!request.list().isEmpty()) {
            type = LoopType.LIST;
            cursor = LoopCursor.ofList(request.list());
        } else if (request.from() != null && request.to() != null) {
            type = LoopType.LIST;
            cursor = LoopCursor.ofList(ObservationList.range(request.from(), request.to()));
        } else if (request.from() != null && request.skip()
                && (request.loop() == null || !request.loop().waitsForData())) {
            OptionalInt highest = data.highestPresent(utdate);
            int to = highest.isPresent() ? highest.getAsInt() : request.from();
            type = LoopType.LIST;
            cursor = LoopCursor.ofList(ObservationList.range(request.from(), to));
        } else if (request.from() != null) {
            type = LoopType.INF;
            cursor = LoopCursor.from(request.from());
        } else if (request.to() != null) {
            type = LoopType.LIST;
            cursor = LoopCursor.ofList(ObservationList.range(1, request.to()));
        } else {
            type = LoopType.WAIT;
            cursor = LoopCursor.from(1);
        }

        if (request.loop() != null && request.loop() != type) {
            if (request.loop() == LoopType.FILE) {
                throw new IllegalArgumentException("The file loop requires a list of files");
            }
            if (type == LoopType.FILE) {
                throw new IllegalArgumentException("Files cannot be processed with the " + request.loop() + " loop");
            }
            type = request.loop();
            if (type != LoopType.LIST) {
                cursor = LoopCursor.from(request.from() == null ? firstOf(request) : request.from());
            }
        }
        logger.info("Using the " + type.name().toLowerCase() + " loop");
        return new Selection(create(type), cursor);
    }

    private static int firstOf(LoopRequest request) {
        return request.list().isEmpty() ? 1 : request.list().get(0);
    }

    /// @param type strategy, not null
    /// @return a loop of that type over this selector's data directory
    public DataLoop create(LoopType type) {
        return switch (type) {
            case LIST -> new ListLoop(data);
            case INF -> new InfiniteLoop(data);
            case WAIT -> new WaitLoop(data, pollInterval, timeout);
            case FLAG -> new FlagLoop(data, pollInterval, timeout, flagLookahead);
            case FILE -> new FileLoop(data);
        };
    }

    /// Loop arguments of a run.
    ///
    /// @param loop explicit strategy, or null to derive it
    /// @param from first observation, or null
    /// @param to last observation, or null
    /// @param list explicit observations, empty if none
    /// @param files explicit filenames, empty if none
    /// @param skip skip missing observations
    public record LoopRequest(
            LoopType loop, Integer from, Integer to, List<Integer> list, List<String> files, boolean skip) {

        public LoopRequest {
            list = list == null ? List.of() : List.copyOf(list);
            files = files == null ? List.of() : List.copyOf(files);
            if (from != null && to != null && to < from) {
                throw new IllegalArgumentException("--to " + to + " is before --from " + from);
            }
        }
    }

    /// @param loop the strategy
    /// @param cursor its starting position
    public record Selection(DataLoop loop, LoopCursor cursor) {}
}
