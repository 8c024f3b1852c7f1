package io.caldera.core.loop;

import io.caldera.core.exception.LoopException;
import io.caldera.core.frame.Frame;
import io.caldera.core.frame.FrameFactory;
import java.util.Optional;

/// Strategy delivering the next observation to process.
///
/// ### Contracts
/// - **Postcondition**: an empty result means there is no more work; the
///   orchestrator stops acquiring frames
/// - **Postcondition**: a returned frame is configured and, when the input and
///   output directories differ, linked into the output directory
/// - Timeouts and I/O failures are thrown, never reported as an empty result
///
/// @see LoopType for the available strategies
public interface DataLoop {

    /// Returns the next frame.
    ///
    /// @param frames factory configuring frames for the instrument, not null
    /// @param utdate UT date of the night, not null
    /// @param cursor loop position, advanced by this call, not null
    /// @param skip whether missing observations are skipped rather than ending the loop
    /// @return the next frame, or empty when there is no more work
    /// @throws io.caldera.core.exception.LoopTimeoutException if waiting for data timed out
    /// @throws LoopException if data was found but could not be read
    Optional<Frame> next(FrameFactory frames, String utdate, LoopCursor cursor, boolean skip)
            throws LoopException;

    /// @return the strategy name used in messages
    String name();
}
