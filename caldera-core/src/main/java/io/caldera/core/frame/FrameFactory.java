package io.caldera.core.frame;

import io.caldera.core.instrument.HeaderConventions;
import io.caldera.core.instrument.Instrument;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.OptionalInt;
import java.util.logging.Logger;

/// Creates and configures frames for newly arrived raw files.
///
/// Configuration reads the header, computes the derived values, resolves the
/// recipe name and the group key. A frame leaves the factory ready to be
/// placed in its group.
public class FrameFactory {

    private static final Logger logger = Logger.getLogger(FrameFactory.class.getName());

    private final Instrument instrument;
    private final HeaderReader headerReader;

    public FrameFactory(Instrument instrument, HeaderReader headerReader) {
        this.instrument = instrument;
        this.headerReader = headerReader;
    }

    /// Creates a configured frame.
    ///
    /// @param rawFile the raw file on disk, not null
    /// @param workingName name under which recipes refer to the raw file, not null
    /// @param utdate UT date of the night being reduced, not null
    /// @return the configured frame, never null
    /// @throws IOException if the header cannot be read
    public Frame create(Path rawFile, String workingName, String utdate) throws IOException {
        Map<String, Object> header = headerReader.read(rawFile);
        Frame frame = new Frame(workingName, header);
        configure(frame, rawFile.getFileName().toString(), utdate);
        return frame;
    }

    /// Computes derived headers, recipe name and group key on an existing frame.
    ///
    /// @param frame the frame, not null
    /// @param rawName bare raw filename used to recover the observation number, not null
    /// @param utdate UT date of the night, not null
    public void configure(Frame frame, String rawName, String utdate) {
        HeaderConventions conventions = instrument.headers();

        OptionalInt parsed = instrument.naming().observationNumber(utdate, rawName);
        int number = parsed.isPresent() ? parsed.getAsInt() : frame.number();
        frame.setDerived(DerivedHeaders.OBSERVATION_NUMBER, number);
        frame.setDerived(DerivedHeaders.UTDATE, utdate);

        Object time = frame.headerValue(conventions.timeKey());
        frame.setDerived(DerivedHeaders.TIME, time instanceof Number ? time : (double) number);

        Object mode = frame.headerValue(conventions.observationModeKey());
        frame.setDerived(DerivedHeaders.OBSERVATION_MODE, mode == null ? "" : mode.toString());

        Object recipe = frame.headerValue(conventions.recipeKey());
        if (recipe == null || recipe.toString().isBlank()) {
            logger.fine("No recipe in header of " + rawName + ", using " + conventions.defaultRecipe());
            frame.setRecipe(conventions.defaultRecipe());
        } else {
            frame.setRecipe(recipe.toString().trim());
        }

        frame.setGroupKey(instrument.grouping().groupKey(frame));
    }

    public Instrument getInstrument() {
        return instrument;
    }
}
