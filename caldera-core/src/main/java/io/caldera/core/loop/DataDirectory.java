package io.caldera.core.loop;

import io.caldera.core.exception.LoopException;
import io.caldera.core.frame.Frame;
import io.caldera.core.frame.FrameFactory;
import io.caldera.core.instrument.RawNamingScheme;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.OptionalInt;
import java.util.logging.Logger;
import java.util.stream.Stream;

/// The raw data directory of a night and the output directory frames are reduced in.
///
/// Raw files are read from the input directory. When the output directory is
/// a different one, a symbolic link to the raw file is created there so that
/// recipes can treat every file as local; the link is removed after the
/// frame's recipe.
public class DataDirectory {

    private static final Logger logger = Logger.getLogger(DataDirectory.class.getName());

    private final Path inputDir;
    private final Path outputDir;
    private final RawNamingScheme naming;

    public DataDirectory(Path inputDir, Path outputDir, RawNamingScheme naming) {
        this.inputDir = inputDir;
        this.outputDir = outputDir;
        this.naming = naming;
    }

    public Path rawPath(String utdate, int observation) {
        return inputDir.resolve(naming.rawFileName(utdate, observation));
    }

    public Path flagPath(String utdate, int observation) {
        return inputDir.resolve(naming.flagFileName(utdate, observation));
    }

    /// Finds the lowest observation number above `after` with data present.
    ///
    /// @param utdate UT date, not null
    /// @param after observation number to search beyond
    /// @param byFlag look for flag files instead of data files
    /// @return the observation number, or empty if none is present
    /// @throws LoopException if the directory cannot be listed
    public OptionalInt nextPresent(String utdate, int after, boolean byFlag) throws LoopException {
        int best = Integer.MAX_VALUE;
        try (Stream<Path> files = Files.list(inputDir)) {
            for (Path file : (Iterable<Path>) files::iterator) {
                OptionalInt n = observationOf(utdate, file.getFileName().toString(), byFlag);
                if (n.isPresent() && n.getAsInt() > after && n.getAsInt() < best) {
                    best = n.getAsInt();
                }
            }
        } catch (IOException e) {
            throw new LoopException("Unable to scan data directory " + inputDir, e);
        }
        return best == Integer.MAX_VALUE ? OptionalInt.empty() : OptionalInt.of(best);
    }

    /// Finds the highest observation number present for the night.
    ///
    /// @param utdate UT date, not null
    /// @return the number, or empty if the directory holds no raw data of that night
    /// @throws LoopException if the directory cannot be listed
    public OptionalInt highestPresent(String utdate) throws LoopException {
        int best = Integer.MIN_VALUE;
        try (Stream<Path> files = Files.list(inputDir)) {
            for (Path file : (Iterable<Path>) files::iterator) {
                OptionalInt n = naming.observationNumber(utdate, file.getFileName().toString());
                if (n.isPresent() && n.getAsInt() > best) {
                    best = n.getAsInt();
                }
            }
        } catch (IOException e) {
            throw new LoopException("Unable to scan data directory " + inputDir, e);
        }
        return best == Integer.MIN_VALUE ? OptionalInt.empty() : OptionalInt.of(best);
    }

    private OptionalInt observationOf(String utdate, String fileName, boolean byFlag) {
        if (!byFlag) {
            return naming.observationNumber(utdate, fileName);
        }
        if (!fileName.startsWith(".") || !fileName.endsWith(".ok")) {
            return OptionalInt.empty();
        }
        String stem = fileName.substring(1, fileName.length() - ".ok".length());
        OptionalInt n = naming.observationNumber(utdate, stem + extensionOf(utdate));
        return n.isPresent() && naming.flagFileName(utdate, n.getAsInt()).equals(fileName)
                ? n
                : OptionalInt.empty();
    }

    private String extensionOf(String utdate) {
        String sample = naming.rawFileName(utdate, 1);
        int dot = sample.lastIndexOf('.');
        return dot < 0 ? "" : sample.substring(dot);
    }

    /// Creates a configured frame for a raw file, linking it into the output directory.
    ///
    /// @param frames frame factory, not null
    /// @param rawFile raw file in (or relative to) the input directory, not null
    /// @param utdate UT date, not null
    /// @return the configured frame, never null
    /// @throws LoopException if the file cannot be linked or its header read
    public Frame linkAndRead(FrameFactory frames, Path rawFile, String utdate) throws LoopException {
        Path source = inputDir.resolve(rawFile);
        String name = source.getFileName().toString();
        Path link = null;
        try {
            if (!sameDirectory()) {
                link = outputDir.resolve(name);
                Files.deleteIfExists(link);
                Files.createSymbolicLink(link, source.toAbsolutePath());
                logger.fine("Linked " + source + " to " + link);
            }
            Frame frame = frames.create(source, name, utdate);
            if (link != null) {
                frame.setRawLink(link);
            }
            return frame;
        } catch (IOException e) {
            throw new LoopException("Unable to read " + source + ": " + e.getMessage(), e);
        }
    }

    public boolean sameDirectory() {
        return outputDir == null || inputDir.toAbsolutePath().normalize()
                .equals(outputDir.toAbsolutePath().normalize());
    }

    public Path getInputDir() {
        return inputDir;
    }

    public Path getOutputDir() {
        return outputDir;
    }

    public RawNamingScheme getNaming() {
        return naming;
    }
}
