package io.caldera.core.calibration;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/// Directories searched for calibration files, rules and static indexes.
///
/// The output directory is searched first since products of the current run
/// live there, then the calibration directories in order.
public class CalibrationSearchPath {

    private final Path outputDir;
    private final List<Path> calibrationDirs;

    public CalibrationSearchPath(Path outputDir, List<Path> calibrationDirs) {
        this.outputDir = outputDir;
        this.calibrationDirs = List.copyOf(calibrationDirs);
    }

    /// Finds a file on the whole search path.
    ///
    /// @param fileName bare filename, not null
    /// @return the first existing match, or empty
    public Optional<Path> find(String fileName) {
        for (Path dir : dirs()) {
            Path candidate = dir.resolve(fileName);
            if (Files.exists(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /// Finds a file in the calibration directories only.
    ///
    /// @param fileName bare filename, not null
    /// @return the first existing match, or empty
    public Optional<Path> findStatic(String fileName) {
        for (Path dir : calibrationDirs) {
            Path candidate = dir.resolve(fileName);
            if (Files.exists(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /// @return output directory followed by calibration directories, never null
    public List<Path> dirs() {
        List<Path> all = new ArrayList<>();
        all.add(outputDir);
        all.addAll(calibrationDirs);
        return all;
    }

    public Path getOutputDir() {
        return outputDir;
    }

    public List<Path> getCalibrationDirs() {
        return calibrationDirs;
    }
}
