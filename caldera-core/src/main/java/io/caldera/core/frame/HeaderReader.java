package io.caldera.core.frame;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/// Reads the metadata header of a raw observation file.
///
/// Values are `String`, `Long`, `Double` or `Boolean`; keys keep file order.
@FunctionalInterface
public interface HeaderReader {

    /// @param file the raw file, not null
    /// @return the header in file order, never null
    /// @throws IOException if the file cannot be read or is not in the expected format
    Map<String, Object> read(Path file) throws IOException;
}
