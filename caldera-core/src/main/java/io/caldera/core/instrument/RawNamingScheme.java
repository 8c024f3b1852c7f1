package io.caldera.core.instrument;

import java.util.OptionalInt;

/// Filename conventions for raw observations, their flag files and group products.
///
/// One implementation per instrument. The data-arrival loops only ever ask the
/// scheme for names, so an instrument with a different layout needs nothing
/// but a new scheme.
///
/// @see PrefixedNamingScheme
public interface RawNamingScheme {

    /// Returns the raw data filename for an observation.
    ///
    /// @param utdate UT date in `YYYYMMDD` form, not null
    /// @param observationNumber the observation number, positive
    /// @return the bare filename (no directory), never null
    String rawFileName(String utdate, int observationNumber);

    /// Returns the sentinel filename that marks the observation as fully written.
    ///
    /// @param utdate UT date in `YYYYMMDD` form, not null
    /// @param observationNumber the observation number, positive
    /// @return the bare flag filename, never null
    String flagFileName(String utdate, int observationNumber);

    /// Parses the observation number out of a raw filename for the given night.
    ///
    /// @param utdate UT date the file must belong to, not null
    /// @param fileName bare filename, not null
    /// @return the observation number, or empty if the name is not a raw file of that night
    OptionalInt observationNumber(String utdate, String fileName);

    /// Returns the output filename used by a group.
    ///
    /// @param utdate UT date of the group's first frame, not null
    /// @param groupKey the group key, not null
    /// @return the bare group filename, never null
    String groupFileName(String utdate, String groupKey);
}
