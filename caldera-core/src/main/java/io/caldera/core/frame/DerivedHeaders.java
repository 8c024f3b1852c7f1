package io.caldera.core.frame;

/// Keys of the values the pipeline derives for every frame at configuration.
///
/// They live in the frame's derived header, never in the raw header read from
/// disk, and take precedence over raw keys of the same name.
public final class DerivedHeaders {

    public static final String OBSERVATION_NUMBER = "DR_OBSNUM";
    public static final String UTDATE = "DR_UTDATE";
    public static final String TIME = "DR_TIME";
    public static final String OBSERVATION_MODE = "DR_MODE";
    public static final String GROUP = "DR_GROUP";
    public static final String RECIPE = "DR_RECIPE";

    private DerivedHeaders() {}
}
