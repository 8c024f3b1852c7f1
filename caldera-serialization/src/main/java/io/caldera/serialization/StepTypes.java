package io.caldera.serialization;

/// Discriminator values of serialized steps.
final class StepTypes {

    static final String STATEMENT = "statement";
    static final String ENGINE_CALL = "engine_call";
    static final String ENGINE_CHECK = "engine_check";
    static final String STATUS_CHECK = "status_check";
    static final String ARGS = "args";
    static final String ENTER = "enter";
    static final String EXIT = "exit";

    private StepTypes() {}
}
