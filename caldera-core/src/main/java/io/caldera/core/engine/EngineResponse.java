package io.caldera.core.engine;

/// Reply of an algorithm engine to one request.
///
/// @param status engine status code, {@link #OK} on success
/// @param message engine output or diagnostic, never null
public record EngineResponse(int status, String message) {

    public static final int OK = 0;

    /// Status an engine returns when it is no longer usable and must be relaunched.
    public static final int BAD_ENGINE = 2;

    public static EngineResponse ok() {
        return new EngineResponse(OK, "");
    }

    public static EngineResponse ok(String message) {
        return new EngineResponse(OK, message);
    }

    public static EngineResponse failed(int status, String message) {
        return new EngineResponse(status, message);
    }

    public boolean isOk() {
        return status == OK;
    }
}
