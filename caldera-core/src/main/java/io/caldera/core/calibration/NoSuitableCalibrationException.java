package io.caldera.core.calibration;

import java.io.Serial;

/// No index entry is compatible with the frame being reduced.
///
/// Fails the current recipe only; the run carries on with the next frame.
public class NoSuitableCalibrationException extends Exception {
    @Serial private static final long serialVersionUID = 4127983465170023319L;

    private final String role;

    public NoSuitableCalibrationException(String role, String message) {
        super(message);
        this.role = role;
    }

    public NoSuitableCalibrationException(String role, String message, Throwable cause) {
        super(message, cause);
        this.role = role;
    }

    public String getRole() {
        return role;
    }
}
