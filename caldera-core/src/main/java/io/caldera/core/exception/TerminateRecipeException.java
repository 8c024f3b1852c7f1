package io.caldera.core.exception;

import java.io.Serial;

/// Ends the current recipe early on purpose. Counted apart from errors.
public class TerminateRecipeException extends RuntimeException {
    @Serial private static final long serialVersionUID = -1285530976129400321L;

    public TerminateRecipeException(String message) {
        super(message);
    }
}
