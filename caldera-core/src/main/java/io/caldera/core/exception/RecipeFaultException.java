package io.caldera.core.exception;

import java.io.Serial;

/// A recipe statement failed at run time. Fails the current frame only.
///
/// A fault raised while interpreting a statement (an unknown statement or an
/// undefined variable) is a syntax fault and is reported with the surrounding
/// steps.
public class RecipeFaultException extends RuntimeException {
    @Serial private static final long serialVersionUID = 8270011533602786613L;

    private final boolean syntax;

    public RecipeFaultException(String message) {
        this(message, false);
    }

    public RecipeFaultException(String message, boolean syntax) {
        super(message);
        this.syntax = syntax;
    }

    public RecipeFaultException(String message, Throwable cause) {
        super(message, cause);
        this.syntax = false;
    }

    public boolean isSyntax() {
        return syntax;
    }
}
