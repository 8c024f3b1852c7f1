package io.caldera.core.exception;

import java.io.Serial;
import java.util.List;

/// Recipe expansion failed: a primitive cycle, the depth limit, or an
/// unreadable source file.
public class RecipeCompileException extends Exception {
    @Serial private static final long serialVersionUID = -7732159624087732215L;

    private final List<String> path;

    public RecipeCompileException(String message, List<String> path) {
        super(message);
        this.path = List.copyOf(path);
    }

    public RecipeCompileException(String message, List<String> path, Throwable cause) {
        super(message, cause);
        this.path = List.copyOf(path);
    }

    /// @return recipe then primitive names leading to the failure, never null
    public List<String> getPath() {
        return path;
    }
}
