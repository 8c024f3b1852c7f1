package io.caldera.core.exception;

import java.io.Serial;
import java.nio.file.Path;
import java.util.List;

public class RecipeNotFoundException extends Exception {
    @Serial private static final long serialVersionUID = 3360528831924437418L;

    private final List<Path> searched;

    public RecipeNotFoundException(String name, List<Path> searched) {
        super("Unable to find '" + name + "' in any of " + searched);
        this.searched = List.copyOf(searched);
    }

    public List<Path> getSearched() {
        return searched;
    }
}
