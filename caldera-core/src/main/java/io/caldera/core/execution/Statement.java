package io.caldera.core.execution;

import io.caldera.core.exception.RecipeFaultException;
import java.util.List;

/// A parsed statement ready for its handler.
///
/// @param keyword the first word of the statement
/// @param text everything after the keyword, variables interpolated
/// @param arguments `text` split on whitespace
public record Statement(String keyword, String text, List<String> arguments) {

    public Statement {
        arguments = List.copyOf(arguments);
    }

    /// @param index 0-based argument position
    /// @return the argument
    /// @throws RecipeFaultException if the statement has fewer arguments
    public String argument(int index) {
        if (index >= arguments.size()) {
            throw new RecipeFaultException(
                    "'" + keyword + "' expects at least " + (index + 1) + " argument(s)", true);
        }
        return arguments.get(index);
    }
}
