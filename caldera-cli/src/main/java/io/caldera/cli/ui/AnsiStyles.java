package io.caldera.cli.ui;

/// ANSI text styling for pipeline console output.
///
/// Methods return styled strings; printing is the caller's responsibility.
/// With color disabled every method returns its input unchanged, which keeps
/// log captures and piped output free of escape codes.
///
/// ### Usage
/// ```java
/// AnsiStyles styles = AnsiStyles.of(true);
/// System.out.println(styles.checkmark() + " " + styles.bold("f20260101_0001"));
/// ```
///
/// @implNote **Thread-safe**. Instances are immutable after construction.
public final class AnsiStyles {

    private static final String BOLD = "\033[1m";
    private static final String GRAY = "\033[38;5;244m";
    private static final String DIM = "\033[38;5;241m";
    private static final String GREEN = "\033[0;32m";
    private static final String RED = "\033[38;5;167m";
    private static final String YELLOW = "\033[38;5;214m";
    private static final String BLUE = "\033[38;5;39m";
    private static final String RESET = "\033[0m";

    private static final String RULE = "─".repeat(61);

    private final boolean useColor;

    private AnsiStyles(boolean useColor) {
        this.useColor = useColor;
    }

    /// @param useColor true to apply ANSI codes, false for plain text
    /// @return new instance, never null
    public static AnsiStyles of(boolean useColor) {
        return new AnsiStyles(useColor);
    }

    public boolean isColorEnabled() {
        return useColor;
    }

    private String style(String text, String code) {
        return useColor ? code + text + RESET : text;
    }

    // --- Text ---

    public String bold(String text) {
        return style(text, BOLD);
    }

    /// Secondary detail such as file paths and step listings.
    public String gray(String text) {
        return style(text, GRAY);
    }

    // --- Semantic colors ---

    public String success(String text) {
        return style(text, GREEN);
    }

    public String error(String text) {
        return style(text, RED);
    }

    public String warn(String text) {
        return style(text, YELLOW);
    }

    public String accent(String text) {
        return style(text, BLUE);
    }

    /// Colors green on success, red on failure.
    public String successOrError(String text, boolean isSuccess) {
        return style(text, isSuccess ? GREEN : RED);
    }

    // --- Symbols ---

    public String arrow() {
        return style("→", BLUE);
    }

    public String bullet() {
        return style("•", GRAY);
    }

    public String checkmark() {
        return style("✓", GREEN);
    }

    public String crossmark() {
        return style("✗", RED);
    }

    // --- Separators ---

    public String separatorTop() {
        return style("┌" + RULE, DIM);
    }

    public String separatorMid() {
        return style(" " + RULE, DIM);
    }

    public String separatorBottom() {
        return style("└" + RULE, DIM);
    }
}
