package io.caldera.cli.execution;

import io.caldera.cli.ui.AnsiStyles;
import io.caldera.core.engine.EngineResponse;
import io.caldera.core.execution.RecipeListener;
import io.caldera.core.execution.RecipeStatus;
import io.caldera.core.frame.Frame;
import io.caldera.core.frame.Group;
import java.io.PrintStream;

/// Recipe listener that prints every frame, primitive and engine call.
///
/// ### Output Format
/// ```
/// ┌─────────────────────────────────────────────────────────────
///   * FRAME f20260101_0001 [OBJECT] → gf20260101_1
///  ─────────────────────────────────────────────────────────────
///   REDUCE_OBJECT
///     _FLAT_FIELD_  (from REDUCE_OBJECT)
///       kappa.div in=f20260101_0001 ... ✓
/// └─────────────────────────────────────────────────────────────
///   * REDUCE_OBJECT (OK)
/// ```
///
/// @implNote **Not thread-safe**. One listener serves one sequential run.
public class VerboseRecipeListener implements RecipeListener {

    private final PrintStream out;
    private final AnsiStyles styles;
    private int depth;

    /// @param out output stream, typically `System.out`, not null
    /// @param useColor whether to apply ANSI color codes
    public VerboseRecipeListener(PrintStream out, boolean useColor) {
        this.out = out;
        this.styles = AnsiStyles.of(useColor);
    }

    @Override
    public void onFrameStart(Frame frame, Group group) {
        out.println(styles.separatorTop());
        out.printf(
                "  %s %s [%s] %s %s%n",
                styles.accent("*"),
                styles.bold("FRAME " + frame.raw()),
                frame.recipe() == null ? "-" : frame.recipe(),
                styles.arrow(),
                group == null ? "-" : group.file());
        out.println(styles.separatorMid());
    }

    @Override
    public void onRecipeStart(String recipe, Frame frame) {
        depth = 0;
        line(styles.bold(recipe));
    }

    @Override
    public void onPrimitiveEnter(String primitive, String caller) {
        depth++;
        line(primitive + "  " + styles.gray("(from " + caller + ")"));
    }

    @Override
    public void onPrimitiveExit(String primitive) {
        if (depth > 0) {
            depth--;
        }
    }

    @Override
    public void onEngineCall(String engine, String operation, String arguments, EngineResponse response) {
        String call = engine + "." + operation + (arguments == null || arguments.isEmpty() ? "" : " " + arguments);
        if (response == null) {
            line("  " + call + " " + styles.crossmark() + " " + styles.error("engine unavailable"));
        } else if (response.isOk()) {
            line("  " + call + " " + styles.checkmark());
        } else {
            line("  " + call + " " + styles.crossmark() + " "
                    + styles.error("status " + response.status()));
        }
    }

    @Override
    public void onRecipeComplete(String recipe, Frame frame, RecipeStatus status) {
        out.println(styles.separatorBottom());
        String marker = styles.successOrError("*", status.isGood());
        out.printf("  %s %s (%s)%n", marker, recipe, styles.successOrError(status.name(), status.isGood()));
        out.println();
    }

    private void line(String text) {
        out.println("  " + "  ".repeat(depth) + text);
    }
}
