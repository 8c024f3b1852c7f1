package io.caldera.cli.commands;

import io.caldera.cli.ui.AnsiStyles;
import java.util.concurrent.Callable;
import picocli.CommandLine.Option;

/// Minimal abstract base for all Caldera CLI commands.
///
/// Owns the banner display and the {@link #call()} / {@link #execute()} contract.
/// The value returned by {@link #execute()} becomes the process exit status.
public abstract class CalderaCommand implements Callable<Integer> {

    /// Exit status for invalid arguments.
    static final int USAGE = 2;

    private static final String[] BANNER = {
        "",
        "   ___      _     _",
        "  / __|__ _| |__| |___ _ _ __ _",
        " | (__/ _` | / _` / -_) '_/ _` |",
        "  \\___\\__,_|_\\__,_\\___|_| \\__,_|",
        "",
        " Recipe pipeline",
        ""
    };

    @Option(
            names = {"--no-color"},
            description = "Disable colored output",
            negatable = true)
    boolean color = true;

    @Option(
            names = {"-q", "--quiet"},
            description = "Do not print the banner")
    boolean quiet = false;

    @Override
    public final Integer call() {
        if (!quiet) {
            for (String line : BANNER) {
                System.out.println(line);
            }
        }
        return execute();
    }

    protected AnsiStyles styles() {
        return AnsiStyles.of(color);
    }

    /// Prints a one-line failure to stderr.
    protected void printError(String headline, String detail) {
        AnsiStyles styles = styles();
        System.err.printf("%s %s %s%n", styles.crossmark(), styles.bold(headline), detail);
    }

    /// @return the process exit status
    protected abstract int execute();
}
