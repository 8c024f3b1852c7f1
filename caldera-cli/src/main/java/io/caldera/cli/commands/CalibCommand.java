package io.caldera.cli.commands;

import io.caldera.cli.ui.AnsiStyles;
import io.caldera.core.CalderaEnvironment;
import io.caldera.core.calibration.CalibrationIndex;
import io.caldera.core.calibration.IndexEntry;
import io.caldera.core.calibration.SearchMode;
import io.caldera.core.calibration.Verdict;
import io.caldera.core.frame.FrameFactory;
import jakarta.inject.Inject;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/// CLI command that inspects a calibration index.
///
/// Without `--header` the entries of the role's index are listed. With a
/// data file, each entry is checked against the file's header (with the derived
/// headers a pipeline run would add) and the entry the selector would choose is
/// reported.
///
/// ### Usage
/// ```bash
/// caldera calib <role> [--header FILE [--ut YYYYMMDD]] [--entry NAME] [--earlier]
/// ```
@Command(name = "calib", description = "List a calibration index or check a frame against it")
class CalibCommand extends CalderaCommand {

    @Parameters(index = "0", description = "Calibration role, e.g. dark")
    private String role;

    @Option(names = "--header", description = "Data file whose header is checked against the index")
    private Path header;

    @Option(names = "--entry", description = "Only verify this index entry")
    private String entry;

    @Option(names = "--ut", description = "UT date of the data file, YYYYMMDD")
    private String utdate = "";

    @Option(names = "--earlier", description = "Only consider calibrations taken before the frame")
    private boolean earlier = false;

    @Inject CalderaEnvironment environment;

    @Override
    protected int execute() {
        AnsiStyles styles = styles();
        String normalised = role.toLowerCase(Locale.ROOT);

        CalibrationIndex index;
        try {
            index = environment.getCalibration().getIndexes().index(normalised);
        } catch (IOException e) {
            printError("Unable to open the " + normalised + " index:", e.getMessage());
            return 1;
        }

        if (header == null) {
            listEntries(index, styles);
            return 0;
        }

        Map<String, Object> context;
        try {
            context = new FrameFactory(environment.getInstrument(), environment.getHeaderReader())
                    .create(header, header.getFileName().toString(), utdate)
                    .headerContext();
        } catch (IOException e) {
            printError("Unable to read header of " + header + ":", e.getMessage());
            return 1;
        }

        if (entry != null) {
            Verdict verdict = index.verify(entry, context);
            System.out.printf("%s %s%n", entry, styles.successOrError(verdict.name(), verdict == Verdict.SUITABLE));
            return verdict == Verdict.SUITABLE ? 0 : 1;
        }

        for (IndexEntry candidate : index.entries()) {
            Verdict verdict = index.verify(candidate.name(), context);
            System.out.printf(
                    "  %s %s%n",
                    styles.successOrError(verdict == Verdict.SUITABLE ? "+" : "-", verdict == Verdict.SUITABLE),
                    candidate.name());
        }
        Optional<IndexEntry> chosen;
        try {
            chosen = index.choose(context, earlier ? SearchMode.EARLIER : SearchMode.NEAREST);
        } catch (IllegalArgumentException e) {
            printError("Unable to search the " + normalised + " index:", e.getMessage());
            return 1;
        }
        if (chosen.isEmpty()) {
            printError("No suitable " + normalised + " for", header.toString());
            return 1;
        }
        System.out.printf("%n%s %s %s%n", styles.checkmark(), styles.bold("Selected " + normalised + ":"),
                chosen.get().name());
        return 0;
    }

    private void listEntries(CalibrationIndex index, AnsiStyles styles) {
        List<IndexEntry> entries = index.entries();
        System.out.printf(
                "%s %s%n",
                styles.bold(index.role() + " index"),
                styles.gray("(" + (index.file() == null ? "in memory" : index.file().toString())
                        + ", " + entries.size() + " entries)"));
        List<String> keys = index.rules().keys();
        System.out.println(styles.gray("  #name " + String.join(" ", keys)));
        for (IndexEntry e : entries) {
            StringBuilder line = new StringBuilder("  ").append(e.name());
            for (String key : keys) {
                line.append(' ').append(e.values().getOrDefault(key, "-"));
            }
            System.out.println(line);
        }
    }
}
