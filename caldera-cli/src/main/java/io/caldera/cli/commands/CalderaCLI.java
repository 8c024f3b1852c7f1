package io.caldera.cli.commands;

import io.quarkus.picocli.runtime.annotations.TopCommand;
import picocli.CommandLine.Command;

/// Main entry point for the Caldera CLI application.
///
/// Registers the subcommands:
/// - `run` - Reduce a night of observations
/// - `compile` - Expand a recipe and print its step list as JSON
/// - `calib` - List a calibration index or check a header against it
///
/// @see RunCommand
/// @see CompileCommand
/// @see CalibCommand
@TopCommand
@Command(
        name = "caldera",
        description = "Caldera recipe pipeline",
        mixinStandardHelpOptions = true,
        subcommands = {RunCommand.class, CompileCommand.class, CalibCommand.class})
public class CalderaCLI {}
