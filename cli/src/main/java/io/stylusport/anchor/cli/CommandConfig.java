package io.stylusport.anchor.cli;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;

/** Settings for one invocation, collected from the parsed command line. */
public final class CommandConfig {
    private final Command command;
    private final Path inputPath;
    private final Path outputPath;
    private final OutputFormat format;
    private final int verbosity;
    private final boolean quiet;

    CommandConfig(
            Command command, Path inputPath, Path outputPath, OutputFormat format, int verbosity, boolean quiet) {
        this.command = Objects.requireNonNull(command, "command");
        this.inputPath = Objects.requireNonNull(inputPath, "inputPath");
        this.outputPath = outputPath;
        this.format = Objects.requireNonNull(format, "format");
        this.verbosity = verbosity;
        this.quiet = quiet;
    }

    public Command getCommand() {
        return command;
    }

    public Path getInputPath() {
        return inputPath;
    }

    /** Report destination; standard output when absent. */
    public Optional<Path> getOutputPath() {
        return Optional.ofNullable(outputPath);
    }

    public OutputFormat getFormat() {
        return format;
    }

    public int getVerbosity() {
        return verbosity;
    }

    public boolean isQuiet() {
        return quiet;
    }

    public Level getLogLevel() {
        if (quiet) {
            return Level.WARNING;
        }
        if (verbosity >= 2) {
            return Level.FINEST;
        }
        if (verbosity == 1) {
            return Level.FINE;
        }
        return Level.INFO;
    }
}
