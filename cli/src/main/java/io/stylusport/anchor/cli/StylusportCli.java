package io.stylusport.anchor.cli;

import io.stylusport.anchor.model.Program;
import io.stylusport.anchor.normalize.NormalizationException;
import io.stylusport.anchor.normalize.NormalizedProgram;
import io.stylusport.anchor.normalize.Normalizer;
import io.stylusport.anchor.normalize.ValidationIssue;
import io.stylusport.anchor.parser.AnchorParseException;
import io.stylusport.anchor.parser.AnchorParser;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@code stylusport parse|normalize [options] <input.rs>}: extracts the Anchor program model from a source
 * file and prints it, optionally normalized. Validation issues are always reported, never dropped.
 */
public final class StylusportCli {
    private static final Logger LOGGER = Logger.getLogger(StylusportCli.class.getName());

    private final PrintStream out;
    private final PrintStream err;

    StylusportCli(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        System.exit(new StylusportCli(System.out, System.err).run(args).code());
    }

    ExitCode run(String[] args) {
        CommandConfig config;
        try {
            config = CommandLineOptions.parse(args);
        } catch (UsageException ex) {
            err.println("error: " + ex.getMessage());
            err.print(CommandLineOptions.help());
            return ExitCode.USAGE;
        }
        if (config == null) {
            out.print(CommandLineOptions.help());
            return ExitCode.SUCCESS;
        }
        LoggingSetup.configure(config.getLogLevel());
        return execute(config);
    }

    ExitCode execute(CommandConfig config) {
        LOGGER.log(Level.INFO, "Parsing {0}", config.getInputPath());
        Program program;
        try {
            program = new AnchorParser().parseFile(config.getInputPath());
        } catch (AnchorParseException ex) {
            err.println("parse failed: " + ex.getMessage());
            return ExitCode.PARSE_FAILURE;
        }

        if (config.getCommand() == Command.PARSE) {
            String report = config.getFormat() == OutputFormat.DEBUG
                    ? program + System.lineSeparator()
                    : TextRenderer.render(program);
            return write(config, report);
        }

        NormalizedProgram normalized;
        try {
            normalized = new Normalizer().normalize(program);
        } catch (NormalizationException ex) {
            err.println("normalization failed: " + ex.getMessage());
            return ExitCode.NORMALIZE_FAILURE;
        }
        LOGGER.log(Level.INFO, "Normalized {0} with {1} issue(s)", new Object[] {
            normalized.getName(), normalized.getValidationIssues().size()
        });
        if (normalized.hasErrors()) {
            LOGGER.log(Level.WARNING, "Program {0} has {1} error-level validation issue(s)", new Object[] {
                normalized.getName(), normalized.countIssues(ValidationIssue.Severity.ERROR)
            });
        }

        String report = config.getFormat() == OutputFormat.DEBUG
                ? normalized + System.lineSeparator()
                : TextRenderer.render(normalized);
        String issues = TextRenderer.renderIssues(normalized.getValidationIssues());
        if (config.getOutputPath().isPresent()) {
            ExitCode written = write(config, report);
            err.print(issues);
            return written;
        }
        return write(config, report + issues);
    }

    private ExitCode write(CommandConfig config, String report) {
        Optional<Path> output = config.getOutputPath();
        if (output.isEmpty()) {
            out.print(report);
            out.flush();
            return ExitCode.SUCCESS;
        }
        try {
            Files.writeString(output.get(), report, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            err.println("failed to write " + output.get() + ": " + ex.getMessage());
            return ExitCode.OUTPUT_FAILURE;
        }
        LOGGER.log(Level.INFO, "Wrote report to {0}", output.get());
        return ExitCode.SUCCESS;
    }
}
