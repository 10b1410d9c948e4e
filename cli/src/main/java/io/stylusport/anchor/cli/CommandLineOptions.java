package io.stylusport.anchor.cli;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.OptionGroup;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

/** Command line definition and its translation into a {@link CommandConfig}. */
final class CommandLineOptions {
    static final String USAGE = "stylusport <parse|normalize> [options] <input.rs>";

    private static final String FORMAT_FLAG = "f";
    private static final String OUTPUT_FLAG = "o";
    private static final String VERBOSE_FLAG = "v";
    private static final String QUIET_FLAG = "q";
    private static final String HELP_FLAG = "h";

    private CommandLineOptions() {}

    static Options options() {
        Options options = new Options();
        options.addOption(Option.builder(FORMAT_FLAG)
                .longOpt("format")
                .hasArg()
                .argName("text|debug")
                .desc("Report format (default: text)")
                .build());
        options.addOption(Option.builder(OUTPUT_FLAG)
                .longOpt("output")
                .hasArg()
                .argName("file")
                .desc("Write the report to a file instead of standard output")
                .build());

        OptionGroup logging = new OptionGroup();
        logging.addOption(Option.builder(VERBOSE_FLAG)
                .longOpt("verbose")
                .desc("More logging; repeat for even more")
                .build());
        logging.addOption(Option.builder(QUIET_FLAG)
                .longOpt("quiet")
                .desc("Only log warnings and errors")
                .build());
        options.addOptionGroup(logging);

        options.addOption(HELP_FLAG, "help", false, "Show this help");
        return options;
    }

    /** Returns null when help was requested. */
    static CommandConfig parse(String[] args) throws UsageException {
        CommandLineParser parser = new DefaultParser();
        CommandLine cmd;
        try {
            cmd = parser.parse(options(), args);
        } catch (ParseException ex) {
            throw new UsageException(ex.getMessage(), ex);
        }
        if (cmd.hasOption(HELP_FLAG)) {
            return null;
        }

        List<String> positional = cmd.getArgList();
        if (positional.size() != 2) {
            throw new UsageException("Expected a command and one input file");
        }
        Command command = Command.fromName(positional.get(0));
        Path input = toPath(positional.get(1));
        Path output = cmd.hasOption(OUTPUT_FLAG) ? toPath(cmd.getOptionValue(OUTPUT_FLAG)) : null;
        OutputFormat format = cmd.hasOption(FORMAT_FLAG)
                ? OutputFormat.fromName(cmd.getOptionValue(FORMAT_FLAG))
                : OutputFormat.TEXT;
        return new CommandConfig(command, input, output, format, countVerbose(cmd), cmd.hasOption(QUIET_FLAG));
    }

    static String help() {
        StringWriter buffer = new StringWriter();
        PrintWriter writer = new PrintWriter(buffer);
        new HelpFormatter().printHelp(writer, HelpFormatter.DEFAULT_WIDTH, USAGE, null, options(),
                HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, null);
        writer.flush();
        return buffer.toString();
    }

    private static int countVerbose(CommandLine cmd) {
        int count = 0;
        for (Option option : cmd.getOptions()) {
            if (VERBOSE_FLAG.equals(option.getOpt())) {
                count++;
            }
        }
        return count;
    }

    private static Path toPath(String value) throws UsageException {
        try {
            return Path.of(value);
        } catch (InvalidPathException ex) {
            throw new UsageException("Invalid path: " + value, ex);
        }
    }
}
