package io.stylusport.anchor.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.Optional;
import java.util.logging.Level;
import org.junit.jupiter.api.Test;

class CommandLineOptionsTest {

    @Test
    void defaultsToTextOnStandardOutput() throws Exception {
        CommandConfig config = CommandLineOptions.parse(new String[] {"normalize", "program.rs"});

        assertEquals(Command.NORMALIZE, config.getCommand());
        assertEquals(Path.of("program.rs"), config.getInputPath());
        assertEquals(Optional.empty(), config.getOutputPath());
        assertEquals(OutputFormat.TEXT, config.getFormat());
        assertEquals(Level.INFO, config.getLogLevel());
    }

    @Test
    void optionsMayFollowPositionalArguments() throws Exception {
        CommandConfig config =
                CommandLineOptions.parse(new String[] {"parse", "program.rs", "-f", "debug", "--output", "out.txt"});

        assertEquals(Command.PARSE, config.getCommand());
        assertEquals(OutputFormat.DEBUG, config.getFormat());
        assertEquals(Optional.of(Path.of("out.txt")), config.getOutputPath());
    }

    @Test
    void repeatedVerboseRaisesLogLevel() throws Exception {
        assertEquals(Level.FINE, CommandLineOptions.parse(new String[] {"-v", "parse", "a.rs"}).getLogLevel());

        CommandConfig config = CommandLineOptions.parse(new String[] {"-vv", "parse", "a.rs"});
        assertEquals(2, config.getVerbosity());
        assertEquals(Level.FINEST, config.getLogLevel());
    }

    @Test
    void quietOnlyLogsWarnings() throws Exception {
        CommandConfig config = CommandLineOptions.parse(new String[] {"-q", "parse", "a.rs"});

        assertTrue(config.isQuiet());
        assertEquals(Level.WARNING, config.getLogLevel());
    }

    @Test
    void verboseAndQuietAreExclusive() {
        assertThrows(UsageException.class, () -> CommandLineOptions.parse(new String[] {"-v", "-q", "parse", "a.rs"}));
    }

    @Test
    void rejectsBadArguments() {
        assertThrows(UsageException.class, () -> CommandLineOptions.parse(new String[] {"parse"}));
        assertThrows(UsageException.class, () -> CommandLineOptions.parse(new String[] {"parse", "a.rs", "b.rs"}));
        assertThrows(UsageException.class, () -> CommandLineOptions.parse(new String[] {"lint", "a.rs"}));
        assertThrows(UsageException.class, () -> CommandLineOptions.parse(new String[] {"-f", "json", "parse", "a.rs"}));
        assertThrows(UsageException.class, () -> CommandLineOptions.parse(new String[] {"--bogus", "parse", "a.rs"}));
    }

    @Test
    void helpShortCircuitsValidation() throws Exception {
        assertNull(CommandLineOptions.parse(new String[] {"-h"}));
    }
}
