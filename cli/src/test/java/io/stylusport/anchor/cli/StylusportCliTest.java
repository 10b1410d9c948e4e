package io.stylusport.anchor.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class StylusportCliTest {

    private static final String VAULT = String.join(
            "\n",
            "use anchor_lang::prelude::*;",
            "",
            "#[program]",
            "pub mod vault {",
            "    use super::*;",
            "    pub fn initialize(ctx: Context<Initialize>) -> Result<()> { Ok(()) }",
            "    pub(crate) fn audit(ctx: Context<Missing>) -> Result<()> { Ok(()) }",
            "}",
            "",
            "#[derive(Accounts)]",
            "pub struct Initialize<'info> {",
            "    #[account(init, payer = authority, space = 8 + 32)]",
            "    pub vault: Account<'info, Vault>,",
            "    #[account(mut)]",
            "    pub authority: Signer<'info>,",
            "}",
            "",
            "#[account]",
            "pub struct Vault {",
            "    pub authority: Pubkey,",
            "}",
            "");

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private StylusportCli cli;
    private Path source;

    @BeforeEach
    void setUp() throws IOException {
        cli = new StylusportCli(
                new PrintStream(out, true, StandardCharsets.UTF_8), new PrintStream(err, true, StandardCharsets.UTF_8));
        source = tempDir.resolve("vault.rs");
        Files.writeString(source, VAULT, StandardCharsets.UTF_8);
    }

    @Test
    void parsePrintsExtractedModel() {
        ExitCode code = cli.run(new String[] {"parse", "-q", source.toString()});

        assertEquals(ExitCode.SUCCESS, code);
        String report = stdout();
        assertTrue(report.startsWith("Program (" + source + ")"), report);
        assertTrue(report.contains("  module vault [pub]"), report);
        assertTrue(report.contains("    instruction initialize [pub] -> Result<()>"), report);
        assertTrue(report.contains("      param ctx: Context<Initialize> (context)"), report);
        assertTrue(report.contains("      constraint payer = authority"), report);
        assertTrue(report.contains("  account Vault [pub]"), report);
        assertFalse(report.contains("Validation issues"), report);
    }

    @Test
    void normalizeReportsInferenceAndIssues() {
        ExitCode code = cli.run(new String[] {"normalize", "--quiet", source.toString()});

        assertEquals(ExitCode.SUCCESS, code);
        String report = stdout();
        assertTrue(report.startsWith("Program vault (id: program:" + source + ", schema 1.0)"), report);
        assertTrue(report.contains("        initialize vault (payer: authority)"), report);
        assertTrue(report.contains("      constraint mut (inferred)"), report);
        assertTrue(report.contains("      constraint signer (inferred)"), report);
        assertTrue(report.contains("Validation issues (2):"), report);
        assertTrue(report.contains("  WARNING [audit] Instruction audit references undefined account struct Missing"),
                report);
        assertTrue(report.contains("  INFO [audit] "), report);
    }

    @Test
    void outputFileKeepsIssuesOnStandardError() throws IOException {
        Path target = tempDir.resolve("report.txt");

        ExitCode code = cli.run(new String[] {"normalize", "-q", "-o", target.toString(), source.toString()});

        assertEquals(ExitCode.SUCCESS, code);
        assertEquals("", stdout());
        assertTrue(Files.readString(target, StandardCharsets.UTF_8).startsWith("Program vault"));
        assertTrue(stderr().startsWith("Validation issues (2):"), stderr());
    }

    @Test
    void debugFormatUsesModelToString() {
        ExitCode code = cli.run(new String[] {"parse", "-q", "--format", "debug", source.toString()});

        assertEquals(ExitCode.SUCCESS, code);
        assertTrue(stdout().startsWith("Program{sourcePath=" + source), stdout());
    }

    @Test
    void syntaxErrorIsParseFailure() throws IOException {
        Path broken = tempDir.resolve("broken.rs");
        Files.writeString(broken, "pub fn broken(ctx: Context<X> -> Result<()> {}\n", StandardCharsets.UTF_8);

        ExitCode code = cli.run(new String[] {"normalize", "-q", broken.toString()});

        assertEquals(ExitCode.PARSE_FAILURE, code);
        assertEquals(2, code.code());
        assertTrue(stderr().startsWith("parse failed: " + broken + ": line 1:"), stderr());
    }

    @Test
    void missingInputIsParseFailure() {
        ExitCode code = cli.run(new String[] {"parse", "-q", tempDir.resolve("absent.rs").toString()});

        assertEquals(ExitCode.PARSE_FAILURE, code);
        assertTrue(stderr().contains("Failed to read"), stderr());
    }

    @Test
    void unwritableOutputIsOutputFailure() {
        Path target = tempDir.resolve("no-such-dir").resolve("report.txt");

        ExitCode code = cli.run(new String[] {"parse", "-q", "-o", target.toString(), source.toString()});

        assertEquals(ExitCode.OUTPUT_FAILURE, code);
        assertTrue(stderr().startsWith("failed to write " + target), stderr());
    }

    @Test
    void usageErrorsPrintHelp() {
        assertEquals(ExitCode.USAGE, cli.run(new String[] {"compile", source.toString()}));
        assertTrue(stderr().startsWith("error: Unknown command: compile"), stderr());
        assertTrue(stderr().contains("usage: " + CommandLineOptions.USAGE), stderr());
        assertEquals(1, ExitCode.USAGE.code());
    }

    @Test
    void helpGoesToStandardOutput() {
        assertEquals(ExitCode.SUCCESS, cli.run(new String[] {"--help"}));
        assertTrue(stdout().contains("--format <text|debug>"), stdout());
        assertEquals("", stderr());
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }
}
