package io.stylusport.anchor.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.stylusport.anchor.model.Program;
import io.stylusport.anchor.testing.TestResources;
import java.nio.file.Path;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AnchorParserTest {

    @TempDir
    Path tempDir;

    private final AnchorParser parser = new AnchorParser();

    @Test
    void parseFileRecordsSourcePath() throws Exception {
        Path source = TestResources.copyTo("fixtures/token_vault.rs", tempDir);

        Program program = parser.parseFile(source);

        assertEquals(Optional.of(source.toString()), program.getSourcePath());
        assertEquals("token_vault", program.getModules().get(0).getName());
    }

    @Test
    void missingFileIsReported() {
        Path missing = tempDir.resolve("missing.rs");

        AnchorParseException ex = assertThrows(AnchorParseException.class, () -> parser.parseFile(missing));

        assertTrue(ex.getMessage().startsWith("Failed to read " + missing), ex.getMessage());
        assertTrue(ex.getLocation().isEmpty());
    }

    @Test
    void syntaxErrorNamesTheFile() throws Exception {
        Path source = TestResources.copyTo("fixtures/invalid_syntax.rs", tempDir);

        AnchorParseException ex = assertThrows(AnchorParseException.class, () -> parser.parseFile(source));

        assertTrue(ex.getMessage().startsWith(source + ": line "), ex.getMessage());
    }
}
