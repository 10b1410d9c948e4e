package io.stylusport.anchor.parser;

import io.stylusport.anchor.model.Program;
import io.stylusport.anchor.syntax.SourceFileNode;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;

/** Entry point for extracting an Anchor {@link Program} from Rust source. */
public final class AnchorParser {
    private final SyntaxTreeBuilder syntaxTreeBuilder = new SyntaxTreeBuilder();
    private final ProgramModelBuilder modelBuilder = new ProgramModelBuilder();

    public Program parseFile(Path sourcePath) throws AnchorParseException {
        CharStream stream;
        try {
            stream = CharStreams.fromPath(sourcePath, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new AnchorParseException("Failed to read " + sourcePath + ": " + ex.getMessage(), ex);
        }
        SourceFileNode file = syntaxTreeBuilder.parse(sourcePath.toString(), stream);
        return modelBuilder.build(file).setSourcePath(sourcePath.toString());
    }

    public Program parseString(String sourceName, String source) throws AnchorParseException {
        return modelBuilder.build(syntaxTreeBuilder.parse(sourceName, source));
    }
}
