package io.stylusport.anchor.parser;

import io.stylusport.anchor.syntax.grammar.RustItemsLexer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.antlr.v4.runtime.ANTLRErrorListener;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.Token;

public final class DebugFlags {
    private static final Logger LOGGER = Logger.getLogger(DebugFlags.class.getName());
    private static final String TOKENS_PROPERTY = "anchor.parser.debugTokens";
    private static final String PARSER_PROPERTY = "anchor.parser.debugParser";
    /** Environment fallback kept for convenience; prefer using system properties. */
    private static final String TOKENS_ENV = "ANCHOR_PARSER_DEBUG_TOKENS";
    private static final String PARSER_ENV = "ANCHOR_PARSER_DEBUG_PARSER";
    private static final ThreadLocal<List<String>> CAPTURED_TOKENS =
            ThreadLocal.withInitial(ArrayList::new);
    private static final ThreadLocal<List<String>> CAPTURED_DIAGNOSTICS =
            ThreadLocal.withInitial(ArrayList::new);

    private DebugFlags() {}

    public static boolean isTokenDebugEnabled() {
        return isEnabled(TOKENS_PROPERTY, TOKENS_ENV);
    }

    public static boolean isParserTraceEnabled() {
        return isEnabled(PARSER_PROPERTY, PARSER_ENV);
    }

    private static boolean isEnabled(String property, String environment) {
        String value = System.getProperty(property);
        if (value != null) {
            return Boolean.parseBoolean(value);
        }
        return Boolean.parseBoolean(System.getenv(environment));
    }

    public static void logTokens(CommonTokenStream tokens, RustItemsLexer lexer) {
        StringBuilder dump = new StringBuilder("Token dump for ").append(lexer.getSourceName());
        for (Token token : tokens.getTokens()) {
            String symbolic = lexer.getVocabulary().getSymbolicName(token.getType());
            if (symbolic == null) {
                symbolic = String.format(Locale.ROOT, "#%d", token.getType());
            }
            String line =
                    String.format(
                            Locale.ROOT,
                            "%-15s @ %4d:%-3d -> %s",
                            symbolic,
                            token.getLine(),
                            token.getCharPositionInLine(),
                            token.getText());
            dump.append(System.lineSeparator()).append("  ").append(line);
            CAPTURED_TOKENS.get().add(line);
        }
        LOGGER.log(Level.INFO, dump.toString());
    }

    static ANTLRErrorListener diagnosticListener() {
        return new AmbiguityTraceListener();
    }

    public static List<String> drainCapturedTokens() {
        List<String> captured = new ArrayList<>(CAPTURED_TOKENS.get());
        CAPTURED_TOKENS.get().clear();
        return captured;
    }

    public static void captureDiagnostic(String message) {
        LOGGER.fine(message);
        CAPTURED_DIAGNOSTICS.get().add(message);
    }

    public static List<String> drainCapturedDiagnostics() {
        List<String> captured = new ArrayList<>(CAPTURED_DIAGNOSTICS.get());
        CAPTURED_DIAGNOSTICS.get().clear();
        return captured;
    }
}
