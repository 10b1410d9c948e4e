package io.stylusport.anchor.syntax;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Canonical text rendering of types. Tokens are joined with single spaces, then whitespace next to
 * {@code < > ( ) [ ] ,} and {@code :} is removed and remaining runs collapse to one space, so
 * differently spaced spellings of the same type render identically.
 */
public final class TypeText {

    private static final Pattern PUNCTUATION_PADDING = Pattern.compile("\\s*([<>()\\[\\],:])\\s*");
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

    private TypeText() {}

    public static String canonical(TypeNode type) {
        if (type == null) {
            return "";
        }
        return canonical(type.getTokens());
    }

    public static String canonical(List<String> tokens) {
        return canonical(String.join(" ", tokens));
    }

    public static String canonical(String rendered) {
        String stripped = PUNCTUATION_PADDING.matcher(rendered).replaceAll("$1");
        return WHITESPACE_RUN.matcher(stripped).replaceAll(" ").trim();
    }
}
