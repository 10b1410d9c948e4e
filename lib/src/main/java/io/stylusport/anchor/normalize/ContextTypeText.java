package io.stylusport.anchor.normalize;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Reads the account struct name back out of canonical parameter type text such as
 * {@code Context<Initialize>} or {@code &mut anchor_lang::prelude::Context<'_,'_,'_,'info,Deposit>}.
 * Lifetimes and associated-type bindings are ignored; exactly one remaining argument is required.
 */
final class ContextTypeText {

    private static final String CONTEXT = "Context";
    private static final Pattern BINDING = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*\\s*=.*");

    private ContextTypeText() {}

    static Optional<String> structName(String typeText) {
        String text = stripReferences(typeText.trim());
        int open = text.indexOf('<');
        if (open < 0 || !text.endsWith(">")) {
            return Optional.empty();
        }
        String head = text.substring(0, open).trim();
        int separator = head.lastIndexOf("::");
        String lastSegment = separator >= 0 ? head.substring(separator + 2) : head;
        if (!lastSegment.equals(CONTEXT)) {
            return Optional.empty();
        }
        List<String> typeArguments = new ArrayList<>();
        for (String argument : splitArguments(text.substring(open + 1, text.length() - 1))) {
            if (!argument.startsWith("'") && !BINDING.matcher(argument).matches()) {
                typeArguments.add(argument);
            }
        }
        return typeArguments.size() == 1 ? Optional.of(typeArguments.get(0)) : Optional.empty();
    }

    private static String stripReferences(String text) {
        String current = text;
        while (current.startsWith("&")) {
            current = current.substring(1).trim();
            if (current.startsWith("'")) {
                int end = current.indexOf(' ');
                current = end < 0 ? "" : current.substring(end + 1).trim();
            }
            if (current.startsWith("mut ")) {
                current = current.substring(4).trim();
            }
        }
        return current;
    }

    private static List<String> splitArguments(String text) {
        List<String> arguments = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '<' || c == '(' || c == '[') {
                depth++;
            } else if (c == '>' || c == ')' || c == ']') {
                depth--;
            } else if (c == ',' && depth == 0) {
                addArgument(arguments, text.substring(start, i));
                start = i + 1;
            }
        }
        addArgument(arguments, text.substring(start));
        return arguments;
    }

    private static void addArgument(List<String> arguments, String argument) {
        String trimmed = argument.trim();
        if (!trimmed.isEmpty()) {
            arguments.add(trimmed);
        }
    }
}
