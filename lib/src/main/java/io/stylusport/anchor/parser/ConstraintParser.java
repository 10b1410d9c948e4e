package io.stylusport.anchor.parser;

import io.stylusport.anchor.model.Constraint;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits the argument text of {@code #[account(...)]} into constraints. Commas split only outside
 * {@code ()}, {@code []} and {@code {}}; each entry is split once, on its first {@code =}, into name and
 * verbatim value. An entry whose first {@code =} belongs to an expression, such as {@code a == b}, is
 * split there as well.
 */
public final class ConstraintParser {

    private ConstraintParser() {}

    public static List<Constraint> parse(String argumentText) {
        List<Constraint> constraints = new ArrayList<>();
        for (String entry : splitTopLevel(argumentText)) {
            int equals = entry.indexOf('=');
            if (equals >= 0) {
                String name = entry.substring(0, equals).trim();
                String value = entry.substring(equals + 1).trim();
                constraints.add(Constraint.withValue(name, value));
            } else {
                constraints.add(Constraint.withoutValue(entry));
            }
        }
        return constraints;
    }

    /** Comma-separated entries at nesting depth zero, trimmed, empty entries dropped. */
    static List<String> splitTopLevel(String text) {
        List<String> entries = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '(':
                case '[':
                case '{':
                    depth++;
                    current.append(c);
                    break;
                case ')':
                case ']':
                case '}':
                    depth--;
                    current.append(c);
                    break;
                case ',':
                    if (depth == 0) {
                        addEntry(entries, current);
                        current.setLength(0);
                    } else {
                        current.append(c);
                    }
                    break;
                default:
                    current.append(c);
            }
        }
        addEntry(entries, current);
        return entries;
    }

    private static void addEntry(List<String> entries, StringBuilder current) {
        String entry = current.toString().trim();
        if (!entry.isEmpty()) {
            entries.add(entry);
        }
    }
}
