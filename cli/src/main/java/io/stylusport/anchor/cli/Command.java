package io.stylusport.anchor.cli;

import java.util.Locale;

public enum Command {
    PARSE,
    NORMALIZE;

    static Command fromName(String name) throws UsageException {
        for (Command command : values()) {
            if (command.name().toLowerCase(Locale.ROOT).equals(name)) {
                return command;
            }
        }
        throw new UsageException("Unknown command: " + name);
    }
}
