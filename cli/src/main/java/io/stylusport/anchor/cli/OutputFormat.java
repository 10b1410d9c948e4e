package io.stylusport.anchor.cli;

import java.util.Locale;

public enum OutputFormat {
    /** Indented tree. */
    TEXT,
    /** The models' {@code toString()} form. */
    DEBUG;

    static OutputFormat fromName(String name) throws UsageException {
        for (OutputFormat format : values()) {
            if (format.name().toLowerCase(Locale.ROOT).equals(name)) {
                return format;
            }
        }
        throw new UsageException("Unknown format: " + name + " (expected text or debug)");
    }
}
