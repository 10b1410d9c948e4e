package io.stylusport.anchor.parser;

import io.stylusport.anchor.syntax.SourceLocation;
import java.util.Optional;

/** Checked exception signalling that a source file could not be read or is not syntactically valid. */
public final class AnchorParseException extends Exception {
    private final SourceLocation location;

    public AnchorParseException(String message) {
        this(null, message, null);
    }

    public AnchorParseException(String message, Throwable cause) {
        this(null, message, cause);
    }

    public AnchorParseException(SourceLocation location, String message) {
        this(location, message, null);
    }

    public AnchorParseException(SourceLocation location, String message, Throwable cause) {
        super(message, cause);
        this.location = location;
    }

    /** Where in the source the failure was detected; absent for I/O failures. */
    public Optional<SourceLocation> getLocation() {
        return Optional.ofNullable(location);
    }
}
