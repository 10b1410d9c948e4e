package io.stylusport.anchor.normalize;

import java.util.Objects;

/** Fatal normalization failure. No partial result accompanies it. */
public final class NormalizationException extends Exception {

    public enum Kind {
        AST_EXTRACTION("AST extraction error: "),
        VALIDATION("Validation error: "),
        INFERENCE("Inference error: "),
        MISSING_INFO("Missing information: "),
        OTHER("Normalization error: ");

        private final String prefix;

        Kind(String prefix) {
            this.prefix = prefix;
        }

        String getPrefix() {
            return prefix;
        }
    }

    private final Kind kind;
    private final String detail;

    public NormalizationException(Kind kind, String detail) {
        super(Objects.requireNonNull(kind, "kind").getPrefix() + detail);
        this.kind = kind;
        this.detail = detail;
    }

    public NormalizationException(Kind kind, String detail, Throwable cause) {
        super(Objects.requireNonNull(kind, "kind").getPrefix() + detail, cause);
        this.kind = kind;
        this.detail = detail;
    }

    public Kind getKind() {
        return kind;
    }

    /** The message without its kind prefix. */
    public String getDetail() {
        return detail;
    }
}
