package io.stylusport.anchor.normalize;

import java.util.Objects;

/**
 * A non-fatal diagnostic recorded during normalization. The element names the offending entity, or
 * {@code Struct.field} for field-level issues.
 */
public final class ValidationIssue {

    public enum Severity {
        INFO,
        WARNING,
        ERROR
    }

    private final Severity severity;
    private final String message;
    private final String element;

    public ValidationIssue(Severity severity, String message, String element) {
        this.severity = Objects.requireNonNull(severity, "severity");
        this.message = Objects.requireNonNull(message, "message");
        this.element = Objects.requireNonNull(element, "element");
    }

    public static ValidationIssue info(String message, String element) {
        return new ValidationIssue(Severity.INFO, message, element);
    }

    public static ValidationIssue warning(String message, String element) {
        return new ValidationIssue(Severity.WARNING, message, element);
    }

    public static ValidationIssue error(String message, String element) {
        return new ValidationIssue(Severity.ERROR, message, element);
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getMessage() {
        return message;
    }

    public String getElement() {
        return element;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof ValidationIssue)) {
            return false;
        }
        ValidationIssue other = (ValidationIssue) obj;
        return severity == other.severity && message.equals(other.message) && element.equals(other.element);
    }

    @Override
    public int hashCode() {
        return Objects.hash(severity, message, element);
    }

    @Override
    public String toString() {
        return severity + " [" + element + "] " + message;
    }
}
