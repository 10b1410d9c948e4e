package io.stylusport.anchor.model;

import java.util.Objects;
import java.util.Optional;

/**
 * A single entry of an {@code #[account(...)]} attribute, e.g. {@code init} or {@code payer = authority}.
 * The value is the raw text after the first {@code =} and is never interpreted.
 */
public record Constraint(String constraintType, String value) {

    public Constraint {
        Objects.requireNonNull(constraintType, "constraintType");
    }

    public static Constraint withoutValue(String constraintType) {
        return new Constraint(constraintType, null);
    }

    public static Constraint withValue(String constraintType, String value) {
        return new Constraint(constraintType, Objects.requireNonNull(value, "value"));
    }

    public Optional<String> valueIfPresent() {
        return Optional.ofNullable(value);
    }

    public boolean hasValue() {
        return value != null;
    }
}
