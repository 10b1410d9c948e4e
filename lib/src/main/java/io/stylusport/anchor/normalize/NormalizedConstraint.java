package io.stylusport.anchor.normalize;

import java.util.Objects;
import java.util.Optional;

/** A constraint on an account field, flagged as inferred when synthesized rather than declared. */
public record NormalizedConstraint(String constraintType, String value, boolean isInferred) {

    public NormalizedConstraint {
        Objects.requireNonNull(constraintType, "constraintType");
    }

    public static NormalizedConstraint explicit(String constraintType, String value) {
        return new NormalizedConstraint(constraintType, value, false);
    }

    public static NormalizedConstraint inferred(String constraintType) {
        return new NormalizedConstraint(constraintType, null, true);
    }

    public Optional<String> valueIfPresent() {
        return Optional.ofNullable(value);
    }
}
