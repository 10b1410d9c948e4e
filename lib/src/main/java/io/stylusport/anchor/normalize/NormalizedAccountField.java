package io.stylusport.anchor.normalize;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public final class NormalizedAccountField {
    private final String name;
    private final String type;
    private final List<NormalizedConstraint> constraints = new ArrayList<>();
    private InferredFieldInfo inferredInfo = InferredFieldInfo.NONE;

    public NormalizedAccountField(String name, String type) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
    }

    public String getName() {
        return name;
    }

    public String getType() {
        return type;
    }

    /** Declared constraints in source order, followed by inferred ones in the order they were added. */
    public List<NormalizedConstraint> getConstraints() {
        return Collections.unmodifiableList(constraints);
    }

    public InferredFieldInfo getInferredInfo() {
        return inferredInfo;
    }

    /** Doc comments are not collected from the source, so this is always empty. */
    public Optional<String> getDocumentation() {
        return Optional.empty();
    }

    public Optional<NormalizedConstraint> findConstraint(String constraintType) {
        return constraints.stream().filter(c -> c.constraintType().equals(constraintType)).findFirst();
    }

    public boolean hasConstraint(String constraintType) {
        return findConstraint(constraintType).isPresent();
    }

    /** Appends the constraint and updates the derived flags it implies. */
    void addConstraint(NormalizedConstraint constraint) {
        switch (constraint.constraintType()) {
            case "mut":
                inferredInfo = inferredInfo.withRequiresMut();
                break;
            case "signer":
                inferredInfo = inferredInfo.withRequiresSigner();
                break;
            case "init":
                inferredInfo = inferredInfo.withInitialized();
                break;
            case "payer":
                if (constraint.value() != null) {
                    inferredInfo = inferredInfo.withRelatedAccount(constraint.value());
                }
                break;
            default:
                break;
        }
        constraints.add(constraint);
    }

    void setRelatedAccount(String account) {
        inferredInfo = inferredInfo.withRelatedAccount(account);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof NormalizedAccountField)) {
            return false;
        }
        NormalizedAccountField other = (NormalizedAccountField) obj;
        return name.equals(other.name)
                && type.equals(other.type)
                && constraints.equals(other.constraints)
                && inferredInfo.equals(other.inferredInfo);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, constraints, inferredInfo);
    }

    @Override
    public String toString() {
        return "NormalizedAccountField{" + name + ": " + type + ", constraints=" + constraints
                + ", inferred=" + inferredInfo + "}";
    }
}
