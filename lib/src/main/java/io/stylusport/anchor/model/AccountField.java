package io.stylusport.anchor.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public final class AccountField {
    private final String name;
    private final String type;
    private final List<Constraint> constraints = new ArrayList<>();

    public AccountField(String name, String type) {
        this.name = Objects.requireNonNull(name, "name");
        this.type = Objects.requireNonNull(type, "type");
    }

    public String getName() {
        return name;
    }

    public String getType() {
        return type;
    }

    public List<Constraint> getConstraints() {
        return Collections.unmodifiableList(constraints);
    }

    public AccountField addConstraint(Constraint constraint) {
        constraints.add(Objects.requireNonNull(constraint, "constraint"));
        return this;
    }

    public Optional<Constraint> findConstraint(String constraintType) {
        return constraints.stream().filter(c -> c.constraintType().equals(constraintType)).findFirst();
    }

    public boolean hasConstraint(String constraintType) {
        return findConstraint(constraintType).isPresent();
    }

    @Override
    public String toString() {
        return "AccountField{" + name + ": " + type + ", constraints=" + constraints + "}";
    }
}
