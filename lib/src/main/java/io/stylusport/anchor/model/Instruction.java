package io.stylusport.anchor.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public final class Instruction {
    private final String name;
    private final String visibility;
    private final List<Parameter> parameters = new ArrayList<>();
    private String returnType;
    private String contextType;

    public Instruction(String name, String visibility) {
        this.name = Objects.requireNonNull(name, "name");
        this.visibility = Objects.requireNonNull(visibility, "visibility");
    }

    public String getName() {
        return name;
    }

    public String getVisibility() {
        return visibility;
    }

    public List<Parameter> getParameters() {
        return Collections.unmodifiableList(parameters);
    }

    public Instruction addParameter(Parameter parameter) {
        parameters.add(Objects.requireNonNull(parameter, "parameter"));
        return this;
    }

    public Optional<String> getReturnType() {
        return Optional.ofNullable(returnType);
    }

    public Instruction setReturnType(String returnType) {
        this.returnType = returnType;
        return this;
    }

    /** Name of the account struct named by the instruction's {@code Context<T>} parameter, if resolved. */
    public Optional<String> getContextType() {
        return Optional.ofNullable(contextType);
    }

    /** Records the context struct; the first reference set wins and later calls are ignored. */
    public Instruction setContextType(String contextType) {
        if (this.contextType == null) {
            this.contextType = contextType;
        }
        return this;
    }

    public boolean hasContextParameter() {
        return parameters.stream().anyMatch(Parameter::isContext);
    }

    @Override
    public String toString() {
        return "Instruction{"
                + AccountStruct.visibilityPrefix(visibility)
                + name
                + ", parameters="
                + parameters
                + ", returnType="
                + returnType
                + ", contextType="
                + contextType
                + "}";
    }
}
