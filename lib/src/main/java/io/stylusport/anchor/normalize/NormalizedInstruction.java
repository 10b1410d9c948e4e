package io.stylusport.anchor.normalize;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public final class NormalizedInstruction {
    private final String name;
    private final String visibility;
    private final List<NormalizedParameter> parameters = new ArrayList<>();
    private String returnType;
    private String accountStructName;
    private InstructionBody body = InstructionBody.UNKNOWN;

    public NormalizedInstruction(String name, String visibility) {
        this.name = Objects.requireNonNull(name, "name");
        this.visibility = Objects.requireNonNull(visibility, "visibility");
    }

    public String getName() {
        return name;
    }

    public String getVisibility() {
        return visibility;
    }

    public List<NormalizedParameter> getParameters() {
        return Collections.unmodifiableList(parameters);
    }

    public Optional<String> getReturnType() {
        return Optional.ofNullable(returnType);
    }

    /** The account struct this instruction validates its accounts with. May name an undeclared struct. */
    public Optional<String> getAccountStructName() {
        return Optional.ofNullable(accountStructName);
    }

    public InstructionBody getBody() {
        return body;
    }

    /** Doc comments are not collected from the source, so this is always empty. */
    public Optional<String> getDocumentation() {
        return Optional.empty();
    }

    public boolean hasContextParameter() {
        return parameters.stream().anyMatch(NormalizedParameter::isContext);
    }

    public Optional<NormalizedParameter> getContextParameter() {
        return parameters.stream().filter(NormalizedParameter::isContext).findFirst();
    }

    void addParameter(NormalizedParameter parameter) {
        parameters.add(Objects.requireNonNull(parameter, "parameter"));
    }

    void setReturnType(String returnType) {
        this.returnType = returnType;
    }

    /** Sets the struct reference unless one is already recorded; returns whether it was set. */
    boolean linkAccountStruct(String structName) {
        if (accountStructName != null) {
            return false;
        }
        accountStructName = Objects.requireNonNull(structName, "structName");
        return true;
    }

    void setBody(InstructionBody body) {
        this.body = Objects.requireNonNull(body, "body");
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof NormalizedInstruction)) {
            return false;
        }
        NormalizedInstruction other = (NormalizedInstruction) obj;
        return name.equals(other.name)
                && visibility.equals(other.visibility)
                && parameters.equals(other.parameters)
                && Objects.equals(returnType, other.returnType)
                && Objects.equals(accountStructName, other.accountStructName)
                && body.equals(other.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, visibility, parameters, returnType, accountStructName, body);
    }

    @Override
    public String toString() {
        return "NormalizedInstruction{" + name + ", accountStruct=" + accountStructName + ", body=" + body + "}";
    }
}
