package io.stylusport.anchor.normalize;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public final class NormalizedModule {
    private final String name;
    private final String visibility;
    private final List<NormalizedInstruction> instructions = new ArrayList<>();

    public NormalizedModule(String name, String visibility) {
        this.name = Objects.requireNonNull(name, "name");
        this.visibility = Objects.requireNonNull(visibility, "visibility");
    }

    public String getName() {
        return name;
    }

    public String getVisibility() {
        return visibility;
    }

    public List<NormalizedInstruction> getInstructions() {
        return Collections.unmodifiableList(instructions);
    }

    /** Doc comments are not collected from the source, so this is always empty. */
    public Optional<String> getDocumentation() {
        return Optional.empty();
    }

    public Optional<NormalizedInstruction> findInstruction(String instructionName) {
        return instructions.stream().filter(i -> i.getName().equals(instructionName)).findFirst();
    }

    void addInstruction(NormalizedInstruction instruction) {
        instructions.add(Objects.requireNonNull(instruction, "instruction"));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof NormalizedModule)) {
            return false;
        }
        NormalizedModule other = (NormalizedModule) obj;
        return name.equals(other.name)
                && visibility.equals(other.visibility)
                && instructions.equals(other.instructions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, visibility, instructions);
    }

    @Override
    public String toString() {
        return "NormalizedModule{" + name + ", instructions=" + instructions + "}";
    }
}
