package io.stylusport.anchor.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** A {@code #[program]} module and the instruction handlers declared directly inside it. */
public final class ProgramModule {
    private final String name;
    private final String visibility;
    private final List<Instruction> instructions = new ArrayList<>();

    public ProgramModule(String name, String visibility) {
        this.name = Objects.requireNonNull(name, "name");
        this.visibility = Objects.requireNonNull(visibility, "visibility");
    }

    public String getName() {
        return name;
    }

    public String getVisibility() {
        return visibility;
    }

    public List<Instruction> getInstructions() {
        return Collections.unmodifiableList(instructions);
    }

    public ProgramModule addInstruction(Instruction instruction) {
        instructions.add(Objects.requireNonNull(instruction, "instruction"));
        return this;
    }

    public Optional<Instruction> findInstruction(String instructionName) {
        return instructions.stream().filter(i -> i.getName().equals(instructionName)).findFirst();
    }

    @Override
    public String toString() {
        return "ProgramModule{" + AccountStruct.visibilityPrefix(visibility) + name + ", instructions=" + instructions + "}";
    }
}
