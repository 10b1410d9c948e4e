package io.stylusport.anchor.normalize.validation;

import io.stylusport.anchor.normalize.NormalizedInstruction;
import io.stylusport.anchor.normalize.NormalizedModule;
import io.stylusport.anchor.normalize.NormalizedProgram;
import io.stylusport.anchor.normalize.ValidationIssue;
import java.util.ArrayList;
import java.util.List;

/** Instructions are expected to be plain {@code pub}; anything else is reported for information. */
public final class InstructionVisibilityRule implements ValidationRule {
    static final String EXPECTED_VISIBILITY = "pub";

    @Override
    public String name() {
        return "instruction-visibility";
    }

    @Override
    public List<ValidationIssue> validate(NormalizedProgram program) {
        List<ValidationIssue> issues = new ArrayList<>();
        for (NormalizedModule module : program.getModules()) {
            for (NormalizedInstruction instruction : module.getInstructions()) {
                if (!EXPECTED_VISIBILITY.equals(instruction.getVisibility())) {
                    issues.add(ValidationIssue.info(
                            "Instruction " + instruction.getName() + " has non-public visibility: "
                                    + instruction.getVisibility(),
                            instruction.getName()));
                }
            }
        }
        return issues;
    }
}
