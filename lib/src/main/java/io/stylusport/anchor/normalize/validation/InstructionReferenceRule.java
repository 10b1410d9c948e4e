package io.stylusport.anchor.normalize.validation;

import io.stylusport.anchor.normalize.NormalizedAccountStruct;
import io.stylusport.anchor.normalize.NormalizedInstruction;
import io.stylusport.anchor.normalize.NormalizedModule;
import io.stylusport.anchor.normalize.NormalizedProgram;
import io.stylusport.anchor.normalize.ValidationIssue;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/** Flags instructions pointing at undeclared account structs, or with a context but no struct at all. */
public final class InstructionReferenceRule implements ValidationRule {

    @Override
    public String name() {
        return "instruction-references";
    }

    @Override
    public List<ValidationIssue> validate(NormalizedProgram program) {
        Set<String> declared = new HashSet<>();
        for (NormalizedAccountStruct accounts : program.getAccountStructs()) {
            declared.add(accounts.getName());
        }

        List<ValidationIssue> issues = new ArrayList<>();
        for (NormalizedModule module : program.getModules()) {
            for (NormalizedInstruction instruction : module.getInstructions()) {
                Optional<String> reference = instruction.getAccountStructName();
                if (reference.isPresent()) {
                    if (!declared.contains(reference.get())) {
                        issues.add(ValidationIssue.warning(
                                String.format(
                                        "Instruction %s references undefined account struct %s",
                                        instruction.getName(), reference.get()),
                                instruction.getName()));
                    }
                } else if (instruction.hasContextParameter()) {
                    issues.add(ValidationIssue.warning(
                            String.format(
                                    "Instruction %s has Context parameter but no associated account struct",
                                    instruction.getName()),
                            instruction.getName()));
                }
            }
        }
        return issues;
    }
}
