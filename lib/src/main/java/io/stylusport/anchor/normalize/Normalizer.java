package io.stylusport.anchor.normalize;

import io.stylusport.anchor.model.AccountField;
import io.stylusport.anchor.model.AccountStruct;
import io.stylusport.anchor.model.Constraint;
import io.stylusport.anchor.model.Instruction;
import io.stylusport.anchor.model.Parameter;
import io.stylusport.anchor.model.Program;
import io.stylusport.anchor.model.ProgramModule;
import io.stylusport.anchor.model.RawAccount;
import io.stylusport.anchor.model.RawAccountField;
import io.stylusport.anchor.normalize.validation.ValidationRunner;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns an extracted {@link Program} into a {@link NormalizedProgram}: derives name and id, copies the
 * model, links instructions to their account structs, runs inference and finally validation. The input
 * is never modified. The only failure is a program whose name cannot be determined; every other
 * irregularity is recorded as a {@link ValidationIssue}.
 */
public final class Normalizer {
    private static final Logger LOGGER = Logger.getLogger(Normalizer.class.getName());
    private static final String ID_PREFIX = "program:";

    private final InferenceEngine inferenceEngine = new InferenceEngine();
    private final ValidationRunner validationRunner;

    public Normalizer() {
        this(ValidationRunner.defaultRunner());
    }

    public Normalizer(ValidationRunner validationRunner) {
        this.validationRunner = Objects.requireNonNull(validationRunner, "validationRunner");
    }

    public NormalizedProgram normalize(Program program) throws NormalizationException {
        Objects.requireNonNull(program, "program");
        String name = programName(program);
        NormalizedProgram normalized = new NormalizedProgram(programId(program), name);
        program.getSourcePath().map(SourceInfo::of).ifPresent(normalized::setSourceInfo);

        for (ProgramModule module : program.getModules()) {
            normalized.addModule(copyModule(module));
        }
        for (AccountStruct accountStruct : program.getAccountStructs()) {
            normalized.addAccountStruct(copyAccountStruct(accountStruct));
        }
        for (RawAccount rawAccount : program.getRawAccounts()) {
            normalized.addRawAccount(copyRawAccount(rawAccount));
        }

        linkInstructions(normalized);
        inferenceEngine.apply(normalized);
        normalized.addValidationIssues(validationRunner.run(normalized));

        LOGGER.log(Level.FINE, "Normalized program {0}: {1} module(s), {2} issue(s)", new Object[] {
            name, normalized.getModules().size(), normalized.getValidationIssues().size()
        });
        return normalized;
    }

    static String programName(Program program) throws NormalizationException {
        List<ProgramModule> modules = program.getModules();
        if (!modules.isEmpty()) {
            if (modules.size() > 1) {
                LOGGER.log(Level.FINE, "Found {0} program modules; using the first", modules.size());
            }
            return modules.get(0).getName();
        }
        Optional<String> stem = program.getSourcePath().flatMap(Normalizer::fileStem);
        if (stem.isPresent()) {
            return stem.get();
        }
        throw new NormalizationException(NormalizationException.Kind.MISSING_INFO, "Could not determine program name");
    }

    static String programId(Program program) {
        Optional<String> sourcePath = program.getSourcePath();
        if (sourcePath.isPresent()) {
            return ID_PREFIX + sourcePath.get();
        }
        if (!program.getModules().isEmpty()) {
            return ID_PREFIX + program.getModules().get(0).getName();
        }
        return ID_PREFIX + Instant.now().getEpochSecond();
    }

    /**
     * File name without its last extension; a leading dot does not start an extension. Both {@code /} and
     * {@code \} separate directories and trailing separators are ignored. The path is treated as plain text,
     * so names that are not valid on this platform still yield a stem.
     */
    static Optional<String> fileStem(String sourcePath) {
        int end = sourcePath.length();
        while (end > 0 && isSeparator(sourcePath.charAt(end - 1))) {
            end--;
        }
        int start = end;
        while (start > 0 && !isSeparator(sourcePath.charAt(start - 1))) {
            start--;
        }
        String fileName = sourcePath.substring(start, end);
        int dot = fileName.lastIndexOf('.');
        String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
        return stem.isEmpty() ? Optional.empty() : Optional.of(stem);
    }

    private static boolean isSeparator(char c) {
        return c == '/' || c == '\\';
    }

    private static NormalizedModule copyModule(ProgramModule module) {
        NormalizedModule copy = new NormalizedModule(module.getName(), module.getVisibility());
        for (Instruction instruction : module.getInstructions()) {
            copy.addInstruction(copyInstruction(instruction));
        }
        return copy;
    }

    private static NormalizedInstruction copyInstruction(Instruction instruction) {
        NormalizedInstruction copy = new NormalizedInstruction(instruction.getName(), instruction.getVisibility());
        instruction.getReturnType().ifPresent(copy::setReturnType);
        instruction.getContextType().ifPresent(copy::linkAccountStruct);
        for (Parameter parameter : instruction.getParameters()) {
            copy.addParameter(new NormalizedParameter(parameter.name(), parameter.type(), parameter.isContext()));
        }
        return copy;
    }

    private static NormalizedAccountStruct copyAccountStruct(AccountStruct accountStruct) {
        NormalizedAccountStruct copy = new NormalizedAccountStruct(accountStruct.getName(), accountStruct.getVisibility());
        for (AccountField field : accountStruct.getFields()) {
            NormalizedAccountField fieldCopy = new NormalizedAccountField(field.getName(), field.getType());
            for (Constraint constraint : field.getConstraints()) {
                fieldCopy.addConstraint(NormalizedConstraint.explicit(constraint.constraintType(), constraint.value()));
            }
            copy.addField(fieldCopy);
        }
        return copy;
    }

    private static NormalizedRawAccount copyRawAccount(RawAccount rawAccount) {
        NormalizedRawAccount copy = new NormalizedRawAccount(rawAccount.getName(), rawAccount.getVisibility());
        for (RawAccountField field : rawAccount.getFields()) {
            copy.addField(new NormalizedRawField(field.name(), field.type(), field.visibility()));
        }
        return copy;
    }

    /** Fills in missing struct references from the first context parameter whose type names one. */
    static void linkInstructions(NormalizedProgram program) {
        for (NormalizedModule module : program.getModules()) {
            for (NormalizedInstruction instruction : module.getInstructions()) {
                if (instruction.getAccountStructName().isPresent()) {
                    continue;
                }
                for (NormalizedParameter parameter : instruction.getParameters()) {
                    if (!parameter.isContext()) {
                        continue;
                    }
                    Optional<String> structName = ContextTypeText.structName(parameter.type());
                    if (structName.isPresent()) {
                        instruction.linkAccountStruct(structName.get());
                        LOGGER.log(Level.FINE, "Linked instruction {0} to account struct {1}", new Object[] {
                            instruction.getName(), structName.get()
                        });
                        break;
                    }
                }
            }
        }
    }
}
