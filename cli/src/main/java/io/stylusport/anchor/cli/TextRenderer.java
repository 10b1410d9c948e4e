package io.stylusport.anchor.cli;

import io.stylusport.anchor.model.AccountField;
import io.stylusport.anchor.model.AccountStruct;
import io.stylusport.anchor.model.Constraint;
import io.stylusport.anchor.model.Instruction;
import io.stylusport.anchor.model.Parameter;
import io.stylusport.anchor.model.Program;
import io.stylusport.anchor.model.ProgramModule;
import io.stylusport.anchor.model.RawAccount;
import io.stylusport.anchor.model.RawAccountField;
import io.stylusport.anchor.normalize.BasicOperation;
import io.stylusport.anchor.normalize.InferredFieldInfo;
import io.stylusport.anchor.normalize.InstructionBody;
import io.stylusport.anchor.normalize.NormalizedAccountField;
import io.stylusport.anchor.normalize.NormalizedAccountStruct;
import io.stylusport.anchor.normalize.NormalizedConstraint;
import io.stylusport.anchor.normalize.NormalizedInstruction;
import io.stylusport.anchor.normalize.NormalizedModule;
import io.stylusport.anchor.normalize.NormalizedParameter;
import io.stylusport.anchor.normalize.NormalizedProgram;
import io.stylusport.anchor.normalize.NormalizedRawAccount;
import io.stylusport.anchor.normalize.NormalizedRawField;
import io.stylusport.anchor.normalize.ValidationIssue;
import java.util.ArrayList;
import java.util.List;

/** Indented plain-text rendering of extracted and normalized programs. */
final class TextRenderer {
    private static final String INDENT = "  ";

    private final StringBuilder out = new StringBuilder();

    static String render(Program program) {
        TextRenderer renderer = new TextRenderer();
        renderer.program(program);
        return renderer.out.toString();
    }

    static String render(NormalizedProgram program) {
        TextRenderer renderer = new TextRenderer();
        renderer.normalized(program);
        return renderer.out.toString();
    }

    static String renderIssues(List<ValidationIssue> issues) {
        TextRenderer renderer = new TextRenderer();
        renderer.line(0, "Validation issues (" + issues.size() + "):");
        for (ValidationIssue issue : issues) {
            renderer.line(1, issue.getSeverity() + " [" + issue.getElement() + "] " + issue.getMessage());
        }
        return renderer.out.toString();
    }

    private void program(Program program) {
        line(0, "Program" + program.getSourcePath().map(path -> " (" + path + ")").orElse(""));
        for (ProgramModule module : program.getModules()) {
            line(1, "module " + module.getName() + visibility(module.getVisibility()));
            for (Instruction instruction : module.getInstructions()) {
                line(2, "instruction " + instruction.getName() + visibility(instruction.getVisibility())
                        + instruction.getReturnType().map(type -> " -> " + type).orElse(""));
                instruction.getContextType().ifPresent(context -> line(3, "context: " + context));
                for (Parameter parameter : instruction.getParameters()) {
                    line(3, "param " + parameter.name() + ": " + parameter.type()
                            + (parameter.isContext() ? " (context)" : ""));
                }
            }
        }
        for (AccountStruct accounts : program.getAccountStructs()) {
            line(1, "accounts " + accounts.getName() + visibility(accounts.getVisibility()));
            for (AccountField field : accounts.getFields()) {
                line(2, "field " + field.getName() + ": " + field.getType());
                for (Constraint constraint : field.getConstraints()) {
                    line(3, constraint(constraint.constraintType(), constraint.value(), false));
                }
            }
        }
        for (RawAccount account : program.getRawAccounts()) {
            line(1, "account " + account.getName() + visibility(account.getVisibility()));
            for (RawAccountField field : account.getFields()) {
                line(2, "field " + field.name() + ": " + field.type() + visibility(field.visibility()));
            }
        }
    }

    private void normalized(NormalizedProgram program) {
        line(0, "Program " + program.getName() + " (id: " + program.getId() + ", schema "
                + program.getSchemaVersion() + ")");
        program.getSourceInfo().ifPresent(info -> line(1, "source: " + info.filePath()));
        for (NormalizedModule module : program.getModules()) {
            line(1, "module " + module.getName() + visibility(module.getVisibility()));
            for (NormalizedInstruction instruction : module.getInstructions()) {
                line(2, "instruction " + instruction.getName() + visibility(instruction.getVisibility())
                        + instruction.getReturnType().map(type -> " -> " + type).orElse(""));
                instruction.getAccountStructName().ifPresent(name -> line(3, "accounts: " + name));
                for (NormalizedParameter parameter : instruction.getParameters()) {
                    line(3, "param " + parameter.name() + ": " + parameter.type()
                            + (parameter.isContext() ? " (context)" : ""));
                }
                body(instruction.getBody());
            }
        }
        for (NormalizedAccountStruct accounts : program.getAccountStructs()) {
            line(1, "accounts " + accounts.getName() + visibility(accounts.getVisibility()));
            for (NormalizedAccountField field : accounts.getFields()) {
                line(2, "field " + field.getName() + ": " + field.getType());
                for (NormalizedConstraint constraint : field.getConstraints()) {
                    line(3, constraint(constraint.constraintType(), constraint.value(), constraint.isInferred()));
                }
                String facts = facts(field.getInferredInfo());
                if (!facts.isEmpty()) {
                    line(3, "inferred: " + facts);
                }
            }
        }
        for (NormalizedRawAccount account : program.getRawAccounts()) {
            line(1, "account " + account.getName() + visibility(account.getVisibility()));
            for (NormalizedRawField field : account.getFields()) {
                line(2, "field " + field.name() + ": " + field.type() + visibility(field.visibility()));
            }
        }
    }

    private void body(InstructionBody body) {
        if (body instanceof InstructionBody.Basic basic) {
            line(3, "operations:");
            for (BasicOperation operation : basic.operations()) {
                line(4, operation(operation));
            }
        } else {
            line(3, "body: unknown");
        }
    }

    private static String operation(BasicOperation operation) {
        if (operation instanceof BasicOperation.Initialize init) {
            return "initialize " + init.target() + " (payer: " + init.payer() + ")";
        }
        if (operation instanceof BasicOperation.Transfer transfer) {
            return "transfer " + transfer.from() + " -> " + transfer.to();
        }
        if (operation instanceof BasicOperation.Close close) {
            return "close " + close.target() + " (refund to: " + close.refundTo() + ")";
        }
        BasicOperation.Log log = (BasicOperation.Log) operation;
        return "log \"" + log.text() + "\"";
    }

    private static String constraint(String type, String value, boolean inferred) {
        return "constraint " + type + (value != null ? " = " + value : "") + (inferred ? " (inferred)" : "");
    }

    private static String facts(InferredFieldInfo info) {
        List<String> facts = new ArrayList<>();
        if (info.requiresMut()) {
            facts.add("mut");
        }
        if (info.requiresSigner()) {
            facts.add("signer");
        }
        if (info.isInitialized()) {
            facts.add("initialized");
        }
        info.relatedAccountIfKnown().ifPresent(related -> facts.add("related to " + related));
        return String.join(", ", facts);
    }

    private static String visibility(String visibility) {
        return visibility.isEmpty() ? " [private]" : " [" + visibility + "]";
    }

    private void line(int depth, String text) {
        out.append(INDENT.repeat(depth)).append(text).append(System.lineSeparator());
    }
}
