package io.stylusport.anchor.normalize;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Heuristic passes that make implicit Anchor semantics explicit. The passes run in a fixed order, each
 * seeing the state left by the previous one: instruction operations, implied field constraints, then
 * field relationships. Each pass collects its edits before applying them and is safe to re-run.
 */
final class InferenceEngine {
    private static final Logger LOGGER = Logger.getLogger(InferenceEngine.class.getName());

    static final String DEFAULT_PAYER = "payer";
    static final String DEFAULT_REFUND_TARGET = "authority";

    private static final Set<String> TRANSFER_NAMES = Set.of("transfer", "send");
    private static final String CLOSE_NAME = "close";
    private static final Set<String> SIGNER_ROLE_NAMES = Set.of("authority", "owner", "admin");
    private static final Set<String> RELATIONSHIP_CONSTRAINTS = Set.of("has_one", "belongs_to");

    void apply(NormalizedProgram program) {
        inferInstructionOperations(program);
        inferFieldConstraints(program);
        inferAccountRelationships(program);
    }

    void inferInstructionOperations(NormalizedProgram program) {
        List<OperationEdit> edits = new ArrayList<>();
        for (NormalizedModule module : program.getModules()) {
            for (NormalizedInstruction instruction : module.getInstructions()) {
                if (instruction.getBody() instanceof InstructionBody.Basic) {
                    continue;
                }
                Optional<NormalizedAccountStruct> accounts =
                        instruction.getAccountStructName().flatMap(program::findAccountStruct);
                if (accounts.isEmpty()) {
                    continue;
                }
                List<BasicOperation> operations = operationsFor(instruction, accounts.get());
                if (!operations.isEmpty()) {
                    edits.add(new OperationEdit(instruction, operations));
                }
            }
        }
        for (OperationEdit edit : edits) {
            LOGGER.log(Level.FINE, "Inferred operations {0} for instruction {1}", new Object[] {
                edit.operations, edit.instruction.getName()
            });
            edit.instruction.setBody(new InstructionBody.Basic(edit.operations));
        }
    }

    private static List<BasicOperation> operationsFor(
            NormalizedInstruction instruction, NormalizedAccountStruct accounts) {
        List<BasicOperation> operations = new ArrayList<>();
        for (NormalizedAccountField field : accounts.getFields()) {
            if (field.hasConstraint("init")) {
                String payer = field.findConstraint("payer")
                        .map(NormalizedConstraint::value)
                        .orElse(DEFAULT_PAYER);
                operations.add(new BasicOperation.Initialize(field.getName(), payer));
            }
        }

        String name = instruction.getName();
        if (TRANSFER_NAMES.contains(name)) {
            Optional<NormalizedAccountField> from = accounts.findField("from");
            Optional<NormalizedAccountField> to = accounts.findField("to");
            if (from.isPresent() && to.isPresent()) {
                operations.add(new BasicOperation.Transfer(from.get().getName(), to.get().getName()));
            }
        } else if (CLOSE_NAME.equals(name)) {
            for (NormalizedAccountField field : accounts.getFields()) {
                Optional<NormalizedConstraint> close = field.findConstraint("close");
                if (close.isPresent()) {
                    String refundTo = close.get().valueIfPresent().orElse(DEFAULT_REFUND_TARGET);
                    operations.add(new BasicOperation.Close(field.getName(), refundTo));
                    break;
                }
            }
        }
        return operations;
    }

    void inferFieldConstraints(NormalizedProgram program) {
        List<ConstraintEdit> edits = new ArrayList<>();
        for (NormalizedAccountStruct accounts : program.getAccountStructs()) {
            for (NormalizedAccountField field : accounts.getFields()) {
                if (SIGNER_ROLE_NAMES.contains(field.getName())
                        && field.getType().contains("Signer")
                        && !field.hasConstraint("signer")) {
                    edits.add(new ConstraintEdit(accounts, field, "signer"));
                }
                if (field.hasConstraint("init") && !field.hasConstraint("mut")) {
                    edits.add(new ConstraintEdit(accounts, field, "mut"));
                }
            }
        }
        for (ConstraintEdit edit : edits) {
            LOGGER.log(Level.FINE, "Inferred constraint {0} on {1}.{2}", new Object[] {
                edit.constraintType, edit.accounts.getName(), edit.field.getName()
            });
            edit.field.addConstraint(NormalizedConstraint.inferred(edit.constraintType));
        }
    }

    void inferAccountRelationships(NormalizedProgram program) {
        List<RelationshipEdit> edits = new ArrayList<>();
        for (NormalizedAccountStruct accounts : program.getAccountStructs()) {
            List<NormalizedAccountField> fields = accounts.getFields();
            for (int i = 0; i < fields.size(); i++) {
                String target = fields.get(i).getName();
                for (int j = 0; j < fields.size(); j++) {
                    if (i == j) {
                        continue;
                    }
                    for (NormalizedConstraint constraint : fields.get(j).getConstraints()) {
                        if (RELATIONSHIP_CONSTRAINTS.contains(constraint.constraintType())
                                && target.equals(constraint.value())) {
                            edits.add(new RelationshipEdit(fields.get(j), target));
                        }
                    }
                }
            }
        }
        // Applied in collection order, so the last qualifying constraint wins.
        for (RelationshipEdit edit : edits) {
            edit.field.setRelatedAccount(edit.relatedAccount);
        }
    }

    private static final class OperationEdit {
        private final NormalizedInstruction instruction;
        private final List<BasicOperation> operations;

        OperationEdit(NormalizedInstruction instruction, List<BasicOperation> operations) {
            this.instruction = instruction;
            this.operations = operations;
        }
    }

    private static final class ConstraintEdit {
        private final NormalizedAccountStruct accounts;
        private final NormalizedAccountField field;
        private final String constraintType;

        ConstraintEdit(NormalizedAccountStruct accounts, NormalizedAccountField field, String constraintType) {
            this.accounts = accounts;
            this.field = field;
            this.constraintType = constraintType;
        }
    }

    private static final class RelationshipEdit {
        private final NormalizedAccountField field;
        private final String relatedAccount;

        RelationshipEdit(NormalizedAccountField field, String relatedAccount) {
            this.field = field;
            this.relatedAccount = relatedAccount;
        }
    }
}
