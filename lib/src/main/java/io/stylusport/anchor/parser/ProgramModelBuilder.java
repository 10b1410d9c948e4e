package io.stylusport.anchor.parser;

import io.stylusport.anchor.model.AccountField;
import io.stylusport.anchor.model.AccountStruct;
import io.stylusport.anchor.model.Constraint;
import io.stylusport.anchor.model.Instruction;
import io.stylusport.anchor.model.Parameter;
import io.stylusport.anchor.model.Program;
import io.stylusport.anchor.model.ProgramModule;
import io.stylusport.anchor.model.RawAccount;
import io.stylusport.anchor.model.RawAccountField;
import io.stylusport.anchor.syntax.AttributeNode;
import io.stylusport.anchor.syntax.FieldNode;
import io.stylusport.anchor.syntax.FunctionItemNode;
import io.stylusport.anchor.syntax.ItemNode;
import io.stylusport.anchor.syntax.ModuleItemNode;
import io.stylusport.anchor.syntax.ParameterNode;
import io.stylusport.anchor.syntax.SourceFileNode;
import io.stylusport.anchor.syntax.StructItemNode;
import io.stylusport.anchor.syntax.TypeText;
import io.stylusport.anchor.syntax.TypedParameterNode;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Walks the top-level items of a parsed source file and builds the {@link Program} model. Items that are
 * neither program modules nor Anchor structs are skipped; inside a program module only function items
 * are considered, without descending into nested modules.
 */
public final class ProgramModelBuilder {
    private static final Logger LOGGER = Logger.getLogger(ProgramModelBuilder.class.getName());
    static final String UNNAMED_PARAMETER = "unnamed";

    public Program build(SourceFileNode file) throws AnchorParseException {
        Program program = new Program();
        for (ItemNode item : file.getItems()) {
            if (item instanceof ModuleItemNode module && AnchorPredicates.isProgramModule(module)) {
                program.addModule(buildModule(module));
            } else if (item instanceof StructItemNode structure) {
                if (AnchorPredicates.isAccountStruct(structure)) {
                    program.addAccountStruct(buildAccountStruct(structure));
                } else if (AnchorPredicates.isRawAccount(structure)) {
                    program.addRawAccount(buildRawAccount(structure));
                } else {
                    LOGGER.log(Level.FINE, "Skipping plain struct {0} at {1}", new Object[] {
                        structure.getName(), structure.getLocation()
                    });
                }
            } else {
                LOGGER.log(Level.FINE, "Skipping item at {0}", item.getLocation());
            }
        }
        return program;
    }

    private ProgramModule buildModule(ModuleItemNode node) {
        ProgramModule module = new ProgramModule(node.getName(), node.getVisibility());
        for (ItemNode item : node.getItems()) {
            if (item instanceof FunctionItemNode function && AnchorPredicates.isInstruction(function)) {
                module.addInstruction(buildInstruction(function));
            } else if (item instanceof FunctionItemNode function) {
                LOGGER.log(Level.FINE, "Function {0} in program {1} takes no Context; not an instruction",
                        new Object[] {function.getName(), node.getName()});
            }
        }
        return module;
    }

    private Instruction buildInstruction(FunctionItemNode function) {
        Instruction instruction = new Instruction(function.getName(), function.getVisibility());
        if (function.getReturnType() != null) {
            instruction.setReturnType(TypeText.canonical(function.getReturnType()));
        }
        for (ParameterNode node : function.getParameters()) {
            if (!(node instanceof TypedParameterNode typed)) {
                continue;
            }
            String name = typed.getIdentifier() != null ? typed.getIdentifier() : UNNAMED_PARAMETER;
            ContextResolver.Resolution resolution = ContextResolver.resolve(typed.getType());
            if (resolution.isContext() && resolution.structName() != null) {
                instruction.setContextType(resolution.structName());
            }
            instruction.addParameter(
                    new Parameter(name, TypeText.canonical(typed.getType()), resolution.isContext()));
        }
        return instruction;
    }

    private AccountStruct buildAccountStruct(StructItemNode node) throws AnchorParseException {
        AccountStruct accountStruct = new AccountStruct(node.getName(), node.getVisibility());
        for (FieldNode fieldNode : node.getFields()) {
            if (!fieldNode.isNamed()) {
                continue;
            }
            AccountField field = new AccountField(fieldNode.getName(), TypeText.canonical(fieldNode.getType()));
            for (AttributeNode attribute : fieldNode.getAttributes()) {
                if (!attribute.isIdent(AnchorPredicates.ACCOUNT_ATTRIBUTE)) {
                    continue;
                }
                if (attribute.getArgumentStyle() != AttributeNode.ArgumentStyle.PARENTHESIZED) {
                    throw new AnchorParseException(attribute.getLocation(), String.format(
                            "%s: failed to parse account attribute on field %s.%s, expected #[account(...)]",
                            attribute.getLocation(), node.getName(), fieldNode.getName()));
                }
                for (Constraint constraint : ConstraintParser.parse(attribute.getArgumentText())) {
                    field.addConstraint(constraint);
                }
            }
            accountStruct.addField(field);
        }
        return accountStruct;
    }

    private RawAccount buildRawAccount(StructItemNode node) {
        RawAccount rawAccount = new RawAccount(node.getName(), node.getVisibility());
        for (FieldNode fieldNode : node.getFields()) {
            if (fieldNode.isNamed()) {
                rawAccount.addField(new RawAccountField(
                        fieldNode.getName(), TypeText.canonical(fieldNode.getType()), fieldNode.getVisibility()));
            }
        }
        return rawAccount;
    }
}
