package io.stylusport.anchor.parser;

import io.stylusport.anchor.syntax.AttributeNode;
import io.stylusport.anchor.syntax.FunctionItemNode;
import io.stylusport.anchor.syntax.ItemNode;
import io.stylusport.anchor.syntax.ParameterNode;
import io.stylusport.anchor.syntax.PathTypeNode;
import io.stylusport.anchor.syntax.ReferenceTypeNode;
import io.stylusport.anchor.syntax.StructItemNode;
import io.stylusport.anchor.syntax.TypeNode;
import io.stylusport.anchor.syntax.TypedParameterNode;
import java.util.List;

/**
 * Classifies syntax items by the Anchor conventions they follow. All checks look at attribute paths and
 * parameter types only; attribute arguments are inspected solely for {@code derive}.
 */
public final class AnchorPredicates {

    static final String PROGRAM_ATTRIBUTE = "program";
    static final String ACCOUNT_ATTRIBUTE = "account";
    static final String DERIVE_ATTRIBUTE = "derive";
    static final String ACCOUNTS_DERIVE = "Accounts";
    static final String CONTEXT_TYPE = "Context";

    private AnchorPredicates() {}

    /** {@code #[program]} on any item, regardless of arguments. */
    public static boolean isProgramModule(ItemNode item) {
        return hasAttribute(item.getAttributes(), PROGRAM_ATTRIBUTE);
    }

    /** A function taking at least one parameter typed {@code Context<..>}, possibly behind references. */
    public static boolean isInstruction(FunctionItemNode function) {
        for (ParameterNode parameter : function.getParameters()) {
            if (parameter instanceof TypedParameterNode typed && isContextType(typed.getType())) {
                return true;
            }
        }
        return false;
    }

    /** {@code #[derive(..., Accounts, ...)]}. */
    public static boolean isAccountStruct(StructItemNode structure) {
        for (AttributeNode attribute : structure.getAttributes()) {
            if (attribute.isIdent(DERIVE_ATTRIBUTE)
                    && attribute.getArgumentStyle() == AttributeNode.ArgumentStyle.PARENTHESIZED
                    && derivesAccounts(attribute.getArgumentText())) {
                return true;
            }
        }
        return false;
    }

    /** {@code #[account]} with or without arguments. */
    public static boolean isRawAccount(StructItemNode structure) {
        return hasAttribute(structure.getAttributes(), ACCOUNT_ATTRIBUTE);
    }

    static boolean isContextType(TypeNode type) {
        TypeNode stripped = stripReferences(type);
        return stripped instanceof PathTypeNode path
                && path.getLastSegment().getIdentifier().equals(CONTEXT_TYPE);
    }

    static TypeNode stripReferences(TypeNode type) {
        if (type instanceof ReferenceTypeNode reference) {
            return reference.stripReferences();
        }
        return type;
    }

    static boolean hasAttribute(List<AttributeNode> attributes, String name) {
        for (AttributeNode attribute : attributes) {
            if (attribute.isIdent(name)) {
                return true;
            }
        }
        return false;
    }

    private static boolean derivesAccounts(String argumentText) {
        for (String derived : argumentText.split(",")) {
            if (derived.trim().equals(ACCOUNTS_DERIVE)) {
                return true;
            }
        }
        return false;
    }
}
