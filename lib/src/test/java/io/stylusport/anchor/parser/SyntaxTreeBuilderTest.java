package io.stylusport.anchor.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.stylusport.anchor.syntax.AttributeNode;
import io.stylusport.anchor.syntax.FunctionItemNode;
import io.stylusport.anchor.syntax.GenericArgumentNode;
import io.stylusport.anchor.syntax.ItemNode;
import io.stylusport.anchor.syntax.ModuleItemNode;
import io.stylusport.anchor.syntax.OpaqueTypeNode;
import io.stylusport.anchor.syntax.OtherItemNode;
import io.stylusport.anchor.syntax.PathSegmentNode;
import io.stylusport.anchor.syntax.PathTypeNode;
import io.stylusport.anchor.syntax.ReceiverParameterNode;
import io.stylusport.anchor.syntax.ReferenceTypeNode;
import io.stylusport.anchor.syntax.SourceFileNode;
import io.stylusport.anchor.syntax.SourceLocation;
import io.stylusport.anchor.syntax.StructItemNode;
import io.stylusport.anchor.syntax.TypedParameterNode;
import java.util.List;
import org.junit.jupiter.api.Test;

class SyntaxTreeBuilderTest {

    private static final String SAMPLE = String.join(
            "\n",
            "#![allow(unused)]",
            "use anchor_lang::prelude::*;",
            "declare_id!(\"Fg6PaFpoGXkYsidMpWTK6W2BeZ7FEfcYkg476zPFsLnS\");",
            "",
            "/// Entry points.",
            "#[program]",
            "pub mod vault {",
            "    use super::*;",
            "    pub fn deposit<'a>(ctx: Context<'_, '_, '_, 'a, Deposit<'a>>, (x, y): (u8, u8), _: u64)",
            "        -> Result<()> where 'a: 'a {",
            "        let total = x as u64 + y as u64; // comment with } brace",
            "        msg!(\"{}\", total);",
            "        Ok(())",
            "    }",
            "    pub(crate) async fn helper(&mut self, data: &[u8]) {}",
            "}",
            "",
            "#[derive(Accounts, Clone)]",
            "pub struct Deposit<'info> {",
            "    #[account(mut, seeds = [b\"vault\", owner.key().as_ref()], bump)]",
            "    pub vault: Account<'info, Vault>,",
            "    owner: Signer<'info>,",
            "}",
            "",
            "pub struct Pair(pub u8, u16);",
            "struct Marker;",
            "impl Vault { pub const SIZE: usize = 8; }",
            "enum Side { Bid, Ask }",
            "");

    private final SyntaxTreeBuilder builder = new SyntaxTreeBuilder();

    @Test
    void parsesItemsInDeclarationOrder() throws Exception {
        SourceFileNode file = builder.parse("lib.rs", SAMPLE);

        assertEquals(1, file.getInnerAttributes().size());
        assertTrue(file.getInnerAttributes().get(0).isInner());
        List<ItemNode> items = file.getItems();
        assertEquals(8, items.size());
        assertEquals("use", assertInstanceOf(OtherItemNode.class, items.get(0)).getLeadingKeyword());
        assertEquals("declare_id", assertInstanceOf(OtherItemNode.class, items.get(1)).getLeadingKeyword());
        assertInstanceOf(ModuleItemNode.class, items.get(2));
        assertInstanceOf(StructItemNode.class, items.get(3));
        assertInstanceOf(StructItemNode.class, items.get(4));
        assertInstanceOf(StructItemNode.class, items.get(5));
        assertEquals("impl", assertInstanceOf(OtherItemNode.class, items.get(6)).getLeadingKeyword());
        assertEquals("enum", assertInstanceOf(OtherItemNode.class, items.get(7)).getLeadingKeyword());
    }

    @Test
    void buildsModuleWithFunctions() throws Exception {
        ModuleItemNode module = (ModuleItemNode) builder.parse("lib.rs", SAMPLE).getItems().get(2);

        assertEquals("vault", module.getName());
        assertEquals("pub", module.getVisibility());
        assertTrue(module.isInline());
        assertEquals(new SourceLocation("lib.rs", 6, 1), module.getLocation());
        assertEquals(1, module.getAttributes().size());
        assertTrue(module.getAttributes().get(0).isIdent("program"));
        assertFalse(module.getAttributes().get(0).hasArguments());

        assertEquals(3, module.getItems().size());
        FunctionItemNode deposit = assertInstanceOf(FunctionItemNode.class, module.getItems().get(1));
        assertEquals("deposit", deposit.getName());
        assertEquals("Result<()>", deposit.getReturnType().toString());
        assertEquals(3, deposit.getParameters().size());

        TypedParameterNode ctx = assertInstanceOf(TypedParameterNode.class, deposit.getParameters().get(0));
        assertEquals("ctx", ctx.getIdentifier());
        PathTypeNode context = assertInstanceOf(PathTypeNode.class, ctx.getType());
        PathSegmentNode segment = context.getLastSegment();
        assertEquals("Context", segment.getIdentifier());
        assertEquals(5, segment.getArguments().size());
        assertEquals(GenericArgumentNode.Kind.LIFETIME, segment.getArguments().get(0).getKind());
        assertEquals(1, segment.getTypeArguments().size());
        assertEquals("Deposit<'a>", segment.getTypeArguments().get(0).toString());

        TypedParameterNode tuple = assertInstanceOf(TypedParameterNode.class, deposit.getParameters().get(1));
        assertNull(tuple.getIdentifier());
        assertEquals("( x , y )", tuple.getPatternText());
        assertInstanceOf(OpaqueTypeNode.class, tuple.getType());

        TypedParameterNode wildcard = assertInstanceOf(TypedParameterNode.class, deposit.getParameters().get(2));
        assertNull(wildcard.getIdentifier());

        FunctionItemNode helper = assertInstanceOf(FunctionItemNode.class, module.getItems().get(2));
        assertEquals("pub(crate)", helper.getVisibility());
        assertNull(helper.getReturnType());
        ReceiverParameterNode self = assertInstanceOf(ReceiverParameterNode.class, helper.getParameters().get(0));
        assertEquals("& mut self", self.getText());
        TypedParameterNode data = assertInstanceOf(TypedParameterNode.class, helper.getParameters().get(1));
        ReferenceTypeNode slice = assertInstanceOf(ReferenceTypeNode.class, data.getType());
        assertFalse(slice.isMutable());
        assertEquals(OpaqueTypeNode.Form.ARRAY, ((OpaqueTypeNode) slice.getReferent()).getForm());
    }

    @Test
    void keepsAttributeArgumentsVerbatim() throws Exception {
        StructItemNode deposit = (StructItemNode) builder.parse("lib.rs", SAMPLE).getItems().get(3);

        AttributeNode derive = deposit.getAttributes().get(0);
        assertEquals(AttributeNode.ArgumentStyle.PARENTHESIZED, derive.getArgumentStyle());
        assertEquals("Accounts, Clone", derive.getArgumentText());

        assertEquals(StructItemNode.Shape.NAMED, deposit.getShape());
        assertEquals(2, deposit.getFields().size());
        AttributeNode account = deposit.getFields().get(0).getAttributes().get(0);
        assertEquals("mut, seeds = [b\"vault\", owner.key().as_ref()], bump", account.getArgumentText());
        assertEquals("pub", deposit.getFields().get(0).getVisibility());
        assertEquals("", deposit.getFields().get(1).getVisibility());
        assertEquals("Signer<'info>", deposit.getFields().get(1).getType().toString());
    }

    @Test
    void recognisesTupleAndUnitStructs() throws Exception {
        List<ItemNode> items = builder.parse("lib.rs", SAMPLE).getItems();

        StructItemNode pair = (StructItemNode) items.get(4);
        assertEquals(StructItemNode.Shape.TUPLE, pair.getShape());
        assertEquals(2, pair.getFields().size());
        assertFalse(pair.getFields().get(0).isNamed());

        StructItemNode marker = (StructItemNode) items.get(5);
        assertEquals(StructItemNode.Shape.UNIT, marker.getShape());
        assertTrue(marker.getFields().isEmpty());
    }

    @Test
    void assignedAttributeKeepsValue() throws Exception {
        SourceFileNode file = builder.parse("doc.rs", "#[doc = \"hidden\"]\nfn documented() {}\n");

        AttributeNode doc = file.getItems().get(0).getAttributes().get(0);
        assertEquals(AttributeNode.ArgumentStyle.ASSIGNED, doc.getArgumentStyle());
        assertEquals("\"hidden\"", doc.getArgumentText());
    }

    @Test
    void commentsAreDroppedFromAttributeArguments() throws Exception {
        StructItemNode accounts = (StructItemNode) builder.parse(
                        "comments.rs",
                        String.join(
                                "\n",
                                "struct Init {",
                                "    #[account(",
                                "        init, // create the vault",
                                "        payer = authority,",
                                "        space = 8 /* discriminator */ + 32,",
                                "        seeds = [b\"vault\", authority.key().as_ref()], // pda",
                                "    )]",
                                "    vault: u8,",
                                "    /// Doc comment on a field.",
                                "    #[doc = /* inline */ \"kept\"]",
                                "    other: u8,",
                                "}",
                                ""))
                .getItems()
                .get(0);

        assertEquals(
                "init, payer = authority,\n        space = 8 + 32,\n        seeds = [b\"vault\", authority.key().as_ref()],",
                accounts.getFields().get(0).getAttributes().get(0).getArgumentText());
        assertEquals("\"kept\"", accounts.getFields().get(1).getAttributes().get(0).getArgumentText());
    }

    @Test
    void syntaxErrorsAreReportedWithPosition() {
        AnchorParseException ex = assertThrows(
                AnchorParseException.class,
                () -> builder.parse("broken.rs", "pub fn broken(ctx: Context<X> -> Result<()> {}\n"));

        assertTrue(ex.getMessage().startsWith("broken.rs: line 1:"), ex.getMessage());
        SourceLocation location = ex.getLocation().orElseThrow();
        assertEquals("broken.rs", location.sourceName());
        assertEquals(1, location.line());
        assertTrue(location.column() > 1, location.toString());
    }
}
