package io.stylusport.anchor.parser;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.stylusport.anchor.syntax.FunctionItemNode;
import io.stylusport.anchor.syntax.ItemNode;
import io.stylusport.anchor.syntax.StructItemNode;
import org.junit.jupiter.api.Test;

class AnchorPredicatesTest {

    private final SyntaxTreeBuilder builder = new SyntaxTreeBuilder();

    @Test
    void programAttributeMarksModule() throws Exception {
        assertTrue(AnchorPredicates.isProgramModule(item("#[program] pub mod p {}")));
        assertTrue(AnchorPredicates.isProgramModule(item("#[program(skip)] mod p {}")));
        assertFalse(AnchorPredicates.isProgramModule(item("#[anchor_lang::program] mod p {}")));
        assertFalse(AnchorPredicates.isProgramModule(item("mod p {}")));
    }

    @Test
    void contextParameterMakesInstruction() throws Exception {
        assertTrue(AnchorPredicates.isInstruction(function("fn a(ctx: Context<A>) {}")));
        assertTrue(AnchorPredicates.isInstruction(function("fn a(x: u8, ctx: &mut anchor_lang::Context<A>) {}")));
        assertTrue(AnchorPredicates.isInstruction(function("fn a(ctx: & &Context) {}")));
        assertFalse(AnchorPredicates.isInstruction(function("fn a(ctx: CpiContext<A>) {}")));
        assertFalse(AnchorPredicates.isInstruction(function("fn a(ctx: Box<Context<A>>) {}")));
        assertFalse(AnchorPredicates.isInstruction(function("fn a(&self) {}")));
    }

    @Test
    void deriveAccountsMarksAccountStruct() throws Exception {
        assertTrue(AnchorPredicates.isAccountStruct(structure("#[derive(Accounts)] struct A {}")));
        assertTrue(AnchorPredicates.isAccountStruct(structure("#[derive(Clone,  Accounts )] struct A {}")));
        assertFalse(AnchorPredicates.isAccountStruct(structure("#[derive(AccountsExt)] struct A {}")));
        assertFalse(AnchorPredicates.isAccountStruct(structure("#[account] struct A {}")));
    }

    @Test
    void accountAttributeMarksRawAccount() throws Exception {
        assertTrue(AnchorPredicates.isRawAccount(structure("#[account] struct A {}")));
        assertTrue(AnchorPredicates.isRawAccount(structure("#[account(zero_copy)] struct A {}")));
        assertFalse(AnchorPredicates.isRawAccount(structure("#[event] struct A {}")));
    }

    private ItemNode item(String source) throws AnchorParseException {
        return builder.parse("test.rs", source).getItems().get(0);
    }

    private FunctionItemNode function(String source) throws AnchorParseException {
        return (FunctionItemNode) item(source);
    }

    private StructItemNode structure(String source) throws AnchorParseException {
        return (StructItemNode) item(source);
    }
}
