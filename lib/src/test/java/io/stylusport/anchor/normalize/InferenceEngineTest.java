package io.stylusport.anchor.normalize;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.stylusport.anchor.model.AccountField;
import io.stylusport.anchor.model.AccountStruct;
import io.stylusport.anchor.model.Constraint;
import io.stylusport.anchor.model.Program;
import io.stylusport.anchor.model.ProgramModule;
import java.util.List;
import org.junit.jupiter.api.Test;

class InferenceEngineTest {

    private final Normalizer normalizer = new Normalizer();

    @Test
    void rerunningInferenceChangesNothing() throws Exception {
        NormalizedProgram once = normalizer.normalize(ProgramFixtures.tokenProgram());
        NormalizedProgram twice = normalizer.normalize(ProgramFixtures.tokenProgram());

        new InferenceEngine().apply(twice);

        assertEquals(once, twice);
    }

    @Test
    void closeInstructionUsesCloseConstraintTarget() throws Exception {
        AccountStruct accounts = new AccountStruct("Close", "pub")
                .addField(new AccountField("authority", "Signer<'info>"))
                .addField(new AccountField("vault", "Account<'info,Vault>")
                        .addConstraint(Constraint.withoutValue("mut"))
                        .addConstraint(Constraint.withValue("close", "receiver")));
        Program program = withInstruction("close", accounts);

        NormalizedProgram normalized = normalizer.normalize(program);

        InstructionBody.Basic body = assertInstanceOf(
                InstructionBody.Basic.class, normalized.findInstruction("close").orElseThrow().getBody());
        assertEquals(List.of(new BasicOperation.Close("vault", "receiver")), body.operations());
    }

    @Test
    void closeWithoutValueRefundsAuthority() throws Exception {
        AccountStruct accounts = new AccountStruct("Close", "pub")
                .addField(new AccountField("vault", "Account<'info,Vault>").addConstraint(Constraint.withoutValue("close")));

        NormalizedProgram normalized = normalizer.normalize(withInstruction("close", accounts));

        InstructionBody.Basic body = assertInstanceOf(
                InstructionBody.Basic.class, normalized.findInstruction("close").orElseThrow().getBody());
        assertEquals(List.of(new BasicOperation.Close("vault", "authority")), body.operations());
    }

    @Test
    void closeConstraintIsIgnoredForOtherInstructionNames() throws Exception {
        AccountStruct accounts = new AccountStruct("Withdraw", "pub")
                .addField(new AccountField("vault", "Account<'info,Vault>").addConstraint(Constraint.withoutValue("close")));

        NormalizedProgram normalized = normalizer.normalize(withInstruction("withdraw", accounts));

        assertEquals(InstructionBody.UNKNOWN, normalized.findInstruction("withdraw").orElseThrow().getBody());
    }

    @Test
    void sendNeedsBothFromAndToFields() throws Exception {
        AccountStruct accounts = new AccountStruct("Send", "pub")
                .addField(new AccountField("from", "Account<'info,TokenAccount>"))
                .addField(new AccountField("destination", "Account<'info,TokenAccount>"));

        NormalizedProgram normalized = normalizer.normalize(withInstruction("send", accounts));

        assertEquals(InstructionBody.UNKNOWN, normalized.findInstruction("send").orElseThrow().getBody());
    }

    @Test
    void initializeOperationsFollowFieldOrderAndPrecedeTransfer() throws Exception {
        AccountStruct accounts = new AccountStruct("Transfer", "pub")
                .addField(new AccountField("receipt", "Account<'info,Receipt>")
                        .addConstraint(Constraint.withoutValue("init"))
                        .addConstraint(Constraint.withValue("payer", "from")))
                .addField(new AccountField("from", "Account<'info,TokenAccount>"))
                .addField(new AccountField("to", "Account<'info,TokenAccount>"));

        NormalizedProgram normalized = normalizer.normalize(withInstruction("transfer", accounts));

        InstructionBody.Basic body = assertInstanceOf(
                InstructionBody.Basic.class, normalized.findInstruction("transfer").orElseThrow().getBody());
        assertEquals(
                List.of(new BasicOperation.Initialize("receipt", "from"), new BasicOperation.Transfer("from", "to")),
                body.operations());
    }

    @Test
    void signerIsInferredOnlyForRoleNamesWithSignerType() throws Exception {
        AccountStruct accounts = new AccountStruct("Admin", "pub")
                .addField(new AccountField("admin", "Signer<'info>"))
                .addField(new AccountField("owner", "UncheckedAccount<'info>"))
                .addField(new AccountField("payer", "Signer<'info>"))
                .addField(new AccountField("authority", "Signer<'info>").addConstraint(Constraint.withoutValue("signer")));

        NormalizedAccountStruct normalized =
                normalizer.normalize(ProgramFixtures.singleStruct(accounts)).getAccountStructs().get(0);

        assertEquals(List.of(NormalizedConstraint.inferred("signer")),
                normalized.findField("admin").orElseThrow().getConstraints());
        assertEquals(List.of(), normalized.findField("owner").orElseThrow().getConstraints());
        assertEquals(List.of(), normalized.findField("payer").orElseThrow().getConstraints());
        assertEquals(List.of(NormalizedConstraint.explicit("signer", null)),
                normalized.findField("authority").orElseThrow().getConstraints());
    }

    @Test
    void hasOneSetsRelatedAccount() throws Exception {
        AccountStruct accounts = new AccountStruct("Deposit", "pub")
                .addField(new AccountField("vault", "Account<'info,Vault>")
                        .addConstraint(Constraint.withValue("has_one", "authority")))
                .addField(new AccountField("authority", "Signer<'info>"));

        NormalizedAccountStruct normalized =
                normalizer.normalize(ProgramFixtures.singleStruct(accounts)).getAccountStructs().get(0);

        NormalizedAccountField vault = normalized.findField("vault").orElseThrow();
        assertEquals("authority", vault.getInferredInfo().relatedAccount());
        assertTrue(normalized.findField("authority").orElseThrow().getInferredInfo().relatedAccountIfKnown().isEmpty());
    }

    @Test
    void relationshipToUndeclaredFieldIsIgnored() throws Exception {
        AccountStruct accounts = new AccountStruct("Deposit", "pub")
                .addField(new AccountField("vault", "Account<'info,Vault>")
                        .addConstraint(Constraint.withValue("belongs_to", "mint")));

        NormalizedAccountStruct normalized =
                normalizer.normalize(ProgramFixtures.singleStruct(accounts)).getAccountStructs().get(0);

        assertTrue(normalized.findField("vault").orElseThrow().getInferredInfo().relatedAccountIfKnown().isEmpty());
    }

    @Test
    void laterDeclaredTargetWinsWhenSeveralRelationshipsMatch() throws Exception {
        AccountStruct accounts = new AccountStruct("Deposit", "pub")
                .addField(new AccountField("owner", "Signer<'info>"))
                .addField(new AccountField("mint", "Account<'info,Mint>"))
                .addField(new AccountField("vault", "Account<'info,Vault>")
                        .addConstraint(Constraint.withValue("has_one", "mint"))
                        .addConstraint(Constraint.withValue("belongs_to", "owner")));

        NormalizedAccountStruct normalized =
                normalizer.normalize(ProgramFixtures.singleStruct(accounts)).getAccountStructs().get(0);

        assertEquals("mint", normalized.findField("vault").orElseThrow().getInferredInfo().relatedAccount());
    }

    @Test
    void relationshipOverridesPayerDerivedAccount() throws Exception {
        AccountStruct accounts = new AccountStruct("Initialize", "pub")
                .addField(new AccountField("vault", "Account<'info,Vault>")
                        .addConstraint(Constraint.withoutValue("init"))
                        .addConstraint(Constraint.withValue("payer", "user"))
                        .addConstraint(Constraint.withValue("has_one", "authority")))
                .addField(new AccountField("authority", "Signer<'info>"))
                .addField(new AccountField("user", "Signer<'info>"));

        NormalizedAccountStruct normalized =
                normalizer.normalize(ProgramFixtures.singleStruct(accounts)).getAccountStructs().get(0);

        NormalizedAccountField vault = normalized.findField("vault").orElseThrow();
        assertEquals(new InferredFieldInfo(true, false, true, "authority"), vault.getInferredInfo());
    }

    private static Program withInstruction(String instructionName, AccountStruct accounts) {
        return new Program()
                .addModule(new ProgramModule("fixture", "pub")
                        .addInstruction(ProgramFixtures.instruction(instructionName, accounts.getName())))
                .addAccountStruct(accounts);
    }
}
