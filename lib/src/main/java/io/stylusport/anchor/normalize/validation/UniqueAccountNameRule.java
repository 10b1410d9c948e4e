package io.stylusport.anchor.normalize.validation;

import io.stylusport.anchor.normalize.NormalizedAccountStruct;
import io.stylusport.anchor.normalize.NormalizedProgram;
import io.stylusport.anchor.normalize.NormalizedRawAccount;
import io.stylusport.anchor.normalize.ValidationIssue;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/** Account structs and raw accounts share one namespace; every repeat after the first is an error. */
public final class UniqueAccountNameRule implements ValidationRule {

    @Override
    public String name() {
        return "unique-account-names";
    }

    @Override
    public List<ValidationIssue> validate(NormalizedProgram program) {
        List<ValidationIssue> issues = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (NormalizedAccountStruct accounts : program.getAccountStructs()) {
            if (!seen.add(accounts.getName())) {
                issues.add(ValidationIssue.error(
                        "Duplicate account struct name: " + accounts.getName(), accounts.getName()));
            }
        }
        for (NormalizedRawAccount account : program.getRawAccounts()) {
            if (!seen.add(account.getName())) {
                issues.add(ValidationIssue.error("Duplicate account name: " + account.getName(), account.getName()));
            }
        }
        return issues;
    }
}
