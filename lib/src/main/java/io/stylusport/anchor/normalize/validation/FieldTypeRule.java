package io.stylusport.anchor.normalize.validation;

import io.stylusport.anchor.normalize.NormalizedAccountField;
import io.stylusport.anchor.normalize.NormalizedAccountStruct;
import io.stylusport.anchor.normalize.NormalizedProgram;
import io.stylusport.anchor.normalize.NormalizedRawAccount;
import io.stylusport.anchor.normalize.NormalizedRawField;
import io.stylusport.anchor.normalize.ValidationIssue;
import java.util.ArrayList;
import java.util.List;

public final class FieldTypeRule implements ValidationRule {

    @Override
    public String name() {
        return "field-types";
    }

    @Override
    public List<ValidationIssue> validate(NormalizedProgram program) {
        List<ValidationIssue> issues = new ArrayList<>();
        for (NormalizedAccountStruct accounts : program.getAccountStructs()) {
            for (NormalizedAccountField field : accounts.getFields()) {
                if (field.getType().isEmpty()) {
                    issues.add(missingType("account", accounts.getName(), field.getName()));
                }
            }
        }
        for (NormalizedRawAccount account : program.getRawAccounts()) {
            for (NormalizedRawField field : account.getFields()) {
                if (field.type().isEmpty()) {
                    issues.add(missingType("raw account", account.getName(), field.name()));
                }
            }
        }
        return issues;
    }

    private static ValidationIssue missingType(String kind, String owner, String field) {
        return ValidationIssue.warning(
                String.format("Field %s in %s %s has no type information", field, kind, owner), owner + "." + field);
    }
}
