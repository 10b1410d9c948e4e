package io.stylusport.anchor.normalize.validation;

import io.stylusport.anchor.normalize.NormalizedProgram;
import io.stylusport.anchor.normalize.ValidationIssue;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/** Runs validation rules in registration order and concatenates their issues. */
public final class ValidationRunner {
    private static final Logger LOGGER = Logger.getLogger(ValidationRunner.class.getName());

    private final List<ValidationRule> rules;

    public ValidationRunner(List<ValidationRule> rules) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules"));
    }

    public static ValidationRunner defaultRunner() {
        return new ValidationRunner(defaultRules());
    }

    public static List<ValidationRule> defaultRules() {
        return List.of(
                new UniqueAccountNameRule(),
                new InstructionReferenceRule(),
                new FieldTypeRule(),
                new InstructionVisibilityRule());
    }

    public List<ValidationRule> getRules() {
        return rules;
    }

    public List<ValidationIssue> run(NormalizedProgram program) {
        List<ValidationIssue> issues = new ArrayList<>();
        for (ValidationRule rule : rules) {
            List<ValidationIssue> found = rule.validate(program);
            if (!found.isEmpty()) {
                LOGGER.log(Level.FINE, "Rule {0} reported {1} issue(s)", new Object[] {rule.name(), found.size()});
            }
            issues.addAll(found);
        }
        return issues;
    }
}
