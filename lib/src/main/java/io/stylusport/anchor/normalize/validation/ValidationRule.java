package io.stylusport.anchor.normalize.validation;

import io.stylusport.anchor.normalize.NormalizedProgram;
import io.stylusport.anchor.normalize.ValidationIssue;
import java.util.List;

/** A read-only check over a normalized program. Rules never modify the program. */
public interface ValidationRule {
    String name();

    List<ValidationIssue> validate(NormalizedProgram program);
}
