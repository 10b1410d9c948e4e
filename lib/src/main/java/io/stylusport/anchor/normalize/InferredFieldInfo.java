package io.stylusport.anchor.normalize;

import java.util.Optional;

/** Facts derived from a field's constraints. Instances are immutable; updates produce copies. */
public record InferredFieldInfo(
        boolean requiresMut, boolean requiresSigner, boolean isInitialized, String relatedAccount) {

    public static final InferredFieldInfo NONE = new InferredFieldInfo(false, false, false, null);

    public Optional<String> relatedAccountIfKnown() {
        return Optional.ofNullable(relatedAccount);
    }

    InferredFieldInfo withRequiresMut() {
        return new InferredFieldInfo(true, requiresSigner, isInitialized, relatedAccount);
    }

    InferredFieldInfo withRequiresSigner() {
        return new InferredFieldInfo(requiresMut, true, isInitialized, relatedAccount);
    }

    InferredFieldInfo withInitialized() {
        return new InferredFieldInfo(requiresMut, requiresSigner, true, relatedAccount);
    }

    InferredFieldInfo withRelatedAccount(String account) {
        return new InferredFieldInfo(requiresMut, requiresSigner, isInitialized, account);
    }
}
