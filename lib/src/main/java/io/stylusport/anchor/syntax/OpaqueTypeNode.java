package io.stylusport.anchor.syntax;

import java.util.List;
import java.util.Objects;

/** Types whose inner structure no consumer inspects: tuples, arrays, pointers, trait objects and so on. */
public final class OpaqueTypeNode extends TypeNode {

    public enum Form {
        TUPLE,
        ARRAY,
        POINTER,
        TRAIT_OBJECT,
        FUNCTION_POINTER,
        QUALIFIED_PATH,
        NEVER,
        MACRO
    }

    private final Form form;

    public OpaqueTypeNode(SourceLocation location, List<String> tokens, Form form) {
        super(location, tokens);
        this.form = Objects.requireNonNull(form, "form");
    }

    public Form getForm() {
        return form;
    }
}
