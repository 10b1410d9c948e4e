package io.stylusport.anchor.parser;

import io.stylusport.anchor.syntax.PathSegmentNode;
import io.stylusport.anchor.syntax.PathTypeNode;
import io.stylusport.anchor.syntax.TypeNode;
import io.stylusport.anchor.syntax.TypeText;
import java.util.List;
import java.util.Optional;

/** Recognises {@code Context<T>} parameter types and extracts the account struct name {@code T}. */
public final class ContextResolver {

    /** Outcome for one parameter type. A context parameter may still lack a resolvable struct name. */
    public record Resolution(boolean isContext, String structName) {

        static final Resolution NOT_CONTEXT = new Resolution(false, null);
        static final Resolution UNRESOLVED = new Resolution(true, null);

        public Optional<String> structNameIfResolved() {
            return Optional.ofNullable(structName);
        }
    }

    private ContextResolver() {}

    public static Resolution resolve(TypeNode type) {
        if (!AnchorPredicates.isContextType(type)) {
            return Resolution.NOT_CONTEXT;
        }
        PathSegmentNode last = ((PathTypeNode) AnchorPredicates.stripReferences(type)).getLastSegment();
        // Lifetimes such as Context<'_, '_, '_, 'info, T> do not count towards the single argument.
        List<TypeNode> arguments = last.getTypeArguments();
        if (arguments.size() != 1) {
            return Resolution.UNRESOLVED;
        }
        return new Resolution(true, TypeText.canonical(arguments.get(0)));
    }
}
