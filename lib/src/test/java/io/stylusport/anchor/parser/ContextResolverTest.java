package io.stylusport.anchor.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.stylusport.anchor.syntax.FunctionItemNode;
import io.stylusport.anchor.syntax.TypedParameterNode;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ContextResolverTest {

    private final SyntaxTreeBuilder builder = new SyntaxTreeBuilder();

    @Test
    void resolvesSingleTypeArgument() throws Exception {
        ContextResolver.Resolution resolution = resolve("Context<Initialize>");

        assertTrue(resolution.isContext());
        assertEquals(Optional.of("Initialize"), resolution.structNameIfResolved());
    }

    @Test
    void ignoresLifetimesAndReferences() throws Exception {
        assertEquals("Deposit<'info>", resolve("&mut Context<'_, '_, '_, 'info, Deposit<'info>>").structName());
    }

    @Test
    void contextWithoutSingleArgumentIsUnresolved() throws Exception {
        assertEquals(ContextResolver.Resolution.UNRESOLVED, resolve("Context"));
        assertEquals(ContextResolver.Resolution.UNRESOLVED, resolve("Context<A, B>"));
        assertEquals(ContextResolver.Resolution.UNRESOLVED, resolve("Context<'info>"));
    }

    @Test
    void otherTypesAreNotContexts() throws Exception {
        ContextResolver.Resolution resolution = resolve("Vec<Context<A>>");

        assertFalse(resolution.isContext());
        assertEquals(Optional.empty(), resolution.structNameIfResolved());
    }

    private ContextResolver.Resolution resolve(String type) throws AnchorParseException {
        FunctionItemNode function =
                (FunctionItemNode) builder.parse("test.rs", "fn f(p: " + type + ") {}").getItems().get(0);
        return ContextResolver.resolve(((TypedParameterNode) function.getParameters().get(0)).getType());
    }
}
