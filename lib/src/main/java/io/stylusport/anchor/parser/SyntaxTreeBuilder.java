package io.stylusport.anchor.parser;

import io.stylusport.anchor.syntax.AttributeNode;
import io.stylusport.anchor.syntax.FieldNode;
import io.stylusport.anchor.syntax.FunctionItemNode;
import io.stylusport.anchor.syntax.GenericArgumentNode;
import io.stylusport.anchor.syntax.ItemNode;
import io.stylusport.anchor.syntax.ModuleItemNode;
import io.stylusport.anchor.syntax.OpaqueTypeNode;
import io.stylusport.anchor.syntax.OtherItemNode;
import io.stylusport.anchor.syntax.ParameterNode;
import io.stylusport.anchor.syntax.PathSegmentNode;
import io.stylusport.anchor.syntax.PathTypeNode;
import io.stylusport.anchor.syntax.ReceiverParameterNode;
import io.stylusport.anchor.syntax.ReferenceTypeNode;
import io.stylusport.anchor.syntax.SourceFileNode;
import io.stylusport.anchor.syntax.SourceLocation;
import io.stylusport.anchor.syntax.StructItemNode;
import io.stylusport.anchor.syntax.TypeNode;
import io.stylusport.anchor.syntax.TypeText;
import io.stylusport.anchor.syntax.TypedParameterNode;
import io.stylusport.anchor.syntax.grammar.RustItemsBaseVisitor;
import io.stylusport.anchor.syntax.grammar.RustItemsLexer;
import io.stylusport.anchor.syntax.grammar.RustItemsParser;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.Interval;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;

/** Parses Rust source text into the item-level syntax tree consumed by {@link ProgramModelBuilder}. */
public final class SyntaxTreeBuilder {

    public SourceFileNode parse(String sourceName, String input) throws AnchorParseException {
        CharStream stream = CharStreams.fromString(input, sourceName);
        return parse(sourceName, stream);
    }

    public SourceFileNode parse(String sourceName, CharStream input) throws AnchorParseException {
        Objects.requireNonNull(sourceName, "sourceName");
        Objects.requireNonNull(input, "input");

        RustItemsLexer lexer = new RustItemsLexer(input);
        lexer.removeErrorListeners();
        lexer.addErrorListener(SyntaxErrorListener.INSTANCE);

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        if (DebugFlags.isTokenDebugEnabled()) {
            tokens.fill();
            DebugFlags.logTokens(tokens, lexer);
            tokens.seek(0);
        }

        RustItemsParser parser = new RustItemsParser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(SyntaxErrorListener.INSTANCE);
        if (DebugFlags.isParserTraceEnabled()) {
            parser.addErrorListener(DebugFlags.diagnosticListener());
        }

        try {
            RustItemsParser.SourceFileContext context = parser.sourceFile();
            return new NodeBuilder(sourceName, input, tokens).build(context);
        } catch (SyntaxErrorListener.SyntaxError ex) {
            throw new AnchorParseException(ex.locationIn(sourceName), sourceName + ": " + ex.getMessage(), ex);
        }
    }

    private static final class NodeBuilder {
        private final String sourceName;
        private final CharStream input;
        private final CommonTokenStream tokens;
        private final TypeBuilder types;

        NodeBuilder(String sourceName, CharStream input, CommonTokenStream tokens) {
            this.sourceName = sourceName;
            this.input = input;
            this.tokens = tokens;
            this.types = new TypeBuilder(this);
        }

        SourceFileNode build(RustItemsParser.SourceFileContext ctx) {
            List<AttributeNode> innerAttributes = new ArrayList<>();
            for (RustItemsParser.InnerAttributeContext attribute : ctx.innerAttribute()) {
                innerAttributes.add(innerAttribute(attribute));
            }
            return new SourceFileNode(sourceName, innerAttributes, items(ctx.item()));
        }

        private List<ItemNode> items(List<RustItemsParser.ItemContext> contexts) {
            List<ItemNode> items = new ArrayList<>(contexts.size());
            for (RustItemsParser.ItemContext itemContext : contexts) {
                items.add(item(itemContext));
            }
            return items;
        }

        private ItemNode item(RustItemsParser.ItemContext ctx) {
            SourceLocation location = location(ctx.getStart());
            List<AttributeNode> attributes = outerAttributes(ctx.outerAttribute());
            String visibility = visibility(ctx.visibility());
            RustItemsParser.ItemKindContext kind = ctx.itemKind();
            if (kind.moduleItem() != null) {
                return module(location, attributes, visibility, kind.moduleItem());
            }
            if (kind.functionItem() != null) {
                return function(location, attributes, visibility, kind.functionItem());
            }
            if (kind.structItem() != null) {
                return structure(location, attributes, visibility, kind.structItem());
            }
            String leading = kind.otherItem().getStart().getText();
            return new OtherItemNode(location, attributes, visibility, leading);
        }

        private ModuleItemNode module(
                SourceLocation location,
                List<AttributeNode> attributes,
                String visibility,
                RustItemsParser.ModuleItemContext ctx) {
            List<AttributeNode> allAttributes = new ArrayList<>(attributes);
            for (RustItemsParser.InnerAttributeContext inner : ctx.innerAttribute()) {
                allAttributes.add(innerAttribute(inner));
            }
            boolean inline = ctx.SEMI() == null;
            return new ModuleItemNode(
                    location, allAttributes, visibility, ctx.IDENT().getText(), inline, items(ctx.item()));
        }

        private FunctionItemNode function(
                SourceLocation location,
                List<AttributeNode> attributes,
                String visibility,
                RustItemsParser.FunctionItemContext ctx) {
            List<ParameterNode> parameters = new ArrayList<>();
            if (ctx.functionParams() != null) {
                for (RustItemsParser.FunctionParamContext param : ctx.functionParams().functionParam()) {
                    parameters.add(parameter(param));
                }
            }
            TypeNode returnType = null;
            if (ctx.returnType() != null) {
                returnType = types.type(ctx.returnType().type_());
            }
            return new FunctionItemNode(
                    location, attributes, visibility, ctx.IDENT().getText(), parameters, returnType);
        }

        private ParameterNode parameter(RustItemsParser.FunctionParamContext ctx) {
            if (ctx.selfParam() != null) {
                RustItemsParser.SelfParamContext self = ctx.selfParam();
                return new ReceiverParameterNode(location(self.getStart()), TypeText.canonical(tokenTexts(self)));
            }
            RustItemsParser.TypedParamContext typed = ctx.typedParam();
            RustItemsParser.PatternContext pattern = typed.pattern();
            String identifier = null;
            if (pattern instanceof RustItemsParser.IdentifierPatternContext) {
                String text = ((RustItemsParser.IdentifierPatternContext) pattern).IDENT().getText();
                if (!"_".equals(text)) {
                    identifier = text;
                }
            }
            return new TypedParameterNode(
                    location(typed.getStart()),
                    identifier,
                    String.join(" ", tokenTexts(pattern)),
                    types.type(typed.type_()));
        }

        private StructItemNode structure(
                SourceLocation location,
                List<AttributeNode> attributes,
                String visibility,
                RustItemsParser.StructItemContext ctx) {
            List<FieldNode> fields = new ArrayList<>();
            StructItemNode.Shape shape;
            if (ctx.LBRACE() != null) {
                shape = StructItemNode.Shape.NAMED;
                if (ctx.structFields() != null) {
                    for (RustItemsParser.StructFieldContext field : ctx.structFields().structField()) {
                        fields.add(
                                new FieldNode(
                                        location(field.getStart()),
                                        outerAttributes(field.outerAttribute()),
                                        visibility(field.visibility()),
                                        field.IDENT().getText(),
                                        types.type(field.type_())));
                    }
                }
            } else if (ctx.LPAREN() != null) {
                shape = StructItemNode.Shape.TUPLE;
                if (ctx.tupleFields() != null) {
                    for (RustItemsParser.TupleFieldContext field : ctx.tupleFields().tupleField()) {
                        fields.add(
                                new FieldNode(
                                        location(field.getStart()),
                                        outerAttributes(field.outerAttribute()),
                                        visibility(field.visibility()),
                                        null,
                                        types.type(field.type_())));
                    }
                }
            } else {
                shape = StructItemNode.Shape.UNIT;
            }
            return new StructItemNode(location, attributes, visibility, ctx.IDENT().getText(), shape, fields);
        }

        private List<AttributeNode> outerAttributes(List<RustItemsParser.OuterAttributeContext> contexts) {
            List<AttributeNode> attributes = new ArrayList<>(contexts.size());
            for (RustItemsParser.OuterAttributeContext ctx : contexts) {
                attributes.add(attribute(ctx.getStart(), false, ctx.attrPath(), ctx.attrInput()));
            }
            return attributes;
        }

        private AttributeNode innerAttribute(RustItemsParser.InnerAttributeContext ctx) {
            return attribute(ctx.getStart(), true, ctx.attrPath(), ctx.attrInput());
        }

        private AttributeNode attribute(
                Token start,
                boolean inner,
                RustItemsParser.AttrPathContext pathContext,
                RustItemsParser.AttrInputContext inputContext) {
            List<String> path = new ArrayList<>();
            for (RustItemsParser.AttrSegmentContext segment : pathContext.attrSegment()) {
                path.add(segment.getText());
            }
            AttributeNode.ArgumentStyle style = AttributeNode.ArgumentStyle.NONE;
            String arguments = "";
            if (inputContext != null) {
                RustItemsParser.DelimitedTreeContext delimited = inputContext.delimitedTree();
                if (delimited != null) {
                    style = delimiterStyle(delimited.getStart());
                    arguments = sourceText(
                            delimited.getStart().getTokenIndex() + 1, delimited.getStop().getTokenIndex() - 1);
                } else {
                    style = AttributeNode.ArgumentStyle.ASSIGNED;
                    arguments = sourceText(
                            inputContext.tokenTree(0).getStart().getTokenIndex(),
                            inputContext.getStop().getTokenIndex());
                }
            }
            return new AttributeNode(location(start), inner, path, style, arguments);
        }

        private static AttributeNode.ArgumentStyle delimiterStyle(Token open) {
            switch (open.getType()) {
                case RustItemsLexer.LBRACK:
                    return AttributeNode.ArgumentStyle.BRACKETED;
                case RustItemsLexer.LBRACE:
                    return AttributeNode.ArgumentStyle.BRACED;
                default:
                    return AttributeNode.ArgumentStyle.PARENTHESIZED;
            }
        }

        private String visibility(RustItemsParser.VisibilityContext ctx) {
            if (ctx == null) {
                return "";
            }
            return TypeText.canonical(tokenTexts(ctx));
        }

        SourceLocation location(Token token) {
            return new SourceLocation(sourceName, token.getLine(), token.getCharPositionInLine() + 1);
        }

        /**
         * Source text of the tokens {@code fromIndex..toIndex} as written, minus comments. Spacing between
         * tokens is kept verbatim, except that a gap holding a comment shrinks to a single space.
         */
        private String sourceText(int fromIndex, int toIndex) {
            StringBuilder text = new StringBuilder();
            int gapStart = -1;
            boolean commentInGap = false;
            for (int i = fromIndex; i <= toIndex; i++) {
                Token token = tokens.get(i);
                if (token.getChannel() != Token.DEFAULT_CHANNEL) {
                    commentInGap = true;
                    continue;
                }
                if (gapStart >= 0) {
                    if (commentInGap) {
                        text.append(' ');
                    } else if (token.getStartIndex() > gapStart) {
                        text.append(input.getText(Interval.of(gapStart, token.getStartIndex() - 1)));
                    }
                }
                text.append(token.getText());
                gapStart = token.getStopIndex() + 1;
                commentInGap = false;
            }
            return text.toString();
        }
    }

    private static final class TypeBuilder extends RustItemsBaseVisitor<TypeNode> {
        private final NodeBuilder nodes;

        TypeBuilder(NodeBuilder nodes) {
            this.nodes = nodes;
        }

        TypeNode type(RustItemsParser.Type_Context ctx) {
            return visitType_(ctx);
        }

        @Override
        public TypeNode visitType_(RustItemsParser.Type_Context ctx) {
            if (ctx.referenceType() != null) {
                return visitReferenceType(ctx.referenceType());
            }
            if (ctx.pathType() != null) {
                return visitPathType(ctx.pathType());
            }
            return visit(ctx.opaqueType());
        }

        @Override
        public TypeNode visitReferenceType(RustItemsParser.ReferenceTypeContext ctx) {
            String lifetime = ctx.LIFETIME() != null ? ctx.LIFETIME().getText() : null;
            return new ReferenceTypeNode(
                    nodes.location(ctx.getStart()),
                    tokenTexts(ctx),
                    lifetime,
                    ctx.MUT() != null,
                    visitType_(ctx.type_()));
        }

        @Override
        public TypeNode visitPathType(RustItemsParser.PathTypeContext ctx) {
            boolean global = ctx.getChild(0) instanceof TerminalNode;
            List<PathSegmentNode> segments = new ArrayList<>();
            for (RustItemsParser.PathSegmentContext segment : ctx.pathSegment()) {
                segments.add(segment(segment));
            }
            return new PathTypeNode(nodes.location(ctx.getStart()), tokenTexts(ctx), global, segments);
        }

        private PathSegmentNode segment(RustItemsParser.PathSegmentContext ctx) {
            String identifier = ctx.pathIdent().getText();
            RustItemsParser.GenericArgsContext args = ctx.genericArgs();
            if (args instanceof RustItemsParser.AngleArgsContext) {
                List<GenericArgumentNode> arguments = new ArrayList<>();
                for (RustItemsParser.GenericArgContext arg : ((RustItemsParser.AngleArgsContext) args).genericArg()) {
                    arguments.add(argument(arg));
                }
                return new PathSegmentNode(identifier, PathSegmentNode.ArgumentStyle.ANGLE_BRACKETED, arguments);
            }
            if (args instanceof RustItemsParser.ParenArgsContext) {
                List<GenericArgumentNode> arguments = new ArrayList<>();
                for (RustItemsParser.Type_Context type : ((RustItemsParser.ParenArgsContext) args).type_()) {
                    arguments.add(GenericArgumentNode.type(visitType_(type)));
                }
                return new PathSegmentNode(identifier, PathSegmentNode.ArgumentStyle.PARENTHESIZED, arguments);
            }
            return new PathSegmentNode(identifier, PathSegmentNode.ArgumentStyle.NONE, List.of());
        }

        private GenericArgumentNode argument(RustItemsParser.GenericArgContext ctx) {
            if (ctx instanceof RustItemsParser.LifetimeArgumentContext) {
                return GenericArgumentNode.lifetime(
                        ((RustItemsParser.LifetimeArgumentContext) ctx).LIFETIME().getText());
            }
            if (ctx instanceof RustItemsParser.BindingArgumentContext) {
                RustItemsParser.BindingArgumentContext binding = (RustItemsParser.BindingArgumentContext) ctx;
                return GenericArgumentNode.binding(binding.IDENT().getText(), visitType_(binding.type_()));
            }
            if (ctx instanceof RustItemsParser.TypeArgumentContext) {
                return GenericArgumentNode.type(visitType_(((RustItemsParser.TypeArgumentContext) ctx).type_()));
            }
            return GenericArgumentNode.constant(TypeText.canonical(tokenTexts(ctx)));
        }

        @Override
        public TypeNode visitTupleType(RustItemsParser.TupleTypeContext ctx) {
            return opaque(ctx, OpaqueTypeNode.Form.TUPLE);
        }

        @Override
        public TypeNode visitArrayType(RustItemsParser.ArrayTypeContext ctx) {
            return opaque(ctx, OpaqueTypeNode.Form.ARRAY);
        }

        @Override
        public TypeNode visitPointerType(RustItemsParser.PointerTypeContext ctx) {
            return opaque(ctx, OpaqueTypeNode.Form.POINTER);
        }

        @Override
        public TypeNode visitTraitObjectType(RustItemsParser.TraitObjectTypeContext ctx) {
            return opaque(ctx, OpaqueTypeNode.Form.TRAIT_OBJECT);
        }

        @Override
        public TypeNode visitFnPointerType(RustItemsParser.FnPointerTypeContext ctx) {
            return opaque(ctx, OpaqueTypeNode.Form.FUNCTION_POINTER);
        }

        @Override
        public TypeNode visitQualifiedPathType(RustItemsParser.QualifiedPathTypeContext ctx) {
            return opaque(ctx, OpaqueTypeNode.Form.QUALIFIED_PATH);
        }

        @Override
        public TypeNode visitNeverType(RustItemsParser.NeverTypeContext ctx) {
            return opaque(ctx, OpaqueTypeNode.Form.NEVER);
        }

        @Override
        public TypeNode visitMacroType(RustItemsParser.MacroTypeContext ctx) {
            return opaque(ctx, OpaqueTypeNode.Form.MACRO);
        }

        private TypeNode opaque(ParserRuleContext ctx, OpaqueTypeNode.Form form) {
            return new OpaqueTypeNode(nodes.location(ctx.getStart()), tokenTexts(ctx), form);
        }
    }

    static List<String> tokenTexts(ParseTree tree) {
        List<String> texts = new ArrayList<>();
        collectTokenTexts(tree, texts);
        return texts;
    }

    private static void collectTokenTexts(ParseTree tree, List<String> out) {
        if (tree instanceof TerminalNode) {
            Token symbol = ((TerminalNode) tree).getSymbol();
            if (symbol.getType() != Token.EOF) {
                out.add(symbol.getText());
            }
            return;
        }
        for (int i = 0; i < tree.getChildCount(); i++) {
            collectTokenTexts(tree.getChild(i), out);
        }
    }
}
