package com.cyclerprotocol.loader;

import com.cyclerprotocol.loader.ast.XmlElementNode;
import com.cyclerprotocol.loader.grammar.MaccorXmlBaseVisitor;
import com.cyclerprotocol.loader.grammar.MaccorXmlLexer;
import com.cyclerprotocol.loader.grammar.MaccorXmlParser;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.antlr.v4.runtime.CharStream;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.Interval;
import org.antlr.v4.runtime.misc.ParseCancellationException;

/** Parses a procedure document into an {@link XmlElementNode} tree rooted at the document element. */
public final class MaccorAstBuilder {

    public XmlElementNode parse(String sourceName, String input) throws ProcedureParseException {
        CharStream stream = CharStreams.fromString(input, sourceName);
        return parse(sourceName, stream);
    }

    public XmlElementNode parse(String sourceName, CharStream input) throws ProcedureParseException {
        Objects.requireNonNull(sourceName, "sourceName");
        Objects.requireNonNull(input, "input");

        MaccorXmlLexer lexer = new MaccorXmlLexer(input);
        lexer.removeErrorListeners();
        lexer.addErrorListener(ThrowingErrorListener.INSTANCE);

        CommonTokenStream tokens = new CommonTokenStream(lexer);
        if (DebugFlags.isTokenDebugEnabled()) {
            tokens.fill();
            DebugFlags.logTokens(sourceName, tokens, lexer);
            tokens.seek(0);
        }

        MaccorXmlParser parser = new MaccorXmlParser(tokens);
        parser.removeErrorListeners();
        parser.addErrorListener(ThrowingErrorListener.INSTANCE);

        MaccorXmlParser.DocumentContext document;
        try {
            document = parser.document();
        } catch (ParseCancellationException ex) {
            throw new ProcedureParseException(sourceName, ex.getMessage(), ex);
        }
        try {
            return new ElementBuildingVisitor(input).visit(document.element());
        } catch (MalformedElement ex) {
            throw new ProcedureParseException(sourceName, ex.getMessage(), ex);
        }
    }

    /** Carries a structural error out of the visitor, which cannot throw checked exceptions. */
    private static final class MalformedElement extends RuntimeException {
        MalformedElement(String message, Throwable cause) {
            super(message, cause);
        }
    }

    private static final class ElementBuildingVisitor extends MaccorXmlBaseVisitor<XmlElementNode> {
        private final CharStream input;

        ElementBuildingVisitor(CharStream input) {
            this.input = input;
        }

        @Override
        public XmlElementNode visitPairedElement(MaccorXmlParser.PairedElementContext ctx) {
            String name = ctx.name.getText();
            if (!name.equals(ctx.closingName.getText())) {
                throw malformed(
                        ctx.closingName,
                        "closing tag </" + ctx.closingName.getText() + "> does not match <" + name + ">",
                        null);
            }
            List<XmlElementNode> children = new ArrayList<>();
            for (MaccorXmlParser.ElementContext child : ctx.content().element()) {
                children.add(visit(child));
            }
            String text = "";
            if (children.isEmpty()) {
                text = characterData(ctx.startClose, ctx.endOpen);
            }
            return new XmlElementNode(
                    name,
                    attributes(ctx.attribute()),
                    children,
                    text,
                    ctx.name.getLine(),
                    ctx.name.getCharPositionInLine() + 1);
        }

        @Override
        public XmlElementNode visitEmptyElement(MaccorXmlParser.EmptyElementContext ctx) {
            return new XmlElementNode(
                    ctx.name.getText(),
                    attributes(ctx.attribute()),
                    List.of(),
                    "",
                    ctx.name.getLine(),
                    ctx.name.getCharPositionInLine() + 1);
        }

        private Map<String, String> attributes(List<MaccorXmlParser.AttributeContext> contexts) {
            Map<String, String> attributes = new LinkedHashMap<>();
            for (MaccorXmlParser.AttributeContext attribute : contexts) {
                String quoted = attribute.STRING().getText();
                String raw = quoted.substring(1, quoted.length() - 1);
                try {
                    attributes.put(attribute.NAME().getText(), XmlText.decode(raw));
                } catch (IllegalArgumentException ex) {
                    throw malformed(attribute.STRING().getSymbol(), ex.getMessage(), ex);
                }
            }
            return attributes;
        }

        private String characterData(Token startClose, Token endOpen) {
            int start = startClose.getStopIndex() + 1;
            int stop = endOpen.getStartIndex() - 1;
            if (stop < start) {
                return "";
            }
            try {
                return XmlText.decode(input.getText(Interval.of(start, stop)));
            } catch (IllegalArgumentException ex) {
                throw malformed(startClose, ex.getMessage(), ex);
            }
        }

        private MalformedElement malformed(Token at, String message, Throwable cause) {
            return new MalformedElement(
                    "line " + at.getLine() + ":" + (at.getCharPositionInLine() + 1) + " " + message,
                    cause);
        }
    }
}
