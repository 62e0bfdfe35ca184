package com.cyclerprotocol.loader;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.Lexer;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.ParseCancellationException;

/**
 * Stops at the first lexer or parser error. A procedure file that is not well-formed XML is rejected outright rather
 * than repaired, so the message names the position and, for parser errors, the token found there.
 */
final class ThrowingErrorListener extends BaseErrorListener {
    static final ThrowingErrorListener INSTANCE = new ThrowingErrorListener();

    private ThrowingErrorListener() {}

    @Override
    public void syntaxError(
            Recognizer<?, ?> recognizer,
            Object offendingSymbol,
            int line,
            int charPositionInLine,
            String msg,
            RecognitionException e) {
        StringBuilder message = new StringBuilder();
        message.append("line ").append(line).append(':').append(charPositionInLine + 1).append(' ');
        message.append(recognizer instanceof Lexer ? "malformed markup: " : "unexpected structure: ");
        message.append(msg);
        if (offendingSymbol instanceof Token token && token.getType() != Token.EOF) {
            message.append(" (found '").append(token.getText()).append("')");
        }
        throw new ParseCancellationException(message.toString(), e);
    }
}
