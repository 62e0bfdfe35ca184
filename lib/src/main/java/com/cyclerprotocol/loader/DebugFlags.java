package com.cyclerprotocol.loader;

import com.cyclerprotocol.loader.grammar.MaccorXmlLexer;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.Token;

public final class DebugFlags {
    private static final String TOKENS_PROPERTY = "cyclerprotocol.debugTokens";
    /** Environment fallback kept for convenience; prefer using system properties. */
    private static final String TOKENS_ENV = "CYCLERPROTOCOL_DEBUG_TOKENS";
    private static final Logger LOGGER = Logger.getLogger(DebugFlags.class.getName());

    private DebugFlags() {}

    public static boolean isTokenDebugEnabled() {
        String value = System.getProperty(TOKENS_PROPERTY);
        if (value != null) {
            return Boolean.parseBoolean(value);
        }
        return Boolean.parseBoolean(System.getenv(TOKENS_ENV));
    }

    static void logTokens(String sourceName, CommonTokenStream tokens, MaccorXmlLexer lexer) {
        LOGGER.log(Level.INFO, "Token dump for {0}", sourceName);
        for (Token token : tokens.getTokens()) {
            String symbolic = lexer.getVocabulary().getSymbolicName(token.getType());
            if (symbolic == null) {
                symbolic = String.format(Locale.ROOT, "#%d", token.getType());
            }
            LOGGER.info(
                    String.format(
                            Locale.ROOT,
                            "  %-12s @ %4d:%-3d -> %s",
                            symbolic,
                            token.getLine(),
                            token.getCharPositionInLine(),
                            token.getText()));
        }
    }
}
