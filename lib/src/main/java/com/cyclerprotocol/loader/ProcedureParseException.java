package com.cyclerprotocol.loader;

/**
 * A Maccor procedure file could not be read: the XML is not well-formed, or the document lacks the
 * {@code MaccorTestProcedure/ProcSteps/TestStep} structure. Messages start with the source name.
 */
public final class ProcedureParseException extends Exception {
    public ProcedureParseException(String sourceName, String message) {
        super(sourceName + ": " + message);
    }

    public ProcedureParseException(String sourceName, String message, Throwable cause) {
        super(sourceName + ": " + message, cause);
    }
}
