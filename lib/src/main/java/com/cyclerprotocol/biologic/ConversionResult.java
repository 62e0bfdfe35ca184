package com.cyclerprotocol.biologic;

import java.util.List;

/** Ordered Biologic sequences plus the diagnostics gathered while producing them. */
public final class ConversionResult {
    private final List<SequenceRecord> sequences;
    private final List<ConversionMessage> messages;

    public ConversionResult(List<SequenceRecord> sequences, List<ConversionMessage> messages) {
        this.sequences = List.copyOf(sequences);
        this.messages = List.copyOf(messages);
    }

    public List<SequenceRecord> getSequences() {
        return sequences;
    }

    public List<ConversionMessage> getMessages() {
        return messages;
    }
}
