package com.cyclerprotocol.biologic;

import com.cyclerprotocol.biologic.plan.ControlFlowPlanner;
import com.cyclerprotocol.biologic.plan.ConversionPlan;
import com.cyclerprotocol.biologic.plan.SequenceGenerator;
import com.cyclerprotocol.loader.MaccorProcedureLoader;
import com.cyclerprotocol.loader.ProcedureParseException;
import com.cyclerprotocol.procedure.Procedure;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Converts Maccor procedures into Biologic Modulo Bat settings files. Some Maccor constructs cannot be expressed in
 * Modulo Bat at all; those abort with a {@link ConversionException}. Loops that the native loop sequence cannot
 * represent are unrolled.
 */
public final class MaccorToBiologicConverter {
    private static final Logger LOGGER = Logger.getLogger(MaccorToBiologicConverter.class.getName());

    private final ConverterSettings settings;
    private final SequenceTemplate template;
    private final ControlFlowPlanner planner = new ControlFlowPlanner();
    private final SequenceGenerator generator = new SequenceGenerator();

    public MaccorToBiologicConverter(ConverterSettings settings, SequenceTemplate template) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.template = Objects.requireNonNull(template, "template");
    }

    public MaccorToBiologicConverter(ConverterSettings settings) {
        this(settings, SequenceTemplate.moduloBat());
    }

    public MaccorToBiologicConverter() {
        this(ConverterSettings.defaults());
    }

    public ConverterSettings getSettings() {
        return settings;
    }

    public ConversionResult convert(Procedure procedure) throws ConversionException {
        Objects.requireNonNull(procedure, "procedure");
        ConversionPlan plan = planner.plan(procedure);
        List<ConversionMessage> messages = new ArrayList<>();
        List<SequenceRecord> sequences = generator.generate(procedure, plan, messages);
        for (ConversionMessage message : messages) {
            LOGGER.log(Level.INFO, "[{0}] {1}", new Object[] {procedure.getSourceName(), message});
        }
        return new ConversionResult(sequences, messages);
    }

    /** Complete settings file text, CRLF line endings. */
    public String toProtocolText(Procedure procedure) throws ConversionException {
        ConversionResult result = convert(procedure);
        return new ModuloBatSerializer(settings.getColumnWidth()).render(result.getSequences(), template);
    }

    /** Writes the settings file as Latin-1, which is what EC-Lab expects. */
    public void writeProtocolFile(Procedure procedure, Path target) throws ConversionException, IOException {
        String text = toProtocolText(procedure);
        Files.write(target, text.getBytes(ConverterSettings.OUTPUT_CHARSET));
    }

    /** Loads a Maccor procedure file and writes the converted {@code .mps} file. */
    public void convertFile(Path maccorFile, Path biologicFile)
            throws ProcedureParseException, ConversionException, IOException {
        Procedure procedure = new MaccorProcedureLoader().load(maccorFile, settings.getSourceCharset());
        writeProtocolFile(procedure, biologicFile);
        LOGGER.log(Level.FINE, "converted {0} to {1}", new Object[] {maccorFile, biologicFile});
    }
}
