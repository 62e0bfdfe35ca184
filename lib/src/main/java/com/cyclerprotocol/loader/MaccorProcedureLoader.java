package com.cyclerprotocol.loader;

import com.cyclerprotocol.loader.ast.XmlElementNode;
import com.cyclerprotocol.procedure.Procedure;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/** Reads a Maccor procedure file ({@code .000}, XML) into a {@link Procedure}. */
public final class MaccorProcedureLoader {
    private static final Logger LOGGER = Logger.getLogger(MaccorProcedureLoader.class.getName());
    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private final MaccorAstBuilder astBuilder;
    private final MaccorProcedureReader reader;

    public MaccorProcedureLoader() {
        this(new MaccorAstBuilder(), new MaccorProcedureReader());
    }

    MaccorProcedureLoader(MaccorAstBuilder astBuilder, MaccorProcedureReader reader) {
        this.astBuilder = Objects.requireNonNull(astBuilder, "astBuilder");
        this.reader = Objects.requireNonNull(reader, "reader");
    }

    public Procedure load(Path path, Charset charset) throws IOException, ProcedureParseException {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(charset, "charset");
        String content = Files.readString(path, charset);
        Procedure procedure = parse(path.toString(), content);
        LOGGER.log(Level.FINE, "Loaded {0} steps from {1}", new Object[] {procedure.size(), path});
        return procedure;
    }

    public Procedure parse(String sourceName, String xml) throws ProcedureParseException {
        Objects.requireNonNull(xml, "xml");
        String content = !xml.isEmpty() && xml.charAt(0) == BYTE_ORDER_MARK ? xml.substring(1) : xml;
        XmlElementNode root = astBuilder.parse(sourceName, content);
        return reader.read(sourceName, root);
    }
}
