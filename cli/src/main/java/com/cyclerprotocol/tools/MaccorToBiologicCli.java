package com.cyclerprotocol.tools;

import com.cyclerprotocol.biologic.ConversionException;
import com.cyclerprotocol.biologic.ConverterSettings;
import com.cyclerprotocol.biologic.MaccorToBiologicConverter;
import com.cyclerprotocol.loader.ProcedureParseException;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Converts one Maccor procedure file into a Modulo Bat settings file.
 *
 * <pre>MaccorToBiologicCli [--column-width N] [--source-encoding NAME] &lt;maccor.000&gt; &lt;output.mps&gt;</pre>
 */
public final class MaccorToBiologicCli {
    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    private static final String USAGE =
            "Usage: MaccorToBiologicCli [--column-width N] [--source-encoding NAME] <maccor.000> <output.mps>";

    private MaccorToBiologicCli() {}

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        ConverterSettings settings;
        List<String> positional = new ArrayList<>();
        try {
            settings = ConverterSettings.fromProperties(System.getProperties());
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                switch (arg) {
                    case "--column-width":
                        settings = settings.withColumnWidth(parseWidth(requireValue(args, ++i, arg)));
                        break;
                    case "--source-encoding":
                        settings = settings.withSourceCharset(Charset.forName(requireValue(args, ++i, arg)));
                        break;
                    case "-h":
                    case "--help":
                        out.println(USAGE);
                        return EXIT_OK;
                    default:
                        if (arg.startsWith("--")) {
                            throw new IllegalArgumentException("Unknown option " + arg);
                        }
                        positional.add(arg);
                }
            }
        } catch (IllegalCharsetNameException | UnsupportedCharsetException ex) {
            err.println("Unknown source encoding: " + ex.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        } catch (IllegalArgumentException ex) {
            err.println(ex.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }
        if (positional.size() != 2) {
            err.println(USAGE);
            return EXIT_USAGE;
        }

        Path source = Path.of(positional.get(0)).toAbsolutePath().normalize();
        Path target = Path.of(positional.get(1)).toAbsolutePath().normalize();
        if (!Files.isRegularFile(source)) {
            err.println("Maccor procedure not found: " + source);
            return EXIT_FAILED;
        }
        try {
            new MaccorToBiologicConverter(settings).convertFile(source, target);
        } catch (ProcedureParseException ex) {
            err.println("Unable to read procedure: " + ex.getMessage());
            return EXIT_FAILED;
        } catch (ConversionException ex) {
            err.println("Conversion failed (" + ex.getCategory() + "): " + ex.getMessage());
            return EXIT_FAILED;
        } catch (IOException ex) {
            err.println("I/O error: " + ex.getMessage());
            return EXIT_FAILED;
        }
        out.println("Wrote " + target);
        return EXIT_OK;
    }

    private static String requireValue(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException(option + " requires a value");
        }
        return args[index];
    }

    private static int parseWidth(String text) {
        int width;
        try {
            width = Integer.parseInt(text);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("--column-width expects an integer, got " + text, ex);
        }
        if (width <= 0) {
            throw new IllegalArgumentException("--column-width must be positive, got " + width);
        }
        return width;
    }
}
