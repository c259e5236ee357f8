package net.atndebug.data;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import net.atndebug.atn.ATNDeserializer;
import net.atndebug.atn.ATNException;
import net.atndebug.atn.DeserializationOptions;
import net.atndebug.util.Formats;
import org.antlr.v4.runtime.VocabularyImpl;
import org.antlr.v4.runtime.atn.ATN;

/**
 * Reads the interpreter data files (".interp") a grammar compiler writes
 * next to its generated code.
 * The file consists of sections, each introduced by a header line ending
 * with a colon and terminated by a blank line (or the end of the file).
 * Name lists contain one name per line, with "null" standing for a
 * missing name; the "atn:" section holds the serialized ATN as a
 * bracketed, comma-separated list of words.
 */
public class InterpreterDataReader {

    public static class FormatException extends IOException {

        private final int lineNumber;

        public FormatException(String message, int lineNumber) {
            super(message + " (at line " + lineNumber + ")");
            this.lineNumber = lineNumber;
        }

        public FormatException(String message, int lineNumber,
                               Throwable cause) {
            super(message + " (at line " + lineNumber + ")", cause);
            this.lineNumber = lineNumber;
        }

        /**
         * The 1-based line the error was detected at.
         */
        public int getLineNumber() {
            return lineNumber;
        }

    }

    public static final String LITERAL_NAMES = "token literal names:";
    public static final String SYMBOLIC_NAMES = "token symbolic names:";
    public static final String RULE_NAMES = "rule names:";
    public static final String CHANNEL_NAMES = "channel names:";
    public static final String MODE_NAMES = "mode names:";
    public static final String ATN_SECTION = "atn:";

    private static final Logger LOGGER =
        Logger.getLogger("InterpreterDataReader");

    private final DeserializationOptions options;

    public InterpreterDataReader(DeserializationOptions options) {
        this.options = (options == null) ? new DeserializationOptions() :
            options;
    }

    public InterpreterDataReader() {
        this(null);
    }

    public DeserializationOptions getOptions() {
        return options;
    }

    public InterpreterData read(File file) throws IOException {
        InputStream stream = new FileInputStream(file);
        try {
            return read(new InputStreamReader(stream,
                                              StandardCharsets.UTF_8));
        } finally {
            stream.close();
        }
    }

    public InterpreterData read(Reader input) throws IOException {
        BufferedReader reader = new BufferedReader(input);
        List<String> literalNames = null, symbolicNames = null;
        List<String> ruleNames = null, channels = null, modes = null;
        List<Integer> words = null;
        int lineNumber = 0, atnLine = -1;
        for (;;) {
            String header = reader.readLine();
            if (header == null) break;
            lineNumber++;
            header = header.trim();
            if (header.isEmpty()) continue;
            int sectionStart = lineNumber;
            if (header.equals(ATN_SECTION)) {
                String line = reader.readLine();
                lineNumber++;
                if (line == null)
                    throw new FormatException("Missing ATN data",
                                              lineNumber);
                line = line.trim();
                if (! line.startsWith("[") || ! line.endsWith("]"))
                    throw new FormatException("ATN data must be a " +
                        "bracketed list", lineNumber);
                words = Formats.parseIntList(line.substring(1,
                    line.length() - 1));
                if (words == null)
                    throw new FormatException("Malformed ATN data",
                                              lineNumber);
                atnLine = lineNumber;
                continue;
            }
            List<String> names = new ArrayList<String>();
            for (;;) {
                String line = reader.readLine();
                if (line == null) break;
                lineNumber++;
                if (line.trim().isEmpty()) break;
                names.add(line.equals("null") ? null : line);
            }
            if (header.equals(LITERAL_NAMES)) {
                literalNames = names;
            } else if (header.equals(SYMBOLIC_NAMES)) {
                symbolicNames = names;
            } else if (header.equals(RULE_NAMES)) {
                ruleNames = names;
            } else if (header.equals(CHANNEL_NAMES)) {
                channels = names;
            } else if (header.equals(MODE_NAMES)) {
                modes = names;
            } else {
                throw new FormatException("Unrecognized section " +
                    Formats.formatString(header), sectionStart);
            }
        }
        if (literalNames == null || symbolicNames == null)
            throw new FormatException("Missing token name sections",
                                      lineNumber);
        if (ruleNames == null)
            throw new FormatException("Missing rule names", lineNumber);
        if (words == null)
            throw new FormatException("Missing ATN data", lineNumber);

        int[] data = new int[words.size()];
        for (int i = 0; i < data.length; i++) data[i] = words.get(i);
        ATN atn;
        try {
            atn = new ATNDeserializer(options).deserialize(data);
        } catch (ATNException exc) {
            throw new FormatException("Invalid ATN: " + exc.getMessage(),
                                      atnLine, exc);
        }
        LOGGER.fine("Read " + atn.grammarType + " grammar data with " +
                    ruleNames.size() + " rules");
        VocabularyImpl vocabulary = new VocabularyImpl(
            literalNames.toArray(new String[literalNames.size()]),
            symbolicNames.toArray(new String[symbolicNames.size()]));
        return new InterpreterData(vocabulary, ruleNames, channels, modes,
                                   atn);
    }

}
