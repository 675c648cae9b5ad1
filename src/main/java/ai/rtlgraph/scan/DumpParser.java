package ai.rtlgraph.scan;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import ai.rtlgraph.model.Ids;
import ai.rtlgraph.model.RefKind;

/**
 * Turns RTL dump text into {@link DumpEvent}s. Knows nothing about the graph.
 * <p>
 * Recognized lines, first match wins:
 * 1) {@code ;; Function name}                            (older compilers)
 * 2) {@code ;; Function pretty name (mangled[, ...])...} (newer compilers)
 * 3) {@code ... (call ... "callee" ...}
 * 4) {@code ... (symbol_ref ... "symbol" ...}
 * Everything else is ignored.
 */
public final class DumpParser {

    private static final Pattern LEGACY_FUNCTION = Pattern.compile("^;; Function (\\S+)\\s*$");

    private static final Pattern FUNCTION = Pattern.compile(
            "^;; Function (?<pretty>.+?)\\s+\\((?<mangled>[^\\s,()]+)(?:,[^)]*)?\\)");

    private static final Pattern CALL = Pattern.compile("\\(call[^\"]*\"(?<name>[^\"]*)\"");

    private static final Pattern SYMBOL_REF = Pattern.compile("\\(symbol_ref[^\"]*\"(?<name>[^\"]*)\"");

    /** Reads one dump file; its logical source name is derived from the file name. */
    public List<DumpEvent> parse(Path dumpFile) throws IOException, DumpFormatException {
        Objects.requireNonNull(dumpFile, "dumpFile");
        // InputStreamReader replaces malformed bytes instead of failing
        try (var reader = new InputStreamReader(Files.newInputStream(dumpFile), StandardCharsets.UTF_8)) {
            return parse(reader, Ids.logicalSourceName(dumpFile));
        }
    }

    public List<DumpEvent> parse(String text, String sourceFile) throws DumpFormatException {
        try {
            return parse(new StringReader(text), sourceFile);
        } catch (IOException ex) {
            throw new IllegalStateException("StringReader failed", ex);
        }
    }

    public List<DumpEvent> parse(Reader in, String sourceFile) throws IOException, DumpFormatException {
        Objects.requireNonNull(in, "in");
        Objects.requireNonNull(sourceFile, "sourceFile");

        final List<DumpEvent> events = new ArrayList<>();
        final BufferedReader br = in instanceof BufferedReader b ? b : new BufferedReader(in);

        String current = null;
        int lineNo = 0;
        String line;
        while ((line = br.readLine()) != null) {
            lineNo++;
            current = parseLine(line, current, sourceFile, lineNo, events);
        }
        return events;
    }

    /**
     * Handles one line and returns the function that is current after it.
     */
    private static String parseLine(String line,
                                    String current,
                                    String sourceFile,
                                    int lineNo,
                                    List<DumpEvent> out) throws DumpFormatException {

        if (line.startsWith(";; Function ")) {
            final Matcher legacy = LEGACY_FUNCTION.matcher(line);
            if (legacy.matches()) {
                final String name = legacy.group(1);
                out.add(new DumpEvent.EnterFunction(name, sourceFile));
                return name;
            }

            final Matcher m = FUNCTION.matcher(line);
            if (m.lookingAt()) {
                final String pretty = m.group("pretty").trim();
                final String mangled = Ids.completeObjectTag(m.group("mangled"));
                out.add(new DumpEvent.EnterFunction(mangled, sourceFile));
                if (!pretty.equals(mangled)) {
                    out.add(new DumpEvent.SetDisplayLabel(mangled, pretty));
                    out.add(new DumpEvent.RegisterNameAlias(pretty, mangled));
                }
                return mangled;
            }
        }

        final Matcher call = CALL.matcher(line);
        if (call.find()) {
            final String callee = stripShortCallMarker(call.group("name"));
            out.add(new DumpEvent.RecordReference(requireCurrent(current, sourceFile, lineNo), callee, RefKind.CALL));
            return current;
        }

        final Matcher ref = SYMBOL_REF.matcher(line);
        if (ref.find()) {
            out.add(new DumpEvent.RecordReference(
                    requireCurrent(current, sourceFile, lineNo), ref.group("name"), RefKind.REFERENCE));
        }
        return current;
    }

    // some targets prefix short-call symbols with '^'
    static String stripShortCallMarker(String name) {
        int i = 0;
        while (i < name.length() && name.charAt(i) == '^') {
            i++;
        }
        return name.substring(i);
    }

    private static String requireCurrent(String current, String sourceFile, int lineNo) throws DumpFormatException {
        if (current == null) {
            throw new DumpFormatException(sourceFile, lineNo, "reference before any ';; Function' marker");
        }
        return current;
    }
}
