package ai.rtlgraph.scan;

/**
 * A dump file breaks the structure the parser relies on, e.g. a reference outside any function.
 */
public final class DumpFormatException extends Exception {

    private final String sourceName;
    private final int lineNumber;

    public DumpFormatException(String sourceName, int lineNumber, String message) {
        super(sourceName + ":" + lineNumber + ": " + message);
        this.sourceName = sourceName;
        this.lineNumber = lineNumber;
    }

    public String sourceName() {
        return sourceName;
    }

    public int lineNumber() {
        return lineNumber;
    }
}
