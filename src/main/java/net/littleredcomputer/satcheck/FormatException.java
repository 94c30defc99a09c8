package net.littleredcomputer.satcheck;

/**
 * Thrown when a CNF file or a solver log cannot be parsed. This says nothing about the
 * solver's correctness; the input itself is malformed.
 */
public class FormatException extends IllegalArgumentException {
    private final int lineNumber;

    public FormatException(int lineNumber, String message) {
        super(lineNumber > 0 ? "line " + lineNumber + ": " + message : message);
        this.lineNumber = lineNumber;
    }

    public FormatException(int lineNumber, String message, Throwable cause) {
        this(lineNumber, message);
        initCause(cause);
    }

    /** @return 1-based line of the offending input, or 0 if unknown */
    public int lineNumber() {
        return lineNumber;
    }
}
