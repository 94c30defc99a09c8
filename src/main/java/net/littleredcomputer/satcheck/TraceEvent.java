package net.littleredcomputer.satcheck;

import java.util.Objects;

/**
 * One interpreted line of a solver log.
 */
public class TraceEvent {
    public enum Kind {
        ASSIGN,    // the solver claims a literal was forced (or restates its decision)
        DECIDE,    // the solver branches on a literal
        UNASSIGN,  // the solver backtracks over a literal
        CONFLICT,  // the solver claims a clause is falsified
    }

    private final Kind kind;
    private final int literal;  // 0 for CONFLICT
    private final int lineNumber;  // 1-based position in the log; 0 if not read from a log

    TraceEvent(Kind kind, int literal, int lineNumber) {
        if (kind != Kind.CONFLICT && literal == 0) throw new IllegalArgumentException("0 is not a literal");
        this.kind = kind;
        this.literal = literal;
        this.lineNumber = lineNumber;
    }

    public static TraceEvent assign(int literal) { return new TraceEvent(Kind.ASSIGN, literal, 0); }
    public static TraceEvent decide(int literal) { return new TraceEvent(Kind.DECIDE, literal, 0); }
    public static TraceEvent unassign(int literal) { return new TraceEvent(Kind.UNASSIGN, literal, 0); }
    public static TraceEvent conflict() { return new TraceEvent(Kind.CONFLICT, 0, 0); }

    public Kind kind() { return kind; }
    public int literal() { return literal; }
    public int lineNumber() { return lineNumber; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TraceEvent)) return false;
        TraceEvent e = (TraceEvent) o;
        return kind == e.kind && literal == e.literal && lineNumber == e.lineNumber;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, literal, lineNumber);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(kind.name().toLowerCase());
        if (kind != Kind.CONFLICT) sb.append(' ').append(literal);
        if (lineNumber > 0) sb.append(" (line ").append(lineNumber).append(')');
        return sb.toString();
    }
}
