package net.littleredcomputer.satcheck;

import java.io.BufferedReader;
import java.io.Reader;
import java.io.StringReader;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Extracts {@link TraceEvent}s from the debug output of a solver, e.g.
 * <pre>
 * c DEBUG 0 decide 2
 * c DEBUG 1 assign 2
 * c DEBUG 1 assign -3
 * c DEBUG 1 conflicting size 2 clause[7] 3@1=-1 -2@1=-1
 * c DEBUG 1 unassign -3@1=1
 * </pre>
 * Only the keyword and the signed integer after it matter; anything else on the line
 * (level annotations, {@code @level=value} decorations) is ignored, as are lines carrying
 * none of the keywords.
 */
public class TraceParser {
    // \b keeps "unassign" from matching as "assign".
    private static final Pattern keywordRe = Pattern.compile("\\b(assign|decide|unassign)\\b(?:\\s+(-?\\d+))?");
    // A numeric level followed by "conflict" or "conflicting".
    private static final Pattern conflictRe = Pattern.compile("(?<!\\S)\\d+\\s+conflict");

    private TraceParser() {}

    /**
     * @param line       a line of the log
     * @param lineNumber its 1-based position, recorded in the event
     * @return the event the line describes, if any
     * @throws FormatException if the line names an assignment keyword without a literal
     */
    public static Optional<TraceEvent> parseLine(String line, int lineNumber) {
        Matcher k = keywordRe.matcher(line);
        if (k.find()) {
            if (k.group(2) == null) {
                throw new FormatException(lineNumber, "no literal after " + k.group(1) + ": " + line);
            }
            final int literal;
            try {
                literal = Integer.parseInt(k.group(2));
            } catch (NumberFormatException e) {
                throw new FormatException(lineNumber, "literal out of range: " + k.group(2), e);
            }
            if (literal == 0) throw new FormatException(lineNumber, "0 is not a literal: " + line);
            if (literal == Integer.MIN_VALUE) throw new FormatException(lineNumber, "literal has no negation: " + line);
            return Optional.of(new TraceEvent(kindOf(k.group(1)), literal, lineNumber));
        }
        if (conflictRe.matcher(line).find()) {
            return Optional.of(new TraceEvent(TraceEvent.Kind.CONFLICT, 0, lineNumber));
        }
        return Optional.empty();
    }

    private static TraceEvent.Kind kindOf(String keyword) {
        switch (keyword) {
            case "assign": return TraceEvent.Kind.ASSIGN;
            case "decide": return TraceEvent.Kind.DECIDE;
            case "unassign": return TraceEvent.Kind.UNASSIGN;
            default: throw new IllegalArgumentException("unknown keyword: " + keyword);
        }
    }

    /**
     * Parse a whole log. The stream is lazy, so a {@link FormatException} surfaces only when the
     * malformed line is reached.
     */
    public static Stream<TraceEvent> events(Reader r) {
        AtomicInteger lineNumber = new AtomicInteger();
        return new BufferedReader(r).lines()
                .map(line -> parseLine(line, lineNumber.incrementAndGet()))
                .flatMap(e -> e.map(Stream::of).orElseGet(Stream::empty));
    }

    public static Stream<TraceEvent> events(String s) {
        return events(new StringReader(s));
    }
}
