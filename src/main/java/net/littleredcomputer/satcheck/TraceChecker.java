package net.littleredcomputer.satcheck;

import com.google.common.base.Stopwatch;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.FormattedMessage;

import java.io.IOException;
import java.io.LineNumberReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Checks that every move recorded in a solver log was legal for a given formula. A check
 * reads the log once, front to back, and stops at the first fault.
 */
public class TraceChecker {
    private static final Logger log = LogManager.getFormatterLogger(TraceChecker.class);
    private static final int logCheckLines = 10000;
    private final Formula formula;
    private Duration logInterval = Duration.ofMillis(1000);

    public TraceChecker(Formula formula) {
        this.formula = formula;
    }

    public TraceChecker setLogInterval(Duration interval) {
        logInterval = interval;
        return this;
    }

    /**
     * Check a CNF file against a log file.
     *
     * @param cnf formula the solver was run on
     * @param trace the solver's debug output
     * @return the first fault, or empty if the solver made no illegal move
     * @throws IOException if either file cannot be read
     * @throws FormatException if either file is malformed
     * @throws LogConsistencyException if the log contradicts itself
     */
    public static Optional<Fault> check(Path cnf, Path trace) throws IOException {
        Formula f;
        try (Reader r = Files.newBufferedReader(cnf, StandardCharsets.UTF_8)) {
            f = Formula.parseFrom(r);
        }
        try (Reader r = Files.newBufferedReader(trace, StandardCharsets.UTF_8)) {
            return new TraceChecker(f).check(r);
        }
    }

    public Optional<Fault> check(String trace) {
        try {
            return check(new StringReader(trace));
        } catch (IOException e) {
            throw new IllegalStateException("unexpected I/O error reading a string", e);
        }
    }

    public Optional<Fault> check(Reader trace) throws IOException {
        LineNumberReader lines = new LineNumberReader(trace);
        Replay replay = new Replay(formula);
        Stopwatch stopwatch = Stopwatch.createStarted();
        Instant lastLogTime = Instant.now();
        long lastEventCount = 0;
        for (String line = lines.readLine(); line != null; line = lines.readLine()) {
            Optional<TraceEvent> e = TraceParser.parseLine(line, lines.getLineNumber());
            if (e.isPresent()) {
                Optional<Fault> fault = replay.step(e.get());
                if (fault.isPresent()) {
                    log.info("%s after %d events %s", fault.get(), replay.eventCount(), stopwatch);
                    return fault;
                }
            }
            if (lines.getLineNumber() % logCheckLines == 0) {
                Instant now = Instant.now();
                Duration tween = Duration.between(lastLogTime, now);
                if (tween.compareTo(logInterval) >= 0) {
                    final long events = replay.eventCount();
                    final double perSec = 1e3 * (events - lastEventCount) / Math.max(1, tween.toMillis());
                    final int lineNumber = lines.getLineNumber();
                    final int trailSize = replay.trail().size();
                    log.info(() -> new FormattedMessage("line %d %d events %s %.0f/sec trail %d",
                            lineNumber, events, stopwatch, perSec, trailSize));
                    lastLogTime = now;
                    lastEventCount = events;
                }
            }
        }
        log.info("no faults in %d events (%d decisions, %d assignments, %d unassignments, %d conflicts) %s",
                replay.eventCount(),
                replay.count(TraceEvent.Kind.DECIDE),
                replay.count(TraceEvent.Kind.ASSIGN),
                replay.count(TraceEvent.Kind.UNASSIGN),
                replay.count(TraceEvent.Kind.CONFLICT),
                stopwatch);
        return Optional.empty();
    }
}
