package net.littleredcomputer.satcheck;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.annotation.CheckReturnValue;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The state of one pass over a solver log: the trail built so far and whether the previous
 * event was a decision. Each call to {@link #step} judges one event against the formula and,
 * if it is legal, applies it to the trail.
 * <p>
 * The solver writes a decision twice, once as {@code decide l} and again as {@code assign l}.
 * The decision puts l on the trail; the assignment that immediately follows is absorbed
 * without a second push and without asking the formula to justify it.
 */
public class Replay {
    private static final Logger log = LogManager.getFormatterLogger(Replay.class);
    private final Formula formula;
    private final Trail trail = new Trail();
    private boolean pendingDecision = false;
    private int decision = 0;  // literal of the most recent decision
    private final Map<TraceEvent.Kind, Long> counts = new EnumMap<>(TraceEvent.Kind.class);

    public Replay(Formula formula) {
        this.formula = formula;
        for (TraceEvent.Kind k : TraceEvent.Kind.values()) counts.put(k, 0L);
    }

    /**
     * Apply one event.
     *
     * @param e the event
     * @return the fault, if the event is illegal; the trail is then left as it was
     * @throws LogConsistencyException if the event contradicts the trail itself
     */
    @CheckReturnValue
    public Optional<Fault> step(TraceEvent e) {
        counts.merge(e.kind(), 1L, Long::sum);
        log.trace("%s trail %s", e, trail);
        switch (e.kind()) {
            case DECIDE: {
                List<Integer> forced = formula.possiblePropagations(trail);
                if (!forced.isEmpty()) return Optional.of(Fault.unjustifiedDecision(e, forced));
                trail.push(e.literal());
                pendingDecision = true;
                decision = e.literal();
                return Optional.empty();
            }
            case ASSIGN:
                if (pendingDecision) {
                    pendingDecision = false;
                    if (e.literal() != decision) {
                        log.warn("assign %d follows decide %d; treating it as the decision's restatement", e.literal(), decision);
                    }
                    return Optional.empty();
                }
                Optional<List<Integer>> reason = formula.reasonFor(e.literal(), trail);
                if (!reason.isPresent()) return Optional.of(Fault.unjustifiedPropagation(e));
                log.debug("%d forced by %s", e.literal(), reason.get());
                trail.push(e.literal());
                return Optional.empty();
            case UNASSIGN:
                trail.remove(e.literal());
                return Optional.empty();
            case CONFLICT:
                Optional<List<Integer>> falsified = formula.falsifiedClause(trail);
                if (!falsified.isPresent()) return Optional.of(Fault.spuriousConflict(e));
                log.debug("conflict on %s", falsified.get());
                return Optional.empty();
            default:
                throw new IllegalStateException("unknown event kind " + e.kind());
        }
    }

    /**
     * Apply events in order, stopping at the first fault.
     */
    @CheckReturnValue
    public Optional<Fault> replay(Iterable<TraceEvent> events) {
        for (TraceEvent e : events) {
            Optional<Fault> f = step(e);
            if (f.isPresent()) return f;
        }
        return Optional.empty();
    }

    public Trail trail() { return trail; }

    public boolean pendingDecision() { return pendingDecision; }

    /** @return number of events of the given kind seen so far, including a rejected one */
    public long count(TraceEvent.Kind kind) { return counts.get(kind); }

    public long eventCount() {
        return counts.values().stream().mapToLong(Long::longValue).sum();
    }
}
