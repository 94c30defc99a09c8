package net.littleredcomputer.satcheck;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * A move of the solver that the formula does not justify. Faults are the verdict of a check,
 * not errors: the log was read fine, but the solver broke a rule.
 */
public class Fault {
    public enum Kind {
        UNJUSTIFIED_DECISION,     // branched while a unit propagation was pending
        UNJUSTIFIED_PROPAGATION,  // assigned a literal no clause forces
        SPURIOUS_CONFLICT,        // declared a conflict no clause exhibits
    }

    private final Kind kind;
    private final TraceEvent event;
    private final ImmutableList<Integer> pending;

    private Fault(Kind kind, TraceEvent event, List<Integer> pending) {
        this.kind = kind;
        this.event = event;
        this.pending = ImmutableList.copyOf(pending);
    }

    static Fault unjustifiedDecision(TraceEvent event, List<Integer> pending) {
        return new Fault(Kind.UNJUSTIFIED_DECISION, event, pending);
    }

    static Fault unjustifiedPropagation(TraceEvent event) {
        return new Fault(Kind.UNJUSTIFIED_PROPAGATION, event, ImmutableList.of());
    }

    static Fault spuriousConflict(TraceEvent event) {
        return new Fault(Kind.SPURIOUS_CONFLICT, event, ImmutableList.of());
    }

    public Kind kind() { return kind; }

    /** @return the offending literal; 0 for a spurious conflict */
    public int literal() { return event.literal(); }

    /** @return the event that was rejected */
    public TraceEvent event() { return event; }

    /** @return for a decision fault, the literals that should have been propagated first */
    public List<Integer> pending() { return pending; }

    public String message() {
        switch (kind) {
            case UNJUSTIFIED_DECISION:
                return String.format("FAULT: Decision made on %d, but propagations %s were possible", literal(), pending);
            case UNJUSTIFIED_PROPAGATION:
                return String.format("FAULT: Propagation %d not implied by the formula", literal());
            case SPURIOUS_CONFLICT:
                return "FAULT: SAT solver detected conflict, although there is none";
            default:
                throw new IllegalStateException("unknown fault kind " + kind);
        }
    }

    @Override
    public String toString() {
        return event.lineNumber() > 0 ? message() + " (line " + event.lineNumber() + ")" : message();
    }
}
