package net.littleredcomputer.satcheck;

/**
 * Thrown when the log contradicts its own history, e.g. an unassign of a literal that is not
 * on the trail, or a second assignment of a variable that is still assigned. The log is
 * malformed or out of order; this is not a fault of the solver's reasoning.
 */
public class LogConsistencyException extends IllegalStateException {
    public LogConsistencyException(String message) {
        super(message);
    }
}
