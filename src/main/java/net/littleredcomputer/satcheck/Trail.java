package net.littleredcomputer.satcheck;

import gnu.trove.list.array.TIntArrayList;
import gnu.trove.set.hash.TIntHashSet;

/**
 * The literals currently assigned true, in the order they were assigned. A variable
 * appears at most once; it must be removed before it may be assigned again.
 */
public class Trail {
    private final TIntArrayList literals = new TIntArrayList();
    private final TIntHashSet live = new TIntHashSet();

    public void push(int literal) {
        if (literal == 0 || literal == Integer.MIN_VALUE) throw new IllegalArgumentException(literal + " is not a literal");
        if (isAssigned(literal)) {
            throw new LogConsistencyException(String.format("variable %d assigned twice: %d is already on the trail",
                    Math.abs(literal), live.contains(literal) ? literal : -literal));
        }
        literals.add(literal);
        live.add(literal);
    }

    /**
     * Remove the oldest entry equal to literal. Since no variable is live twice this is also
     * the only entry.
     */
    public void remove(int literal) {
        if (!live.contains(literal)) {
            throw new LogConsistencyException("unassign of " + literal + ", which is not on the trail");
        }
        literals.remove(literal);
        live.remove(literal);
    }

    public boolean contains(int literal) { return live.contains(literal); }

    /** @return true if the negation of literal is on the trail */
    public boolean isFalsified(int literal) { return live.contains(-literal); }

    /** @return true if the variable of literal has a value, of either sign */
    public boolean isAssigned(int literal) { return live.contains(literal) || live.contains(-literal); }

    public int size() { return literals.size(); }

    public boolean isEmpty() { return literals.isEmpty(); }

    /** @return a copy of the trail, oldest first */
    public int[] literals() { return literals.toArray(); }

    @Override
    public String toString() {
        return literals.toString();
    }
}
