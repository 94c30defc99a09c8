package net.littleredcomputer.satcheck;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A propositional formula in conjunctive normal form: an ordered, immutable list of clauses, each
 * of which is an ordered, immutable list of nonzero literals. A positive literal asserts its
 * variable, a negative one denies it.
 * <p>
 * Besides holding the clauses, this class answers the three questions the trace checker asks
 * of a partial assignment: whether a literal is forced, which literals are forced and not yet
 * assigned, and whether some clause is falsified outright. These are computed by rescanning
 * every clause; there is no watch list.
 */
public class Formula {
    private static final Logger log = LogManager.getFormatterLogger(Formula.class);
    private static final Pattern pLineRe = Pattern.compile("p\\s+cnf\\s+([0-9]+)\\s+([0-9]+)\\s*");
    private static final Splitter splitter = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

    private final ImmutableList<ImmutableList<Integer>> clauses;
    private final int nVariables;
    private final OptionalInt declaredVariables;
    private final OptionalInt declaredClauses;

    Formula(List<? extends List<Integer>> clauses) {
        this(clauses, OptionalInt.empty(), OptionalInt.empty());
    }

    private Formula(List<? extends List<Integer>> clauses, OptionalInt declaredVariables, OptionalInt declaredClauses) {
        ImmutableList.Builder<ImmutableList<Integer>> b = ImmutableList.builder();
        int maxVariable = 0;
        for (List<Integer> c : clauses) {
            for (int l : c) {
                if (l == 0) throw new IllegalArgumentException("0 is not a literal");
                if (l == Integer.MIN_VALUE) throw new IllegalArgumentException("literal has no negation: " + l);
                maxVariable = Math.max(maxVariable, Math.abs(l));
            }
            b.add(ImmutableList.copyOf(c));
        }
        this.clauses = b.build();
        this.nVariables = maxVariable;
        this.declaredVariables = declaredVariables;
        this.declaredClauses = declaredClauses;
    }

    public int nClauses() { return clauses.size(); }

    public List<Integer> getClause(int i) { return clauses.get(i); }

    public List<ImmutableList<Integer>> clauses() { return clauses; }

    /** @return the largest variable mentioned by any clause */
    public int nVariables() { return nVariables; }

    /** @return the variable count from the {@code p cnf} header, if there was one */
    public OptionalInt declaredVariables() { return declaredVariables; }

    /** @return the clause count from the {@code p cnf} header, if there was one */
    public OptionalInt declaredClauses() { return declaredClauses; }

    /**
     * Find a clause that forces the given literal under the trail: one that contains the literal
     * (with the same sign) and all of whose other literals are false. A unit clause {@code [l]}
     * always qualifies.
     *
     * @param literal the literal whose assignment is to be justified
     * @param trail   current partial assignment
     * @return the first such clause, if any
     */
    public Optional<List<Integer>> reasonFor(int literal, Trail trail) {
        CLAUSE:
        for (List<Integer> clause : clauses) {
            if (!clause.contains(literal)) continue;
            for (int l : clause) {
                if (l != literal && !trail.isFalsified(l)) continue CLAUSE;
            }
            return Optional.of(clause);
        }
        return Optional.empty();
    }

    public boolean isImplied(int literal, Trail trail) {
        return reasonFor(literal, trail).isPresent();
    }

    /**
     * Collect the literals that unit propagation would assign next. A clause contributes its
     * literal if it is a unit clause whose literal is not yet true, or if exactly one of its
     * literals is unassigned and all the rest are false. A literal forced by several clauses is
     * reported once per clause.
     *
     * @param trail current partial assignment
     * @return forced literals, in clause order
     */
    public List<Integer> possiblePropagations(Trail trail) {
        List<Integer> forced = new ArrayList<>();
        for (List<Integer> clause : clauses) {
            if (clause.size() == 1) {
                if (!trail.contains(clause.get(0))) forced.add(clause.get(0));
                continue;
            }
            int falsified = 0;
            int unassigned = 0;
            int candidate = 0;
            for (int l : clause) {
                if (trail.isFalsified(l)) ++falsified;
                if (!trail.isAssigned(l)) {
                    ++unassigned;
                    candidate = l;
                }
            }
            if (falsified == clause.size() - 1 && unassigned == 1) forced.add(candidate);
        }
        return forced;
    }

    /**
     * Find a clause that is false under the trail: every one of its variables is assigned, and
     * every literal evaluates to false.
     *
     * @param trail current partial assignment
     * @return the first falsified clause, if any
     */
    public Optional<List<Integer>> falsifiedClause(Trail trail) {
        CLAUSE:
        for (List<Integer> clause : clauses) {
            for (int l : clause) {
                if (!trail.isFalsified(l)) continue CLAUSE;
            }
            return Optional.of(clause);
        }
        return Optional.empty();
    }

    public boolean hasConflict(Trail trail) {
        return falsifiedClause(trail).isPresent();
    }

    public static Formula parseFrom(String s) {
        return parseFrom(new StringReader(s));
    }

    /**
     * Read a formula in the clause-per-line DIMACS layout: a header line, then one line per
     * clause of whitespace-separated literals terminated by {@code 0}. The header's counts are
     * recorded but not enforced. Comment lines (starting with {@code c}) and blank lines after
     * the header are skipped. A line holding only {@code 0} is the empty clause, which every
     * assignment falsifies.
     *
     * @param r source of the formula text
     * @return the parsed formula
     * @throws FormatException if a clause line is malformed
     */
    public static Formula parseFrom(Reader r) {
        BufferedReader br = new BufferedReader(r);
        List<List<Integer>> clauses = new ArrayList<>();
        OptionalInt nVar = OptionalInt.empty();
        OptionalInt nClause = OptionalInt.empty();
        try {
            String header = br.readLine();
            if (header == null) throw new FormatException(1, "missing header line");
            Matcher m = pLineRe.matcher(header.trim());
            if (m.matches()) {
                nVar = OptionalInt.of(Integer.parseInt(m.group(1)));
                nClause = OptionalInt.of(Integer.parseInt(m.group(2)));
            } else {
                log.debug("header is not a p line: %s", header);
            }
            int lineNumber = 1;
            for (String line = br.readLine(); line != null; line = br.readLine()) {
                ++lineNumber;
                if (line.startsWith("c") || CharMatcher.whitespace().matchesAllOf(line)) continue;
                clauses.add(parseClause(line, lineNumber));
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        if (nClause.isPresent() && nClause.getAsInt() != clauses.size()) {
            log.warn("header declares %d clauses, found %d", nClause.getAsInt(), clauses.size());
        }
        Formula f = new Formula(clauses, nVar, nClause);
        if (nVar.isPresent() && f.nVariables() > nVar.getAsInt()) {
            log.warn("header declares %d variables, but variable %d occurs", nVar.getAsInt(), f.nVariables());
        }
        return f;
    }

    private static List<Integer> parseClause(String line, int lineNumber) {
        List<String> tokens = splitter.splitToList(line);
        if (!tokens.get(tokens.size() - 1).equals("0")) {
            throw new FormatException(lineNumber, "clause not terminated by 0: " + line);
        }
        List<Integer> clause = new ArrayList<>(tokens.size() - 1);
        for (String t : tokens.subList(0, tokens.size() - 1)) {
            final int l;
            try {
                l = Integer.parseInt(t);
            } catch (NumberFormatException e) {
                throw new FormatException(lineNumber, "not a literal: " + t, e);
            }
            if (l == 0) throw new FormatException(lineNumber, "0 before end of clause: " + line);
            if (l == Integer.MIN_VALUE) throw new FormatException(lineNumber, "literal has no negation: " + t);
            clause.add(l);
        }
        return clause;
    }

    @Override
    public String toString() {
        return clauses.toString();
    }
}
