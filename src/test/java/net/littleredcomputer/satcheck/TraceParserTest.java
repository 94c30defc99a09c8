package net.littleredcomputer.satcheck;

import org.junit.Test;

import java.util.List;
import java.util.stream.Collectors;

import static com.github.npathai.hamcrestopt.OptionalMatchers.isEmpty;
import static com.github.npathai.hamcrestopt.OptionalMatchers.isPresentAndIs;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.Matchers.contains;
import static org.junit.Assert.assertThat;

public class TraceParserTest {
    private static TraceEvent event(TraceEvent.Kind kind, int literal, int lineNumber) {
        return new TraceEvent(kind, literal, lineNumber);
    }

    @Test
    public void assignments() {
        assertThat(TraceParser.parseLine("c DEBUG 0 assign 65", 1), isPresentAndIs(event(TraceEvent.Kind.ASSIGN, 65, 1)));
        assertThat(TraceParser.parseLine("c DEBUG 0 decide -2", 2), isPresentAndIs(event(TraceEvent.Kind.DECIDE, -2, 2)));
        assertThat(TraceParser.parseLine("c DEBUG 3 assign -17@3=1", 3), isPresentAndIs(event(TraceEvent.Kind.ASSIGN, -17, 3)));
    }

    @Test
    public void unassignIsNotAssign() {
        assertThat(TraceParser.parseLine("c DEBUG 2 unassign -306@2=2", 7), isPresentAndIs(event(TraceEvent.Kind.UNASSIGN, -306, 7)));
    }

    @Test
    public void conflicts() {
        assertThat(TraceParser.parseLine("c DEBUG 2 conflict", 4), isPresentAndIs(event(TraceEvent.Kind.CONFLICT, 0, 4)));
        assertThat(TraceParser.parseLine("c DEBUG 12 conflicting size 2 clause[3] -2@1=-1 -3@1=-1", 5),
                isPresentAndIs(event(TraceEvent.Kind.CONFLICT, 0, 5)));
    }

    @Test
    public void otherLinesAreIgnored() {
        assertThat(TraceParser.parseLine("c DEBUG 1 propagating 3", 1), isEmpty());
        assertThat(TraceParser.parseLine("c DEBUG 1 forced 3 by size 2 clause[2] -1@1=1 3", 1), isEmpty());
        assertThat(TraceParser.parseLine("c DEBUG 1 analyzing conflict 1 size 2 clause[3] -2@1=-1 -3@1=-1", 1), isEmpty());
        assertThat(TraceParser.parseLine("c DEBUG 1 reassigning 3", 1), isEmpty());
        assertThat(TraceParser.parseLine("s SATISFIABLE", 1), isEmpty());
        assertThat(TraceParser.parseLine("", 1), isEmpty());
    }

    @Test(expected = FormatException.class)
    public void keywordWithoutLiteral() {
        TraceParser.parseLine("c DEBUG 0 decide", 9);
    }

    @Test(expected = FormatException.class)
    public void zeroLiteral() {
        TraceParser.parseLine("c DEBUG 0 assign 0", 9);
    }

    @Test(expected = FormatException.class)
    public void literalTooLarge() {
        TraceParser.parseLine("c DEBUG 0 assign 99999999999", 9);
    }

    @Test(expected = FormatException.class)
    public void literalWithoutNegation() {
        TraceParser.parseLine("c DEBUG 0 assign -2147483648", 9);
    }

    @Test
    public void eventsCarryLineNumbers() {
        List<TraceEvent> es = TraceParser.events("c DEBUG 0 decide 1\nc DEBUG 1 assign 1\nc DEBUG 1 propagating 1\n"
                + "c DEBUG 1 assign 3\nc DEBUG 1 conflicting size 1 clause[2] -3@1=-1\n")
                .collect(Collectors.toList());
        assertThat(es, contains(
                event(TraceEvent.Kind.DECIDE, 1, 1),
                event(TraceEvent.Kind.ASSIGN, 1, 2),
                event(TraceEvent.Kind.ASSIGN, 3, 4),
                event(TraceEvent.Kind.CONFLICT, 0, 5)));
        assertThat(es.get(2).toString(), is("assign 3 (line 4)"));
    }
}
