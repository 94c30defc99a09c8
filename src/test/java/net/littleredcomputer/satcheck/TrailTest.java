package net.littleredcomputer.satcheck;

import org.junit.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertThat;

public class TrailTest {

    @Test
    public void pushAndQuery() {
        Trail t = new Trail();
        assertThat(t.isEmpty(), is(true));
        t.push(3);
        t.push(-1);
        assertThat(t.size(), is(2));
        assertThat(t.contains(3), is(true));
        assertThat(t.contains(-3), is(false));
        assertThat(t.isFalsified(-3), is(true));
        assertThat(t.isFalsified(1), is(true));
        assertThat(t.isFalsified(-1), is(false));
        assertThat(t.isAssigned(1), is(true));
        assertThat(t.isAssigned(-3), is(true));
        assertThat(t.isAssigned(2), is(false));
        assertArrayEquals(new int[]{3, -1}, t.literals());
    }

    @Test
    public void removeKeepsOrderOfTheRest() {
        Trail t = new Trail();
        t.push(1);
        t.push(-2);
        t.push(3);
        t.remove(-2);
        assertArrayEquals(new int[]{1, 3}, t.literals());
        assertThat(t.isAssigned(2), is(false));
        t.push(2);
        assertArrayEquals(new int[]{1, 3, 2}, t.literals());
    }

    @Test(expected = LogConsistencyException.class)
    public void removeAbsentLiteral() {
        Trail t = new Trail();
        t.push(1);
        t.remove(2);
    }

    @Test(expected = LogConsistencyException.class)
    public void removeRequiresMatchingSign() {
        Trail t = new Trail();
        t.push(1);
        t.remove(-1);
    }

    @Test(expected = LogConsistencyException.class)
    public void noVariableTwice() {
        Trail t = new Trail();
        t.push(4);
        t.push(4);
    }

    @Test(expected = LogConsistencyException.class)
    public void noVariableWithBothSigns() {
        Trail t = new Trail();
        t.push(4);
        t.push(-4);
    }

    @Test(expected = IllegalArgumentException.class)
    public void minValueIsNotALiteral() {
        new Trail().push(Integer.MIN_VALUE);
    }

    @Test(expected = IllegalArgumentException.class)
    public void zeroIsNotALiteral() {
        new Trail().push(0);
    }
}
