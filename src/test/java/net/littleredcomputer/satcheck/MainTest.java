package net.littleredcomputer.satcheck;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.ParseException;
import org.junit.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

public class MainTest {

    @Test
    public void shortOptions() throws ParseException {
        CommandLine cmd = new DefaultParser().parse(Main.options(), new String[]{"-cnf", "a.cnf", "-log", "a.log", "-loginterval", "PT5S"});
        assertThat(cmd.getOptionValue("cnf"), is("a.cnf"));
        assertThat(cmd.getOptionValue("log"), is("a.log"));
        assertThat(cmd.getOptionValue("loginterval"), is("PT5S"));
    }

    @Test
    public void longOptions() throws ParseException {
        CommandLine cmd = new DefaultParser().parse(Main.options(), new String[]{"--cnf-file", "b.cnf", "--log-file", "-"});
        assertThat(cmd.getOptionValue("cnf"), is("b.cnf"));
        assertThat(cmd.getOptionValue("log"), is("-"));
    }
}
