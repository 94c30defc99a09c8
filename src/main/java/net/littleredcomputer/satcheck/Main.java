package net.littleredcomputer.satcheck;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;

public class Main {
    static Options options() {
        return new Options()
                .addOption(Option.builder("cnf").longOpt("cnf-file").hasArg()
                        .desc("filename of the formula in DIMACS CNF format").build())
                .addOption(Option.builder("log").longOpt("log-file").hasArg()
                        .desc("filename of the solver's debug log, or - for stdin").build())
                .addOption("loginterval", true, "interval between progress log entries in ISO-8601 format");
    }

    private static Reader trace(CommandLine cmd) throws FileNotFoundException {
        if (!cmd.hasOption("log")) throw new IllegalArgumentException("Must specify -log");
        String l = cmd.getOptionValue("log");
        return new BufferedReader(l.equals("-")
                ? new InputStreamReader(System.in, StandardCharsets.UTF_8)
                : new InputStreamReader(new FileInputStream(l), StandardCharsets.UTF_8));
    }

    private static Formula formula(CommandLine cmd) throws IOException {
        if (!cmd.hasOption("cnf")) throw new IllegalArgumentException("Must specify -cnf");
        try (Reader r = new InputStreamReader(new FileInputStream(cmd.getOptionValue("cnf")), StandardCharsets.UTF_8)) {
            return Formula.parseFrom(r);
        }
    }

    private static Duration logInterval(CommandLine cmd) {
        return Duration.parse(cmd.getOptionValue("loginterval", "PT1S"));
    }

    public static void main(String[] args) throws ParseException, IOException {
        CommandLine cmd = new DefaultParser().parse(options(), args);
        Formula f = formula(cmd);
        Optional<Fault> fault;
        try (Reader r = trace(cmd)) {
            fault = new TraceChecker(f).setLogInterval(logInterval(cmd)).check(r);
        }
        if (fault.isPresent()) {
            System.out.println(fault.get());
            System.exit(1);
        }
        System.out.println("Found no faults in SAT solver");
    }
}
