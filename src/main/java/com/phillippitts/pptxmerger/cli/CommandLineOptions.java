package com.phillippitts.pptxmerger.cli;

import com.phillippitts.pptxmerger.exception.InvalidInputException;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import java.io.PrintWriter;
import java.util.List;

/**
 * Command line grammar: {@code pptx-merger [FILE.pptx ...] [-o|--output merged.pptx] [-h|--help]}.
 *
 * @param inputs input files in merge order; empty for interactive selection
 * @param output output file, or null to use the configured default
 * @param help   whether usage was requested
 */
record CommandLineOptions(List<String> inputs, String output, boolean help) {

    static final String USAGE = "pptx-merger [FILE.pptx ...]";

    private static final Options OPTIONS = buildOptions();

    CommandLineOptions {
        inputs = List.copyOf(inputs);
    }

    /**
     * @throws InvalidInputException on unknown options or a missing option argument
     */
    static CommandLineOptions parse(String[] args) {
        CommandLineParser parser = new DefaultParser();
        try {
            CommandLine line = parser.parse(OPTIONS, args);
            return new CommandLineOptions(line.getArgList(), line.getOptionValue("output"), line.hasOption("help"));
        } catch (ParseException e) {
            throw new InvalidInputException(e.getMessage());
        }
    }

    static void printHelp(PrintWriter out) {
        HelpFormatter formatter = new HelpFormatter();
        formatter.printHelp(out, HelpFormatter.DEFAULT_WIDTH, USAGE,
                "Merge .pptx files in the given order. Without files, the current folder is listed "
                        + "and the order is asked for.",
                OPTIONS, HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, null, true);
        out.flush();
    }

    private static Options buildOptions() {
        Options options = new Options();
        options.addOption(new Option("h", "help", false, "Show this message"));
        options.addOption(Option.builder("o")
                .longOpt("output")
                .hasArg()
                .argName("FILE")
                .desc("Output .pptx file (default: merged.pptx)")
                .build());
        return options;
    }
}
