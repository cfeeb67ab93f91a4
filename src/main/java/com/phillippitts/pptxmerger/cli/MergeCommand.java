package com.phillippitts.pptxmerger.cli;

import com.phillippitts.pptxmerger.config.properties.MergeProperties;
import com.phillippitts.pptxmerger.domain.MergeResult;
import com.phillippitts.pptxmerger.exception.InvalidInputException;
import com.phillippitts.pptxmerger.exception.PptxMergerException;
import com.phillippitts.pptxmerger.service.merge.PresentationMergeService;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;

/**
 * Command line entry point: resolves inputs (explicitly or interactively), runs the merge and
 * maps the outcome to a process exit code.
 *
 * <p>Exit codes: {@value #EXIT_OK} on success, {@value #EXIT_INVALID_INPUT} for bad options or
 * inputs, {@value #EXIT_MERGE_FAILED} when the merge itself fails.
 */
@Component
@ConditionalOnProperty(prefix = "merge.cli", name = "enabled", havingValue = "true", matchIfMissing = true)
public class MergeCommand implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger LOG = LogManager.getLogger(MergeCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_INVALID_INPUT = 1;
    static final int EXIT_MERGE_FAILED = 2;

    private final PresentationMergeService mergeService;
    private final InputResolver inputResolver;
    private final MergeProperties properties;
    private final BufferedReader in;
    private final PrintStream out;
    private final PrintStream err;
    private final Path workingDir;
    private int exitCode = EXIT_OK;

    @Autowired
    public MergeCommand(PresentationMergeService mergeService, InputResolver inputResolver, MergeProperties properties) {
        this(mergeService, inputResolver, properties,
                new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
                System.out, System.err, Path.of("").toAbsolutePath());
    }

    MergeCommand(PresentationMergeService mergeService,
                 InputResolver inputResolver,
                 MergeProperties properties,
                 BufferedReader in,
                 PrintStream out,
                 PrintStream err,
                 Path workingDir) {
        this.mergeService = mergeService;
        this.inputResolver = inputResolver;
        this.properties = properties;
        this.in = in;
        this.out = out;
        this.err = err;
        this.workingDir = workingDir;
    }

    @Override
    public void run(ApplicationArguments args) {
        exitCode = execute(args.getSourceArgs());
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /**
     * Runs one command line invocation.
     *
     * @return process exit code
     */
    int execute(String[] args) {
        CommandLineOptions options;
        List<Path> inputs;
        Path output;
        try {
            options = CommandLineOptions.parse(args);
            if (options.help()) {
                CommandLineOptions.printHelp(new PrintWriter(out, true, StandardCharsets.UTF_8));
                return EXIT_OK;
            }
            String outputName = options.output() != null ? options.output() : properties.getDefaultOutput();
            output = resolveOutput(outputName);
            inputs = selectInputs(options, output);
        } catch (InvalidInputException e) {
            LOG.error("Invalid input: {}", e.getMessage());
            err.println("Invalid input: " + e.getMessage());
            return EXIT_INVALID_INPUT;
        }

        try {
            MergeResult result = mergeService.merge(inputs, output);
            out.println();
            out.printf("Done. Wrote: %s (%d slides)%n", result.output(), result.totalSlides());
            return EXIT_OK;
        } catch (InvalidInputException e) {
            LOG.error("Invalid input: {}", e.getMessage());
            err.println("Invalid input: " + e.getMessage());
            return EXIT_INVALID_INPUT;
        } catch (PptxMergerException e) {
            LOG.error("Merge failed", e);
            err.println();
            err.println("ERROR while merging:");
            err.println(e.getMessage());
            return EXIT_MERGE_FAILED;
        }
    }

    private Path resolveOutput(String outputName) {
        try {
            return workingDir.resolve(outputName).toAbsolutePath().normalize();
        } catch (InvalidPathException e) {
            throw new InvalidInputException(outputName, "not a valid output path");
        }
    }

    private List<Path> selectInputs(CommandLineOptions options, Path output) {
        if (!options.inputs().isEmpty()) {
            return inputResolver.resolve(options.inputs(), workingDir);
        }
        out.println("Interactive mode: scanning " + workingDir + " for " + properties.getInputExtension() + " files...");
        List<Path> candidates = inputResolver.discover(workingDir, output);
        if (candidates.isEmpty()) {
            throw new InvalidInputException("No " + properties.getInputExtension() + " files found in " + workingDir);
        }
        return new SlideOrderPrompt(in, out, properties.getInputExtension()).choose(candidates);
    }
}
