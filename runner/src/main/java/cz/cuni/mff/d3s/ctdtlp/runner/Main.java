package cz.cuni.mff.d3s.ctdtlp.runner;

import cz.cuni.mff.d3s.ctdtlp.model.common.errors.GenerationException;
import cz.cuni.mff.d3s.ctdtlp.runner.args.Arguments;
import cz.cuni.mff.d3s.ctdtlp.runner.orchestrator.Orchestrator;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;

import java.io.PrintStream;
import java.io.UncheckedIOException;

@Slf4j
public final class Main {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_USAGE = 2;

    private Main() {}

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        Arguments arguments = new Arguments();
        CommandLine commandLine = new CommandLine(arguments);
        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException e) {
            err.println(e.getMessage());
            commandLine.usage(err);
            return EXIT_USAGE;
        }
        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(out);
            return EXIT_OK;
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(out);
            return EXIT_OK;
        }

        try {
            arguments.validateOrThrow();
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            return EXIT_USAGE;
        }

        try {
            new Orchestrator(arguments).run(out);
            return EXIT_OK;
        } catch (GenerationException e) {
            log.error("Generation failed", e);
            err.println("Generation failed: " + e.getMessage());
            String rawOutput = e.getRawOutput();
            if (rawOutput != null && !rawOutput.isBlank()) {
                err.println("Raw oracle output:");
                err.println(rawOutput.stripTrailing());
            }
            return EXIT_FAILURE;
        } catch (IllegalArgumentException | IllegalStateException | UncheckedIOException e) {
            log.error("Run failed", e);
            err.println("Run failed: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }
}
