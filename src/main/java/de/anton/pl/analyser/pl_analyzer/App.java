package de.anton.pl.analyser.pl_analyzer;

import de.anton.pl.analyser.pl_analyzer.controller.AnalyzeCommand;
import de.anton.pl.analyser.pl_analyzer.controller.CompareCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Main application class. Wires the sub-commands and runs the command line.
 */
@Command(
    name = "pl-analyzer",
    mixinStandardHelpOptions = true,
    version = "pl-analyzer 0.1.0",
    description = "Photoluminescence spectrum analysis",
    subcommands = {AnalyzeCommand.class, CompareCommand.class}
)
public class App implements Runnable {
    private static final Logger logger = LoggerFactory.getLogger(App.class);

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    public static void main(String[] args) {
        int exitCode = newCommandLine().execute(args);
        logger.debug("Exiting with code {}", exitCode);
        System.exit(exitCode);
    }

    static CommandLine newCommandLine() {
        return new CommandLine(new App());
    }

    // No sub-command given
    @Override
    public void run() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing required sub-command");
    }
}
