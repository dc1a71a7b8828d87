package com.szntopology;

import ch.qos.logback.classic.Level;
import com.szntopology.cli.InjectCommand;
import com.szntopology.cli.ParseCommand;
import com.szntopology.cli.ValidateCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for the SZN topology tools.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code parse} - Parse a topology file and print it as JSON</li>
 *   <li>{@code inject} - Resolve an attribute injection file</li>
 *   <li>{@code validate} - Check that topology files parse</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Print a topology with injected attributes
 * szn-topology parse test/test_ping.py --inject attributes.json --search-path test
 *
 * # Check every topology of a suite
 * szn-topology validate test/*.szn
 * }</pre>
 */
@Command(
    name = "szn-topology",
    mixinStandardHelpOptions = true,
    version = "SZN Topology 1.0.0-SNAPSHOT",
    description = "Parser and attribute injection tool for SZN network topologies",
    subcommands = {
        ParseCommand.class,
        InjectCommand.class,
        ValidateCommand.class
    }
)
public class SznTopologyCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(SznTopologyCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }
        System.out.println("SZN Topology - Parser and attribute injection tool");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'szn-topology --help' to see available commands");
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Verbose output enabled");
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line with the global options applied before any
     * subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        SznTopologyCLI cli = new SznTopologyCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
