package com.inp2ops;

import ch.qos.logback.classic.Level;
import com.inp2ops.cli.BatchCommand;
import com.inp2ops.cli.ConvertCommand;
import com.inp2ops.cli.InfoCommand;
import com.inp2ops.cli.ListCommand;
import com.inp2ops.cli.ValidateCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for inp2ops.
 *
 * <p>inp2ops converts Abaqus {@code .inp} input decks into OpenSeesPy scripts.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code convert} - Convert one input file</li>
 *   <li>{@code batch} - Convert every input file in a directory</li>
 *   <li>{@code info} - Show what an input file contains</li>
 *   <li>{@code validate} - Check that an input file converts, without writing</li>
 *   <li>{@code list} - List supported elements, materials or renderers</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Convert a model next to the input
 * inp2ops convert frame.inp
 *
 * # Convert a directory with debug logging
 * inp2ops -v batch models/ -o scripts/
 *
 * # Show supported element types
 * inp2ops list elements
 * }</pre>
 */
@Command(
    name = "inp2ops",
    mixinStandardHelpOptions = true,
    version = "inp2ops 1.0.0-SNAPSHOT",
    description = "Converts Abaqus .inp models into OpenSeesPy scripts",
    subcommands = {
        ConvertCommand.class,
        BatchCommand.class,
        InfoCommand.class,
        ValidateCommand.class,
        ListCommand.class
    }
)
public class Inp2OpsCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(Inp2OpsCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("inp2ops - Abaqus to OpenSeesPy converter");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'inp2ops --help' to see available commands");
        System.out.println("Use 'inp2ops <command> --help' for command-specific help");
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
        log.debug("Root log level set to {}", root.getLevel());
    }

    /**
     * Returns whether verbose mode is enabled.
     *
     * @return true if verbose mode is enabled
     */
    public boolean isVerbose() {
        return verbose;
    }

    /**
     * Returns whether quiet mode is enabled.
     *
     * @return true if quiet mode is enabled
     */
    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Builds the command line with logging configured before any subcommand runs.
     *
     * @return ready-to-execute command line
     */
    public static CommandLine commandLine() {
        Inp2OpsCLI cli = new Inp2OpsCLI();
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
