package com.solv;

import ch.qos.logback.classic.Level;
import com.solv.cli.InfoCommand;
import com.solv.cli.JsonCommand;
import com.solv.cli.NugetCommand;
import com.solv.cli.ValidateCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for solv.
 *
 * <p>solv parses Visual Studio solution files and reports on their structure.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code validate} - Find dependency cycles, configuration problems and missing project files</li>
 *   <li>{@code info} - Summarize projects, versions, configurations and platforms</li>
 *   <li>{@code nuget} - List NuGet package versions referenced by the projects</li>
 *   <li>{@code json} - Print the parsed solution model as JSON</li>
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
 * # Validate every solution below the current directory
 * solv validate .
 *
 * # Show only solutions with problems
 * solv validate --problems ~/src
 *
 * # Summarize one solution
 * solv info App.sln
 * }</pre>
 */
@Command(
    name = "solv",
    mixinStandardHelpOptions = true,
    version = "solv 1.0.0-SNAPSHOT",
    description = "Visual Studio solution file parser and validator",
    subcommands = {
        ValidateCommand.class,
        InfoCommand.class,
        NugetCommand.class,
        JsonCommand.class
    }
)
public class SolvCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(SolvCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("solv - Visual Studio solution file parser and validator");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'solv --help' to see available commands");
        System.out.println("Use 'solv <command> --help' for command-specific help");
    }

    /**
     * Applies global options, then runs the selected subcommand.
     */
    private int executionStrategy(CommandLine.ParseResult parseResult) {
        configureLogging();
        return new CommandLine.RunLast().execute(parseResult);
    }

    /**
     * Configures logging level based on global options.
     */
    private void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Logging configured: verbose={}, quiet={}", verbose, quiet);
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
     * Creates the command line with global option handling installed.
     *
     * @return configured command line
     */
    public static CommandLine createCommandLine() {
        SolvCLI cli = new SolvCLI();
        return new CommandLine(cli).setExecutionStrategy(cli::executionStrategy);
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }
}
