package com.solv.cli;

import com.solv.core.config.SolvConfig;
import picocli.CommandLine.Command;

import java.io.PrintStream;

/**
 * Command to summarize solution files.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * solv info App.sln
 * }</pre>
 */
@Command(
    name = "info",
    description = "Show format, versions, project types, configurations and platforms",
    mixinStandardHelpOptions = true
)
public class InfoCommand extends AbstractSolutionCommand {

    @Override
    protected SolutionReport createReport(SolvConfig config, PrintStream out) {
        return new InfoPrinter(out, debug);
    }
}
