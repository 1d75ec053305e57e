package com.solv.cli;

import com.solv.core.config.SolvConfig;
import com.solv.core.msbuild.MsbuildProjectReader;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.PrintStream;

/**
 * Command to list NuGet packages referenced by the projects of each solution.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # All packages and their versions
 * solv nuget App.sln
 *
 * # Only packages referenced with different versions
 * solv nuget -m ~/src
 * }</pre>
 */
@Command(
    name = "nuget",
    description = "List NuGet package versions referenced by solution projects",
    mixinStandardHelpOptions = true
)
public class NugetCommand extends AbstractSolutionCommand {

    @Option(
        names = {"-m", "--mismatch"},
        description = "Show only packages referenced with more than one version"
    )
    private boolean onlyMismatched;

    @Override
    protected SolutionReport createReport(SolvConfig config, PrintStream out) {
        return new NugetPrinter(out, debug, onlyMismatched, new MsbuildProjectReader());
    }
}
