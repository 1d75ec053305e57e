package com.solv.cli;

import com.solv.core.config.SolvConfig;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.PrintStream;

/**
 * Command to print parsed solutions as JSON, one document per solution.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * solv json --pretty App.sln
 * }</pre>
 */
@Command(
    name = "json",
    description = "Print the parsed solution model as JSON",
    mixinStandardHelpOptions = true
)
public class JsonCommand extends AbstractSolutionCommand {

    @Option(
        names = {"--pretty"},
        description = "Indent the JSON output"
    )
    private boolean pretty;

    @Override
    protected SolutionReport createReport(SolvConfig config, PrintStream out) {
        return new JsonPrinter(out, debug, pretty);
    }
}
