package com.solv.cli;

import com.solv.core.config.SolvConfig;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.PrintStream;

/**
 * Command to validate solution files.
 *
 * <p>Checks each solution for:
 * <ol>
 *   <li>cycles in project dependencies</li>
 *   <li>project configurations of undeclared projects</li>
 *   <li>project configurations missing from the solution configurations</li>
 *   <li>project files that do not exist</li>
 * </ol>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Validate all solutions below a directory
 * solv validate ~/src
 *
 * # Print only solutions with problems
 * solv validate -p ~/src
 * }</pre>
 */
@Command(
    name = "validate",
    description = "Validate solution files for structural problems",
    mixinStandardHelpOptions = true
)
public class ValidateCommand extends AbstractSolutionCommand {

    @Option(
        names = {"-p", "--problems"},
        description = "Show only solutions that have problems"
    )
    private boolean showOnlyProblems;

    @Override
    protected SolutionReport createReport(SolvConfig config, PrintStream out) {
        boolean onlyProblems = showOnlyProblems || config.validate().showOnlyProblems();
        return new ValidationPrinter(out, debug, onlyProblems);
    }
}
