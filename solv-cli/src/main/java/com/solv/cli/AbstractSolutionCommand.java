package com.solv.cli;

import com.solv.core.config.ConfigLoader;
import com.solv.core.config.SolvConfig;
import com.solv.core.scanner.SolutionScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

/**
 * Shared options and flow of commands that read one solution or scan a directory for them.
 *
 * <p>Subclasses supply the {@link SolutionReport} that receives each parsed solution.
 */
public abstract class AbstractSolutionCommand implements Callable<Integer> {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    @Parameters(
        index = "0",
        description = "Solution file, or directory to scan for solution files"
    )
    protected Path path;

    @Option(
        names = {"-e", "--ext"},
        description = "Solution file extension when scanning a directory (default: sln)"
    )
    protected String extension;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: solv.yaml)"
    )
    protected Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(
        names = {"-t", "--threads"},
        description = "Worker threads when scanning (default: available processors)"
    )
    protected Integer threads;

    @Option(
        names = {"--debug"},
        description = "Print the full diagnostic for files that cannot be parsed"
    )
    protected boolean debug;

    @Override
    public Integer call() {
        if (!Files.exists(path)) {
            System.err.println("✗ Path not found: " + path);
            return 1;
        }

        SolvConfig config = ConfigLoader.load(configPath);
        SolutionReport report = createReport(config, System.out);
        SolutionScanner scanner = new SolutionScanner(threads != null ? threads : config.scan().threads());

        try {
            if (Files.isDirectory(path)) {
                String ext = extension != null ? extension : config.scan().extension();
                log.debug("Scanning {} for *.{} files", path.toAbsolutePath(), ext);
                int found = scanner.scan(path, ext, report);
                if (found == 0) {
                    System.out.println("No ." + ext + " files found under " + path);
                }
            } else {
                scanner.parseFile(path, report);
            }
        } catch (IOException e) {
            log.error("Scan failed", e);
            System.err.println("✗ Scan failed: " + e.getMessage());
            return 1;
        }

        return report.finish();
    }

    /**
     * Creates the report for one run.
     *
     * @param config loaded configuration
     * @param out destination of the report
     * @return report receiving scanner results
     */
    protected abstract SolutionReport createReport(SolvConfig config, PrintStream out);
}
