package com.solv.core.scanner;

import com.solv.core.SolutionParser;
import com.solv.core.diagnostic.DiagnosticRenderer;
import com.solv.core.diagnostic.SolutionSyntaxException;
import com.solv.core.model.Solution;
import com.solv.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Finds solution files below a directory and parses them on a worker pool.
 *
 * <p>Each file is parsed independently; a file that cannot be read or parsed is reported to
 * the consumer and the batch continues. Consumer calls are serialized, so consumers need
 * no synchronization of their own.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * SolutionScanner scanner = new SolutionScanner(4);
 * int found = scanner.scan(Paths.get("src"), "sln", consumer);
 * }</pre>
 */
public class SolutionScanner {

    private static final Logger log = LoggerFactory.getLogger(SolutionScanner.class);

    private final int threads;
    private final Object consumerLock = new Object();

    /**
     * Creates a scanner using one thread per available processor.
     */
    public SolutionScanner() {
        this(0);
    }

    /**
     * @param threads worker count; 0 or less means one per available processor
     */
    public SolutionScanner(int threads) {
        this.threads = threads > 0 ? threads : Runtime.getRuntime().availableProcessors();
    }

    /**
     * Parses every file with the given extension below {@code rootPath}.
     *
     * @param rootPath directory to search
     * @param extension file extension, with or without the leading dot
     * @param consumer receiver of per-file results
     * @return number of files found
     * @throws IOException if the directory cannot be walked
     */
    public int scan(Path rootPath, String extension, SolutionConsumer consumer) throws IOException {
        List<Path> files = FileUtils.findFilesByExtension(rootPath, extension);
        log.debug("Found {} *.{} files under {}", files.size(), FileUtils.normalizeExtension(extension), rootPath);
        if (files.isEmpty()) {
            return 0;
        }

        ExecutorService executor = Executors.newFixedThreadPool(Math.min(threads, files.size()));
        try {
            List<Future<?>> tasks = new ArrayList<>(files.size());
            for (Path file : files) {
                tasks.add(executor.submit(() -> parseFile(file, consumer)));
            }
            for (Future<?> task : tasks) {
                await(task);
            }
        } finally {
            executor.shutdown();
        }

        log.debug("Scanned {} files under {}", files.size(), rootPath);
        return files.size();
    }

    /**
     * Reads and parses one file, reporting the outcome to the consumer.
     *
     * @param path solution file
     * @param consumer receiver of the result
     */
    public void parseFile(Path path, SolutionConsumer consumer) {
        String text;
        try {
            text = FileUtils.readString(path);
        } catch (IOException e) {
            log.error("Cannot read {}: {}", path, e.getMessage());
            deliverFailure(path, consumer);
            return;
        }

        Solution solution;
        try {
            solution = SolutionParser.parse(text, path.toString());
        } catch (SolutionSyntaxException e) {
            if (consumer.isVerboseMode()) {
                log.error("{}", DiagnosticRenderer.render(path.toString(),
                    SolutionParser.stripByteOrderMark(text), e.getDiagnostic()));
            } else {
                log.debug("Failed to parse {}: {}", path, e.getMessage());
            }
            deliverFailure(path, consumer);
            return;
        }

        synchronized (consumerLock) {
            consumer.onSuccess(path, solution);
        }
    }

    private void deliverFailure(Path path, SolutionConsumer consumer) {
        synchronized (consumerLock) {
            consumer.onFailure(path);
        }
    }

    private static void await(Future<?> task) {
        try {
            task.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while scanning", e);
        } catch (ExecutionException e) {
            // An exception thrown by the consumer aborts the batch.
            throw new IllegalStateException("Solution consumer failed", e.getCause());
        }
    }
}
