package com.solv.core.scanner;

import com.solv.core.model.Solution;

import java.nio.file.Path;

/**
 * Receives per-file results from {@link SolutionScanner}.
 *
 * <p>{@link SolutionScanner} never calls one consumer from two threads at once.
 */
public interface SolutionConsumer {

    /**
     * Called for every file that parsed.
     *
     * @param path solution file
     * @param solution parsed model
     */
    void onSuccess(Path path, Solution solution);

    /**
     * Called for every file that could not be read or parsed.
     *
     * @param path solution file
     */
    void onFailure(Path path);

    /**
     * Whether failures should be logged with their full diagnostic.
     */
    boolean isVerboseMode();
}
