package com.solv.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.solv.core.model.Solution;

import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;

/**
 * Writes each solution as a JSON document using Jackson.
 */
class JsonPrinter extends SolutionReport {

    private final ObjectWriter writer;

    JsonPrinter(PrintStream out, boolean verbose, boolean pretty) {
        super(out, verbose);
        ObjectMapper mapper = new ObjectMapper();
        this.writer = pretty ? mapper.writerWithDefaultPrettyPrinter() : mapper.writer();
    }

    @Override
    public void onSuccess(Path path, Solution solution) {
        try {
            out.println(writer.writeValueAsString(new SolutionDocument(path.toString(), solution)));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Cannot serialize " + path, e);
        }
    }

    /**
     * JSON envelope pairing a solution with its file.
     *
     * @param path solution file
     * @param solution parsed model
     */
    record SolutionDocument(String path, Solution solution) {
    }
}
