package com.solv.core.scanner;

import com.solv.core.Fixtures;
import com.solv.core.SolutionParser;
import com.solv.core.model.Solution;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link SolutionScanner}.
 */
class SolutionScannerTest {

    @TempDir
    Path tempDir;

    private RecordingConsumer consumer;

    @BeforeEach
    void setUp() {
        consumer = new RecordingConsumer();
    }

    @Test
    void scan_mixedFiles_reportsEachFileOnce() throws IOException {
        Path good = writeFile("src/App.sln", Fixtures.solution(Fixtures.REAL));
        Path other = writeFile("lib/Lib.SLN", Fixtures.solution(Fixtures.APR));
        Path bad = writeFile("broken/Broken.sln", "Microsoft Visual Studio Solution File, Format Version 12.00\nEndProject\n");
        writeFile("src/App.csproj", "<Project />");

        int found = new SolutionScanner(2).scan(tempDir, "sln", consumer);

        assertThat(found).isEqualTo(3);
        assertThat(consumer.succeeded).containsExactlyInAnyOrder(good, other);
        assertThat(consumer.failed).containsExactly(bad);
    }

    @Test
    void scan_extensionWithLeadingDot_isAccepted() throws IOException {
        writeFile("App.sln", Fixtures.solution(Fixtures.CORRECT));

        int found = new SolutionScanner(1).scan(tempDir, ".sln", consumer);

        assertThat(found).isEqualTo(1);
        assertThat(consumer.succeeded).hasSize(1);
    }

    @Test
    void scan_noMatchingFiles_returnsZero() throws IOException {
        writeFile("readme.txt", "nothing here");

        assertThat(new SolutionScanner().scan(tempDir, "sln", consumer)).isZero();
        assertThat(consumer.succeeded).isEmpty();
        assertThat(consumer.failed).isEmpty();
    }

    @Test
    void scan_failingConsumer_abortsBatch() throws IOException {
        writeFile("App.sln", Fixtures.solution(Fixtures.CORRECT));
        SolutionConsumer throwing = new RecordingConsumer() {
            @Override
            public void onSuccess(Path path, Solution solution) {
                throw new IllegalStateException("boom");
            }
        };

        assertThatThrownBy(() -> new SolutionScanner(1).scan(tempDir, "sln", throwing))
            .isInstanceOf(IllegalStateException.class)
            .hasRootCauseMessage("boom");
    }

    @Test
    void parseFile_missingFile_reportsFailure() {
        Path missing = tempDir.resolve("missing.sln");

        new SolutionScanner().parseFile(missing, consumer);

        assertThat(consumer.failed).containsExactly(missing);
    }

    @Test
    void parseFile_verboseMode_stillReportsFailure() throws IOException {
        Path bad = writeFile("Bad.sln", "Microsoft Visual Studio Solution File, Format Version 12.00\n$");
        consumer.verbose = true;

        new SolutionScanner().parseFile(bad, consumer);

        assertThat(consumer.failed).containsExactly(bad);
    }

    @Test
    void parseFile_byteOrderMarkFile_parses() throws IOException {
        Path file = writeFile("Bom.sln", SolutionParser.BYTE_ORDER_MARK + Fixtures.solution(Fixtures.REAL));

        new SolutionScanner().parseFile(file, consumer);

        assertThat(consumer.solutions).singleElement()
            .satisfies(solution -> assertThat(solution.projects()).hasSize(10));
    }

    private Path writeFile(String relativePath, String content) throws IOException {
        Path file = tempDir.resolve(relativePath);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }

    private static class RecordingConsumer implements SolutionConsumer {
        final List<Path> succeeded = new ArrayList<>();
        final List<Solution> solutions = new ArrayList<>();
        final List<Path> failed = new ArrayList<>();
        boolean verbose;

        @Override
        public void onSuccess(Path path, Solution solution) {
            succeeded.add(path);
            solutions.add(solution);
        }

        @Override
        public void onFailure(Path path) {
            failed.add(path);
        }

        @Override
        public boolean isVerboseMode() {
            return verbose;
        }
    }
}
