package com.solv.cli;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ValidateCommand}.
 */
class ValidateCommandTest extends CommandTestBase {

    @Test
    void validate_cleanSolution_exitsZero() throws IOException {
        Path solution = writeSolution("App.sln", "");
        writeProjectFiles(tempDir);

        int exitCode = run("validate", solution.toString());

        assertThat(exitCode).isZero();
        assertThat(output())
            .contains(solution.toString())
            .contains("✓ No problems found")
            .contains("Statistic:");
    }

    @Test
    void validate_dependencyCycle_reportsCycleAndExitsOne() throws IOException {
        Path solution = writeSolution("App.sln", APP_ID);
        writeProjectFiles(tempDir);

        int exitCode = run("validate", solution.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(output()).contains("✗ Solution contains project dependency cycles");
    }

    @Test
    void validate_missingProjectFiles_listsThem() throws IOException {
        Path solution = writeSolution("App.sln", "");

        int exitCode = run("validate", solution.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(output())
            .contains("✗ Project files not found:")
            .contains(tempDir.resolve("App").resolve("App.csproj").toAbsolutePath().normalize().toString());
    }

    @Test
    void validate_problemsOnly_hidesCleanSolutions() throws IOException {
        Path solution = writeSolution("clean/App.sln", "");
        writeProjectFiles(solution.getParent());

        int exitCode = run("validate", "--problems", tempDir.toString());

        assertThat(exitCode).isZero();
        assertThat(output()).doesNotContain("No problems found");
    }

    @Test
    void validate_directory_scansAllSolutions() throws IOException {
        writeSolution("one/App.sln", "");
        writeSolution("two/App.sln", "");
        write("broken/Broken.sln", "Microsoft Visual Studio Solution File, Format Version 12.00\nEndGlobal\n");

        int exitCode = run("validate", "--threads=2", tempDir.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(output())
            .contains("✗ Files that could not be parsed:")
            .contains("Broken.sln")
            .containsPattern("Total\\s+3");
    }

    @Test
    void validate_customExtension_findsOnlyThoseFiles() throws IOException {
        writeSolution("App.slnx", "");
        writeSolution("Other.sln", "");

        run("validate", "--ext=slnx", tempDir.toString());

        assertThat(output()).contains("App.slnx").doesNotContain("Other.sln");
    }

    @Test
    void validate_missingPath_exitsOne() {
        int exitCode = run("validate", tempDir.resolve("nowhere").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(errors()).contains("✗ Path not found");
    }

    @Test
    void validate_emptyDirectory_saysSo() {
        int exitCode = run("validate", tempDir.toString());

        assertThat(exitCode).isZero();
        assertThat(output()).contains("No .sln files found");
    }
}
