package com.solv.core.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link FileUtils}.
 */
class FileUtilsTest {

    @TempDir
    Path tempDir;

    @Test
    void findFilesByExtension_nestedFiles_returnsSortedMatches() throws IOException {
        Path second = tempDir.resolve("b/Second.sln");
        Path first = tempDir.resolve("a/First.sln");
        Files.createDirectories(second.getParent());
        Files.createDirectories(first.getParent());
        Files.writeString(second, "test");
        Files.writeString(first, "test");
        Files.writeString(tempDir.resolve("a/First.csproj"), "test");

        List<Path> files = FileUtils.findFilesByExtension(tempDir, "sln");

        assertThat(files).containsExactly(first, second);
    }

    @Test
    void findFilesByExtension_ignoresCase() throws IOException {
        Path upper = tempDir.resolve("App.SLN");
        Files.writeString(upper, "test");

        assertThat(FileUtils.findFilesByExtension(tempDir, ".Sln")).containsExactly(upper);
    }

    @Test
    void findFilesByExtension_withNoMatches_returnsEmptyList() throws IOException {
        Files.writeString(tempDir.resolve("readme.txt"), "test");

        assertThat(FileUtils.findFilesByExtension(tempDir, "sln")).isEmpty();
    }

    @Test
    void normalizeExtension_stripsDotAndLowerCases() {
        assertThat(FileUtils.normalizeExtension(".SLN")).isEqualTo("sln");
        assertThat(FileUtils.normalizeExtension("sln")).isEqualTo("sln");
    }

    @Test
    void readString_keepsByteOrderMark() throws IOException {
        Path file = tempDir.resolve("bom.sln");
        Files.write(file, new byte[] {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF, 'a', 'b'});

        assertThat(FileUtils.readString(file)).isEqualTo("\uFEFFab");
    }

    @Test
    void toHostPath_backslashSeparators_becomeHostSeparators() {
        assertThat(FileUtils.toHostPath("src\\App\\App.csproj")).isEqualTo(Path.of("src", "App", "App.csproj"));
        assertThat(FileUtils.toHostPath("src/App.csproj")).isEqualTo(Path.of("src", "App.csproj"));
    }

    @Test
    void resolveProjectPath_isRelativeToSolutionDirectory() {
        Path solution = tempDir.resolve("repo/All.sln");

        Path resolved = FileUtils.resolveProjectPath(solution, "..\\lib\\Lib.csproj");

        assertThat(resolved).isEqualTo(tempDir.resolve("lib/Lib.csproj").toAbsolutePath().normalize());
    }

    @Test
    void isUrl_distinguishesUrlsFromPaths() {
        assertThat(FileUtils.isUrl("http://localhost:8080/site")).isTrue();
        assertThat(FileUtils.isUrl("https://example.com/app.csproj")).isTrue();
        assertThat(FileUtils.isUrl("C:\\src\\app.csproj")).isFalse();
        assertThat(FileUtils.isUrl("src\\app.csproj")).isFalse();
    }
}
