package com.solv.core.util;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Utility class for file operations.
 */
public final class FileUtils {

    private FileUtils() {
        // Utility class
    }

    /**
     * Finds regular files with the given extension below a root directory.
     *
     * <p>The extension is matched case-insensitively and may be given with or without its
     * leading dot. Unreadable directories are skipped.
     *
     * @param rootPath root directory to search from
     * @param extension extension such as {@code sln} or {@code .sln}
     * @return matching paths, sorted
     * @throws IOException if the root cannot be walked
     */
    public static List<Path> findFilesByExtension(Path rootPath, String extension) throws IOException {
        String suffix = "." + normalizeExtension(extension);
        List<Path> found = new ArrayList<>();

        Files.walkFileTree(rootPath, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile() && file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(suffix)) {
                    found.add(file);
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                return FileVisitResult.CONTINUE;
            }
        });

        found.sort(null);
        return found;
    }

    /**
     * Strips a leading dot and lower-cases an extension.
     */
    public static String normalizeExtension(String extension) {
        String trimmed = extension.startsWith(".") ? extension.substring(1) : extension;
        return trimmed.toLowerCase(Locale.ROOT);
    }

    /**
     * Reads a file as UTF-8, replacing malformed input instead of failing.
     *
     * @param path path to file
     * @return file content, including any byte-order mark
     * @throws IOException if reading fails
     */
    public static String readString(Path path) throws IOException {
        return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
    }

    /**
     * Converts a path written in a solution file to a host path.
     *
     * <p>Solution files always use {@code \} as separator.
     *
     * @param relativePath path as written, e.g. {@code src\App\App.csproj}
     * @return host path
     */
    public static Path toHostPath(String relativePath) {
        String[] parts = relativePath.split("[\\\\/]+");
        List<String> segments = new ArrayList<>();
        for (String part : parts) {
            if (!part.isEmpty()) {
                segments.add(part);
            }
        }
        if (segments.isEmpty()) {
            return Path.of("");
        }
        String first = relativePath.startsWith("/") ? "/" + segments.get(0) : segments.get(0);
        return Path.of(first, segments.subList(1, segments.size()).toArray(String[]::new));
    }

    /**
     * Resolves a project path against the directory of its solution file.
     *
     * @param solutionFile solution file
     * @param relativePath project path as written in the solution
     * @return normalized host path
     */
    public static Path resolveProjectPath(Path solutionFile, String relativePath) {
        Path directory = solutionFile.toAbsolutePath().getParent();
        Path project = toHostPath(relativePath);
        return (directory != null ? directory.resolve(project) : project).normalize();
    }

    /**
     * Returns whether a project path is an absolute URL such as {@code http://localhost/site}.
     *
     * <p>Drive-letter paths like {@code C:\src} are not URLs.
     */
    public static boolean isUrl(String path) {
        try {
            URI uri = new URI(path);
            return uri.getScheme() != null && uri.getScheme().length() > 1 && uri.getHost() != null;
        } catch (URISyntaxException e) {
            return false;
        }
    }
}
