package com.contractbridge.core.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Utility class for file operations.
 */
public final class FileUtils {

    private FileUtils() {
        // Utility class
    }

    /**
     * Finds files matching a glob pattern starting from a root directory.
     *
     * <p>The pattern is matched against the path relative to {@code rootPath},
     * e.g. {@code src/main/java/**}{@code /*.java}.
     *
     * @param rootPath root directory to search from
     * @param globPattern glob pattern
     * @return matching paths, ordered by relative path
     * @throws IOException if directory traversal fails
     */
    public static List<Path> findFiles(Path rootPath, String globPattern) throws IOException {
        return findFiles(rootPath, List.of(globPattern));
    }

    /**
     * Finds files matching any of several glob patterns.
     *
     * <p>Every file is returned once, ordered lexicographically by its relative path.
     *
     * @param rootPath root directory to search from
     * @param globPatterns glob patterns
     * @return matching paths, ordered by relative path
     * @throws IOException if directory traversal fails
     */
    public static List<Path> findFiles(Path rootPath, List<String> globPatterns) throws IOException {
        if (!Files.isDirectory(rootPath) || globPatterns.isEmpty()) {
            return List.of();
        }
        List<PathMatcher> matchers = globPatterns.stream()
            .map(pattern -> FileSystems.getDefault().getPathMatcher("glob:" + pattern))
            .toList();

        Set<Path> matches = new LinkedHashSet<>();
        try (Stream<Path> paths = Files.walk(rootPath)) {
            paths
                .filter(Files::isRegularFile)
                .filter(path -> {
                    Path relativePath = rootPath.relativize(path);
                    return matchers.stream().anyMatch(matcher -> matcher.matches(relativePath));
                })
                .forEach(matches::add);
        }
        List<Path> sorted = new ArrayList<>(matches);
        sorted.sort(Comparator.comparing(path -> relativePath(rootPath, path)));
        return sorted;
    }

    /**
     * Returns the path of {@code file} relative to {@code rootPath}, with {@code /} separators.
     *
     * @param rootPath root directory
     * @param file file below the root
     * @return relative path string
     */
    public static String relativePath(Path rootPath, Path file) {
        return rootPath.relativize(file).toString().replace('\\', '/');
    }

    /**
     * Writes a file through a sibling temporary file and a move, creating parent
     * directories as needed. Readers never observe a partially written file.
     *
     * @param target file to write
     * @param content file content
     * @throws IOException if writing fails
     */
    public static void writeAtomically(Path target, String content) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        Path temp = Files.createTempFile(parent, target.getFileName().toString(), ".tmp");
        try {
            Files.writeString(temp, content, StandardCharsets.UTF_8);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    /**
     * Deletes a directory tree, children first.
     *
     * @param root directory or file to delete
     * @throws IOException if any entry cannot be deleted
     */
    public static void deleteRecursively(Path root) throws IOException {
        if (!Files.exists(root)) {
            return;
        }
        List<Path> entries;
        try (Stream<Path> paths = Files.walk(root)) {
            entries = paths.sorted(Comparator.reverseOrder()).toList();
        }
        for (Path entry : entries) {
            entry.toFile().setWritable(true);
            Files.delete(entry);
        }
    }
}
