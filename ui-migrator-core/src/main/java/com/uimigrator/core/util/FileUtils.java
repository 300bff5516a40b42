package com.uimigrator.core.util;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Utility class for file operations.
 */
public final class FileUtils {

    /** Directories never searched for components. */
    private static final Set<String> IGNORED_DIRECTORIES = Set.of(
        "node_modules", ".git", "dist", "build", "target", "tmp", "vendor", "coverage"
    );

    private FileUtils() {
        // Utility class
    }

    /**
     * Finds files matching a glob pattern starting from a root directory, skipping dependency
     * and build output directories. Results are sorted.
     *
     * @param rootPath root directory to search from
     * @param globPattern glob pattern, matched against the path relative to the root
     * @return list of matching paths
     * @throws IOException if directory traversal fails
     */
    public static List<Path> findFiles(Path rootPath, String globPattern) throws IOException {
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + globPattern);
        // "**/" needs at least one directory, so match files directly under the root separately
        PathMatcher topLevelMatcher = globPattern.startsWith("**/")
            ? FileSystems.getDefault().getPathMatcher("glob:" + globPattern.substring(3))
            : matcher;

        try (Stream<Path> paths = Files.walk(rootPath)) {
            return paths
                .filter(Files::isRegularFile)
                .filter(path -> !isIgnored(rootPath.relativize(path)))
                .filter(path -> {
                    Path relativePath = rootPath.relativize(path);
                    return matcher.matches(relativePath)
                        || (relativePath.getNameCount() == 1 && topLevelMatcher.matches(relativePath));
                })
                .sorted()
                .toList();
        }
    }

    /**
     * Normalizes a file path relative to its source root as
     * {@code <root directory name>/<relative path>} with forward slashes.
     *
     * <p>The result does not depend on where the root is checked out, which keeps IDs stable
     * across machines.
     *
     * @param root source root
     * @param file file under the root
     * @return normalized path
     */
    public static String normalizedPath(Path root, Path file) {
        Path absoluteRoot = root.toAbsolutePath().normalize();
        Path absoluteFile = file.toAbsolutePath().normalize();
        String relative = absoluteFile.startsWith(absoluteRoot)
            ? absoluteRoot.relativize(absoluteFile).toString()
            : absoluteFile.toString();
        Path rootName = absoluteRoot.getFileName();
        String prefix = rootName == null ? "" : rootName + "/";
        return (prefix + relative).replace('\\', '/');
    }

    private static boolean isIgnored(Path relativePath) {
        for (Path part : relativePath) {
            if (IGNORED_DIRECTORIES.contains(part.toString())) {
                return true;
            }
        }
        return false;
    }
}
