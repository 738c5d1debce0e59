package com.rustarchitect.core.util;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

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
     * <p>Directories whose name is in {@code skippedDirectories} are not entered.
     * A symbolic link to a regular file counts as a file; symbolic links to directories
     * are not followed, so link cycles cannot occur. Subdirectories that cannot be listed are skipped silently; the caller sees
     * only the files that could be reached.
     *
     * @param rootPath root directory to search from
     * @param extension file extension without dot (for example {@code rs})
     * @param skippedDirectories directory names never descended into
     * @return matching paths in traversal order
     * @throws IOException if the root itself cannot be traversed
     */
    public static List<Path> findFiles(Path rootPath, String extension, Set<String> skippedDirectories)
            throws IOException {
        List<Path> found = new ArrayList<>();
        Files.walkFileTree(rootPath, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (!dir.equals(rootPath) && skippedDirectories.contains(dir.getFileName().toString())) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                boolean regular = attrs.isRegularFile() || isLinkToRegularFile(file, attrs);
                if (regular && extension.equals(getExtension(file))) {
                    found.add(file);
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
                if (file.equals(rootPath)) {
                    throw exc;
                }
                return FileVisitResult.CONTINUE;
            }
        });
        return found;
    }

    private static boolean isLinkToRegularFile(Path file, BasicFileAttributes attrs) {
        return attrs.isSymbolicLink() && Files.isRegularFile(file);
    }

    /**
     * Returns the path of {@code file} relative to {@code root} with {@code /} separators.
     *
     * @param root base directory
     * @param file file below the base directory
     * @return portable relative path
     */
    public static String relativePath(Path root, Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }

    /**
     * Returns the file name of a portable path without its extension.
     *
     * <p>{@code src/net/conn.rs} gives {@code conn}.
     *
     * @param path {@code /}-separated path
     * @return file stem
     */
    public static String stem(String path) {
        int slash = path.lastIndexOf('/');
        String fileName = slash >= 0 ? path.substring(slash + 1) : path;
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(0, lastDot) : fileName;
    }

    /**
     * Returns the immediate parent directory name of a portable path.
     *
     * @param path {@code /}-separated path
     * @return parent directory name, or null for a top-level file
     */
    public static String parentName(String path) {
        int slash = path.lastIndexOf('/');
        if (slash <= 0) {
            return null;
        }
        String parent = path.substring(0, slash);
        int previous = parent.lastIndexOf('/');
        return previous >= 0 ? parent.substring(previous + 1) : parent;
    }

    /**
     * Gets the file extension.
     *
     * @param path file path
     * @return file extension without dot, or empty string if no extension
     */
    public static String getExtension(Path path) {
        String fileName = path.getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(lastDot + 1) : "";
    }
}
