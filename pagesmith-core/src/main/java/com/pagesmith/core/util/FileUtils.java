package com.pagesmith.core.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Locale;
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
     * Finds regular files with one of the given extensions below a root directory.
     *
     * <p>Extensions are compared case-insensitively. Results are sorted for a
     * stable build order.
     *
     * @param rootPath root directory to search from
     * @param extensions extensions without leading dot
     * @return list of matching paths
     * @throws IOException if directory traversal fails
     */
    public static List<Path> findFiles(Path rootPath, Set<String> extensions) throws IOException {
        try (Stream<Path> paths = Files.walk(rootPath)) {
            return paths
                .filter(Files::isRegularFile)
                .filter(path -> extensions.contains(getExtension(path).toLowerCase(Locale.ROOT)))
                .sorted()
                .toList();
        }
    }

    /**
     * Gets the extension of a file name.
     *
     * @param fileName file name
     * @return extension without dot, or empty string if there is none
     */
    public static String getExtension(String fileName) {
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(lastDot + 1) : "";
    }

    /**
     * Gets the file extension.
     *
     * @param path file path
     * @return file extension without dot, or empty string if no extension
     */
    public static String getExtension(Path path) {
        return getExtension(path.getFileName().toString());
    }

    /**
     * Makes sure a directory exists, creating missing parents.
     *
     * <p>A directory that already exists, or that another thread creates at the
     * same time, is accepted. Anything else on the path that is not a directory
     * is reported.
     *
     * @param dir directory to create
     * @throws IOException if the directory cannot be created
     */
    public static void ensureDirectory(Path dir) throws IOException {
        if (Files.isDirectory(dir)) {
            return;
        }
        try {
            Files.createDirectories(dir);
        } catch (FileAlreadyExistsException e) {
            if (!Files.isDirectory(dir)) {
                throw e;
            }
        }
    }

    /**
     * Writes text as UTF-8, replacing the target only once the content is fully written.
     *
     * <p>Content goes to a temporary file next to the target which is then moved
     * into place. On failure the temporary file is removed and the previous
     * target, if any, is left untouched.
     *
     * @param target file to write
     * @param content text content
     * @throws IOException if writing or moving fails
     */
    public static void writeStringAtomically(Path target, String content) throws IOException {
        Path dir = target.toAbsolutePath().getParent();
        Path temp = Files.createTempFile(dir, "." + target.getFileName(), ".tmp");
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
}
