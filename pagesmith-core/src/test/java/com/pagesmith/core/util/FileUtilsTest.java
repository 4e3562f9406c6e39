package com.pagesmith.core.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link FileUtils}.
 */
class FileUtilsTest {

    @TempDir
    Path tempDir;

    @Test
    void findFiles_withMatchingExtensions_returnsSortedFiles() throws IOException {
        Path nested = tempDir.resolve("blog/post.md");
        Path top = tempDir.resolve("about.TXT");
        Files.createDirectories(nested.getParent());
        Files.writeString(nested, "x");
        Files.writeString(top, "x");
        Files.writeString(tempDir.resolve("image.png"), "x");

        List<Path> files = FileUtils.findFiles(tempDir, Set.of("md", "txt"));

        assertThat(files).containsExactly(top, nested);
    }

    @Test
    void findFiles_withNoMatches_returnsEmptyList() throws IOException {
        assertThat(FileUtils.findFiles(tempDir, Set.of("md"))).isEmpty();
    }

    @Test
    void getExtension_returnsTextAfterLastDot() {
        assertThat(FileUtils.getExtension("post.tar.md")).isEqualTo("md");
        assertThat(FileUtils.getExtension(Path.of("dir", "README"))).isEmpty();
        assertThat(FileUtils.getExtension(".hidden")).isEmpty();
    }

    @Test
    void ensureDirectory_withExistingDirectory_succeeds() throws IOException {
        Path dir = Files.createDirectories(tempDir.resolve("a/b"));

        FileUtils.ensureDirectory(dir);

        assertThat(dir).isDirectory();
    }

    @Test
    void ensureDirectory_withMissingParents_createsThem() throws IOException {
        Path dir = tempDir.resolve("x/y/z");

        FileUtils.ensureDirectory(dir);

        assertThat(dir).isDirectory();
    }

    @Test
    void ensureDirectory_withFileInTheWay_throwsException() throws IOException {
        Path file = Files.writeString(tempDir.resolve("taken"), "x");

        assertThatThrownBy(() -> FileUtils.ensureDirectory(file.resolve("sub")))
            .isInstanceOf(IOException.class);
        assertThatThrownBy(() -> FileUtils.ensureDirectory(file))
            .isInstanceOf(FileAlreadyExistsException.class);
    }

    @Test
    void writeStringAtomically_replacesContentAndLeavesNoTempFiles() throws IOException {
        Path target = tempDir.resolve("page.html");
        Files.writeString(target, "old");

        FileUtils.writeStringAtomically(target, "new ünïcode");

        assertThat(Files.readString(target)).isEqualTo("new ünïcode");
        try (Stream<Path> files = Files.list(tempDir)) {
            assertThat(files).containsExactly(target);
        }
    }

    @Test
    void writeStringAtomically_withMissingDirectory_throwsAndCreatesNothing() {
        Path target = tempDir.resolve("missing/page.html");

        assertThatThrownBy(() -> FileUtils.writeStringAtomically(target, "x"))
            .isInstanceOf(IOException.class);
        assertThat(target).doesNotExist();
    }
}
