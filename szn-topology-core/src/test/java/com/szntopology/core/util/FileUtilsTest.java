package com.szntopology.core.util;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Tests for {@link FileUtils}.
 */
class FileUtilsTest {

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() throws IOException {
        Files.createDirectories(tempDir.resolve("suite/nested"));
        Files.createDirectories(tempDir.resolve(".hidden/inner"));
        Files.writeString(tempDir.resolve("test_a.py"), "");
        Files.writeString(tempDir.resolve("test_b.py"), "");
        Files.writeString(tempDir.resolve("notes.txt"), "");
        Files.writeString(tempDir.resolve("suite/test_c.py"), "");
        Files.writeString(tempDir.resolve("suite/nested/test_d.py"), "");
    }

    @Test
    void findFiles_singleStar_staysInDirectory() throws IOException {
        List<Path> files = FileUtils.findFiles(tempDir + "/test_*.py");

        assertThat(files).extracting(path -> path.getFileName().toString())
            .containsExactlyInAnyOrder("test_a.py", "test_b.py");
    }

    @Test
    void findFiles_doubleStar_descends() throws IOException {
        List<Path> files = FileUtils.findFiles(tempDir + "/**/test_*.py");

        assertThat(files).extracting(path -> path.getFileName().toString())
            .containsExactlyInAnyOrder("test_c.py", "test_d.py");
    }

    @Test
    void findFiles_plainPath_returnsFileIfPresent() throws IOException {
        assertThat(FileUtils.findFiles(tempDir.resolve("notes.txt").toString())).hasSize(1);
        assertThat(FileUtils.findFiles(tempDir.resolve("missing.txt").toString())).isEmpty();
        assertThat(FileUtils.findFiles(tempDir + "/missing/*.py")).isEmpty();
    }

    @Test
    void subdirectories_skipsHiddenDirectories() throws IOException {
        List<Path> directories = FileUtils.subdirectories(tempDir);

        assertThat(directories).containsExactly(tempDir.resolve("suite"), tempDir.resolve("suite/nested"));
    }

    @Test
    void findFiles_symlinkLoop_isSkipped() throws IOException {
        Files.createSymbolicLink(tempDir.resolve("suite/nested/back"), tempDir.resolve("suite"));

        List<Path> files = FileUtils.findFiles(tempDir + "/**/test_*.py");

        assertThat(files).containsExactly(
            tempDir.resolve("suite/nested/test_d.py"),
            tempDir.resolve("suite/test_c.py"));
    }

    @Test
    void subdirectories_symlinkLoop_listsEachDirectoryOnce() throws IOException {
        Files.createSymbolicLink(tempDir.resolve("suite/nested/back"), tempDir.resolve("suite"));

        List<Path> directories = FileUtils.subdirectories(tempDir);

        assertThat(directories).containsExactly(tempDir.resolve("suite"), tempDir.resolve("suite/nested"));
    }

    @Test
    void subdirectories_unreadableDirectory_keepsSiblings() throws IOException {
        assumeTrue(FileSystems.getDefault().supportedFileAttributeViews().contains("posix"));
        Path locked = Files.createDirectories(tempDir.resolve("locked/deep")).getParent();
        Files.setPosixFilePermissions(locked, PosixFilePermissions.fromString("---------"));
        try {
            assumeTrue(!Files.isReadable(locked), "directory permissions are not enforced for this user");

            List<Path> directories = FileUtils.subdirectories(tempDir);

            assertThat(directories).containsExactly(
                locked,
                tempDir.resolve("suite"),
                tempDir.resolve("suite/nested"));
        } finally {
            Files.setPosixFilePermissions(locked, PosixFilePermissions.fromString("rwx------"));
        }
    }

    @Test
    void nameMatchesAny_testsFileNameOnly() {
        List<String> patterns = List.of("test_*.py", "*.szn");

        assertThat(FileUtils.nameMatchesAny(Path.of("/x/test_ping.py"), patterns)).isTrue();
        assertThat(FileUtils.nameMatchesAny(Path.of("/x/topology.szn"), patterns)).isTrue();
        assertThat(FileUtils.nameMatchesAny(Path.of("/test_dir/ping.py"), patterns)).isFalse();
    }

    @Test
    void getExtension_returnsSuffixWithoutDot() {
        assertThat(FileUtils.getExtension(Path.of("test_a.py"))).isEqualTo("py");
        assertThat(FileUtils.getExtension(Path.of("Makefile"))).isEmpty();
        assertThat(FileUtils.getExtension(Path.of(".hidden"))).isEmpty();
    }
}
