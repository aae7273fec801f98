package spmconvert;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class ModelFileWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void testCreatesMissingParentDirectories() throws Exception {
        Path target = tempDir.resolve("a/b/c/out.model");
        ModelFileWriter.write(target, new byte[]{1, 2, 3});
        assertArrayEquals(new byte[]{1, 2, 3}, Files.readAllBytes(target));
    }

    @Test
    void testReplacesExistingFileWholesale() throws Exception {
        Path target = tempDir.resolve("out.model");
        Files.write(target, new byte[]{9, 9, 9, 9, 9, 9});
        ModelFileWriter.write(target, new byte[]{1, 2});
        assertArrayEquals(new byte[]{1, 2}, Files.readAllBytes(target));
    }

    @Test
    void testLeavesNoTemporaryFiles() throws Exception {
        ModelFileWriter.write(tempDir.resolve("out.model"), new byte[]{1});
        try (Stream<Path> files = Files.list(tempDir)) {
            assertEquals(1, files.count());
        }
    }

    @Test
    void testNewFileGetsDefaultPermissions() throws Exception {
        assumeTrue(Files.getFileAttributeView(tempDir, PosixFileAttributeView.class) != null);
        Path reference = tempDir.resolve("reference.bin");
        Files.write(reference, new byte[]{1});

        Path target = tempDir.resolve("out.model");
        ModelFileWriter.write(target, new byte[]{1});
        assertEquals(Files.getPosixFilePermissions(reference), Files.getPosixFilePermissions(target));
    }

    @Test
    void testReplacedFileKeepsItsPermissions() throws Exception {
        assumeTrue(Files.getFileAttributeView(tempDir, PosixFileAttributeView.class) != null);
        Path target = tempDir.resolve("out.model");
        Files.write(target, new byte[]{9});
        Files.setPosixFilePermissions(target, PosixFilePermissions.fromString("rw-r-----"));

        ModelFileWriter.write(target, new byte[]{1, 2});
        assertEquals("rw-r-----", PosixFilePermissions.toString(Files.getPosixFilePermissions(target)));

        Files.setPosixFilePermissions(target, PosixFilePermissions.fromString("rw-r--r--"));
        ModelFileWriter.write(target, new byte[]{3});
        assertEquals("rw-r--r--", PosixFilePermissions.toString(Files.getPosixFilePermissions(target)));
    }
}
