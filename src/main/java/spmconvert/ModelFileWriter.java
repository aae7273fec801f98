package spmconvert;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.util.UUID;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Writes a file all-or-nothing.
 *
 * <p>The bytes go to a temporary file next to the target, which is then moved over
 * the target. A failed write leaves any existing target untouched. A new file gets
 * the same permissions as any file created with {@link Files#write}; a replaced file
 * keeps its POSIX permissions.</p>
 */
public final class ModelFileWriter {
    private static final Logger LOGGER = ConverterLogging.getLogger(ModelFileWriter.class);

    private ModelFileWriter() {
    }

    /**
     * Replaces {@code target} with {@code bytes}, creating missing parent directories.
     *
     * @param target the file to write
     * @param bytes  the complete file content
     * @throws IOException if a directory cannot be created or the file cannot be written
     */
    public static void write(Path target, byte[] bytes) throws IOException {
        Path absolute = target.toAbsolutePath();
        Path dir = absolute.getParent();
        if (dir != null && !Files.isDirectory(dir)) {
            Files.createDirectories(dir);
        }

        Path temp = absolute.resolveSibling("." + absolute.getFileName() + "." + UUID.randomUUID() + ".tmp");
        try {
            Files.write(temp, bytes, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            copyPermissions(absolute, temp);
            try {
                Files.move(temp, absolute, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING);
            }
            LOGGER.info(() -> "Wrote " + bytes.length + " bytes to " + absolute);
        } finally {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException e) {
                LOGGER.log(Level.WARNING, "Failed to delete temp file " + temp, e);
            }
        }
    }

    private static void copyPermissions(Path from, Path to) throws IOException {
        if (!Files.exists(from) || Files.getFileAttributeView(from, PosixFileAttributeView.class) == null) {
            return;
        }
        Files.setPosixFilePermissions(to, Files.getPosixFilePermissions(from));
    }
}
