package io.deskscale.util;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Properties;

public final class AtomicWrites {

    private AtomicWrites() {}

    /**
     * Replaces the content of {@code targetPath} so that readers see either the old or the new content, never a
     * partial write. The data goes to a sibling temp file which is then moved over the target.
     *
     * @throws IOException if writing or moving fails; the temp file is removed in that case
     */
    public static void atomicOverwrite(Path targetPath, String content) throws IOException {
        var dir = targetPath.toAbsolutePath().getParent();
        Files.createDirectories(dir);
        Path tempFile = Files.createTempFile(dir, "." + targetPath.getFileName(), ".tmp");
        try {
            Files.writeString(tempFile, content, StandardCharsets.UTF_8);
            try {
                Files.move(
                        tempFile, targetPath, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tempFile, targetPath, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            Files.deleteIfExists(tempFile);
            throw e;
        }
    }

    /** Serializes {@code properties} and writes them with {@link #atomicOverwrite(Path, String)}. */
    public static void atomicSaveProperties(Path path, Properties properties, String comment) throws IOException {
        var writer = new StringWriter();
        properties.store(writer, comment);
        atomicOverwrite(path, writer.toString());
    }
}
