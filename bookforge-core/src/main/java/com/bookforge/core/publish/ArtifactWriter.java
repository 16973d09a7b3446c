package com.bookforge.core.publish;

import com.bookforge.core.renderer.RenderedArtifact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes rendered artifacts to the filesystem.
 *
 * <p>The artifact is first written to a temporary file next to the target, then moved
 * over the target, atomically where the filesystem supports it. A failed write never
 * leaves a partial file at the target path. Parent directories are created as needed
 * and an existing target is replaced.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * ArtifactWriter writer = new ArtifactWriter();
 * long size = writer.write(new TextArtifact("text/html", html), Paths.get("out/book.html"));
 * }</pre>
 */
public class ArtifactWriter {

    private static final Logger logger = LoggerFactory.getLogger(ArtifactWriter.class);

    /**
     * Writes an artifact to its output path.
     *
     * @param artifact rendered artifact
     * @param target output path
     * @return number of bytes written
     * @throws IllegalStateException if the artifact cannot be written
     */
    public long write(RenderedArtifact artifact, Path target) {
        Path absolute = target.toAbsolutePath().normalize();
        Path parentDir = absolute.getParent();
        logger.debug("Writing {} to: {}", artifact.mediaType(), absolute);

        Path temp = null;
        try {
            if (parentDir != null) {
                Files.createDirectories(parentDir);
            }
            temp = Files.createTempFile(parentDir, "." + absolute.getFileName(), ".tmp");
            try (OutputStream out = Files.newOutputStream(temp)) {
                artifact.writeTo(out);
            }
            long size = Files.size(temp);
            move(temp, absolute);
            temp = null;
            logger.info("Wrote file: {} ({} bytes)", absolute, size);
            return size;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write file: " + absolute, e);
        } finally {
            if (temp != null) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException e) {
                    logger.warn("Could not delete temporary file {}: {}", temp, e.getMessage());
                }
            }
        }
    }

    private static void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            logger.debug("Atomic move not supported for {}, replacing instead", target);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
