package com.bookforge.core.renderer;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Output of a renderer: a text buffer, a packaged container or raw bytes.
 *
 * @see TextArtifact
 * @see ContainerArtifact
 * @see BinaryArtifact
 */
public interface RenderedArtifact {

    /**
     * Returns the media type of the artifact.
     *
     * @return media type, e.g. {@code application/epub+zip}
     */
    String mediaType();

    /**
     * Serializes the artifact.
     *
     * @param out destination stream, not closed by this method
     * @throws IOException if writing fails
     */
    void writeTo(OutputStream out) throws IOException;
}
