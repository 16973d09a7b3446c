package com.bookforge.core.renderer;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Objects;

/**
 * Opaque bytes produced by an external tool (PDF).
 *
 * @param mediaType media type of the bytes
 * @param bytes content
 */
public record BinaryArtifact(String mediaType, byte[] bytes) implements RenderedArtifact {

    public BinaryArtifact {
        Objects.requireNonNull(mediaType, "mediaType must not be null");
        Objects.requireNonNull(bytes, "bytes must not be null");
    }

    @Override
    public void writeTo(OutputStream out) throws IOException {
        out.write(bytes);
    }
}
