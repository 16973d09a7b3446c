package com.bookforge.core.renderer;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * A UTF-8 text buffer (HTML, LaTeX).
 *
 * @param mediaType media type of the text
 * @param content text content
 */
public record TextArtifact(String mediaType, String content) implements RenderedArtifact {

    public TextArtifact {
        Objects.requireNonNull(mediaType, "mediaType must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }

    @Override
    public void writeTo(OutputStream out) throws IOException {
        out.write(content.getBytes(StandardCharsets.UTF_8));
    }
}
