package com.bookforge.core.renderer;

import com.bookforge.core.book.Book;
import com.bookforge.core.error.RenderException;
import com.bookforge.core.error.ResourceNotFoundException;
import com.bookforge.core.token.Image;
import com.bookforge.core.token.Tokens;
import com.bookforge.core.util.FileUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Local images referenced by chapters, with the container entry names they are packaged under.
 *
 * <p>Remote images ({@code http}, {@code https}, {@code data}) are left as links.
 */
public final class ImageCatalog {

    /**
     * A local image.
     *
     * @param url source as written in the chapter
     * @param path resolved file
     * @param entryName name inside the container, e.g. {@code images/image_001.png}
     * @param mediaType media type guessed from the extension
     */
    public record ImageResource(String url, Path path, String entryName, String mediaType) {
    }

    private final Map<String, ImageResource> images;

    private ImageCatalog(Map<String, ImageResource> images) {
        this.images = images;
    }

    /**
     * Collects every local image of a book in order of first use.
     *
     * @param book book whose directory images resolve against
     * @param chapters resolved chapters
     * @param prefix entry name prefix, e.g. {@code images/}
     * @return catalog
     */
    public static ImageCatalog collect(Book book, List<ResolvedChapter> chapters, String prefix) {
        Map<String, ImageResource> images = new LinkedHashMap<>();
        for (ResolvedChapter chapter : chapters) {
            Tokens.walk(chapter.chapter().content(), token -> {
                if (token instanceof Image image && !image.isRemote() && !images.containsKey(image.url())) {
                    String extension = FileUtils.getExtension(image.url()).toLowerCase(Locale.ROOT);
                    String entryName = String.format("%simage_%03d%s", prefix, images.size() + 1,
                        extension.isEmpty() ? "" : "." + extension);
                    images.put(image.url(), new ImageResource(image.url(), book.resolve(image.url()),
                        entryName, FileUtils.imageMediaType(image.url())));
                }
            });
        }
        return new ImageCatalog(images);
    }

    public Optional<ImageResource> lookup(String url) {
        return Optional.ofNullable(images.get(url));
    }

    public List<ImageResource> images() {
        return new ArrayList<>(images.values());
    }

    public boolean isEmpty() {
        return images.isEmpty();
    }

    /**
     * Reads a required file for packaging.
     *
     * @param path file to read
     * @param format format id for error messages
     * @return file bytes
     * @throws RenderException if the file is missing or unreadable
     */
    public static byte[] readRequired(Path path, String format) throws RenderException {
        try {
            return Files.readAllBytes(path);
        } catch (NoSuchFileException e) {
            throw new RenderException(format, "missing resource: " + path, new ResourceNotFoundException(path, e));
        } catch (IOException e) {
            throw new RenderException(format, "could not read resource " + path, e);
        }
    }
}
