package com.bookforge.core.renderer;

import java.io.IOException;
import java.io.OutputStream;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.zip.CRC32;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * A ZIP container with ordered entries (EPUB, ODT).
 *
 * <p>Entries are written in list order, so a stored {@code mimetype} entry placed first
 * ends up as the first local file header, as both formats require.
 *
 * @param mediaType media type of the container
 * @param entries ordered entries with unique paths
 */
public record ContainerArtifact(String mediaType, List<ContainerEntry> entries) implements RenderedArtifact {

    public ContainerArtifact {
        Objects.requireNonNull(mediaType, "mediaType must not be null");
        entries = entries == null ? List.of() : List.copyOf(entries);
        Set<String> seen = new HashSet<>();
        for (ContainerEntry entry : entries) {
            if (!seen.add(entry.path())) {
                throw new IllegalArgumentException("duplicate container entry: " + entry.path());
            }
        }
    }

    /**
     * Finds an entry by path.
     *
     * @param path entry path
     * @return entry if present
     */
    public Optional<ContainerEntry> entry(String path) {
        return entries.stream().filter(entry -> entry.path().equals(path)).findFirst();
    }

    public List<String> paths() {
        return entries.stream().map(ContainerEntry::path).toList();
    }

    @Override
    public void writeTo(OutputStream out) throws IOException {
        ZipOutputStream zip = new ZipOutputStream(out);
        for (ContainerEntry entry : entries) {
            ZipEntry zipEntry = new ZipEntry(entry.path());
            if (entry.stored()) {
                CRC32 crc = new CRC32();
                crc.update(entry.bytes());
                zipEntry.setMethod(ZipEntry.STORED);
                zipEntry.setSize(entry.bytes().length);
                zipEntry.setCompressedSize(entry.bytes().length);
                zipEntry.setCrc(crc.getValue());
            } else {
                zipEntry.setMethod(ZipEntry.DEFLATED);
            }
            zip.putNextEntry(zipEntry);
            zip.write(entry.bytes());
            zip.closeEntry();
        }
        zip.finish();
    }
}
