package dev.nuclr.photo.viewer;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * {@link ImageFile} backed by the default file system.
 */
public record LocalImageFile(Path path) implements ImageFile {

    public LocalImageFile {
        Objects.requireNonNull(path, "path");
    }

    public static LocalImageFile of(String path) {
        return new LocalImageFile(Path.of(path));
    }

    @Override
    public String name() {
        Path fileName = path.getFileName();
        return fileName != null ? fileName.toString() : path.toString();
    }

    @Override
    public InputStream openStream() throws IOException {
        return Files.newInputStream(path);
    }
}
