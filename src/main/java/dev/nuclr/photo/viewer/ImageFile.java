package dev.nuclr.photo.viewer;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Handle to an image on disk as seen by the cache.
 *
 * <p>The cache key is the normalized absolute path, so two handles for the
 * same file always resolve to the same entry.
 */
public interface ImageFile {

    /** File name for logging, e.g. {@code IMG_0001.JPG}. */
    String name();

    Path path();

    /** Open a fresh stream over the file contents. The caller closes it. */
    InputStream openStream() throws IOException;

    /** Lower-case extension without the dot, or an empty string. */
    default String extension() {
        String n = name();
        int dot = n.lastIndexOf('.');
        return dot < 0 ? "" : n.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    default String cacheKey() {
        return keyOf(path());
    }

    static String keyOf(Path path) {
        return path.toAbsolutePath().normalize().toString();
    }
}
