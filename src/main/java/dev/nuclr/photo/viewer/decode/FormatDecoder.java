package dev.nuclr.photo.viewer.decode;

import dev.nuclr.photo.viewer.ImageFile;

import java.awt.image.BufferedImage;
import java.util.Locale;
import java.util.Set;

/**
 * Strategy interface for formats the standard ImageIO path cannot read.
 * Implementations must be safe to call from several worker threads at once.
 */
public interface FormatDecoder {

    /** Human-readable name for logging. */
    String name();

    /** Return true if this decoder can actually decode on the current system. */
    boolean isSupported();

    /** Lower-case extensions, without the dot, routed to this decoder. */
    Set<String> extensions();

    default boolean handles(ImageFile file) {
        String ext = file.extension();
        return ext != null && extensions().contains(ext.toLowerCase(Locale.ROOT));
    }

    /**
     * Decode the full image.
     *
     * @return the image, or null if the file holds nothing displayable
     * @throws Exception for I/O or format errors
     */
    BufferedImage decode(ImageFile file) throws Exception;

    /**
     * Decode a reduced image whose longer side does not exceed {@code maxSize}.
     */
    BufferedImage decodeThumbnail(ImageFile file, int maxSize) throws Exception;
}
