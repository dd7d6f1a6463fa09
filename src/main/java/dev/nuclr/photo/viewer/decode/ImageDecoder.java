package dev.nuclr.photo.viewer.decode;

import dev.nuclr.photo.viewer.ImageFile;

import java.awt.image.BufferedImage;

/**
 * Turns a file into a display-ready bitmap.
 * Implementations never throw; failures are logged and reported as null.
 */
@FunctionalInterface
public interface ImageDecoder {

    BufferedImage decode(ImageFile file);

    /** Whether decoded images drop their alpha channel (3 bytes per pixel instead of 4). */
    default boolean isStripAlpha() {
        return false;
    }
}
