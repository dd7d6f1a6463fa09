package dev.nuclr.photo.viewer.decode;

import dev.nuclr.photo.viewer.ImageFile;

import java.awt.image.BufferedImage;
import java.util.Set;

/**
 * Claims the HEIF family of extensions without being able to decode them.
 *
 * <p>Installed by default so HEIF files are recognised and fail cleanly
 * instead of reaching ImageIO. A platform decoder replaces it when available.
 */
public class HeifFormatDecoder implements FormatDecoder {

    private static final Set<String> EXTENSIONS = Set.of("heif", "heic", "hif", "avif");

    @Override
    public String name() {
        return "HEIF (unsupported)";
    }

    @Override
    public boolean isSupported() {
        return false;
    }

    @Override
    public Set<String> extensions() {
        return EXTENSIONS;
    }

    @Override
    public BufferedImage decode(ImageFile file) {
        return null;
    }

    @Override
    public BufferedImage decodeThumbnail(ImageFile file, int maxSize) {
        return null;
    }
}
