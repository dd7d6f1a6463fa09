package dev.nuclr.photo.viewer.metadata;

/**
 * Pixel dimensions read from a file header, before any decode.
 */
public record ImageDimensions(int width, int height) {

    public boolean isValid() {
        return width > 0 && height > 0;
    }

    public long pixelCount() {
        return (long) width * height;
    }
}
