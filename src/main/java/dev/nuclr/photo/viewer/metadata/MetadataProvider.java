package dev.nuclr.photo.viewer.metadata;

import dev.nuclr.photo.viewer.ImageFile;

/**
 * Cheap metadata lookups used by the cache. Implementations must not decode
 * pixel data and must not throw; unknown values fall back to the defaults below.
 */
public interface MetadataProvider {

    /** EXIF orientation 1..8; 1 when absent or unreadable. */
    int orientation(ImageFile file);

    /** Header dimensions, or null when they cannot be read cheaply. */
    ImageDimensions dimensions(ImageFile file);

    /** Provider that knows nothing. */
    static MetadataProvider none() {
        return new MetadataProvider() {
            @Override
            public int orientation(ImageFile file) {
                return 1;
            }

            @Override
            public ImageDimensions dimensions(ImageFile file) {
                return null;
            }
        };
    }
}
