package dev.nuclr.photo.viewer.decode;

/**
 * EXIF orientation codes and the clockwise rotation each one needs.
 *
 * <p>The mirrored variants (2, 4, 5, 7) only contribute their rotation; the
 * horizontal flip is not applied.
 */
public enum Orientation {
    NORMAL(1, 0, false),
    MIRROR_HORIZONTAL(2, 0, true),
    ROTATE_180(3, 180, false),
    MIRROR_VERTICAL(4, 180, true),
    TRANSPOSE(5, 90, true),
    ROTATE_90(6, 90, false),
    TRANSVERSE(7, 270, true),
    ROTATE_270(8, 270, false);

    private final int exifValue;
    private final int degrees;
    private final boolean mirrored;

    Orientation(int exifValue, int degrees, boolean mirrored) {
        this.exifValue = exifValue;
        this.degrees = degrees;
        this.mirrored = mirrored;
    }

    public int exifValue() {
        return exifValue;
    }

    /** Clockwise rotation in degrees: 0, 90, 180 or 270. */
    public int degrees() {
        return degrees;
    }

    public boolean isMirrored() {
        return mirrored;
    }

    public boolean swapsDimensions() {
        return degrees % 180 != 0;
    }

    /** Unknown values map to {@link #NORMAL}. */
    public static Orientation fromExif(int value) {
        for (Orientation o : values()) {
            if (o.exifValue == value) return o;
        }
        return NORMAL;
    }
}
