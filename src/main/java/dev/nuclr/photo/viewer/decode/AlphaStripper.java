package dev.nuclr.photo.viewer.decode;

import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;

/**
 * Converts 4-byte-per-pixel images to {@link BufferedImage#TYPE_3BYTE_BGR},
 * saving a quarter of the raster memory for photos that never use alpha.
 */
public final class AlphaStripper {

    private AlphaStripper() {}

    /** True for rasters that store four bytes per pixel. */
    public static boolean isFourBytePerPixel(BufferedImage image) {
        return switch (image.getType()) {
            case BufferedImage.TYPE_INT_ARGB,
                 BufferedImage.TYPE_INT_ARGB_PRE,
                 BufferedImage.TYPE_INT_RGB,
                 BufferedImage.TYPE_INT_BGR,
                 BufferedImage.TYPE_4BYTE_ABGR,
                 BufferedImage.TYPE_4BYTE_ABGR_PRE -> true;
            default -> false;
        };
    }

    /**
     * Copy {@code source} row by row into a 3-byte BGR image. Channel order is
     * taken from the source colour model, so ARGB, ABGR and premultiplied
     * layouts all convert correctly. Other formats are returned unchanged.
     *
     * <p>When a copy is made the source is flushed.
     */
    public static BufferedImage strip(BufferedImage source) {
        if (!isFourBytePerPixel(source)) return source;

        int w = source.getWidth();
        int h = source.getHeight();
        BufferedImage target = new BufferedImage(w, h, BufferedImage.TYPE_3BYTE_BGR);
        byte[] dst = ((DataBufferByte) target.getRaster().getDataBuffer()).getData();

        int[] row = new int[w];
        for (int y = 0; y < h; y++) {
            source.getRGB(0, y, w, 1, row, 0, w);
            int o = y * w * 3;
            for (int x = 0; x < w; x++) {
                int argb = row[x];
                dst[o++] = (byte) argb;          // B
                dst[o++] = (byte) (argb >> 8);   // G
                dst[o++] = (byte) (argb >> 16);  // R
            }
        }
        source.flush();
        return target;
    }
}
