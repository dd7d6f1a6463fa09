package dev.nuclr.photo.viewer.decode;

import dev.nuclr.photo.viewer.ImageFile;
import dev.nuclr.photo.viewer.metadata.MetadataProvider;
import lombok.extern.slf4j.Slf4j;

import javax.imageio.ImageIO;
import javax.imageio.ImageReadParam;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.InputStream;
import java.util.Iterator;
import java.util.List;

/**
 * Decodes a file into a display-ready bitmap.
 *
 * <p>Files whose extension is claimed by a {@link FormatDecoder} go to that
 * decoder; everything else is read with ImageIO. The result is rotated
 * according to the EXIF orientation and, when enabled, converted to a
 * 3-byte-per-pixel layout.
 *
 * <p>Nothing escapes {@link #decode}: failures are logged and return null.
 */
@Slf4j
public class DecodePipeline implements ImageDecoder {

    public static final int DEFAULT_THUMBNAIL_SIZE = 120;

    private final MetadataProvider metadata;
    private final List<FormatDecoder> formatDecoders;

    private volatile boolean stripAlpha;

    public DecodePipeline(MetadataProvider metadata, List<FormatDecoder> formatDecoders, boolean stripAlpha) {
        this.metadata = metadata;
        this.formatDecoders = List.copyOf(formatDecoders);
        this.stripAlpha = stripAlpha;
    }

    @Override
    public boolean isStripAlpha() {
        return stripAlpha;
    }

    public void setStripAlpha(boolean stripAlpha) {
        this.stripAlpha = stripAlpha;
    }

    // ------------------------------------------------------------ full decode

    @Override
    public BufferedImage decode(ImageFile file) {
        try {
            BufferedImage original = decodeSource(file);
            if (original == null) {
                log.warn("No decodable image in {}", file.name());
                return null;
            }
            if (original.getWidth() <= 0 || original.getHeight() <= 0) {
                log.warn("Invalid bitmap size {}x{} in {}", original.getWidth(), original.getHeight(), file.name());
                original.flush();
                return null;
            }

            Orientation orientation = Orientation.fromExif(readOrientation(file));
            if (orientation.degrees() == 0) {
                return finish(original);
            }

            BufferedImage rotated = rotate(original, orientation.degrees());
            original.flush();
            return finish(rotated);
        } catch (Exception e) {
            log.error("Failed to decode image ({})", file.name(), e);
            return null;
        }
    }

    /** Route to a format decoder or ImageIO. Null means the format is not readable. */
    private BufferedImage decodeSource(ImageFile file) throws Exception {
        FormatDecoder special = findFormatDecoder(file);
        if (special != null) {
            if (!special.isSupported()) {
                log.info("{} decoder not available; cannot show {}", special.name(), file.name());
                return null;
            }
            return special.decode(file);
        }
        try (InputStream in = file.openStream()) {
            return ImageIO.read(in);
        }
    }

    private int readOrientation(ImageFile file) {
        try {
            return metadata.orientation(file);
        } catch (Exception e) {
            log.warn("Failed to read EXIF orientation for {}: {}", file.name(), e.getMessage());
            return 1;
        }
    }

    private BufferedImage finish(BufferedImage image) {
        return stripAlpha ? AlphaStripper.strip(image) : image;
    }

    // ---------------------------------------------------------------- rotation

    /**
     * Render {@code source} rotated clockwise by {@code degrees} into a new canvas.
     * Dimensions are swapped for 90 and 270.
     */
    static BufferedImage rotate(BufferedImage source, int degrees) {
        int w = source.getWidth();
        int h = source.getHeight();
        boolean swap = degrees % 180 != 0;
        int newW = swap ? h : w;
        int newH = swap ? w : h;

        BufferedImage target = new BufferedImage(newW, newH, canvasType(source));
        Graphics2D g2 = target.createGraphics();
        try {
            g2.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_NEAREST_NEIGHBOR);
            g2.translate(newW / 2.0, newH / 2.0);
            g2.rotate(Math.toRadians(degrees));
            g2.translate(-w / 2.0, -h / 2.0);
            g2.drawImage(source, 0, 0, null);
        } finally {
            g2.dispose();
        }
        return target;
    }

    private static int canvasType(BufferedImage source) {
        return switch (source.getType()) {
            case BufferedImage.TYPE_CUSTOM,
                 BufferedImage.TYPE_BYTE_INDEXED,
                 BufferedImage.TYPE_BYTE_BINARY ->
                    source.getColorModel().hasAlpha() ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB;
            default -> source.getType();
        };
    }

    // -------------------------------------------------------------- thumbnails

    /**
     * Decode a reduced image whose longer side is at most {@code maxSize} pixels.
     * Orientation is applied; alpha stripping is not. Returns null on failure.
     */
    public BufferedImage decodeThumbnail(ImageFile file, int maxSize) {
        int bound = maxSize > 0 ? maxSize : DEFAULT_THUMBNAIL_SIZE;
        try {
            BufferedImage thumb;
            FormatDecoder special = findFormatDecoder(file);
            if (special != null) {
                if (!special.isSupported()) return null;
                thumb = special.decodeThumbnail(file, bound);
            } else {
                thumb = readSubsampled(file, bound);
            }
            if (thumb == null || thumb.getWidth() <= 0 || thumb.getHeight() <= 0) return null;

            thumb = fitInside(thumb, bound);
            Orientation orientation = Orientation.fromExif(readOrientation(file));
            if (orientation.degrees() == 0) return thumb;
            BufferedImage rotated = rotate(thumb, orientation.degrees());
            thumb.flush();
            return rotated;
        } catch (Exception e) {
            log.error("Failed to decode thumbnail ({})", file.name(), e);
            return null;
        }
    }

    private static BufferedImage readSubsampled(ImageFile file, int bound) throws Exception {
        try (InputStream in = file.openStream();
             ImageInputStream iis = ImageIO.createImageInputStream(in)) {
            if (iis == null) return null;
            Iterator<ImageReader> readers = ImageIO.getImageReaders(iis);
            if (!readers.hasNext()) return null;
            ImageReader reader = readers.next();
            try {
                reader.setInput(iis, true, true);
                int longest = Math.max(reader.getWidth(0), reader.getHeight(0));
                ImageReadParam param = reader.getDefaultReadParam();
                int step = Math.max(1, longest / bound);
                param.setSourceSubsampling(step, step, 0, 0);
                return reader.read(0, param);
            } finally {
                reader.dispose();
            }
        }
    }

    /** Scale down so the longer side equals {@code bound}; never upscale. */
    private static BufferedImage fitInside(BufferedImage image, int bound) {
        int w = image.getWidth();
        int h = image.getHeight();
        double scale = Math.min(1.0, (double) bound / Math.max(w, h));
        if (scale >= 1.0) return image;

        int drawW = Math.max(1, (int) Math.round(w * scale));
        int drawH = Math.max(1, (int) Math.round(h * scale));
        BufferedImage scaled = new BufferedImage(drawW, drawH, canvasType(image));
        Graphics2D g2 = scaled.createGraphics();
        try {
            g2.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g2.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g2.drawImage(image, 0, 0, drawW, drawH, null);
        } finally {
            g2.dispose();
        }
        image.flush();
        return scaled;
    }

    private FormatDecoder findFormatDecoder(ImageFile file) {
        for (FormatDecoder decoder : formatDecoders) {
            if (decoder.handles(file)) return decoder;
        }
        return null;
    }
}
