package dev.nuclr.photo.viewer.metadata;

import com.drew.imaging.ImageMetadataReader;
import com.drew.metadata.Metadata;
import com.drew.metadata.exif.ExifIFD0Directory;
import dev.nuclr.photo.viewer.ImageFile;
import lombok.extern.slf4j.Slf4j;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.io.InputStream;
import java.util.Iterator;

/**
 * Default metadata provider.
 *
 * <p>Orientation is read with metadata-extractor, which finds the EXIF IFD0 in
 * every container it understands (JPEG, PNG, TIFF, WebP, HEIF and camera raw).
 * Dimensions come from the ImageIO reader's header parse, so they are only
 * available for formats the JDK can read.
 */
@Slf4j
public class ImageMetadataProvider implements MetadataProvider {

    @Override
    public int orientation(ImageFile file) {
        try (InputStream in = file.openStream()) {
            Metadata metadata = ImageMetadataReader.readMetadata(in);
            ExifIFD0Directory ifd0 = metadata.getFirstDirectoryOfType(ExifIFD0Directory.class);
            if (ifd0 == null || !ifd0.containsTag(ExifIFD0Directory.TAG_ORIENTATION)) return 1;

            int value = ifd0.getInt(ExifIFD0Directory.TAG_ORIENTATION);
            return (value >= 1 && value <= 8) ? value : 1;
        } catch (Exception e) {
            log.debug("Could not read orientation of {}: {}", file.name(), e.getMessage());
            return 1;
        }
    }

    @Override
    public ImageDimensions dimensions(ImageFile file) {
        try (InputStream in = file.openStream();
             ImageInputStream iis = ImageIO.createImageInputStream(in)) {
            if (iis == null) return null;
            Iterator<ImageReader> readers = ImageIO.getImageReaders(iis);
            if (!readers.hasNext()) return null;
            ImageReader reader = readers.next();
            try {
                reader.setInput(iis, true, true);
                ImageDimensions dims = new ImageDimensions(reader.getWidth(0), reader.getHeight(0));
                return dims.isValid() ? dims : null;
            } finally {
                reader.dispose();
            }
        } catch (Exception e) {
            log.debug("Could not read dimensions of {}: {}", file.name(), e.getMessage());
            return null;
        }
    }
}
