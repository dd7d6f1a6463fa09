package dev.nuclr.photo.viewer.cache;

import dev.nuclr.photo.viewer.ImageFile;
import dev.nuclr.photo.viewer.metadata.ImageDimensions;
import dev.nuclr.photo.viewer.metadata.MetadataProvider;
import lombok.extern.slf4j.Slf4j;

import java.util.function.BooleanSupplier;

/**
 * Predicts the decoded footprint of a file before decoding it:
 * header dimensions first, then the average cached entry, then a flat 100 MB.
 */
@Slf4j
public class SizeEstimator {

    public static final long FALLBACK_BYTES = 100L * 1024 * 1024;

    private final MetadataProvider metadata;
    private final EntryTable table;
    private final BooleanSupplier stripAlpha;

    SizeEstimator(MetadataProvider metadata, EntryTable table, BooleanSupplier stripAlpha) {
        this.metadata = metadata;
        this.table = table;
        this.stripAlpha = stripAlpha;
    }

    public long estimate(ImageFile file) {
        try {
            ImageDimensions dims = metadata.dimensions(file);
            if (dims != null && dims.isValid()) {
                return dims.pixelCount() * bytesPerPixel();
            }
        } catch (Exception e) {
            log.debug("Dimension lookup failed for {}: {}", file.name(), e.getMessage());
        }

        long avg = averageEntrySize();
        if (avg > 0) return avg;

        return FALLBACK_BYTES;
    }

    int bytesPerPixel() {
        return stripAlpha.getAsBoolean() ? 3 : 4;
    }

    private long averageEntrySize() {
        int count = table.count();
        if (count <= 0) return 0;
        long total = table.sizeBytes();
        return total <= 0 ? 0 : total / count;
    }
}
