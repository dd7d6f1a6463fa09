package dev.nuclr.photo.viewer;

import dev.nuclr.photo.viewer.metadata.ImageDimensions;
import dev.nuclr.photo.viewer.metadata.MetadataProvider;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Metadata provider answering from in-memory maps keyed by file name.
 */
public class FixedMetadata implements MetadataProvider {

    private final Map<String, ImageDimensions> dimensions = new ConcurrentHashMap<>();
    private final Map<String, Integer> orientations = new ConcurrentHashMap<>();
    private volatile ImageDimensions defaultDimensions;

    public FixedMetadata withDimensions(String name, int width, int height) {
        dimensions.put(name, new ImageDimensions(width, height));
        return this;
    }

    public FixedMetadata withDefaultDimensions(int width, int height) {
        defaultDimensions = new ImageDimensions(width, height);
        return this;
    }

    public FixedMetadata withOrientation(String name, int orientation) {
        orientations.put(name, orientation);
        return this;
    }

    @Override
    public int orientation(ImageFile file) {
        return orientations.getOrDefault(file.name(), 1);
    }

    @Override
    public ImageDimensions dimensions(ImageFile file) {
        return dimensions.getOrDefault(file.name(), defaultDimensions);
    }
}
