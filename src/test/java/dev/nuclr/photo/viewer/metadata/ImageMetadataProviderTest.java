package dev.nuclr.photo.viewer.metadata;

import dev.nuclr.photo.viewer.LocalImageFile;
import dev.nuclr.photo.viewer.TestImages;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.CRC32;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

public class ImageMetadataProviderTest {

    private static final int TAG_ORIENTATION = 0x0112;
    private static final int TAG_MAKE = 0x010F;

    @TempDir
    Path dir;

    private final ImageMetadataProvider provider = new ImageMetadataProvider();

    /** Insert an APP1 segment right after the JFIF APP0 segment. */
    private static byte[] spliceApp1(byte[] jpeg, byte[] app1) {
        int app0Length = ((jpeg[4] & 0xFF) << 8) | (jpeg[5] & 0xFF);
        int insertAt = 4 + app0Length;
        int segmentLength = app1.length + 2;

        ByteArrayOutputStream out = new ByteArrayOutputStream(jpeg.length + app1.length + 4);
        out.write(jpeg, 0, insertAt);
        out.write(0xFF);
        out.write(0xE1);
        out.write((segmentLength >> 8) & 0xFF);
        out.write(segmentLength & 0xFF);
        out.write(app1, 0, app1.length);
        out.write(jpeg, insertAt, jpeg.length - insertAt);
        return out.toByteArray();
    }

    /** Insert an eXIf chunk right after the IHDR chunk (signature 8 bytes + IHDR 25 bytes). */
    private static byte[] spliceExif(byte[] png, byte[] tiff) {
        int insertAt = 8 + 25;
        byte[] type = "eXIf".getBytes(StandardCharsets.US_ASCII);
        CRC32 crc = new CRC32();
        crc.update(type);
        crc.update(tiff);
        long crcValue = crc.getValue();

        ByteArrayOutputStream out = new ByteArrayOutputStream(png.length + tiff.length + 12);
        out.write(png, 0, insertAt);
        writeInt(out, tiff.length);
        out.write(type, 0, type.length);
        out.write(tiff, 0, tiff.length);
        writeInt(out, (int) crcValue);
        out.write(png, insertAt, png.length - insertAt);
        return out.toByteArray();
    }

    private static void writeInt(ByteArrayOutputStream out, int value) {
        out.write((value >>> 24) & 0xFF);
        out.write((value >>> 16) & 0xFF);
        out.write((value >>> 8) & 0xFF);
        out.write(value & 0xFF);
    }

    private LocalImageFile jpegWith(byte[] app1) throws Exception {
        Path plain = TestImages.writeJpeg(dir, "plain.jpg", 32, 16);
        return new LocalImageFile(Files.write(dir.resolve("exif.jpg"), spliceApp1(Files.readAllBytes(plain), app1)));
    }

    @Test
    public void pngDimensionsFromHeader() throws Exception {
        LocalImageFile file = new LocalImageFile(TestImages.writePng(dir, "a.png", 64, 48));

        assertEquals(new ImageDimensions(64, 48), provider.dimensions(file));
        assertEquals(1, provider.orientation(file));
    }

    @Test
    public void jpegWithoutExifIsUpright() throws Exception {
        LocalImageFile file = new LocalImageFile(TestImages.writeJpeg(dir, "plain.jpg", 32, 16));

        assertEquals(new ImageDimensions(32, 16), provider.dimensions(file));
        assertEquals(1, provider.orientation(file));
    }

    @Test
    public void jpegMotorolaOrientationIsRead() throws Exception {
        LocalImageFile file = jpegWith(ExifSegments.app1(TAG_ORIENTATION, 6, ByteOrder.BIG_ENDIAN));

        assertEquals(6, provider.orientation(file));
        assertEquals(new ImageDimensions(32, 16), provider.dimensions(file));
    }

    @Test
    public void jpegIntelOrientationIsRead() throws Exception {
        LocalImageFile file = jpegWith(ExifSegments.app1(TAG_ORIENTATION, 8, ByteOrder.LITTLE_ENDIAN));

        assertEquals(8, provider.orientation(file));
    }

    @Test
    public void pngExifChunkOrientationIsRead() throws Exception {
        Path plain = TestImages.writePng(dir, "plain.png", 20, 10);
        byte[] withExif = spliceExif(Files.readAllBytes(plain), ExifSegments.tiff(TAG_ORIENTATION, 3, ByteOrder.BIG_ENDIAN));
        LocalImageFile file = new LocalImageFile(Files.write(dir.resolve("exif.png"), withExif));

        assertEquals(3, provider.orientation(file));
        assertEquals(new ImageDimensions(20, 10), provider.dimensions(file));
    }

    @Test
    public void exifWithoutOrientationTagIsUpright() throws Exception {
        LocalImageFile file = jpegWith(ExifSegments.app1(TAG_MAKE, 0, ByteOrder.LITTLE_ENDIAN));

        assertEquals(1, provider.orientation(file));
    }

    @Test
    public void outOfRangeOrientationIsUpright() throws Exception {
        LocalImageFile file = jpegWith(ExifSegments.app1(TAG_ORIENTATION, 9, ByteOrder.LITTLE_ENDIAN));

        assertEquals(1, provider.orientation(file));
    }

    @Test
    public void unreadableFilesFallBack() throws Exception {
        Path text = Files.writeString(dir.resolve("notes.jpg"), "plain text");
        LocalImageFile garbage = new LocalImageFile(text);
        LocalImageFile missing = new LocalImageFile(dir.resolve("missing.jpg"));

        assertNull(provider.dimensions(garbage));
        assertEquals(1, provider.orientation(garbage));
        assertNull(provider.dimensions(missing));
        assertEquals(1, provider.orientation(missing));
    }
}
