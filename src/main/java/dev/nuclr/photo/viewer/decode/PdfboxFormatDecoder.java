package dev.nuclr.photo.viewer.decode;

import dev.nuclr.photo.viewer.ImageFile;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import java.util.Set;

/**
 * Shows the first page of a PDF as a photo, rendered with Apache PDFBox 3.x.
 * Every call opens and closes its own document, so instances are thread-safe.
 */
@Slf4j
public class PdfboxFormatDecoder implements FormatDecoder {

    private static final Set<String> EXTENSIONS = Set.of("pdf");

    private final float dpi;

    public PdfboxFormatDecoder(float dpi) {
        if (dpi <= 0) throw new IllegalArgumentException("dpi must be positive: " + dpi);
        this.dpi = dpi;
    }

    @Override
    public String name() {
        return "PDFBox";
    }

    @Override
    public boolean isSupported() {
        return true;
    }

    @Override
    public Set<String> extensions() {
        return EXTENSIONS;
    }

    @Override
    public BufferedImage decode(ImageFile file) throws Exception {
        try (PDDocument document = open(file)) {
            if (document.getNumberOfPages() == 0) return null;
            PDFRenderer renderer = new PDFRenderer(document);
            renderer.setSubsamplingAllowed(true);
            log.debug("PDFBox: rendering first page of {} at {} DPI", file.name(), dpi);
            return renderer.renderImageWithDPI(0, dpi, ImageType.RGB);
        }
    }

    @Override
    public BufferedImage decodeThumbnail(ImageFile file, int maxSize) throws Exception {
        try (PDDocument document = open(file)) {
            if (document.getNumberOfPages() == 0) return null;
            PDRectangle box = document.getPage(0).getCropBox();
            float longest = Math.max(box.getWidth(), box.getHeight());
            if (longest <= 0) return null;
            PDFRenderer renderer = new PDFRenderer(document);
            renderer.setSubsamplingAllowed(true);
            return renderer.renderImage(0, maxSize / longest, ImageType.RGB);
        }
    }

    private static PDDocument open(ImageFile file) throws IOException {
        byte[] pdfBytes;
        try (InputStream in = file.openStream()) {
            pdfBytes = in.readAllBytes();
        }
        try {
            return Loader.loadPDF(pdfBytes);
        } catch (InvalidPasswordException e) {
            throw new IOException("Encrypted PDF \u2013 cannot preview " + file.name(), e);
        }
    }
}
