package com.example.guardianintake.service.ocr;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.Graphics2D;
import java.awt.Image;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Rasterizes PDF pages for the image-based engines.
 */
@Component
public class PdfPageRenderer {

    private static final Logger logger = LoggerFactory.getLogger(PdfPageRenderer.class);

    @Value("${ocr.render.dpi:300}")
    private int dpi;

    @Value("${ocr.render.max-pages:2}")
    private int maxPages;

    @Value("${ocr.render.max-image-dimension:3000}")
    private int maxImageDimension;

    public List<BufferedImage> renderPages(byte[] pdfBytes) throws IOException {
        List<BufferedImage> images = new ArrayList<>();
        try (PDDocument document = Loader.loadPDF(pdfBytes)) {
            PDFRenderer renderer = new PDFRenderer(document);
            int pages = Math.min(document.getNumberOfPages(), Math.max(1, maxPages));
            for (int i = 0; i < pages; i++) {
                BufferedImage image = renderer.renderImageWithDPI(i, dpi, ImageType.RGB);
                images.add(scaleDown(image));
            }
            logger.debug("Rendered {} of {} pages at {} DPI", pages, document.getNumberOfPages(), dpi);
        }
        return images;
    }

    public byte[] toPng(BufferedImage image) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(image, "png", out);
        return out.toByteArray();
    }

    /**
     * Grayscale copy; Tesseract reads handwriting slightly better without colour noise.
     */
    public BufferedImage toGrayscale(BufferedImage image) {
        BufferedImage gray = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_BYTE_GRAY);
        Graphics2D g = gray.createGraphics();
        try {
            g.drawImage(image, 0, 0, null);
        } finally {
            g.dispose();
        }
        return gray;
    }

    private BufferedImage scaleDown(BufferedImage image) {
        int width = image.getWidth();
        int height = image.getHeight();
        if (width <= maxImageDimension && height <= maxImageDimension) {
            return image;
        }

        double scale = Math.min((double) maxImageDimension / width, (double) maxImageDimension / height);
        int newWidth = (int) (width * scale);
        int newHeight = (int) (height * scale);
        logger.debug("Scaling page image from {}x{} to {}x{}", width, height, newWidth, newHeight);

        BufferedImage scaled = new BufferedImage(newWidth, newHeight, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = scaled.createGraphics();
        try {
            g.drawImage(image.getScaledInstance(newWidth, newHeight, Image.SCALE_SMOOTH), 0, 0, null);
        } finally {
            g.dispose();
        }
        return scaled;
    }
}
