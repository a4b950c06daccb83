package com.ttennebkram.imagelab.render;

import com.ttennebkram.imagelab.config.ImageLabSettings;
import com.ttennebkram.imagelab.raster.MatConversions;
import com.ttennebkram.imagelab.raster.RasterBuffer;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.graphics.image.LosslessFactory;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;

import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * Writes one image as the only content of a one-page PDF.
 *
 * Page geometry comes from configuration: either the page is sized to the
 * image at the configured DPI, or a fixed A4/Letter page is used and the
 * image is scaled to fit inside the margins and centered.
 */
class PdfImageWriter {

    private static final float POINTS_PER_INCH = 72f;

    private final ImageLabSettings.PageSize pageSize;
    private final float margin;
    private final float dpi;

    PdfImageWriter(ImageLabSettings settings) {
        this.pageSize = settings.getPdfPageSize();
        this.margin = settings.getPdfMargin();
        this.dpi = settings.getPdfDpi();
    }

    byte[] write(RasterBuffer buffer) throws IOException {
        BufferedImage image = MatConversions.toBufferedImage(buffer);
        float imageWidth = buffer.width() * POINTS_PER_INCH / dpi;
        float imageHeight = buffer.height() * POINTS_PER_INCH / dpi;

        PDRectangle pageBox;
        switch (pageSize) {
            case A4:
                pageBox = PDRectangle.A4;
                break;
            case LETTER:
                pageBox = PDRectangle.LETTER;
                break;
            default:
                pageBox = new PDRectangle(imageWidth + 2 * margin, imageHeight + 2 * margin);
                break;
        }

        float availableWidth = pageBox.getWidth() - 2 * margin;
        float availableHeight = pageBox.getHeight() - 2 * margin;
        if (availableWidth <= 0 || availableHeight <= 0) {
            throw new IllegalStateException("PDF margin " + margin + "pt leaves no room on a "
                    + pageSize + " page");
        }
        float scale = Math.min(availableWidth / imageWidth, availableHeight / imageHeight);
        float drawWidth = imageWidth * scale;
        float drawHeight = imageHeight * scale;
        float x = (pageBox.getWidth() - drawWidth) / 2;
        float y = (pageBox.getHeight() - drawHeight) / 2;

        try (PDDocument document = new PDDocument()) {
            PDPage page = new PDPage(pageBox);
            document.addPage(page);
            PDImageXObject embedded = LosslessFactory.createFromImage(document, image);
            try (PDPageContentStream content = new PDPageContentStream(document, page)) {
                content.drawImage(embedded, x, y, drawWidth, drawHeight);
            }
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            document.save(out);
            return out.toByteArray();
        }
    }
}
