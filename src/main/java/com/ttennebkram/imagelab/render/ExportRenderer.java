package com.ttennebkram.imagelab.render;

import com.ttennebkram.imagelab.config.ImageLabSettings;
import com.ttennebkram.imagelab.errors.ImageLabException;
import com.ttennebkram.imagelab.errors.InvalidParameterException;
import com.ttennebkram.imagelab.errors.TransformFailedException;
import com.ttennebkram.imagelab.raster.RasterBuffer;
import com.ttennebkram.imagelab.raster.RasterCodec;
import org.opencv.core.Mat;
import org.opencv.core.MatOfInt;
import org.opencv.imgcodecs.Imgcodecs;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Re-encodes one buffer into a requested container.
 *
 * Raster formats go through the OpenCV encoders, which expect BGR order, so
 * buffers are passed as-is apart from dropping alpha for formats that cannot
 * store it and converting between gray and BGR for the netpbm formats that
 * take only one layout. Quality only affects lossy formats. PDF export embeds the image
 * in a one-page document; failures there are reported, never downgraded.
 */
public class ExportRenderer {

    private static final Logger log = LoggerFactory.getLogger(ExportRenderer.class);

    private final int defaultQuality;
    private final PdfImageWriter pdfWriter;

    public ExportRenderer(ImageLabSettings settings) {
        this.defaultQuality = settings.getExportDefaultQuality();
        this.pdfWriter = new PdfImageWriter(settings);
    }

    public ExportedImage export(RasterBuffer buffer, String format) {
        return export(buffer, format, null);
    }

    /**
     * @param quality 0-100, or null for the configured default
     * @throws com.ttennebkram.imagelab.errors.UnsupportedFormatException if the format cannot be written
     * @throws InvalidParameterException if quality is out of range
     * @throws TransformFailedException if encoding fails
     */
    public ExportedImage export(RasterBuffer buffer, String format, Integer quality) {
        if (buffer == null) {
            throw new InvalidParameterException("image", "No image supplied");
        }
        int q = quality == null ? defaultQuality : quality;
        if (q < 0 || q > 100) {
            throw new InvalidParameterException("quality", "Parameter 'quality' must be between 0 and 100, got " + q);
        }
        ExportFormat target = ExportFormat.parse(format);

        byte[] content = target.isDocument() ? exportPdf(buffer) : exportRaster(buffer, target, q);
        log.debug("Exported {} as {} ({} bytes)", buffer, target, content.length);
        return new ExportedImage(content, target);
    }

    private byte[] exportRaster(RasterBuffer buffer, ExportFormat target, int quality) {
        RasterBuffer flattened = null;
        RasterBuffer source = buffer;
        int required = target.getRequiredChannels();
        if (required != ExportFormat.ANY_CHANNELS && buffer.channels() != required) {
            flattened = toChannels(buffer, required);
            source = flattened;
        } else if (buffer.hasAlpha() && !target.isAlphaSupported()) {
            flattened = buffer.withoutAlpha();
            source = flattened;
        }

        MatOfInt params = new MatOfInt();
        try {
            if (target.isLossy()) {
                int flag = "webp".equals(target.getExtension())
                        ? Imgcodecs.IMWRITE_WEBP_QUALITY
                        : Imgcodecs.IMWRITE_JPEG_QUALITY;
                // WebP treats 0 as invalid; 1 is its lowest quality
                int value = flag == Imgcodecs.IMWRITE_WEBP_QUALITY ? Math.max(1, quality) : quality;
                params.fromArray(flag, value);
            }
            return RasterCodec.encode(source, target.getExtension(), params);
        } finally {
            params.release();
            if (flattened != null) flattened.close();
        }
    }

    private static RasterBuffer toChannels(RasterBuffer buffer, int channels) {
        int code;
        if (channels == 1) {
            code = buffer.hasAlpha() ? Imgproc.COLOR_BGRA2GRAY : Imgproc.COLOR_BGR2GRAY;
        } else {
            code = buffer.isGrayscale() ? Imgproc.COLOR_GRAY2BGR : Imgproc.COLOR_BGRA2BGR;
        }
        Mat converted = new Mat();
        Imgproc.cvtColor(buffer.mat(), converted, code);
        return RasterBuffer.wrap(converted);
    }

    private byte[] exportPdf(RasterBuffer buffer) {
        try {
            return pdfWriter.write(buffer);
        } catch (IOException | RuntimeException e) {
            if (e instanceof ImageLabException) {
                throw (ImageLabException) e;
            }
            throw new TransformFailedException("PDF export failed: " + e.getMessage(), e);
        }
    }
}
