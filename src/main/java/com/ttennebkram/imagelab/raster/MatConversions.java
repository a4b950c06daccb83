package com.ttennebkram.imagelab.raster;

import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;

/**
 * Conversions between OpenCV Mats and AWT images.
 */
public final class MatConversions {

    private MatConversions() {
    }

    /**
     * Copy a buffer into a BufferedImage. Grayscale maps to TYPE_BYTE_GRAY and
     * BGR to TYPE_3BYTE_BGR without reordering; alpha is dropped.
     */
    public static BufferedImage toBufferedImage(RasterBuffer buffer) {
        Mat mat = buffer.mat();
        int width = buffer.width();
        int height = buffer.height();

        int bufferedImageType;
        Mat converted;
        if (buffer.channels() == 1) {
            bufferedImageType = BufferedImage.TYPE_BYTE_GRAY;
            converted = mat;
        } else if (buffer.channels() == 3) {
            // BufferedImage stores 3BYTE_BGR in the same order as OpenCV
            bufferedImageType = BufferedImage.TYPE_3BYTE_BGR;
            converted = mat;
        } else {
            bufferedImageType = BufferedImage.TYPE_3BYTE_BGR;
            converted = new Mat();
            Imgproc.cvtColor(mat, converted, Imgproc.COLOR_BGRA2BGR);
        }

        try {
            if (!converted.isContinuous()) {
                Mat continuous = converted.clone();
                if (converted != mat) {
                    converted.release();
                }
                converted = continuous;
            }
            BufferedImage image = new BufferedImage(width, height, bufferedImageType);
            byte[] targetPixels = ((DataBufferByte) image.getRaster().getDataBuffer()).getData();
            converted.get(0, 0, targetPixels);
            return image;
        } finally {
            if (converted != mat) {
                converted.release();
            }
        }
    }
}
