package com.ttennebkram.imagelab;

import com.ttennebkram.imagelab.raster.RasterBuffer;
import com.ttennebkram.imagelab.raster.RasterCodec;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Scalar;
import org.opencv.imgproc.Imgproc;

/**
 * Synthetic images shared by the tests.
 */
public final class TestImages {

    private TestImages() {
    }

    /**
     * A BGR image with a diagonal gradient and a filled circle, so filters
     * have edges and texture to work on.
     */
    public static RasterBuffer pattern(int width, int height) {
        Mat mat = new Mat(height, width, CvType.CV_8UC3);
        byte[] row = new byte[width * 3];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                row[x * 3] = (byte) ((x * 255) / Math.max(1, width - 1));
                row[x * 3 + 1] = (byte) ((y * 255) / Math.max(1, height - 1));
                row[x * 3 + 2] = (byte) (((x + y) * 7) & 0xFF);
            }
            mat.put(y, 0, row);
        }
        Imgproc.circle(mat, new Point(width / 2.0, height / 2.0), Math.min(width, height) / 4,
                new Scalar(255, 255, 255), -1);
        return RasterBuffer.wrap(mat);
    }

    public static RasterBuffer solid(int width, int height, int blue, int green, int red) {
        return RasterBuffer.filled(width, height, 3, new Scalar(blue, green, red));
    }

    public static RasterBuffer gray(int width, int height, int value) {
        return RasterBuffer.filled(width, height, 1, Scalar.all(value));
    }

    public static RasterBuffer withAlpha(int width, int height) {
        return RasterBuffer.filled(width, height, 4, new Scalar(10, 20, 30, 128));
    }

    public static byte[] png(RasterBuffer buffer) {
        return RasterCodec.encodePng(buffer);
    }

    public static byte[] pngPattern(int width, int height) {
        try (RasterBuffer buffer = pattern(width, height)) {
            return png(buffer);
        }
    }
}
