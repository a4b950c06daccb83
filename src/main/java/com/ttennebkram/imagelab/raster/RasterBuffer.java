package com.ttennebkram.imagelab.raster;

import com.ttennebkram.imagelab.errors.InvalidParameterException;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.opencv.imgproc.Imgproc;

import java.util.Arrays;

/**
 * A decoded image: width x height x channels of unsigned 8-bit samples in BGR order.
 *
 * Buffers are owned by whoever holds them for the duration of a call.
 * Operations never write into a buffer they are given; they return a new one.
 * A buffer may carry an alpha channel (4 channels) straight out of the decoder,
 * but only 1- and 3-channel buffers are handed to operations.
 */
public final class RasterBuffer implements AutoCloseable {

    static {
        OpenCvNatives.ensureLoaded();
    }

    private final Mat mat;

    private RasterBuffer(Mat mat) {
        this.mat = mat;
    }

    /**
     * Take ownership of a Mat. The Mat is released when the buffer is closed.
     *
     * @throws InvalidParameterException if the Mat is empty, not 8-bit, or has
     *         a channel count other than 1, 3 or 4
     */
    public static RasterBuffer wrap(Mat mat) {
        if (mat == null || mat.empty() || mat.cols() <= 0 || mat.rows() <= 0) {
            throw new InvalidParameterException("image", "Image has no pixels");
        }
        if (mat.depth() != CvType.CV_8U) {
            throw new InvalidParameterException("image",
                    "Image must have 8-bit samples, got " + CvType.typeToString(mat.type()));
        }
        int channels = mat.channels();
        if (channels != 1 && channels != 3 && channels != 4) {
            throw new InvalidParameterException("image",
                    "Image must have 1, 3 or 4 channels, got " + channels);
        }
        return new RasterBuffer(mat);
    }

    /**
     * Wrap a deep copy of the given Mat, leaving the caller's Mat untouched.
     */
    public static RasterBuffer copyOf(Mat mat) {
        if (mat == null) {
            throw new InvalidParameterException("image", "Image has no pixels");
        }
        return wrap(mat.clone());
    }

    /**
     * Create a buffer of the given shape with every pixel set to {@code value}.
     */
    public static RasterBuffer filled(int width, int height, int channels, Scalar value) {
        if (width <= 0 || height <= 0) {
            throw new InvalidParameterException("image",
                    "Image dimensions must be positive, got " + width + "x" + height);
        }
        return wrap(new Mat(height, width, CvType.CV_8UC(channels), value));
    }

    public int width() {
        return mat.cols();
    }

    public int height() {
        return mat.rows();
    }

    public int channels() {
        return mat.channels();
    }

    public boolean isGrayscale() {
        return mat.channels() == 1;
    }

    public boolean hasAlpha() {
        return mat.channels() == 4;
    }

    /**
     * The underlying Mat. Callers must treat it as read-only.
     */
    public Mat mat() {
        return mat;
    }

    /**
     * Deep copy with its own native storage.
     */
    public RasterBuffer copy() {
        return new RasterBuffer(mat.clone());
    }

    /**
     * Copy of this buffer with any alpha channel dropped (BGRA to BGR).
     * Buffers without alpha are simply copied.
     */
    public RasterBuffer withoutAlpha() {
        if (!hasAlpha()) {
            return copy();
        }
        Mat bgr = new Mat();
        Imgproc.cvtColor(mat, bgr, Imgproc.COLOR_BGRA2BGR);
        return new RasterBuffer(bgr);
    }

    /**
     * All samples in row-major, channel-interleaved order.
     */
    public byte[] toByteArray() {
        Mat continuous = mat.isContinuous() ? mat : mat.clone();
        try {
            byte[] data = new byte[(int) (continuous.total() * continuous.channels())];
            continuous.get(0, 0, data);
            return data;
        } finally {
            if (continuous != mat) {
                continuous.release();
            }
        }
    }

    /**
     * True when both buffers have the same shape and byte-identical samples.
     */
    public boolean sameSamples(RasterBuffer other) {
        return other != null
                && width() == other.width()
                && height() == other.height()
                && channels() == other.channels()
                && Arrays.equals(toByteArray(), other.toByteArray());
    }

    @Override
    public void close() {
        mat.release();
    }

    @Override
    public String toString() {
        return "RasterBuffer[" + width() + "x" + height() + "x" + channels() + "]";
    }
}
