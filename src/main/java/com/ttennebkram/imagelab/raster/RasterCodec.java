package com.ttennebkram.imagelab.raster;

import com.ttennebkram.imagelab.errors.TransformFailedException;
import com.ttennebkram.imagelab.errors.UnreadableImageException;
import com.ttennebkram.imagelab.errors.UnsupportedFormatException;
import org.opencv.core.CvException;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.MatOfByte;
import org.opencv.core.MatOfInt;
import org.opencv.imgcodecs.Imgcodecs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes uploaded bytes into raster buffers and encodes buffers back into
 * image containers using the OpenCV codecs.
 */
public final class RasterCodec {

    private static final Logger log = LoggerFactory.getLogger(RasterCodec.class);

    static {
        OpenCvNatives.ensureLoaded();
    }

    /** Extension of the canonical exchange format. */
    public static final String PNG = "png";

    private RasterCodec() {
    }

    /**
     * Decode encoded image bytes. Alpha is preserved; 16-bit images are scaled
     * down to 8 bits.
     *
     * @throws UnreadableImageException if the bytes are not a decodable image
     */
    public static RasterBuffer decode(byte[] encoded) {
        if (encoded == null || encoded.length == 0) {
            throw new UnreadableImageException("Image data is empty");
        }
        MatOfByte raw = new MatOfByte(encoded);
        Mat decoded;
        try {
            decoded = Imgcodecs.imdecode(raw, Imgcodecs.IMREAD_UNCHANGED);
        } catch (CvException e) {
            throw new UnreadableImageException("Could not decode image: " + e.getMessage(), e);
        } finally {
            raw.release();
        }
        if (decoded == null || decoded.empty()) {
            throw new UnreadableImageException("Could not decode image (" + encoded.length + " bytes)");
        }

        if (decoded.depth() == CvType.CV_16U) {
            Mat eightBit = new Mat();
            decoded.convertTo(eightBit, CvType.CV_8U, 1.0 / 256.0);
            decoded.release();
            decoded = eightBit;
        }
        return RasterBuffer.wrap(decoded);
    }

    /**
     * Encode a buffer as PNG.
     */
    public static byte[] encodePng(RasterBuffer buffer) {
        return encode(buffer, PNG, new MatOfInt());
    }

    /**
     * Whether OpenCV has a usable writer for the extension. Codecs that are
     * compiled in but disabled at runtime (OpenEXR by default) raise from
     * the lookup itself and count as unavailable.
     */
    public static boolean canEncode(String extension) {
        try {
            return Imgcodecs.haveImageWriter("image." + extension);
        } catch (CvException e) {
            log.debug("Writer lookup for {} failed: {}", extension, e.getMessage());
            return false;
        }
    }

    /**
     * Encode a buffer into the container identified by {@code extension}
     * (without the leading dot), passing OpenCV writer flags through.
     *
     * @throws UnsupportedFormatException if OpenCV has no usable encoder for the extension
     * @throws TransformFailedException if the encoder rejects the buffer
     */
    public static byte[] encode(RasterBuffer buffer, String extension, MatOfInt writeParams) {
        if (!canEncode(extension)) {
            throw new UnsupportedFormatException(extension);
        }
        MatOfByte out = new MatOfByte();
        try {
            boolean ok;
            try {
                ok = Imgcodecs.imencode("." + extension, buffer.mat(), out, writeParams);
            } catch (CvException e) {
                throw new TransformFailedException("Encoding to " + extension + " failed", e);
            }
            if (!ok) {
                throw new TransformFailedException("Encoding to " + extension + " failed");
            }
            return out.toArray();
        } finally {
            out.release();
        }
    }
}
