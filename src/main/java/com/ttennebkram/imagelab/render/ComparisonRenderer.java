package com.ttennebkram.imagelab.render;

import com.ttennebkram.imagelab.config.ImageLabSettings;
import com.ttennebkram.imagelab.dispatch.Dispatcher;
import com.ttennebkram.imagelab.errors.InvalidParameterException;
import com.ttennebkram.imagelab.raster.RasterBuffer;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Rect;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Renders an original and a transformed image side by side.
 *
 * The derived image is brought to the source's channel count (gray is
 * replicated into BGR, not reinterpreted) and resized to the source's
 * dimensions; the source itself is never resized. Output is
 * 2W x (H + label strip).
 */
public class ComparisonRenderer {

    private static final Logger log = LoggerFactory.getLogger(ComparisonRenderer.class);

    public static final String ORIGINAL_LABEL = "Original";

    private static final double LABEL_FONT_SCALE = 0.7;
    private static final int LABEL_THICKNESS = 2;
    private static final Scalar LABEL_COLOR = Scalar.all(255);
    private static final Scalar STRIP_BACKGROUND = Scalar.all(0);

    private final Dispatcher dispatcher;
    private final int labelStripHeight;

    public ComparisonRenderer(Dispatcher dispatcher, ImageLabSettings settings) {
        this.dispatcher = dispatcher;
        this.labelStripHeight = settings.getCompareLabelHeight();
    }

    public int getLabelStripHeight() {
        return labelStripHeight;
    }

    /**
     * Derive the right-hand image with the dispatcher, then compose.
     */
    public ComparisonArtifact compare(RasterBuffer source, String operationId, Map<String, ?> parameters) {
        try (RasterBuffer derived = dispatcher.dispatch(operationId, parameters, source)) {
            return compare(source, derived, operationId);
        }
    }

    /**
     * Compose {@code source} and {@code derived} with labels. Neither input is modified.
     *
     * @param operationName shown above the derived half
     */
    public ComparisonArtifact compare(RasterBuffer source, RasterBuffer derived, String operationName) {
        if (source == null || derived == null) {
            throw new InvalidParameterException("image", "Comparison needs both a source and a derived image");
        }

        Mat left = source.hasAlpha() ? flattenAlpha(source.mat()) : source.mat();
        Mat right = null;
        Mat composite = null;
        try {
            int width = left.cols();
            int height = left.rows();
            right = reconcile(derived.mat(), left.channels(), new Size(width, height));

            composite = new Mat(height + labelStripHeight, 2 * width,
                    CvType.CV_8UC(left.channels()), STRIP_BACKGROUND);
            copyInto(left, composite, new Rect(0, labelStripHeight, width, height));
            copyInto(right, composite, new Rect(width, labelStripHeight, width, height));

            // Labels start a quarter of the way into each half
            int baseline = labelStripHeight * 2 / 3;
            Imgproc.putText(composite, ORIGINAL_LABEL, new Point(width / 4.0, baseline),
                    Imgproc.FONT_HERSHEY_SIMPLEX, LABEL_FONT_SCALE, LABEL_COLOR, LABEL_THICKNESS);
            Imgproc.putText(composite, derivedLabel(operationName), new Point(width + width / 4.0, baseline),
                    Imgproc.FONT_HERSHEY_SIMPLEX, LABEL_FONT_SCALE, LABEL_COLOR, LABEL_THICKNESS);

            log.debug("Composed comparison of {} and {} as {}x{}", source, derived,
                    composite.cols(), composite.rows());
            ComparisonArtifact artifact = new ComparisonArtifact(RasterBuffer.wrap(composite), labelStripHeight, width);
            composite = null;
            return artifact;
        } finally {
            if (left != source.mat()) left.release();
            if (right != null) right.release();
            if (composite != null) composite.release();
        }
    }

    static String derivedLabel(String operationName) {
        return operationName == null || operationName.isEmpty()
                ? "Processed"
                : "Processed (" + operationName + ")";
    }

    /**
     * New Mat holding {@code derived} with {@code channels} channels at {@code size}.
     */
    private static Mat reconcile(Mat derived, int channels, Size size) {
        Mat converted = new Mat();
        int have = derived.channels();
        if (have == channels) {
            derived.copyTo(converted);
        } else if (have == 1) {
            Imgproc.cvtColor(derived, converted, Imgproc.COLOR_GRAY2BGR);
        } else if (channels == 1) {
            Imgproc.cvtColor(derived, converted, have == 4 ? Imgproc.COLOR_BGRA2GRAY : Imgproc.COLOR_BGR2GRAY);
        } else {
            Imgproc.cvtColor(derived, converted, Imgproc.COLOR_BGRA2BGR);
        }

        if (converted.cols() == (int) size.width && converted.rows() == (int) size.height) {
            return converted;
        }
        Mat resized = new Mat();
        Imgproc.resize(converted, resized, size);
        converted.release();
        return resized;
    }

    private static Mat flattenAlpha(Mat bgra) {
        Mat bgr = new Mat();
        Imgproc.cvtColor(bgra, bgr, Imgproc.COLOR_BGRA2BGR);
        return bgr;
    }

    private static void copyInto(Mat part, Mat composite, Rect region) {
        Mat view = composite.submat(region);
        try {
            part.copyTo(view);
        } finally {
            view.release();
        }
    }
}
