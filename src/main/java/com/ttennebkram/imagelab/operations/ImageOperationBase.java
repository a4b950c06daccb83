package com.ttennebkram.imagelab.operations;

import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

/**
 * Abstract base class for catalog operations.
 * Reads identity from the {@link OperationInfo} annotation and provides
 * common helpers.
 */
public abstract class ImageOperationBase implements ImageOperation {

    private final OperationInfo info;

    protected ImageOperationBase() {
        this.info = getClass().getAnnotation(OperationInfo.class);
        if (info == null) {
            throw new IllegalStateException(getClass().getName() + " is missing @OperationInfo");
        }
    }

    @Override
    public String getOperationId() {
        return info.id();
    }

    @Override
    public String getCategory() {
        return info.category();
    }

    @Override
    public String getDescription() {
        return info.description();
    }

    @Override
    public boolean isDestructive() {
        return info.destructive();
    }

    /**
     * Single-channel derivation of the input. Always returns a new Mat.
     */
    protected static Mat toGray(Mat input) {
        Mat gray = new Mat();
        if (input.channels() == 3) {
            Imgproc.cvtColor(input, gray, Imgproc.COLOR_BGR2GRAY);
        } else {
            input.copyTo(gray);
        }
        return gray;
    }

    /**
     * Three-channel BGR derivation of the input. Always returns a new Mat.
     */
    protected static Mat toBgr(Mat input) {
        Mat bgr = new Mat();
        if (input.channels() == 1) {
            Imgproc.cvtColor(input, bgr, Imgproc.COLOR_GRAY2BGR);
        } else {
            input.copyTo(bgr);
        }
        return bgr;
    }

    /**
     * Release temporaries, skipping nulls.
     */
    protected static void release(Mat... mats) {
        for (Mat m : mats) {
            if (m != null) m.release();
        }
    }
}
