package com.ttennebkram.imagelab.operations;

import com.ttennebkram.imagelab.errors.InvalidParameterException;
import com.ttennebkram.imagelab.params.OperationParameters;
import com.ttennebkram.imagelab.params.ParameterSchema;
import com.ttennebkram.imagelab.params.ParameterSpec;
import org.opencv.core.Mat;
import org.opencv.core.Rect;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

/**
 * Resize to an exact width x height with linear interpolation, optionally
 * cropping a fixed margin from every side afterwards.
 */
@OperationInfo(
    id = "resize_crop",
    category = "Geometry",
    description = "Resize and crop\nImgproc.resize(src, dst, dsize, 0, 0, INTER_LINEAR)",
    aliases = {
        @OperationAlias(id = "resize", preset = "crop=false")
    }
)
public class ResizeCropOperation extends ImageOperationBase {

    /** Pixels removed from each side when cropping. */
    public static final int CROP_MARGIN = 10;

    private static final int MAX_DIMENSION = 16384;

    private static final ParameterSchema SCHEMA = ParameterSchema.of(
            ParameterSpec.integer("width").defaultValue(100).range(1, MAX_DIMENSION),
            ParameterSpec.integer("height").defaultValue(100).range(1, MAX_DIMENSION),
            ParameterSpec.bool("crop").defaultValue(false)
    );

    @Override
    public ParameterSchema getParameterSchema() {
        return SCHEMA;
    }

    @Override
    public void validate(OperationParameters params) {
        if (!params.getBoolean("crop")) {
            return;
        }
        int width = params.getInt("width");
        int height = params.getInt("height");
        if (width <= 2 * CROP_MARGIN || height <= 2 * CROP_MARGIN) {
            throw new InvalidParameterException("crop",
                    "Cropping needs width and height greater than " + (2 * CROP_MARGIN)
                            + ", got " + width + "x" + height);
        }
    }

    @Override
    public Mat apply(Mat input, OperationParameters params) {
        int width = params.getInt("width");
        int height = params.getInt("height");

        Mat resized = new Mat();
        Imgproc.resize(input, resized, new Size(width, height), 0, 0, Imgproc.INTER_LINEAR);
        if (!params.getBoolean("crop")) {
            return resized;
        }

        try {
            Rect inner = new Rect(CROP_MARGIN, CROP_MARGIN,
                    width - 2 * CROP_MARGIN, height - 2 * CROP_MARGIN);
            Mat view = resized.submat(inner);
            Mat cropped = view.clone();
            view.release();
            return cropped;
        } finally {
            resized.release();
        }
    }
}
