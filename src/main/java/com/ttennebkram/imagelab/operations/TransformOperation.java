package com.ttennebkram.imagelab.operations;

import com.ttennebkram.imagelab.params.OperationParameters;
import com.ttennebkram.imagelab.params.ParameterSchema;
import com.ttennebkram.imagelab.params.ParameterSpec;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

/**
 * Translation followed by rotation about the image center.
 * Output keeps the input dimensions; uncovered pixels are filled with zero.
 */
@OperationInfo(
    id = "transform",
    category = "Geometry",
    description = "Translate and rotate\nImgproc.warpAffine(src, dst, M, dsize)"
)
public class TransformOperation extends ImageOperationBase {

    private static final ParameterSchema SCHEMA = ParameterSchema.of(
            ParameterSpec.integer("tx").defaultValue(0),
            ParameterSpec.integer("ty").defaultValue(0),
            ParameterSpec.decimal("angle").defaultValue(0.0)
    );

    private static final Scalar BACKGROUND = Scalar.all(0);

    @Override
    public ParameterSchema getParameterSchema() {
        return SCHEMA;
    }

    @Override
    public Mat apply(Mat input, OperationParameters params) {
        int tx = params.getInt("tx");
        int ty = params.getInt("ty");
        double angle = params.getDouble("angle");

        int width = input.cols();
        int height = input.rows();
        Size size = new Size(width, height);

        // Translation matrix [[1, 0, tx], [0, 1, ty]]
        Mat shift = new Mat(2, 3, CvType.CV_64F);
        shift.put(0, 0, 1, 0, tx, 0, 1, ty);

        Mat translated = new Mat();
        try {
            Imgproc.warpAffine(input, translated, shift, size,
                    Imgproc.INTER_LINEAR, Core.BORDER_CONSTANT, BACKGROUND);
        } finally {
            shift.release();
        }
        if (angle == 0) {
            return translated;
        }

        // Positive angle rotates counter-clockwise, as in getRotationMatrix2D
        Mat rotation = Imgproc.getRotationMatrix2D(new Point(width / 2.0, height / 2.0), angle, 1.0);
        Mat output = new Mat();
        try {
            Imgproc.warpAffine(translated, output, rotation, size,
                    Imgproc.INTER_LINEAR, Core.BORDER_CONSTANT, BACKGROUND);
        } finally {
            release(rotation, translated);
        }
        return output;
    }
}
