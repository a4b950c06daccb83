package com.ttennebkram.imagelab.operations;

import com.ttennebkram.imagelab.params.OperationParameters;
import com.ttennebkram.imagelab.params.ParameterSchema;
import com.ttennebkram.imagelab.params.ParameterSpec;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

/**
 * Fixed binary or adaptive mean thresholding on the grayscale derivation.
 * Output is single-channel.
 */
@OperationInfo(
    id = "threshold",
    category = "Threshold",
    description = "Threshold\nImgproc.threshold(src, dst, thresh, maxval, THRESH_BINARY)\n"
            + "Imgproc.adaptiveThreshold(src, dst, maxval, ADAPTIVE_THRESH_MEAN_C, THRESH_BINARY, blockSize, C)"
)
public class ThresholdOperation extends ImageOperationBase {

    private static final ParameterSchema SCHEMA = ParameterSchema.of(
            ParameterSpec.string("op").defaultValue("binary").oneOf("binary", "adaptive"),
            ParameterSpec.decimal("thresh").defaultValue(127).range(0, 255),
            ParameterSpec.decimal("max_value").defaultValue(255).range(0, 255),
            ParameterSpec.integer("block_size").defaultValue(11).positiveOdd().min(3),
            ParameterSpec.decimal("c").defaultValue(2)
    );

    @Override
    public ParameterSchema getParameterSchema() {
        return SCHEMA;
    }

    @Override
    public Mat apply(Mat input, OperationParameters params) {
        Mat gray = toGray(input);
        Mat output = new Mat();
        try {
            double maxValue = params.getDouble("max_value");
            if ("adaptive".equals(params.getString("op"))) {
                Imgproc.adaptiveThreshold(gray, output, maxValue,
                        Imgproc.ADAPTIVE_THRESH_MEAN_C, Imgproc.THRESH_BINARY,
                        params.getInt("block_size"), params.getDouble("c"));
            } else {
                Imgproc.threshold(gray, output, params.getDouble("thresh"), maxValue, Imgproc.THRESH_BINARY);
            }
            return output;
        } finally {
            gray.release();
        }
    }
}
