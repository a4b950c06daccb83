package com.ttennebkram.imagelab.operations;

import com.ttennebkram.imagelab.params.OperationParameters;
import com.ttennebkram.imagelab.params.ParameterSchema;
import com.ttennebkram.imagelab.params.ParameterSpec;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

/**
 * Noise reduction with a bilateral, Gaussian or median filter.
 * Preserves dimensions and channel count.
 */
@OperationInfo(
    id = "denoise",
    category = "Filter",
    description = "Noise reduction\nImgproc.bilateralFilter(src, dst, d, sigmaColor, sigmaSpace)\n"
            + "Imgproc.GaussianBlur(src, dst, ksize, 0) / Imgproc.medianBlur(src, dst, ksize)"
)
public class DenoiseOperation extends ImageOperationBase {

    // Window defaults differ per filter, so ksize has no schema default
    private static final int BILATERAL_DIAMETER = 9;
    private static final int DEFAULT_KSIZE = 5;

    private static final ParameterSchema SCHEMA = ParameterSchema.of(
            ParameterSpec.string("op").defaultValue("bilateral").oneOf("bilateral", "gaussian", "median"),
            ParameterSpec.integer("ksize").positiveOdd().max(99),
            ParameterSpec.decimal("sigma_color").defaultValue(75).min(0),
            ParameterSpec.decimal("sigma_space").defaultValue(75).min(0)
    );

    @Override
    public ParameterSchema getParameterSchema() {
        return SCHEMA;
    }

    @Override
    public Mat apply(Mat input, OperationParameters params) {
        String op = params.getString("op");
        Mat output = new Mat();
        switch (op) {
            case "gaussian": {
                int ksize = params.has("ksize") ? params.getInt("ksize") : DEFAULT_KSIZE;
                Imgproc.GaussianBlur(input, output, new Size(ksize, ksize), 0);
                break;
            }
            case "median": {
                int ksize = params.has("ksize") ? params.getInt("ksize") : DEFAULT_KSIZE;
                Imgproc.medianBlur(input, output, ksize);
                break;
            }
            default: {
                int diameter = params.has("ksize") ? params.getInt("ksize") : BILATERAL_DIAMETER;
                Imgproc.bilateralFilter(input, output, diameter,
                        params.getDouble("sigma_color"), params.getDouble("sigma_space"));
                break;
            }
        }
        return output;
    }
}
