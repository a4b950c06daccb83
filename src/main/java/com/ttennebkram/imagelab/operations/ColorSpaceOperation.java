package com.ttennebkram.imagelab.operations;

import com.ttennebkram.imagelab.params.OperationParameters;
import com.ttennebkram.imagelab.params.ParameterSchema;
import com.ttennebkram.imagelab.params.ParameterSpec;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

/**
 * Color space conversion.
 * RGB, HSV and LAB give three channels; GRAY gives one.
 */
@OperationInfo(
    id = "colorspace",
    category = "Color",
    description = "Convert between color spaces\nImgproc.cvtColor(src, dst, code)"
)
public class ColorSpaceOperation extends ImageOperationBase {

    private static final ParameterSchema SCHEMA = ParameterSchema.of(
            ParameterSpec.string("space").required().oneOf("RGB", "HSV", "LAB", "GRAY")
    );

    @Override
    public ParameterSchema getParameterSchema() {
        return SCHEMA;
    }

    @Override
    public Mat apply(Mat input, OperationParameters params) {
        String space = params.getString("space");
        if ("GRAY".equals(space)) {
            return toGray(input);
        }

        int code;
        switch (space) {
            case "RGB":
                code = Imgproc.COLOR_BGR2RGB;
                break;
            case "HSV":
                code = Imgproc.COLOR_BGR2HSV;
                break;
            default:
                code = Imgproc.COLOR_BGR2Lab;
                break;
        }

        // Gray input is promoted first so every target gets three channels
        Mat bgr = toBgr(input);
        try {
            Mat output = new Mat();
            Imgproc.cvtColor(bgr, output, code);
            return output;
        } finally {
            bgr.release();
        }
    }
}
