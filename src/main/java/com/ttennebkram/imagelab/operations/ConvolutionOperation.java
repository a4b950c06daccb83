package com.ttennebkram.imagelab.operations;

import com.ttennebkram.imagelab.params.OperationParameters;
import com.ttennebkram.imagelab.params.ParameterSchema;
import com.ttennebkram.imagelab.params.ParameterSpec;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

/**
 * Convolution filters: Gaussian blur or a 3x3 sharpening kernel.
 * Preserves dimensions and channel count.
 */
@OperationInfo(
    id = "convolution",
    category = "Filter",
    description = "Blur or sharpen\nImgproc.GaussianBlur(src, dst, ksize, 0) / Imgproc.filter2D(src, dst, -1, kernel)",
    aliases = {
        @OperationAlias(id = "blur", preset = "op=blur"),
        @OperationAlias(id = "sharpen", preset = "op=sharpen")
    }
)
public class ConvolutionOperation extends ImageOperationBase {

    private static final ParameterSchema SCHEMA = ParameterSchema.of(
            ParameterSpec.string("op").defaultValue("blur").oneOf("blur", "sharpen"),
            ParameterSpec.integer("ksize").defaultValue(7).positiveOdd().max(99)
    );

    private static final float[] SHARPEN_KERNEL = {
            0, -1, 0,
            -1, 5, -1,
            0, -1, 0
    };

    @Override
    public ParameterSchema getParameterSchema() {
        return SCHEMA;
    }

    @Override
    public Mat apply(Mat input, OperationParameters params) {
        Mat output = new Mat();
        if ("sharpen".equals(params.getString("op"))) {
            Mat kernel = new Mat(3, 3, CvType.CV_32F);
            try {
                kernel.put(0, 0, SHARPEN_KERNEL);
                Imgproc.filter2D(input, output, -1, kernel);
            } finally {
                kernel.release();
            }
        } else {
            int ksize = params.getInt("ksize");
            Imgproc.GaussianBlur(input, output, new Size(ksize, ksize), 0);
        }
        return output;
    }
}
