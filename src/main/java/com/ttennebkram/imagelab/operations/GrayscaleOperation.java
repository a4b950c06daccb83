package com.ttennebkram.imagelab.operations;

import com.ttennebkram.imagelab.params.OperationParameters;
import com.ttennebkram.imagelab.params.ParameterSchema;
import org.opencv.core.Mat;

/**
 * Grayscale operation.
 * Converts BGR to a single luminance channel (0.299 R + 0.587 G + 0.114 B).
 * Already-gray input is copied, so applying it twice equals applying it once.
 */
@OperationInfo(
    id = "grayscale",
    category = "Color",
    description = "Convert to grayscale\nImgproc.cvtColor(src, dst, COLOR_BGR2GRAY)"
)
public class GrayscaleOperation extends ImageOperationBase {

    @Override
    public ParameterSchema getParameterSchema() {
        return ParameterSchema.empty();
    }

    @Override
    public Mat apply(Mat input, OperationParameters params) {
        return toGray(input);
    }
}
