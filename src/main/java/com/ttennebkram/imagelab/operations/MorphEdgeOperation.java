package com.ttennebkram.imagelab.operations;

import com.ttennebkram.imagelab.params.OperationParameters;
import com.ttennebkram.imagelab.params.ParameterSchema;
import com.ttennebkram.imagelab.params.ParameterSpec;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.imgproc.Imgproc;

/**
 * Morphology (dilate, erode) and edge detection (Canny, horizontal Sobel) on
 * the grayscale derivation. Output is single-channel.
 */
@OperationInfo(
    id = "morph_edge",
    category = "Edges",
    description = "Dilation, erosion, edge detection\n"
            + "Imgproc.dilate / Imgproc.erode / Imgproc.Canny / Imgproc.Sobel",
    aliases = {
        @OperationAlias(id = "canny", preset = "op=canny")
    }
)
public class MorphEdgeOperation extends ImageOperationBase {

    private static final ParameterSchema SCHEMA = ParameterSchema.of(
            ParameterSpec.string("op").defaultValue("canny").oneOf("dilate", "erode", "canny", "sobel"),
            ParameterSpec.integer("ksize").defaultValue(5).positiveOdd().max(99),
            ParameterSpec.integer("iterations").defaultValue(1).range(1, 100),
            ParameterSpec.decimal("threshold1").defaultValue(100).min(0),
            ParameterSpec.decimal("threshold2").defaultValue(200).min(0),
            ParameterSpec.integer("sobel_ksize").defaultValue(5).oneOf(1, 3, 5, 7)
    );

    @Override
    public ParameterSchema getParameterSchema() {
        return SCHEMA;
    }

    @Override
    public Mat apply(Mat input, OperationParameters params) {
        String op = params.getString("op");
        Mat gray = toGray(input);
        Mat output = new Mat();
        try {
            switch (op) {
                case "dilate":
                case "erode": {
                    int ksize = params.getInt("ksize");
                    Mat kernel = Mat.ones(ksize, ksize, CvType.CV_8U);
                    try {
                        if ("dilate".equals(op)) {
                            Imgproc.dilate(gray, output, kernel, new Point(-1, -1), params.getInt("iterations"));
                        } else {
                            Imgproc.erode(gray, output, kernel, new Point(-1, -1), params.getInt("iterations"));
                        }
                    } finally {
                        kernel.release();
                    }
                    break;
                }
                case "sobel": {
                    // 64F keeps negative gradients before taking the absolute value
                    Mat gradient = new Mat();
                    try {
                        Imgproc.Sobel(gray, gradient, CvType.CV_64F, 1, 0, params.getInt("sobel_ksize"));
                        Core.convertScaleAbs(gradient, output);
                    } finally {
                        gradient.release();
                    }
                    break;
                }
                default:
                    Imgproc.Canny(gray, output, params.getDouble("threshold1"), params.getDouble("threshold2"));
                    break;
            }
            return output;
        } finally {
            gray.release();
        }
    }
}
