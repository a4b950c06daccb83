package com.ttennebkram.imagelab.operations;

import com.ttennebkram.imagelab.params.OperationParameters;
import com.ttennebkram.imagelab.params.ParameterSchema;
import com.ttennebkram.imagelab.params.ParameterSpec;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.CLAHE;
import org.opencv.imgproc.Imgproc;

/**
 * Histogram equalization, global or contrast-limited adaptive (CLAHE),
 * on the grayscale derivation. Output is single-channel.
 */
@OperationInfo(
    id = "histogram",
    category = "Enhancement",
    description = "Histogram equalization\nImgproc.equalizeHist(src, dst) / Imgproc.createCLAHE(clipLimit, tileGridSize)",
    aliases = {
        @OperationAlias(id = "histogram_equalize", preset = "op=equalize")
    }
)
public class HistogramOperation extends ImageOperationBase {

    private static final ParameterSchema SCHEMA = ParameterSchema.of(
            ParameterSpec.string("op").defaultValue("equalize").oneOf("equalize", "clahe"),
            ParameterSpec.decimal("clip_limit").defaultValue(2.0).range(0.01, 1000),
            ParameterSpec.integer("tile_size").defaultValue(8).range(1, 64)
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
            if ("clahe".equals(params.getString("op"))) {
                int tile = params.getInt("tile_size");
                CLAHE clahe = Imgproc.createCLAHE(params.getDouble("clip_limit"), new Size(tile, tile));
                clahe.apply(gray, output);
            } else {
                Imgproc.equalizeHist(gray, output);
            }
            return output;
        } finally {
            gray.release();
        }
    }
}
