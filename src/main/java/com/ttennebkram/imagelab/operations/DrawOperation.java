package com.ttennebkram.imagelab.operations;

import com.ttennebkram.imagelab.params.OperationParameters;
import com.ttennebkram.imagelab.params.ParameterSchema;
import com.ttennebkram.imagelab.params.ParameterSpec;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Scalar;
import org.opencv.imgproc.Imgproc;

/**
 * Draws a fixed rectangle, circle or text string onto the image.
 * This is the one destructive operation: it draws into the Mat it is handed,
 * which the dispatcher always supplies as a private copy.
 */
@OperationInfo(
    id = "draw",
    category = "Draw",
    description = "Draw shapes and text\nImgproc.rectangle / Imgproc.circle / Imgproc.putText",
    destructive = true
)
public class DrawOperation extends ImageOperationBase {

    private static final ParameterSchema SCHEMA = ParameterSchema.of(
            ParameterSpec.string("shape").defaultValue("rectangle").oneOf("rectangle", "circle", "text"),
            ParameterSpec.string("text")
    );

    // BGR colors
    private static final Scalar GREEN = new Scalar(0, 255, 0);
    private static final Scalar BLUE = new Scalar(255, 0, 0);
    private static final Scalar RED = new Scalar(0, 0, 255);

    @Override
    public ParameterSchema getParameterSchema() {
        return SCHEMA;
    }

    @Override
    public Mat apply(Mat input, OperationParameters params) {
        switch (params.getString("shape")) {
            case "rectangle":
                Imgproc.rectangle(input, new Point(50, 50), new Point(200, 200), GREEN, 3);
                break;
            case "circle":
                Imgproc.circle(input, new Point(150, 150), 75, BLUE, 3);
                break;
            default:
                String text = params.getString("text", "");
                // Nothing to draw for an empty string
                if (!text.isEmpty()) {
                    Imgproc.putText(input, text, new Point(50, 50),
                            Imgproc.FONT_HERSHEY_SIMPLEX, 1.0, RED, 2);
                }
                break;
        }
        return input;
    }
}
