package com.ttennebkram.imagelab.operations;

import com.ttennebkram.imagelab.params.OperationParameters;
import com.ttennebkram.imagelab.params.ParameterSchema;
import com.ttennebkram.imagelab.params.ParameterSpec;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Saturating arithmetic and bitwise combination against a constant image of
 * the same shape. An unrecognized operator returns the input unchanged.
 */
@OperationInfo(
    id = "arithmetic",
    category = "Arithmetic",
    description = "Arithmetic and bitwise operations\nCore.add / Core.subtract / Core.bitwise_and / Core.bitwise_or"
)
public class ArithmeticOperation extends ImageOperationBase {

    private static final Logger log = LoggerFactory.getLogger(ArithmeticOperation.class);

    private static final ParameterSchema SCHEMA = ParameterSchema.of(
            ParameterSpec.string("op").defaultValue("add"),
            ParameterSpec.integer("value").defaultValue(50).range(0, 255)
    );

    @Override
    public ParameterSchema getParameterSchema() {
        return SCHEMA;
    }

    @Override
    public Mat apply(Mat input, OperationParameters params) {
        String op = params.getString("op");
        Mat constant = new Mat(input.size(), input.type(), Scalar.all(params.getInt("value")));
        Mat output = new Mat();
        try {
            switch (op) {
                case "add":
                    Core.add(input, constant, output);
                    break;
                case "subtract":
                    Core.subtract(input, constant, output);
                    break;
                case "bitwise_and":
                    Core.bitwise_and(input, constant, output);
                    break;
                case "bitwise_or":
                    Core.bitwise_or(input, constant, output);
                    break;
                default:
                    log.debug("Unrecognized arithmetic operator '{}', returning input unchanged", op);
                    input.copyTo(output);
                    break;
            }
            return output;
        } finally {
            constant.release();
        }
    }
}
