package com.ttennebkram.imagelab.dispatch;

import com.ttennebkram.imagelab.errors.ImageLabException;
import com.ttennebkram.imagelab.errors.InvalidParameterException;
import com.ttennebkram.imagelab.errors.TransformFailedException;
import com.ttennebkram.imagelab.errors.UnknownOperationException;
import com.ttennebkram.imagelab.operations.ImageOperation;
import com.ttennebkram.imagelab.operations.OperationEntry;
import com.ttennebkram.imagelab.operations.OperationRegistry;
import com.ttennebkram.imagelab.params.OperationParameters;
import com.ttennebkram.imagelab.raster.RasterBuffer;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Resolves an operation identifier, validates its parameters and runs it.
 *
 * Unknown identifiers and invalid parameters are rejected before any pixel
 * work starts. Failures inside a transform are wrapped as
 * {@link TransformFailedException}. The input buffer is never modified.
 */
public class Dispatcher {

    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

    private final OperationRegistry registry;

    public Dispatcher(OperationRegistry registry) {
        this.registry = registry;
    }

    public Dispatcher() {
        this(OperationRegistry.getDefault());
    }

    public OperationRegistry getRegistry() {
        return registry;
    }

    /**
     * Resolve and validate without touching any image.
     *
     * @throws UnknownOperationException if the identifier is not registered
     * @throws InvalidParameterException if a parameter is missing, mistyped or out of range
     */
    public PreparedOperation prepare(String operationId, Map<String, ?> parameters) {
        OperationEntry entry = registry.find(operationId)
                .orElseThrow(() -> new UnknownOperationException(operationId));
        OperationParameters params = entry.resolveParameters(parameters);
        return new PreparedOperation(entry, params);
    }

    public PreparedOperation prepare(OperationDescriptor descriptor) {
        return prepare(descriptor.getOperationId(), descriptor.getParameters());
    }

    public RasterBuffer dispatch(String operationId, Map<String, ?> parameters, RasterBuffer input) {
        return dispatch(prepare(operationId, parameters), input);
    }

    public RasterBuffer dispatch(OperationDescriptor descriptor, RasterBuffer input) {
        return dispatch(prepare(descriptor), input);
    }

    /**
     * Dispatch with the parameter object given as JSON text.
     */
    public RasterBuffer dispatchJson(String operationId, String parametersJson, RasterBuffer input) {
        return dispatch(OperationDescriptor.fromJson(operationId, parametersJson), input);
    }

    /**
     * Run a prepared operation against one buffer.
     *
     * @return a new buffer owned by the caller
     * @throws InvalidParameterException if the input buffer is unusable
     * @throws TransformFailedException if the transform itself fails
     */
    public RasterBuffer dispatch(PreparedOperation prepared, RasterBuffer input) {
        if (input == null) {
            throw new InvalidParameterException("image", "No image supplied");
        }
        ImageOperation operation = prepared.getEntry().getOperation();
        String id = prepared.getOperationId();

        // Alpha never reaches an operation
        Mat source = input.mat();
        Mat flattened = null;
        if (input.hasAlpha()) {
            RasterBuffer bgr = input.withoutAlpha();
            flattened = bgr.mat();
            source = flattened;
        } else if (operation.isDestructive()) {
            flattened = source.clone();
            source = flattened;
        }

        log.debug("Dispatching {} with {} on {}", id, prepared.getParameters(), input);
        Mat output;
        try {
            output = operation.apply(source, prepared.getParameters());
        } catch (ImageLabException e) {
            if (flattened != null) flattened.release();
            throw e;
        } catch (RuntimeException e) {
            if (flattened != null) flattened.release();
            throw new TransformFailedException("Operation '" + id + "' failed: " + e.getMessage(), e);
        }
        if (flattened != null && output != flattened) {
            flattened.release();
        }

        checkOutput(id, output, input);
        return RasterBuffer.wrap(output);
    }

    private static void checkOutput(String id, Mat output, RasterBuffer input) {
        if (output == null) {
            throw new TransformFailedException("Operation '" + id + "' produced no image");
        }
        if (output == input.mat()) {
            throw new TransformFailedException("Operation '" + id + "' returned its input instead of a new image");
        }
        String problem = null;
        if (output.empty() || output.cols() <= 0 || output.rows() <= 0) {
            problem = "an empty image";
        } else if (output.depth() != CvType.CV_8U) {
            problem = "a " + CvType.typeToString(output.type()) + " image";
        } else if (output.channels() != 1 && output.channels() != 3) {
            problem = "a " + output.channels() + "-channel image";
        }
        if (problem != null) {
            output.release();
            throw new TransformFailedException("Operation '" + id + "' produced " + problem);
        }
    }
}
