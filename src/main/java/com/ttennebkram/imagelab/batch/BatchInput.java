package com.ttennebkram.imagelab.batch;

import com.ttennebkram.imagelab.raster.RasterBuffer;
import com.ttennebkram.imagelab.raster.RasterCodec;

/**
 * One named image handed to a batch, either still encoded or already decoded.
 * Encoded inputs are decoded inside the batch so that an unreadable file only
 * fails its own item.
 */
public final class BatchInput {

    private final String name;
    private final byte[] encoded;
    private final RasterBuffer buffer;

    private BatchInput(String name, byte[] encoded, RasterBuffer buffer) {
        this.name = name;
        this.encoded = encoded;
        this.buffer = buffer;
    }

    /**
     * An input that still has to be decoded.
     *
     * @param name original file name, may be null or blank
     */
    public static BatchInput encoded(String name, byte[] data) {
        return new BatchInput(name, data == null ? new byte[0] : data.clone(), null);
    }

    /**
     * An already-decoded input. The batch reads it but never modifies or releases it.
     */
    public static BatchInput decoded(String name, RasterBuffer buffer) {
        if (buffer == null) {
            throw new IllegalArgumentException("buffer must not be null");
        }
        return new BatchInput(name, null, buffer);
    }

    public String getName() {
        return name;
    }

    /**
     * Produce a buffer the batch owns and must close.
     */
    RasterBuffer open() {
        return buffer != null ? buffer.copy() : RasterCodec.decode(encoded);
    }
}
