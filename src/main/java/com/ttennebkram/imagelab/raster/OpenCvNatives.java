package com.ttennebkram.imagelab.raster;

import org.opencv.core.Core;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads the OpenCV native library bundled with the openpnp artifact.
 * Every entry point that creates a Mat goes through here first.
 */
public final class OpenCvNatives {

    private static final Logger log = LoggerFactory.getLogger(OpenCvNatives.class);

    private static boolean loaded = false;

    private OpenCvNatives() {
    }

    /**
     * Load the native library once per class loader. Safe to call repeatedly.
     */
    public static synchronized void ensureLoaded() {
        if (loaded) return;
        nu.pattern.OpenCV.loadLocally();
        loaded = true;
        log.debug("Loaded OpenCV {}", Core.VERSION);
    }
}
