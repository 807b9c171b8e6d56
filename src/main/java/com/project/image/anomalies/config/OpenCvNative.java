package com.project.image.anomalies.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads the OpenCV native library bundled with the openpnp artifact, once per JVM.
 */
public final class OpenCvNative {
    private static final Logger log = LoggerFactory.getLogger(OpenCvNative.class);

    private static boolean loaded;

    private OpenCvNative() {}

    public static synchronized void load() {
        if (loaded) {
            return;
        }
        try {
            nu.pattern.OpenCV.loadLocally();
            loaded = true;
            log.info("OpenCV loaded successfully");
        } catch (RuntimeException | UnsatisfiedLinkError e) {
            log.error("Failed to load OpenCV", e);
            throw new IllegalStateException("OpenCV native library could not be loaded", e);
        }
    }
}
