package com.example.skygate_backend.util;

/**
 * Stable identifiers of the built-in analysis methods. Model identifiers come from configuration.
 */
public final class MethodNames {
    public static final String METADATA = "metadata";
    public static final String PRNU = "prnu";
    public static final String ELA = "ela";
    public static final String TEXTURE = "texture";

    private MethodNames() {
    }
}
