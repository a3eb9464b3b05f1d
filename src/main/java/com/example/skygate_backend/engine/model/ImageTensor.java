package com.example.skygate_backend.engine.model;

import java.util.Arrays;

/** Dense float tensor in row-major order. */
public record ImageTensor(float[] data, long[] shape) {
    public ImageTensor {
        long expected = 1;
        for (long d : shape) expected *= d;
        if (expected != data.length) {
            throw new IllegalArgumentException("shape " + Arrays.toString(shape) + " does not match " + data.length + " values");
        }
    }
}
