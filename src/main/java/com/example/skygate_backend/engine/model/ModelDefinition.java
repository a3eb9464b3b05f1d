package com.example.skygate_backend.engine.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Static description of one model: where its ONNX file lives and how its input is prepared.
 *
 * @param resize        shorter-side resize in pixels, 0 to keep the original size
 * @param crop          side of the square center crop fed to the model
 * @param positiveIndex index of the "AI-generated" class in a multi-class output
 */
public record ModelDefinition(String id, String version, Path path, int resize, int crop,
                              float[] mean, float[] std, int positiveIndex) {
    public ModelDefinition {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(path, "path");
        if (crop <= 0) throw new IllegalArgumentException("crop must be > 0 for model " + id);
        if (resize < 0) throw new IllegalArgumentException("resize must be >= 0 for model " + id);
        if (mean == null || mean.length != 3 || std == null || std.length != 3) {
            throw new IllegalArgumentException("mean and std need three channels for model " + id);
        }
        for (float s : std) {
            if (s <= 0f) throw new IllegalArgumentException("std must be > 0 for model " + id);
        }
        if (positiveIndex < 0) throw new IllegalArgumentException("positiveIndex must be >= 0 for model " + id);
        mean = mean.clone();
        std = std.clone();
    }

    public ResizeNormalizePreprocessor preprocessor() {
        return new ResizeNormalizePreprocessor(resize, crop, mean, std);
    }
}
