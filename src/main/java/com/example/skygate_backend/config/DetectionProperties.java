package com.example.skygate_backend.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Combination parameters, per-upload timeout and model definitions.
 */
@Validated
@ConfigurationProperties(prefix = "detection")
public class DetectionProperties {

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double decisionThreshold = 0.5;
    @DecimalMin("0.0")
    private double defaultWeight = 1.0;
    @Min(1)
    private int topFactors = 5;
    @NotNull
    private Duration timeout = Duration.ofSeconds(30);
    @NotBlank
    private String weightTableId = "weights-v1";
    private Map<String, Double> weights = new LinkedHashMap<>();
    @Valid
    private List<Model> models = new ArrayList<>();

    public double getDecisionThreshold() {
        return decisionThreshold;
    }

    public void setDecisionThreshold(double decisionThreshold) {
        this.decisionThreshold = decisionThreshold;
    }

    public double getDefaultWeight() {
        return defaultWeight;
    }

    public void setDefaultWeight(double defaultWeight) {
        this.defaultWeight = defaultWeight;
    }

    public int getTopFactors() {
        return topFactors;
    }

    public void setTopFactors(int topFactors) {
        this.topFactors = topFactors;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    public String getWeightTableId() {
        return weightTableId;
    }

    public void setWeightTableId(String weightTableId) {
        this.weightTableId = weightTableId;
    }

    public Map<String, Double> getWeights() {
        return weights;
    }

    public void setWeights(Map<String, Double> weights) {
        this.weights = weights;
    }

    public List<Model> getModels() {
        return models;
    }

    public void setModels(List<Model> models) {
        this.models = models;
    }

    public static class Model {
        @NotBlank
        private String id;
        @NotBlank
        private String version = "1";
        @NotBlank
        private String path;
        @Min(0)
        private int resize = 0;
        @Min(1)
        private int crop = 224;
        private float[] mean = {0.485f, 0.456f, 0.406f};
        private float[] std = {0.229f, 0.224f, 0.225f};
        @Min(0)
        private int positiveIndex = 1;

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getVersion() {
            return version;
        }

        public void setVersion(String version) {
            this.version = version;
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public int getResize() {
            return resize;
        }

        public void setResize(int resize) {
            this.resize = resize;
        }

        public int getCrop() {
            return crop;
        }

        public void setCrop(int crop) {
            this.crop = crop;
        }

        public float[] getMean() {
            return mean;
        }

        public void setMean(float[] mean) {
            this.mean = mean;
        }

        public float[] getStd() {
            return std;
        }

        public void setStd(float[] std) {
            this.std = std;
        }

        public int getPositiveIndex() {
            return positiveIndex;
        }

        public void setPositiveIndex(int positiveIndex) {
            this.positiveIndex = positiveIndex;
        }
    }
}
