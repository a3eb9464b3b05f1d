package com.example.skygate_backend.engine.model;

import com.example.skygate_backend.dto.AnalysisInput;
import com.example.skygate_backend.dto.MethodOutcome;
import com.example.skygate_backend.engine.AnalyzerException;
import com.example.skygate_backend.engine.Interfaces.Analyzer;
import com.example.skygate_backend.engine.Interfaces.ModelRegistry;
import com.example.skygate_backend.util.ImageRasters;
import com.example.skygate_backend.util.SignalMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Scores an input with one registered model. Frame sets are scored frame by frame and averaged over
 * the frames that could be scored.
 */
public class ModelScorer {
    private static final Logger LOGGER = LoggerFactory.getLogger(ModelScorer.class);

    private final ModelRegistry registry;

    public ModelScorer(ModelRegistry registry) {
        this.registry = registry;
    }

    public MethodOutcome score(AnalysisInput input, String modelId) {
        long t0 = System.nanoTime();
        try {
            List<Double> probabilities = new ArrayList<>();
            List<Map<String, Object>> frameErrors = new ArrayList<>();
            List<AnalysisInput.ContentSource> sources = input.rasterSources();
            for (int i = 0; i < sources.size(); i++) {
                try {
                    probabilities.add(scoreRaster(sources.get(i), modelId));
                } catch (AnalyzerException e) {
                    if (!input.isFrameSet()) {
                        throw e;
                    }
                    LOGGER.debug("Model {} could not score frame {} of {}: {}", modelId, i, input.filename(), e.getMessage());
                    frameErrors.add(Map.of("frame", i, "error", e.getMessage()));
                }
            }
            if (probabilities.isEmpty()) {
                throw new AnalyzerException(String.format(Locale.ROOT, "no frame could be scored (%d of %d failed): %s",
                        frameErrors.size(), sources.size(), frameErrors.get(0).get("error")));
            }
            double probability = SignalMath.clamp01(probabilities.stream().mapToDouble(Double::doubleValue).average().orElse(0.0));

            Map<String, Object> detail = new LinkedHashMap<>();
            detail.put(MethodOutcome.ANALYSIS_KEY, String.format(Locale.ROOT, "%s model probability %.2f%s",
                    modelId, probability, input.isFrameSet() ? " averaged over " + probabilities.size() + " frames" : ""));
            detail.put("probability", SignalMath.round(probability, 4));
            detail.put("modelVersion", registry.modelVersion(modelId));
            if (input.isFrameSet()) {
                detail.put("framesAnalyzed", probabilities.size());
                detail.put("framesFailed", frameErrors.size());
                detail.put("frameProbabilities", probabilities.stream().map(p -> SignalMath.round(p, 4)).toList());
                if (!frameErrors.isEmpty()) {
                    detail.put("frameErrors", frameErrors);
                }
            }
            return MethodOutcome.ok(modelId, probability, detail, elapsed(t0));
        } catch (AnalyzerException e) {
            LOGGER.warn("Model {} failed for {}: {}", modelId, input.filename(), e.getMessage());
            return MethodOutcome.failed(modelId, e.getMessage(), elapsed(t0));
        } catch (RuntimeException e) {
            LOGGER.warn("Model {} failed unexpectedly for {}", modelId, input.filename(), e);
            return MethodOutcome.failed(modelId, "unexpected error: " + e, elapsed(t0));
        }
    }

    private double scoreRaster(AnalysisInput.ContentSource source, String modelId) throws AnalyzerException {
        ImageRasters.DecodedImage decoded = ImageRasters.decode(source);
        ImageTensor tensor = registry.preprocessorFor(modelId).apply(decoded.image());
        return registry.invoke(modelId, tensor);
    }

    /** One analyzer per registered model, named by the model id. */
    public List<Analyzer> analyzers() {
        return registry.listRegisteredModels().stream()
                .<Analyzer>map(id -> new Analyzer() {
                    @Override
                    public String methodName() {
                        return id;
                    }

                    @Override
                    public MethodOutcome produce(AnalysisInput input) {
                        return score(input, id);
                    }
                })
                .toList();
    }

    private static Duration elapsed(long t0) {
        return Duration.ofNanos(System.nanoTime() - t0);
    }
}
