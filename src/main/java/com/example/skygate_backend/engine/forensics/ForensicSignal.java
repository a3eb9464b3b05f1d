package com.example.skygate_backend.engine.forensics;

import com.example.skygate_backend.dto.AnalysisInput;
import com.example.skygate_backend.dto.MethodOutcome;
import com.example.skygate_backend.engine.AnalyzerException;
import com.example.skygate_backend.engine.Interfaces.Analyzer;
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
 * Base for the pixel-domain signals. Decodes every raster of the input, measures it and averages
 * the applicable measurements; a signal that applies to no raster is reported as skipped. A frame that
 * cannot be decoded is recorded and left out of the mean; the signal fails only when no frame was usable.
 */
public abstract class ForensicSignal implements Analyzer {
    private static final Logger LOGGER = LoggerFactory.getLogger(ForensicSignal.class);

    /** Measurement of a single raster. {@code score == null} means the signal does not apply. */
    public record Measurement(Double score, String skipReason, Map<String, Object> detail) {
        public static Measurement scored(double score, Map<String, Object> detail) {
            return new Measurement(SignalMath.clamp01(score), null, detail);
        }

        public static Measurement notApplicable(String reason) {
            return new Measurement(null, reason, Map.of());
        }

        public boolean applicable() {
            return score != null;
        }
    }

    protected abstract Measurement measure(ImageRasters.DecodedImage image) throws AnalyzerException;

    @Override
    public MethodOutcome produce(AnalysisInput input) {
        long t0 = System.nanoTime();
        List<Double> scores = new ArrayList<>();
        List<Map<String, Object>> frames = new ArrayList<>();
        List<Map<String, Object>> frameErrors = new ArrayList<>();
        String skipReason = null;
        try {
            List<AnalysisInput.ContentSource> sources = input.rasterSources();
            for (int i = 0; i < sources.size(); i++) {
                Measurement m;
                try {
                    m = measure(ImageRasters.decode(sources.get(i)));
                } catch (AnalyzerException e) {
                    if (!input.isFrameSet()) {
                        throw e;
                    }
                    LOGGER.debug("Signal {} could not analyze frame {} of {}: {}", methodName(), i, input.filename(), e.getMessage());
                    frameErrors.add(Map.of("frame", i, "error", e.getMessage()));
                    continue;
                }
                if (m.applicable()) {
                    scores.add(m.score());
                    frames.add(m.detail());
                } else {
                    skipReason = m.skipReason();
                }
            }
        } catch (AnalyzerException e) {
            LOGGER.warn("Signal {} failed for {}: {}", methodName(), input.filename(), e.getMessage());
            return MethodOutcome.failed(methodName(), e.getMessage(), elapsed(t0));
        } catch (RuntimeException e) {
            LOGGER.warn("Signal {} failed unexpectedly for {}", methodName(), input.filename(), e);
            return MethodOutcome.failed(methodName(), "unexpected error: " + e, elapsed(t0));
        }

        if (scores.isEmpty() && !frameErrors.isEmpty()) {
            String reason = String.format(Locale.ROOT, "no frame could be analyzed (%d of %d failed): %s",
                    frameErrors.size(), input.frames().size(), frameErrors.get(0).get("error"));
            LOGGER.warn("Signal {} failed for {}: {}", methodName(), input.filename(), reason);
            return MethodOutcome.failed(methodName(), reason, elapsed(t0));
        }
        if (scores.isEmpty()) {
            LOGGER.debug("Signal {} skipped for {}: {}", methodName(), input.filename(), skipReason);
            return MethodOutcome.skipped(methodName(), skipReason, Map.of(MethodOutcome.ANALYSIS_KEY, skipReason), elapsed(t0));
        }
        if (!input.isFrameSet()) {
            return MethodOutcome.ok(methodName(), scores.get(0), frames.get(0), elapsed(t0));
        }

        double mean = scores.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        int strongest = 0;
        for (int i = 1; i < scores.size(); i++) {
            if (scores.get(i) > scores.get(strongest)) strongest = i;
        }
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put(MethodOutcome.ANALYSIS_KEY, String.format(Locale.ROOT, "mean over %d of %d frames; strongest frame: %s",
                scores.size(), input.frames().size(), frames.get(strongest).get(MethodOutcome.ANALYSIS_KEY)));
        detail.put("framesAnalyzed", scores.size());
        detail.put("framesSkipped", input.frames().size() - scores.size() - frameErrors.size());
        detail.put("framesFailed", frameErrors.size());
        detail.put("frames", frames);
        if (!frameErrors.isEmpty()) {
            detail.put("frameErrors", frameErrors);
        }
        return MethodOutcome.ok(methodName(), SignalMath.clamp01(mean), detail, elapsed(t0));
    }

    private static Duration elapsed(long t0) {
        return Duration.ofNanos(System.nanoTime() - t0);
    }
}
