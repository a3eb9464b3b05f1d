package com.example.skygate_backend.util;

import com.example.skygate_backend.dto.DetectionVerdict;
import com.example.skygate_backend.dto.MethodOutcome;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Human-readable one-paragraph summary of a verdict, stored with the relational row.
 */
public final class VerdictSummaries {
    static final double INDICATOR_SCORE = 0.6;

    private static final Map<String, String> LABELS = Map.of(
            MethodNames.METADATA, "suspicious metadata patterns",
            MethodNames.ELA, "error level analysis",
            MethodNames.PRNU, "photo response non-uniformity",
            MethodNames.TEXTURE, "unnatural texture smoothness",
            "vit", "Vision Transformer model detection",
            "resnet_nodown", "ResNet model detection"
    );

    private VerdictSummaries() {
    }

    public static String describe(DetectionVerdict verdict) {
        if (!verdict.aiGenerated()) {
            return String.format(Locale.ROOT,
                    "This image appears to be authentic with %.1f%% confidence. No significant indicators of AI generation were detected.",
                    (1.0 - verdict.confidenceScore()) * 100.0);
        }
        StringBuilder sb = new StringBuilder(String.format(Locale.ROOT,
                "This image is likely AI-generated with %.1f%% confidence.", verdict.confidenceScore() * 100.0));
        List<String> indicators = verdict.methodOutcomes().stream()
                .filter(MethodOutcome::isOk)
                .filter(o -> o.score() > INDICATOR_SCORE)
                .sorted(Comparator.comparingDouble((MethodOutcome o) -> -o.score()).thenComparing(MethodOutcome::methodName))
                .map(o -> String.format(Locale.ROOT, "%s (%.1f%% confidence)", label(o.methodName()), o.score() * 100.0))
                .toList();
        if (!indicators.isEmpty()) {
            sb.append(" Key indicators include: ").append(String.join(", ", indicators)).append('.');
        }
        return sb.toString();
    }

    public static String label(String methodName) {
        return LABELS.getOrDefault(methodName, methodName + " model detection");
    }
}
