package com.example.skygate_backend.service;

import com.example.skygate_backend.dto.DetectionVerdict;
import com.example.skygate_backend.dto.MethodOutcome;
import com.example.skygate_backend.util.SignalMath;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Weighted mean over the OK outcomes of a run. Pure: the same outcomes and config always give the
 * same verdict.
 */
public class EnsembleAggregator {

    public DetectionVerdict aggregate(List<MethodOutcome> outcomes, AggregationConfig config) {
        List<MethodOutcome> usable = outcomes.stream().filter(MethodOutcome::isOk).toList();
        if (usable.isEmpty()) {
            throw new InsufficientEvidenceException("no analysis method produced a score ("
                    + outcomes.size() + " outcomes, none ok)");
        }

        double weightSum = 0.0;
        double weighted = 0.0;
        for (MethodOutcome o : usable) {
            double w = config.weightFor(o.methodName());
            weightSum += w;
            weighted += w * o.score();
        }
        if (weightSum <= 0.0) {
            throw new InsufficientEvidenceException("every scored method carries weight 0");
        }
        double confidence = SignalMath.clamp01(weighted / weightSum);

        List<String> factors = usable.stream()
                .sorted(Comparator.<MethodOutcome>comparingDouble(o -> -o.score() * config.weightFor(o.methodName()))
                        .thenComparing(MethodOutcome::methodName))
                .limit(config.topFactors())
                .map(o -> factor(o, config.weightFor(o.methodName())))
                .toList();

        return new DetectionVerdict(confidence >= config.decisionThreshold(), confidence, factors, outcomes,
                config.algorithmVersion());
    }

    static String factor(MethodOutcome outcome, double weight) {
        return String.format(Locale.ROOT, "%s: %s (score %.2f, weight %.2f)",
                outcome.methodName(), outcome.analysis(), outcome.score(), weight);
    }
}
