package com.example.skygate_backend.engine.model;

import com.example.skygate_backend.dto.AnalysisInput;
import com.example.skygate_backend.dto.MethodOutcome;
import com.example.skygate_backend.engine.Interfaces.Analyzer;
import com.example.skygate_backend.engine.Interfaces.ImagePreprocessor;
import com.example.skygate_backend.engine.Interfaces.ModelRegistry;
import com.example.skygate_backend.util.OutcomeStatus;
import com.example.skygate_backend.util.TestImages;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ModelScorerTest {

    /** Registry answering from a queue of canned probabilities; an empty queue means the model is broken. */
    private static final class CannedRegistry implements ModelRegistry {
        private final Map<String, Deque<Double>> answers = new LinkedHashMap<>();

        CannedRegistry answer(String id, Double... probabilities) {
            answers.put(id, new ArrayDeque<>(List.of(probabilities)));
            return this;
        }

        @Override
        public List<String> listRegisteredModels() {
            return List.copyOf(answers.keySet());
        }

        @Override
        public ImagePreprocessor preprocessorFor(String modelId) {
            return new ResizeNormalizePreprocessor(0, 8, new float[]{0.5f, 0.5f, 0.5f}, new float[]{0.5f, 0.5f, 0.5f});
        }

        @Override
        public double invoke(String modelId, ImageTensor tensor) throws ModelInvocationException {
            Double next = answers.get(modelId).poll();
            if (next == null) {
                throw new ModelInvocationException("model file not found: " + modelId + ".onnx");
            }
            return next;
        }

        @Override
        public String modelVersion(String modelId) {
            return "3";
        }

        @Override
        public String version() {
            return String.join(",", answers.keySet());
        }

        @Override
        public Map<String, Boolean> availability() {
            return Map.of();
        }
    }

    private static AnalysisInput image() {
        return AnalysisInput.ofBytes(TestImages.png(TestImages.noise(32, 32, 5L)), "image/png", "a.png");
    }

    @Test
    void scoreReportsModelProbability() {
        ModelScorer scorer = new ModelScorer(new CannedRegistry().answer("vit", 0.93));

        MethodOutcome outcome = scorer.score(image(), "vit");

        assertThat(outcome.status()).isEqualTo(OutcomeStatus.OK);
        assertThat(outcome.methodName()).isEqualTo("vit");
        assertThat(outcome.score()).isCloseTo(0.93, within(1e-9));
        assertThat(outcome.detail()).containsEntry("modelVersion", "3");
    }

    @Test
    void unavailableModelYieldsFailedOutcome() {
        ModelScorer scorer = new ModelScorer(new CannedRegistry().answer("resnet_nodown"));

        MethodOutcome outcome = scorer.score(image(), "resnet_nodown");

        assertThat(outcome.status()).isEqualTo(OutcomeStatus.FAILED);
        assertThat(outcome.reason()).contains("not found");
    }

    @Test
    void frameSetAveragesFrameProbabilities() {
        ModelScorer scorer = new ModelScorer(new CannedRegistry().answer("vit", 0.2, 0.6));
        byte[] frame = TestImages.png(TestImages.flat(16, 16, 40));
        AnalysisInput frames = AnalysisInput.ofFrames(new byte[]{1}, "video/mp4", "v.mp4", List.of(frame, frame));

        MethodOutcome outcome = scorer.score(frames, "vit");

        assertThat(outcome.score()).isCloseTo(0.4, within(1e-9));
        assertThat(outcome.detail()).containsEntry("framesAnalyzed", 2);
    }

    @Test
    void exposesOneAnalyzerPerRegisteredModel() {
        ModelScorer scorer = new ModelScorer(new CannedRegistry().answer("vit", 0.7).answer("resnet_nodown", 0.1));

        List<Analyzer> analyzers = scorer.analyzers();

        assertThat(analyzers).extracting(Analyzer::methodName).containsExactly("vit", "resnet_nodown");
        assertThat(analyzers.get(1).produce(image()).score()).isCloseTo(0.1, within(1e-9));
    }

    @Test
    void undecodableFrameIsSkippedWhenOthersScore() {
        ModelScorer scorer = new ModelScorer(new CannedRegistry().answer("vit", 0.3, 0.7));
        byte[] frame = TestImages.png(TestImages.flat(16, 16, 40));
        AnalysisInput frames = AnalysisInput.ofFrames(new byte[]{1}, "video/mp4", "v.mp4",
                List.of(frame, "not a frame".getBytes(), frame));

        MethodOutcome outcome = scorer.score(frames, "vit");

        assertThat(outcome.status()).isEqualTo(OutcomeStatus.OK);
        assertThat(outcome.score()).isCloseTo(0.5, within(1e-9));
        assertThat(outcome.detail()).containsEntry("framesAnalyzed", 2).containsEntry("framesFailed", 1);
    }

    @Test
    void frameSetFailsWhenNoFrameScores() {
        ModelScorer scorer = new ModelScorer(new CannedRegistry().answer("vit"));
        byte[] frame = TestImages.png(TestImages.flat(16, 16, 40));
        AnalysisInput frames = AnalysisInput.ofFrames(new byte[]{1}, "video/mp4", "v.mp4", List.of(frame, frame));

        MethodOutcome outcome = scorer.score(frames, "vit");

        assertThat(outcome.status()).isEqualTo(OutcomeStatus.FAILED);
        assertThat(outcome.reason()).startsWith("no frame could be scored (2 of 2 failed)").contains("not found");
    }
}
