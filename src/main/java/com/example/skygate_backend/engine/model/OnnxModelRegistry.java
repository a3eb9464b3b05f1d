package com.example.skygate_backend.engine.model;

import ai.onnxruntime.OnnxTensor;
import ai.onnxruntime.OnnxValue;
import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import com.example.skygate_backend.engine.Interfaces.ImagePreprocessor;
import com.example.skygate_backend.engine.Interfaces.ModelRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.FloatBuffer;
import java.nio.file.Files;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * ONNX Runtime backed registry. Every configured model is registered; one whose file is missing
 * or fails to load stays registered without a session and fails on invocation.
 */
public class OnnxModelRegistry implements ModelRegistry, AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(OnnxModelRegistry.class);

    private record Entry(ModelDefinition definition, ImagePreprocessor preprocessor, OrtSession session, String loadError) {
    }

    private final Map<String, Entry> entries;
    private final String version;
    private OrtEnvironment environment;

    public OnnxModelRegistry(List<ModelDefinition> definitions) {
        Map<String, Entry> loaded = new LinkedHashMap<>();
        for (ModelDefinition def : definitions) {
            if (loaded.containsKey(def.id())) {
                throw new IllegalArgumentException("duplicate model id: " + def.id());
            }
            loaded.put(def.id(), load(def));
        }
        this.entries = Collections.unmodifiableMap(loaded);
        this.version = entries.values().stream()
                .map(e -> e.definition().id() + "@" + e.definition().version())
                .sorted()
                .collect(Collectors.joining(","));
    }

    private Entry load(ModelDefinition def) {
        ImagePreprocessor preprocessor = def.preprocessor();
        if (!Files.isRegularFile(def.path())) {
            LOGGER.warn("Model {} unavailable: file {} not found", def.id(), def.path());
            return new Entry(def, preprocessor, null, "model file not found: " + def.path());
        }
        try {
            if (environment == null) {
                environment = OrtEnvironment.getEnvironment();
            }
            OrtSession session;
            try (OrtSession.SessionOptions options = new OrtSession.SessionOptions()) {
                options.setOptimizationLevel(OrtSession.SessionOptions.OptLevel.ALL_OPT);
                session = environment.createSession(def.path().toAbsolutePath().toString(), options);
            }
            LOGGER.info("Loaded model {}@{} from {} ({})", def.id(), def.version(), def.path(), preprocessor.describe());
            return new Entry(def, preprocessor, session, null);
        } catch (OrtException | RuntimeException | LinkageError e) {
            LOGGER.warn("Model {} unavailable: load failed from {}", def.id(), def.path(), e);
            return new Entry(def, preprocessor, null, "model failed to load: " + e.getMessage());
        }
    }

    @Override
    public List<String> listRegisteredModels() {
        return List.copyOf(entries.keySet());
    }

    @Override
    public ImagePreprocessor preprocessorFor(String modelId) {
        return entry(modelId).preprocessor();
    }

    @Override
    public double invoke(String modelId, ImageTensor tensor) throws ModelInvocationException {
        Entry entry = entries.get(modelId);
        if (entry == null) {
            throw new ModelInvocationException("unknown model: " + modelId);
        }
        if (entry.session() == null) {
            throw new ModelInvocationException(entry.loadError());
        }
        OrtSession session = entry.session();
        String inputName = session.getInputNames().iterator().next();
        try (OnnxTensor input = OnnxTensor.createTensor(environment, FloatBuffer.wrap(tensor.data()), tensor.shape());
             OrtSession.Result result = session.run(Map.of(inputName, input))) {
            OnnxValue output = result.get(0);
            return toProbability(flatten(output.getValue()), entry.definition().positiveIndex());
        } catch (OrtException e) {
            throw new ModelInvocationException("inference failed for " + modelId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String modelVersion(String modelId) {
        return entry(modelId).definition().version();
    }

    @Override
    public String version() {
        return version;
    }

    @Override
    public Map<String, Boolean> availability() {
        Map<String, Boolean> out = new LinkedHashMap<>();
        entries.forEach((id, e) -> out.put(id, e.session() != null));
        return out;
    }

    private Entry entry(String modelId) {
        Entry entry = entries.get(modelId);
        if (entry == null) {
            throw new IllegalArgumentException("unknown model: " + modelId);
        }
        return entry;
    }

    private static float[] flatten(Object value) throws ModelInvocationException {
        if (value instanceof float[][] batch && batch.length > 0) {
            return batch[0];
        }
        if (value instanceof float[] flat) {
            return flat;
        }
        throw new ModelInvocationException("unexpected model output type: " + (value == null ? "null" : value.getClass().getSimpleName()));
    }

    /**
     * Maps raw model output to a probability: softmax over multi-class logits taking
     * {@code positiveIndex}; a single output is passed through a sigmoid unless it already lies in [0,1].
     */
    static double toProbability(float[] output, int positiveIndex) throws ModelInvocationException {
        if (output.length == 0) {
            throw new ModelInvocationException("model produced no output");
        }
        if (output.length == 1) {
            double v = output[0];
            if (Double.isNaN(v)) throw new ModelInvocationException("model produced NaN");
            return v >= 0.0 && v <= 1.0 ? v : 1.0 / (1.0 + Math.exp(-v));
        }
        if (positiveIndex >= output.length) {
            throw new ModelInvocationException("positive index " + positiveIndex + " outside output of size " + output.length);
        }
        double max = Double.NEGATIVE_INFINITY;
        for (float v : output) max = Math.max(max, v);
        double sum = 0;
        for (float v : output) sum += Math.exp(v - max);
        double p = Math.exp(output[positiveIndex] - max) / sum;
        if (Double.isNaN(p)) throw new ModelInvocationException("model produced NaN");
        return p;
    }

    @Override
    public void close() {
        for (Entry e : entries.values()) {
            if (e.session() == null) continue;
            try {
                e.session().close();
            } catch (OrtException ex) {
                LOGGER.warn("Closing model {} failed", e.definition().id(), ex);
            }
        }
    }
}
