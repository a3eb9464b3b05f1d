package com.example.skygate_backend.engine.Interfaces;

import com.example.skygate_backend.engine.model.ImageTensor;
import com.example.skygate_backend.engine.model.ModelInvocationException;

import java.util.List;
import java.util.Map;

/**
 * Loaded classification models, keyed by identifier. The set of models is fixed at start-up.
 */
public interface ModelRegistry {

    List<String> listRegisteredModels();

    ImagePreprocessor preprocessorFor(String modelId);

    /**
     * @return probability in [0,1] that the tensor shows AI-generated content
     */
    double invoke(String modelId, ImageTensor tensor) throws ModelInvocationException;

    String modelVersion(String modelId);

    /** Sorted {@code id@version} list identifying the loaded model set. */
    String version();

    /** Model id to whether it loaded; a model that did not load still appears here. */
    Map<String, Boolean> availability();
}
