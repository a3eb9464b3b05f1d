package com.example.skygate_backend.engine.model;

import com.example.skygate_backend.engine.AnalyzerException;

public class ModelInvocationException extends AnalyzerException {
    public ModelInvocationException(String message) {
        super(message);
    }

    public ModelInvocationException(String message, Throwable cause) {
        super(message, cause);
    }
}
