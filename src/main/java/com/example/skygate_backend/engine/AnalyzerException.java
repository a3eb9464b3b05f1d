package com.example.skygate_backend.engine;

/**
 * Raised inside an analyzer when it cannot produce a score. Never crosses the analyzer boundary;
 * it is converted into a failed outcome.
 */
public class AnalyzerException extends Exception {
    public AnalyzerException(String message) {
        super(message);
    }

    public AnalyzerException(String message, Throwable cause) {
        super(message, cause);
    }
}
