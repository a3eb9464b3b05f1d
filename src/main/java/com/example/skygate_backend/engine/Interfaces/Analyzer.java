package com.example.skygate_backend.engine.Interfaces;

import com.example.skygate_backend.dto.AnalysisInput;
import com.example.skygate_backend.dto.MethodOutcome;

/**
 * One independently schedulable analysis method. Implementations turn their own failures into
 * {@code FAILED} or {@code SKIPPED} outcomes instead of throwing.
 */
public interface Analyzer {
    String methodName();

    MethodOutcome produce(AnalysisInput input);
}
