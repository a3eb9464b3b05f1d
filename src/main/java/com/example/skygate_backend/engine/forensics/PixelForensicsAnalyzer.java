package com.example.skygate_backend.engine.forensics;

import com.example.skygate_backend.dto.AnalysisInput;
import com.example.skygate_backend.dto.MethodOutcome;
import com.example.skygate_backend.engine.Interfaces.Analyzer;

import java.util.List;

/**
 * Groups the three pixel-domain signals. Each signal is a separate {@link Analyzer} so the
 * orchestrator can schedule them concurrently; {@link #analyze} runs them in sequence.
 */
public class PixelForensicsAnalyzer {
    private final List<ForensicSignal> signals;

    public PixelForensicsAnalyzer() {
        this(List.of(new SensorNoiseSignal(), new ErrorLevelSignal(), new TextureSignal()));
    }

    PixelForensicsAnalyzer(List<ForensicSignal> signals) {
        this.signals = List.copyOf(signals);
    }

    public List<MethodOutcome> analyze(AnalysisInput input) {
        return signals.stream().map(s -> s.produce(input)).toList();
    }

    public List<Analyzer> signals() {
        return List.copyOf(signals);
    }
}
