package com.example.skygate_backend.engine;

import com.example.skygate_backend.engine.Interfaces.Analyzer;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/** Every analyzer run for an upload: metadata, the pixel signals and one per registered model. */
public class AnalyzerCatalog {
    private final List<Analyzer> analyzers;

    public AnalyzerCatalog(List<Analyzer> analyzers) {
        Set<String> seen = new HashSet<>();
        for (Analyzer a : analyzers) {
            if (!seen.add(a.methodName())) {
                throw new IllegalArgumentException("duplicate analysis method: " + a.methodName());
            }
        }
        this.analyzers = List.copyOf(analyzers);
    }

    public List<Analyzer> analyzers() {
        return analyzers;
    }

    public List<String> methodNames() {
        return analyzers.stream().map(Analyzer::methodName).toList();
    }
}
