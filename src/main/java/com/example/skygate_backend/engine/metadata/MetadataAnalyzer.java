package com.example.skygate_backend.engine.metadata;

import com.example.skygate_backend.dto.AnalysisInput;
import com.example.skygate_backend.dto.MethodOutcome;
import com.example.skygate_backend.engine.AnalyzerException;
import com.example.skygate_backend.engine.Interfaces.Analyzer;
import com.example.skygate_backend.util.MethodNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class MetadataAnalyzer implements Analyzer {
    private static final Logger LOGGER = LoggerFactory.getLogger(MetadataAnalyzer.class);

    private final ExifMetadataReader reader;
    private final MetadataScorer scorer;

    public MetadataAnalyzer(ExifMetadataReader reader, MetadataScorer scorer) {
        this.reader = reader;
        this.scorer = scorer;
    }

    @Override
    public String methodName() {
        return MethodNames.METADATA;
    }

    /** Reads the primary content; for a frame set that is the video container. */
    @Override
    public MethodOutcome produce(AnalysisInput input) {
        long t0 = System.nanoTime();
        ExtractedMetadata metadata;
        try {
            metadata = reader.read(input.content());
        } catch (AnalyzerException e) {
            LOGGER.warn("Metadata extraction failed for {}: {}", input.filename(), e.getMessage());
            return MethodOutcome.failed(methodName(), e.getMessage(), Duration.ofNanos(System.nanoTime() - t0));
        } catch (RuntimeException e) {
            LOGGER.warn("Metadata extraction failed unexpectedly for {}", input.filename(), e);
            return MethodOutcome.failed(methodName(), "unexpected error: " + e, Duration.ofNanos(System.nanoTime() - t0));
        }

        MetadataScorer.Assessment assessment = scorer.assess(metadata);
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put(MethodOutcome.ANALYSIS_KEY, summarize(assessment.indicators()));
        detail.put("indicators", assessment.indicators());
        detail.put("fieldsPresent", metadata.fieldsPresent().stream().map(Enum::name).sorted().toList());
        if (!metadata.signatures().isEmpty()) {
            detail.put("software", metadata.signatures().get(0));
        }
        if (metadata.make() != null) detail.put("make", metadata.make());
        if (metadata.model() != null) detail.put("model", metadata.model());
        assessment.generator().ifPresent(g -> detail.put("generator", g));
        return MethodOutcome.ok(methodName(), assessment.score(), detail, Duration.ofNanos(System.nanoTime() - t0));
    }

    private static String summarize(List<String> indicators) {
        if (indicators.isEmpty()) {
            return "camera metadata complete and consistent";
        }
        return String.join("; ", indicators);
    }
}
