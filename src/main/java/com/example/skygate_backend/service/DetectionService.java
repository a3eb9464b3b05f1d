package com.example.skygate_backend.service;

import com.example.skygate_backend.dto.AnalysisInput;
import com.example.skygate_backend.dto.DetectionReport;
import com.example.skygate_backend.dto.DetectionVerdict;
import com.example.skygate_backend.dto.ResultReference;
import com.example.skygate_backend.util.PersistenceStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Entry point for one upload: run detection, then persist. Persistence failures are reported in
 * the returned {@link DetectionReport}; {@link InsufficientEvidenceException} and
 * {@link DetectionCancelledException} propagate and nothing is written.
 */
@Service
public class DetectionService {
    private static final Logger LOGGER = LoggerFactory.getLogger(DetectionService.class);

    private final DetectionOrchestrator orchestrator;
    private final ResultAssembler assembler;

    public DetectionService(DetectionOrchestrator orchestrator, ResultAssembler assembler) {
        this.orchestrator = orchestrator;
        this.assembler = assembler;
    }

    public DetectionReport process(AnalysisInput input, String uploadReference) {
        if (uploadReference == null || uploadReference.isBlank()) {
            throw new IllegalArgumentException("uploadReference is required");
        }
        DetectionVerdict verdict = orchestrator.runDetection(input);
        LOGGER.info("DETECT VERDICT upload={} aiGenerated={} confidence={} version={}", uploadReference,
                verdict.aiGenerated(), verdict.confidenceScore(), verdict.algorithmVersion());
        try {
            ResultReference reference = assembler.persist(verdict, uploadReference);
            return new DetectionReport(verdict, Optional.of(reference), Optional.empty());
        } catch (PersistenceFailureException e) {
            Optional<ResultReference> partial = e.getStage() == PersistenceStage.DETAIL
                    ? e.getReferenceKey().map(key -> new ResultReference(key, uploadReference))
                    : Optional.empty();
            return new DetectionReport(verdict, partial, Optional.of(e));
        }
    }
}
