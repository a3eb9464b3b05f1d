package com.example.skygate_backend.service;

import com.example.skygate_backend.dto.DetectionDetail;
import com.example.skygate_backend.dto.DetectionSummary;
import com.example.skygate_backend.dto.DetectionVerdict;
import com.example.skygate_backend.dto.MethodOutcome;
import com.example.skygate_backend.dto.ResultReference;
import com.example.skygate_backend.service.Interfaces.DetailStore;
import com.example.skygate_backend.service.Interfaces.SummaryStore;
import com.example.skygate_backend.util.SignalMath;
import com.example.skygate_backend.util.VerdictSummaries;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Writes a verdict to both stores. The relational summary goes first and yields the reference key;
 * the document detail is written under that key afterwards. A failed summary write skips the detail.
 */
@Service
public class ResultAssembler {
    private static final Logger LOGGER = LoggerFactory.getLogger(ResultAssembler.class);
    private static final TypeReference<Map<String, Object>> DETAIL_TYPE = new TypeReference<>() {
    };

    private final SummaryStore summaryStore;
    private final DetailStore detailStore;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ResultAssembler(SummaryStore summaryStore, DetailStore detailStore, ObjectMapper objectMapper, Clock clock) {
        this.summaryStore = summaryStore;
        this.detailStore = detailStore;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * @throws PersistenceFailureException with stage SUMMARY when nothing was written, or stage
     *                                     DETAIL (carrying the reference key) when only the summary exists
     */
    public ResultReference persist(DetectionVerdict verdict, String uploadReference) {
        Instant now = clock.instant();
        UUID key;
        try {
            key = summaryStore.writeSummary(toSummary(verdict, uploadReference, now));
        } catch (RuntimeException e) {
            LOGGER.error("PERSIST summary failed upload={} reason={}", uploadReference, e.toString(), e);
            throw PersistenceFailureException.summary(e);
        }
        writeDetail(key, verdict, uploadReference, now);
        LOGGER.info("PERSIST DONE upload={} key={} aiGenerated={} confidence={}", uploadReference, key,
                verdict.aiGenerated(), verdict.confidenceScore());
        return new ResultReference(key, uploadReference);
    }

    /** Re-attempts the detail write for a summary row that already exists. */
    public ResultReference retryDetail(UUID referenceKey, DetectionVerdict verdict, String uploadReference) {
        writeDetail(referenceKey, verdict, uploadReference, clock.instant());
        LOGGER.info("PERSIST detail retry succeeded key={}", referenceKey);
        return new ResultReference(referenceKey, uploadReference);
    }

    private void writeDetail(UUID key, DetectionVerdict verdict, String uploadReference, Instant now) {
        try {
            detailStore.writeDetail(toDetail(key, verdict, uploadReference, now));
        } catch (RuntimeException e) {
            LOGGER.warn("PERSIST detail failed key={} upload={} reason={}", key, uploadReference, e.toString());
            throw PersistenceFailureException.detail(key, e);
        }
    }

    DetectionSummary toSummary(DetectionVerdict verdict, String uploadReference, Instant detectedAt) {
        Map<String, Double> methodScores = new LinkedHashMap<>();
        long slowest = 0L;
        for (MethodOutcome o : verdict.methodOutcomes()) {
            slowest = Math.max(slowest, o.processingTime().toMillis());
            if (o.isOk()) {
                methodScores.put(o.methodName(), SignalMath.round(o.score(), 4));
            }
        }
        return new DetectionSummary(
                uploadReference,
                verdict.aiGenerated(),
                BigDecimal.valueOf(verdict.confidenceScore()).setScale(4, RoundingMode.HALF_UP),
                slowest,
                verdict.algorithmVersion(),
                VerdictSummaries.describe(verdict),
                methodScores,
                detectedAt);
    }

    DetectionDetail toDetail(UUID key, DetectionVerdict verdict, String uploadReference, Instant createdAt) {
        List<Map<String, Object>> outcomes = new ArrayList<>(verdict.methodOutcomes().size());
        for (MethodOutcome o : verdict.methodOutcomes()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("method", o.methodName());
            entry.put("status", o.status().name());
            entry.put("score", o.score());
            entry.put("reason", o.reason());
            entry.put("processingTimeMs", o.processingTime().toMillis());
            entry.put("detail", objectMapper.convertValue(o.detail(), DETAIL_TYPE));
            outcomes.add(entry);
        }
        return new DetectionDetail(key, uploadReference, verdict.algorithmVersion(), verdict.aiGenerated(),
                verdict.confidenceScore(), verdict.contributingFactors(), outcomes, createdAt);
    }
}
