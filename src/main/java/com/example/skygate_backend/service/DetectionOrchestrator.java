package com.example.skygate_backend.service;

import com.example.skygate_backend.config.DetectionProperties;
import com.example.skygate_backend.dto.AnalysisInput;
import com.example.skygate_backend.dto.DetectionVerdict;
import com.example.skygate_backend.dto.MethodOutcome;
import com.example.skygate_backend.engine.AnalyzerCatalog;
import com.example.skygate_backend.engine.Interfaces.Analyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs every analyzer of the catalog concurrently on the shared analysis pool and combines the
 * outcomes. One deadline covers the whole upload; an analyzer still running at the deadline is
 * cancelled and reported as failed.
 */
@Service
public class DetectionOrchestrator {
    private static final Logger LOGGER = LoggerFactory.getLogger(DetectionOrchestrator.class);

    private final AnalyzerCatalog catalog;
    private final EnsembleAggregator aggregator;
    private final AggregationConfig aggregationConfig;
    private final AsyncTaskExecutor executor;
    private final Duration timeout;

    public DetectionOrchestrator(AnalyzerCatalog catalog,
                                 EnsembleAggregator aggregator,
                                 AggregationConfig aggregationConfig,
                                 @Qualifier("analysisTaskExecutor") AsyncTaskExecutor executor,
                                 DetectionProperties properties) {
        this.catalog = catalog;
        this.aggregator = aggregator;
        this.aggregationConfig = aggregationConfig;
        this.executor = executor;
        this.timeout = properties.getTimeout();
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("detection timeout must be positive, got: " + timeout);
        }
    }

    public DetectionVerdict runDetection(AnalysisInput input) {
        return aggregator.aggregate(collectOutcomes(input), aggregationConfig);
    }

    /**
     * @return one outcome per analyzer, in catalog order
     * @throws DetectionCancelledException when the calling thread is interrupted while waiting
     */
    public List<MethodOutcome> collectOutcomes(AnalysisInput input) {
        List<Analyzer> analyzers = catalog.analyzers();
        long t0 = System.nanoTime();
        long deadline = t0 + timeout.toNanos();
        LOGGER.info("DETECT START file={} mime={} frames={} methods={}", input.filename(), input.mimeType(),
                input.frames().size(), catalog.methodNames());

        List<Future<MethodOutcome>> futures = new ArrayList<>(analyzers.size());
        List<MethodOutcome> rejected = new ArrayList<>(analyzers.size());
        for (Analyzer analyzer : analyzers) {
            try {
                futures.add(executor.submit(() -> guarded(analyzer, input)));
                rejected.add(null);
            } catch (TaskRejectedException e) {
                LOGGER.warn("DETECT {} rejected by analysis pool: {}", analyzer.methodName(), e.getMessage());
                futures.add(null);
                rejected.add(MethodOutcome.failed(analyzer.methodName(), "rejected by analysis pool: pool saturated", Duration.ZERO));
            }
        }

        List<MethodOutcome> outcomes = new ArrayList<>(analyzers.size());
        for (int i = 0; i < analyzers.size(); i++) {
            Future<MethodOutcome> future = futures.get(i);
            String method = analyzers.get(i).methodName();
            if (future == null) {
                outcomes.add(rejected.get(i));
                continue;
            }
            try {
                long remaining = Math.max(0L, deadline - System.nanoTime());
                outcomes.add(future.get(remaining, TimeUnit.NANOSECONDS));
            } catch (TimeoutException e) {
                future.cancel(true);
                LOGGER.warn("DETECT {} timed out after {} ms", method, timeout.toMillis());
                outcomes.add(MethodOutcome.failed(method, "timed out after " + timeout.toMillis() + " ms", timeout));
            } catch (InterruptedException e) {
                futures.stream().filter(f -> f != null).forEach(f -> f.cancel(true));
                Thread.currentThread().interrupt();
                LOGGER.warn("DETECT cancelled file={} while waiting for {}", input.filename(), method);
                throw new DetectionCancelledException("detection cancelled for " + input.filename(), e);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                LOGGER.warn("DETECT {} crashed: {}", method, cause.toString(), cause);
                outcomes.add(MethodOutcome.failed(method, "unexpected error: " + cause, elapsedSince(t0)));
            } catch (CancellationException e) {
                outcomes.add(MethodOutcome.failed(method, "cancelled", elapsedSince(t0)));
            }
        }

        long okCount = outcomes.stream().filter(MethodOutcome::isOk).count();
        LOGGER.info("DETECT DONE file={} ok={}/{} in={}ms", input.filename(), okCount, outcomes.size(),
                elapsedSince(t0).toMillis());
        return outcomes;
    }

    private static MethodOutcome guarded(Analyzer analyzer, AnalysisInput input) {
        long t0 = System.nanoTime();
        try {
            MethodOutcome outcome = analyzer.produce(input);
            if (outcome == null) {
                return MethodOutcome.failed(analyzer.methodName(), "analyzer returned no outcome", elapsedSince(t0));
            }
            return outcome;
        } catch (RuntimeException e) {
            LOGGER.warn("DETECT {} threw: {}", analyzer.methodName(), e.toString(), e);
            return MethodOutcome.failed(analyzer.methodName(), "unexpected error: " + e, elapsedSince(t0));
        }
    }

    private static Duration elapsedSince(long t0) {
        return Duration.ofNanos(System.nanoTime() - t0);
    }
}
