package com.example.skygate_backend.service;

import com.example.skygate_backend.config.DetectionProperties;
import com.example.skygate_backend.dto.AnalysisInput;
import com.example.skygate_backend.dto.DetectionVerdict;
import com.example.skygate_backend.dto.MethodOutcome;
import com.example.skygate_backend.engine.AnalyzerCatalog;
import com.example.skygate_backend.engine.Interfaces.Analyzer;
import com.example.skygate_backend.util.OutcomeStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DetectionOrchestratorTest {

    private ThreadPoolTaskExecutor executor;

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.shutdown();
        }
    }

    private static Analyzer analyzer(String name, Function<AnalysisInput, MethodOutcome> body) {
        return new Analyzer() {
            @Override
            public String methodName() {
                return name;
            }

            @Override
            public MethodOutcome produce(AnalysisInput input) {
                return body.apply(input);
            }
        };
    }

    private static Analyzer fixed(String name, double score) {
        return analyzer(name, in -> MethodOutcome.ok(name, score, Map.of("analysis", name), Duration.ofMillis(1)));
    }

    private DetectionOrchestrator orchestrator(List<Analyzer> analyzers, Duration timeout, int threads, int queue) {
        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(queue);
        executor.setThreadNamePrefix("analysis-test-");
        executor.initialize();
        DetectionProperties props = new DetectionProperties();
        props.setTimeout(timeout);
        return new DetectionOrchestrator(new AnalyzerCatalog(analyzers), new EnsembleAggregator(),
                AggregationConfig.defaults(Map.of(), ""), executor, props);
    }

    private static AnalysisInput input() {
        return AnalysisInput.ofBytes(new byte[]{1, 2, 3}, "image/png", "x.png");
    }

    @Test
    void outcomesFollowCatalogOrder() {
        DetectionOrchestrator o = orchestrator(List.of(fixed("metadata", 0.2), fixed("ela", 0.4), fixed("vit", 0.9)),
                Duration.ofSeconds(5), 4, 16);

        DetectionVerdict v = o.runDetection(input());

        assertThat(v.methodOutcomes()).extracting(MethodOutcome::methodName).containsExactly("metadata", "ela", "vit");
        assertThat(v.confidenceScore()).isBetween(0.49, 0.51);
    }

    @Test
    void analyzersRunConcurrently() {
        CountDownLatch allStarted = new CountDownLatch(3);
        Function<String, Analyzer> waiting = name -> analyzer(name, in -> {
            allStarted.countDown();
            try {
                boolean together = allStarted.await(2, TimeUnit.SECONDS);
                return together
                        ? MethodOutcome.ok(name, 0.5, Map.of(), Duration.ZERO)
                        : MethodOutcome.failed(name, "ran alone", Duration.ZERO);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return MethodOutcome.failed(name, "interrupted", Duration.ZERO);
            }
        });
        DetectionOrchestrator o = orchestrator(List.of(waiting.apply("a"), waiting.apply("b"), waiting.apply("c")),
                Duration.ofSeconds(5), 3, 16);

        List<MethodOutcome> outcomes = o.collectOutcomes(input());

        assertThat(outcomes).extracting(MethodOutcome::status).containsOnly(OutcomeStatus.OK);
    }

    @Test
    void slowAnalyzerTimesOutAndIsCancelled() throws Exception {
        CountDownLatch interrupted = new CountDownLatch(1);
        Analyzer slow = analyzer("vit", in -> {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
                Thread.currentThread().interrupt();
            }
            return MethodOutcome.failed("vit", "interrupted", Duration.ZERO);
        });
        DetectionOrchestrator o = orchestrator(List.of(fixed("metadata", 0.8), slow), Duration.ofMillis(200), 2, 16);

        DetectionVerdict v = o.runDetection(input());

        MethodOutcome timedOut = v.methodOutcomes().get(1);
        assertThat(timedOut.status()).isEqualTo(OutcomeStatus.FAILED);
        assertThat(timedOut.reason()).isEqualTo("timed out after 200 ms");
        assertThat(v.confidenceScore()).isEqualTo(0.8);
        assertThat(interrupted.await(2, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void throwingAnalyzerBecomesFailedOutcome() {
        Analyzer broken = analyzer("texture", in -> {
            throw new IllegalStateException("boom");
        });
        DetectionOrchestrator o = orchestrator(List.of(broken, fixed("ela", 0.3)), Duration.ofSeconds(5), 2, 16);

        DetectionVerdict v = o.runDetection(input());

        assertThat(v.methodOutcomes().get(0).status()).isEqualTo(OutcomeStatus.FAILED);
        assertThat(v.methodOutcomes().get(0).reason()).contains("boom");
        assertThat(v.confidenceScore()).isEqualTo(0.3);
    }

    @Test
    void allFailedIsInsufficientEvidence() {
        Analyzer broken = analyzer("texture", in -> MethodOutcome.failed("texture", "unreadable", Duration.ZERO));
        DetectionOrchestrator o = orchestrator(List.of(broken), Duration.ofSeconds(5), 1, 4);

        assertThatThrownBy(() -> o.runDetection(input())).isInstanceOf(InsufficientEvidenceException.class);
    }

    @Test
    void saturatedPoolRejectsAsFailedOutcome() {
        Analyzer busy = analyzer("metadata", in -> {
            try {
                Thread.sleep(300);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return MethodOutcome.ok("metadata", 0.6, Map.of(), Duration.ZERO);
        });
        DetectionOrchestrator o = orchestrator(List.of(busy, fixed("ela", 0.1)), Duration.ofSeconds(5), 1, 0);

        List<MethodOutcome> outcomes = o.collectOutcomes(input());

        assertThat(outcomes.get(0).status()).isEqualTo(OutcomeStatus.OK);
        assertThat(outcomes.get(1).status()).isEqualTo(OutcomeStatus.FAILED);
        assertThat(outcomes.get(1).reason()).contains("rejected");
    }

    @Test
    void interruptingTheCallerCancelsDetection() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch analyzerInterrupted = new CountDownLatch(1);
        Analyzer slow = analyzer("prnu", in -> {
            started.countDown();
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                analyzerInterrupted.countDown();
                Thread.currentThread().interrupt();
            }
            return MethodOutcome.failed("prnu", "interrupted", Duration.ZERO);
        });
        DetectionOrchestrator o = orchestrator(List.of(slow), Duration.ofSeconds(30), 1, 4);
        AtomicReference<Throwable> thrown = new AtomicReference<>();

        Thread caller = new Thread(() -> {
            try {
                o.runDetection(input());
            } catch (Throwable t) {
                thrown.set(t);
            }
        });
        caller.start();
        assertThat(started.await(2, TimeUnit.SECONDS)).isTrue();
        caller.interrupt();
        caller.join(2_000);

        assertThat(thrown.get()).isInstanceOf(DetectionCancelledException.class);
        assertThat(analyzerInterrupted.await(2, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void nonPositiveTimeoutIsRejected() {
        assertThatThrownBy(() -> orchestrator(List.of(fixed("ela", 0.1)), Duration.ZERO, 1, 1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
