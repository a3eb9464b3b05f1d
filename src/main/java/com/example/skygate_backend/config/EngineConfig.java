package com.example.skygate_backend.config;

import com.example.skygate_backend.engine.AnalyzerCatalog;
import com.example.skygate_backend.engine.Interfaces.Analyzer;
import com.example.skygate_backend.engine.Interfaces.ModelRegistry;
import com.example.skygate_backend.engine.forensics.PixelForensicsAnalyzer;
import com.example.skygate_backend.engine.metadata.ExifMetadataReader;
import com.example.skygate_backend.engine.metadata.MetadataAnalyzer;
import com.example.skygate_backend.engine.metadata.MetadataScorer;
import com.example.skygate_backend.engine.model.ModelDefinition;
import com.example.skygate_backend.engine.model.ModelScorer;
import com.example.skygate_backend.engine.model.OnnxModelRegistry;
import com.example.skygate_backend.service.AggregationConfig;
import com.example.skygate_backend.service.EnsembleAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

@Configuration
public class EngineConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(EngineConfig.class);

    @Bean
    public Clock detectionClock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "close")
    public OnnxModelRegistry modelRegistry(DetectionProperties properties) {
        List<ModelDefinition> definitions = properties.getModels().stream()
                .map(m -> new ModelDefinition(m.getId(), m.getVersion(), Path.of(m.getPath()), m.getResize(), m.getCrop(),
                        m.getMean(), m.getStd(), m.getPositiveIndex()))
                .toList();
        return new OnnxModelRegistry(definitions);
    }

    @Bean
    public MetadataAnalyzer metadataAnalyzer(Clock clock) {
        return new MetadataAnalyzer(new ExifMetadataReader(), new MetadataScorer(clock));
    }

    @Bean
    public PixelForensicsAnalyzer pixelForensicsAnalyzer() {
        return new PixelForensicsAnalyzer();
    }

    @Bean
    public ModelScorer modelScorer(ModelRegistry modelRegistry) {
        return new ModelScorer(modelRegistry);
    }

    @Bean
    public AnalyzerCatalog analyzerCatalog(MetadataAnalyzer metadataAnalyzer,
                                           PixelForensicsAnalyzer pixelForensicsAnalyzer,
                                           ModelScorer modelScorer) {
        List<Analyzer> analyzers = new ArrayList<>();
        analyzers.add(metadataAnalyzer);
        analyzers.addAll(pixelForensicsAnalyzer.signals());
        analyzers.addAll(modelScorer.analyzers());
        return new AnalyzerCatalog(analyzers);
    }

    @Bean
    public AggregationConfig aggregationConfig(DetectionProperties properties, ModelRegistry modelRegistry,
                                               AnalyzerCatalog catalog) {
        AggregationConfig config = new AggregationConfig(
                properties.getWeights(),
                properties.getDefaultWeight(),
                properties.getDecisionThreshold(),
                properties.getTopFactors(),
                properties.getWeightTableId(),
                modelRegistry.version());
        for (String method : catalog.methodNames()) {
            if (!properties.getWeights().containsKey(method)) {
                LOGGER.warn("No weight configured for method={}, using default weight {}", method, config.defaultWeight());
            }
        }
        LOGGER.info("Detection configured methods={} algorithmVersion={} threshold={}",
                catalog.methodNames(), config.algorithmVersion(), config.decisionThreshold());
        return config;
    }

    @Bean
    public EnsembleAggregator ensembleAggregator() {
        return new EnsembleAggregator();
    }
}
