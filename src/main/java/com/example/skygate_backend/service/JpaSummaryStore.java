package com.example.skygate_backend.service;

import com.example.skygate_backend.dto.DetectionSummary;
import com.example.skygate_backend.model.DetectionResult;
import com.example.skygate_backend.repository.DetectionResultRepository;
import com.example.skygate_backend.service.Interfaces.SummaryStore;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

@Service
public class JpaSummaryStore implements SummaryStore {
    private final DetectionResultRepository repository;

    public JpaSummaryStore(DetectionResultRepository repository) {
        this.repository = repository;
    }

    @Override
    @Transactional
    public UUID writeSummary(DetectionSummary summary) {
        DetectionResult row = new DetectionResult(
                summary.uploadReference(),
                summary.aiGenerated(),
                summary.confidenceScore(),
                summary.slowestMethodMs(),
                summary.algorithmVersion(),
                summary.resultSummary(),
                summary.methodScores(),
                summary.detectedAt());
        return repository.saveAndFlush(row).getId();
    }
}
