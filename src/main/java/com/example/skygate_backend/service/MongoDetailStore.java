package com.example.skygate_backend.service;

import com.example.skygate_backend.dto.DetectionDetail;
import com.example.skygate_backend.model.DetectionDetailDocument;
import com.example.skygate_backend.repository.DetectionDetailRepository;
import com.example.skygate_backend.service.Interfaces.DetailStore;
import org.springframework.stereotype.Service;

import java.util.ArrayList;

@Service
public class MongoDetailStore implements DetailStore {
    private final DetectionDetailRepository repository;

    public MongoDetailStore(DetectionDetailRepository repository) {
        this.repository = repository;
    }

    @Override
    public void writeDetail(DetectionDetail detail) {
        String key = detail.referenceKey().toString();
        DetectionDetailDocument doc = repository.findByReferenceKey(key).orElseGet(DetectionDetailDocument::new);
        doc.setReferenceKey(key);
        doc.setUploadReference(detail.uploadReference());
        doc.setAlgorithmVersion(detail.algorithmVersion());
        doc.setAggregated(new DetectionDetailDocument.Aggregate(detail.aiGenerated(), detail.confidenceScore(),
                new ArrayList<>(detail.contributingFactors())));
        doc.setOutcomes(new ArrayList<>(detail.outcomes()));
        doc.setCreatedAt(detail.createdAt());
        repository.save(doc);
    }
}
