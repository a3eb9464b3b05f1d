package com.example.skygate_backend.repository;

import com.example.skygate_backend.model.DetectionDetailDocument;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface DetectionDetailRepository extends MongoRepository<DetectionDetailDocument, String> {
    Optional<DetectionDetailDocument> findByReferenceKey(String referenceKey);
}
