package com.example.skygate_backend.repository;

import com.example.skygate_backend.model.DetectionResult;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface DetectionResultRepository extends JpaRepository<DetectionResult, UUID> {
    List<DetectionResult> findByUploadReferenceOrderByDetectedAtDesc(String uploadReference);
}
