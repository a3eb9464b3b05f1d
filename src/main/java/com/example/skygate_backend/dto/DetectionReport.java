package com.example.skygate_backend.dto;

import com.example.skygate_backend.service.PersistenceFailureException;

import java.util.Optional;

/**
 * Outcome of {@code DetectionService.process}. A persistence failure never discards the verdict.
 *
 * @param reference          set when the summary row was written
 * @param persistenceFailure set when the summary or the detail write failed
 */
public record DetectionReport(
        DetectionVerdict verdict,
        Optional<ResultReference> reference,
        Optional<PersistenceFailureException> persistenceFailure
) {
    public boolean fullyPersisted() {
        return reference.isPresent() && persistenceFailure.isEmpty();
    }
}
