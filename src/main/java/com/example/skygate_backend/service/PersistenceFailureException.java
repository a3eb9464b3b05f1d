package com.example.skygate_backend.service;

import com.example.skygate_backend.util.PersistenceStage;

import java.util.Optional;
import java.util.UUID;

/**
 * A write to the result stores failed. For {@link PersistenceStage#DETAIL} the summary row already
 * exists and {@link #getReferenceKey()} identifies it.
 */
public class PersistenceFailureException extends RuntimeException {
    private final PersistenceStage stage;
    private final UUID referenceKey;

    public PersistenceFailureException(PersistenceStage stage, UUID referenceKey, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
        this.referenceKey = referenceKey;
    }

    public static PersistenceFailureException summary(Throwable cause) {
        return new PersistenceFailureException(PersistenceStage.SUMMARY, null,
                "summary write failed: " + cause.getMessage(), cause);
    }

    public static PersistenceFailureException detail(UUID referenceKey, Throwable cause) {
        return new PersistenceFailureException(PersistenceStage.DETAIL, referenceKey,
                "detail write failed for " + referenceKey + ": " + cause.getMessage(), cause);
    }

    public PersistenceStage getStage() {
        return stage;
    }

    public Optional<UUID> getReferenceKey() {
        return Optional.ofNullable(referenceKey);
    }
}
