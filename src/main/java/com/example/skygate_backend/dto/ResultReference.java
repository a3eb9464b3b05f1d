package com.example.skygate_backend.dto;

import java.util.UUID;

/**
 * Identifies a persisted verdict. The relational summary row is the existence marker; the detail
 * document is linked through the same {@code referenceKey}.
 */
public record ResultReference(UUID referenceKey, String uploadReference) {
}
