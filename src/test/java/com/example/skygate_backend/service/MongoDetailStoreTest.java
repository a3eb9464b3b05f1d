package com.example.skygate_backend.service;

import com.example.skygate_backend.dto.DetectionDetail;
import com.example.skygate_backend.model.DetectionDetailDocument;
import com.example.skygate_backend.repository.DetectionDetailRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MongoDetailStoreTest {

    @Mock private DetectionDetailRepository repository;

    @InjectMocks private MongoDetailStore store;

    @Test
    void writesAggregatedBlockAndOutcomes() {
        UUID key = UUID.randomUUID();
        when(repository.findByReferenceKey(key.toString())).thenReturn(Optional.empty());
        DetectionDetail detail = new DetectionDetail(key, "upload-5", "weights-v1/vit@1", true, 0.77,
                List.of("vit: high"), List.of(Map.of("method", "vit")), Instant.parse("2024-03-03T00:00:00Z"));

        store.writeDetail(detail);

        ArgumentCaptor<DetectionDetailDocument> saved = ArgumentCaptor.forClass(DetectionDetailDocument.class);
        verify(repository).save(saved.capture());
        DetectionDetailDocument doc = saved.getValue();
        assertThat(doc.getReferenceKey()).isEqualTo(key.toString());
        assertThat(doc.getUploadReference()).isEqualTo("upload-5");
        assertThat(doc.getAggregated().isAiGenerated()).isTrue();
        assertThat(doc.getAggregated().getConfidenceScore()).isEqualTo(0.77);
        assertThat(doc.getOutcomes()).hasSize(1);
    }

    @Test
    void retryOverwritesExistingDocumentForSameKey() {
        UUID key = UUID.randomUUID();
        DetectionDetailDocument existing = new DetectionDetailDocument();
        existing.setId("abc");
        existing.setReferenceKey(key.toString());
        when(repository.findByReferenceKey(key.toString())).thenReturn(Optional.of(existing));

        store.writeDetail(new DetectionDetail(key, "upload-5", "v", false, 0.1, List.of(), List.of(), Instant.EPOCH));

        verify(repository).save(existing);
        assertThat(existing.getId()).isEqualTo("abc");
        assertThat(existing.getAlgorithmVersion()).isEqualTo("v");
    }
}
