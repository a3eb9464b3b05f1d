package com.example.skygate_backend.service.Interfaces;

import com.example.skygate_backend.dto.DetectionDetail;

/** Document store for the per-method evidence of a verdict. */
public interface DetailStore {
    void writeDetail(DetectionDetail detail);
}
