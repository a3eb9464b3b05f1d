package com.example.skygate_backend.service.Interfaces;

import com.example.skygate_backend.dto.DetectionSummary;

import java.util.UUID;

/** Relational store for verdict summaries. */
public interface SummaryStore {
    /**
     * @return the reference key of the new row
     */
    UUID writeSummary(DetectionSummary summary);
}
