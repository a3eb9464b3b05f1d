package com.example.skygate_backend.util;

public enum PersistenceStage {
    SUMMARY,
    DETAIL
}
