package com.example.skygate_backend.util;

public enum OutcomeStatus {
    OK,
    FAILED,
    SKIPPED
}
