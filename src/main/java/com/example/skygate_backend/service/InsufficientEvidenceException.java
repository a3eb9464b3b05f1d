package com.example.skygate_backend.service;

/** No usable outcome was left to combine into a verdict. */
public class InsufficientEvidenceException extends RuntimeException {
    public InsufficientEvidenceException(String message) {
        super(message);
    }
}
