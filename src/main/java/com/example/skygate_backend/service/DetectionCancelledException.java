package com.example.skygate_backend.service;

public class DetectionCancelledException extends RuntimeException {
    public DetectionCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
