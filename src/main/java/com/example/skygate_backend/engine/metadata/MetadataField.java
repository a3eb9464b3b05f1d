package com.example.skygate_backend.engine.metadata;

/** Descriptive metadata groups whose presence the metadata analyzer reports. */
public enum MetadataField {
    DEVICE,
    SOFTWARE,
    EXPOSURE,
    LENS,
    GPS,
    CAPTURE_TIME,
    XMP,
    IPTC,
    TEXT_CHUNKS
}
