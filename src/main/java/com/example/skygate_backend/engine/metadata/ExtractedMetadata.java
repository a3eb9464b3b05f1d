package com.example.skygate_backend.engine.metadata;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Descriptive fields found in a container. Absent values are {@code null}; {@code signatures}
 * holds every free-text value that may name the producing software (EXIF Software, XMP
 * CreatorTool, PNG text chunks and similar).
 */
public record ExtractedMetadata(
        Set<MetadataField> fieldsPresent,
        String make,
        String model,
        List<String> signatures,
        Instant original,
        Instant digitized,
        Instant modified,
        Double fNumber,
        Integer iso
) {
    public ExtractedMetadata {
        fieldsPresent = fieldsPresent.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(fieldsPresent));
        signatures = List.copyOf(signatures);
    }

    public boolean has(MetadataField field) {
        return fieldsPresent.contains(field);
    }

    public boolean isEmpty() {
        return fieldsPresent.isEmpty();
    }
}
