package com.example.skygate_backend.dto;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Artifact under test. Every analyzer opens its own stream, so one instance can be shared across
 * concurrently running analyzers.
 *
 * @param content  primary bytes (the image, or the video container for a frame set)
 * @param mimeType declared MIME type
 * @param filename original filename, informational only
 * @param frames   decoded-frame images of a video, empty for a single image
 */
public record AnalysisInput(ContentSource content, String mimeType, String filename, List<ContentSource> frames) {

    /** Opens a fresh stream over a piece of content on every call. */
    @FunctionalInterface
    public interface ContentSource {
        InputStream open() throws IOException;
    }

    public AnalysisInput {
        Objects.requireNonNull(content, "content");
        mimeType = mimeType == null ? "application/octet-stream" : mimeType.toLowerCase(Locale.ROOT);
        frames = frames == null ? List.of() : List.copyOf(frames);
    }

    public static AnalysisInput ofBytes(byte[] bytes, String mimeType, String filename) {
        Objects.requireNonNull(bytes, "bytes");
        return new AnalysisInput(bytesSource(bytes), mimeType, filename, List.of());
    }

    public static AnalysisInput ofPath(Path path, String mimeType) {
        Objects.requireNonNull(path, "path");
        Path fileName = path.getFileName();
        return new AnalysisInput(() -> Files.newInputStream(path), mimeType,
                fileName != null ? fileName.toString() : null, List.of());
    }

    public static AnalysisInput ofFrames(byte[] container, String mimeType, String filename, List<byte[]> frames) {
        Objects.requireNonNull(container, "container");
        Objects.requireNonNull(frames, "frames");
        List<ContentSource> sources = new ArrayList<>(frames.size());
        for (byte[] frame : frames) {
            sources.add(bytesSource(Objects.requireNonNull(frame, "frame")));
        }
        return new AnalysisInput(bytesSource(container), mimeType, filename, sources);
    }

    /**
     * @return the frames when this is a frame set, otherwise the primary content as the only raster.
     */
    public List<ContentSource> rasterSources() {
        return frames.isEmpty() ? List.of(content) : frames;
    }

    public boolean isFrameSet() {
        return !frames.isEmpty();
    }

    private static ContentSource bytesSource(byte[] bytes) {
        byte[] copy = bytes.clone();
        return () -> new ByteArrayInputStream(copy);
    }
}
