package com.example.skygate_backend.engine.metadata;

import com.example.skygate_backend.util.SignalMath;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Turns extracted metadata into a suspicion score by summing fixed increments per indicator.
 */
public class MetadataScorer {
    static final double NO_METADATA = 0.55;
    static final double NO_DEVICE = 0.15;
    static final double NO_EXPOSURE = 0.10;
    static final double NO_LENS = 0.05;
    static final double NO_GPS = 0.05;
    static final double GENERATOR_SOFTWARE = 0.60;
    static final double IMPLAUSIBLE_TIMESTAMP = 0.15;
    static final double IMPLAUSIBLE_EXPOSURE = 0.10;

    static final String NO_METADATA_INDICATOR = "no metadata present";
    static final String NO_DEVICE_INDICATOR = "no capture-device identifiers";
    static final String NO_EXPOSURE_INDICATOR = "no exposure settings";
    static final String NO_LENS_INDICATOR = "no lens information";
    static final String NO_GPS_INDICATOR = "no geolocation";
    static final String GENERATOR_INDICATOR = "image-generation software signature: ";
    static final String TIMESTAMP_INDICATOR = "implausible creation timestamp: ";
    static final String EXPOSURE_INDICATOR = "implausible exposure values: ";

    private static final Instant EARLIEST_PLAUSIBLE = ZonedDateTime.of(1980, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC).toInstant();
    private static final Duration MAX_ORIGINAL_DIGITIZED_GAP = Duration.ofHours(24);
    private static final Duration CLOCK_SKEW = Duration.ofDays(1);

    private static final List<Pattern> GENERATOR_PATTERNS = List.of(
            Pattern.compile("stable[\\s_-]*diffusion", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bdall[\\s·-]*e\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("midjourney", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bfirefly\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("comfyui", Pattern.CASE_INSENSITIVE),
            Pattern.compile("automatic1111|novelai", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bgenerative\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("deep\\s*dream", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bopenai\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bgan\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("trainedalgorithmicmedia", Pattern.CASE_INSENSITIVE),
            // A1111 "parameters" chunk and ComfyUI workflow JSON
            Pattern.compile("steps:\\s*\\d+.*\\bsampler:", Pattern.CASE_INSENSITIVE | Pattern.DOTALL),
            Pattern.compile("\"class_type\"")
    );

    public record Assessment(double score, List<String> indicators, Optional<String> generator) {
        public Assessment {
            indicators = List.copyOf(indicators);
        }
    }

    private final Clock clock;

    public MetadataScorer(Clock clock) {
        this.clock = clock;
    }

    public Assessment assess(ExtractedMetadata metadata) {
        List<String> indicators = new ArrayList<>();
        double score = 0.0;

        if (metadata.isEmpty()) {
            indicators.add(NO_METADATA_INDICATOR);
            score += NO_METADATA;
        } else {
            if (!metadata.has(MetadataField.DEVICE)) {
                indicators.add(NO_DEVICE_INDICATOR);
                score += NO_DEVICE;
            }
            if (!metadata.has(MetadataField.EXPOSURE)) {
                indicators.add(NO_EXPOSURE_INDICATOR);
                score += NO_EXPOSURE;
            }
            if (!metadata.has(MetadataField.LENS)) {
                indicators.add(NO_LENS_INDICATOR);
                score += NO_LENS;
            }
            if (!metadata.has(MetadataField.GPS)) {
                indicators.add(NO_GPS_INDICATOR);
                score += NO_GPS;
            }
        }

        Optional<String> generator = findGenerator(metadata.signatures());
        if (generator.isPresent()) {
            indicators.add(GENERATOR_INDICATOR + generator.get());
            score += GENERATOR_SOFTWARE;
        }

        Optional<String> timestampProblem = timestampProblem(metadata);
        if (timestampProblem.isPresent()) {
            indicators.add(TIMESTAMP_INDICATOR + timestampProblem.get());
            score += IMPLAUSIBLE_TIMESTAMP;
        }

        Optional<String> exposureProblem = exposureProblem(metadata);
        if (exposureProblem.isPresent()) {
            indicators.add(EXPOSURE_INDICATOR + exposureProblem.get());
            score += IMPLAUSIBLE_EXPOSURE;
        }

        return new Assessment(SignalMath.clamp01(score), indicators, generator);
    }

    static Optional<String> findGenerator(List<String> signatures) {
        for (String signature : signatures) {
            for (Pattern pattern : GENERATOR_PATTERNS) {
                if (pattern.matcher(signature).find()) {
                    return Optional.of(abbreviate(signature));
                }
            }
        }
        return Optional.empty();
    }

    private Optional<String> timestampProblem(ExtractedMetadata m) {
        Instant latestAllowed = clock.instant().plus(CLOCK_SKEW);
        for (Instant t : new Instant[]{m.original(), m.digitized(), m.modified()}) {
            if (t == null) continue;
            if (t.isAfter(latestAllowed)) return Optional.of("timestamp " + t + " lies in the future");
            if (t.isBefore(EARLIEST_PLAUSIBLE)) return Optional.of("timestamp " + t + " predates digital capture");
        }
        if (m.original() != null && m.digitized() != null
                && Duration.between(m.original(), m.digitized()).abs().compareTo(MAX_ORIGINAL_DIGITIZED_GAP) > 0) {
            return Optional.of("original and digitized times differ by more than 24h");
        }
        if (m.original() != null && m.modified() != null && m.original().isAfter(m.modified())) {
            return Optional.of("original time is after the last-modified time");
        }
        return Optional.empty();
    }

    private static Optional<String> exposureProblem(ExtractedMetadata m) {
        if (m.fNumber() != null && (m.fNumber() < 0.7 || m.fNumber() > 64.0)) {
            return Optional.of("f-number " + m.fNumber());
        }
        if (m.iso() != null && (m.iso() < 50 || m.iso() > 409_600)) {
            return Optional.of("ISO " + m.iso());
        }
        return Optional.empty();
    }

    private static String abbreviate(String signature) {
        String oneLine = signature.replaceAll("\\s+", " ");
        return oneLine.length() <= 80 ? oneLine : oneLine.substring(0, 77) + "...";
    }
}
