package com.example.skygate_backend.engine.metadata;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class MetadataScorerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
    private final MetadataScorer scorer = new MetadataScorer(Clock.fixed(NOW, ZoneOffset.UTC));

    private static ExtractedMetadata camera(List<String> software, Instant original, Instant digitized, Double fNumber, Integer iso) {
        Set<MetadataField> fields = EnumSet.of(MetadataField.DEVICE, MetadataField.EXPOSURE, MetadataField.LENS,
                MetadataField.GPS, MetadataField.CAPTURE_TIME);
        if (!software.isEmpty()) fields.add(MetadataField.SOFTWARE);
        return new ExtractedMetadata(fields, "Canon", "EOS R5", software, original, digitized, null, fNumber, iso);
    }

    @Test
    void completeCameraMetadataScoresZero() {
        Instant shot = Instant.parse("2023-08-14T09:30:00Z");
        MetadataScorer.Assessment a = scorer.assess(camera(List.of("Firmware Version 1.8.1"), shot, shot, 2.8, 400));

        assertThat(a.score()).isEqualTo(0.0);
        assertThat(a.indicators()).isEmpty();
        assertThat(a.generator()).isEmpty();
    }

    @Test
    void missingMetadataAddsFixedIncrement() {
        MetadataScorer.Assessment a = scorer.assess(new ExtractedMetadata(Set.of(), null, null, List.of(), null, null, null, null, null));

        assertThat(a.score()).isCloseTo(0.55, within(1e-9));
        assertThat(a.indicators()).containsExactly("no metadata present");
    }

    @Test
    void partialMetadataAddsPerFieldIncrements() {
        ExtractedMetadata onlyTime = new ExtractedMetadata(EnumSet.of(MetadataField.CAPTURE_TIME), null, null, List.of(),
                Instant.parse("2023-01-01T00:00:00Z"), null, null, null, null);

        MetadataScorer.Assessment a = scorer.assess(onlyTime);

        assertThat(a.score()).isCloseTo(0.15 + 0.10 + 0.05 + 0.05, within(1e-9));
        assertThat(a.indicators()).containsExactly("no capture-device identifiers", "no exposure settings",
                "no lens information", "no geolocation");
    }

    @Test
    void generatorSignatureIsReported() {
        Instant shot = Instant.parse("2023-08-14T09:30:00Z");
        MetadataScorer.Assessment a = scorer.assess(camera(List.of("Stable Diffusion XL 1.0"), shot, shot, 2.8, 400));

        assertThat(a.score()).isCloseTo(0.60, within(1e-9));
        assertThat(a.generator()).contains("Stable Diffusion XL 1.0");
        assertThat(a.indicators()).anyMatch(s -> s.startsWith("image-generation software signature"));
    }

    @Test
    void scoreIsClampedToOne() {
        ExtractedMetadata m = new ExtractedMetadata(EnumSet.of(MetadataField.SOFTWARE, MetadataField.CAPTURE_TIME), null, null,
                List.of("Midjourney v6"), Instant.parse("2031-01-01T00:00:00Z"), null, null, null, null);

        assertThat(scorer.assess(m).score()).isEqualTo(1.0);
    }

    @Test
    void futureAndInconsistentTimestampsAreImplausible() {
        Instant future = NOW.plusSeconds(7 * 24 * 3600);
        assertThat(scorer.assess(camera(List.of(), future, future, 2.8, 400)).indicators())
                .anyMatch(s -> s.contains("in the future"));

        Instant original = Instant.parse("2023-08-14T09:30:00Z");
        assertThat(scorer.assess(camera(List.of(), original, original.plusSeconds(3 * 24 * 3600), 2.8, 400)).indicators())
                .anyMatch(s -> s.contains("differ by more than 24h"));

        Instant old = Instant.parse("1975-01-01T00:00:00Z");
        assertThat(scorer.assess(camera(List.of(), old, old, 2.8, 400)).score()).isCloseTo(0.15, within(1e-9));
    }

    @Test
    void implausibleExposureAddsIncrement() {
        Instant shot = Instant.parse("2023-08-14T09:30:00Z");
        MetadataScorer.Assessment a = scorer.assess(camera(List.of(), shot, shot, 120.0, 400));

        assertThat(a.score()).isCloseTo(0.10, within(1e-9));
        assertThat(scorer.assess(camera(List.of(), shot, shot, 4.0, 10)).indicators())
                .anyMatch(s -> s.contains("ISO 10"));
    }

    @Test
    void generatorPatternsRespectWordBoundaries() {
        assertThat(MetadataScorer.findGenerator(List.of("Adobe Photoshop 25.0"))).isEmpty();
        assertThat(MetadataScorer.findGenerator(List.of("Ganesh Photo Editor"))).isEmpty();
        assertThat(MetadataScorer.findGenerator(List.of("StyleGAN2 export"))).isEmpty();
        assertThat(MetadataScorer.findGenerator(List.of("GAN sampler"))).isPresent();
        assertThat(MetadataScorer.findGenerator(List.of("DALL-E 3"))).isPresent();
        assertThat(MetadataScorer.findGenerator(List.of("parameters: a cat\nSteps: 20, Sampler: Euler a, CFG scale: 7"))).isPresent();
        assertThat(MetadataScorer.findGenerator(List.of("prompt: {\"3\": {\"class_type\": \"KSampler\"}}"))).isPresent();
    }
}
