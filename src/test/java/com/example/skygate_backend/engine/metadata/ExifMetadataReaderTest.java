package com.example.skygate_backend.engine.metadata;

import com.adobe.internal.xmp.XMPConst;
import com.adobe.internal.xmp.XMPMeta;
import com.adobe.internal.xmp.XMPMetaFactory;
import com.drew.metadata.Metadata;
import com.drew.metadata.exif.ExifDirectoryBase;
import com.drew.metadata.exif.ExifIFD0Directory;
import com.drew.metadata.exif.ExifSubIFDDirectory;
import com.drew.metadata.mp4.Mp4Directory;
import com.drew.metadata.xmp.XmpDirectory;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Date;

import static org.assertj.core.api.Assertions.assertThat;

class ExifMetadataReaderTest {

    private final ExifMetadataReader reader = new ExifMetadataReader();

    @Test
    void collectsCameraFieldsFromExifDirectories() {
        Metadata metadata = new Metadata();
        ExifIFD0Directory ifd0 = new ExifIFD0Directory();
        ifd0.setString(ExifDirectoryBase.TAG_MAKE, "Canon");
        ifd0.setString(ExifDirectoryBase.TAG_MODEL, "EOS R5");
        ifd0.setString(ExifDirectoryBase.TAG_SOFTWARE, "Firmware 1.8.1");
        metadata.addDirectory(ifd0);
        ExifSubIFDDirectory sub = new ExifSubIFDDirectory();
        sub.setDouble(ExifDirectoryBase.TAG_FNUMBER, 2.8);
        sub.setInt(ExifDirectoryBase.TAG_ISO_EQUIVALENT, 400);
        sub.setString(ExifDirectoryBase.TAG_LENS_MODEL, "RF24-70mm F2.8 L IS USM");
        sub.setString(ExifDirectoryBase.TAG_DATETIME_ORIGINAL, "2023:08:14 09:30:00");
        metadata.addDirectory(sub);

        ExtractedMetadata extracted = reader.extract(metadata);

        assertThat(extracted.fieldsPresent()).contains(MetadataField.DEVICE, MetadataField.EXPOSURE, MetadataField.LENS,
                MetadataField.SOFTWARE, MetadataField.CAPTURE_TIME);
        assertThat(extracted.fieldsPresent()).doesNotContain(MetadataField.GPS);
        assertThat(extracted.make()).isEqualTo("Canon");
        assertThat(extracted.fNumber()).isEqualTo(2.8);
        assertThat(extracted.iso()).isEqualTo(400);
        assertThat(extracted.signatures()).containsExactly("Firmware 1.8.1");
        assertThat(extracted.original()).isNotNull();
    }

    @Test
    void xmpCreatorToolIsTreatedAsSoftwareSignature() throws Exception {
        XMPMeta meta = XMPMetaFactory.create();
        meta.setProperty(XMPConst.NS_XMP, "CreatorTool", "Midjourney v6");
        XmpDirectory xmp = new XmpDirectory();
        xmp.setXMPMeta(meta);
        Metadata metadata = new Metadata();
        metadata.addDirectory(xmp);

        ExtractedMetadata extracted = reader.extract(metadata);

        assertThat(extracted.fieldsPresent()).contains(MetadataField.XMP, MetadataField.SOFTWARE);
        assertThat(extracted.signatures()).containsExactly("Midjourney v6");
        assertThat(MetadataScorer.findGenerator(extracted.signatures())).contains("Midjourney v6");
    }

    @Test
    void emptyMetadataHasNoDescriptiveFields() {
        assertThat(reader.extract(new Metadata()).isEmpty()).isTrue();
    }

    private static Metadata stampedPhoto(String dateTime, String dateTimeOriginal, String modifiedOffset, String originalOffset) {
        Metadata metadata = new Metadata();
        ExifIFD0Directory ifd0 = new ExifIFD0Directory();
        ifd0.setString(ExifDirectoryBase.TAG_MAKE, "Apple");
        ifd0.setString(ExifDirectoryBase.TAG_DATETIME, dateTime);
        metadata.addDirectory(ifd0);
        ExifSubIFDDirectory sub = new ExifSubIFDDirectory();
        sub.setString(ExifDirectoryBase.TAG_DATETIME_ORIGINAL, dateTimeOriginal);
        sub.setString(ExifDirectoryBase.TAG_DATETIME_DIGITIZED, dateTimeOriginal);
        if (modifiedOffset != null) {
            sub.setString(ExifDirectoryBase.TAG_TIME_ZONE, modifiedOffset);
        }
        if (originalOffset != null) {
            sub.setString(ExifDirectoryBase.TAG_TIME_ZONE_ORIGINAL, originalOffset);
            sub.setString(ExifDirectoryBase.TAG_TIME_ZONE_DIGITIZED, originalOffset);
        }
        metadata.addDirectory(sub);
        return metadata;
    }

    @Test
    void offsetTagsApplyToAllThreeTimestamps() {
        ExtractedMetadata extracted = reader.extract(
                stampedPhoto("2024:05:01 12:00:00", "2024:05:01 12:00:00", "-04:00", "-04:00"));

        Instant expected = Instant.parse("2024-05-01T16:00:00Z");
        assertThat(extracted.original()).isEqualTo(expected);
        assertThat(extracted.digitized()).isEqualTo(expected);
        assertThat(extracted.modified()).isEqualTo(expected);
    }

    @Test
    void photoWestOfUtcIsNotFlaggedForImplausibleTimestamps() {
        ExtractedMetadata extracted = reader.extract(
                stampedPhoto("2024:05:01 12:05:00", "2024:05:01 12:00:00", "-04:00", "-04:00"));
        MetadataScorer scorer = new MetadataScorer(Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.UTC));

        MetadataScorer.Assessment a = scorer.assess(extracted);

        assertThat(a.indicators()).noneMatch(i -> i.startsWith("implausible creation timestamp"));
    }

    @Test
    void originalOffsetIsUsedWhenModifiedOffsetIsMissing() {
        ExtractedMetadata extracted = reader.extract(
                stampedPhoto("2024:05:01 12:00:00", "2024:05:01 12:00:00", null, "+02:00"));

        assertThat(extracted.original()).isEqualTo(Instant.parse("2024-05-01T10:00:00Z"));
        assertThat(extracted.modified()).isEqualTo(extracted.original());
    }

    @Test
    void timestampsWithoutOffsetTagsAreReadAsUtc() {
        ExtractedMetadata extracted = reader.extract(
                stampedPhoto("2024:05:01 18:30:00", "2024:05:01 12:00:00", null, null));

        assertThat(extracted.original()).isEqualTo(Instant.parse("2024-05-01T12:00:00Z"));
        assertThat(extracted.modified()).isEqualTo(Instant.parse("2024-05-01T18:30:00Z"));
        assertThat(extracted.fieldsPresent()).contains(MetadataField.CAPTURE_TIME);
    }

    @Test
    void mp4CreationTimeBecomesOriginalTime() {
        Instant created = Instant.parse("2024-03-10T08:15:00Z");
        Mp4Directory mp4 = new Mp4Directory();
        mp4.setDate(Mp4Directory.TAG_CREATION_TIME, Date.from(created));
        Metadata metadata = new Metadata();
        metadata.addDirectory(mp4);

        ExtractedMetadata extracted = reader.extract(metadata);

        assertThat(extracted.original()).isEqualTo(created);
        assertThat(extracted.modified()).isNull();
        assertThat(extracted.fieldsPresent()).containsExactly(MetadataField.CAPTURE_TIME);
    }
}
