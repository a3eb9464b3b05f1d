package com.example.skygate_backend.engine.metadata;

import com.drew.imaging.ImageMetadataReader;
import com.drew.imaging.ImageProcessingException;
import com.drew.lang.GeoLocation;
import com.drew.metadata.Metadata;
import com.drew.metadata.exif.ExifDirectoryBase;
import com.drew.metadata.exif.ExifIFD0Directory;
import com.drew.metadata.exif.ExifSubIFDDirectory;
import com.drew.metadata.exif.GpsDirectory;
import com.drew.metadata.iptc.IptcDirectory;
import com.drew.metadata.mov.QuickTimeDirectory;
import com.drew.metadata.mp4.Mp4Directory;
import com.drew.metadata.png.PngDirectory;
import com.drew.metadata.xmp.XmpDirectory;
import com.example.skygate_backend.dto.AnalysisInput;
import com.example.skygate_backend.engine.AnalyzerException;

import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TimeZone;
import java.util.regex.Pattern;

/**
 * Reads descriptive metadata with metadata-extractor. Structural directories (image dimensions,
 * file type, Huffman tables) are ignored; only fields that describe capture or provenance count.
 */
public class ExifMetadataReader {
    private static final Pattern UTC_OFFSET = Pattern.compile("[+-]\\d{2}:\\d{2}");
    private static final List<String> XMP_SOFTWARE_KEYS = List.of("creatortool", "software", "agent", "digitalsourcetype");

    public ExtractedMetadata read(AnalysisInput.ContentSource source) throws AnalyzerException {
        Metadata metadata;
        try (InputStream in = source.open()) {
            metadata = ImageMetadataReader.readMetadata(in);
        } catch (ImageProcessingException e) {
            throw new AnalyzerException("metadata could not be parsed: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new AnalyzerException("metadata could not be read: " + e.getMessage(), e);
        }
        return extract(metadata);
    }

    ExtractedMetadata extract(Metadata metadata) {
        Set<MetadataField> present = EnumSet.noneOf(MetadataField.class);
        List<String> signatures = new ArrayList<>();
        String make = null, model = null;
        Instant original = null, digitized = null, modified = null;
        Double fNumber = null;
        Integer iso = null;

        String modifiedOffset = null, originalOffset = null, modifiedSubsecond = null;

        for (ExifSubIFDDirectory sub : metadata.getDirectoriesOfType(ExifSubIFDDirectory.class)) {
            if (sub.containsTag(ExifDirectoryBase.TAG_EXPOSURE_TIME) || sub.containsTag(ExifDirectoryBase.TAG_FNUMBER)
                    || sub.containsTag(ExifDirectoryBase.TAG_ISO_EQUIVALENT)) {
                present.add(MetadataField.EXPOSURE);
            }
            fNumber = firstNonNull(fNumber, sub.getDoubleObject(ExifDirectoryBase.TAG_FNUMBER));
            iso = firstNonNull(iso, sub.getInteger(ExifDirectoryBase.TAG_ISO_EQUIVALENT));
            if (sub.containsTag(ExifDirectoryBase.TAG_LENS_MODEL) || sub.containsTag(ExifDirectoryBase.TAG_LENS_SPECIFICATION)
                    || sub.containsTag(ExifDirectoryBase.TAG_LENS_MAKE)) {
                present.add(MetadataField.LENS);
            }
            original = firstNonNull(original, instant(sub.getDateOriginal()));
            digitized = firstNonNull(digitized, instant(sub.getDateDigitized()));
            modifiedOffset = firstNonBlank(modifiedOffset, sub.getString(ExifDirectoryBase.TAG_TIME_ZONE));
            originalOffset = firstNonBlank(originalOffset, sub.getString(ExifDirectoryBase.TAG_TIME_ZONE_ORIGINAL));
            modifiedSubsecond = firstNonBlank(modifiedSubsecond, sub.getString(ExifDirectoryBase.TAG_SUBSECOND_TIME));
        }
        // IFD0 DateTime carries no offset of its own; OffsetTime lives in the sub-IFD. The camera clock
        // is shared, so the original offset stands in when OffsetTime is missing.
        TimeZone modifiedZone = offsetZone(modifiedOffset != null ? modifiedOffset : originalOffset);
        for (ExifIFD0Directory ifd0 : metadata.getDirectoriesOfType(ExifIFD0Directory.class)) {
            make = firstNonBlank(make, ifd0.getString(ExifDirectoryBase.TAG_MAKE));
            model = firstNonBlank(model, ifd0.getString(ExifDirectoryBase.TAG_MODEL));
            addSignature(signatures, ifd0.getString(ExifDirectoryBase.TAG_SOFTWARE));
            modified = firstNonNull(modified,
                    instant(ifd0.getDate(ExifDirectoryBase.TAG_DATETIME, modifiedSubsecond, modifiedZone)));
        }
        if (make != null || model != null) {
            present.add(MetadataField.DEVICE);
        }
        for (GpsDirectory gps : metadata.getDirectoriesOfType(GpsDirectory.class)) {
            GeoLocation location = gps.getGeoLocation();
            if (location != null && !location.isZero()) {
                present.add(MetadataField.GPS);
            }
        }
        for (XmpDirectory xmp : metadata.getDirectoriesOfType(XmpDirectory.class)) {
            Map<String, String> properties = xmp.getXmpProperties();
            if (!properties.isEmpty()) {
                present.add(MetadataField.XMP);
            }
            properties.forEach((key, value) -> {
                String k = key.toLowerCase(Locale.ROOT);
                if (XMP_SOFTWARE_KEYS.stream().anyMatch(k::contains)) {
                    addSignature(signatures, value);
                }
            });
        }
        for (PngDirectory png : metadata.getDirectoriesOfType(PngDirectory.class)) {
            if (png.containsTag(PngDirectory.TAG_TEXTUAL_DATA)) {
                present.add(MetadataField.TEXT_CHUNKS);
                addSignature(signatures, png.getDescription(PngDirectory.TAG_TEXTUAL_DATA));
            }
        }
        for (IptcDirectory iptc : metadata.getDirectoriesOfType(IptcDirectory.class)) {
            if (iptc.getTagCount() > 0) {
                present.add(MetadataField.IPTC);
            }
            addSignature(signatures, iptc.getString(IptcDirectory.TAG_ORIGINATING_PROGRAM));
        }
        for (Mp4Directory mp4 : metadata.getDirectoriesOfType(Mp4Directory.class)) {
            original = firstNonNull(original, instant(mp4.getDate(Mp4Directory.TAG_CREATION_TIME)));
        }
        for (QuickTimeDirectory mov : metadata.getDirectoriesOfType(QuickTimeDirectory.class)) {
            original = firstNonNull(original, instant(mov.getDate(QuickTimeDirectory.TAG_CREATION_TIME)));
        }

        if (!signatures.isEmpty()) {
            present.add(MetadataField.SOFTWARE);
        }
        if (original != null || digitized != null || modified != null) {
            present.add(MetadataField.CAPTURE_TIME);
        }
        return new ExtractedMetadata(present, make, model, signatures, original, digitized, modified, fNumber, iso);
    }

    private static void addSignature(List<String> signatures, String value) {
        if (value != null && !value.isBlank()) {
            signatures.add(value.trim());
        }
    }

    private static TimeZone offsetZone(String offset) {
        if (offset == null || !UTC_OFFSET.matcher(offset).matches()) {
            return null;
        }
        return TimeZone.getTimeZone("GMT" + offset);
    }

    private static Instant instant(Date date) {
        return date == null ? null : date.toInstant();
    }

    private static String firstNonBlank(String current, String candidate) {
        if (current != null) return current;
        return candidate == null || candidate.isBlank() ? null : candidate.trim();
    }

    private static <T> T firstNonNull(T current, T candidate) {
        return current != null ? current : candidate;
    }
}
