package com.example.cameratrap.service.metadata;

import com.drew.imaging.ImageMetadataReader;
import com.drew.imaging.ImageProcessingException;
import com.drew.lang.GeoLocation;
import com.drew.metadata.Directory;
import com.drew.metadata.Metadata;
import com.drew.metadata.exif.ExifIFD0Directory;
import com.drew.metadata.exif.ExifSubIFDDirectory;
import com.drew.metadata.exif.GpsDirectory;
import com.example.cameratrap.model.ImageMetadata;
import com.example.cameratrap.service.metadata.ImageQualityAnalyzer.QualityScores;
import com.example.cameratrap.util.ImageDecoding;
import com.example.cameratrap.util.ImageDecoding.DecodedImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Derives {@link ImageMetadata} from raw image bytes. Decoding failures are fatal for the image;
 * EXIF problems only leave the EXIF-backed fields empty.
 */
@Service
public class MetadataExtractor {

    private static final Logger log = LoggerFactory.getLogger(MetadataExtractor.class);

    private static final DateTimeFormatter EXIF_DATE = DateTimeFormatter.ofPattern("yyyy:MM:dd HH:mm:ss");

    private final ImageQualityAnalyzer qualityAnalyzer;

    public MetadataExtractor(ImageQualityAnalyzer qualityAnalyzer) {
        this.qualityAnalyzer = qualityAnalyzer;
    }

    /**
     * @throws com.example.cameratrap.exception.ImageDecodeException when the bytes are not a
     *                                                               readable image
     */
    public ImageMetadata extract(byte[] data) {
        DecodedImage decoded = ImageDecoding.decode(data);
        QualityScores quality = qualityAnalyzer.analyze(decoded.image());
        ExifFields exif = readExif(data);
        log.debug("Extracted metadata: {}x{} {} captured {}", decoded.width(), decoded.height(),
                decoded.format(), exif.capturedAt());
        return new ImageMetadata(
                decoded.width(),
                decoded.height(),
                decoded.format(),
                exif.capturedAt(),
                exif.latitude(),
                exif.longitude(),
                exif.altitude(),
                exif.make(),
                exif.model(),
                exif.tags(),
                quality.brightness(),
                quality.sharpness(),
                quality.quality());
    }

    private ExifFields readExif(byte[] data) {
        Metadata metadata;
        try {
            metadata = ImageMetadataReader.readMetadata(new ByteArrayInputStream(data), data.length);
        } catch (ImageProcessingException | IOException | RuntimeException ex) {
            log.warn("Unable to read EXIF block: {}", ex.getMessage());
            return ExifFields.EMPTY;
        }

        ExifIFD0Directory ifd0 = metadata.getFirstDirectoryOfType(ExifIFD0Directory.class);
        ExifSubIFDDirectory subIfd = metadata.getFirstDirectoryOfType(ExifSubIFDDirectory.class);
        GpsDirectory gps = metadata.getFirstDirectoryOfType(GpsDirectory.class);

        LocalDateTime capturedAt = parseDate(string(subIfd, ExifSubIFDDirectory.TAG_DATETIME_ORIGINAL));
        if (capturedAt == null) {
            capturedAt = parseDate(string(ifd0, ExifIFD0Directory.TAG_DATETIME));
        }

        Double latitude = null;
        Double longitude = null;
        Double altitude = null;
        if (gps != null) {
            GeoLocation location = gps.getGeoLocation();
            if (location != null && !location.isZero()) {
                latitude = location.getLatitude();
                longitude = location.getLongitude();
            }
            altitude = readAltitude(gps);
        }

        Map<String, String> tags = new LinkedHashMap<>();
        putIfPresent(tags, "exposure_time", subIfd, ExifSubIFDDirectory.TAG_EXPOSURE_TIME);
        putIfPresent(tags, "f_number", subIfd, ExifSubIFDDirectory.TAG_FNUMBER);
        putIfPresent(tags, "iso", subIfd, ExifSubIFDDirectory.TAG_ISO_EQUIVALENT);
        putIfPresent(tags, "focal_length", subIfd, ExifSubIFDDirectory.TAG_FOCAL_LENGTH);

        return new ExifFields(capturedAt, latitude, longitude, altitude,
                trimmed(string(ifd0, ExifIFD0Directory.TAG_MAKE)),
                trimmed(string(ifd0, ExifIFD0Directory.TAG_MODEL)),
                tags);
    }

    private Double readAltitude(GpsDirectory gps) {
        Double altitude = gps.getDoubleObject(GpsDirectory.TAG_ALTITUDE);
        if (altitude == null) {
            return null;
        }
        Integer reference = gps.getInteger(GpsDirectory.TAG_ALTITUDE_REF);
        // ref 1 means below sea level
        return reference != null && reference == 1 ? -altitude : altitude;
    }

    private LocalDateTime parseDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDateTime.parse(value.trim(), EXIF_DATE);
        } catch (DateTimeParseException ex) {
            log.warn("Ignoring malformed EXIF timestamp '{}'", value);
            return null;
        }
    }

    private static void putIfPresent(Map<String, String> tags, String name, Directory directory, int tag) {
        String value = string(directory, tag);
        if (value != null && !value.isBlank()) {
            tags.put(name, value.trim());
        }
    }

    private static String string(Directory directory, int tag) {
        return directory == null ? null : directory.getString(tag);
    }

    private static String trimmed(String value) {
        if (value == null) {
            return null;
        }
        String result = value.trim();
        return result.isEmpty() ? null : result;
    }

    private record ExifFields(LocalDateTime capturedAt, Double latitude, Double longitude, Double altitude,
                              String make, String model, Map<String, String> tags) {

        static final ExifFields EMPTY = new ExifFields(null, null, null, null, null, null, Map.of());
    }
}
