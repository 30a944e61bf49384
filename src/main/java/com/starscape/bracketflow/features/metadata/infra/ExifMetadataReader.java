package com.starscape.bracketflow.features.metadata.infra;

import com.drew.imaging.ImageMetadataReader;
import com.drew.imaging.ImageProcessingException;
import com.drew.metadata.Directory;
import com.drew.metadata.Metadata;
import com.drew.metadata.exif.ExifDirectoryBase;
import com.drew.metadata.exif.ExifIFD0Directory;
import com.drew.metadata.exif.ExifSubIFDDirectory;
import com.starscape.bracketflow.features.metadata.domain.CaptureMetadata;
import com.starscape.bracketflow.features.metadata.domain.CaptureMetadataReader;
import com.starscape.bracketflow.features.metadata.domain.MetadataNormalizer;
import com.starscape.bracketflow.features.metadata.domain.RawExifTags;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.ResponseInputStream;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;

import java.io.ByteArrayInputStream;
import java.io.IOException;

/**
 * Downloads an original from S3 and reads its EXIF block with metadata-extractor.
 * APEX shutter and aperture values are converted to seconds and f-numbers before
 * normalization so they can stand in for missing ExposureTime/FNumber tags.
 */
@Component
public class ExifMetadataReader implements CaptureMetadataReader {
    
    private static final Logger log = LoggerFactory.getLogger(ExifMetadataReader.class);
    
    private final S3Client s3Client;
    private final String bucket;
    
    public ExifMetadataReader(S3Client s3Client, @Value("${aws.s3.bucket}") String bucket) {
        this.s3Client = s3Client;
        this.bucket = bucket;
    }
    
    @Override
    public CaptureMetadata read(String storageKey) throws IOException {
        byte[] bytes = download(storageKey);
        try {
            Metadata metadata = ImageMetadataReader.readMetadata(new ByteArrayInputStream(bytes));
            RawExifTags tags = toRawTags(metadata);
            log.debug("Read EXIF for {}: {}", storageKey, tags);
            return MetadataNormalizer.normalize(tags);
        } catch (ImageProcessingException e) {
            throw new IOException("Unreadable image metadata for " + storageKey, e);
        }
    }
    
    RawExifTags toRawTags(Metadata metadata) {
        ExifSubIFDDirectory exif = metadata.getFirstDirectoryOfType(ExifSubIFDDirectory.class);
        ExifIFD0Directory ifd0 = metadata.getFirstDirectoryOfType(ExifIFD0Directory.class);
        
        return new RawExifTags(
            string(exif, ExifDirectoryBase.TAG_DATETIME_ORIGINAL),
            string(exif, ExifDirectoryBase.TAG_DATETIME_DIGITIZED),
            string(ifd0, ExifDirectoryBase.TAG_DATETIME),
            string(exif, ExifDirectoryBase.TAG_TIME_ZONE_ORIGINAL),
            string(exif, ExifDirectoryBase.TAG_EXPOSURE_TIME),
            apexShutterSeconds(exif),
            string(exif, ExifDirectoryBase.TAG_FNUMBER),
            apexAperture(exif),
            string(exif, ExifDirectoryBase.TAG_ISO_EQUIVALENT),
            string(exif, ExifDirectoryBase.TAG_FOCAL_LENGTH),
            string(ifd0, ExifDirectoryBase.TAG_MAKE),
            string(ifd0, ExifDirectoryBase.TAG_MODEL)
        );
    }
    
    private byte[] download(String storageKey) throws IOException {
        GetObjectRequest getRequest = GetObjectRequest.builder()
                .bucket(bucket)
                .key(storageKey)
                .build();
        
        try (ResponseInputStream<GetObjectResponse> response = s3Client.getObject(getRequest)) {
            return response.readAllBytes();
        }
    }
    
    private static String string(Directory directory, int tag) {
        if (directory == null || !directory.containsTag(tag)) {
            return null;
        }
        return directory.getString(tag);
    }
    
    // ShutterSpeedValue is APEX Tv: t = 2^-Tv
    private static String apexShutterSeconds(Directory directory) {
        Double apex = directory == null ? null : directory.getDoubleObject(ExifDirectoryBase.TAG_SHUTTER_SPEED);
        return apex == null ? null : String.valueOf(Math.pow(2, -apex));
    }
    
    // ApertureValue is APEX Av: N = sqrt(2)^Av
    private static String apexAperture(Directory directory) {
        Double apex = directory == null ? null : directory.getDoubleObject(ExifDirectoryBase.TAG_APERTURE);
        return apex == null ? null : String.valueOf(Math.pow(Math.sqrt(2), apex));
    }
}
