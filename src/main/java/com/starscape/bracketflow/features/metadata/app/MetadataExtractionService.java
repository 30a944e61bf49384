package com.starscape.bracketflow.features.metadata.app;

import com.starscape.bracketflow.common.config.GroupingProperties;
import com.starscape.bracketflow.features.jobs.domain.UploadedFile;
import com.starscape.bracketflow.features.metadata.domain.CaptureMetadata;
import com.starscape.bracketflow.features.metadata.domain.CaptureMetadataReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Reads EXIF for files that still lack capture fields, a few files at a time.
 * Runs outside any transaction; callers apply the results under the job lock.
 */
@Service
public class MetadataExtractionService {
    
    private static final Logger log = LoggerFactory.getLogger(MetadataExtractionService.class);
    
    private final CaptureMetadataReader metadataReader;
    private final int concurrency;
    
    public MetadataExtractionService(CaptureMetadataReader metadataReader, GroupingProperties groupingProperties) {
        this.metadataReader = metadataReader;
        this.concurrency = Math.max(1, groupingProperties.getMetadataConcurrency());
    }
    
    /**
     * Returns extracted metadata keyed by file id for every file that needed extraction.
     * A file whose original cannot be read maps to {@link CaptureMetadata#empty()}.
     */
    public Map<String, CaptureMetadata> extractMissing(String jobId, List<UploadedFile> files) {
        List<UploadedFile> pending = files.stream()
                .filter(UploadedFile::needsMetadataExtraction)
                .toList();
        Map<String, CaptureMetadata> results = new LinkedHashMap<>();
        if (pending.isEmpty()) {
            return results;
        }
        
        log.info("Extracting metadata for {} files of job {} ({} at a time)", pending.size(), jobId, concurrency);
        ExecutorService pool = Executors.newFixedThreadPool(Math.min(concurrency, pending.size()));
        try {
            List<Future<CaptureMetadata>> futures = new ArrayList<>();
            for (UploadedFile file : pending) {
                futures.add(pool.submit(() -> readOne(file)));
            }
            for (int i = 0; i < pending.size(); i++) {
                results.put(pending.get(i).getFileId(), await(futures.get(i), pending.get(i)));
            }
        } finally {
            pool.shutdownNow();
        }
        return results;
    }
    
    private CaptureMetadata readOne(UploadedFile file) {
        try {
            return metadataReader.read(file.getStorageKey());
        } catch (IOException | RuntimeException e) {
            log.warn("Metadata extraction failed for {} ({}): {}", file.getFileId(), file.getStorageKey(), e.getMessage());
            return CaptureMetadata.empty();
        }
    }
    
    private CaptureMetadata await(Future<CaptureMetadata> future, UploadedFile file) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while extracting metadata for " + file.getFileId(), e);
        } catch (ExecutionException e) {
            log.warn("Metadata extraction failed for {}", file.getFileId(), e.getCause());
            return CaptureMetadata.empty();
        }
    }
}
