package com.starscape.bracketflow.features.jobs.app;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Where a job's uploads live in the bucket: {@code env/userId/jobs/jobId/raw/}.
 */
@Component
public class StorageLayout {
    
    private final String environment;
    
    public StorageLayout(@Value("${spring.profiles.active:dev}") String environment) {
        // Handle multiple profiles (comma-separated) by taking the first one
        this.environment = environment != null && environment.contains(",")
            ? environment.split(",")[0].trim()
            : (environment != null && !environment.isBlank() ? environment : "dev");
    }
    
    public String uploadPrefix(String userId, String jobId) {
        return String.format("%s/%s/jobs/%s/raw/", environment, userId, jobId);
    }
    
    /**
     * True for a key strictly below the job's upload prefix with no path traversal.
     */
    public boolean isUploadKey(String key, String userId, String jobId) {
        if (key == null || key.contains("..") || key.contains("\\") || key.contains("//")) {
            return false;
        }
        String prefix = uploadPrefix(userId, jobId);
        return key.startsWith(prefix) && key.length() > prefix.length();
    }
}
