package com.starscape.bracketflow.features.trackprogress.api;

import com.starscape.bracketflow.common.security.UserPrincipal;
import com.starscape.bracketflow.features.trackprogress.api.dto.JobStatusResponse;
import com.starscape.bracketflow.features.trackprogress.app.GetJobStatusHandler;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/queries")
public class JobStatusController {
    
    private final GetJobStatusHandler getJobStatusHandler;
    
    public JobStatusController(GetJobStatusHandler getJobStatusHandler) {
        this.getJobStatusHandler = getJobStatusHandler;
    }
    
    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<JobStatusResponse> getJobStatus(
            @PathVariable String jobId,
            @AuthenticationPrincipal UserPrincipal principal) {
        
        JobStatusResponse response = getJobStatusHandler.handle(jobId, principal.getUserId());
        return ResponseEntity.ok(response);
    }
}
