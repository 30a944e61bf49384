package com.starscape.bracketflow.features.lifecycle.api;

import com.starscape.bracketflow.common.security.UserPrincipal;
import com.starscape.bracketflow.features.lifecycle.api.dto.JobActionResponse;
import com.starscape.bracketflow.features.lifecycle.api.dto.StartJobRequest;
import com.starscape.bracketflow.features.lifecycle.app.JobLifecycleService;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/commands")
public class JobLifecycleController {
    
    private final JobLifecycleService lifecycleService;
    
    public JobLifecycleController(JobLifecycleService lifecycleService) {
        this.lifecycleService = lifecycleService;
    }
    
    /**
     * Reserves credits for every group not in {@code skipGroupIds} and dispatches the job.
     * Repeating the call with the same selection returns the current state.
     */
    @PostMapping("/jobs/{jobId}/start")
    public ResponseEntity<JobActionResponse> start(
            @PathVariable String jobId,
            @RequestBody(required = false) StartJobRequest request,
            @AuthenticationPrincipal UserPrincipal principal) {
        
        JobActionResponse response = lifecycleService.start(
            jobId, principal.getUserId(), request != null ? request.skipGroupIds() : null);
        return ResponseEntity.ok(response);
    }
    
    @PostMapping("/jobs/{jobId}/cancel")
    public ResponseEntity<JobActionResponse> cancel(
            @PathVariable String jobId,
            @AuthenticationPrincipal UserPrincipal principal) {
        
        return ResponseEntity.ok(lifecycleService.cancel(jobId, principal.getUserId()));
    }
    
    /**
     * Sends failed groups that still have attempts left back to the provider.
     */
    @PostMapping("/jobs/{jobId}/retry-missing")
    public ResponseEntity<JobActionResponse> retryMissing(
            @PathVariable String jobId,
            @AuthenticationPrincipal UserPrincipal principal) {
        
        return ResponseEntity.ok(lifecycleService.retryMissing(jobId, principal.getUserId()));
    }
    
    @PostMapping("/jobs/{jobId}/remote-grouping")
    public ResponseEntity<JobActionResponse> remoteGrouping(
            @PathVariable String jobId,
            @AuthenticationPrincipal UserPrincipal principal) {
        
        return ResponseEntity.accepted().body(lifecycleService.requestRemoteGrouping(jobId, principal.getUserId()));
    }
}
