package com.starscape.bracketflow.features.grouping.api;

import com.starscape.bracketflow.common.security.UserPrincipal;
import com.starscape.bracketflow.features.grouping.api.dto.AnalyzeJobResponse;
import com.starscape.bracketflow.features.grouping.app.AnalyzeJobHandler;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/commands")
public class AnalyzeJobController {
    
    private final AnalyzeJobHandler analyzeJobHandler;
    
    public AnalyzeJobController(AnalyzeJobHandler analyzeJobHandler) {
        this.analyzeJobHandler = analyzeJobHandler;
    }
    
    /**
     * Extracts missing capture metadata and regroups every uploaded file of the job.
     * Replaces any previous grouping.
     */
    @PostMapping("/jobs/{jobId}/analyze")
    public ResponseEntity<AnalyzeJobResponse> analyze(
            @PathVariable String jobId,
            @AuthenticationPrincipal UserPrincipal principal) {
        
        AnalyzeJobResponse response = analyzeJobHandler.handle(jobId, principal.getUserId());
        return ResponseEntity.ok(response);
    }
}
