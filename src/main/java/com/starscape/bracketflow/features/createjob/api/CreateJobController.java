package com.starscape.bracketflow.features.createjob.api;

import com.starscape.bracketflow.common.security.UserPrincipal;
import com.starscape.bracketflow.features.createjob.api.dto.CreateJobRequest;
import com.starscape.bracketflow.features.createjob.api.dto.CreateJobResponse;
import com.starscape.bracketflow.features.createjob.app.CreateJobHandler;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/commands")
public class CreateJobController {
    
    private final CreateJobHandler createJobHandler;
    
    public CreateJobController(CreateJobHandler createJobHandler) {
        this.createJobHandler = createJobHandler;
    }
    
    @PostMapping("/jobs")
    public ResponseEntity<CreateJobResponse> createJob(
            @Valid @RequestBody CreateJobRequest request,
            @AuthenticationPrincipal UserPrincipal principal) {
        
        CreateJobResponse response = createJobHandler.handle(request, principal.getUserId());
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }
}
