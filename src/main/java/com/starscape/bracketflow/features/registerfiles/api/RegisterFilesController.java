package com.starscape.bracketflow.features.registerfiles.api;

import com.starscape.bracketflow.common.security.UserPrincipal;
import com.starscape.bracketflow.features.registerfiles.api.dto.RegisterFilesRequest;
import com.starscape.bracketflow.features.registerfiles.api.dto.RegisterFilesResponse;
import com.starscape.bracketflow.features.registerfiles.app.RegisterFilesHandler;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/commands")
public class RegisterFilesController {
    
    private final RegisterFilesHandler registerFilesHandler;
    
    public RegisterFilesController(RegisterFilesHandler registerFilesHandler) {
        this.registerFilesHandler = registerFilesHandler;
    }
    
    /**
     * Declares uploaded objects for a job. Registering a key twice updates the existing
     * record; {@code uploaded: true} confirms the object without waiting for the storage event.
     */
    @PostMapping("/jobs/{jobId}/files")
    public ResponseEntity<RegisterFilesResponse> registerFiles(
            @PathVariable String jobId,
            @Valid @RequestBody RegisterFilesRequest request,
            @AuthenticationPrincipal UserPrincipal principal) {
        
        return ResponseEntity.ok(registerFilesHandler.handle(jobId, principal.getUserId(), request));
    }
}
