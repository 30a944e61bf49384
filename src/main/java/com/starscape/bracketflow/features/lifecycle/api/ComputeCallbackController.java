package com.starscape.bracketflow.features.lifecycle.api;

import com.starscape.bracketflow.features.lifecycle.api.dto.ComputeCallbackRequest;
import com.starscape.bracketflow.features.lifecycle.api.dto.ComputeCallbackResponse;
import com.starscape.bracketflow.features.lifecycle.app.ComputeCallbackHandler;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Called by the compute provider, not by users. Authenticated with a shared secret header.
 */
@RestController
@RequestMapping("/callbacks")
public class ComputeCallbackController {
    
    static final String SECRET_HEADER = "X-Callback-Secret";
    
    private final ComputeCallbackHandler callbackHandler;
    
    public ComputeCallbackController(ComputeCallbackHandler callbackHandler) {
        this.callbackHandler = callbackHandler;
    }
    
    @PostMapping("/compute")
    public ResponseEntity<ComputeCallbackResponse> compute(
            @RequestHeader(name = SECRET_HEADER, required = false) String secret,
            @Valid @RequestBody ComputeCallbackRequest request) {
        
        return ResponseEntity.ok(callbackHandler.handle(secret, request));
    }
}
