package com.starscape.bracketflow.features.trackprogress.api;

import com.starscape.bracketflow.common.exception.ValidationException;
import com.starscape.bracketflow.common.security.UserPrincipal;
import com.starscape.bracketflow.features.trackprogress.app.SubscribeToJobEventsHandler;
import org.springframework.http.MediaType;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Resumable live event stream of a job. Clients reconnect with the last {@code id} they saw,
 * either as the standard {@code Last-Event-ID} header or the {@code lastEventId} parameter.
 */
@RestController
@RequestMapping("/queries")
public class JobEventsController {
    
    private final SubscribeToJobEventsHandler subscribeHandler;
    
    public JobEventsController(SubscribeToJobEventsHandler subscribeHandler) {
        this.subscribeHandler = subscribeHandler;
    }
    
    @GetMapping(value = "/jobs/{jobId}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamEvents(
            @PathVariable String jobId,
            @RequestHeader(value = "Last-Event-ID", required = false) String lastEventIdHeader,
            @RequestParam(value = "lastEventId", required = false) String lastEventIdParam,
            @AuthenticationPrincipal UserPrincipal principal) {
        
        Long resumeAfter = parseSequence(lastEventIdHeader != null ? lastEventIdHeader : lastEventIdParam);
        SseEmitter emitter = new SseEmitter(0L);
        subscribeHandler.handle(jobId, principal.getUserId(), resumeAfter, new SseEventSink(emitter));
        return emitter;
    }
    
    private Long parseSequence(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new ValidationException("Invalid event id: " + raw);
        }
    }
}
