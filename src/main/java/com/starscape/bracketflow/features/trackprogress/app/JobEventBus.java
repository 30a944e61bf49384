package com.starscape.bracketflow.features.trackprogress.app;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.starscape.bracketflow.common.domain.DomainEvent;
import com.starscape.bracketflow.common.exception.NotFoundException;
import com.starscape.bracketflow.features.jobs.domain.Job;
import com.starscape.bracketflow.features.jobs.domain.JobRepository;
import com.starscape.bracketflow.features.trackprogress.domain.JobEvent;
import com.starscape.bracketflow.features.trackprogress.domain.JobEventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Appends to the per-job event log and pushes committed events to the live subscriber.
 * <p>
 * Sequence numbers come from the job row, so appends must happen while the job is
 * locked. Live delivery waits for the surrounding transaction to commit; a rolled
 * back append is never pushed.
 */
@Service
public class JobEventBus {
    
    private static final Logger log = LoggerFactory.getLogger(JobEventBus.class);
    
    private final JobRepository jobRepository;
    private final JobEventRepository eventRepository;
    private final JobSubscriberRegistry subscriberRegistry;
    private final ObjectMapper objectMapper;
    
    public JobEventBus(
            JobRepository jobRepository,
            JobEventRepository eventRepository,
            JobSubscriberRegistry subscriberRegistry,
            ObjectMapper objectMapper) {
        this.jobRepository = jobRepository;
        this.eventRepository = eventRepository;
        this.subscriberRegistry = subscriberRegistry;
        this.objectMapper = objectMapper;
    }
    
    @Transactional
    public long append(String jobId, DomainEvent event) {
        Job job = jobRepository.findByIdForUpdate(jobId)
                .orElseThrow(() -> new NotFoundException("Job not found: " + jobId));
        return append(job, event);
    }
    
    /**
     * Appends with a job the caller has already locked in the current transaction.
     */
    public long append(Job job, DomainEvent event) {
        long sequence = job.nextEventSequence();
        JobEvent stored = new JobEvent(
            "evt_" + UUID.randomUUID().toString().replace("-", ""),
            job.getJobId(),
            sequence,
            event.getEventType(),
            serialize(job.getJobId(), sequence, event),
            event.getOccurredOn()
        );
        eventRepository.save(stored);
        jobRepository.save(job);
        log.debug("Appended {} #{} to job {}", event.getEventType(), sequence, job.getJobId());
        pushAfterCommit(stored);
        return sequence;
    }
    
    /**
     * Drains the events the job raised during this transaction into its log.
     */
    public void publishPending(Job job) {
        List<DomainEvent> pending = new ArrayList<>(job.getDomainEvents());
        job.clearDomainEvents();
        for (DomainEvent event : pending) {
            append(job, event);
        }
    }
    
    private void pushAfterCommit(JobEvent event) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            subscriberRegistry.deliver(event);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                subscriberRegistry.deliver(event);
            }
        });
    }
    
    private String serialize(String jobId, long sequence, DomainEvent event) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("job_id", jobId);
        body.put("seq", sequence);
        body.put("type", event.getEventType());
        body.putAll(event.toPayload());
        body.put("ts", event.getOccurredOn() != null ? event.getOccurredOn().toString() : null);
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize event " + event.getEventType(), e);
        }
    }
}
