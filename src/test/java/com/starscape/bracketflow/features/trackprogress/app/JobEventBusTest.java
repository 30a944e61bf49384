package com.starscape.bracketflow.features.trackprogress.app;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.starscape.bracketflow.features.jobs.domain.Job;
import com.starscape.bracketflow.features.jobs.domain.Workflow;
import com.starscape.bracketflow.features.jobs.domain.events.FilesRegistered;
import com.starscape.bracketflow.features.trackprogress.domain.JobEvent;
import com.starscape.bracketflow.support.InMemoryJobEventRepository;
import com.starscape.bracketflow.support.InMemoryJobRepository;
import com.starscape.bracketflow.support.RecordingEventSink;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class JobEventBusTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private InMemoryJobRepository jobs;
    private InMemoryJobEventRepository events;
    private JobSubscriberRegistry registry;
    private JobEventBus bus;
    private Job job;

    @BeforeEach
    void setUp() {
        jobs = new InMemoryJobRepository();
        events = new InMemoryJobEventRepository();
        registry = new JobSubscriberRegistry();
        bus = new JobEventBus(jobs, events, registry, objectMapper);
        job = jobs.save(new Job("job_1", "usr_1", new Workflow("wf_1", "hdr", "HDR", 1, 3), null));
    }

    @Test
    void append_assignsGaplessSequences() {
        long first = bus.append(job, new FilesRegistered("job_1", 3, 1, Instant.now()));
        long second = bus.append("job_1", new FilesRegistered("job_1", 3, 3, Instant.now()));

        assertThat(first).isEqualTo(1);
        assertThat(second).isEqualTo(2);
        assertThat(job.getLastEventSequence()).isEqualTo(2);
        assertThat(events.all("job_1")).extracting(JobEvent::getSequence).containsExactly(1L, 2L);
    }

    @Test
    void append_payloadCarriesEnvelopeFields() throws Exception {
        bus.append(job, new FilesRegistered("job_1", 3, 1, Instant.parse("2024-05-01T10:00:00Z")));

        JsonNode payload = objectMapper.readTree(events.all("job_1").get(0).getPayload());
        assertThat(payload.get("job_id").asText()).isEqualTo("job_1");
        assertThat(payload.get("seq").asLong()).isEqualTo(1);
        assertThat(payload.get("type").asText()).isEqualTo("files_registered");
        assertThat(payload.get("ts").asText()).isEqualTo("2024-05-01T10:00:00Z");
    }

    @Test
    void publishPending_drainsAggregateEvents() {
        job.recordUploads(2, 1);

        bus.publishPending(job);

        assertThat(job.getDomainEvents()).isEmpty();
        assertThat(events.types("job_1")).containsExactly("job_status_changed");
    }

    @Test
    void append_outsideTransaction_pushesToLiveSubscriber() {
        RecordingEventSink sink = new RecordingEventSink();
        JobEventSubscription subscription = new JobEventSubscription("job_1", sink, events);
        registry.attach(subscription);
        subscription.start(0);

        bus.append(job, new FilesRegistered("job_1", 1, 1, Instant.now()));

        assertThat(sink.sequences()).containsExactly(1L);
    }
}
