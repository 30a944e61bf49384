package com.starscape.bracketflow.features.dispatch.app;

import com.starscape.bracketflow.common.config.DispatchProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DispatchMetricsTest {

    private DispatchMetrics metrics;

    @BeforeEach
    void setUp() {
        DispatchProperties properties = new DispatchProperties();
        properties.setMaxConcurrency(2);
        properties.setEstimatedRunSeconds(180);
        properties.setMinEstimatedRunSeconds(30);
        metrics = new DispatchMetrics(properties);
    }

    @Test
    void etaSeconds_usesEstimateUntilARunFinishes() {
        assertThat(metrics.averageRunSeconds()).isEqualTo(180);
        // ceil(3 / 2 * 180)
        assertThat(metrics.etaSeconds(3)).isEqualTo(270);
        assertThat(metrics.etaSeconds(0)).isZero();
    }

    @Test
    void pending_countsWaitingAndRunning() {
        metrics.beginWaiting();
        metrics.beginWaiting();
        assertThat(metrics.pending()).isEqualTo(2);

        metrics.recordStart("job_a");
        metrics.abortWaiting();

        assertThat(metrics.pending()).isEqualTo(1);
        assertThat(metrics.startedCount()).isEqualTo(1);
    }

    @Test
    void recordFinish_countsOncePerRun() {
        metrics.beginWaiting();
        metrics.recordStart("job_a");

        metrics.recordFinish("job_a");
        metrics.recordFinish("job_a");
        metrics.recordFinish("job_unknown");

        assertThat(metrics.finishedCount()).isEqualTo(1);
        assertThat(metrics.pending()).isZero();
        // sub-second runs are floored to the configured minimum
        assertThat(metrics.averageRunSeconds()).isEqualTo(30);
    }

    @Test
    void forget_dropsRunWithoutCountingIt() {
        metrics.beginWaiting();
        metrics.recordStart("job_a");

        metrics.forget("job_a");

        assertThat(metrics.pending()).isZero();
        assertThat(metrics.finishedCount()).isZero();
    }
}
