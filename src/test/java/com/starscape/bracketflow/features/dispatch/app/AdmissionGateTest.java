package com.starscape.bracketflow.features.dispatch.app;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class AdmissionGateTest {

    @Test
    void acquire_beyondCapacity_waitsForARelease() {
        AdmissionGate gate = new AdmissionGate(2);
        AdmissionGate.Permit first = gate.acquire();
        AdmissionGate.Permit second = gate.acquire();

        CompletableFuture<AdmissionGate.Permit> third = CompletableFuture.supplyAsync(gate::acquire);
        await().atMost(Duration.ofSeconds(5)).until(() -> gate.waiting() == 1);
        assertThat(third).isNotDone();

        first.close();

        await().atMost(Duration.ofSeconds(5)).until(third::isDone);
        assertThat(gate.inFlight()).isEqualTo(2);
        second.close();
        third.join().close();
        assertThat(gate.inFlight()).isZero();
    }

    @Test
    void close_twice_releasesOnce() {
        AdmissionGate gate = new AdmissionGate(1);
        AdmissionGate.Permit permit = gate.acquire();

        permit.close();
        permit.close();

        assertThat(gate.inFlight()).isZero();
        assertThat(gate.capacity()).isEqualTo(1);
    }

    @Test
    void constructor_rejectsNonPositiveCapacity() {
        assertThatThrownBy(() -> new AdmissionGate(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
