package com.starscape.bracketflow.features.grouping.domain;

import com.starscape.bracketflow.features.jobs.domain.FileKind;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class FrameMetadataTest {

    @Test
    void shutterStops_growAsShutterShortens() {
        assertThat(frame(null, 1.0 / 128).shutterStops()).isCloseTo(7.0, within(1e-9));
        assertThat(frame(null, 1.0 / 8).shutterStops()).isCloseTo(3.0, within(1e-9));
        assertThat(frame(null, 2.0).shutterStops()).isCloseTo(-1.0, within(1e-9));
        assertThat(frame(null, null).shutterStops()).isNull();
    }

    @Test
    void exposureScale_prefersEvForTheWholeSet() {
        FrameMetadata withEv = frame(12.0, 1.0 / 128);
        FrameMetadata shutterOnly = frame(null, 1.0 / 4);

        Function<FrameMetadata, Double> scale = FrameMetadata.exposureScale(List.of(withEv, shutterOnly));

        assertThat(scale.apply(withEv)).isEqualTo(12.0);
        assertThat(scale.apply(shutterOnly)).isNull();
    }

    @Test
    void exposureScale_withoutAnyEv_usesShutterStops() {
        FrameMetadata fast = frame(null, 1.0 / 256);
        FrameMetadata slow = frame(null, 1.0 / 16);

        Function<FrameMetadata, Double> scale = FrameMetadata.exposureScale(List.of(fast, slow));

        assertThat(scale.apply(fast)).isGreaterThan(scale.apply(slow));
    }

    private static FrameMetadata frame(Double exposureValue, Double exposureTime) {
        return new FrameMetadata("fil_1", "dev/u1/jobs/j1/raw/IMG_0001.CR2", "IMG_0001.CR2", FileKind.RAW,
            Instant.parse("2024-05-01T10:00:00Z"), exposureValue, exposureTime, null, null, null,
            null, null, null);
    }
}
