package com.starscape.bracketflow.features.grouping.domain;

import com.starscape.bracketflow.common.config.GroupingProperties;
import com.starscape.bracketflow.features.jobs.domain.FileKind;
import com.starscape.bracketflow.features.metadata.domain.SequenceToken;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class HdrConfidenceScorerTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private HdrConfidenceScorer scorer;

    @BeforeEach
    void setUp() {
        scorer = new HdrConfidenceScorer(new GroupingProperties());
    }

    @Test
    void confidence_tightRegularBracket_isClampedToOne() {
        List<FrameMetadata> frames = List.of(
            frame("IMG_0001.CR2", 0, 12.0, 100),
            frame("IMG_0002.CR2", 1000, 11.0, 100),
            frame("IMG_0003.CR2", 2000, 13.0, 100));

        assertThat(scorer.confidence(frames)).isEqualTo(1.0);
    }

    @Test
    void confidence_belowMinimumSize_isZero() {
        assertThat(scorer.confidence(List.of(frame("IMG_0001.CR2", 0, 12.0, 100)))).isZero();
    }

    @Test
    void confidence_noExposureData_usesConventionalSizeFloor() {
        // time term 0.4 * (1 - 5000 / 6000), sequence 0.35, camera 0.1
        List<FrameMetadata> frames = List.of(
            frame("IMG_0001.JPG", 0, null, null),
            frame("IMG_0002.JPG", 4000, null, null),
            frame("IMG_0003.JPG", 8000, null, null));

        assertThat(scorer.confidence(frames)).isCloseTo(0.7, within(1e-9));
    }

    @Test
    void timeCompactness_decaysLinearlyBetweenSpans() {
        assertThat(scorer.timeCompactness(List.of(frame("a1.CR2", 0, 1.0, 100), frame("a2.CR2", 3000, 1.0, 100))))
            .isCloseTo(0.4, within(1e-9));
        assertThat(scorer.timeCompactness(List.of(frame("a1.CR2", 0, 1.0, 100), frame("a2.CR2", 6000, 1.0, 100))))
            .isCloseTo(0.2, within(1e-9));
        assertThat(scorer.timeCompactness(List.of(frame("a1.CR2", 0, 1.0, 100), frame("a2.CR2", 9000, 1.0, 100))))
            .isZero();
    }

    @Test
    void timeCompactness_missingCaptureTime_isZero() {
        FrameMetadata untimed = new FrameMetadata("f2", "k2", "a2.CR2", FileKind.RAW, null,
            1.0, null, 8.0, 100, 24.0, "Canon", "EOS R5", null);

        assertThat(scorer.timeCompactness(List.of(frame("a1.CR2", 0, 1.0, 100), untimed))).isZero();
    }

    @Test
    void exposureStepRegularity_matchesOneOrTwoStopSteps() {
        assertThat(scorer.exposureStepRegularity(List.of(0.0, -1.0, 1.0))).isCloseTo(0.35, within(1e-9));
        assertThat(scorer.exposureStepRegularity(List.of(0.0, 2.0, -2.0))).isCloseTo(0.35, within(1e-9));
        assertThat(scorer.exposureStepRegularity(List.of(0.0, 0.2, 3.0))).isZero();
        assertThat(scorer.exposureStepRegularity(List.of(0.0))).isZero();
    }

    @Test
    void isoConsistency_requiresMatchingIso() {
        assertThat(scorer.isoConsistency(List.of(frame("a1.CR2", 0, 1.0, 100), frame("a2.CR2", 0, 2.0, 100))))
            .isEqualTo(0.15);
        assertThat(scorer.isoConsistency(List.of(frame("a1.CR2", 0, 1.0, 100), frame("a2.CR2", 0, 2.0, 200))))
            .isZero();
    }

    @Test
    void hasSequentialFilenames_requiresConsecutiveCounters() {
        assertThat(HdrConfidenceScorer.hasSequentialFilenames(List.of(
            frame("IMG_0003.CR2", 0, null, null),
            frame("IMG_0002.CR2", 0, null, null)))).isTrue();
        assertThat(HdrConfidenceScorer.hasSequentialFilenames(List.of(
            frame("IMG_0001.CR2", 0, null, null),
            frame("IMG_0003.CR2", 0, null, null)))).isFalse();
        assertThat(HdrConfidenceScorer.hasSequentialFilenames(List.of(
            frame("IMG_0001.CR2", 0, null, null),
            frame("DSC_0002.CR2", 0, null, null)))).isFalse();
    }

    private static FrameMetadata frame(String filename, long millis, Double exposureValue, Integer iso) {
        return new FrameMetadata(
            "fil_" + filename,
            "key/" + filename,
            filename,
            FileKind.fromFilename(filename),
            T0.plusMillis(millis),
            exposureValue,
            null,
            8.0,
            iso,
            24.0,
            "Canon",
            "EOS R5",
            SequenceToken.parse(filename).orElse(null));
    }
}
