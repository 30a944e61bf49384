package com.starscape.bracketflow.features.grouping.domain;

import com.starscape.bracketflow.common.config.GroupingProperties;
import com.starscape.bracketflow.common.config.GroupingProperties.Scoring;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Scores how likely a set of frames is one exposure bracket. Every term is bounded by its
 * configured weight and the sum is clamped to [0, 1].
 */
public class HdrConfidenceScorer {

    private static final Set<Integer> CONVENTIONAL_SIZES = Set.of(3, 5, 7);
    private static final double[] STEP_TARGETS = {1.0, 2.0};

    private final GroupingProperties properties;
    private final Scoring scoring;

    public HdrConfidenceScorer(GroupingProperties properties) {
        this.properties = properties;
        this.scoring = properties.getScoring();
    }

    public double confidence(List<FrameMetadata> frames) {
        if (frames.size() < properties.getMinBracketSize()) {
            return 0.0;
        }
        double time = timeCompactness(frames);
        boolean sequential = hasSequentialFilenames(frames);
        double camera = sameCamera(frames);
        List<Double> exposures = exposures(frames);

        if (exposures.isEmpty()) {
            double sequence = sequential ? scoring.getSequenceWeight() : 0.0;
            double score = Math.min(1.0, time + sequence + camera);
            if (CONVENTIONAL_SIZES.contains(frames.size())
                    && (sequential || time >= scoring.getNoExposureMinTimeScore())) {
                score = Math.max(score, scoring.getConventionalSizeFloor());
            }
            return clamp(score);
        }

        double spread = spread(exposures);
        double score = time
            + exposureStepRegularity(exposures)
            + isoConsistency(frames)
            + camera
            + (spread >= properties.getMinExposureSpread() ? scoring.getEvRangeWeight() : 0.0);
        if (CONVENTIONAL_SIZES.contains(frames.size())
                && spread >= properties.getMinExposureSpread()
                && (sequential || time >= scoring.getConventionalSizeMinTimeScore())) {
            score = Math.max(score, scoring.getConventionalSizeFloor());
        }
        return clamp(score);
    }

    /**
     * Full weight up to the tight span, nothing past the loose span, linear in between.
     * Zero when any frame lacks a capture time.
     */
    double timeCompactness(List<FrameMetadata> frames) {
        long min = Long.MAX_VALUE;
        long max = Long.MIN_VALUE;
        for (FrameMetadata frame : frames) {
            Instant time = frame.captureTime();
            if (time == null) {
                return 0.0;
            }
            min = Math.min(min, time.toEpochMilli());
            max = Math.max(max, time.toEpochMilli());
        }
        long span = max - min;
        long tight = scoring.getTightSpanMs();
        long loose = scoring.getLooseSpanMs();
        if (span <= tight) {
            return scoring.getTimeWeight();
        }
        if (span >= loose || loose <= tight) {
            return 0.0;
        }
        return scoring.getTimeWeight() * (1.0 - (double) (span - tight) / (loose - tight));
    }

    /**
     * Fraction of consecutive sorted exposure steps that sit near 1 EV or near 2 EV,
     * whichever target fits more steps.
     */
    double exposureStepRegularity(List<Double> exposures) {
        if (exposures.size() < 2) {
            return 0.0;
        }
        List<Double> sorted = new ArrayList<>(exposures);
        sorted.sort(Comparator.reverseOrder());
        List<Double> steps = new ArrayList<>();
        for (int i = 1; i < sorted.size(); i++) {
            steps.add(Math.abs(sorted.get(i - 1) - sorted.get(i)));
        }
        double bestFraction = 0.0;
        for (double target : STEP_TARGETS) {
            long matching = steps.stream()
                .filter(step -> Math.abs(step - target) <= scoring.getExposureStepTolerance())
                .count();
            bestFraction = Math.max(bestFraction, (double) matching / steps.size());
        }
        return bestFraction * scoring.getExposureStepWeight();
    }

    double isoConsistency(List<FrameMetadata> frames) {
        Integer first = frames.get(0).iso();
        if (first == null) {
            return 0.0;
        }
        for (FrameMetadata frame : frames) {
            if (frame.iso() == null || Math.abs(frame.iso() - first) > scoring.getIsoTolerance()) {
                return 0.0;
            }
        }
        return scoring.getIsoWeight();
    }

    double sameCamera(List<FrameMetadata> frames) {
        String make = frames.get(0).cameraMake();
        String model = frames.get(0).cameraModel();
        if (make == null || model == null) {
            return 0.0;
        }
        for (FrameMetadata frame : frames) {
            if (!Objects.equals(make, frame.cameraMake()) || !Objects.equals(model, frame.cameraModel())) {
                return 0.0;
            }
        }
        return scoring.getCameraWeight();
    }

    /**
     * All frames carry a filename counter with the same prefix, stepping by exactly one.
     */
    public static boolean hasSequentialFilenames(List<FrameMetadata> frames) {
        if (frames.size() < 2) {
            return false;
        }
        List<FrameMetadata> sorted = new ArrayList<>(frames);
        for (FrameMetadata frame : sorted) {
            if (frame.sequence() == null) {
                return false;
            }
        }
        sorted.sort(Comparator.comparingLong(frame -> frame.sequence().number()));
        for (int i = 1; i < sorted.size(); i++) {
            if (!sorted.get(i - 1).sequence().isFollowedBy(sorted.get(i).sequence())) {
                return false;
            }
        }
        return true;
    }

    static List<Double> exposures(List<FrameMetadata> frames) {
        Function<FrameMetadata, Double> scale = FrameMetadata.exposureScale(frames);
        List<Double> values = new ArrayList<>();
        for (FrameMetadata frame : frames) {
            Double exposure = scale.apply(frame);
            if (exposure != null) {
                values.add(exposure);
            }
        }
        return values;
    }

    static double spread(List<Double> values) {
        if (values.size() < 2) {
            return 0.0;
        }
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double value : values) {
            min = Math.min(min, value);
            max = Math.max(max, value);
        }
        return max - min;
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }
}
