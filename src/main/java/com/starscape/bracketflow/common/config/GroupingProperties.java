package com.starscape.bracketflow.common.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tunable thresholds for bracket detection and HDR scoring.
 * Binds to app.grouping.* properties from application.yml
 */
@ConfigurationProperties(prefix = "app.grouping")
public class GroupingProperties {

    private int minBracketSize = 2;
    private int maxBracketSize = 7;
    private long baseGapMs = 3000;
    private long bracketWindowMs = 10000;
    private double confidenceThreshold = 0.70;
    private double monotonicTolerance = 0.05;
    private double focalLengthTolerance = 0.1;
    private double apertureTolerance = 0.1;
    private double isoRelativeTolerance = 0.10;
    private double minExposureSpread = 0.6;
    private double minShutterRatio = 2.0;
    private double reversalDirectionStep = 0.4;
    private double reversalFlipStep = 0.6;
    private double reversalReturnTolerance = 0.4;
    private String outputExtension = "jpg";
    private int metadataConcurrency = 2;
    private Scoring scoring = new Scoring();

    public int getMinBracketSize() {
        return minBracketSize;
    }

    public void setMinBracketSize(int minBracketSize) {
        this.minBracketSize = minBracketSize;
    }

    /**
     * Largest bracket the engine emits. Zero or less means unlimited.
     */
    public int getMaxBracketSize() {
        return maxBracketSize;
    }

    public void setMaxBracketSize(int maxBracketSize) {
        this.maxBracketSize = maxBracketSize;
    }

    public int effectiveMaxBracketSize() {
        return maxBracketSize <= 0 ? Integer.MAX_VALUE : Math.max(maxBracketSize, minBracketSize);
    }

    public long getBaseGapMs() {
        return baseGapMs;
    }

    public void setBaseGapMs(long baseGapMs) {
        this.baseGapMs = baseGapMs;
    }

    public long getBracketWindowMs() {
        return bracketWindowMs;
    }

    public void setBracketWindowMs(long bracketWindowMs) {
        this.bracketWindowMs = bracketWindowMs;
    }

    public double getConfidenceThreshold() {
        return confidenceThreshold;
    }

    public void setConfidenceThreshold(double confidenceThreshold) {
        this.confidenceThreshold = confidenceThreshold;
    }

    public double getMonotonicTolerance() {
        return monotonicTolerance;
    }

    public void setMonotonicTolerance(double monotonicTolerance) {
        this.monotonicTolerance = monotonicTolerance;
    }

    public double getFocalLengthTolerance() {
        return focalLengthTolerance;
    }

    public void setFocalLengthTolerance(double focalLengthTolerance) {
        this.focalLengthTolerance = focalLengthTolerance;
    }

    public double getApertureTolerance() {
        return apertureTolerance;
    }

    public void setApertureTolerance(double apertureTolerance) {
        this.apertureTolerance = apertureTolerance;
    }

    public double getIsoRelativeTolerance() {
        return isoRelativeTolerance;
    }

    public void setIsoRelativeTolerance(double isoRelativeTolerance) {
        this.isoRelativeTolerance = isoRelativeTolerance;
    }

    public double getMinExposureSpread() {
        return minExposureSpread;
    }

    public void setMinExposureSpread(double minExposureSpread) {
        this.minExposureSpread = minExposureSpread;
    }

    public double getMinShutterRatio() {
        return minShutterRatio;
    }

    public void setMinShutterRatio(double minShutterRatio) {
        this.minShutterRatio = minShutterRatio;
    }

    public double getReversalDirectionStep() {
        return reversalDirectionStep;
    }

    public void setReversalDirectionStep(double reversalDirectionStep) {
        this.reversalDirectionStep = reversalDirectionStep;
    }

    public double getReversalFlipStep() {
        return reversalFlipStep;
    }

    public void setReversalFlipStep(double reversalFlipStep) {
        this.reversalFlipStep = reversalFlipStep;
    }

    public double getReversalReturnTolerance() {
        return reversalReturnTolerance;
    }

    public void setReversalReturnTolerance(double reversalReturnTolerance) {
        this.reversalReturnTolerance = reversalReturnTolerance;
    }

    public String getOutputExtension() {
        return outputExtension;
    }

    public void setOutputExtension(String outputExtension) {
        this.outputExtension = outputExtension;
    }

    public int getMetadataConcurrency() {
        return metadataConcurrency;
    }

    public void setMetadataConcurrency(int metadataConcurrency) {
        this.metadataConcurrency = metadataConcurrency;
    }

    public Scoring getScoring() {
        return scoring;
    }

    public void setScoring(Scoring scoring) {
        this.scoring = scoring;
    }

    /**
     * Named weights of the HDR confidence score. Each term contributes at most its weight.
     */
    public static class Scoring {

        private double timeWeight = 0.4;
        private long tightSpanMs = 3000;
        private long looseSpanMs = 9000;
        private double exposureStepWeight = 0.35;
        private double exposureStepTolerance = 0.3;
        private double isoWeight = 0.15;
        private double isoTolerance = 0.5;
        private double cameraWeight = 0.1;
        private double evRangeWeight = 0.2;
        private double sequenceWeight = 0.35;
        private double conventionalSizeFloor = 0.7;
        private double conventionalSizeMinTimeScore = 0.3;
        private double noExposureMinTimeScore = 0.2;

        public double getTimeWeight() {
            return timeWeight;
        }

        public void setTimeWeight(double timeWeight) {
            this.timeWeight = timeWeight;
        }

        public long getTightSpanMs() {
            return tightSpanMs;
        }

        public void setTightSpanMs(long tightSpanMs) {
            this.tightSpanMs = tightSpanMs;
        }

        public long getLooseSpanMs() {
            return looseSpanMs;
        }

        public void setLooseSpanMs(long looseSpanMs) {
            this.looseSpanMs = looseSpanMs;
        }

        public double getExposureStepWeight() {
            return exposureStepWeight;
        }

        public void setExposureStepWeight(double exposureStepWeight) {
            this.exposureStepWeight = exposureStepWeight;
        }

        public double getExposureStepTolerance() {
            return exposureStepTolerance;
        }

        public void setExposureStepTolerance(double exposureStepTolerance) {
            this.exposureStepTolerance = exposureStepTolerance;
        }

        public double getIsoWeight() {
            return isoWeight;
        }

        public void setIsoWeight(double isoWeight) {
            this.isoWeight = isoWeight;
        }

        public double getIsoTolerance() {
            return isoTolerance;
        }

        public void setIsoTolerance(double isoTolerance) {
            this.isoTolerance = isoTolerance;
        }

        public double getCameraWeight() {
            return cameraWeight;
        }

        public void setCameraWeight(double cameraWeight) {
            this.cameraWeight = cameraWeight;
        }

        public double getEvRangeWeight() {
            return evRangeWeight;
        }

        public void setEvRangeWeight(double evRangeWeight) {
            this.evRangeWeight = evRangeWeight;
        }

        public double getSequenceWeight() {
            return sequenceWeight;
        }

        public void setSequenceWeight(double sequenceWeight) {
            this.sequenceWeight = sequenceWeight;
        }

        public double getConventionalSizeFloor() {
            return conventionalSizeFloor;
        }

        public void setConventionalSizeFloor(double conventionalSizeFloor) {
            this.conventionalSizeFloor = conventionalSizeFloor;
        }

        public double getConventionalSizeMinTimeScore() {
            return conventionalSizeMinTimeScore;
        }

        public void setConventionalSizeMinTimeScore(double conventionalSizeMinTimeScore) {
            this.conventionalSizeMinTimeScore = conventionalSizeMinTimeScore;
        }

        public double getNoExposureMinTimeScore() {
            return noExposureMinTimeScore;
        }

        public void setNoExposureMinTimeScore(double noExposureMinTimeScore) {
            this.noExposureMinTimeScore = noExposureMinTimeScore;
        }
    }
}
