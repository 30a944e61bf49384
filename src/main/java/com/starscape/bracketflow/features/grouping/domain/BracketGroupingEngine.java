package com.starscape.bracketflow.features.grouping.domain;

import com.starscape.bracketflow.common.config.GroupingProperties;
import com.starscape.bracketflow.features.jobs.domain.GroupType;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/**
 * Partitions a job's files into capture groups.
 * <p>
 * Pure and deterministic: the result depends only on the metadata of the given frames,
 * never on their input order, so re-analysis and manifest hashing are stable.
 * Stages: partition candidates from pass-through files, order, cluster by time (or by
 * filename sequence when capture times are missing), split on exposure reversals, split
 * oversized runs into planned brackets, then score and classify each piece.
 */
public class BracketGroupingEngine {

    private static final int MIN_CANDIDATE_FRAMES = 3;

    private static final Comparator<FrameMetadata> BY_NAME = Comparator
        .comparing(FrameMetadata::filename, Comparator.nullsLast(Comparator.naturalOrder()))
        .thenComparing(FrameMetadata::storageKey, Comparator.nullsLast(Comparator.naturalOrder()))
        .thenComparing(FrameMetadata::fileId, Comparator.nullsLast(Comparator.naturalOrder()));

    private static final Comparator<FrameMetadata> BY_TIME = Comparator
        .comparing(FrameMetadata::captureTime, Comparator.nullsLast(Comparator.naturalOrder()))
        .thenComparing(BY_NAME);

    private static final Comparator<FrameMetadata> BY_SEQUENCE = Comparator
        .comparing((FrameMetadata frame) -> frame.sequence() == null)
        .thenComparing(frame -> frame.sequence() == null ? "" : frame.sequence().prefix())
        .thenComparingLong(frame -> frame.sequence() == null ? 0L : frame.sequence().number())
        .thenComparing(BY_NAME);

    private final GroupingProperties properties;
    private final HdrConfidenceScorer scorer;

    public BracketGroupingEngine(GroupingProperties properties) {
        this.properties = properties;
        this.scorer = new HdrConfidenceScorer(properties);
    }

    public List<GroupSpec> group(List<FrameMetadata> frames) {
        List<FrameMetadata> candidates = new ArrayList<>();
        List<FrameMetadata> passThrough = new ArrayList<>();
        for (FrameMetadata frame : frames) {
            if (frame.kind() != null && frame.kind().isBracketCandidate()) {
                candidates.add(frame);
            } else {
                passThrough.add(frame);
            }
        }
        candidates.sort(BY_NAME);
        passThrough.sort(BY_NAME);

        List<GroupSpec> groups = new ArrayList<>();
        for (List<FrameMetadata> cluster : cluster(candidates)) {
            for (List<FrameMetadata> segment : splitOnReversal(cluster)) {
                groups.addAll(classifySegment(segment));
            }
        }
        for (FrameMetadata frame : passThrough) {
            groups.add(singleton(frame, GroupType.IMAGE, null));
        }
        return groups;
    }

    // ---- clustering

    List<List<FrameMetadata>> cluster(List<FrameMetadata> candidates) {
        if (candidates.isEmpty()) {
            return List.of();
        }
        boolean sequentialAll = candidates.size() >= properties.getMinBracketSize()
            && HdrConfidenceScorer.hasSequentialFilenames(candidates);
        long missingTime = candidates.stream().filter(frame -> frame.captureTime() == null).count();

        if (sequentialAll && missingTime * 2 > candidates.size()) {
            return sequenceClusters(sorted(candidates, BY_SEQUENCE));
        }

        List<FrameMetadata> timed = new ArrayList<>();
        List<FrameMetadata> untimed = new ArrayList<>();
        for (FrameMetadata frame : sorted(candidates, BY_TIME)) {
            (frame.captureTime() != null ? timed : untimed).add(frame);
        }
        List<List<FrameMetadata>> clusters = new ArrayList<>(timeClusters(timed));
        clusters.addAll(sequenceClusters(sorted(untimed, BY_SEQUENCE)));

        if (sequentialAll && clusters.stream().noneMatch(c -> c.size() >= properties.getMinBracketSize())) {
            return sequenceClusters(sorted(candidates, BY_SEQUENCE));
        }
        return clusters;
    }

    /**
     * Walks frames in capture order. A hard discontinuity always breaks; otherwise the gap
     * may stretch to the bracket window while the growing cluster still looks like a bracket.
     */
    List<List<FrameMetadata>> timeClusters(List<FrameMetadata> timed) {
        List<List<FrameMetadata>> clusters = new ArrayList<>();
        List<FrameMetadata> current = new ArrayList<>();
        for (FrameMetadata frame : timed) {
            if (current.isEmpty()) {
                current.add(frame);
                continue;
            }
            FrameMetadata last = current.get(current.size() - 1);
            boolean startNew;
            if (hasHardBreak(last, frame)) {
                startNew = true;
            } else {
                long gap = frame.captureMillis() - last.captureMillis();
                List<FrameMetadata> extended = new ArrayList<>(current);
                extended.add(frame);
                long allowed = isBracketCandidate(extended)
                    ? properties.getBracketWindowMs()
                    : properties.getBaseGapMs();
                startNew = gap > allowed;
            }
            if (startNew) {
                clusters.add(current);
                current = new ArrayList<>();
            }
            current.add(frame);
        }
        if (!current.isEmpty()) {
            clusters.add(current);
        }
        return clusters;
    }

    /**
     * Consecutive frame counters with the same prefix form one cluster; frames without a
     * counter stand alone.
     */
    List<List<FrameMetadata>> sequenceClusters(List<FrameMetadata> ordered) {
        List<List<FrameMetadata>> clusters = new ArrayList<>();
        List<FrameMetadata> current = new ArrayList<>();
        for (FrameMetadata frame : ordered) {
            if (frame.sequence() == null) {
                if (!current.isEmpty()) {
                    clusters.add(current);
                    current = new ArrayList<>();
                }
                clusters.add(List.of(frame));
                continue;
            }
            if (!current.isEmpty()) {
                FrameMetadata last = current.get(current.size() - 1);
                if (hasHardBreak(last, frame) || !last.sequence().isFollowedBy(frame.sequence())) {
                    clusters.add(current);
                    current = new ArrayList<>();
                }
            }
            current.add(frame);
        }
        if (!current.isEmpty()) {
            clusters.add(current);
        }
        return clusters;
    }

    boolean hasHardBreak(FrameMetadata a, FrameMetadata b) {
        if (differs(a.cameraMake(), b.cameraMake()) || differs(a.cameraModel(), b.cameraModel())) {
            return true;
        }
        if (a.focalLength() != null && b.focalLength() != null
                && Math.abs(a.focalLength() - b.focalLength()) > properties.getFocalLengthTolerance()) {
            return true;
        }
        if (a.fNumber() != null && b.fNumber() != null
                && Math.abs(a.fNumber() - b.fNumber()) > properties.getApertureTolerance()) {
            return true;
        }
        return a.iso() != null && b.iso() != null && a.iso() > 0
            && (double) Math.abs(a.iso() - b.iso()) / a.iso() > properties.getIsoRelativeTolerance();
    }

    /**
     * Provisional bracket test used to widen the clustering window: enough timed frames with
     * exposure data, a monotonic exposure direction in capture order, and a real spread.
     */
    boolean isBracketCandidate(List<FrameMetadata> frames) {
        if (frames.size() < MIN_CANDIDATE_FRAMES) {
            return false;
        }
        if (frames.stream().anyMatch(frame -> frame.captureTime() == null)) {
            return false;
        }
        List<FrameMetadata> ordered = sorted(frames, BY_TIME);
        List<Double> exposures = HdrConfidenceScorer.exposures(ordered);
        if (exposures.size() < MIN_CANDIDATE_FRAMES) {
            return false;
        }
        boolean spread = HdrConfidenceScorer.spread(exposures) >= properties.getMinExposureSpread()
            || shutterRatio(ordered) >= properties.getMinShutterRatio();
        return spread && isMonotonic(exposures);
    }

    private double shutterRatio(List<FrameMetadata> ordered) {
        Double first = ordered.get(0).exposureTime();
        Double last = ordered.get(ordered.size() - 1).exposureTime();
        if (first == null || last == null || first <= 0 || last <= 0) {
            return 0.0;
        }
        return Math.max(first / last, last / first);
    }

    boolean isMonotonic(List<Double> values) {
        if (values.size() < 2) {
            return false;
        }
        double tolerance = properties.getMonotonicTolerance();
        boolean nonDecreasing = true;
        boolean nonIncreasing = true;
        for (int i = 1; i < values.size(); i++) {
            double delta = values.get(i) - values.get(i - 1);
            if (delta < -tolerance) {
                nonDecreasing = false;
            }
            if (delta > tolerance) {
                nonIncreasing = false;
            }
        }
        return nonDecreasing || nonIncreasing;
    }

    // ---- splitting

    /**
     * Cuts a cluster where the exposure sweep turns around: after at least two frames the
     * direction flips by a large step and the new exposure either returns near the sweep's
     * start or falls back inside an already wide range. A flip that extends the range past
     * both ends (0, -2, +2 style brackets) keeps the cluster together.
     */
    List<List<FrameMetadata>> splitOnReversal(List<FrameMetadata> cluster) {
        if (cluster.size() <= 2) {
            return List.of(cluster);
        }
        List<List<FrameMetadata>> segments = new ArrayList<>();
        List<FrameMetadata> current = new ArrayList<>();
        Double start = null;
        Double previous = null;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        int direction = 0;
        Function<FrameMetadata, Double> scale = FrameMetadata.exposureScale(cluster);

        for (FrameMetadata frame : cluster) {
            Double exposure = scale.apply(frame);
            boolean split = false;
            if (exposure != null && previous != null && current.size() >= 2 && direction != 0) {
                double delta = exposure - previous;
                if (Math.signum(delta) != direction && Math.abs(delta) > properties.getReversalFlipStep()) {
                    double tolerance = properties.getReversalReturnTolerance();
                    boolean backToStart = start != null && Math.abs(exposure - start) <= tolerance;
                    boolean insideRange = exposure >= min - tolerance && exposure <= max + tolerance;
                    boolean wideRange = max - min >= properties.getMinExposureSpread();
                    if (backToStart || (insideRange && wideRange)) {
                        split = true;
                    } else {
                        direction = (int) Math.signum(delta);
                    }
                }
            }
            if (split) {
                segments.add(current);
                current = new ArrayList<>();
                start = null;
                previous = null;
                min = Double.POSITIVE_INFINITY;
                max = Double.NEGATIVE_INFINITY;
                direction = 0;
            }
            current.add(frame);
            if (exposure != null) {
                if (start == null) {
                    start = exposure;
                }
                if (previous != null && direction == 0
                        && Math.abs(exposure - previous) >= properties.getReversalDirectionStep()) {
                    direction = (int) Math.signum(exposure - previous);
                }
                previous = exposure;
                min = Math.min(min, exposure);
                max = Math.max(max, exposure);
            }
        }
        segments.add(current);
        return segments;
    }

    /**
     * Oversized segments are cut into planned brackets in capture order; frames left over
     * by the plan become unscored singletons.
     */
    List<GroupSpec> classifySegment(List<FrameMetadata> segment) {
        int max = properties.effectiveMaxBracketSize();
        if (segment.size() <= max) {
            return classify(segment);
        }
        BracketSizePlanner.Plan plan = BracketSizePlanner.plan(segment.size(), properties.getMinBracketSize(), max);
        List<GroupSpec> groups = new ArrayList<>();
        int offset = 0;
        for (int size : plan.bracketSizes()) {
            groups.addAll(classify(segment.subList(offset, offset + size)));
            offset += size;
        }
        for (FrameMetadata frame : segment.subList(offset, segment.size())) {
            groups.add(singleton(frame, GroupType.singletonFor(frame.kind()), null));
        }
        return groups;
    }

    /**
     * Wraps a provider-supplied member list as one {@code group} capture group, ordered and
     * named the same way local brackets are.
     */
    public GroupSpec providedGroup(List<FrameMetadata> members, Double confidence) {
        List<FrameMetadata> ordered = orderMembers(members);
        FrameMetadata lead = pickLead(ordered);
        return new GroupSpec(
            GroupType.GROUP,
            ordered,
            confidence,
            outputFilename(lead.filename()),
            (ordered.size() - 1) / 2
        );
    }

    // ---- scoring and naming

    List<GroupSpec> classify(List<FrameMetadata> frames) {
        if (frames.size() < properties.getMinBracketSize()) {
            return singletons(frames, null);
        }
        List<FrameMetadata> ordered = orderMembers(frames);
        double confidence = scorer.confidence(ordered);
        if (confidence >= properties.getConfidenceThreshold()) {
            FrameMetadata lead = pickLead(ordered);
            return List.of(new GroupSpec(
                GroupType.HDR,
                ordered,
                confidence,
                outputFilename(lead.filename()),
                (ordered.size() - 1) / 2
            ));
        }
        return singletons(frames, confidence);
    }

    private List<GroupSpec> singletons(List<FrameMetadata> frames, Double confidence) {
        List<GroupSpec> groups = new ArrayList<>();
        for (FrameMetadata frame : frames) {
            groups.add(singleton(frame, GroupType.singletonFor(frame.kind()), confidence));
        }
        return groups;
    }

    private GroupSpec singleton(FrameMetadata frame, GroupType type, Double confidence) {
        return new GroupSpec(type, List.of(frame), confidence, outputFilename(frame.filename()), 0);
    }

    /**
     * Output order of a bracket: by EV when any member has one, else by shutter time,
     * else by capture time, else by filename. Sweep direction is enforced earlier, by
     * {@link #splitOnReversal}.
     */
    List<FrameMetadata> orderMembers(List<FrameMetadata> frames) {
        if (frames.stream().anyMatch(FrameMetadata::hasExposureValue)) {
            return sorted(frames, Comparator
                .comparing(FrameMetadata.exposureScale(frames), Comparator.nullsLast(Comparator.naturalOrder()))
                .thenComparing(BY_TIME));
        }
        if (frames.stream().anyMatch(frame -> frame.exposureTime() != null)) {
            return sorted(frames, Comparator
                .comparing(FrameMetadata::exposureTime, Comparator.nullsLast(Comparator.naturalOrder()))
                .thenComparing(BY_TIME));
        }
        if (frames.stream().anyMatch(frame -> frame.captureTime() != null)) {
            return sorted(frames, BY_TIME);
        }
        return sorted(frames, BY_SEQUENCE);
    }

    /**
     * Frame whose name the merged output takes: earliest capture, or the lowest frame counter
     * when no member has a capture time.
     */
    FrameMetadata pickLead(List<FrameMetadata> members) {
        if (members.stream().anyMatch(frame -> frame.captureTime() != null)) {
            return sorted(members, BY_TIME).get(0);
        }
        return sorted(members, BY_SEQUENCE).get(0);
    }

    String outputFilename(String filename) {
        String base = filename == null ? "" : filename;
        int slash = Math.max(base.lastIndexOf('/'), base.lastIndexOf('\\'));
        if (slash >= 0) {
            base = base.substring(slash + 1);
        }
        int dot = base.lastIndexOf('.');
        String stem = dot > 0 ? base.substring(0, dot) : base;
        stem = stem.replaceAll("[^a-zA-Z0-9._-]", "_");
        if (stem.isEmpty()) {
            stem = "frame";
        }
        return stem + "." + properties.getOutputExtension().toLowerCase(Locale.ROOT);
    }

    private static List<FrameMetadata> sorted(List<FrameMetadata> frames, Comparator<FrameMetadata> order) {
        List<FrameMetadata> copy = new ArrayList<>(frames);
        copy.sort(order);
        return copy;
    }

    private static boolean differs(String a, String b) {
        return a != null && b != null && !a.trim().equalsIgnoreCase(b.trim());
    }
}
