package com.jreinhal.scrubber.detection;

import com.jreinhal.scrubber.model.CandidateEntity;
import com.jreinhal.scrubber.model.ContentUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable set of active detectors. Built once at startup by {@code ScrubberConfig}.
 */
public class DetectorRegistry {
    private static final Logger log = LoggerFactory.getLogger(DetectorRegistry.class);
    private static final Comparator<CandidateEntity> CANDIDATE_ORDER = Comparator
            .comparing(CandidateEntity::span)
            .thenComparing(CandidateEntity::ruleId);
    private final List<EntityDetector> detectors;

    public DetectorRegistry(List<? extends EntityDetector> detectors) {
        this.detectors = List.copyOf(detectors);
    }

    public static DetectorRegistry build(List<PatternDetector> manifestRules, Set<String> disabledLabels) {
        Set<String> disabled = disabledLabels == null ? Set.of() : disabledLabels.stream()
                .map(l -> l.trim().toUpperCase(Locale.ROOT))
                .collect(Collectors.toSet());
        List<EntityDetector> active = new ArrayList<>();
        for (PatternDetector detector : BuiltInDetectors.all()) {
            if (!disabled.contains(detector.label())) {
                active.add(detector);
            }
        }
        if (manifestRules != null) {
            for (PatternDetector rule : manifestRules) {
                if (!disabled.contains(rule.label())) {
                    active.add(rule);
                }
            }
        }
        log.info("Detector registry initialized with {} detectors (disabled labels: {})", active.size(), disabled);
        return new DetectorRegistry(active);
    }

    public List<EntityDetector> detectors() {
        return this.detectors;
    }

    /**
     * Runs every detector over one unit and returns candidates in span order, tagged with the unit's coordinate.
     */
    public List<CandidateEntity> detect(ContentUnit unit) {
        if (unit.text() == null || unit.text().isEmpty()) {
            return List.of();
        }
        List<CandidateEntity> candidates = new ArrayList<>();
        for (EntityDetector detector : this.detectors) {
            for (CandidateEntity candidate : detector.scan(unit.text())) {
                candidates.add(unit.isStructural() ? candidate.atCoordinate(unit.coordinate()) : candidate);
            }
        }
        candidates.sort(CANDIDATE_ORDER);
        return candidates;
    }
}
