package com.jreinhal.scrubber.fusion;

import com.jreinhal.scrubber.model.CandidateEntity;
import com.jreinhal.scrubber.model.ExternalCandidate;
import com.jreinhal.scrubber.model.FusedEntity;
import com.jreinhal.scrubber.model.SensitivityTier;
import com.jreinhal.scrubber.model.Span;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves overlapping candidates of one content unit into non-overlapping entities.
 *
 * Candidates are grouped into clusters by interval merge. Inside a cluster the strongest
 * candidate wins (longest span, then label priority, then left-most start, then rule id);
 * remaining candidates that do not overlap a chosen winner are considered again, so two
 * disjoint detections bridged by a third are both kept.
 */
public class FusionEngine {
    private static final Logger log = LoggerFactory.getLogger(FusionEngine.class);

    private final FusionMode mode;
    private final Map<String, Integer> labelPriority;
    private final ExternalLabelMapper externalLabels;
    private final boolean allowExternalOnly;
    private final Comparator<CandidateEntity> winnerOrder;

    public FusionEngine(FusionMode mode, List<String> labelPriority, ExternalLabelMapper externalLabels, boolean allowExternalOnly) {
        this.mode = mode == null ? FusionMode.MAX : mode;
        this.labelPriority = new HashMap<String, Integer>();
        if (labelPriority != null) {
            for (int i = 0; i < labelPriority.size(); i++) {
                this.labelPriority.putIfAbsent(labelPriority.get(i).trim().toUpperCase(Locale.ROOT), i);
            }
        }
        this.externalLabels = externalLabels == null ? ExternalLabelMapper.withDefaults() : externalLabels;
        this.allowExternalOnly = allowExternalOnly;
        this.winnerOrder = Comparator
                .comparingInt((CandidateEntity c) -> c.span().length()).reversed()
                .thenComparingInt(c -> this.priorityOf(c.label()))
                .thenComparingInt(c -> c.span().start())
                .thenComparing(CandidateEntity::ruleId, Comparator.nullsLast(Comparator.naturalOrder()));
    }

    public FusionMode mode() {
        return this.mode;
    }

    /**
     * Fuses candidates of a single unit.
     *
     * @param contentLength length of the unit, used to discard out-of-range external spans
     * @param coordinate structural coordinate of the unit, or {@code null}
     * @param requestedTier clearance of the request; selects the external-only score thresholds
     */
    public List<FusedEntity> fuse(List<CandidateEntity> candidates, List<ExternalCandidate> external, int contentLength, String coordinate,
                                  SensitivityTier requestedTier) {
        List<CandidateEntity> sorted = new ArrayList<CandidateEntity>(candidates == null ? List.of() : candidates);
        sorted.sort(Comparator.comparing(CandidateEntity::span));
        List<ExternalCandidate> externals = new ArrayList<ExternalCandidate>();
        if (external != null) {
            for (ExternalCandidate candidate : external) {
                if (isUsableScore(candidate.score())) {
                    externals.add(candidate);
                } else {
                    log.warn("Discarding external candidate {} with score {} outside [0,1]", candidate.label(), candidate.score());
                }
            }
        }

        List<FusedEntity> fused = new ArrayList<FusedEntity>();
        for (List<CandidateEntity> cluster : cluster(sorted)) {
            for (CandidateEntity winner : selectWinners(cluster)) {
                fused.add(toFused(winner, cluster, externals, coordinate));
            }
        }
        if (this.allowExternalOnly && !externals.isEmpty()) {
            fused.addAll(externalOnly(sorted, externals, contentLength, coordinate, requestedTier));
        }
        fused.sort(Comparator.comparing(FusedEntity::span));
        return fused;
    }

    static List<List<CandidateEntity>> cluster(List<CandidateEntity> sortedByStart) {
        List<List<CandidateEntity>> clusters = new ArrayList<List<CandidateEntity>>();
        List<CandidateEntity> current = new ArrayList<CandidateEntity>();
        int currentEnd = -1;
        for (CandidateEntity candidate : sortedByStart) {
            if (!current.isEmpty() && candidate.span().start() >= currentEnd) {
                clusters.add(current);
                current = new ArrayList<CandidateEntity>();
            }
            current.add(candidate);
            currentEnd = Math.max(currentEnd, candidate.span().end());
        }
        if (!current.isEmpty()) {
            clusters.add(current);
        }
        return clusters;
    }

    List<CandidateEntity> selectWinners(List<CandidateEntity> cluster) {
        List<CandidateEntity> ordered = new ArrayList<CandidateEntity>(cluster);
        ordered.sort(this.winnerOrder);
        List<CandidateEntity> winners = new ArrayList<CandidateEntity>();
        for (CandidateEntity candidate : ordered) {
            boolean free = true;
            for (CandidateEntity winner : winners) {
                if (winner.span().overlaps(candidate.span())) {
                    free = false;
                    break;
                }
            }
            if (free) {
                winners.add(candidate);
            }
        }
        return winners;
    }

    private FusedEntity toFused(CandidateEntity winner, List<CandidateEntity> cluster, List<ExternalCandidate> externals, String coordinate) {
        Set<String> detectorIds = new LinkedHashSet<String>();
        detectorIds.add(winner.detectorId());
        for (CandidateEntity other : cluster) {
            if (other.span().overlaps(winner.span())) {
                detectorIds.add(other.detectorId());
            }
        }
        Optional<Double> best = bestExternalScore(winner.span(), externals);
        double confidence = best.map(score -> this.mode.combine(winner.confidence(), score)).orElse(winner.confidence());
        return new FusedEntity(winner.label(), winner.span(), confidence, winner.confidence(), best.orElse(null),
                winner.tier(), winner.ruleId(), new ArrayList<String>(detectorIds), winner.validated(),
                coordinate != null ? coordinate : winner.coordinate());
    }

    private static Optional<Double> bestExternalScore(Span span, List<ExternalCandidate> externals) {
        Double best = null;
        for (ExternalCandidate candidate : externals) {
            if (candidate.span().overlaps(span) && (best == null || candidate.score() > best)) {
                best = candidate.score();
            }
        }
        return Optional.ofNullable(best);
    }

    private List<FusedEntity> externalOnly(List<CandidateEntity> patternCandidates, List<ExternalCandidate> externals, int contentLength, String coordinate,
                                           SensitivityTier requestedTier) {
        List<ExternalCandidate> ordered = new ArrayList<ExternalCandidate>(externals);
        ordered.sort(Comparator.comparingDouble(ExternalCandidate::score).reversed()
                .thenComparing(ExternalCandidate::span));
        List<FusedEntity> kept = new ArrayList<FusedEntity>();
        for (ExternalCandidate candidate : ordered) {
            if (!candidate.span().fitsWithin(contentLength) || candidate.span().length() == 0) {
                log.warn("Discarding external span {} outside content of length {}", candidate.span(), contentLength);
                continue;
            }
            if (patternCandidates.stream().anyMatch(c -> c.span().overlaps(candidate.span()))) {
                continue;
            }
            if (kept.stream().anyMatch(k -> k.span().overlaps(candidate.span()))) {
                continue;
            }
            Optional<String> mapped = this.externalLabels.map(candidate.label());
            if (mapped.isEmpty() || candidate.score() < this.externalLabels.threshold(requestedTier, mapped.get())) {
                continue;
            }
            String label = mapped.get();
            double score = candidate.score();
            kept.add(new FusedEntity(label, candidate.span(), score, 0.0, score, this.externalLabels.tier(label),
                    "external:" + label, List.of("external"), false, coordinate));
        }
        return kept;
    }

    static boolean isUsableScore(double score) {
        return !Double.isNaN(score) && score >= 0.0 && score <= 1.0;
    }

    private int priorityOf(String label) {
        return this.labelPriority.getOrDefault(label, Integer.MAX_VALUE);
    }
}
