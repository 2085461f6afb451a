package com.jreinhal.scrubber.fusion;

import com.jreinhal.scrubber.model.SensitivityTier;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Maps raw labels from the recognition model onto the service's labels, with the minimum
 * score an external-only entity needs to be kept.
 */
public class ExternalLabelMapper {
    private static final Map<String, String> LABELS = Map.of(
            "PERSON", "NAME",
            "PER", "NAME",
            "ORG", "ORG_NAME",
            "ORGANIZATION", "ORG_NAME",
            "LOC", "ADDRESS",
            "LOCATION", "ADDRESS",
            "GPE", "ADDRESS");
    private static final Map<String, SensitivityTier> TIERS = Map.of(
            "NAME", SensitivityTier.C3,
            "ADDRESS", SensitivityTier.C3,
            "ORG_NAME", SensitivityTier.C2);
    static final double DEFAULT_THRESHOLD = 0.80;
    static final SensitivityTier DEFAULT_TIER = SensitivityTier.C3;
    private static final Map<SensitivityTier, Map<String, Double>> DEFAULT_THRESHOLDS = Map.of(
            SensitivityTier.C1, Map.of("NAME", 0.85, "ADDRESS", 0.90, "ORG_NAME", 0.90),
            SensitivityTier.C2, Map.of("NAME", 0.80, "ADDRESS", 0.85, "ORG_NAME", 0.85),
            SensitivityTier.C3, Map.of("NAME", 0.75, "ADDRESS", 0.80, "ORG_NAME", 0.80),
            SensitivityTier.C4, Map.of("NAME", 0.70, "ADDRESS", 0.75, "ORG_NAME", 0.75));

    private final Map<SensitivityTier, Map<String, Double>> thresholds;

    /**
     * @param thresholds minimum external-only score per requested tier and mapped label;
     *                   tiers or labels left out fall back to the built-in defaults
     */
    public ExternalLabelMapper(Map<SensitivityTier, Map<String, Double>> thresholds) {
        EnumMap<SensitivityTier, Map<String, Double>> merged = new EnumMap<SensitivityTier, Map<String, Double>>(SensitivityTier.class);
        for (SensitivityTier tier : SensitivityTier.values()) {
            Map<String, Double> perLabel = new HashMap<String, Double>(DEFAULT_THRESHOLDS.get(tier));
            if (thresholds != null && thresholds.get(tier) != null) {
                perLabel.putAll(thresholds.get(tier));
            }
            merged.put(tier, Map.copyOf(perLabel));
        }
        this.thresholds = Collections.unmodifiableMap(merged);
    }

    public static ExternalLabelMapper withDefaults() {
        return new ExternalLabelMapper(Map.of());
    }

    public static Map<SensitivityTier, Map<String, Double>> defaultThresholds() {
        return DEFAULT_THRESHOLDS;
    }

    /**
     * Strips BIO prefixes ({@code B-PER}, {@code I-LOC}) before lookup.
     */
    public Optional<String> map(String rawLabel) {
        if (rawLabel == null || rawLabel.isBlank()) {
            return Optional.empty();
        }
        String label = rawLabel.trim().toUpperCase(Locale.ROOT);
        int dash = label.indexOf('-');
        if (dash >= 0) {
            label = label.substring(dash + 1);
        }
        return Optional.ofNullable(LABELS.get(label));
    }

    /**
     * Higher clearance lowers the bar: a request at C4 keeps weaker external detections than one at C1.
     * A {@code null} tier reads the C3 thresholds.
     */
    public double threshold(SensitivityTier requestedTier, String mappedLabel) {
        SensitivityTier tier = requestedTier == null ? DEFAULT_TIER : requestedTier;
        return this.thresholds.get(tier).getOrDefault(mappedLabel, DEFAULT_THRESHOLD);
    }

    public SensitivityTier tier(String mappedLabel) {
        return TIERS.getOrDefault(mappedLabel, SensitivityTier.C3);
    }
}
