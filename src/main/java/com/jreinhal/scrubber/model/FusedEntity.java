package com.jreinhal.scrubber.model;

import java.util.List;

/**
 * Winning entity of one overlap cluster after fusion.
 *
 * @param externalScore best overlapping external score, {@code null} when the external model contributed nothing
 */
public record FusedEntity(
        String label,
        Span span,
        double confidence,
        double ruleConfidence,
        Double externalScore,
        SensitivityTier tier,
        String ruleId,
        List<String> detectorIds,
        boolean validated,
        String coordinate
) {

    public FusedEntity {
        detectorIds = detectorIds == null ? List.of() : List.copyOf(detectorIds);
    }
}
