package com.jreinhal.scrubber.model;

import java.util.List;

/**
 * Explainability record for one fused entity and what was done to it.
 * Spans always refer to offsets in the original content.
 */
public record ScrubbedEntity(
        String label,
        Span span,
        String coordinate,
        List<String> detectors,
        double confidence,
        Double externalScore,
        String ruleId,
        SensitivityTier tier,
        boolean validated,
        String identifier,
        PolicyAction action
) {

    public ScrubbedEntity {
        detectors = detectors == null ? List.of() : List.copyOf(detectors);
    }

    public static ScrubbedEntity of(FusedEntity entity, String identifier, PolicyAction action) {
        return new ScrubbedEntity(entity.label(), entity.span(), entity.coordinate(), entity.detectorIds(),
                entity.confidence(), entity.externalScore(), entity.ruleId(), entity.tier(), entity.validated(),
                identifier, action);
    }
}
