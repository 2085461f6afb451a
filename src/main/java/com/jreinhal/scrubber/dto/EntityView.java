package com.jreinhal.scrubber.dto;

import com.jreinhal.scrubber.model.ScrubbedEntity;
import java.util.List;

/**
 * Explainability record returned to callers. Never carries the raw value.
 */
public record EntityView(
        String label,
        int start,
        int end,
        String coordinate,
        List<String> detectors,
        double confidence,
        Double externalScore,
        String ruleId,
        String tier,
        boolean validated,
        String identifier,
        String action
) {

    public static EntityView from(ScrubbedEntity entity) {
        return new EntityView(entity.label(), entity.span().start(), entity.span().end(), entity.coordinate(), entity.detectors(),
                entity.confidence(), entity.externalScore(), entity.ruleId(), entity.tier().name(), entity.validated(),
                entity.identifier(), entity.action().name());
    }
}
