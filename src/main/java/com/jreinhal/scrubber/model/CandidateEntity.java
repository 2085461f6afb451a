package com.jreinhal.scrubber.model;

/**
 * A single detector's proposal for a sensitive occurrence.
 *
 * @param coordinate structural coordinate of the content unit, or {@code null} for flat text
 */
public record CandidateEntity(
        String label,
        Span span,
        double confidence,
        String detectorId,
        String ruleId,
        SensitivityTier tier,
        boolean validated,
        String coordinate
) {

    public CandidateEntity {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Candidate label is required");
        }
        if (span == null) {
            throw new IllegalArgumentException("Candidate span is required");
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0 and 1: " + confidence);
        }
    }

    public CandidateEntity atCoordinate(String newCoordinate) {
        return new CandidateEntity(label, span, confidence, detectorId, ruleId, tier, validated, newCoordinate);
    }
}
