package com.jreinhal.scrubber.detection;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One rule as written in a YAML rule manifest:
 * <pre>
 * - id: VAT_be
 *   label: VAT_NUMBER
 *   pattern: 'BE0\d{9}'
 *   validator: none
 *   confidence: 0.85
 *   tier: C3
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DetectionRule(
        @JsonProperty("id") String id,
        @JsonProperty("label") String label,
        @JsonProperty("pattern") String pattern,
        @JsonProperty("validator") String validator,
        @JsonProperty("confidence") Double confidence,
        @JsonProperty("tier") String tier,
        @JsonProperty("group") Integer group,
        @JsonProperty("on-invalid") String onInvalid
) {
}
