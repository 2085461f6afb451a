package com.jreinhal.scrubber.policy;

import com.jreinhal.scrubber.model.PolicyAction;
import com.jreinhal.scrubber.model.SensitivityTier;
import java.util.Map;

/**
 * Parsed policy for one sensitivity tier. Immutable.
 *
 * @param defaultAction action for labels the manifest does not list, or {@code null} when none is configured
 */
public record PolicyManifest(SensitivityTier tier, String version, PolicyAction defaultAction, Map<String, LabelRule> labels) {

    public PolicyManifest {
        labels = labels == null ? Map.of() : Map.copyOf(labels);
    }

    /**
     * Disabled labels are allowed through; unconfigured labels take the default, and without
     * a default they are redacted.
     */
    public PolicyAction actionFor(String label) {
        LabelRule rule = labels.get(label);
        if (rule == null) {
            return defaultAction != null ? defaultAction : PolicyAction.REDACT;
        }
        if (!rule.enabled()) {
            return PolicyAction.ALLOW;
        }
        if (rule.action() != null) {
            return rule.action();
        }
        return defaultAction != null ? defaultAction : PolicyAction.REDACT;
    }

    public record LabelRule(boolean enabled, PolicyAction action) {
    }
}
