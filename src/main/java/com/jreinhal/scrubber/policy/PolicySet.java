package com.jreinhal.scrubber.policy;

import com.jreinhal.scrubber.exception.PolicyConfigException;
import com.jreinhal.scrubber.model.PolicyAction;
import com.jreinhal.scrubber.model.SensitivityTier;
import java.util.EnumMap;
import java.util.Map;
import java.util.StringJoiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Snapshot of all tier manifests loaded together. An operation captures one snapshot at
 * start and uses it throughout, so a concurrent reload never changes its decisions.
 */
public final class PolicySet {
    private static final Logger log = LoggerFactory.getLogger(PolicySet.class);

    private final Map<SensitivityTier, PolicyManifest> manifests;
    private final Map<SensitivityTier, String> problems;
    private final String version;

    public PolicySet(Map<SensitivityTier, PolicyManifest> manifests, Map<SensitivityTier, String> problems) {
        this.manifests = manifests.isEmpty() ? new EnumMap<SensitivityTier, PolicyManifest>(SensitivityTier.class) : new EnumMap<SensitivityTier, PolicyManifest>(manifests);
        this.problems = problems.isEmpty() ? new EnumMap<SensitivityTier, String>(SensitivityTier.class) : new EnumMap<SensitivityTier, String>(problems);
        StringJoiner joiner = new StringJoiner(",");
        for (SensitivityTier tier : SensitivityTier.values()) {
            PolicyManifest manifest = this.manifests.get(tier);
            joiner.add(tier.name() + ":" + (manifest == null ? "missing" : manifest.version()));
        }
        this.version = joiner.toString();
    }

    public String version() {
        return this.version;
    }

    public boolean isUsable(SensitivityTier tier) {
        return this.manifests.containsKey(tier);
    }

    public Map<SensitivityTier, String> problems() {
        return Map.copyOf(this.problems);
    }

    /**
     * Fails when the caller's requested tier has no usable manifest.
     */
    public PolicyManifest require(SensitivityTier tier) {
        PolicyManifest manifest = this.manifests.get(tier);
        if (manifest == null) {
            String reason = this.problems.getOrDefault(tier, "not configured");
            throw new PolicyConfigException("Policy manifest for tier " + tier + " is unavailable: " + reason);
        }
        return manifest;
    }

    /**
     * Action at the entity's own tier. A missing manifest for that tier redacts.
     */
    public PolicyAction actionFor(String label, SensitivityTier entityTier) {
        PolicyManifest manifest = this.manifests.get(entityTier);
        if (manifest == null) {
            log.warn("No usable policy manifest for tier {}; redacting {}", entityTier, label);
            return PolicyAction.REDACT;
        }
        return manifest.actionFor(label);
    }
}
