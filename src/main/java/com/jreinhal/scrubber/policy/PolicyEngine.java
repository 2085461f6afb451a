package com.jreinhal.scrubber.policy;

import com.jreinhal.scrubber.exception.PolicyConfigException;
import com.jreinhal.scrubber.model.SensitivityTier;
import com.jreinhal.scrubber.util.LogSanitizer;
import jakarta.annotation.PostConstruct;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Holds the active {@link PolicySet}. Manifests are loaded at startup and on explicit
 * reload; a reload builds a complete new set and swaps it in one step.
 */
@Service
public class PolicyEngine {
    private static final Logger log = LoggerFactory.getLogger(PolicyEngine.class);

    private final ManifestLoader loader;
    private final Map<SensitivityTier, String> manifestPaths;
    private final AtomicReference<PolicySet> active = new AtomicReference<PolicySet>();

    public PolicyEngine(ManifestLoader loader,
                        @Value("${scrubber.policy.manifest-paths.C1:classpath:policy/c1.yml}") String c1,
                        @Value("${scrubber.policy.manifest-paths.C2:classpath:policy/c2.yml}") String c2,
                        @Value("${scrubber.policy.manifest-paths.C3:classpath:policy/c3.yml}") String c3,
                        @Value("${scrubber.policy.manifest-paths.C4:classpath:policy/c4.yml}") String c4) {
        this.loader = loader;
        this.manifestPaths = new EnumMap<SensitivityTier, String>(SensitivityTier.class);
        this.manifestPaths.put(SensitivityTier.C1, c1);
        this.manifestPaths.put(SensitivityTier.C2, c2);
        this.manifestPaths.put(SensitivityTier.C3, c3);
        this.manifestPaths.put(SensitivityTier.C4, c4);
    }

    @PostConstruct
    public void init() {
        reload();
    }

    public PolicySet reload() {
        Map<SensitivityTier, PolicyManifest> manifests = new EnumMap<SensitivityTier, PolicyManifest>(SensitivityTier.class);
        Map<SensitivityTier, String> problems = new EnumMap<SensitivityTier, String>(SensitivityTier.class);
        for (SensitivityTier tier : SensitivityTier.values()) {
            try {
                manifests.put(tier, this.loader.load(tier, this.manifestPaths.get(tier)));
            } catch (PolicyConfigException e) {
                problems.put(tier, e.getMessage());
                log.warn("Policy manifest for tier {} unusable, entities at this tier will be redacted: {}",
                        tier, LogSanitizer.sanitize(e.getMessage()));
            }
        }
        PolicySet set = new PolicySet(manifests, problems);
        this.active.set(set);
        log.info("Policy manifests active: {}", set.version());
        return set;
    }

    public PolicySet snapshot() {
        PolicySet set = this.active.get();
        if (set == null) {
            return reload();
        }
        return set;
    }
}
