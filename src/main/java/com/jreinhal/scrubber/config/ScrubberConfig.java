package com.jreinhal.scrubber.config;

import com.jreinhal.scrubber.detection.DetectorRegistry;
import com.jreinhal.scrubber.detection.RuleManifestLoader;
import com.jreinhal.scrubber.exception.EncryptionUnavailableException;
import com.jreinhal.scrubber.fusion.ExternalLabelMapper;
import com.jreinhal.scrubber.fusion.FusionEngine;
import com.jreinhal.scrubber.fusion.FusionMode;
import com.jreinhal.scrubber.model.SensitivityTier;
import com.jreinhal.scrubber.service.KeyMaterialLoader;
import com.jreinhal.scrubber.service.ScrubberSecrets;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

/**
 * Wires the detection, fusion and secret-holding components from {@code scrubber.*} properties.
 */
@Configuration
public class ScrubberConfig {
    private static final Logger log = LoggerFactory.getLogger(ScrubberConfig.class);

    @Bean
    public ScrubberSecrets scrubberSecrets(KeyMaterialLoader keyMaterialLoader,
                                           @Value("${scrubber.identifier.salt:}") String salt,
                                           @Value("${scrubber.receipts.encryption-key-source:}") String keySource) {
        byte[] saltBytes;
        if (salt == null || salt.isBlank()) {
            saltBytes = new byte[32];
            new SecureRandom().nextBytes(saltBytes);
            log.warn("=================================================================");
            log.warn("  IDENTIFIERS: Using randomly generated salt (DEV MODE)");
            log.warn("  Identifiers will NOT link across application restarts!");
            log.warn("  Set scrubber.identifier.salt for production use.");
            log.warn("=================================================================");
        } else {
            saltBytes = salt.getBytes(StandardCharsets.UTF_8);
        }
        try {
            byte[] key = keyMaterialLoader.loadAesKey(keySource);
            if (key == null) {
                log.warn("No receipt encryption key configured (scrubber.receipts.encryption-key-source); receipt-bearing scrubs will fail");
                return ScrubberSecrets.withoutKey(saltBytes, "no receipt key configured");
            }
            log.info("Receipt encryption key loaded");
            return ScrubberSecrets.of(saltBytes, key);
        } catch (EncryptionUnavailableException e) {
            log.error("Receipt encryption key unusable; receipt-bearing scrubs will fail: {}", e.getMessage());
            return ScrubberSecrets.withoutKey(saltBytes, e.getMessage());
        }
    }

    @Bean
    public DetectorRegistry detectorRegistry(RuleManifestLoader ruleManifestLoader,
                                             @Value("${scrubber.detection.rule-manifests:}") String ruleManifests,
                                             @Value("${scrubber.detection.disabled-labels:}") String disabledLabels) {
        return DetectorRegistry.build(ruleManifestLoader.load(splitList(ruleManifests)), new HashSet<String>(splitList(disabledLabels)));
    }

    @Bean
    public FusionEngine fusionEngine(Environment environment,
                                     @Value("${scrubber.fusion.mode:max}") String mode,
                                     @Value("${scrubber.fusion.label-priority:}") String labelPriority,
                                     @Value("${scrubber.fusion.allow-external-only:false}") boolean allowExternalOnly) {
        FusionMode fusionMode = FusionMode.parse(mode);
        ExternalLabelMapper mapper = new ExternalLabelMapper(clearanceThresholds(environment));
        log.info("Fusion mode {}, external-only entities {}", fusionMode, allowExternalOnly ? "allowed" : "ignored");
        return new FusionEngine(fusionMode, splitList(labelPriority), mapper, allowExternalOnly);
    }

    /**
     * Reads {@code scrubber.fusion.thresholds.<tier>.<label>}, keeping the built-in value for any key not set.
     */
    static Map<SensitivityTier, Map<String, Double>> clearanceThresholds(Environment environment) {
        Map<SensitivityTier, Map<String, Double>> thresholds = new EnumMap<SensitivityTier, Map<String, Double>>(SensitivityTier.class);
        for (Map.Entry<SensitivityTier, Map<String, Double>> tier : ExternalLabelMapper.defaultThresholds().entrySet()) {
            Map<String, Double> perLabel = new HashMap<String, Double>();
            for (Map.Entry<String, Double> label : tier.getValue().entrySet()) {
                String key = "scrubber.fusion.thresholds." + tier.getKey().name() + "." + label.getKey();
                perLabel.put(label.getKey(), environment.getProperty(key, Double.class, label.getValue()));
            }
            thresholds.put(tier.getKey(), perLabel);
        }
        return thresholds;
    }

    static List<String> splitList(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }
}
