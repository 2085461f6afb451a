package com.jreinhal.scrubber.detection;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.jreinhal.scrubber.detection.PatternDetector.InvalidMatchPolicy;
import com.jreinhal.scrubber.model.SensitivityTier;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

/**
 * Compiles extra detectors from YAML rule manifests. A malformed rule is skipped with a
 * warning; the remaining rules still load.
 */
@Component
public class RuleManifestLoader {
    private static final Logger log = LoggerFactory.getLogger(RuleManifestLoader.class);
    private static final double DEFAULT_CONFIDENCE = 0.8;
    private final ResourceLoader resourceLoader;
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    public RuleManifestLoader(ResourceLoader resourceLoader) {
        this.resourceLoader = resourceLoader;
    }

    public List<PatternDetector> load(List<String> locations) {
        List<PatternDetector> detectors = new ArrayList<>();
        if (locations == null) {
            return detectors;
        }
        for (String location : locations) {
            if (location == null || location.isBlank()) {
                continue;
            }
            Resource resource = this.resourceLoader.getResource(location.trim());
            if (!resource.exists()) {
                log.warn("Rule manifest not found: {}", location);
                continue;
            }
            List<DetectionRule> rules;
            try (InputStream in = resource.getInputStream()) {
                rules = this.yamlMapper.readValue(in, new TypeReference<List<DetectionRule>>() {});
            } catch (IOException e) {
                log.warn("Rule manifest {} is unreadable and was skipped: {}", location, e.getMessage());
                continue;
            }
            if (rules == null) {
                continue;
            }
            for (DetectionRule rule : rules) {
                try {
                    detectors.add(compile(rule));
                } catch (IllegalArgumentException e) {
                    log.warn("Skipping rule '{}' from {}: {}", rule.id(), location, e.getMessage());
                }
            }
        }
        log.info("Loaded {} detection rules from {} manifest(s)", detectors.size(), locations.size());
        return detectors;
    }

    static PatternDetector compile(DetectionRule rule) {
        if (rule.label() == null || rule.label().isBlank() || rule.pattern() == null || rule.pattern().isBlank()) {
            throw new IllegalArgumentException("label and pattern are required");
        }
        String label = rule.label().trim().toUpperCase(Locale.ROOT);
        Pattern pattern;
        try {
            pattern = Pattern.compile(rule.pattern());
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("invalid pattern: " + e.getDescription(), e);
        }
        String ruleId = rule.id() == null || rule.id().isBlank() ? label + "_rule" : rule.id().trim();
        double confidence = rule.confidence() == null ? DEFAULT_CONFIDENCE : rule.confidence();
        SensitivityTier tier = rule.tier() == null ? SensitivityTier.C4 : SensitivityTier.parse(rule.tier());
        int group = rule.group() == null ? 0 : rule.group();
        InvalidMatchPolicy onInvalid = rule.onInvalid() == null
                ? InvalidMatchPolicy.DROP
                : InvalidMatchPolicy.valueOf(rule.onInvalid().trim().toUpperCase(Locale.ROOT));
        return new PatternDetector(ruleId, label, pattern, group, ValidityCheck.fromManifestName(rule.validator()),
                confidence, tier, onInvalid);
    }
}
