package com.jreinhal.scrubber.policy;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.jreinhal.scrubber.exception.PolicyConfigException;
import com.jreinhal.scrubber.model.PolicyAction;
import com.jreinhal.scrubber.model.SensitivityTier;
import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

/**
 * Reads one YAML policy manifest:
 * <pre>
 * version: "2025.1"
 * tier: C2
 * default-action: redact
 * labels:
 *   EMAIL: { enabled: true, action: mask }
 * </pre>
 */
@Component
public class ManifestLoader {
    private final ResourceLoader resourceLoader;
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    public ManifestLoader(ResourceLoader resourceLoader) {
        this.resourceLoader = resourceLoader;
    }

    public PolicyManifest load(SensitivityTier tier, String location) {
        if (location == null || location.isBlank()) {
            throw new PolicyConfigException("No manifest path configured for tier " + tier);
        }
        Resource resource = this.resourceLoader.getResource(location.trim());
        if (!resource.exists()) {
            throw new PolicyConfigException("Manifest for tier " + tier + " not found at " + location);
        }
        ManifestDocument document;
        try (InputStream in = resource.getInputStream()) {
            document = this.yamlMapper.readValue(in, ManifestDocument.class);
        } catch (IOException e) {
            throw new PolicyConfigException("Manifest for tier " + tier + " is malformed: " + e.getMessage(), e);
        }
        return toManifest(tier, document);
    }

    static PolicyManifest toManifest(SensitivityTier tier, ManifestDocument document) {
        if (document == null) {
            throw new PolicyConfigException("Manifest for tier " + tier + " is empty");
        }
        if (document.version == null || document.version.isBlank()) {
            throw new PolicyConfigException("Manifest for tier " + tier + " has no version");
        }
        if (document.tier != null && !document.tier.isBlank() && parseTier(document.tier) != tier) {
            throw new PolicyConfigException("Manifest declares tier " + document.tier + " but is configured for " + tier);
        }
        Map<String, PolicyManifest.LabelRule> labels = new LinkedHashMap<String, PolicyManifest.LabelRule>();
        if (document.labels != null) {
            for (Map.Entry<String, LabelDocument> entry : document.labels.entrySet()) {
                LabelDocument label = entry.getValue();
                boolean enabled = label == null || label.enabled == null || label.enabled;
                PolicyAction action = label == null ? null : parseAction(label.action, tier);
                labels.put(entry.getKey().trim().toUpperCase(Locale.ROOT), new PolicyManifest.LabelRule(enabled, action));
            }
        }
        return new PolicyManifest(tier, document.version.trim(), parseAction(document.defaultAction, tier), labels);
    }

    private static SensitivityTier parseTier(String value) {
        try {
            return SensitivityTier.parse(value);
        } catch (IllegalArgumentException e) {
            throw new PolicyConfigException(e.getMessage(), e);
        }
    }

    private static PolicyAction parseAction(String value, SensitivityTier tier) {
        try {
            return PolicyAction.parse(value);
        } catch (IllegalArgumentException e) {
            throw new PolicyConfigException("Manifest for tier " + tier + " has unknown action '" + value + "'", e);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ManifestDocument {
        @JsonProperty("version")
        public String version;
        @JsonProperty("tier")
        public String tier;
        @JsonProperty("default-action")
        public String defaultAction;
        @JsonProperty("labels")
        public Map<String, LabelDocument> labels;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class LabelDocument {
        @JsonProperty("enabled")
        public Boolean enabled;
        @JsonProperty("action")
        public String action;
    }
}
