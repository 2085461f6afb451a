package com.jreinhal.scrubber.detection;

import com.jreinhal.scrubber.model.CandidateEntity;
import com.jreinhal.scrubber.model.SensitivityTier;
import com.jreinhal.scrubber.model.Span;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regex shape check plus optional validity check. When {@code group > 0} only that capture
 * group is reported, so context words ("DOB:", "api_key=") stay visible.
 */
public final class PatternDetector implements EntityDetector {
    static final double DEMOTION_FACTOR = 0.5;

    private final String ruleId;
    private final String label;
    private final Pattern pattern;
    private final int group;
    private final ValidityCheck check;
    private final double confidence;
    private final SensitivityTier tier;
    private final InvalidMatchPolicy onInvalid;

    public PatternDetector(String ruleId, String label, Pattern pattern, int group, ValidityCheck check,
                           double confidence, SensitivityTier tier, InvalidMatchPolicy onInvalid) {
        this.ruleId = Objects.requireNonNull(ruleId, "ruleId");
        this.label = Objects.requireNonNull(label, "label");
        this.pattern = Objects.requireNonNull(pattern, "pattern");
        this.group = group;
        this.check = check == null ? ValidityCheck.NONE : check;
        this.tier = Objects.requireNonNull(tier, "tier");
        this.onInvalid = onInvalid == null ? InvalidMatchPolicy.DROP : onInvalid;
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence for " + ruleId + " must be between 0 and 1");
        }
        if (group < 0 || group > pattern.matcher("").groupCount()) {
            throw new IllegalArgumentException("Pattern for " + ruleId + " has no capture group " + group);
        }
        this.confidence = confidence;
    }

    @Override
    public String id() {
        return ruleId;
    }

    @Override
    public String label() {
        return label;
    }

    public SensitivityTier tier() {
        return tier;
    }

    public double confidence() {
        return confidence;
    }

    @Override
    public List<CandidateEntity> scan(String content) {
        if (content == null || content.isEmpty()) {
            return List.of();
        }
        List<CandidateEntity> hits = new ArrayList<>();
        Matcher matcher = pattern.matcher(content);
        while (matcher.find()) {
            int start = matcher.start(group);
            int end = matcher.end(group);
            if (start < 0 || end <= start) {
                continue;
            }
            String value = content.substring(start, end);
            boolean passed = check.test(value);
            if (!passed && onInvalid == InvalidMatchPolicy.DROP) {
                continue;
            }
            double score = passed ? confidence : confidence * DEMOTION_FACTOR;
            boolean validated = passed && check != ValidityCheck.NONE;
            hits.add(new CandidateEntity(label, new Span(start, end), score, ruleId, ruleId, tier, validated, null));
        }
        return hits;
    }

    /**
     * What to do with a shape match that fails its validity check.
     */
    public enum InvalidMatchPolicy {
        DROP,
        DEMOTE
    }
}
