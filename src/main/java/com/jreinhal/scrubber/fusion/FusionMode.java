package com.jreinhal.scrubber.fusion;

import java.util.Locale;

/**
 * How a rule confidence and an overlapping external score are combined.
 * Accepted forms: {@code max}, {@code avg}, {@code weighted:w} where w weights the rule side.
 */
public final class FusionMode {
    static final double FALLBACK_WEIGHT = 0.7;

    public static final FusionMode MAX = new FusionMode(Kind.MAX, 1.0);
    public static final FusionMode AVG = new FusionMode(Kind.AVG, 0.5);

    private final Kind kind;
    private final double ruleWeight;

    private FusionMode(Kind kind, double ruleWeight) {
        this.kind = kind;
        this.ruleWeight = ruleWeight;
    }

    public static FusionMode weighted(double ruleWeight) {
        return new FusionMode(Kind.WEIGHTED, clamp(ruleWeight));
    }

    /**
     * Unknown or blank modes fall back to {@code max}; an unparseable weight falls back to 0.7.
     */
    public static FusionMode parse(String value) {
        if (value == null || value.isBlank()) {
            return MAX;
        }
        String mode = value.trim().toLowerCase(Locale.ROOT);
        if (mode.equals("avg")) {
            return AVG;
        }
        if (mode.startsWith("weighted:")) {
            String raw = mode.substring("weighted:".length()).trim();
            double weight;
            try {
                weight = Double.parseDouble(raw);
            } catch (NumberFormatException e) {
                weight = FALLBACK_WEIGHT;
            }
            if (Double.isNaN(weight)) {
                weight = FALLBACK_WEIGHT;
            }
            return weighted(weight);
        }
        return MAX;
    }

    public double combine(double ruleConfidence, double externalScore) {
        switch (this.kind) {
            case AVG:
                return (ruleConfidence + externalScore) / 2.0;
            case WEIGHTED:
                return this.ruleWeight * ruleConfidence + (1.0 - this.ruleWeight) * externalScore;
            case MAX:
            default:
                return Math.max(ruleConfidence, externalScore);
        }
    }

    public Kind kind() {
        return this.kind;
    }

    public double ruleWeight() {
        return this.ruleWeight;
    }

    private static double clamp(double weight) {
        if (weight < 0.0) {
            return 0.0;
        }
        return Math.min(weight, 1.0);
    }

    @Override
    public String toString() {
        return this.kind == Kind.WEIGHTED ? "weighted:" + this.ruleWeight : this.kind.name().toLowerCase(Locale.ROOT);
    }

    public enum Kind {
        MAX,
        AVG,
        WEIGHTED
    }
}
