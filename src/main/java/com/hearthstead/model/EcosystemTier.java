package com.hearthstead.model;

/**
 * Ordinal bucket of the overall ecosystem health, each with its production multiplier.
 */
public enum EcosystemTier {
    HEALTHY(80.0, 1.2),
    STABLE(60.0, 1.0),
    DEGRADED(40.0, 0.8),
    CRITICAL(Double.NEGATIVE_INFINITY, 0.6);

    private final double threshold;
    private final double productionModifier;

    EcosystemTier(double threshold, double productionModifier) {
        this.threshold = threshold;
        this.productionModifier = productionModifier;
    }

    public double getProductionModifier() { return productionModifier; }

    public static EcosystemTier forHealth(double health) {
        for (EcosystemTier tier : values()) {
            if (health >= tier.threshold) return tier;
        }
        return CRITICAL;
    }
}
