package com.hearthstead.model;

public enum RelationshipTier {
    ADORES(80, "I trust you with our secrets."),
    RESPECTS(60, "I respect the way you work."),
    FRIENDLY(40, "You are trying, and it shows."),
    NEUTRAL(20, "Time will tell."),
    WARY(0, "Let us see what you do."),
    DISPLEASED(-20, "We have nothing to talk about."),
    HOSTILE(-40, "Go away."),
    HATES(Integer.MIN_VALUE, "Go away.");

    private final int threshold;
    private final String greeting;

    RelationshipTier(int threshold, String greeting) {
        this.threshold = threshold;
        this.greeting = greeting;
    }

    public int getThreshold() { return threshold; }
    public String getGreeting() { return greeting; }

    public static RelationshipTier forScore(int score) {
        for (RelationshipTier tier : values()) {
            if (score >= tier.threshold) return tier;
        }
        return HATES;
    }
}
