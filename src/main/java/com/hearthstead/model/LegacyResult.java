package com.hearthstead.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

public class LegacyResult {
    private final VictoryType category;
    private final String title;
    private final double score;
    private final Map<VictoryType, Double> scores;

    public LegacyResult(VictoryType category, String title, double score, Map<VictoryType, Double> scores) {
        this.category = category;
        this.title = title;
        this.score = score;
        this.scores = Collections.unmodifiableMap(new EnumMap<>(scores));
    }

    public VictoryType getCategory() { return category; }
    public String getTitle() { return title; }
    public double getScore() { return score; }
    public Map<VictoryType, Double> getScores() { return scores; }
}
