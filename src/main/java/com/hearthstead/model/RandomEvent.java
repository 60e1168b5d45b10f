package com.hearthstead.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

public enum RandomEvent {
    HEAVY_RAINS("Heavy rains, the harvest improves", Map.of(ResourceType.FOOD, 8.0), 0.0),
    STORM("A storm damaged the buildings", Map.of(ResourceType.WOOD, -5.0, ResourceType.ROCK, -4.0), 0.0),
    CARAVAN("A caravan brings a profitable deal", Map.of(ResourceType.WINE, 14.0), 0.0),
    FOREST_FIRE("Forest fire", Map.of(ResourceType.WOOD, -10.0, ResourceType.FOOD, -4.0), 5.0),
    NEW_DEPOSIT("A new deposit was found", Map.of(ResourceType.IRON, 6.0, ResourceType.COAL, 4.0), 0.0);

    private final String text;
    private final Map<ResourceType, Double> deltas;
    private final double forestDamage;

    RandomEvent(String text, Map<ResourceType, Double> deltas, double forestDamage) {
        this.text = text;
        Map<ResourceType, Double> copy = new EnumMap<>(ResourceType.class);
        copy.putAll(deltas);
        this.deltas = Collections.unmodifiableMap(copy);
        this.forestDamage = forestDamage;
    }

    public String getText() { return text; }
    public Map<ResourceType, Double> getDeltas() { return deltas; }
    public double getForestDamage() { return forestDamage; }
}
