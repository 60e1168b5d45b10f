package com.hearthstead.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Resource amounts plus an optional research amount.
 * Whether research is a gate or gets consumed is up to the caller.
 */
public final class Cost {

    public static final Cost FREE = new Cost(new EnumMap<>(ResourceType.class), 0.0);

    private final Map<ResourceType, Double> resources;
    private final double research;

    private Cost(Map<ResourceType, Double> resources, double research) {
        EnumMap<ResourceType, Double> copy = new EnumMap<>(ResourceType.class);
        copy.putAll(resources);
        this.resources = Collections.unmodifiableMap(copy);
        this.research = research;
    }

    public static Cost of(Map<ResourceType, Double> resources) {
        return new Cost(resources, 0.0);
    }

    public static Cost of(Map<ResourceType, Double> resources, double research) {
        return new Cost(resources, research);
    }

    public Cost scaled(double factor) {
        Map<ResourceType, Double> scaled = new EnumMap<>(ResourceType.class);
        resources.forEach((r, amt) -> scaled.put(r, amt * factor));
        return new Cost(scaled, research * factor);
    }

    public Map<ResourceType, Double> getResources() { return resources; }
    public double getResearch() { return research; }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        resources.forEach((r, amt) -> {
            if (sb.length() > 0) sb.append(", ");
            sb.append(r.getId()).append(':').append(amt);
        });
        if (research > 0) {
            if (sb.length() > 0) sb.append(", ");
            sb.append("research:").append(research);
        }
        return sb.toString();
    }
}
