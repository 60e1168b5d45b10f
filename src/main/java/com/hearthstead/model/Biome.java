package com.hearthstead.model;

import java.util.Arrays;
import java.util.Optional;

public enum Biome {
    FOREST("forest", 5.0),
    RIVERS("rivers", 0.0),
    SOIL("soil", 8.0),
    AIR("air", 2.0);

    private final String id;
    private final double initialHealth;

    Biome(String id, double initialHealth) {
        this.id = id;
        this.initialHealth = initialHealth;
    }

    public String getId() { return id; }
    public double getInitialHealth() { return initialHealth; }

    public static Optional<Biome> fromId(String id) {
        if (id == null) return Optional.empty();
        String key = id.trim().toLowerCase();
        return Arrays.stream(values()).filter(b -> b.id.equals(key)).findFirst();
    }
}
