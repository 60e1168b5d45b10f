package com.hearthstead.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Every fungible stock the settlement can hold.
 * WINE doubles as the currency: it is never capped by storage and pays for market trades.
 */
public enum ResourceType {
    WOOD("wood", 1.0),
    WINE("wine", 2.0),
    ROCK("rock", 1.5),
    FOOD("food", 1.0),
    WATER("water", 0.5),
    SAND("sand", 0.8),
    CLAY("clay", 0.9),
    IRON("iron", 3.5),
    COPPER("copper", 3.0),
    TIN("tin", 3.0),
    NICKEL("nickel", 3.5),
    LEAD("lead", 2.5),
    SALT("salt", 0.7),
    SULFUR("sulfur", 1.4),
    COAL("coal", 3.0),
    STEEL("steel", 8.0),
    BRONZE("bronze", 6.0),
    SULFURIC_ACID("sulfuric_acid", 5.0),
    CHLORINE("chlorine", 4.0),
    BUILDER_MATERIALS("builder_materials", 1.0),
    INSTRUMENT("instrument", 12.0),
    ANCIENT_TOOL("ancient_tool", 40.0),
    HERBS("herbs", 2.5);

    public static final ResourceType CURRENCY = WINE;

    private final String id;
    private final double basePrice;

    ResourceType(String id, double basePrice) {
        this.id = id;
        this.basePrice = basePrice;
    }

    public String getId() { return id; }
    public double getBasePrice() { return basePrice; }

    public boolean isCurrency() { return this == CURRENCY; }

    public static Optional<ResourceType> fromId(String id) {
        if (id == null) return Optional.empty();
        String key = id.trim().toLowerCase();
        return Arrays.stream(values()).filter(r -> r.id.equals(key)).findFirst();
    }
}
