package com.hearthstead.model;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;

/**
 * Secrets of the ancestors. Same one-shot cost/effect pattern as technologies, no prerequisites.
 */
public enum LoreSecret {
    SEED_OF_PROSPERITY("seed_of_prosperity", "Seed of Prosperity",
            "Ancient technique for richer harvests",
            Cost.of(Map.of(ResourceType.FOOD, 50.0), 10.0),
            Effect.of(EffectKind.FOOD_PRODUCTION_FLOOR, 2.0)),
    MEMORY_CRYSTAL("memory_crystal", "Memory Crystal",
            "Reveals the past of the land and its hidden deposits",
            Cost.of(Map.of(ResourceType.ROCK, 30.0, ResourceType.WATER, 20.0)),
            Effect.of(EffectKind.MARKET_TREND_COMPOUND, 0.98)),
    FORGE_OF_SOULS("forge_of_souls", "Forge of Souls",
            "Legendary craft of artifact making",
            Cost.of(Map.of(ResourceType.STEEL, 10.0, ResourceType.COAL, 20.0), 30.0),
            Effect.of(EffectKind.CRAFT_SPEED_COMPOUND, 1.1));

    private final String id;
    private final String displayName;
    private final String description;
    private final Cost cost;
    private final Effect effect;

    LoreSecret(String id, String displayName, String description, Cost cost, Effect effect) {
        this.id = id;
        this.displayName = displayName;
        this.description = description;
        this.cost = cost;
        this.effect = effect;
    }

    public String getId() { return id; }
    public String getDisplayName() { return displayName; }
    public String getDescription() { return description; }
    public Cost getCost() { return cost; }
    public Effect getEffect() { return effect; }

    public static Optional<LoreSecret> fromId(String id) {
        if (id == null) return Optional.empty();
        String key = id.trim().toLowerCase();
        return Arrays.stream(values())
                .filter(s -> s.id.equals(key) || s.displayName.equalsIgnoreCase(key))
                .findFirst();
    }
}
