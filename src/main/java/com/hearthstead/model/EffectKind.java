package com.hearthstead.model;

/**
 * Closed set of effects that technologies, secrets and achievements can apply.
 * FLOOR kinds raise a multiplier to at least their value and never stack.
 * COMPOUND kinds multiply the current value every time they are applied.
 */
public enum EffectKind {
    FOOD_PRODUCTION_FLOOR,
    MINING_EFFICIENCY_FLOOR,
    CRAFT_SPEED_FLOOR,
    RESEARCH_BONUS_FLOOR,
    POLLUTION_FLOOR,
    CRAFT_SPEED_COMPOUND,
    MARKET_TREND_COMPOUND,
    HAPPINESS_BONUS,
    RESOURCE_GRANT,
    BIOME_RESTORE
}
