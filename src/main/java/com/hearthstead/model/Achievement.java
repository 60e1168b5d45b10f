package com.hearthstead.model;

import java.util.Arrays;
import java.util.Optional;

public enum Achievement {
    FIRST_SETTLEMENT("first_settlement", "First Settlement", Effect.grant(ResourceType.BUILDER_MATERIALS, 10.0)),
    MASTER_CRAFTER("master_crafter", "Master Crafter", Effect.of(EffectKind.CRAFT_SPEED_FLOOR, 1.2)),
    ECOLOGICAL_BALANCE("ecological_balance", "Ecological Balance", Effect.of(EffectKind.BIOME_RESTORE, 20.0)),
    TECH_PIONEER("tech_pioneer", "Tech Pioneer", Effect.of(EffectKind.RESEARCH_BONUS_FLOOR, 1.5));

    private final String id;
    private final String displayName;
    private final Effect reward;

    Achievement(String id, String displayName, Effect reward) {
        this.id = id;
        this.displayName = displayName;
        this.reward = reward;
    }

    public String getId() { return id; }
    public String getDisplayName() { return displayName; }
    public Effect getReward() { return reward; }

    public static Optional<Achievement> fromId(String id) {
        if (id == null) return Optional.empty();
        return Arrays.stream(values()).filter(a -> a.id.equals(id)).findFirst();
    }
}
