package com.hearthstead.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Actions characters have an opinion about, with their signed base impact.
 */
public enum PlayerAction {
    DEFORESTATION("deforestation", -25),
    BUILD_SAWMILL("build_sawmill", -10),
    BUILD_HERBALIST("build_herbalist", 15),
    RESEARCH_ECOLOGY("research_ecology", 20),
    POLLUTE_RIVER("pollute_river", -30),
    CLEANUP_POLLUTION("cleanup_pollution", 25),
    BUILD_FORGE("build_forge", 10);

    private final String id;
    private final int impact;

    PlayerAction(String id, int impact) {
        this.id = id;
        this.impact = impact;
    }

    public String getId() { return id; }
    public int getImpact() { return impact; }

    public boolean isDeforestation() { return id.contains("deforest"); }
    public boolean isForgeBuilding() { return id.contains("build_forge"); }

    public static Optional<PlayerAction> fromId(String id) {
        if (id == null) return Optional.empty();
        return Arrays.stream(values()).filter(a -> a.id.equals(id)).findFirst();
    }
}
