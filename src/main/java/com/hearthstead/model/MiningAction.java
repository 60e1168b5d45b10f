package com.hearthstead.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

public enum MiningAction {
    CHOP_WOOD("chop_wood", Map.of(ResourceType.WOOD, 5.0, ResourceType.WINE, 1.0)),
    HARVEST_GRAPES("harvest_grapes", Map.of(ResourceType.WOOD, 1.0, ResourceType.WINE, 3.0)),
    QUARRY_ROCK("quarry_rock", Map.of(ResourceType.ROCK, 3.0)),
    FORAGE("forage", Map.of(ResourceType.FOOD, 3.0, ResourceType.WATER, 3.0)),
    DIG_SAND("dig_sand", Map.of(ResourceType.SAND, 3.0)),
    DIG_CLAY("dig_clay", Map.of(ResourceType.CLAY, 3.0));

    private final String id;
    private final Map<ResourceType, Double> baseYield;

    MiningAction(String id, Map<ResourceType, Double> baseYield) {
        this.id = id;
        Map<ResourceType, Double> copy = new EnumMap<>(ResourceType.class);
        copy.putAll(baseYield);
        this.baseYield = Collections.unmodifiableMap(copy);
    }

    public String getId() { return id; }
    public Map<ResourceType, Double> getBaseYield() { return baseYield; }

    public static Optional<MiningAction> fromId(String id) {
        if (id == null) return Optional.empty();
        String key = id.trim().toLowerCase();
        return Arrays.stream(values())
                .filter(a -> a.id.equals(key) || String.valueOf(a.ordinal() + 1).equals(key))
                .findFirst();
    }
}
