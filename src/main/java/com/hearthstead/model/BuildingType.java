package com.hearthstead.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Producer buildings. Ids are the short codes stored in save files.
 * Storehouses are not listed here: they raise capacity and produce nothing.
 */
public enum BuildingType {
    LUMBER_MILL("les", "Lumber Mill",
            Map.of(ResourceType.WOOD, 2.0),
            Map.of(ResourceType.WOOD, 15.0, ResourceType.ROCK, 5.0),
            Map.of(Biome.FOREST, -0.6, Biome.AIR, -0.15)),
    HERBALIST_HUT("sob", "Herbalist Hut",
            Map.of(ResourceType.WINE, 1.0, ResourceType.HERBS, 0.5),
            Map.of(ResourceType.WOOD, 10.0, ResourceType.ROCK, 3.0, ResourceType.HERBS, 2.0),
            Map.of()),
    QUARRY("kam", "Quarry",
            Map.of(ResourceType.ROCK, 2.0),
            Map.of(ResourceType.WOOD, 8.0, ResourceType.ROCK, 10.0),
            Map.of(Biome.SOIL, -0.4, Biome.AIR, -0.25)),
    WHEAT_FIELD("pol", "Wheat Field",
            Map.of(ResourceType.FOOD, 3.0),
            Map.of(ResourceType.WOOD, 5.0, ResourceType.WATER, 10.0),
            Map.of()),
    SAND_PIT("pes", "Sand Pit",
            Map.of(ResourceType.SAND, 2.0),
            Map.of(ResourceType.WOOD, 12.0, ResourceType.ROCK, 8.0),
            Map.of(Biome.SOIL, -0.55, Biome.RIVERS, -0.35)),
    CLAY_PIT("gli", "Clay Pit",
            Map.of(ResourceType.CLAY, 2.0),
            Map.of(ResourceType.WOOD, 10.0, ResourceType.ROCK, 6.0),
            Map.of(Biome.SOIL, -0.35));

    private final String id;
    private final String displayName;
    private final Map<ResourceType, Double> outputPerUnit;
    private final Map<ResourceType, Double> baseCost;
    private final Map<Biome, Double> biomeImpact;

    BuildingType(String id, String displayName, Map<ResourceType, Double> outputPerUnit,
                 Map<ResourceType, Double> baseCost, Map<Biome, Double> biomeImpact) {
        this.id = id;
        this.displayName = displayName;
        this.outputPerUnit = Collections.unmodifiableMap(copy(outputPerUnit, ResourceType.class));
        this.baseCost = Collections.unmodifiableMap(copy(baseCost, ResourceType.class));
        this.biomeImpact = Collections.unmodifiableMap(copy(biomeImpact, Biome.class));
    }

    private static <K extends Enum<K>> Map<K, Double> copy(Map<K, Double> source, Class<K> type) {
        Map<K, Double> map = new EnumMap<>(type);
        map.putAll(source);
        return map;
    }

    public String getId() { return id; }
    public String getDisplayName() { return displayName; }
    public Map<ResourceType, Double> getOutputPerUnit() { return outputPerUnit; }
    public Map<ResourceType, Double> getBaseCost() { return baseCost; }
    public Map<Biome, Double> getBiomeImpact() { return biomeImpact; }

    public static Optional<BuildingType> fromId(String id) {
        if (id == null) return Optional.empty();
        String key = id.trim().toLowerCase();
        return Arrays.stream(values())
                .filter(b -> b.id.equals(key) || b.name().equalsIgnoreCase(key))
                .findFirst();
    }
}
