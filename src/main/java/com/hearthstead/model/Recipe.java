package com.hearthstead.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Crafting conversion. A research input is consumed from the research counter.
 */
public enum Recipe {
    COAL("coal", "Coal",
            Cost.of(Map.of(ResourceType.WOOD, 1.0)),
            Map.of(ResourceType.COAL, 1.0), null, null),
    STEEL("steel", "Steel",
            Cost.of(Map.of(ResourceType.COAL, 1.0, ResourceType.IRON, 1.0)),
            Map.of(ResourceType.STEEL, 1.5), null, null),
    BRONZE("bronze", "Bronze",
            Cost.of(Map.of(ResourceType.COPPER, 7.0, ResourceType.TIN, 3.0, ResourceType.FOOD, 1.0)),
            Map.of(ResourceType.BRONZE, 10.0), null, null),
    SULFURIC_ACID("acid", "Sulfuric Acid",
            Cost.of(Map.of(ResourceType.SULFUR, 1.0, ResourceType.WATER, 1.0)),
            Map.of(ResourceType.SULFURIC_ACID, 0.5), null, null),
    CHLORINE("chlorine", "Chlorine",
            Cost.of(Map.of(ResourceType.SALT, 1.0)),
            Map.of(ResourceType.CHLORINE, 1.0), null, null),
    INSTRUMENTS("instr", "Instruments",
            Cost.of(Map.of(ResourceType.BRONZE, 1.0, ResourceType.WOOD, 1.0)),
            Map.of(ResourceType.INSTRUMENT, 1.0), null, null),
    ANCIENT_TOOL("ancient_tool", "Ancient Tool",
            Cost.of(Map.of(ResourceType.INSTRUMENT, 2.0, ResourceType.STEEL, 1.0), 20.0),
            Map.of(ResourceType.ANCIENT_TOOL, 1.0), null, LoreSecret.FORGE_OF_SOULS);

    private final String id;
    private final String displayName;
    private final Cost inputs;
    private final Map<ResourceType, Double> outputs;
    private final TechnologyId requiredTechnology;
    private final LoreSecret requiredSecret;

    Recipe(String id, String displayName, Cost inputs, Map<ResourceType, Double> outputs,
           TechnologyId requiredTechnology, LoreSecret requiredSecret) {
        this.id = id;
        this.displayName = displayName;
        this.inputs = inputs;
        Map<ResourceType, Double> copy = new EnumMap<>(ResourceType.class);
        copy.putAll(outputs);
        this.outputs = Collections.unmodifiableMap(copy);
        this.requiredTechnology = requiredTechnology;
        this.requiredSecret = requiredSecret;
    }

    public String getId() { return id; }
    public String getDisplayName() { return displayName; }
    public Cost getInputs() { return inputs; }
    public Map<ResourceType, Double> getOutputs() { return outputs; }
    public TechnologyId getRequiredTechnology() { return requiredTechnology; }
    public LoreSecret getRequiredSecret() { return requiredSecret; }

    public static Optional<Recipe> fromId(String id) {
        if (id == null) return Optional.empty();
        String key = id.trim().toLowerCase();
        return Arrays.stream(values()).filter(r -> r.id.equals(key)).findFirst();
    }
}
