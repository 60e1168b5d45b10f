package com.hearthstead.model;

import java.util.Arrays;
import java.util.Optional;

public enum Quest {
    PROTECT_SACRED_GROVE("protect_sacred_grove", "Protect the sacred grove",
            Condition.FOREST_HEALTH, null, 80.0, 25, Effect.grant(ResourceType.ANCIENT_TOOL, 1.0)),
    RESTORE_BIODIVERSITY("restore_biodiversity", "Restore biodiversity",
            Condition.BIODIVERSITY, null, 70.0, 15, Effect.grant(ResourceType.HERBS, 10.0)),
    FIND_RARE_ORES("find_rare_ores", "Find rare ores",
            Condition.STOCK, ResourceType.IRON, 20.0, 15, Effect.grant(ResourceType.INSTRUMENT, 2.0)),
    IMPROVE_TOOLS("improve_tools", "Improve tools",
            Condition.STOCK, ResourceType.INSTRUMENT, 10.0, 15, Effect.grant(ResourceType.STEEL, 5.0)),
    EXPLORE_RUINS("explore_ruins", "Explore the ancient ruins",
            Condition.DISCOVERED_SECRETS, null, 1.0, 15, Effect.grant(ResourceType.BUILDER_MATERIALS, 10.0)),
    RECOVER_LOST_KNOWLEDGE("recover_lost_knowledge", "Recover lost knowledge",
            Condition.RESEARCHED_TECHNOLOGIES, null, 2.0, 20, Effect.grant(ResourceType.WINE, 25.0));

    public enum Condition {
        FOREST_HEALTH,
        BIODIVERSITY,
        STOCK,
        DISCOVERED_SECRETS,
        RESEARCHED_TECHNOLOGIES
    }

    private final String id;
    private final String title;
    private final Condition condition;
    private final ResourceType conditionResource;
    private final double threshold;
    private final int relationshipReward;
    private final Effect reward;

    Quest(String id, String title, Condition condition, ResourceType conditionResource,
          double threshold, int relationshipReward, Effect reward) {
        this.id = id;
        this.title = title;
        this.condition = condition;
        this.conditionResource = conditionResource;
        this.threshold = threshold;
        this.relationshipReward = relationshipReward;
        this.reward = reward;
    }

    public String getId() { return id; }
    public String getTitle() { return title; }
    public Condition getCondition() { return condition; }
    public ResourceType getConditionResource() { return conditionResource; }
    public double getThreshold() { return threshold; }
    public int getRelationshipReward() { return relationshipReward; }
    public Effect getReward() { return reward; }

    public static Optional<Quest> fromId(String id) {
        if (id == null) return Optional.empty();
        return Arrays.stream(values()).filter(q -> q.id.equals(id)).findFirst();
    }
}
