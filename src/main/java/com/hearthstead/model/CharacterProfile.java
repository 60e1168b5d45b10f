package com.hearthstead.model;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Static definition of each non-player character the settlement starts with.
 */
public enum CharacterProfile {
    FOREST_ELDER("forest_elder", "Forest Elder",
            "Ancient keeper of the woods, sensitive to the state of nature",
            Map.of("wisdom", 8, "ecology", 9, "diplomacy", 7), 50,
            Set.of("environmentalist", "wise", "patient"),
            List.of(Quest.PROTECT_SACRED_GROVE, Quest.RESTORE_BIODIVERSITY),
            List.of(new TradeOffer(ResourceType.WOOD, 0.85), new TradeOffer(ResourceType.HERBS, 1.25))),
    MINE_MASTER("mine_master", "Mine Master",
            "Miner and geologist who values technology",
            Map.of("mining", 9, "crafting", 7, "strength", 8), 30,
            Set.of("pragmatic", "blacksmith", "progressive"),
            List.of(Quest.FIND_RARE_ORES, Quest.IMPROVE_TOOLS),
            List.of(new TradeOffer(ResourceType.ROCK, 0.75), new TradeOffer(ResourceType.INSTRUMENT, 1.45))),
    LORE_KEEPER("lore_keeper", "Lore Keeper",
            "Guardian of the secrets of ancient civilisations",
            Map.of("knowledge", 10, "research", 8, "medicine", 6), 40,
            Set.of("scholar", "curious", "traditionalist"),
            List.of(Quest.EXPLORE_RUINS, Quest.RECOVER_LOST_KNOWLEDGE),
            List.of(new TradeOffer(ResourceType.FOOD, 1.1), new TradeOffer(ResourceType.ANCIENT_TOOL, 3.2)));

    private final String id;
    private final String displayName;
    private final String description;
    private final Map<String, Integer> skills;
    private final int initialRelationship;
    private final Set<String> traits;
    private final List<Quest> quests;
    private final List<TradeOffer> offers;

    CharacterProfile(String id, String displayName, String description, Map<String, Integer> skills,
                     int initialRelationship, Set<String> traits, List<Quest> quests, List<TradeOffer> offers) {
        this.id = id;
        this.displayName = displayName;
        this.description = description;
        this.skills = skills;
        this.initialRelationship = initialRelationship;
        this.traits = traits;
        this.quests = quests;
        this.offers = offers;
    }

    public String getId() { return id; }
    public String getDisplayName() { return displayName; }
    public String getDescription() { return description; }
    public Map<String, Integer> getSkills() { return skills; }
    public int getInitialRelationship() { return initialRelationship; }
    public Set<String> getTraits() { return traits; }
    public List<Quest> getQuests() { return quests; }
    public List<TradeOffer> getOffers() { return offers; }

    public static Optional<CharacterProfile> fromId(String id) {
        if (id == null) return Optional.empty();
        String key = id.trim().toLowerCase();
        return Arrays.stream(values()).filter(c -> c.id.equals(key)).findFirst();
    }
}
