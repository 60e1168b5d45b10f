package com.hearthstead.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class NpcCharacter {
    public static final int MIN_RELATIONSHIP = -100;
    public static final int MAX_RELATIONSHIP = 100;

    private final CharacterProfile profile;
    private int relationship;
    private final List<String> memory = new ArrayList<>();
    private final List<Quest> openQuests = new ArrayList<>();

    public NpcCharacter(CharacterProfile profile) {
        this.profile = profile;
        this.relationship = profile.getInitialRelationship();
        this.openQuests.addAll(profile.getQuests());
    }

    public CharacterProfile getProfile() { return profile; }
    public String getId() { return profile.getId(); }
    public String getName() { return profile.getDisplayName(); }
    public Map<String, Integer> getSkills() { return profile.getSkills(); }
    public Set<String> getTraits() { return profile.getTraits(); }

    public boolean hasTrait(String trait) { return profile.getTraits().contains(trait); }

    public int getRelationship() { return relationship; }

    // Every write goes through the clamp
    public void setRelationship(int relationship) {
        this.relationship = Math.max(MIN_RELATIONSHIP, Math.min(MAX_RELATIONSHIP, relationship));
    }

    public void changeRelationship(int delta) {
        setRelationship(relationship + delta);
    }

    public RelationshipTier getTier() { return RelationshipTier.forScore(relationship); }

    public List<String> getMemory() { return Collections.unmodifiableList(memory); }
    public void remember(String entry) { memory.add(entry); }

    public List<Quest> getOpenQuests() { return Collections.unmodifiableList(openQuests); }
    public boolean hasOpenQuest(Quest quest) { return openQuests.contains(quest); }
    public void closeQuest(Quest quest) { openQuests.remove(quest); }

    public void restore(int relationship, List<String> memory, List<Quest> openQuests) {
        setRelationship(relationship);
        this.memory.clear();
        this.memory.addAll(memory);
        this.openQuests.clear();
        this.openQuests.addAll(openQuests);
    }
}
