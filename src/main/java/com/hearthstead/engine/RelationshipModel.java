package com.hearthstead.engine;

import com.hearthstead.model.CharacterProfile;
import com.hearthstead.model.NpcCharacter;
import com.hearthstead.model.PlayerAction;
import com.hearthstead.model.RelationshipTier;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * How each character feels about the player, and how that reacts to what the player does.
 */
public class RelationshipModel {

    public static final int TRADE_THRESHOLD = 20;
    public static final int QUEST_THRESHOLD = 0;
    public static final int DISCOUNT_THRESHOLD = 60;
    private static final int TALK_CEILING = 80;
    private static final int TALK_BONUS = 5;

    private final Map<CharacterProfile, NpcCharacter> characters = new EnumMap<>(CharacterProfile.class);

    public RelationshipModel() {
        for (CharacterProfile p : CharacterProfile.values()) {
            characters.put(p, new NpcCharacter(p));
        }
    }

    /**
     * Applies the action's impact, adjusted by the character's traits.
     * @return the impact actually added before clamping
     */
    public int reactToAction(CharacterProfile profile, PlayerAction action) {
        NpcCharacter c = characters.get(profile);
        int impact = action.getImpact();
        if (c.hasTrait("environmentalist") && action.isDeforestation()) {
            impact *= 2;
            c.remember("player_destroyed_nature");
        }
        if (c.hasTrait("blacksmith") && action.isForgeBuilding()) {
            impact += 20;
            c.remember("player_built_forge");
        }
        c.changeRelationship(impact);
        return impact;
    }

    // Unknown action ids carry no impact
    public int reactToAction(CharacterProfile profile, String actionId) {
        return PlayerAction.fromId(actionId)
                .map(a -> reactToAction(profile, a))
                .orElse(0);
    }

    /** Every character with the trait reacts to the action. */
    public void notifyCharactersWithTrait(String trait, PlayerAction action) {
        for (NpcCharacter c : characters.values()) {
            if (c.hasTrait(trait)) reactToAction(c.getProfile(), action);
        }
    }

    public RelationshipTier relationshipTier(CharacterProfile profile) {
        return characters.get(profile).getTier();
    }

    /**
     * Greeting for the current tier. Talking warms the relationship up to a ceiling.
     */
    public String talk(CharacterProfile profile) {
        NpcCharacter c = characters.get(profile);
        String line = c.getName() + ": '" + c.getTier().getGreeting() + "'";
        if (c.getRelationship() < TALK_CEILING) {
            c.changeRelationship(TALK_BONUS);
        }
        return line;
    }

    public boolean canTrade(CharacterProfile profile) {
        return characters.get(profile).getRelationship() >= TRADE_THRESHOLD;
    }

    public boolean canTakeQuests(CharacterProfile profile) {
        return characters.get(profile).getRelationship() >= QUEST_THRESHOLD;
    }

    public double tradeDiscount(CharacterProfile profile) {
        return characters.get(profile).getRelationship() >= DISCOUNT_THRESHOLD ? 0.98 : 1.0;
    }

    public NpcCharacter get(CharacterProfile profile) {
        return characters.get(profile);
    }

    public Collection<NpcCharacter> getAll() {
        return Collections.unmodifiableCollection(characters.values());
    }
}
