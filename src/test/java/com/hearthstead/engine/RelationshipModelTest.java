package com.hearthstead.engine;

import com.hearthstead.model.CharacterProfile;
import com.hearthstead.model.NpcCharacter;
import com.hearthstead.model.PlayerAction;
import com.hearthstead.model.RelationshipTier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RelationshipModelTest {

    private RelationshipModel model;

    @BeforeEach
    void setUp() {
        model = new RelationshipModel();
    }

    @Test
    void startingScoresComeFromProfiles() {
        assertEquals(50, model.get(CharacterProfile.FOREST_ELDER).getRelationship());
        assertEquals(30, model.get(CharacterProfile.MINE_MASTER).getRelationship());
        assertEquals(40, model.get(CharacterProfile.LORE_KEEPER).getRelationship());
        assertEquals(RelationshipTier.FRIENDLY, model.relationshipTier(CharacterProfile.FOREST_ELDER));
    }

    // ===== Reactions =====

    @Test
    void environmentalistTakesDeforestationTwiceAsHard() {
        int impact = model.reactToAction(CharacterProfile.FOREST_ELDER, PlayerAction.DEFORESTATION);

        assertEquals(-50, impact);
        NpcCharacter elder = model.get(CharacterProfile.FOREST_ELDER);
        assertEquals(0, elder.getRelationship());
        assertTrue(elder.getMemory().contains("player_destroyed_nature"));
    }

    @Test
    void othersTakeDeforestationAtFaceValue() {
        assertEquals(-25, model.reactToAction(CharacterProfile.LORE_KEEPER, PlayerAction.DEFORESTATION));
        assertEquals(15, model.get(CharacterProfile.LORE_KEEPER).getRelationship());
    }

    @Test
    void blacksmithLikesForges() {
        assertEquals(30, model.reactToAction(CharacterProfile.MINE_MASTER, PlayerAction.BUILD_FORGE));
        assertTrue(model.get(CharacterProfile.MINE_MASTER).getMemory().contains("player_built_forge"));
    }

    @Test
    void unknownActionHasNoEffect() {
        assertEquals(0, model.reactToAction(CharacterProfile.MINE_MASTER, "throw_party"));
        assertEquals(30, model.get(CharacterProfile.MINE_MASTER).getRelationship());
    }

    @Test
    void relationshipIsClamped() {
        for (int i = 0; i < 10; i++) {
            model.reactToAction(CharacterProfile.FOREST_ELDER, PlayerAction.POLLUTE_RIVER);
        }
        assertEquals(NpcCharacter.MIN_RELATIONSHIP, model.get(CharacterProfile.FOREST_ELDER).getRelationship());
        assertEquals(RelationshipTier.HATES, model.relationshipTier(CharacterProfile.FOREST_ELDER));
    }

    @Test
    void traitBroadcastReachesOnlyMatchingCharacters() {
        model.notifyCharactersWithTrait("scholar", PlayerAction.BUILD_HERBALIST);

        assertEquals(55, model.get(CharacterProfile.LORE_KEEPER).getRelationship());
        assertEquals(50, model.get(CharacterProfile.FOREST_ELDER).getRelationship());
    }

    // ===== Talking and gates =====

    @Test
    void talkingWarmsUpToTheCeiling() {
        NpcCharacter elder = model.get(CharacterProfile.FOREST_ELDER);
        elder.setRelationship(78);

        String line = model.talk(CharacterProfile.FOREST_ELDER);
        assertTrue(line.startsWith("Forest Elder"));
        assertEquals(83, elder.getRelationship());

        model.talk(CharacterProfile.FOREST_ELDER);
        assertEquals(83, elder.getRelationship());
    }

    @Test
    void tradeAndQuestGates() {
        NpcCharacter master = model.get(CharacterProfile.MINE_MASTER);
        master.setRelationship(19);
        assertFalse(model.canTrade(CharacterProfile.MINE_MASTER));
        assertTrue(model.canTakeQuests(CharacterProfile.MINE_MASTER));

        master.setRelationship(-1);
        assertFalse(model.canTakeQuests(CharacterProfile.MINE_MASTER));

        master.setRelationship(60);
        assertTrue(model.canTrade(CharacterProfile.MINE_MASTER));
        assertEquals(0.98, model.tradeDiscount(CharacterProfile.MINE_MASTER));
    }
}
