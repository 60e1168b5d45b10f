package com.hearthstead.engine;

import com.hearthstead.model.LoreSecret;
import com.hearthstead.model.Outcome;
import com.hearthstead.model.ResourceType;
import com.hearthstead.model.UnlockState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class LoreArchiveTest {

    private ResourceLedger ledger;
    private SettlementModifiers modifiers;
    private MarketModel market;
    private LoreArchive lore;

    @BeforeEach
    void setUp() {
        ledger = new ResourceLedger();
        modifiers = new SettlementModifiers();
        market = new MarketModel(ledger, new EventCalendar(30, 150, 30), new SettlementClock(), new Random(2));
        EffectApplier effects = new EffectApplier(modifiers, ledger, new EcosystemModel(), market, new Population(8));
        lore = new LoreArchive(ledger, effects);
    }

    @Test
    void memoryCrystalLowersTheMarketTrend() {
        ledger.adjust(ResourceType.ROCK, 20);
        ledger.adjust(ResourceType.WATER, 20);

        assertEquals(UnlockState.AVAILABLE, lore.stateOf(LoreSecret.MEMORY_CRYSTAL));
        assertTrue(lore.discover(LoreSecret.MEMORY_CRYSTAL).isSuccess());
        assertEquals(0.98, market.getTrend(), 1e-9);
        assertEquals(0.0, ledger.get(ResourceType.ROCK), 1e-9);
        assertEquals(0.0, ledger.get(ResourceType.WATER), 1e-9);
    }

    @Test
    void secretIsDiscoveredOnlyOnce() {
        ledger.adjust(ResourceType.ROCK, 100);
        ledger.adjust(ResourceType.WATER, 100);
        lore.discover(LoreSecret.MEMORY_CRYSTAL);

        assertEquals(Outcome.ALREADY_UNLOCKED, lore.discover(LoreSecret.MEMORY_CRYSTAL).getOutcome());
        assertEquals(0.98, market.getTrend(), 1e-9);
        assertEquals(1, lore.discoveredCount());
    }

    @Test
    void researchThresholdGatesSecretWithoutBeingSpent() {
        ledger.adjust(ResourceType.FOOD, 50);

        assertEquals(Outcome.UNAFFORDABLE, lore.discover(LoreSecret.SEED_OF_PROSPERITY).getOutcome());
        assertEquals(62.0, ledger.get(ResourceType.FOOD));

        ledger.addResearch(10);
        assertTrue(lore.discover(LoreSecret.SEED_OF_PROSPERITY).isSuccess());
        assertEquals(10.0, ledger.getResearch());
        assertEquals(12.0, ledger.get(ResourceType.FOOD), 1e-9);
        assertEquals(2.0, modifiers.getFoodProduction());
    }

    @Test
    void forgeOfSoulsCompoundsCraftSpeed() {
        modifiers.setCraftSpeed(1.5);
        ledger.adjust(ResourceType.STEEL, 10);
        ledger.adjust(ResourceType.COAL, 20);
        ledger.addResearch(30);

        assertTrue(lore.discover(LoreSecret.FORGE_OF_SOULS).isSuccess());
        assertEquals(1.65, modifiers.getCraftSpeed(), 1e-9);
        assertTrue(lore.isDiscovered(LoreSecret.FORGE_OF_SOULS));
    }
}
