package com.hearthstead.engine;

import com.hearthstead.model.Cost;
import com.hearthstead.model.ResourceType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ResourceLedgerTest {

    private ResourceLedger ledger;

    @BeforeEach
    void setUp() {
        ledger = new ResourceLedger();
    }

    @Test
    void startsWithStarterStockAndOneStorehouse() {
        assertEquals(10.0, ledger.get(ResourceType.WOOD));
        assertEquals(10.0, ledger.get(ResourceType.WINE));
        assertEquals(10.0, ledger.get(ResourceType.ROCK));
        assertEquals(12.0, ledger.get(ResourceType.FOOD));
        assertEquals(0.0, ledger.get(ResourceType.IRON));
        assertEquals(125.0, ledger.getStorageCapacity());
    }

    // ===== Capacity =====

    @Test
    void creditsAreCappedAtCapacity() {
        ledger.adjust(ResourceType.WOOD, 500);
        assertEquals(125.0, ledger.get(ResourceType.WOOD));
    }

    @Test
    void currencyIsNotCapped() {
        ledger.adjust(ResourceType.WINE, 1000);
        assertEquals(1010.0, ledger.get(ResourceType.WINE));
    }

    @Test
    void debitsNeverGoBelowZero() {
        ledger.adjust(ResourceType.ROCK, -50);
        assertEquals(0.0, ledger.get(ResourceType.ROCK));
    }

    @Test
    void storehouseRaisesCapacity() {
        ledger.addStorageUnit();
        assertEquals(200.0, ledger.getStorageCapacity());
        ledger.adjust(ResourceType.WOOD, 500);
        assertEquals(200.0, ledger.get(ResourceType.WOOD));
    }

    @Test
    void creditToAStockAlreadyOverCapacityPullsItDown() {
        ledger.set(ResourceType.WOOD, 300);
        ledger.adjust(ResourceType.WOOD, 1);
        assertEquals(125.0, ledger.get(ResourceType.WOOD));
    }

    // ===== Debit =====

    @Test
    void debitIsAllOrNothing() {
        boolean ok = ledger.debit(Map.of(ResourceType.WOOD, 5.0, ResourceType.ROCK, 50.0));

        assertFalse(ok);
        assertEquals(10.0, ledger.get(ResourceType.WOOD));
        assertEquals(10.0, ledger.get(ResourceType.ROCK));
    }

    @Test
    void debitTakesEveryAmount() {
        assertTrue(ledger.debit(Map.of(ResourceType.WOOD, 5.0, ResourceType.ROCK, 10.0)));
        assertEquals(5.0, ledger.get(ResourceType.WOOD));
        assertEquals(0.0, ledger.get(ResourceType.ROCK));
    }

    @Test
    void costAffordabilityIncludesResearchThreshold() {
        Cost cost = Cost.of(Map.of(ResourceType.WOOD, 1.0), 20.0);
        assertFalse(ledger.affordable(cost));
        ledger.addResearch(20);
        assertTrue(ledger.affordable(cost));
    }

    // ===== Research =====

    @Test
    void researchCompletesAtGoalAndStaysComplete() {
        ledger.addResearch(99.5);
        assertFalse(ledger.isResearchComplete());
        ledger.addResearch(0.5);
        assertTrue(ledger.isResearchComplete());
        ledger.consumeResearch(60);
        assertTrue(ledger.isResearchComplete());
        assertEquals(40.0, ledger.getResearch(), 1e-9);
    }

    @Test
    void wealthExcludesCurrency() {
        // wood 10 + rock 10 + food 12
        assertEquals(32.0, ledger.totalNonCurrencyWealth(), 1e-9);
    }
}
