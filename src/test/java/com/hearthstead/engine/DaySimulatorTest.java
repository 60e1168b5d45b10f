package com.hearthstead.engine;

import com.hearthstead.config.SettlementProperties;
import com.hearthstead.model.Biome;
import com.hearthstead.model.DayPhase;
import com.hearthstead.model.DayReport;
import com.hearthstead.model.RandomEvent;
import com.hearthstead.model.ResourceType;
import com.hearthstead.model.VictoryType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class DaySimulatorTest {

    private SettlementEngine engine;
    private Random dice;
    private DaySimulator days;

    @BeforeEach
    void setUp() {
        engine = new SettlementEngine(new SettlementProperties(), new Random(4), new EventCalendar(30, 150, 30));
        dice = mock(Random.class);
        days = new DaySimulator(engine.getClock(), engine.getLedger(), engine.getPopulation(), engine.getEcosystem(),
                engine.getProduction(), engine.getMarket(), engine.getModifiers(), engine.getLegacy(), dice);
    }

    // ===== End of day =====

    @Test
    void fedSettlementEatsAndCheersUp() {
        DayReport report = new DayReport(0);
        days.endOfDay(report);

        assertEquals(8.8, engine.getLedger().get(ResourceType.FOOD), 1e-9);
        assertEquals(50.25, engine.getPopulation().getHappiness(), 1e-9);
        assertTrue(engine.getPopulation().getHappiness() > 50.0);
        assertFalse(report.foodShortage);
        assertEquals(8, engine.getPopulation().getTotal());
    }

    @Test
    void hungerHurtsInProportionToTheDeficit() {
        when(dice.nextDouble()).thenReturn(0.9);
        engine.getLedger().set(ResourceType.FOOD, 1.0);
        DayReport report = new DayReport(0);

        days.endOfDay(report);

        assertTrue(report.foodShortage);
        assertFalse(report.starvationDeath);
        assertEquals(0.0, engine.getLedger().get(ResourceType.FOOD));
        // 50 - (2.5 + 0.5 x 2.2) + 0.25
        assertEquals(46.65, engine.getPopulation().getHappiness(), 1e-9);
    }

    @Test
    void starvationCanKillOneResident() {
        when(dice.nextDouble()).thenReturn(0.05);
        engine.getLedger().set(ResourceType.FOOD, 0.0);
        DayReport report = new DayReport(0);

        days.endOfDay(report);

        assertTrue(report.starvationDeath);
        assertEquals(7, engine.getPopulation().getTotal());
        assertEquals(7, engine.getPopulation().getIdle());
    }

    @Test
    void happySettlementsGrow() {
        when(dice.nextDouble()).thenReturn(0.05);
        engine.getPopulation().setHappiness(80);
        DayReport report = new DayReport(0);

        days.endOfDay(report);

        assertTrue(report.birth);
        assertEquals(9, engine.getPopulation().getTotal());
    }

    @Test
    void unhappySettlementsNeverRollForBirth() {
        when(dice.nextDouble()).thenReturn(0.0);
        engine.getPopulation().setHappiness(60);
        DayReport report = new DayReport(0);

        days.endOfDay(report);

        assertFalse(report.birth);
        assertEquals(8, engine.getPopulation().getTotal());
    }

    // ===== Random events =====

    @Test
    void quietDayHasNoEvent() {
        when(dice.nextDouble()).thenReturn(0.5);
        assertTrue(days.rollRandomEvent().isEmpty());
    }

    @Test
    void eventIsPickedUniformlyFromTheTable() {
        when(dice.nextDouble()).thenReturn(0.01);
        when(dice.nextInt(anyInt())).thenReturn(2);

        assertEquals(RandomEvent.CARAVAN, days.rollRandomEvent().orElseThrow());
        assertEquals(24.0, engine.getLedger().get(ResourceType.WINE), 1e-9);
    }

    @Test
    void forestFireAlsoBurnsTheForest() {
        days.applyEvent(RandomEvent.FOREST_FIRE);

        assertEquals(0.0, engine.getLedger().get(ResourceType.WOOD));
        assertEquals(8.0, engine.getLedger().get(ResourceType.FOOD), 1e-9);
        assertEquals(0.0, engine.getEcosystem().getHealth(Biome.FOREST));
    }

    // ===== Day cycle =====

    @Test
    void beginDayRunsOncePerDay() {
        when(dice.nextDouble()).thenReturn(0.5);

        DayReport first = days.beginDay();
        DayReport second = days.beginDay();

        assertSame(first, second);
        assertEquals(DayPhase.ACTIONS, engine.getClock().getPhase());
        assertEquals(5.6, engine.getEcosystem().getHealth(Biome.FOREST), 1e-9);
    }

    @Test
    void endDayAdvancesTheClockAndNotifiesListeners() {
        when(dice.nextDouble()).thenReturn(0.5);
        List<DayReport> seen = new ArrayList<>();
        days.addDayListener(seen::add);

        DayReport report = days.endDay();

        assertEquals(0, report.day);
        assertEquals(1, engine.getClock().getDay());
        assertEquals(DayPhase.DAWN, engine.getClock().getPhase());
        assertEquals(List.of(report), seen);
    }

    @Test
    void autosaveIsDueOnTheConfiguredBoundary() {
        when(dice.nextDouble()).thenReturn(0.5);
        days.setAutosaveEvery(5);

        for (int i = 0; i < 4; i++) {
            assertFalse(days.endDay().autosaveDue);
        }
        assertTrue(days.endDay().autosaveDue);
        assertEquals(5, engine.getClock().getDay());
    }

    @Test
    void victoryIsReportedOnTheDayItHappens() {
        when(dice.nextDouble()).thenReturn(0.5);
        engine.getLedger().addResearch(100);

        DayReport report = days.endDay();

        assertNotNull(report.victory);
        assertNull(days.endDay().victory);
    }

    @Test
    void victoryReachedMidDayLandsInThatDaysReport() {
        when(dice.nextDouble()).thenReturn(0.5);
        days.beginDay();
        engine.getLedger().addResearch(100);

        assertEquals(VictoryType.TECHNOLOGICAL, days.checkVictory().orElseThrow());
        assertEquals(VictoryType.TECHNOLOGICAL, days.endDay().victory);
    }

    @Test
    void dayResumedInTheActionPhaseSkipsDawn() {
        when(dice.nextDouble()).thenReturn(0.0);
        engine.getClock().setPhase(DayPhase.ACTIONS);

        DayReport report = days.beginDay();

        assertEquals(0, report.day);
        assertNull(report.randomEvent);
        assertEquals(5.0, engine.getEcosystem().getHealth(Biome.FOREST), 1e-9);
        assertSame(report, days.beginDay());
    }
}
