package com.hearthstead.engine;

import com.hearthstead.model.BuildingType;
import com.hearthstead.model.Outcome;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PopulationTest {

    private static void assertBalanced(Population p) {
        assertEquals(p.getTotal(), p.getIdle() + p.totalAssigned());
    }

    @Test
    void assignmentIsLimitedByIdleWorkers() {
        Population p = new Population(8);

        assertTrue(p.assign(BuildingType.QUARRY, 5).isSuccess());
        assertEquals(3, p.getIdle());
        assertEquals(Outcome.UNAFFORDABLE, p.assign(BuildingType.WHEAT_FIELD, 4).getOutcome());
        assertEquals(0, p.getAssigned(BuildingType.WHEAT_FIELD));
        assertBalanced(p);
    }

    @Test
    void reassigningCountsOnlyTheDifference() {
        Population p = new Population(8);
        p.assign(BuildingType.QUARRY, 5);

        assertTrue(p.assign(BuildingType.QUARRY, 8).isSuccess());
        assertEquals(0, p.getIdle());
        assertTrue(p.assign(BuildingType.QUARRY, 2).isSuccess());
        assertEquals(6, p.getIdle());
        assertBalanced(p);
    }

    @Test
    void negativeAssignmentIsRejected() {
        assertEquals(Outcome.INVALID_QUANTITY, new Population(8).assign(BuildingType.QUARRY, -1).getOutcome());
    }

    @Test
    void declineTakesIdleFirstThenWorkers() {
        Population p = new Population(3);
        p.assign(BuildingType.QUARRY, 2);

        assertTrue(p.decline());
        assertEquals(0, p.getIdle());
        assertEquals(2, p.getAssigned(BuildingType.QUARRY));

        assertTrue(p.decline());
        assertEquals(1, p.getAssigned(BuildingType.QUARRY));
        assertBalanced(p);

        assertFalse(p.decline());
        assertEquals(1, p.getTotal());
    }

    @Test
    void growthAddsAnIdleResident() {
        Population p = new Population(8);
        p.grow();
        assertEquals(9, p.getTotal());
        assertEquals(9, p.getIdle());
    }

    // ===== Happiness =====

    @Test
    void happinessModifierIsClamped() {
        Population p = new Population(8);
        assertEquals(1.0, p.happinessModifier(), 1e-9);
        p.setHappiness(70);
        assertEquals(1.1, p.happinessModifier(), 1e-9);
        p.setHappiness(100);
        assertEquals(1.2, p.happinessModifier(), 1e-9);
        p.setHappiness(0);
        assertEquals(0.8, p.happinessModifier(), 1e-9);
    }

    @Test
    void happinessRelaxesTowardNeutralWithoutOvershoot() {
        Population p = new Population(8);
        p.setHappiness(50.1);
        p.relaxHappiness(0.25);
        assertEquals(50.0, p.getHappiness());
        p.setHappiness(40);
        p.relaxHappiness(0.25);
        assertEquals(40.25, p.getHappiness(), 1e-9);
    }

    @Test
    void happinessStaysInRange() {
        Population p = new Population(8);
        p.changeHappiness(500);
        assertEquals(100.0, p.getHappiness());
        p.changeHappiness(-500);
        assertEquals(0.0, p.getHappiness());
    }

    // ===== Restore =====

    @Test
    void restoreRejectsMoreWorkersThanResidents() {
        Population p = new Population(8);
        assertThrows(IllegalArgumentException.class,
                () -> p.restore(3, Map.of(BuildingType.QUARRY, 4)));
        assertThrows(IllegalArgumentException.class,
                () -> p.restore(3, Map.of(BuildingType.QUARRY, -1)));
    }

    @Test
    void restoreRecomputesIdle() {
        Population p = new Population(8);
        p.restore(9, Map.of(BuildingType.LUMBER_MILL, 2, BuildingType.QUARRY, 3));
        assertEquals(4, p.getIdle());
        assertBalanced(p);
    }
}
