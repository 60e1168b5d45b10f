package com.hearthstead.engine;

import com.hearthstead.model.Biome;
import com.hearthstead.model.BuildingType;
import com.hearthstead.model.EcosystemTier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EcosystemModelTest {

    private EcosystemModel ecosystem;

    @BeforeEach
    void setUp() {
        ecosystem = new EcosystemModel();
    }

    private static Map<BuildingType, Integer> counts(BuildingType type, int n) {
        Map<BuildingType, Integer> map = new EnumMap<>(BuildingType.class);
        for (BuildingType b : BuildingType.values()) map.put(b, 0);
        map.put(type, n);
        return map;
    }

    private void setAll(double value) {
        for (Biome b : Biome.values()) ecosystem.setHealth(b, value);
    }

    // ===== Tiers =====

    @Test
    void startsCritical() {
        assertEquals(3.75, ecosystem.getOverallHealth(), 1e-9);
        assertEquals(EcosystemTier.CRITICAL, ecosystem.getTier());
        assertEquals(0.6, ecosystem.getProductionModifier());
    }

    @Test
    void productionModifierFollowsTier() {
        setAll(85);
        assertEquals(1.2, ecosystem.getProductionModifier());
        setAll(65);
        assertEquals(1.0, ecosystem.getProductionModifier());
        setAll(55);
        assertEquals(0.8, ecosystem.getProductionModifier());
        setAll(35);
        assertEquals(0.6, ecosystem.getProductionModifier());
    }

    @Test
    void tierBoundariesAreInclusive() {
        setAll(80);
        assertEquals(EcosystemTier.HEALTHY, ecosystem.getTier());
        setAll(60);
        assertEquals(EcosystemTier.STABLE, ecosystem.getTier());
        setAll(40);
        assertEquals(EcosystemTier.DEGRADED, ecosystem.getTier());
    }

    // ===== Tick =====

    @Test
    void emptySettlementRegenerates() {
        ecosystem.tick(counts(BuildingType.LUMBER_MILL, 0), 0, 1.0, 1.0);

        assertEquals(5.6, ecosystem.getHealth(Biome.FOREST), 1e-9);
        assertEquals(0.6, ecosystem.getHealth(Biome.RIVERS), 1e-9);
        assertEquals(0.0, ecosystem.getPollution());
    }

    @Test
    void lumberMillsHurtForestAndAir() {
        ecosystem.tick(counts(BuildingType.LUMBER_MILL, 2), 0, 1.0, 1.0);

        // 5 - 0.6 * 2 * 0.75 + 0.6
        assertEquals(4.7, ecosystem.getHealth(Biome.FOREST), 1e-9);
        // 2 - 0.15 * 2 * 0.75 + 0.6
        assertEquals(2.375, ecosystem.getHealth(Biome.AIR), 1e-9);
        assertEquals(0.375, ecosystem.getPollution(), 1e-9);
    }

    @Test
    void ecoIndustryPenaltyScalesImpact() {
        ecosystem.tick(counts(BuildingType.LUMBER_MILL, 2), 0, 2.0, 1.0);
        // 5 - 0.6 * 2 * 1.5 + 0.6
        assertEquals(3.8, ecosystem.getHealth(Biome.FOREST), 1e-9);
    }

    @Test
    void healthAndPollutionAreClamped() {
        ecosystem.tick(counts(BuildingType.SAND_PIT, 1000), 0, 1.0, 1.0);

        assertEquals(0.0, ecosystem.getHealth(Biome.RIVERS));
        assertEquals(0.0, ecosystem.getHealth(Biome.SOIL));
        assertEquals(100.0, ecosystem.getPollution());
        assertEquals(0.0, ecosystem.getBiodiversity());
    }

    @Test
    void regenerationStopsAtNinety() {
        ecosystem.setHealth(Biome.FOREST, 95);
        ecosystem.setHealth(Biome.AIR, 89.9);
        ecosystem.tick(counts(BuildingType.LUMBER_MILL, 0), 0, 1.0, 1.0);

        assertEquals(95.0, ecosystem.getHealth(Biome.FOREST), 1e-9);
        assertEquals(90.5, ecosystem.getHealth(Biome.AIR), 1e-9);
    }

    @Test
    void biodiversityIsMeanHealthLessPollution() {
        setAll(80);
        ecosystem.tick(counts(BuildingType.QUARRY, 4), 10, 1.0, 1.0);

        double pollution = 0.25 * 4 * 1.25;
        assertEquals(pollution, ecosystem.getPollution(), 1e-9);
        assertEquals(ecosystem.getOverallHealth() - 0.25 * pollution, ecosystem.getBiodiversity(), 1e-9);
    }

    @Test
    void workerLoadFactorFlattensAfterTenWorkers() {
        assertEquals(0.75, EcosystemModel.workerLoadFactor(0), 1e-9);
        assertEquals(1.0, EcosystemModel.workerLoadFactor(5), 1e-9);
        assertEquals(1.25, EcosystemModel.workerLoadFactor(10), 1e-9);
        assertEquals(1.25, EcosystemModel.workerLoadFactor(40), 1e-9);
    }

    @Test
    void restoreAllIsClamped() {
        setAll(90);
        ecosystem.restoreAll(20);
        for (Biome b : Biome.values()) {
            assertEquals(100.0, ecosystem.getHealth(b));
        }
    }
}
