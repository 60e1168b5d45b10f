package com.hearthstead.model;

import java.util.List;
import java.util.Map;

/**
 * Read-only picture of the settlement between ticks, for HUDs and clients.
 */
public class SettlementSnapshot {
    public int day;
    public DayPhase phase;
    public int multiplier;
    public double storageCapacity;
    public int storageCount;
    public int population;
    public int idleWorkers;
    public double happiness;
    public double researchProgress;
    public boolean researchComplete;
    public double hostility;
    public boolean victoryAchieved;
    public VictoryType victoryType;

    public Map<String, Double> resources;
    public Map<String, Integer> buildings;
    public Map<String, Integer> workers;
    public List<String> researchedTechs;
    public List<String> discoveredLore;
    public List<String> achievements;
    public EcosystemSummary ecosystem;

    public static class EcosystemSummary {
        public double overallHealth;
        public EcosystemTier tier;
        public double productionModifier;
        public double pollution;
        public double biodiversity;
        public Map<String, Double> biomes;
    }
}
