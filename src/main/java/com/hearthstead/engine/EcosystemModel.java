package com.hearthstead.engine;

import com.hearthstead.model.Biome;
import com.hearthstead.model.BuildingType;
import com.hearthstead.model.EcosystemTier;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-biome health driven by industrial load. No randomness here.
 */
public class EcosystemModel {

    public static final double MIN_HEALTH = 0.0;
    public static final double MAX_HEALTH = 100.0;
    private static final double REGEN_PER_TICK = 0.6;
    private static final double REGEN_CEILING = 90.0;

    private final Map<Biome, Double> health = new EnumMap<>(Biome.class);
    private double pollution = 0.0;
    private double biodiversity = 100.0;

    public EcosystemModel() {
        for (Biome b : Biome.values()) {
            health.put(b, b.getInitialHealth());
        }
    }

    /**
     * Load factor of the workforce: 0.75 at zero workers, +0.05 per worker, flat after 10.
     */
    public static double workerLoadFactor(int totalWorkers) {
        return 0.75 + 0.05 * Math.min(totalWorkers, 10);
    }

    public void tick(Map<BuildingType, Integer> buildingCounts, int totalWorkers,
                     double ecoIndustryPenalty, double pollutionFactor) {
        double load = workerLoadFactor(totalWorkers) * ecoIndustryPenalty;

        int totalBuildings = 0;
        for (Map.Entry<BuildingType, Integer> e : buildingCounts.entrySet()) {
            int count = e.getValue();
            totalBuildings += count;
            for (Map.Entry<Biome, Double> impact : e.getKey().getBiomeImpact().entrySet()) {
                health.merge(impact.getKey(), impact.getValue() * count * load, Double::sum);
            }
        }

        // Soft regeneration, then clamp
        for (Biome b : Biome.values()) {
            double value = health.get(b);
            if (value < REGEN_CEILING) value += REGEN_PER_TICK;
            health.put(b, clamp(value));
        }

        pollution = Math.min(100.0, 0.25 * totalBuildings * load * pollutionFactor);
        biodiversity = Math.max(0.0, getOverallHealth() - 0.25 * pollution);
    }

    public void damage(Biome biome, double amount) {
        health.put(biome, clamp(health.get(biome) - amount));
    }

    public void restoreAll(double amount) {
        for (Biome b : Biome.values()) {
            health.put(b, clamp(health.get(b) + amount));
        }
    }

    public double getOverallHealth() {
        double sum = 0.0;
        for (double v : health.values()) sum += v;
        return sum / health.size();
    }

    public EcosystemTier getTier() {
        return EcosystemTier.forHealth(getOverallHealth());
    }

    public double getProductionModifier() {
        return getTier().getProductionModifier();
    }

    public double getHealth(Biome biome) { return health.get(biome); }

    public void setHealth(Biome biome, double value) {
        health.put(biome, clamp(value));
    }

    public Map<Biome, Double> getBiomeHealth() { return Collections.unmodifiableMap(health); }

    public double getPollution() { return pollution; }
    public void setPollution(double pollution) { this.pollution = pollution; }
    public double getBiodiversity() { return biodiversity; }
    public void setBiodiversity(double biodiversity) { this.biodiversity = biodiversity; }

    private static double clamp(double value) {
        return Math.max(MIN_HEALTH, Math.min(MAX_HEALTH, value));
    }
}
