package com.hearthstead.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything needed to rebuild an engine, in the shape written to the save file.
 * Ids are the lowercase catalogue ids so the file stays readable.
 */
public class SettlementState {
    public int day;
    public String phase = DayPhase.DAWN.name();
    public int multiplierMode;
    public double researchProgress;
    public boolean researchComplete;
    public boolean victoryAchieved;
    public String victoryType;

    public double craftSpeedMultiplier = 1.0;
    public double researchBonus = 1.0;
    public double foodProductionMultiplier = 1.0;
    public double miningEfficiency = 1.0;
    public double pollutionFactor = 1.0;
    public double happiness = 50.0;
    public double ecoIndustryPenalty = 1.0;

    public Map<String, Double> resources = new LinkedHashMap<>();
    public Map<String, Integer> buildings = new LinkedHashMap<>();
    public int storageCount = 1;
    public int population;
    public int idleWorkers;
    public Map<String, Integer> workers = new LinkedHashMap<>();

    public Map<String, Double> biomeHealth = new LinkedHashMap<>();
    public double pollution;
    public double biodiversity = 100.0;
    public List<String> researchedTechs = new ArrayList<>();
    public List<String> discoveredLore = new ArrayList<>();
    public List<String> achievements = new ArrayList<>();
    public List<CharacterData> characters = new ArrayList<>();

    public double marketTrend = 1.0;
    public Map<String, List<Double>> priceHistory = new LinkedHashMap<>();

    public EventData events = new EventData();

    public static class CharacterData {
        public String id;
        public int relationship;
        public List<String> quests = new ArrayList<>();
        public List<String> memory = new ArrayList<>();
    }

    public static class EventData {
        public int primaryStart;
        public int secondaryStart;
        public int duration;
    }
}
