package com.hearthstead.config;

import com.hearthstead.model.Difficulty;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settlement tuning bound from {@code settlement.*} in application.properties.
 * Also constructed directly by tests and by anything that needs a standalone engine.
 */
@ConfigurationProperties(prefix = "settlement")
public class SettlementProperties {

    private Difficulty difficulty = Difficulty.NORMAL;
    private int basePopulation = 8;
    private double foodPerCapita = 0.4;
    private double happinessDecay = 0.25;
    // null = seed from the clock
    private Long rngSeed;
    private int autosaveEvery = 5;
    private String saveFile = "settlement_save.json";
    private Clock clock = new Clock();
    private Market market = new Market();

    public static class Clock {
        private boolean enabled = false;
        private long dayLengthMs = 3000;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public long getDayLengthMs() { return dayLengthMs; }
        public void setDayLengthMs(long dayLengthMs) { this.dayLengthMs = dayLengthMs; }
    }

    public static class Market {
        private double trendDrift = 0.005;

        public double getTrendDrift() { return trendDrift; }
        public void setTrendDrift(double trendDrift) { this.trendDrift = trendDrift; }
    }

    public Difficulty getDifficulty() { return difficulty; }
    public void setDifficulty(Difficulty difficulty) { this.difficulty = difficulty; }
    public int getBasePopulation() { return basePopulation; }
    public void setBasePopulation(int basePopulation) { this.basePopulation = basePopulation; }
    public double getFoodPerCapita() { return foodPerCapita; }
    public void setFoodPerCapita(double foodPerCapita) { this.foodPerCapita = foodPerCapita; }
    public double getHappinessDecay() { return happinessDecay; }
    public void setHappinessDecay(double happinessDecay) { this.happinessDecay = happinessDecay; }
    public Long getRngSeed() { return rngSeed; }
    public void setRngSeed(Long rngSeed) { this.rngSeed = rngSeed; }
    public int getAutosaveEvery() { return autosaveEvery; }
    public void setAutosaveEvery(int autosaveEvery) { this.autosaveEvery = autosaveEvery; }
    public String getSaveFile() { return saveFile; }
    public void setSaveFile(String saveFile) { this.saveFile = saveFile; }
    public Clock getClock() { return clock; }
    public void setClock(Clock clock) { this.clock = clock; }
    public Market getMarket() { return market; }
    public void setMarket(Market market) { this.market = market; }
}
