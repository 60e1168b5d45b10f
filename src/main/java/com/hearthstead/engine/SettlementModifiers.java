package com.hearthstead.engine;

/**
 * Floating multipliers raised by technologies, secrets and achievements.
 */
public class SettlementModifiers {
    private double craftSpeed = 1.0;
    private double researchBonus = 1.0;
    private double foodProduction = 1.0;
    private double miningEfficiency = 1.0;
    private double pollutionFactor = 1.0;

    public double getCraftSpeed() { return craftSpeed; }
    public void setCraftSpeed(double craftSpeed) { this.craftSpeed = craftSpeed; }
    public double getResearchBonus() { return researchBonus; }
    public void setResearchBonus(double researchBonus) { this.researchBonus = researchBonus; }
    public double getFoodProduction() { return foodProduction; }
    public void setFoodProduction(double foodProduction) { this.foodProduction = foodProduction; }
    public double getMiningEfficiency() { return miningEfficiency; }
    public void setMiningEfficiency(double miningEfficiency) { this.miningEfficiency = miningEfficiency; }
    public double getPollutionFactor() { return pollutionFactor; }
    public void setPollutionFactor(double pollutionFactor) { this.pollutionFactor = pollutionFactor; }
}
