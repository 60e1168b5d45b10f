package com.hearthstead.engine;

import com.hearthstead.model.Cost;
import com.hearthstead.model.ResourceType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Stock of every resource, the storage cap and the research counter.
 * <p>
 * Non-currency stocks stay within [0, storageCapacity] when changed through {@link #adjust}.
 * The currency is never capped. Research is a separate scalar, not a stock entry.
 */
public class ResourceLedger {

    public static final double STORAGE_BASE_CAPACITY = 50.0;
    public static final double STORAGE_PER_UNIT = 75.0;
    public static final double RESEARCH_GOAL = 100.0;

    private final Map<ResourceType, Double> stock = new EnumMap<>(ResourceType.class);
    private int storageCount = 1;
    private double research = 0.0;
    private boolean researchComplete = false;

    public ResourceLedger() {
        for (ResourceType r : ResourceType.values()) {
            stock.put(r, 0.0);
        }
        stock.put(ResourceType.WOOD, 10.0);
        stock.put(ResourceType.WINE, 10.0);
        stock.put(ResourceType.ROCK, 10.0);
        stock.put(ResourceType.FOOD, 12.0);
    }

    public double get(ResourceType resource) {
        return stock.getOrDefault(resource, 0.0);
    }

    // Raw write, bypasses the cap. Used for restore and for "spend everything" actions.
    public void set(ResourceType resource, double amount) {
        stock.put(resource, amount);
    }

    public void adjust(ResourceType resource, double delta) {
        double current = get(resource);
        if (resource.isCurrency()) {
            stock.put(resource, current + delta);
        } else if (delta > 0) {
            stock.put(resource, Math.min(current + delta, getStorageCapacity()));
        } else {
            stock.put(resource, Math.max(0.0, current + delta));
        }
    }

    public boolean affordable(Map<ResourceType, Double> amounts) {
        for (Map.Entry<ResourceType, Double> e : amounts.entrySet()) {
            if (get(e.getKey()) < e.getValue()) return false;
        }
        return true;
    }

    /** Resources and the research threshold both have to be met. */
    public boolean affordable(Cost cost) {
        return affordable(cost.getResources()) && research >= cost.getResearch();
    }

    /**
     * Debits every amount or nothing.
     * @return false if any amount was not available
     */
    public boolean debit(Map<ResourceType, Double> amounts) {
        if (!affordable(amounts)) return false;
        amounts.forEach((r, amt) -> adjust(r, -amt));
        return true;
    }

    public double totalNonCurrencyWealth() {
        double total = 0.0;
        for (Map.Entry<ResourceType, Double> e : stock.entrySet()) {
            if (!e.getKey().isCurrency()) total += e.getValue();
        }
        return total;
    }

    public Map<ResourceType, Double> getStock() {
        return Collections.unmodifiableMap(stock);
    }

    // --- STORAGE ---
    public double getStorageCapacity() {
        return STORAGE_BASE_CAPACITY + STORAGE_PER_UNIT * storageCount;
    }

    public int getStorageCount() { return storageCount; }
    public void setStorageCount(int storageCount) { this.storageCount = storageCount; }
    public void addStorageUnit() { storageCount++; }

    // --- RESEARCH ---
    public double getResearch() { return research; }
    public void setResearch(double research) { this.research = research; }

    public void addResearch(double amount) {
        research += amount;
        if (research >= RESEARCH_GOAL) researchComplete = true;
    }

    public void consumeResearch(double amount) {
        research = Math.max(0.0, research - amount);
    }

    public boolean isResearchComplete() { return researchComplete; }
    public void setResearchComplete(boolean researchComplete) { this.researchComplete = researchComplete; }
}
