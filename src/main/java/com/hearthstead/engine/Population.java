package com.hearthstead.engine;

import com.hearthstead.model.ActionResult;
import com.hearthstead.model.BuildingType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Residents, their job assignments and their mood.
 * idle + sum(assigned) == population holds after every public call.
 */
public class Population {

    public static final double NEUTRAL_HAPPINESS = 50.0;

    private int total;
    private int idle;
    private final Map<BuildingType, Integer> assigned = new EnumMap<>(BuildingType.class);
    private double happiness = NEUTRAL_HAPPINESS;

    public Population(int initial) {
        this.total = initial;
        this.idle = initial;
        for (BuildingType b : BuildingType.values()) {
            assigned.put(b, 0);
        }
    }

    public ActionResult assign(BuildingType building, int workers) {
        if (workers < 0) {
            return ActionResult.invalidQuantity("Worker count cannot be negative");
        }
        int delta = workers - assigned.get(building);
        if (delta > 0 && delta > idle) {
            return ActionResult.unaffordable("Only " + idle + " idle workers");
        }
        assigned.put(building, workers);
        recomputeIdle();
        return ActionResult.success(building.getId() + " -> " + workers + " (idle " + idle + ")");
    }

    public int getAssigned(BuildingType building) {
        return assigned.get(building);
    }

    public int totalAssigned() {
        int sum = 0;
        for (int n : assigned.values()) sum += n;
        return sum;
    }

    public void grow() {
        total++;
        recomputeIdle();
    }

    /**
     * Removes one resident, taking an idle one if possible, otherwise pulling a worker off
     * the most staffed building. The last resident never dies.
     */
    public boolean decline() {
        if (total <= 1) return false;
        total--;
        if (idle == 0) {
            BuildingType busiest = null;
            for (Map.Entry<BuildingType, Integer> e : assigned.entrySet()) {
                if (busiest == null || e.getValue() > assigned.get(busiest)) busiest = e.getKey();
            }
            assigned.merge(busiest, -1, Integer::sum);
        }
        recomputeIdle();
        return true;
    }

    private void recomputeIdle() {
        idle = total - totalAssigned();
    }

    // --- HAPPINESS ---
    public double happinessModifier() {
        return Math.max(0.8, Math.min(1.2, 1.0 + (happiness - NEUTRAL_HAPPINESS) * 0.005));
    }

    public void changeHappiness(double delta) {
        happiness = Math.max(0.0, Math.min(100.0, happiness + delta));
    }

    public void relaxHappiness(double step) {
        if (happiness > NEUTRAL_HAPPINESS) happiness = Math.max(NEUTRAL_HAPPINESS, happiness - step);
        else if (happiness < NEUTRAL_HAPPINESS) happiness = Math.min(NEUTRAL_HAPPINESS, happiness + step);
    }

    public double getHappiness() { return happiness; }
    public void setHappiness(double happiness) { this.happiness = happiness; }

    public int getTotal() { return total; }
    public int getIdle() { return idle; }

    public Map<BuildingType, Integer> getAssignments() {
        return Collections.unmodifiableMap(assigned);
    }

    /**
     * Replaces the whole workforce picture. Rejects numbers that break the accounting.
     */
    public void restore(int total, Map<BuildingType, Integer> workers) {
        int sum = 0;
        for (int n : workers.values()) {
            if (n < 0) throw new IllegalArgumentException("Negative worker count");
            sum += n;
        }
        if (total < 0 || sum > total) {
            throw new IllegalArgumentException("Workers (" + sum + ") exceed population (" + total + ")");
        }
        for (BuildingType b : BuildingType.values()) {
            assigned.put(b, workers.getOrDefault(b, 0));
        }
        this.total = total;
        recomputeIdle();
    }
}
