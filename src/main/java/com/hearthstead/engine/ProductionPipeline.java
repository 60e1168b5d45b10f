package com.hearthstead.engine;

import com.hearthstead.model.ActionResult;
import com.hearthstead.model.BuildingType;
import com.hearthstead.model.Cost;
import com.hearthstead.model.MiningAction;
import com.hearthstead.model.Recipe;
import com.hearthstead.model.ResourceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Buildings, direct extraction, passive building output and crafting.
 */
public class ProductionPipeline {

    private static final Logger log = LoggerFactory.getLogger(ProductionPipeline.class);

    public static final int[] MULTIPLIERS = {1, 10, 100};
    public static final Map<ResourceType, Double> STOREHOUSE_COST =
            Map.of(ResourceType.WOOD, 20.0, ResourceType.ROCK, 15.0);
    private static final double COST_GROWTH_PER_UNIT = 0.1;
    private static final double WORKER_BONUS_STEP = 0.15;
    private static final int WORKER_BONUS_CAP = 5;

    private final Map<BuildingType, Integer> buildings = new EnumMap<>(BuildingType.class);
    private final ResourceLedger ledger;
    private final Population population;
    private final EcosystemModel ecosystem;
    private final EventCalendar calendar;
    private final SettlementClock clock;
    private final SettlementModifiers modifiers;
    private final TechnologyTree technologies;
    private final LoreArchive lore;
    private int multiplierMode = 0;

    public ProductionPipeline(ResourceLedger ledger, Population population, EcosystemModel ecosystem,
                              EventCalendar calendar, SettlementClock clock, SettlementModifiers modifiers,
                              TechnologyTree technologies, LoreArchive lore) {
        this.ledger = ledger;
        this.population = population;
        this.ecosystem = ecosystem;
        this.calendar = calendar;
        this.clock = clock;
        this.modifiers = modifiers;
        this.technologies = technologies;
        this.lore = lore;
        for (BuildingType b : BuildingType.values()) {
            buildings.put(b, 0);
        }
    }

    // --- MULTIPLIER ---
    public int currentMultiplier() {
        return MULTIPLIERS[multiplierMode];
    }

    public int toggleMultiplier() {
        multiplierMode = (multiplierMode + 1) % MULTIPLIERS.length;
        return currentMultiplier();
    }

    public int getMultiplierMode() { return multiplierMode; }

    public void setMultiplierMode(int mode) {
        if (mode < 0 || mode >= MULTIPLIERS.length) {
            throw new IllegalArgumentException("Multiplier mode out of range: " + mode);
        }
        this.multiplierMode = mode;
    }

    public double hostilityModifier() {
        return calendar.hostilityModifier(clock.getDay());
    }

    // --- EXTRACTION ---

    /**
     * One work shift: the direct yield of the action, then the passive output of every building.
     * Direct yield = base x multiplier x hostility x happiness x ecosystem x mining efficiency.
     */
    public Map<ResourceType, Double> mine(MiningAction action) {
        double scale = currentMultiplier() * hostilityModifier() * population.happinessModifier()
                * ecosystem.getProductionModifier() * modifiers.getMiningEfficiency();
        Map<ResourceType, Double> produced = new EnumMap<>(ResourceType.class);
        action.getBaseYield().forEach((r, amt) -> {
            double p = amt * scale;
            ledger.adjust(r, p);
            produced.merge(r, p, Double::sum);
        });
        collectBuildingOutput().forEach((r, p) -> produced.merge(r, p, Double::sum));
        return produced;
    }

    /**
     * Output per type = per-unit output x count x ecosystem x (1 + 0.15 x min(workers, 5)).
     * Food is further scaled by the food production multiplier.
     */
    public Map<ResourceType, Double> collectBuildingOutput() {
        double eco = ecosystem.getProductionModifier();
        Map<ResourceType, Double> produced = new EnumMap<>(ResourceType.class);
        for (Map.Entry<BuildingType, Integer> e : buildings.entrySet()) {
            int count = e.getValue();
            if (count <= 0) continue;
            BuildingType type = e.getKey();
            double workerBonus = 1.0 + WORKER_BONUS_STEP * Math.min(population.getAssigned(type), WORKER_BONUS_CAP);
            type.getOutputPerUnit().forEach((r, base) -> {
                double p = base * count * eco * workerBonus;
                if (r == ResourceType.FOOD) p *= modifiers.getFoodProduction();
                ledger.adjust(r, p);
                produced.merge(r, p, Double::sum);
            });
        }
        return produced;
    }

    // --- CONSTRUCTION ---
    public Cost buildingCost(BuildingType type) {
        return Cost.of(type.getBaseCost()).scaled(1.0 + buildings.get(type) * COST_GROWTH_PER_UNIT);
    }

    public ActionResult build(BuildingType type) {
        Cost cost = buildingCost(type);
        if (!ledger.debit(cost.getResources())) {
            return ActionResult.unaffordable("Not enough materials for " + type.getDisplayName() + ", need " + cost);
        }
        buildings.merge(type, 1, Integer::sum);
        log.debug("Built {} (now {})", type.getId(), buildings.get(type));
        return ActionResult.success(type.getDisplayName() + " built");
    }

    public ActionResult buildStorehouse() {
        if (!ledger.debit(STOREHOUSE_COST)) {
            return ActionResult.unaffordable("Not enough materials for a storehouse");
        }
        ledger.addStorageUnit();
        return ActionResult.success("Storehouse built, capacity " + ledger.getStorageCapacity());
    }

    // --- WORKERS ---
    public ActionResult assignWorkers(BuildingType type, int workers) {
        if (buildings.get(type) <= 0) {
            return ActionResult.invalidReference("No " + type.getDisplayName() + " built yet");
        }
        return population.assign(type, workers);
    }

    // --- CRAFTING ---

    /**
     * Inputs and outputs are scaled by multiplier x hostility x craft speed.
     * All inputs are checked before anything is debited.
     */
    public ActionResult craft(Recipe recipe) {
        if (recipe.getRequiredTechnology() != null && !technologies.isResearched(recipe.getRequiredTechnology())) {
            return ActionResult.prerequisiteUnmet(recipe.getDisplayName() + " needs " + recipe.getRequiredTechnology().getId());
        }
        if (recipe.getRequiredSecret() != null && !lore.isDiscovered(recipe.getRequiredSecret())) {
            return ActionResult.prerequisiteUnmet(recipe.getDisplayName() + " needs " + recipe.getRequiredSecret().getId());
        }
        double scale = currentMultiplier() * hostilityModifier() * modifiers.getCraftSpeed();
        Cost need = recipe.getInputs().scaled(scale);
        if (ledger.getResearch() < need.getResearch()) {
            return ActionResult.unaffordable("Not enough research for " + recipe.getDisplayName());
        }
        if (!ledger.affordable(need.getResources())) {
            return ActionResult.unaffordable("Not enough resources for " + recipe.getDisplayName() + ", need " + need);
        }
        ledger.debit(need.getResources());
        ledger.consumeResearch(need.getResearch());
        recipe.getOutputs().forEach((r, amt) -> ledger.adjust(r, amt * scale));
        return ActionResult.success("Crafted " + recipe.getDisplayName());
    }

    public boolean isRecipeUnlocked(Recipe recipe) {
        if (recipe.getRequiredTechnology() != null && !technologies.isResearched(recipe.getRequiredTechnology())) return false;
        return recipe.getRequiredSecret() == null || lore.isDiscovered(recipe.getRequiredSecret());
    }

    // --- COUNTS ---
    public int getCount(BuildingType type) { return buildings.get(type); }

    public int totalBuildings() {
        int sum = 0;
        for (int n : buildings.values()) sum += n;
        return sum;
    }

    public Map<BuildingType, Integer> getBuildings() {
        return Collections.unmodifiableMap(buildings);
    }

    public void setCount(BuildingType type, int count) {
        if (count < 0) throw new IllegalArgumentException("Negative building count for " + type.getId());
        buildings.put(type, count);
    }
}
