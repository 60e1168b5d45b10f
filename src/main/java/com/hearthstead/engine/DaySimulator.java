package com.hearthstead.engine;

import com.hearthstead.model.Biome;
import com.hearthstead.model.DayPhase;
import com.hearthstead.model.DayReport;
import com.hearthstead.model.RandomEvent;
import com.hearthstead.model.ResourceType;
import com.hearthstead.model.VictoryType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Drives the daily cycle. A day opens at dawn (ecosystem tick, achievements, random event),
 * stays open for player actions, and closes with consumption, mood, population and victory.
 */
public class DaySimulator {

    private static final Logger log = LoggerFactory.getLogger(DaySimulator.class);

    static final double RANDOM_EVENT_CHANCE = 0.12;
    static final double STARVATION_CHANCE = 0.10;
    static final double BIRTH_CHANCE = 0.12;
    static final double BIRTH_HAPPINESS = 70.0;
    static final double FED_HAPPINESS_STEP = 0.5;
    static final double HUNGER_BASE_PENALTY = 2.5;
    static final double HUNGER_PENALTY_PER_UNIT = 0.5;

    private final SettlementClock clock;
    private final ResourceLedger ledger;
    private final Population population;
    private final EcosystemModel ecosystem;
    private final ProductionPipeline production;
    private final MarketModel market;
    private final SettlementModifiers modifiers;
    private final LegacyScoring legacy;
    private final Random random;
    private final List<Consumer<DayReport>> listeners = new CopyOnWriteArrayList<>();

    private double foodPerCapita = 0.4;
    private double happinessDecay = 0.25;
    private int autosaveEvery = 5;
    private double trendDrift = 0.005;
    private double ecoIndustryPenalty = 1.0;

    private DayReport current;

    public DaySimulator(SettlementClock clock, ResourceLedger ledger, Population population,
                        EcosystemModel ecosystem, ProductionPipeline production, MarketModel market,
                        SettlementModifiers modifiers, LegacyScoring legacy, Random random) {
        this.clock = clock;
        this.ledger = ledger;
        this.population = population;
        this.ecosystem = ecosystem;
        this.production = production;
        this.market = market;
        this.modifiers = modifiers;
        this.legacy = legacy;
        this.random = random;
    }

    /**
     * Runs the dawn phases and opens the day for actions. Calling it twice on the same day
     * does nothing the second time. A day restored in the action phase already had its dawn,
     * so it only gets a fresh report.
     */
    public DayReport beginDay() {
        if (clock.getPhase() == DayPhase.ACTIONS) {
            if (current == null) current = new DayReport(clock.getDay());
            return current;
        }
        current = new DayReport(clock.getDay());

        ecosystem.tick(production.getBuildings(), population.totalAssigned(),
                ecoIndustryPenalty, modifiers.getPollutionFactor());
        current.achievementsUnlocked.addAll(legacy.checkAchievements());
        current.randomEvent = rollRandomEvent().orElse(null);

        clock.setPhase(DayPhase.ACTIONS);
        return current;
    }

    Optional<RandomEvent> rollRandomEvent() {
        if (random.nextDouble() >= RANDOM_EVENT_CHANCE) return Optional.empty();
        RandomEvent[] table = RandomEvent.values();
        RandomEvent event = table[random.nextInt(table.length)];
        applyEvent(event);
        return Optional.of(event);
    }

    void applyEvent(RandomEvent event) {
        for (Map.Entry<ResourceType, Double> delta : event.getDeltas().entrySet()) {
            ledger.adjust(delta.getKey(), delta.getValue());
        }
        if (event.getForestDamage() > 0) {
            ecosystem.damage(Biome.FOREST, event.getForestDamage());
        }
        log.info("Event on day {}: {}", clock.getDay(), event.getText());
    }

    /**
     * Closes the current day, opening it first if no action did, and moves the clock on.
     */
    public DayReport endDay() {
        DayReport report = beginDay();

        endOfDay(report);
        market.driftTrend(trendDrift);
        checkVictory();

        clock.nextDay();
        clock.setPhase(DayPhase.DAWN);
        report.autosaveDue = autosaveEvery > 0 && clock.getDay() % autosaveEvery == 0;
        current = null;

        for (Consumer<DayReport> listener : listeners) {
            listener.accept(report);
        }
        return report;
    }

    /** Food, mood and headcount for the closing day. */
    void endOfDay(DayReport report) {
        double need = population.getTotal() * foodPerCapita;
        double food = ledger.get(ResourceType.FOOD);
        if (food >= need) {
            ledger.adjust(ResourceType.FOOD, -need);
            population.changeHappiness(FED_HAPPINESS_STEP);
        } else {
            double deficit = need - food;
            ledger.set(ResourceType.FOOD, 0.0);
            population.changeHappiness(-(HUNGER_BASE_PENALTY + HUNGER_PENALTY_PER_UNIT * deficit));
            report.foodShortage = true;
            if (random.nextDouble() < STARVATION_CHANCE && population.decline()) {
                report.starvationDeath = true;
                log.info("A resident died of hunger, population {}", population.getTotal());
            }
        }

        population.relaxHappiness(happinessDecay);

        if (population.getHappiness() >= BIRTH_HAPPINESS && random.nextDouble() < BIRTH_CHANCE) {
            population.grow();
            report.birth = true;
            log.info("A child was born, population {}", population.getTotal());
        }
    }

    /** A victory reached while a day is open is reported when that day ends. */
    public Optional<VictoryType> checkVictory() {
        Optional<VictoryType> victory = legacy.checkVictory();
        if (victory.isPresent() && current != null) {
            current.victory = victory.get();
        }
        return victory;
    }

    public void addDayListener(Consumer<DayReport> listener) { listeners.add(listener); }

    public void setFoodPerCapita(double foodPerCapita) { this.foodPerCapita = foodPerCapita; }
    public void setHappinessDecay(double happinessDecay) { this.happinessDecay = happinessDecay; }
    public void setAutosaveEvery(int autosaveEvery) { this.autosaveEvery = autosaveEvery; }
    public void setTrendDrift(double trendDrift) { this.trendDrift = trendDrift; }

    public double getEcoIndustryPenalty() { return ecoIndustryPenalty; }
    public void setEcoIndustryPenalty(double ecoIndustryPenalty) { this.ecoIndustryPenalty = ecoIndustryPenalty; }
}
