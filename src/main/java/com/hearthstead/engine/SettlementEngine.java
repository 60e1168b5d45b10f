package com.hearthstead.engine;

import com.hearthstead.config.SettlementProperties;
import com.hearthstead.model.Achievement;
import com.hearthstead.model.ActionResult;
import com.hearthstead.model.Biome;
import com.hearthstead.model.BuildingType;
import com.hearthstead.model.CharacterProfile;
import com.hearthstead.model.DayPhase;
import com.hearthstead.model.DayReport;
import com.hearthstead.model.Difficulty;
import com.hearthstead.model.LegacyResult;
import com.hearthstead.model.LoreSecret;
import com.hearthstead.model.MarketQuote;
import com.hearthstead.model.MiningAction;
import com.hearthstead.model.NpcCharacter;
import com.hearthstead.model.PlayerAction;
import com.hearthstead.model.Quest;
import com.hearthstead.model.Recipe;
import com.hearthstead.model.ResourceType;
import com.hearthstead.model.SettlementSnapshot;
import com.hearthstead.model.SettlementState;
import com.hearthstead.model.TechnologyId;
import com.hearthstead.model.TradeOffer;
import com.hearthstead.model.VictoryType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * One settlement and everything that simulates it. All state lives here; nothing is static.
 * Not thread-safe: callers that share an engine must serialise access.
 */
public class SettlementEngine {

    private static final Logger log = LoggerFactory.getLogger(SettlementEngine.class);

    static final int TRADE_RELATIONSHIP_BONUS = 2;

    private final SettlementClock clock = new SettlementClock();
    private final SettlementModifiers modifiers = new SettlementModifiers();
    private final ResourceLedger ledger = new ResourceLedger();
    private final EcosystemModel ecosystem = new EcosystemModel();
    private final EventCalendar calendar;
    private final MarketModel market;
    private final Population population;
    private final EffectApplier effects;
    private final TechnologyTree technologies;
    private final LoreArchive lore;
    private final RelationshipModel relationships = new RelationshipModel();
    private final ProductionPipeline production;
    private final LegacyScoring legacy;
    private final DaySimulator days;

    SettlementEngine(SettlementProperties props, Random random, EventCalendar calendar) {
        this.calendar = calendar;
        this.market = new MarketModel(ledger, calendar, clock, random);
        this.population = new Population(props.getBasePopulation());
        this.effects = new EffectApplier(modifiers, ledger, ecosystem, market, population);
        this.technologies = new TechnologyTree(TechnologyTree.defaultCatalog(), ledger, modifiers, effects);
        this.lore = new LoreArchive(ledger, effects);
        this.production = new ProductionPipeline(ledger, population, ecosystem, calendar, clock, modifiers,
                technologies, lore);
        this.legacy = new LegacyScoring(ledger, ecosystem, production, lore, effects);
        this.days = new DaySimulator(clock, ledger, population, ecosystem, production, market, modifiers,
                legacy, random);
        days.setFoodPerCapita(props.getFoodPerCapita());
        days.setHappinessDecay(props.getHappinessDecay());
        days.setAutosaveEvery(props.getAutosaveEvery());
        days.setTrendDrift(props.getMarket().getTrendDrift());
    }

    private static Random randomFor(SettlementProperties props) {
        return props.getRngSeed() != null ? new Random(props.getRngSeed()) : new Random();
    }

    /** A fresh world: new event calendar, starting stock adjusted for the difficulty. */
    public static SettlementEngine newWorld(SettlementProperties props) {
        return newWorld(props, props.getDifficulty());
    }

    public static SettlementEngine newWorld(SettlementProperties props, Difficulty difficulty) {
        Random random = randomFor(props);
        SettlementEngine engine = new SettlementEngine(props, random, EventCalendar.generate(random));
        engine.applyDifficulty(difficulty);
        log.info("New settlement on {} difficulty, primary event on day {}",
                difficulty, engine.calendar.getPrimaryStart());
        return engine;
    }

    /**
     * Rebuilds an engine from saved state. The saved event calendar is reused as-is.
     * @throws IllegalArgumentException if the numbers do not add up
     */
    public static SettlementEngine fromState(SettlementProperties props, SettlementState state) {
        if (state.events == null) {
            throw new IllegalArgumentException("Save has no event calendar");
        }
        EventCalendar calendar = new EventCalendar(state.events.primaryStart, state.events.secondaryStart,
                state.events.duration);
        SettlementEngine engine = new SettlementEngine(props, randomFor(props), calendar);
        engine.restore(state);
        return engine;
    }

    void applyDifficulty(Difficulty difficulty) {
        if (difficulty == Difficulty.EASY) {
            ledger.adjust(ResourceType.FOOD, 25);
            ledger.adjust(ResourceType.WOOD, 20);
            ledger.adjust(ResourceType.WINE, 15);
            days.setEcoIndustryPenalty(0.8);
            population.changeHappiness(10);
        } else if (difficulty == Difficulty.HARD) {
            ledger.adjust(ResourceType.FOOD, -5);
            days.setEcoIndustryPenalty(1.2);
            population.changeHappiness(-5);
        }
    }

    // --- DAY CYCLE ---

    public DayReport beginDay() {
        return days.beginDay();
    }

    public DayReport endDay() {
        return days.endDay();
    }

    /** Closes the current day and opens the next one. */
    public DayReport advanceDay() {
        DayReport report = days.endDay();
        days.beginDay();
        return report;
    }

    // Actions always happen inside an open day
    private void openDay() {
        if (clock.getPhase() == DayPhase.DAWN) {
            days.beginDay();
        }
    }

    public void addDayListener(Consumer<DayReport> listener) {
        days.addDayListener(listener);
    }

    // --- ACTIONS ---

    public ActionResult mine(MiningAction action) {
        openDay();
        Map<ResourceType, Double> produced = production.mine(action);
        if (action == MiningAction.CHOP_WOOD) {
            relationships.notifyCharactersWithTrait("environmentalist", PlayerAction.DEFORESTATION);
        }
        StringBuilder sb = new StringBuilder(action.getId()).append(":");
        produced.forEach((r, amount) -> sb.append(String.format(" %s +%.1f", r.getId(), amount)));
        return ActionResult.success(sb.toString());
    }

    public ActionResult build(BuildingType type) {
        openDay();
        ActionResult result = production.build(type);
        if (result.isSuccess()) {
            if (type == BuildingType.LUMBER_MILL) {
                relationships.notifyCharactersWithTrait("environmentalist", PlayerAction.BUILD_SAWMILL);
            } else if (type == BuildingType.HERBALIST_HUT) {
                relationships.notifyCharactersWithTrait("scholar", PlayerAction.BUILD_HERBALIST);
            }
        }
        return result;
    }

    public ActionResult buildStorehouse() {
        openDay();
        return production.buildStorehouse();
    }

    public ActionResult assignWorkers(BuildingType type, int workers) {
        openDay();
        return production.assignWorkers(type, workers);
    }

    public ActionResult craft(Recipe recipe) {
        openDay();
        return production.craft(recipe);
    }

    public ActionResult trade(ResourceType resource, double amount, boolean buying) {
        openDay();
        return market.trade(resource, amount, buying);
    }

    public MarketQuote quote(ResourceType resource) {
        return market.quote(resource);
    }

    public List<MarketQuote> quotes() {
        List<MarketQuote> quotes = new ArrayList<>();
        for (ResourceType r : ResourceType.values()) {
            if (!r.isCurrency()) quotes.add(market.quote(r));
        }
        return quotes;
    }

    public ActionResult researchTechnology(TechnologyId id) {
        openDay();
        ActionResult result = technologies.research(id);
        if (result.isSuccess() && id == TechnologyId.ECOLOGY) {
            relationships.notifyCharactersWithTrait("environmentalist", PlayerAction.RESEARCH_ECOLOGY);
        }
        return result;
    }

    public ActionResult researchFromStock(ResourceType resource) {
        openDay();
        ActionResult result = technologies.researchFromStock(resource);
        if (result.isSuccess()) {
            days.checkVictory();
        }
        return result;
    }

    public ActionResult discoverSecret(LoreSecret secret) {
        openDay();
        return lore.discover(secret);
    }

    public ActionResult talk(CharacterProfile profile) {
        openDay();
        return ActionResult.success(relationships.talk(profile));
    }

    /**
     * Buys from a character's own offer table at market price times the character's markup.
     */
    public ActionResult tradeWithCharacter(CharacterProfile profile, ResourceType resource, double amount) {
        openDay();
        NpcCharacter character = relationships.get(profile);
        Optional<TradeOffer> offer = profile.getOffers().stream()
                .filter(o -> o.getResource() == resource)
                .findFirst();
        if (offer.isEmpty()) {
            return ActionResult.invalidReference(character.getName() + " does not sell " + resource.getId());
        }
        if (!(amount > 0) || Double.isInfinite(amount)) {
            return ActionResult.invalidQuantity("Trade amount must be positive");
        }
        if (!relationships.canTrade(profile)) {
            return ActionResult.prerequisiteUnmet(character.getName() + " refuses to trade with you");
        }
        double unitPrice = market.currentPrice(resource) * offer.get().getMarkup()
                * relationships.tradeDiscount(profile);
        ActionResult result = market.purchase(resource, amount, unitPrice);
        if (result.isSuccess()) {
            character.changeRelationship(TRADE_RELATIONSHIP_BONUS);
        }
        return result;
    }

    public ActionResult completeQuest(CharacterProfile profile, Quest quest) {
        openDay();
        NpcCharacter character = relationships.get(profile);
        if (!profile.getQuests().contains(quest)) {
            return ActionResult.invalidReference(character.getName() + " has no quest " + quest.getId());
        }
        if (!character.hasOpenQuest(quest)) {
            return ActionResult.alreadyUnlocked(quest.getTitle() + " is already complete");
        }
        if (!relationships.canTakeQuests(profile)) {
            return ActionResult.prerequisiteUnmet(character.getName() + " will not give you quests");
        }
        if (!questConditionMet(quest)) {
            return ActionResult.prerequisiteUnmet(quest.getTitle() + " is not done yet");
        }
        character.closeQuest(quest);
        character.changeRelationship(quest.getRelationshipReward());
        effects.apply(quest.getReward());
        log.info("Quest completed: {} for {}", quest.getTitle(), character.getName());
        return ActionResult.success("Completed " + quest.getTitle());
    }

    boolean questConditionMet(Quest quest) {
        double threshold = quest.getThreshold();
        switch (quest.getCondition()) {
            case FOREST_HEALTH:
                return ecosystem.getHealth(Biome.FOREST) >= threshold;
            case BIODIVERSITY:
                return ecosystem.getBiodiversity() >= threshold;
            case STOCK:
                return ledger.get(quest.getConditionResource()) >= threshold;
            case DISCOVERED_SECRETS:
                return lore.discoveredCount() >= threshold;
            case RESEARCHED_TECHNOLOGIES:
                return technologies.getResearched().size() >= threshold;
            default:
                throw new IllegalStateException("Unhandled quest condition " + quest.getCondition());
        }
    }

    public int toggleMultiplier() {
        return production.toggleMultiplier();
    }

    public LegacyResult calculateFinalLegacy() {
        return legacy.calculateFinalLegacy();
    }

    public Optional<VictoryType> checkVictory() {
        return days.checkVictory();
    }

    // --- VIEWS ---

    public SettlementSnapshot snapshot() {
        SettlementSnapshot s = new SettlementSnapshot();
        s.day = clock.getDay();
        s.phase = clock.getPhase();
        s.multiplier = production.currentMultiplier();
        s.storageCapacity = ledger.getStorageCapacity();
        s.storageCount = ledger.getStorageCount();
        s.population = population.getTotal();
        s.idleWorkers = population.getIdle();
        s.happiness = population.getHappiness();
        s.researchProgress = ledger.getResearch();
        s.researchComplete = ledger.isResearchComplete();
        s.hostility = production.hostilityModifier();
        s.victoryAchieved = legacy.isVictoryAchieved();
        s.victoryType = legacy.getVictoryType();

        s.resources = new LinkedHashMap<>();
        ledger.getStock().forEach((r, v) -> s.resources.put(r.getId(), v));
        s.buildings = new LinkedHashMap<>();
        production.getBuildings().forEach((b, n) -> s.buildings.put(b.getId(), n));
        s.workers = new LinkedHashMap<>();
        population.getAssignments().forEach((b, n) -> s.workers.put(b.getId(), n));
        s.researchedTechs = idsOf(technologies.getResearched(), TechnologyId::getId);
        s.discoveredLore = idsOf(lore.getDiscovered(), LoreSecret::getId);
        s.achievements = idsOf(legacy.getUnlocked(), Achievement::getId);

        SettlementSnapshot.EcosystemSummary eco = new SettlementSnapshot.EcosystemSummary();
        eco.overallHealth = ecosystem.getOverallHealth();
        eco.tier = ecosystem.getTier();
        eco.productionModifier = ecosystem.getProductionModifier();
        eco.pollution = ecosystem.getPollution();
        eco.biodiversity = ecosystem.getBiodiversity();
        eco.biomes = new LinkedHashMap<>();
        ecosystem.getBiomeHealth().forEach((b, v) -> eco.biomes.put(b.getId(), v));
        s.ecosystem = eco;
        return s;
    }

    private static <T> List<String> idsOf(List<T> items, Function<T, String> id) {
        List<String> ids = new ArrayList<>();
        for (T item : items) ids.add(id.apply(item));
        return ids;
    }

    // --- PERSISTENCE ---

    public SettlementState toState() {
        SettlementState st = new SettlementState();
        st.day = clock.getDay();
        st.phase = clock.getPhase().name();
        st.multiplierMode = production.getMultiplierMode();
        st.researchProgress = ledger.getResearch();
        st.researchComplete = ledger.isResearchComplete();
        st.victoryAchieved = legacy.isVictoryAchieved();
        st.victoryType = legacy.getVictoryType() != null ? legacy.getVictoryType().name() : null;

        st.craftSpeedMultiplier = modifiers.getCraftSpeed();
        st.researchBonus = modifiers.getResearchBonus();
        st.foodProductionMultiplier = modifiers.getFoodProduction();
        st.miningEfficiency = modifiers.getMiningEfficiency();
        st.pollutionFactor = modifiers.getPollutionFactor();
        st.happiness = population.getHappiness();
        st.ecoIndustryPenalty = days.getEcoIndustryPenalty();

        ledger.getStock().forEach((r, v) -> st.resources.put(r.getId(), v));
        production.getBuildings().forEach((b, n) -> st.buildings.put(b.getId(), n));
        st.storageCount = ledger.getStorageCount();
        st.population = population.getTotal();
        st.idleWorkers = population.getIdle();
        population.getAssignments().forEach((b, n) -> st.workers.put(b.getId(), n));

        ecosystem.getBiomeHealth().forEach((b, v) -> st.biomeHealth.put(b.getId(), v));
        st.pollution = ecosystem.getPollution();
        st.biodiversity = ecosystem.getBiodiversity();
        st.researchedTechs = idsOf(technologies.getResearched(), TechnologyId::getId);
        st.discoveredLore = idsOf(lore.getDiscovered(), LoreSecret::getId);
        st.achievements = idsOf(legacy.getUnlocked(), Achievement::getId);
        for (NpcCharacter c : relationships.getAll()) {
            SettlementState.CharacterData data = new SettlementState.CharacterData();
            data.id = c.getId();
            data.relationship = c.getRelationship();
            data.quests = idsOf(c.getOpenQuests(), Quest::getId);
            data.memory = new ArrayList<>(c.getMemory());
            st.characters.add(data);
        }

        st.marketTrend = market.getTrend();
        market.getAllHistory().forEach((r, prices) -> st.priceHistory.put(r.getId(), new ArrayList<>(prices)));

        st.events.primaryStart = calendar.getPrimaryStart();
        st.events.secondaryStart = calendar.getSecondaryStart();
        st.events.duration = calendar.getDuration();
        return st;
    }

    void restore(SettlementState st) {
        if (st.day < 0 || st.storageCount < 1) {
            throw new IllegalArgumentException("Invalid day or storage count in save");
        }
        clock.setDay(st.day);
        clock.setPhase(st.phase != null ? DayPhase.valueOf(st.phase) : DayPhase.DAWN);
        production.setMultiplierMode(st.multiplierMode);
        ledger.setResearch(st.researchProgress);
        ledger.setResearchComplete(st.researchComplete);

        modifiers.setCraftSpeed(st.craftSpeedMultiplier);
        modifiers.setResearchBonus(st.researchBonus);
        modifiers.setFoodProduction(st.foodProductionMultiplier);
        modifiers.setMiningEfficiency(st.miningEfficiency);
        modifiers.setPollutionFactor(st.pollutionFactor);
        population.setHappiness(st.happiness);
        days.setEcoIndustryPenalty(st.ecoIndustryPenalty);

        for (Map.Entry<String, Double> e : required(st.resources, "resources").entrySet()) {
            Optional<ResourceType> r = ResourceType.fromId(e.getKey());
            if (r.isPresent()) {
                if (e.getValue() == null || e.getValue() < 0) {
                    throw new IllegalArgumentException("Negative stock for " + e.getKey());
                }
                ledger.set(r.get(), e.getValue());
            } else {
                log.warn("Skipping unknown resource '{}' in save", e.getKey());
            }
        }
        for (Map.Entry<String, Integer> e : required(st.buildings, "buildings").entrySet()) {
            Optional<BuildingType> b = BuildingType.fromId(e.getKey());
            if (b.isPresent()) {
                int count = required(e.getValue(), "count of " + e.getKey());
                if (count < 0) {
                    throw new IllegalArgumentException("Negative building count for " + e.getKey());
                }
                production.setCount(b.get(), count);
            } else {
                log.warn("Skipping unknown building '{}' in save", e.getKey());
            }
        }
        ledger.setStorageCount(st.storageCount);

        Map<BuildingType, Integer> workers = new EnumMap<>(BuildingType.class);
        for (Map.Entry<String, Integer> e : required(st.workers, "workers").entrySet()) {
            Optional<BuildingType> b = BuildingType.fromId(e.getKey());
            if (b.isPresent()) {
                workers.put(b.get(), required(e.getValue(), "workers of " + e.getKey()));
            } else {
                log.warn("Skipping workers of unknown building '{}' in save", e.getKey());
            }
        }
        population.restore(st.population, workers);
        if (population.getIdle() != st.idleWorkers) {
            log.warn("Saved idle count {} disagrees with assignments, using {}", st.idleWorkers, population.getIdle());
        }

        for (Map.Entry<String, Double> e : required(st.biomeHealth, "biome health").entrySet()) {
            Optional<Biome> biome = Biome.fromId(e.getKey());
            if (biome.isPresent()) {
                ecosystem.setHealth(biome.get(), required(e.getValue(), "health of " + e.getKey()));
            } else {
                log.warn("Skipping unknown biome '{}' in save", e.getKey());
            }
        }
        ecosystem.setPollution(st.pollution);
        ecosystem.setBiodiversity(st.biodiversity);

        technologies.restore(resolve(st.researchedTechs, TechnologyId::fromId, "technology"));
        lore.restore(resolve(st.discoveredLore, LoreSecret::fromId, "secret"));
        VictoryType victoryType = st.victoryType != null ? VictoryType.valueOf(st.victoryType) : null;
        legacy.restore(resolve(st.achievements, Achievement::fromId, "achievement"), st.victoryAchieved, victoryType);

        for (SettlementState.CharacterData data : required(st.characters, "characters")) {
            required(data, "character entry");
            Optional<CharacterProfile> profile = CharacterProfile.fromId(data.id);
            if (profile.isEmpty()) {
                log.warn("Skipping unknown character '{}' in save", data.id);
                continue;
            }
            relationships.get(profile.get()).restore(data.relationship, required(data.memory, "memory of " + data.id),
                    resolve(data.quests, Quest::fromId, "quest"));
        }

        market.setTrend(st.marketTrend);
        for (Map.Entry<String, List<Double>> e : required(st.priceHistory, "price history").entrySet()) {
            List<Double> prices = required(e.getValue(), "prices of " + e.getKey());
            if (prices.contains(null)) {
                throw new IllegalArgumentException("Missing price in history of " + e.getKey());
            }
            ResourceType.fromId(e.getKey()).ifPresent(r -> market.restoreHistory(r, prices));
        }
    }

    private static <T> T required(T value, String what) {
        if (value == null) {
            throw new IllegalArgumentException("Save is missing " + what);
        }
        return value;
    }

    private static <T> List<T> resolve(List<String> ids, Function<String, Optional<T>> lookup,
                                       String kind) {
        List<T> out = new ArrayList<>();
        if (ids == null) return out;
        for (String id : ids) {
            Optional<T> item = lookup.apply(id);
            if (item.isPresent()) {
                out.add(item.get());
            } else {
                log.warn("Skipping unknown {} '{}' in save", kind, id);
            }
        }
        return out;
    }

    // --- COMPONENTS ---

    public SettlementClock getClock() { return clock; }
    public SettlementModifiers getModifiers() { return modifiers; }
    public ResourceLedger getLedger() { return ledger; }
    public EcosystemModel getEcosystem() { return ecosystem; }
    public EventCalendar getCalendar() { return calendar; }
    public MarketModel getMarket() { return market; }
    public Population getPopulation() { return population; }
    public TechnologyTree getTechnologies() { return technologies; }
    public LoreArchive getLore() { return lore; }
    public RelationshipModel getRelationships() { return relationships; }
    public ProductionPipeline getProduction() { return production; }
    public LegacyScoring getLegacy() { return legacy; }
    public DaySimulator getDays() { return days; }
}
