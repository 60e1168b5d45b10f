package com.hearthstead.service;

import com.hearthstead.config.SettlementProperties;
import com.hearthstead.engine.SettlementEngine;
import com.hearthstead.model.ActionResult;
import com.hearthstead.model.BuildingType;
import com.hearthstead.model.CharacterProfile;
import com.hearthstead.model.DayReport;
import com.hearthstead.model.Difficulty;
import com.hearthstead.model.LegacyResult;
import com.hearthstead.model.LoreSecret;
import com.hearthstead.model.MarketQuote;
import com.hearthstead.model.MiningAction;
import com.hearthstead.model.Quest;
import com.hearthstead.model.Recipe;
import com.hearthstead.model.ResourceType;
import com.hearthstead.model.SettlementSnapshot;
import com.hearthstead.model.SettlementState;
import com.hearthstead.model.TechnologyId;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Owns the live settlement. Every call is serialised on this service, and every
 * identifier coming from a client is resolved here.
 */
@Service
public class GameService {

    private static final Logger log = LoggerFactory.getLogger(GameService.class);

    private final PersistenceService persistenceService;
    private final SettlementProperties props;
    private final List<Consumer<DayReport>> dayListeners = new CopyOnWriteArrayList<>();
    private SettlementEngine engine;

    public GameService(PersistenceService persistenceService, SettlementProperties props) {
        this.persistenceService = persistenceService;
        this.props = props;
    }

    @PostConstruct
    public synchronized void init() {
        SettlementState state = persistenceService.load();
        if (state != null) {
            try {
                attach(SettlementEngine.fromState(props, state));
                log.info("Resumed settlement on day {}", engine.getClock().getDay());
                return;
            } catch (IllegalArgumentException e) {
                log.warn("Save rejected ({}), starting a new settlement", e.getMessage());
            }
        }
        attach(SettlementEngine.newWorld(props));
    }

    @PreDestroy
    public synchronized void cleanup() {
        save();
    }

    public synchronized boolean save() {
        return persistenceService.save(engine.toState());
    }

    public synchronized SettlementSnapshot newGame(Difficulty difficulty) {
        attach(SettlementEngine.newWorld(props, difficulty));
        save();
        return engine.snapshot();
    }

    private void attach(SettlementEngine next) {
        this.engine = next;
        engine.addDayListener(this::onDayEnd);
    }

    // Runs inside endDay, so the lock is already held
    private void onDayEnd(DayReport report) {
        if (report.autosaveDue) {
            persistenceService.save(engine.toState());
        }
        for (Consumer<DayReport> listener : dayListeners) {
            listener.accept(report);
        }
    }

    /** Listeners survive {@link #newGame}. */
    public void addDayListener(Consumer<DayReport> listener) {
        dayListeners.add(listener);
    }

    // --- QUERIES ---

    public synchronized SettlementSnapshot snapshot() {
        return engine.snapshot();
    }

    public synchronized List<MarketQuote> quotes() {
        return engine.quotes();
    }

    public synchronized Optional<MarketQuote> quote(String resourceId) {
        return ResourceType.fromId(resourceId).map(engine::quote);
    }

    public synchronized LegacyResult legacy() {
        return engine.calculateFinalLegacy();
    }

    // --- ACTIONS ---

    public synchronized ActionResult mine(String actionId) {
        return MiningAction.fromId(actionId)
                .map(engine::mine)
                .orElseGet(() -> unknown("action", actionId));
    }

    public synchronized ActionResult build(String buildingId) {
        if ("storehouse".equalsIgnoreCase(buildingId)) {
            return engine.buildStorehouse();
        }
        return BuildingType.fromId(buildingId)
                .map(engine::build)
                .orElseGet(() -> unknown("building", buildingId));
    }

    public synchronized ActionResult buildStorehouse() {
        return engine.buildStorehouse();
    }

    public synchronized ActionResult assignWorkers(String buildingId, int workers) {
        return BuildingType.fromId(buildingId)
                .map(b -> engine.assignWorkers(b, workers))
                .orElseGet(() -> unknown("building", buildingId));
    }

    public synchronized ActionResult craft(String recipeId) {
        return Recipe.fromId(recipeId)
                .map(engine::craft)
                .orElseGet(() -> unknown("recipe", recipeId));
    }

    public synchronized ActionResult trade(String resourceId, double amount, boolean buying) {
        return ResourceType.fromId(resourceId)
                .map(r -> engine.trade(r, amount, buying))
                .orElseGet(() -> unknown("resource", resourceId));
    }

    public synchronized ActionResult researchTechnology(String technologyId) {
        return TechnologyId.fromId(technologyId)
                .map(engine::researchTechnology)
                .orElseGet(() -> unknown("technology", technologyId));
    }

    public synchronized ActionResult researchFromStock(String resourceId) {
        return ResourceType.fromId(resourceId)
                .map(engine::researchFromStock)
                .orElseGet(() -> unknown("resource", resourceId));
    }

    public synchronized ActionResult discoverSecret(String secretId) {
        return LoreSecret.fromId(secretId)
                .map(engine::discoverSecret)
                .orElseGet(() -> unknown("secret", secretId));
    }

    public synchronized ActionResult talk(String characterId) {
        return CharacterProfile.fromId(characterId)
                .map(engine::talk)
                .orElseGet(() -> unknown("character", characterId));
    }

    public synchronized ActionResult tradeWithCharacter(String characterId, String resourceId, double amount) {
        Optional<CharacterProfile> character = CharacterProfile.fromId(characterId);
        if (character.isEmpty()) return unknown("character", characterId);
        Optional<ResourceType> resource = ResourceType.fromId(resourceId);
        if (resource.isEmpty()) return unknown("resource", resourceId);
        return engine.tradeWithCharacter(character.get(), resource.get(), amount);
    }

    public synchronized ActionResult completeQuest(String characterId, String questId) {
        Optional<CharacterProfile> character = CharacterProfile.fromId(characterId);
        if (character.isEmpty()) return unknown("character", characterId);
        Optional<Quest> quest = Quest.fromId(questId);
        if (quest.isEmpty()) return unknown("quest", questId);
        return engine.completeQuest(character.get(), quest.get());
    }

    public synchronized ActionResult toggleMultiplier() {
        int multiplier = engine.toggleMultiplier();
        return ActionResult.success("Multiplier x" + multiplier);
    }

    public synchronized DayReport endDay() {
        return engine.endDay();
    }

    private static ActionResult unknown(String kind, String id) {
        log.debug("Unknown {} '{}'", kind, id);
        return ActionResult.invalidReference("Unknown " + kind + " '" + id + "'");
    }

    SettlementEngine getEngine() {
        return engine;
    }
}
