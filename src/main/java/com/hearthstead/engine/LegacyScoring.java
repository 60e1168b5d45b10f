package com.hearthstead.engine;

import com.hearthstead.model.Achievement;
import com.hearthstead.model.LegacyResult;
import com.hearthstead.model.ResourceType;
import com.hearthstead.model.VictoryType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Achievements, the latched victory check and the end-of-game legacy score.
 */
public class LegacyScoring {

    private static final Logger log = LoggerFactory.getLogger(LegacyScoring.class);

    static final double ECONOMIC_VICTORY_WEALTH = 650.0;
    static final double ECOLOGICAL_VICTORY_HEALTH = 85.0;
    static final int CULTURAL_VICTORY_SECRETS = 2;
    static final double CROSS_BONUS_HEALTH = 70.0;
    static final String DEFAULT_TITLE = "Survivor";

    private static final Map<VictoryType, double[]> TITLE_THRESHOLDS = new EnumMap<>(VictoryType.class);
    private static final Map<VictoryType, String[]> TITLES = new EnumMap<>(VictoryType.class);

    static {
        TITLE_THRESHOLDS.put(VictoryType.TECHNOLOGICAL, new double[]{90, 70, 50});
        TITLES.put(VictoryType.TECHNOLOGICAL, new String[]{"Great Innovator", "Technology Leader", "Inventor"});
        TITLE_THRESHOLDS.put(VictoryType.ECONOMIC, new double[]{1000, 500, 200});
        TITLES.put(VictoryType.ECONOMIC, new String[]{"King of Trade", "Master of Economy", "Successful Merchant"});
        TITLE_THRESHOLDS.put(VictoryType.ECOLOGICAL, new double[]{85, 70, 50});
        TITLES.put(VictoryType.ECOLOGICAL, new String[]{"Wise Guardian", "Friend of Nature", "Eco-Builder"});
        TITLE_THRESHOLDS.put(VictoryType.CULTURAL, new double[]{80, 60, 40});
        TITLES.put(VictoryType.CULTURAL, new String[]{"Cultural Icon", "Enlightener", "Knowledge Collector"});
    }

    private final Set<Achievement> unlocked = new LinkedHashSet<>();
    private final ResourceLedger ledger;
    private final EcosystemModel ecosystem;
    private final ProductionPipeline production;
    private final LoreArchive lore;
    private final EffectApplier effects;
    private boolean victoryAchieved = false;
    private VictoryType victoryType;

    public LegacyScoring(ResourceLedger ledger, EcosystemModel ecosystem, ProductionPipeline production,
                         LoreArchive lore, EffectApplier effects) {
        this.ledger = ledger;
        this.ecosystem = ecosystem;
        this.production = production;
        this.lore = lore;
        this.effects = effects;
    }

    public List<Achievement> checkAchievements() {
        List<Achievement> fresh = new ArrayList<>();
        if (production.totalBuildings() >= 3) unlock(Achievement.FIRST_SETTLEMENT, fresh);
        if (ledger.get(ResourceType.INSTRUMENT) >= 20) unlock(Achievement.MASTER_CRAFTER, fresh);
        if (ecosystem.getOverallHealth() >= 80) unlock(Achievement.ECOLOGICAL_BALANCE, fresh);
        if (ledger.getResearch() >= 50) unlock(Achievement.TECH_PIONEER, fresh);
        return fresh;
    }

    private void unlock(Achievement achievement, List<Achievement> fresh) {
        if (!unlocked.add(achievement)) return;
        effects.apply(achievement.getReward());
        fresh.add(achievement);
        log.info("Achievement unlocked: {}", achievement.getDisplayName());
    }

    /**
     * Evaluates the four victory conditions in priority order. Latched: once a victory
     * is recorded every later call returns empty.
     */
    public Optional<VictoryType> checkVictory() {
        if (victoryAchieved) return Optional.empty();
        VictoryType winner = null;
        if (ledger.isResearchComplete()) {
            winner = VictoryType.TECHNOLOGICAL;
        } else if (ledger.totalNonCurrencyWealth() > ECONOMIC_VICTORY_WEALTH) {
            winner = VictoryType.ECONOMIC;
        } else if (ecosystem.getOverallHealth() > ECOLOGICAL_VICTORY_HEALTH) {
            winner = VictoryType.ECOLOGICAL;
        } else if (lore.discoveredCount() >= CULTURAL_VICTORY_SECRETS) {
            winner = VictoryType.CULTURAL;
        }
        if (winner == null) return Optional.empty();
        victoryAchieved = true;
        victoryType = winner;
        log.info("{}!", winner.getLabel());
        return Optional.of(winner);
    }

    /**
     * Scores every category, applies the ecological cross-bonus and picks the best.
     * Ties go to the earlier category.
     */
    public LegacyResult calculateFinalLegacy() {
        Map<VictoryType, Double> scores = new EnumMap<>(VictoryType.class);
        double wine = ledger.get(ResourceType.CURRENCY);
        scores.put(VictoryType.TECHNOLOGICAL, ledger.getResearch());
        scores.put(VictoryType.ECONOMIC, ledger.totalNonCurrencyWealth() * 0.1 + wine * 0.05);
        scores.put(VictoryType.ECOLOGICAL, ecosystem.getOverallHealth());
        scores.put(VictoryType.CULTURAL, unlocked.size() * 25.0);

        if (scores.get(VictoryType.ECOLOGICAL) > CROSS_BONUS_HEALTH) {
            scores.put(VictoryType.ECONOMIC, scores.get(VictoryType.ECONOMIC) * 1.2);
            scores.put(VictoryType.CULTURAL, scores.get(VictoryType.CULTURAL) * 1.1);
        }

        VictoryType best = VictoryType.TECHNOLOGICAL;
        for (VictoryType t : VictoryType.values()) {
            if (scores.get(t) > scores.get(best)) best = t;
        }
        double score = scores.get(best);
        return new LegacyResult(best, titleFor(best, score), score, scores);
    }

    static String titleFor(VictoryType type, double score) {
        double[] thresholds = TITLE_THRESHOLDS.get(type);
        String[] titles = TITLES.get(type);
        for (int i = 0; i < thresholds.length; i++) {
            if (score >= thresholds[i]) return titles[i];
        }
        return DEFAULT_TITLE;
    }

    public boolean isUnlocked(Achievement achievement) { return unlocked.contains(achievement); }

    public List<Achievement> getUnlocked() { return new ArrayList<>(unlocked); }

    public boolean isVictoryAchieved() { return victoryAchieved; }

    public VictoryType getVictoryType() { return victoryType; }

    public void restore(List<Achievement> achievements, boolean victoryAchieved, VictoryType victoryType) {
        unlocked.clear();
        unlocked.addAll(achievements);
        this.victoryAchieved = victoryAchieved;
        this.victoryType = victoryType;
    }
}
