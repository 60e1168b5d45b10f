package com.hearthstead.engine;

import com.hearthstead.model.Effect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single dispatch point for technology, secret and achievement effects.
 */
public class EffectApplier {

    private static final Logger log = LoggerFactory.getLogger(EffectApplier.class);

    private final SettlementModifiers modifiers;
    private final ResourceLedger ledger;
    private final EcosystemModel ecosystem;
    private final MarketModel market;
    private final Population population;

    public EffectApplier(SettlementModifiers modifiers, ResourceLedger ledger, EcosystemModel ecosystem,
                         MarketModel market, Population population) {
        this.modifiers = modifiers;
        this.ledger = ledger;
        this.ecosystem = ecosystem;
        this.market = market;
        this.population = population;
    }

    public void apply(Effect effect) {
        double v = effect.getValue();
        switch (effect.getKind()) {
            case FOOD_PRODUCTION_FLOOR:
                modifiers.setFoodProduction(Math.max(modifiers.getFoodProduction(), v));
                break;
            case MINING_EFFICIENCY_FLOOR:
                modifiers.setMiningEfficiency(Math.max(modifiers.getMiningEfficiency(), v));
                break;
            case CRAFT_SPEED_FLOOR:
                modifiers.setCraftSpeed(Math.max(modifiers.getCraftSpeed(), v));
                break;
            case RESEARCH_BONUS_FLOOR:
                modifiers.setResearchBonus(Math.max(modifiers.getResearchBonus(), v));
                break;
            case POLLUTION_FLOOR:
                modifiers.setPollutionFactor(Math.max(modifiers.getPollutionFactor(), v));
                break;
            case CRAFT_SPEED_COMPOUND:
                modifiers.setCraftSpeed(modifiers.getCraftSpeed() * v);
                break;
            case MARKET_TREND_COMPOUND:
                market.setTrend(market.getTrend() * v);
                break;
            case HAPPINESS_BONUS:
                population.changeHappiness(v);
                break;
            case RESOURCE_GRANT:
                ledger.adjust(effect.getResource(), v);
                break;
            case BIOME_RESTORE:
                ecosystem.restoreAll(v);
                break;
            default:
                throw new IllegalStateException("Unhandled effect " + effect.getKind());
        }
        log.debug("Applied effect {}", effect);
    }
}
