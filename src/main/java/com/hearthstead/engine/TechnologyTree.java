package com.hearthstead.engine;

import com.hearthstead.model.ActionResult;
import com.hearthstead.model.Cost;
import com.hearthstead.model.Effect;
import com.hearthstead.model.EffectKind;
import com.hearthstead.model.ResourceType;
import com.hearthstead.model.Technology;
import com.hearthstead.model.TechnologyId;
import com.hearthstead.model.UnlockState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Prerequisite graph of technologies plus research-by-resource.
 * <p>
 * A technology is AVAILABLE when it is not researched, every prerequisite is researched,
 * its resource cost is affordable and the research counter has reached its threshold.
 * Researching debits the resource cost only; the research threshold is a gate.
 */
public class TechnologyTree {

    private static final Logger log = LoggerFactory.getLogger(TechnologyTree.class);

    private static final double RESEARCH_YIELD = 0.02;

    private final Map<TechnologyId, Technology> catalog;
    private final Set<TechnologyId> researched = new LinkedHashSet<>();
    private final ResourceLedger ledger;
    private final SettlementModifiers modifiers;
    private final EffectApplier effects;

    public TechnologyTree(Map<TechnologyId, Technology> catalog, ResourceLedger ledger,
                          SettlementModifiers modifiers, EffectApplier effects) {
        validate(catalog);
        this.catalog = Collections.unmodifiableMap(new EnumMap<>(catalog));
        this.ledger = ledger;
        this.modifiers = modifiers;
        this.effects = effects;
    }

    public static Map<TechnologyId, Technology> defaultCatalog() {
        Map<TechnologyId, Technology> c = new EnumMap<>(TechnologyId.class);
        c.put(TechnologyId.BASIC_AGRICULTURE, new Technology(TechnologyId.BASIC_AGRICULTURE,
                "Basic Agriculture", "Better ways of growing food",
                Cost.of(Map.of(), 20.0), Set.of(),
                List.of(Effect.of(EffectKind.FOOD_PRODUCTION_FLOOR, 1.5))));
        c.put(TechnologyId.ADVANCED_MINING, new Technology(TechnologyId.ADVANCED_MINING,
                "Advanced Mining", "Efficient extraction methods",
                Cost.of(Map.of(ResourceType.INSTRUMENT, 5.0), 40.0), Set.of(TechnologyId.BASIC_AGRICULTURE),
                List.of(Effect.of(EffectKind.MINING_EFFICIENCY_FLOOR, 1.6))));
        c.put(TechnologyId.ECOLOGY, new Technology(TechnologyId.ECOLOGY,
                "Ecology", "Understanding the balance of nature",
                Cost.of(Map.of(), 60.0), Set.of(TechnologyId.BASIC_AGRICULTURE),
                List.of(Effect.of(EffectKind.HAPPINESS_BONUS, 2.0))));
        c.put(TechnologyId.INDUSTRIAL_REVOLUTION, new Technology(TechnologyId.INDUSTRIAL_REVOLUTION,
                "Industrial Revolution", "Mass production and automation",
                Cost.of(Map.of(ResourceType.STEEL, 20.0, ResourceType.COAL, 30.0), 100.0),
                Set.of(TechnologyId.ADVANCED_MINING),
                List.of(Effect.of(EffectKind.CRAFT_SPEED_COMPOUND, 1.5),
                        Effect.of(EffectKind.POLLUTION_FLOOR, 1.2))));
        return c;
    }

    /**
     * Every prerequisite must exist in the catalogue and the graph must be acyclic.
     */
    static void validate(Map<TechnologyId, Technology> catalog) {
        for (Technology t : catalog.values()) {
            for (TechnologyId req : t.getPrerequisites()) {
                if (!catalog.containsKey(req)) {
                    throw new IllegalStateException(t.getId() + " requires unknown technology " + req);
                }
            }
        }
        Set<TechnologyId> done = EnumSet.noneOf(TechnologyId.class);
        for (TechnologyId id : catalog.keySet()) {
            visit(id, catalog, EnumSet.noneOf(TechnologyId.class), done);
        }
    }

    private static void visit(TechnologyId id, Map<TechnologyId, Technology> catalog,
                              Set<TechnologyId> path, Set<TechnologyId> done) {
        if (done.contains(id)) return;
        if (!path.add(id)) {
            throw new IllegalStateException("Technology prerequisites form a cycle through " + id);
        }
        for (TechnologyId req : catalog.get(id).getPrerequisites()) {
            visit(req, catalog, path, done);
        }
        path.remove(id);
        done.add(id);
    }

    public UnlockState stateOf(TechnologyId id) {
        if (researched.contains(id)) return UnlockState.UNLOCKED;
        Technology t = catalog.get(id);
        if (!researched.containsAll(t.getPrerequisites())) return UnlockState.LOCKED;
        if (!ledger.affordable(t.getCost())) return UnlockState.LOCKED;
        return UnlockState.AVAILABLE;
    }

    public ActionResult research(TechnologyId id) {
        Technology t = catalog.get(id);
        if (t == null) {
            return ActionResult.invalidReference("Unknown technology " + id);
        }
        if (researched.contains(id)) {
            return ActionResult.alreadyUnlocked(t.getName() + " is already researched");
        }
        if (!researched.containsAll(t.getPrerequisites())) {
            return ActionResult.prerequisiteUnmet(t.getName() + " requires " + t.getPrerequisites());
        }
        if (!ledger.affordable(t.getCost())) {
            return ActionResult.unaffordable(t.getName() + " costs " + t.getCost());
        }
        ledger.debit(t.getCost().getResources());
        researched.add(id);
        t.getEffects().forEach(effects::apply);
        log.info("Researched {}", t.getName());
        return ActionResult.success("Researched " + t.getName());
    }

    /**
     * Turns a whole stock into research progress: stock x 0.02 x research bonus.
     */
    public ActionResult researchFromStock(ResourceType resource) {
        if (resource.isCurrency()) {
            return ActionResult.invalidReference("The currency cannot be studied");
        }
        double stock = ledger.get(resource);
        if (stock <= 0) {
            return ActionResult.invalidQuantity("No " + resource.getId() + " to study");
        }
        double gained = stock * RESEARCH_YIELD * modifiers.getResearchBonus();
        boolean wasComplete = ledger.isResearchComplete();
        ledger.addResearch(gained);
        ledger.set(resource, 0.0);
        if (!wasComplete && ledger.isResearchComplete()) {
            log.info("Research complete");
        }
        return ActionResult.success(String.format("Research progress %.1f%%", ledger.getResearch()));
    }

    public boolean isResearched(TechnologyId id) { return researched.contains(id); }

    public List<TechnologyId> getResearched() { return new ArrayList<>(researched); }

    public Technology get(TechnologyId id) { return catalog.get(id); }

    public Map<TechnologyId, Technology> getCatalog() { return catalog; }

    /** Marks technologies as researched without re-applying their effects. */
    public void restore(List<TechnologyId> ids) {
        researched.clear();
        researched.addAll(ids);
    }
}
