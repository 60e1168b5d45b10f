package com.hearthstead.engine;

import com.hearthstead.model.ActionResult;
import com.hearthstead.model.LoreSecret;
import com.hearthstead.model.UnlockState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Secrets of the ancestors. Research in a secret's cost is a threshold, never consumed.
 */
public class LoreArchive {

    private static final Logger log = LoggerFactory.getLogger(LoreArchive.class);

    private final Set<LoreSecret> discovered = new LinkedHashSet<>();
    private final ResourceLedger ledger;
    private final EffectApplier effects;

    public LoreArchive(ResourceLedger ledger, EffectApplier effects) {
        this.ledger = ledger;
        this.effects = effects;
    }

    public UnlockState stateOf(LoreSecret secret) {
        if (discovered.contains(secret)) return UnlockState.UNLOCKED;
        return ledger.affordable(secret.getCost()) ? UnlockState.AVAILABLE : UnlockState.LOCKED;
    }

    public ActionResult discover(LoreSecret secret) {
        if (discovered.contains(secret)) {
            return ActionResult.alreadyUnlocked(secret.getDisplayName() + " is already known");
        }
        if (!ledger.affordable(secret.getCost())) {
            return ActionResult.unaffordable(secret.getDisplayName() + " costs " + secret.getCost());
        }
        ledger.debit(secret.getCost().getResources());
        discovered.add(secret);
        effects.apply(secret.getEffect());
        log.info("Secret discovered: {} ({})", secret.getDisplayName(), secret.getDescription());
        return ActionResult.success("Discovered " + secret.getDisplayName());
    }

    public boolean isDiscovered(LoreSecret secret) { return discovered.contains(secret); }

    public int discoveredCount() { return discovered.size(); }

    public List<LoreSecret> getDiscovered() { return new ArrayList<>(discovered); }

    public void restore(List<LoreSecret> secrets) {
        discovered.clear();
        discovered.addAll(secrets);
    }
}
