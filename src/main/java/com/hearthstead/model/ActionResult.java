package com.hearthstead.model;

/**
 * Outcome of a player action. Failures never leave partial mutations behind.
 */
public class ActionResult {
    private static final ActionResult OK = new ActionResult(Outcome.SUCCESS, "ok");

    private final Outcome outcome;
    private final String message;

    public ActionResult(Outcome outcome, String message) {
        this.outcome = outcome;
        this.message = message;
    }

    public static ActionResult success() { return OK; }
    public static ActionResult success(String message) { return new ActionResult(Outcome.SUCCESS, message); }

    public static ActionResult unaffordable(String message) { return new ActionResult(Outcome.UNAFFORDABLE, message); }
    public static ActionResult invalidReference(String message) { return new ActionResult(Outcome.INVALID_REFERENCE, message); }
    public static ActionResult prerequisiteUnmet(String message) { return new ActionResult(Outcome.PREREQUISITE_UNMET, message); }
    public static ActionResult invalidQuantity(String message) { return new ActionResult(Outcome.INVALID_QUANTITY, message); }
    public static ActionResult alreadyUnlocked(String message) { return new ActionResult(Outcome.ALREADY_UNLOCKED, message); }

    public Outcome getOutcome() { return outcome; }
    public String getMessage() { return message; }
    public boolean isSuccess() { return outcome == Outcome.SUCCESS; }

    @Override
    public String toString() {
        return outcome + ": " + message;
    }
}
