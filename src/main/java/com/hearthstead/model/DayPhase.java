package com.hearthstead.model;

/**
 * Position inside the current day. DAWN runs the automatic morning steps, ACTIONS accepts player input.
 */
public enum DayPhase {
    DAWN,
    ACTIONS
}
