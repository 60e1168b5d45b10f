package com.hearthstead.model;

/**
 * LOCKED -> AVAILABLE -> UNLOCKED. UNLOCKED is terminal.
 */
public enum UnlockState {
    LOCKED,
    AVAILABLE,
    UNLOCKED
}
