package com.hearthstead.model;

public enum Outcome {
    SUCCESS,
    UNAFFORDABLE,
    INVALID_REFERENCE,
    PREREQUISITE_UNMET,
    INVALID_QUANTITY,
    ALREADY_UNLOCKED
}
