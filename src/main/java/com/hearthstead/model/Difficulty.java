package com.hearthstead.model;

public enum Difficulty {
    EASY,
    NORMAL,
    HARD
}
