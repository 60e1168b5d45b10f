package com.hearthstead.model;

import java.util.ArrayList;
import java.util.List;

/**
 * What happened during one simulated day. Filled in as the phases run.
 */
public class DayReport {
    public int day;
    public RandomEvent randomEvent;
    public List<Achievement> achievementsUnlocked = new ArrayList<>();
    public boolean foodShortage;
    public boolean starvationDeath;
    public boolean birth;
    public VictoryType victory;
    public boolean autosaveDue;

    public DayReport() {}

    public DayReport(int day) {
        this.day = day;
    }
}
