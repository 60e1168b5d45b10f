package com.hearthstead.engine;

import com.hearthstead.model.DayPhase;

/**
 * Current day and phase, shared by every component that needs "now".
 */
public class SettlementClock {
    private int day;
    private DayPhase phase = DayPhase.DAWN;

    public int getDay() { return day; }
    public void setDay(int day) { this.day = day; }
    public void nextDay() { day++; }

    public DayPhase getPhase() { return phase; }
    public void setPhase(DayPhase phase) { this.phase = phase; }
}
