package com.hearthstead.engine;

import com.hearthstead.model.EventWindow;

import java.util.List;
import java.util.Random;

/**
 * Scheduled event windows. Offsets are rolled once when the world is created and never change.
 * <p>
 * The primary window doubles hostility (and so mining/crafting scale) and lifts market prices.
 * Later windows are derived from the secondary offset and dampen output almost to nothing.
 */
public final class EventCalendar {

    public static final double PRIMARY_MARKET_MODIFIER = 1.25;

    private final int primaryStart;
    private final int secondaryStart;
    private final int duration;
    private final List<EventWindow> windows;

    public EventCalendar(int primaryStart, int secondaryStart, int duration) {
        this.primaryStart = primaryStart;
        this.secondaryStart = secondaryStart;
        this.duration = duration;
        this.windows = List.of(
                new EventWindow("primary", primaryStart, duration, 2.0),
                new EventWindow("long_night", secondaryStart, duration * 2, 0.1),
                new EventWindow("deep_winter", secondaryStart * 2, duration * 3, 0.01),
                new EventWindow("great_silence", secondaryStart * 5, duration * 5, 0.001));
    }

    public static EventCalendar generate(Random random) {
        int primary = 20 + random.nextInt(41);
        int secondary = 120 + random.nextInt(61);
        int duration = 20 + random.nextInt(41);
        return new EventCalendar(primary, secondary, duration);
    }

    public double hostilityModifier(int day) {
        for (EventWindow w : windows) {
            if (w.contains(day)) return w.getHostility();
        }
        return 1.0;
    }

    public boolean isPrimaryActive(int day) {
        return windows.get(0).contains(day);
    }

    public double marketEventModifier(int day) {
        return isPrimaryActive(day) ? PRIMARY_MARKET_MODIFIER : 1.0;
    }

    public EventWindow activeWindow(int day) {
        for (EventWindow w : windows) {
            if (w.contains(day)) return w;
        }
        return null;
    }

    public List<EventWindow> getWindows() { return windows; }
    public int getPrimaryStart() { return primaryStart; }
    public int getSecondaryStart() { return secondaryStart; }
    public int getDuration() { return duration; }
}
