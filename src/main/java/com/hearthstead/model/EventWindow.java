package com.hearthstead.model;

/**
 * Inclusive day range [start, start + length] with the hostility multiplier active inside it.
 */
public final class EventWindow {
    private final String name;
    private final int start;
    private final int length;
    private final double hostility;

    public EventWindow(String name, int start, int length, double hostility) {
        this.name = name;
        this.start = start;
        this.length = length;
        this.hostility = hostility;
    }

    public boolean contains(int day) {
        return day >= start && day <= start + length;
    }

    public String getName() { return name; }
    public int getStart() { return start; }
    public int getLength() { return length; }
    public int getEnd() { return start + length; }
    public double getHostility() { return hostility; }
}
