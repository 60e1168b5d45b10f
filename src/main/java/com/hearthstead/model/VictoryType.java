package com.hearthstead.model;

public enum VictoryType {
    TECHNOLOGICAL("Technological victory"),
    ECONOMIC("Economic victory"),
    ECOLOGICAL("Ecological victory"),
    CULTURAL("Cultural victory");

    private final String label;

    VictoryType(String label) { this.label = label; }

    public String getLabel() { return label; }
}
