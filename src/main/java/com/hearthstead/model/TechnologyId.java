package com.hearthstead.model;

import java.util.Arrays;
import java.util.Optional;

public enum TechnologyId {
    BASIC_AGRICULTURE("basic_agriculture"),
    ADVANCED_MINING("advanced_mining"),
    ECOLOGY("ecology"),
    INDUSTRIAL_REVOLUTION("industrial_revolution");

    private final String id;

    TechnologyId(String id) { this.id = id; }

    public String getId() { return id; }

    public static Optional<TechnologyId> fromId(String id) {
        if (id == null) return Optional.empty();
        String key = id.trim().toLowerCase();
        return Arrays.stream(values()).filter(t -> t.id.equals(key)).findFirst();
    }
}
