package com.hearthstead.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable definition of a node in the technology tree.
 * The cost's research amount is a threshold, it is not consumed.
 */
public final class Technology {
    private final TechnologyId id;
    private final String name;
    private final String description;
    private final Cost cost;
    private final Set<TechnologyId> prerequisites;
    private final List<Effect> effects;

    public Technology(TechnologyId id, String name, String description, Cost cost,
                      Set<TechnologyId> prerequisites, List<Effect> effects) {
        this.id = id;
        this.name = name;
        this.description = description;
        this.cost = cost;
        this.prerequisites = prerequisites.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(prerequisites));
        this.effects = List.copyOf(effects);
    }

    public TechnologyId getId() { return id; }
    public String getName() { return name; }
    public String getDescription() { return description; }
    public Cost getCost() { return cost; }
    public Set<TechnologyId> getPrerequisites() { return prerequisites; }
    public List<Effect> getEffects() { return effects; }
}
