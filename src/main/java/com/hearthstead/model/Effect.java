package com.hearthstead.model;

public final class Effect {
    private final EffectKind kind;
    private final double value;
    private final ResourceType resource;

    private Effect(EffectKind kind, double value, ResourceType resource) {
        this.kind = kind;
        this.value = value;
        this.resource = resource;
    }

    public static Effect of(EffectKind kind, double value) {
        if (kind == EffectKind.RESOURCE_GRANT) {
            throw new IllegalArgumentException("RESOURCE_GRANT needs a resource");
        }
        return new Effect(kind, value, null);
    }

    public static Effect grant(ResourceType resource, double amount) {
        return new Effect(EffectKind.RESOURCE_GRANT, amount, resource);
    }

    public EffectKind getKind() { return kind; }
    public double getValue() { return value; }
    // Only set for RESOURCE_GRANT
    public ResourceType getResource() { return resource; }

    @Override
    public String toString() {
        if (kind == EffectKind.RESOURCE_GRANT) return "+" + value + " " + resource.getId();
        return kind.name().toLowerCase() + "(" + value + ")";
    }
}
