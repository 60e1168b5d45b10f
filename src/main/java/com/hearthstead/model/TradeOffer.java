package com.hearthstead.model;

public class TradeOffer {
    private final ResourceType resource;
    private final double markup;

    public TradeOffer(ResourceType resource, double markup) {
        this.resource = resource;
        this.markup = markup;
    }

    public ResourceType getResource() { return resource; }
    public double getMarkup() { return markup; }
}
