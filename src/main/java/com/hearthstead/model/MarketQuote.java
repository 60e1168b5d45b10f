package com.hearthstead.model;

public class MarketQuote {
    public enum Pressure { OVERSUPPLY, STABLE, SHORTAGE }

    private final ResourceType resource;
    private final double price;
    private final double stock;
    private final Pressure pressure;

    public MarketQuote(ResourceType resource, double price, double stock, Pressure pressure) {
        this.resource = resource;
        this.price = price;
        this.stock = stock;
        this.pressure = pressure;
    }

    public String getResource() { return resource.getId(); }
    public double getPrice() { return price; }
    public double getStock() { return stock; }
    public Pressure getPressure() { return pressure; }
}
