package com.hearthstead.engine;

import com.hearthstead.model.ActionResult;
import com.hearthstead.model.MarketQuote;
import com.hearthstead.model.ResourceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Prices derived from saturation, the event calendar and a slow trend, plus trade execution.
 * Every price query is recorded in a bounded history window used for smoothing.
 */
public class MarketModel {

    private static final Logger log = LoggerFactory.getLogger(MarketModel.class);

    public static final int HISTORY_WINDOW = 20;
    public static final double MIN_PRICE = 0.1;
    private static final double NOISE = 0.04;
    private static final double MIN_TREND = 0.8;
    private static final double MAX_TREND = 1.25;

    private final ResourceLedger ledger;
    private final EventCalendar calendar;
    private final SettlementClock clock;
    private final Random random;
    private final Map<ResourceType, Deque<Double>> history = new EnumMap<>(ResourceType.class);
    private double trend = 1.0;

    public MarketModel(ResourceLedger ledger, EventCalendar calendar, SettlementClock clock, Random random) {
        this.ledger = ledger;
        this.calendar = calendar;
        this.clock = clock;
        this.random = random;
    }

    double saturationModifier(ResourceType resource) {
        double capacity = resource.isCurrency()
                ? ledger.getStorageCapacity() * 10
                : ledger.getStorageCapacity();
        double saturation = ledger.get(resource) / Math.max(1.0, capacity);
        if (saturation > 0.9) return 0.6;
        if (saturation < 0.15) return 1.9;
        if (saturation < 0.3) return 1.3;
        return 1.0;
    }

    /**
     * Smoothed price: the mean of the instantaneous price and the history average.
     * Records the instantaneous price as a side effect.
     */
    public double currentPrice(ResourceType resource) {
        double modifier = saturationModifier(resource)
                * calendar.marketEventModifier(clock.getDay())
                * trend;
        double noise = 1.0 + (random.nextDouble() * 2.0 - 1.0) * NOISE;
        double price = Math.max(MIN_PRICE, resource.getBasePrice() * modifier * noise);

        Deque<Double> window = history.computeIfAbsent(resource, r -> new ArrayDeque<>());
        window.addLast(price);
        while (window.size() > HISTORY_WINDOW) {
            window.removeFirst();
        }
        double avg = window.stream().mapToDouble(Double::doubleValue).average().orElse(price);
        return (price + avg) / 2.0;
    }

    public MarketQuote quote(ResourceType resource) {
        double price = currentPrice(resource);
        double stock = ledger.get(resource);
        double saturation = stock / Math.max(1.0, ledger.getStorageCapacity());
        MarketQuote.Pressure pressure = MarketQuote.Pressure.STABLE;
        if (saturation > 0.8) pressure = MarketQuote.Pressure.OVERSUPPLY;
        else if (saturation < 0.2) pressure = MarketQuote.Pressure.SHORTAGE;
        return new MarketQuote(resource, price, stock, pressure);
    }

    public ActionResult trade(ResourceType resource, double amount, boolean buying) {
        if (!(amount > 0) || Double.isInfinite(amount)) {
            return ActionResult.invalidQuantity("Trade amount must be positive");
        }
        if (resource.isCurrency()) {
            return ActionResult.invalidReference("The currency cannot be traded for itself");
        }
        double price = currentPrice(resource);
        if (buying) {
            return purchase(resource, amount, price);
        }
        if (ledger.get(resource) < amount) {
            return ActionResult.unaffordable("Not enough " + resource.getId() + " to sell");
        }
        double total = price * amount;
        ledger.adjust(resource, -amount);
        ledger.adjust(ResourceType.CURRENCY, total);
        log.debug("Sold {} {} for {}", amount, resource.getId(), total);
        return ActionResult.success("Sold " + amount + " " + resource.getId());
    }

    /**
     * Buys at a fixed unit price. The currency debit is uncapped, the credit goes through the storage cap.
     */
    public ActionResult purchase(ResourceType resource, double amount, double unitPrice) {
        double total = unitPrice * amount;
        if (ledger.get(ResourceType.CURRENCY) < total) {
            return ActionResult.unaffordable("Not enough " + ResourceType.CURRENCY.getId());
        }
        ledger.adjust(ResourceType.CURRENCY, -total);
        ledger.adjust(resource, amount);
        log.debug("Bought {} {} for {}", amount, resource.getId(), total);
        return ActionResult.success("Bought " + amount + " " + resource.getId());
    }

    public void driftTrend(double maxDrift) {
        if (maxDrift <= 0) return;
        double factor = 1.0 + (random.nextDouble() * 2.0 - 1.0) * maxDrift;
        trend = Math.max(MIN_TREND, Math.min(MAX_TREND, trend * factor));
    }

    public double getTrend() { return trend; }
    public void setTrend(double trend) { this.trend = trend; }

    public List<Double> getHistory(ResourceType resource) {
        Deque<Double> window = history.get(resource);
        return window == null ? List.of() : new ArrayList<>(window);
    }

    public Map<ResourceType, List<Double>> getAllHistory() {
        Map<ResourceType, List<Double>> copy = new EnumMap<>(ResourceType.class);
        history.forEach((r, w) -> copy.put(r, new ArrayList<>(w)));
        return copy;
    }

    public void restoreHistory(ResourceType resource, List<Double> prices) {
        Deque<Double> window = new ArrayDeque<>(prices);
        while (window.size() > HISTORY_WINDOW) {
            window.removeFirst();
        }
        history.put(resource, window);
    }
}
